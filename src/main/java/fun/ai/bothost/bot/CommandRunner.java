package fun.ai.bothost.bot;

import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * 轻量命令执行器（git clone / 构建命令 / docker build 等有界外部工具）
 */
@Component
public class CommandRunner {
    private static final Logger log = LoggerFactory.getLogger(CommandRunner.class);

    private static final int MAX_CAPTURED_CHARS = 32_000;

    private final ExecutorService ioPool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "cmd-io");
        t.setDaemon(true);
        return t;
    });

    public CommandResult run(Duration timeout, List<String> command) {
        return run(timeout, command, null, Map.of(), null);
    }

    /**
     * 执行命令：stdout/stderr 合并，按行回调 lineSink（可为 null），同时截留输出用于错误上下文。
     *
     * @param workDir 工作目录（null 表示继承当前目录）
     * @param env     追加到继承环境之上的变量
     */
    public CommandResult run(Duration timeout, List<String> command, Path workDir, Map<String, String> env,
                             Consumer<String> lineSink) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("command 不能为空");
        }
        Process p;
        try {
            ProcessBuilder pb = new ProcessBuilder(command);
            pb.redirectErrorStream(true);
            if (workDir != null) {
                pb.directory(workDir.toFile());
            }
            if (env != null && !env.isEmpty()) {
                pb.environment().putAll(env);
            }
            p = pb.start();
            p.getOutputStream().close();
        } catch (Exception e) {
            log.error("run command failed: cmd={}, error={}", command, e.getMessage(), e);
            return new CommandResult(127, "run command failed: " + e.getMessage());
        }

        StringBuilder out = new StringBuilder();
        CompletableFuture<Void> reader = CompletableFuture.runAsync(() -> {
            try (BufferedReader r = new BufferedReader(new InputStreamReader(p.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = r.readLine()) != null) {
                    synchronized (out) {
                        // 只保留前 32k 字符，足够定位错误
                        if (out.length() < MAX_CAPTURED_CHARS) {
                            out.append(line).append('\n');
                        }
                    }
                    if (lineSink != null && !line.isBlank()) {
                        lineSink.accept(line);
                    }
                }
            } catch (Exception e) {
                log.debug("command output reader closed: cmd={}, error={}", command.get(0), e.getMessage());
            }
        }, ioPool);

        try {
            long ms = timeout == null ? 0 : timeout.toMillis();
            boolean finished;
            if (ms <= 0) {
                p.waitFor();
                finished = true;
            } else {
                finished = p.waitFor(ms, TimeUnit.MILLISECONDS);
            }
            if (!finished) {
                log.warn("command timeout: cmd={}, timeoutMs={}", command, ms);
                destroyTree(p);
                p.waitFor(500, TimeUnit.MILLISECONDS);
                awaitReader(reader, 200);
                return new CommandResult(CommandResult.TIMEOUT_EXIT_CODE, snapshot(out) + "\n[timeout]");
            }
            // 进程退出后给 reader 一个短窗口把剩余输出读完
            awaitReader(reader, 500);
            return new CommandResult(p.exitValue(), snapshot(out));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            destroyTree(p);
            return new CommandResult(130, snapshot(out) + "\n[interrupted]");
        }
    }

    private static void destroyTree(Process p) {
        p.descendants().forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
    }

    private static void awaitReader(CompletableFuture<Void> reader, long ms) throws InterruptedException {
        try {
            reader.get(ms, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | ExecutionException e) {
            log.debug("command output not fully drained: {}", e.toString());
        }
    }

    private static String snapshot(StringBuilder out) {
        synchronized (out) {
            return out.toString();
        }
    }

    @PreDestroy
    public void shutdown() {
        ioPool.shutdownNow();
    }
}
