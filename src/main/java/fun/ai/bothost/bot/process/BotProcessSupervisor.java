package fun.ai.bothost.bot.process;

import fun.ai.bothost.bot.BotCommandLine;
import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.BotRecordStore;
import fun.ai.bothost.bot.container.BotContainerService;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.common.BotAlreadyRunningException;
import fun.ai.bothost.common.BotErrorCode;
import fun.ai.bothost.common.BotHostException;
import fun.ai.bothost.common.BotNotRunningException;
import fun.ai.bothost.common.SpawnFailedException;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.enums.BotHealthStatus;
import fun.ai.bothost.enums.FunAiBotStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * bot 进程守护：start / stop / restart / forceStop、退出分类、崩溃自动重启（指数退避）、健康状态。
 * <p>
 * 不变式：record.status == RUNNING 当且仅当 {@link BotProcessRegistry} 持有该 bot 的存活句柄。
 * 注册句柄与置 RUNNING、释放句柄与置 STOPPED/ERROR 均在 synchronized(handle) 内成对完成。
 */
@Service
public class BotProcessSupervisor {
    private static final Logger log = LoggerFactory.getLogger(BotProcessSupervisor.class);

    private static final Duration READER_DRAIN_TIMEOUT = Duration.ofSeconds(2);

    private final BotHostProperties props;
    private final BotRecordStore recordStore;
    private final BotProcessRegistry processRegistry;
    private final BotLockRegistry lockRegistry;
    private final BotLogAggregator logAggregator;
    private final BotContainerService containerService;
    private final ExecutorService ioExecutor;
    private final ScheduledExecutorService restartScheduler;
    private final RestartBackoff backoff;

    private final ConcurrentHashMap<String, ScheduledFuture<?>> pendingRestarts = new ConcurrentHashMap<>();
    private volatile boolean shuttingDown;

    public BotProcessSupervisor(BotHostProperties props,
                                BotRecordStore recordStore,
                                BotProcessRegistry processRegistry,
                                BotLockRegistry lockRegistry,
                                BotLogAggregator logAggregator,
                                BotContainerService containerService,
                                @Qualifier("botProcessIoExecutor") ExecutorService ioExecutor,
                                @Qualifier("botRestartScheduler") ScheduledExecutorService restartScheduler) {
        this.props = props;
        this.recordStore = recordStore;
        this.processRegistry = processRegistry;
        this.lockRegistry = lockRegistry;
        this.logAggregator = logAggregator;
        this.containerService = containerService;
        this.ioExecutor = ioExecutor;
        this.restartScheduler = restartScheduler;
        this.backoff = new RestartBackoff(props.getRestartBackoffBase(), props.getRestartBackoffMax(),
                props.getStableRunThreshold());
    }

    public FunAiBot start(String botId) {
        return lockRegistry.withLock(botId, () -> {
            cancelPendingRestart(botId);
            return launch(botId, 0);
        });
    }

    /**
     * @param immediate true 直接 SIGKILL；false 先 SIGTERM，超时后升级为 SIGKILL
     */
    public FunAiBot stop(String botId, boolean immediate) {
        return lockRegistry.withLock(botId, () -> {
            cancelPendingRestart(botId);
            FunAiBot bot = recordStore.require(botId);
            BotProcessHandle handle = processRegistry.get(botId);
            if (handle == null) {
                throw new BotNotRunningException(bot.getName());
            }
            terminate(handle, immediate);
            cancelPendingRestart(botId);
            log.info("bot stopped: botId={}, name={}, immediate={}", botId, bot.getName(), immediate);
            return recordStore.require(botId);
        });
    }

    public FunAiBot forceStop(String botId) {
        return stop(botId, true);
    }

    /**
     * 运行中：强制停止 -> 固定间隔 -> 启动；未运行：直接启动
     */
    public FunAiBot restart(String botId) {
        return lockRegistry.withLock(botId, () -> {
            cancelPendingRestart(botId);
            recordStore.require(botId);
            BotProcessHandle handle = processRegistry.get(botId);
            if (handle != null) {
                logAggregator.appendRuntime(botId, "Restarting bot...");
                terminate(handle, true);
                cancelPendingRestart(botId);
                sleep(props.getRestartDelay());
            }
            return launch(botId, 0);
        });
    }

    /**
     * 删除前调用（调用方已持有 bot 锁）：取消排队的自动重启，运行中则强制停止
     */
    public void stopForDeletion(String botId) {
        lockRegistry.withLock(botId, () -> {
            cancelPendingRestart(botId);
            BotProcessHandle handle = processRegistry.get(botId);
            if (handle != null) {
                terminate(handle, true);
                cancelPendingRestart(botId);
            }
        });
    }

    public BotHealthStatus healthCheck(String botId) {
        recordStore.require(botId);
        BotProcessHandle handle = processRegistry.get(botId);
        if (handle == null) {
            return BotHealthStatus.UNKNOWN;
        }
        if (!handle.isAlive()) {
            return BotHealthStatus.UNHEALTHY;
        }
        promoteIfGraceElapsed(handle);
        return handle.getHealth();
    }

    public int portFor(String botId) {
        return props.getPortBase() + Math.floorMod(botId.hashCode(), Math.max(1, props.getPortRange()));
    }

    public boolean hasPendingRestart(String botId) {
        ScheduledFuture<?> f = pendingRestarts.get(botId);
        return f != null && !f.isDone();
    }

    /**
     * 自动重启开关关闭时调用
     */
    public void cancelPendingRestart(String botId) {
        ScheduledFuture<?> f = pendingRestarts.remove(botId);
        if (f != null && f.cancel(false)) {
            logAggregator.appendRuntime(botId, "Pending auto-restart cancelled");
            log.info("pending auto-restart cancelled: botId={}", botId);
        }
    }

    private FunAiBot launch(String botId, int restartCount) {
        FunAiBot bot = recordStore.require(botId);
        if (processRegistry.contains(botId)) {
            throw new BotAlreadyRunningException(bot.getName());
        }
        if (bot.getStatus() == FunAiBotStatus.DEPLOYING) {
            throw new IllegalArgumentException("bot 正在部署中: " + bot.getName());
        }
        int port = portFor(botId);
        LaunchPlan plan = plan(bot, port);

        ProcessBuilder pb = new ProcessBuilder(plan.argv);
        if (plan.workDir != null) {
            pb.directory(plan.workDir.toFile());
        }
        pb.environment().putAll(plan.env);
        Process p;
        try {
            p = pb.start();
        } catch (IOException e) {
            log.error("start bot failed: botId={}, name={}, cmd={}, error={}", botId, bot.getName(), plan.argv, e.getMessage(), e);
            logAggregator.appendRuntime(botId, "PROCESS ERROR: " + e.getMessage());
            recordStore.transition(botId, FunAiBotStatus.ERROR, b -> b.setProcessId(null));
            throw new SpawnFailedException(bot.getName(), e);
        }

        BotProcessHandle handle = new BotProcessHandle(botId, bot.getName(), p, restartCount, port, plan.container);
        synchronized (handle) {
            if (!processRegistry.register(handle)) {
                p.destroyForcibly();
                throw new BotAlreadyRunningException(bot.getName());
            }
            recordStore.transition(botId, FunAiBotStatus.RUNNING, b -> {
                b.setProcessId(p.pid());
                b.setRestartCount(restartCount);
            });
        }
        logAggregator.appendRuntime(botId, "Bot process started with PID: " + p.pid() + " (port " + port + ")");
        log.info("bot started: botId={}, name={}, pid={}, port={}, restartCount={}, cmd={}",
                botId, bot.getName(), p.pid(), port, restartCount, plan.argv);

        handle.addReader(CompletableFuture.runAsync(() -> pump(handle, p.getInputStream(), false), ioExecutor));
        handle.addReader(CompletableFuture.runAsync(() -> pump(handle, p.getErrorStream(), true), ioExecutor));
        p.onExit().thenRunAsync(() -> handleExit(handle), ioExecutor);
        return recordStore.require(botId);
    }

    private static final class LaunchPlan {
        final List<String> argv;
        final Path workDir;
        final Map<String, String> env;
        final boolean container;

        LaunchPlan(List<String> argv, Path workDir, Map<String, String> env, boolean container) {
            this.argv = argv;
            this.workDir = workDir;
            this.env = env;
            this.container = container;
        }
    }

    private LaunchPlan plan(FunAiBot bot, int port) {
        if (bot.getImageReference() != null && !bot.getImageReference().isBlank()) {
            Map<String, String> containerEnv = buildEnvironment(bot, port, null);
            List<String> override = List.of();
            if (bot.getRunCommand() != null && !bot.getRunCommand().isBlank()) {
                override = BotCommandLine.parse(bot.getRunCommand()).toArgv("sh", Map.of());
            }
            List<String> argv = containerService.runArguments(bot.getName(), bot.getImageReference(), port, containerEnv, override);
            return new LaunchPlan(argv, null, Map.of(), true);
        }
        if (bot.getWorkingDirectory() == null || bot.getWorkingDirectory().isBlank()) {
            throw new IllegalArgumentException("bot 尚未部署: " + bot.getName());
        }
        Path dir = Paths.get(bot.getWorkingDirectory());
        if (!Files.isDirectory(dir)) {
            throw new IllegalArgumentException("bot 工作目录不存在，请重新部署: " + dir);
        }
        if (bot.getRunCommand() == null || bot.getRunCommand().isBlank()) {
            throw new IllegalArgumentException("runCommand 未配置: " + bot.getName());
        }
        BotCommandLine commandLine = BotCommandLine.parse(bot.getRunCommand());
        Map<String, String> env = buildEnvironment(bot, port, dir);
        env.putAll(commandLine.getEnvironment());
        return new LaunchPlan(commandLine.toArgv(props.getShell(), props.getInterpreterAliases()), dir, env, false);
    }

    /**
     * 存储的环境变量 + 注入变量（注入的 PORT/HOST 等覆盖同名存储值）
     */
    Map<String, String> buildEnvironment(FunAiBot bot, int port, Path workDir) {
        Map<String, String> env = new LinkedHashMap<>();
        if (bot.getEnvironmentVariables() != null) {
            env.putAll(bot.getEnvironmentVariables());
        }
        env.put("PORT", String.valueOf(port));
        env.put("BOT_PORT", String.valueOf(port));
        env.put("HOST", "0.0.0.0");
        env.put("BOT_ID", bot.getId());
        env.put("BOT_NAME", bot.getName());
        env.putIfAbsent("NODE_ENV", "production");
        env.put("PYTHONUNBUFFERED", "1");
        env.put("PYTHONDONTWRITEBYTECODE", "1");
        env.put("PYTHONIOENCODING", "utf-8");
        if (workDir != null) {
            String dir = workDir.toAbsolutePath().toString();
            Path dataDir = workDir.resolve("data");
            try {
                Files.createDirectories(dataDir);
            } catch (IOException e) {
                log.warn("create data dir failed: bot={}, dir={}, error={}", bot.getName(), dataDir, e.getMessage());
            }
            env.put("BOT_WORKDIR", dir);
            env.put("DATA_DIR", dataDir.toAbsolutePath().toString());
            String existing = System.getenv("PYTHONPATH");
            env.put("PYTHONPATH", existing == null || existing.isBlank() ? dir : dir + File.pathSeparator + existing);
        }
        return env;
    }

    private void pump(BotProcessHandle handle, InputStream stream, boolean stderr) {
        try (BufferedReader r = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line;
            while ((line = r.readLine()) != null) {
                String text = line.stripTrailing();
                if (text.isBlank()) {
                    continue;
                }
                logAggregator.appendRuntime(handle.getBotId(), stderr ? "ERROR: " + text : text);
                updateHealth(handle, text, stderr);
            }
        } catch (IOException e) {
            log.debug("bot output closed: botId={}, stderr={}, error={}", handle.getBotId(), stderr, e.getMessage());
        }
    }

    private void updateHealth(BotProcessHandle handle, String text, boolean stderr) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (stderr && containsAny(lower, props.getHealthCriticalPatterns())) {
            if (handle.getHealth() != BotHealthStatus.UNHEALTHY) {
                handle.setHealth(BotHealthStatus.UNHEALTHY);
                log.warn("bot unhealthy: botId={}, line={}", handle.getBotId(), text);
            }
            return;
        }
        // 很多日志库默认输出到 stderr，成功特征两路都认
        if (handle.getHealth() == BotHealthStatus.UNKNOWN && containsAny(lower, props.getHealthSuccessPatterns())) {
            handle.setHealth(BotHealthStatus.HEALTHY);
        }
    }

    private static boolean containsAny(String lowerText, List<String> patterns) {
        if (patterns == null) return false;
        for (String p : patterns) {
            if (p != null && !p.isEmpty() && lowerText.contains(p.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    void promoteIfGraceElapsed(BotProcessHandle handle) {
        if (handle.getHealth() == BotHealthStatus.UNKNOWN && handle.isAlive()
                && handle.uptime().compareTo(props.getHealthGracePeriod()) >= 0) {
            handle.setHealth(BotHealthStatus.HEALTHY);
        }
    }

    /**
     * 巡检发现进程已死但退出回调未执行时补偿执行
     */
    void reconcile(BotProcessHandle handle) {
        if (!handle.isAlive() && !handle.isTerminated()) {
            log.warn("bot process died without exit callback, repairing: botId={}, pid={}", handle.getBotId(), handle.pid());
            ioExecutor.execute(() -> handleExit(handle));
        }
    }

    private void handleExit(BotProcessHandle handle) {
        if (!handle.claimExitHandling()) {
            return;
        }
        String botId = handle.getBotId();
        awaitReaders(handle);
        int code = handle.getProcess().exitValue();
        boolean requested = handle.isStopRequested();
        FunAiBotStatus outcome = (code == 0 || requested) ? FunAiBotStatus.STOPPED : FunAiBotStatus.ERROR;

        boolean released;
        synchronized (handle) {
            released = processRegistry.release(botId, handle);
            if (released) {
                recordStore.transitionIfPresent(botId, outcome, b -> b.setProcessId(null));
            }
        }
        logAggregator.appendRuntime(botId, "Bot process exited with code " + code + (requested ? " (stop requested)" : ""));

        // 自动重启须在唤醒 stop 调用方之前排队，stop 返回前才能把它取消
        if (outcome == FunAiBotStatus.ERROR) {
            log.warn("bot crashed: botId={}, name={}, exitCode={}, uptimeMs={}",
                    botId, handle.getBotName(), code, handle.uptime().toMillis());
            if (released) {
                maybeScheduleRestart(handle);
            }
        } else {
            log.info("bot exited: botId={}, name={}, exitCode={}, stopRequested={}", botId, handle.getBotName(), code, requested);
        }
        handle.completeTermination(outcome);
    }

    private void awaitReaders(BotProcessHandle handle) {
        CompletableFuture<?>[] readers = handle.getReaders().toArray(new CompletableFuture<?>[0]);
        try {
            CompletableFuture.allOf(readers).get(READER_DRAIN_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // 子进程继承了输出管道时读线程会一直阻塞，不再等待
            log.debug("bot output readers still open after exit: botId={}", handle.getBotId());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (ExecutionException e) {
            log.debug("bot output reader failed: botId={}, error={}", handle.getBotId(), e.getMessage());
        }
    }

    private void maybeScheduleRestart(BotProcessHandle crashed) {
        if (shuttingDown) {
            return;
        }
        // 崩溃与主动停止交错：退出码读完后才到达的 stop 同样不重启
        if (crashed.isStopRequested()) {
            log.info("auto-restart suppressed, stop requested: botId={}", crashed.getBotId());
            return;
        }
        Optional<FunAiBot> bot = recordStore.find(crashed.getBotId());
        if (bot.isEmpty() || !bot.get().isAutoRestartEnabled()) {
            return;
        }
        int attempt = backoff.attemptAfterCrash(crashed.getRestartCount(), crashed.uptime());
        scheduleRestart(crashed.getBotId(), attempt);
    }

    private void scheduleRestart(String botId, int attempt) {
        Duration delay = backoff.delayFor(attempt);
        logAggregator.appendRuntime(botId, "Auto-restart scheduled in " + delay.toMillis() + " ms (attempt " + (attempt + 1) + ")");
        log.info("auto-restart scheduled: botId={}, attempt={}, delayMs={}", botId, attempt + 1, delay.toMillis());
        // 调度线程只负责派发，真正的启动在 io 线程上执行（可能要等 bot 锁）
        ScheduledFuture<?> f = restartScheduler.schedule(
                () -> ioExecutor.execute(() -> runAutoRestart(botId, attempt + 1)),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        ScheduledFuture<?> prev = pendingRestarts.put(botId, f);
        if (prev != null) {
            prev.cancel(false);
        }
    }

    private void runAutoRestart(String botId, int restartCount) {
        lockRegistry.withLock(botId, () -> {
            pendingRestarts.computeIfPresent(botId, (k, f) -> f.isDone() ? null : f);
            Optional<FunAiBot> found = recordStore.find(botId);
            if (found.isEmpty() || shuttingDown) {
                return;
            }
            FunAiBot bot = found.get();
            if (bot.getStatus() != FunAiBotStatus.ERROR || processRegistry.contains(botId) || !bot.isAutoRestartEnabled()) {
                log.info("auto-restart skipped: botId={}, status={}", botId, bot.getStatus());
                return;
            }
            logAggregator.appendRuntime(botId, "Auto-restarting bot (attempt " + restartCount + ")");
            try {
                launch(botId, restartCount);
            } catch (SpawnFailedException e) {
                log.warn("auto-restart spawn failed: botId={}, error={}", botId, e.getMessage());
                scheduleRestart(botId, restartCount);
            } catch (RuntimeException e) {
                log.error("auto-restart aborted: botId={}, error={}", botId, e.getMessage(), e);
                logAggregator.appendRuntime(botId, "Auto-restart aborted: " + e.getMessage());
            }
        });
    }

    private void terminate(BotProcessHandle handle, boolean immediate) {
        String botId = handle.getBotId();
        handle.markStopRequested();
        if (!immediate) {
            logAggregator.appendRuntime(botId, "Stopping bot (SIGTERM)...");
            signal(handle, false);
            if (handle.awaitTermination(props.getStopTimeout())) {
                return;
            }
            logAggregator.appendRuntime(botId, "Bot did not exit within " + props.getStopTimeout().toSeconds() + "s, sending SIGKILL");
            log.warn("graceful stop timed out, escalating: botId={}, pid={}", botId, handle.pid());
        } else {
            logAggregator.appendRuntime(botId, "Force stopping bot (SIGKILL)...");
        }
        signal(handle, true);
        if (!handle.awaitTermination(props.getKillTimeout())) {
            log.error("bot process survived SIGKILL: botId={}, pid={}", botId, handle.pid());
            throw new BotHostException(BotErrorCode.STOP_TIMEOUT, "bot 进程在 SIGKILL 后仍未退出: " + handle.getBotName());
        }
    }

    private void signal(BotProcessHandle handle, boolean force) {
        Process p = handle.getProcess();
        // 先取快照：父进程退出后子进程会被托管给 init，无法再通过 descendants 找到
        List<ProcessHandle> descendants = p.descendants().toList();
        if (force) {
            descendants.forEach(ProcessHandle::destroyForcibly);
            p.destroyForcibly();
            if (handle.isContainer()) {
                containerService.removeContainer(handle.getBotName());
            }
        } else {
            descendants.forEach(ProcessHandle::destroy);
            p.destroy();
        }
    }

    private static void sleep(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) {
            return;
        }
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("restart interrupted", e);
        }
    }

    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        pendingRestarts.values().forEach(f -> f.cancel(false));
        pendingRestarts.clear();
        for (BotProcessHandle handle : processRegistry.snapshot()) {
            try {
                terminate(handle, false);
            } catch (BotHostException e) {
                log.error("stop bot on shutdown failed: botId={}, error={}", handle.getBotId(), e.getMessage());
            }
        }
    }
}
