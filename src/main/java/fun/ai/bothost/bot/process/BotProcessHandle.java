package fun.ai.bothost.bot.process;

import fun.ai.bothost.enums.BotHealthStatus;
import fun.ai.bothost.enums.FunAiBotStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 一个运行中 bot 进程的句柄（仅存在于内存，进程退出即作废）。
 */
public class BotProcessHandle {
    private final String botId;
    private final String botName;
    private final Process process;
    private final Instant startedAt;
    private final int restartCount;
    private final int port;
    private final boolean container;
    private volatile BotHealthStatus health = BotHealthStatus.UNKNOWN;
    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean exitHandled = new AtomicBoolean(false);
    private final CompletableFuture<FunAiBotStatus> terminated = new CompletableFuture<>();
    private final List<CompletableFuture<Void>> readers = new CopyOnWriteArrayList<>();

    public BotProcessHandle(String botId, String botName, Process process, int restartCount, int port, boolean container) {
        this.botId = botId;
        this.botName = botName;
        this.process = process;
        this.startedAt = Instant.now();
        this.restartCount = restartCount;
        this.port = port;
        this.container = container;
    }

    public String getBotId() {
        return botId;
    }

    public String getBotName() {
        return botName;
    }

    public Process getProcess() {
        return process;
    }

    public long pid() {
        return process.pid();
    }

    public boolean isAlive() {
        return process.isAlive();
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Duration uptime() {
        return Duration.between(startedAt, Instant.now());
    }

    /**
     * 连续自动重启次数（显式 start 为 0）
     */
    public int getRestartCount() {
        return restartCount;
    }

    public int getPort() {
        return port;
    }

    public boolean isContainer() {
        return container;
    }

    public BotHealthStatus getHealth() {
        return health;
    }

    public void setHealth(BotHealthStatus health) {
        this.health = health;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    public void markStopRequested() {
        stopRequested.set(true);
    }

    /**
     * 退出处理只执行一次（onExit 回调与健康巡检修复可能同时触发）
     */
    boolean claimExitHandling() {
        return exitHandled.compareAndSet(false, true);
    }

    void addReader(CompletableFuture<Void> reader) {
        readers.add(reader);
    }

    List<CompletableFuture<Void>> getReaders() {
        return readers;
    }

    void completeTermination(FunAiBotStatus outcome) {
        terminated.complete(outcome);
    }

    public boolean isTerminated() {
        return terminated.isDone();
    }

    /**
     * 等待退出处理完成（句柄已释放、状态已落定）。
     *
     * @return 超时返回 false
     */
    public boolean awaitTermination(Duration timeout) {
        try {
            terminated.get(Math.max(1, timeout.toMillis()), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException e) {
            return true;
        }
    }
}
