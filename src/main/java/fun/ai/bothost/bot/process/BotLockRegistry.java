package fun.ai.bothost.bot.process;

import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * 每个 bot 一把可重入锁：同一 bot 的 deploy / start / stop / restart / delete / 自动重启串行执行，
 * 不同 bot 之间互不阻塞。
 */
@Component
public class BotLockRegistry {
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLock(String botId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(botId, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void withLock(String botId, Runnable action) {
        withLock(botId, () -> {
            action.run();
            return null;
        });
    }

    public boolean isHeldByCurrentThread(String botId) {
        ReentrantLock lock = locks.get(botId);
        return lock != null && lock.isHeldByCurrentThread();
    }

    /**
     * bot 删除后回收锁（仍被持有或有人排队时保留）
     */
    public void discard(String botId) {
        locks.computeIfPresent(botId, (k, l) -> (l.isLocked() || l.hasQueuedThreads()) ? l : null);
    }
}
