package fun.ai.bothost.bot.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 按 botId 分组的类型化广播通道。
 * <p>
 * publish 只负责入队（不阻塞发布方）；每个订阅者持有独立的有界队列，由 executor 上的串行任务投递，
 * 因此同一订阅者收到的事件顺序与 publish 顺序一致，慢订阅者不影响其它订阅者。
 * 队列满时丢弃最旧事件。订阅不回放历史，需要历史的调用方自行先拉取快照。
 */
public class BotEventChannel<T> {
    private static final Logger log = LoggerFactory.getLogger(BotEventChannel.class);

    private final String name;
    private final Executor deliveryExecutor;
    private final int queueCapacity;
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Subscriber>> subscribers = new ConcurrentHashMap<>();

    public BotEventChannel(String name, Executor deliveryExecutor, int queueCapacity) {
        if (deliveryExecutor == null) {
            throw new IllegalArgumentException("deliveryExecutor 不能为空");
        }
        this.name = name;
        this.deliveryExecutor = deliveryExecutor;
        this.queueCapacity = Math.max(1, queueCapacity);
    }

    /**
     * 订阅句柄
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    public Subscription subscribe(String botId, Consumer<T> sink) {
        if (botId == null || sink == null) {
            throw new IllegalArgumentException("botId/sink 不能为空");
        }
        Subscriber s = new Subscriber(botId, sink);
        subscribers.computeIfAbsent(botId, k -> new CopyOnWriteArrayList<>()).add(s);
        log.debug("{} subscribed: botId={}", name, botId);
        return () -> {
            s.close();
            CopyOnWriteArrayList<Subscriber> subs = subscribers.get(botId);
            if (subs != null) {
                subs.remove(s);
            }
        };
    }

    public void publish(String botId, T event) {
        List<Subscriber> subs = subscribers.get(botId);
        if (subs == null || subs.isEmpty()) {
            return;
        }
        for (Subscriber s : subs) {
            s.offer(event);
        }
    }

    /**
     * 关闭 bot 的全部订阅（bot 删除时调用）；未投递的事件直接丢弃
     */
    public void closeAll(String botId) {
        CopyOnWriteArrayList<Subscriber> subs = subscribers.remove(botId);
        if (subs != null) {
            subs.forEach(Subscriber::close);
            log.debug("{} subscriptions closed: botId={}, count={}", name, botId, subs.size());
        }
    }

    public int subscriberCount(String botId) {
        List<Subscriber> subs = subscribers.get(botId);
        return subs == null ? 0 : subs.size();
    }

    private final class Subscriber implements Runnable {
        private final String botId;
        private final Consumer<T> sink;
        private final ConcurrentLinkedQueue<T> queue = new ConcurrentLinkedQueue<>();
        private final AtomicInteger size = new AtomicInteger();
        private final AtomicBoolean draining = new AtomicBoolean(false);
        private final AtomicLong dropped = new AtomicLong();
        private volatile boolean closed;

        Subscriber(String botId, Consumer<T> sink) {
            this.botId = botId;
            this.sink = sink;
        }

        void offer(T event) {
            if (closed) {
                return;
            }
            queue.add(event);
            if (size.incrementAndGet() > queueCapacity && queue.poll() != null) {
                size.decrementAndGet();
                long n = dropped.incrementAndGet();
                if (n == 1 || n % 1000 == 0) {
                    log.warn("{} subscriber queue full, dropping oldest: botId={}, dropped={}", name, botId, n);
                }
            }
            scheduleDrain();
        }

        void close() {
            closed = true;
            queue.clear();
            size.set(0);
        }

        private void scheduleDrain() {
            if (draining.compareAndSet(false, true)) {
                try {
                    deliveryExecutor.execute(this);
                } catch (RejectedExecutionException e) {
                    draining.set(false);
                    log.warn("{} delivery rejected: botId={}, error={}", name, botId, e.getMessage());
                }
            }
        }

        @Override
        public void run() {
            while (true) {
                T event;
                while (!closed && (event = queue.poll()) != null) {
                    size.decrementAndGet();
                    try {
                        sink.accept(event);
                    } catch (Exception e) {
                        log.warn("{} subscriber threw: botId={}, error={}", name, botId, e.getMessage(), e);
                    }
                }
                draining.set(false);
                // 释放标记后再检查一次，避免与并发 offer 之间丢失唤醒
                if (closed || queue.isEmpty() || !draining.compareAndSet(false, true)) {
                    return;
                }
            }
        }
    }
}
