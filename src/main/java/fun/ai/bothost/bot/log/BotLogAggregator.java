package fun.ai.bothost.bot.log;

import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.enums.BotLogPhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * 每个 bot 的日志缓冲 + 实时推送。
 * <p>
 * 部署日志：仅保留当前这一次部署（beginDeployment 时清空）；运行日志：环形缓冲，满了丢最旧。
 * getAll 返回“部署日志 + 运行日志”，各自按写入顺序。
 */
@Component
public class BotLogAggregator {
    private static final Logger log = LoggerFactory.getLogger(BotLogAggregator.class);

    private final int runtimeCapacity;
    private final int deploymentCapacity;
    private final BotEventChannel<BotLogEntry> channel;
    private final ConcurrentHashMap<String, Buffer> buffers = new ConcurrentHashMap<>();
    private final AtomicLong seq = new AtomicLong();

    public BotLogAggregator(BotHostProperties props, @Qualifier("botEventExecutor") Executor botEventExecutor) {
        this.runtimeCapacity = Math.max(1, props.getLogCapacity());
        this.deploymentCapacity = Math.max(1, props.getDeploymentLogCapacity());
        this.channel = new BotEventChannel<>("bot-log", botEventExecutor, props.getSubscriberQueueCapacity());
    }

    private static final class Buffer {
        final ArrayDeque<BotLogEntry> deployment = new ArrayDeque<>();
        final ArrayDeque<BotLogEntry> runtime = new ArrayDeque<>();
    }

    public BotLogEntry append(String botId, BotLogPhase phase, String text) {
        if (botId == null) {
            throw new IllegalArgumentException("botId 不能为空");
        }
        Buffer buf = buffers.computeIfAbsent(botId, k -> new Buffer());
        // 写入缓冲与入队在同一把锁内：订阅者看到的顺序 == 缓冲顺序
        synchronized (buf) {
            BotLogEntry entry = new BotLogEntry(botId, seq.incrementAndGet(), Instant.now(), phase,
                    text == null ? "" : text);
            ArrayDeque<BotLogEntry> target = phase == BotLogPhase.DEPLOYMENT ? buf.deployment : buf.runtime;
            int cap = phase == BotLogPhase.DEPLOYMENT ? deploymentCapacity : runtimeCapacity;
            target.addLast(entry);
            while (target.size() > cap) {
                target.pollFirst();
            }
            channel.publish(botId, entry);
            return entry;
        }
    }

    public BotLogEntry appendDeployment(String botId, String text) {
        return append(botId, BotLogPhase.DEPLOYMENT, text);
    }

    public BotLogEntry appendRuntime(String botId, String text) {
        return append(botId, BotLogPhase.RUNTIME, text);
    }

    /**
     * 新一次部署开始：丢弃上一次部署日志（运行日志保留）
     */
    public void beginDeployment(String botId) {
        Buffer buf = buffers.computeIfAbsent(botId, k -> new Buffer());
        synchronized (buf) {
            buf.deployment.clear();
        }
    }

    public List<BotLogEntry> getAll(String botId) {
        Buffer buf = buffers.get(botId);
        if (buf == null) {
            return List.of();
        }
        synchronized (buf) {
            List<BotLogEntry> out = new ArrayList<>(buf.deployment.size() + buf.runtime.size());
            out.addAll(buf.deployment);
            out.addAll(buf.runtime);
            return out;
        }
    }

    public List<String> getAllLines(String botId) {
        return getAll(botId).stream().map(BotLogEntry::format).toList();
    }

    public BotEventChannel.Subscription subscribe(String botId, Consumer<BotLogEntry> sink) {
        return channel.subscribe(botId, sink);
    }

    public int subscriberCount(String botId) {
        return channel.subscriberCount(botId);
    }

    /**
     * 删除 bot：清空缓冲并关闭全部订阅
     */
    public void remove(String botId) {
        buffers.remove(botId);
        channel.closeAll(botId);
        log.debug("bot logs removed: botId={}", botId);
    }
}
