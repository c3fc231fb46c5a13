package fun.ai.bothost.bot.log;

import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.enums.FunAiBotStatus;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * 状态变更广播：与日志同样的“每订阅者独立队列”语义，按迁移顺序投递。
 */
@Component
public class BotStatusBroadcaster {
    private final BotEventChannel<BotStatusEvent> channel;

    public BotStatusBroadcaster(BotHostProperties props, @Qualifier("botEventExecutor") Executor botEventExecutor) {
        this.channel = new BotEventChannel<>("bot-status", botEventExecutor, props.getSubscriberQueueCapacity());
    }

    public void publish(String botId, FunAiBotStatus from, FunAiBotStatus to) {
        channel.publish(botId, new BotStatusEvent(botId, from, to, Instant.now()));
    }

    public BotEventChannel.Subscription subscribe(String botId, Consumer<BotStatusEvent> sink) {
        return channel.subscribe(botId, sink);
    }

    public void remove(String botId) {
        channel.closeAll(botId);
    }
}
