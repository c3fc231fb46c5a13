package fun.ai.bothost.bot.log;

import fun.ai.bothost.enums.FunAiBotStatus;

import java.time.Instant;

public class BotStatusEvent {
    private final String botId;
    private final FunAiBotStatus from;
    private final FunAiBotStatus to;
    private final Instant timestamp;

    public BotStatusEvent(String botId, FunAiBotStatus from, FunAiBotStatus to, Instant timestamp) {
        this.botId = botId;
        this.from = from;
        this.to = to;
        this.timestamp = timestamp;
    }

    public String getBotId() {
        return botId;
    }

    public FunAiBotStatus getFrom() {
        return from;
    }

    public FunAiBotStatus getTo() {
        return to;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    @Override
    public String toString() {
        return botId + ": " + from + " -> " + to;
    }
}
