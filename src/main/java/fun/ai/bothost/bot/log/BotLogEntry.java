package fun.ai.bothost.bot.log;

import fun.ai.bothost.enums.BotLogPhase;

import java.time.Instant;

/**
 * 一条日志：seq 在单个聚合器内全局单调递增，可用于补齐/去重。
 */
public class BotLogEntry {
    private final String botId;
    private final long seq;
    private final Instant timestamp;
    private final BotLogPhase phase;
    private final String text;

    public BotLogEntry(String botId, long seq, Instant timestamp, BotLogPhase phase, String text) {
        this.botId = botId;
        this.seq = seq;
        this.timestamp = timestamp;
        this.phase = phase;
        this.text = text;
    }

    public String getBotId() {
        return botId;
    }

    public long getSeq() {
        return seq;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public BotLogPhase getPhase() {
        return phase;
    }

    public String getText() {
        return text;
    }

    /**
     * [2024-01-01T00:00:00Z] text
     */
    public String format() {
        return "[" + timestamp + "] " + text;
    }

    @Override
    public String toString() {
        return format();
    }
}
