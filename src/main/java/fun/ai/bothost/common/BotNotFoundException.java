package fun.ai.bothost.common;

public class BotNotFoundException extends BotHostException {
    public BotNotFoundException(String message) {
        super(BotErrorCode.NOT_FOUND, message);
    }

    public static BotNotFoundException bot(String botId) {
        return new BotNotFoundException("bot 不存在: " + botId);
    }
}
