package fun.ai.bothost.common;

public class BotNotRunningException extends BotHostException {
    public BotNotRunningException(String botName) {
        super(BotErrorCode.NOT_RUNNING, "bot 未运行: " + botName);
    }
}
