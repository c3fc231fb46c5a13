package fun.ai.bothost.common;

public class BotAlreadyRunningException extends BotHostException {
    public BotAlreadyRunningException(String botName) {
        super(BotErrorCode.ALREADY_RUNNING, "bot 已在运行: " + botName);
    }
}
