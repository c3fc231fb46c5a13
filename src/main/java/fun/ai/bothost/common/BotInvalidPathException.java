package fun.ai.bothost.common;

public class BotInvalidPathException extends BotHostException {
    public BotInvalidPathException(String message) {
        super(BotErrorCode.INVALID_PATH, message);
    }
}
