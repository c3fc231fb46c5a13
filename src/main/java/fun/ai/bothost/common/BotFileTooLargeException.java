package fun.ai.bothost.common;

public class BotFileTooLargeException extends BotHostException {
    private final long limitBytes;

    public BotFileTooLargeException(String message, long limitBytes) {
        super(BotErrorCode.TOO_LARGE, message + " (limit=" + limitBytes + " bytes)");
        this.limitBytes = limitBytes;
    }

    public long getLimitBytes() {
        return limitBytes;
    }
}
