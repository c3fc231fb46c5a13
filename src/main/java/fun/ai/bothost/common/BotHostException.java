package fun.ai.bothost.common;

/**
 * Bot 托管业务异常基类：携带 {@link BotErrorCode}，由 {@link GlobalExceptionHandler} 统一转换为 {@link Result}。
 */
public class BotHostException extends RuntimeException {
    private final BotErrorCode errorCode;

    public BotHostException(BotErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public BotHostException(BotErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public BotErrorCode getErrorCode() {
        return errorCode;
    }
}
