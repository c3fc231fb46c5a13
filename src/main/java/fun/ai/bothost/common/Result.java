package fun.ai.bothost.common;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Data;

/**
 * 统一响应包装：code / message / data。
 * <p>
 * 业务错误同样返回 HTTP 200，由 code 区分（见 {@link BotErrorCode}）。
 */
@Data
public class Result<T> {
    public static final int SUCCESS_CODE = 200;
    public static final int DEFAULT_ERROR_CODE = 500;

    private Integer code;      // 状态码
    private String message;    // 提示信息
    private T data;            // 数据

    private Result(Integer code, String message, T data) {
        this.code = code;
        this.message = message;
        this.data = data;
    }

    public static <T> Result<T> success() {
        return new Result<>(SUCCESS_CODE, "操作成功", null);
    }

    public static <T> Result<T> success(T data) {
        return new Result<>(SUCCESS_CODE, "操作成功", data);
    }

    public static <T> Result<T> success(String message, T data) {
        return new Result<>(SUCCESS_CODE, message, data);
    }

    public static <T> Result<T> error(String message) {
        return new Result<>(DEFAULT_ERROR_CODE, message, null);
    }

    public static <T> Result<T> error(Integer code, String message) {
        return new Result<>(code, message, null);
    }

    public static <T> Result<T> error(BotErrorCode errorCode, String message, T data) {
        return new Result<>(errorCode.getCode(), message, data);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return code != null && code == SUCCESS_CODE;
    }
}
