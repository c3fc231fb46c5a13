package fun.ai.bothost.common;

/**
 * Bot 托管错误码（映射到 {@link Result#getCode()}）。
 */
public enum BotErrorCode {
    NOT_FOUND(404, "bot 或文件不存在"),
    INVALID_PATH(400, "非法路径"),
    TOO_LARGE(413, "文件过大"),
    ALREADY_RUNNING(409, "bot 已在运行"),
    NOT_RUNNING(409, "bot 未运行"),
    MISSING_BUILD_RECIPE(422, "缺少构建描述文件"),
    DEPLOYMENT_FAILED(500, "部署失败"),
    SPAWN_FAILED(500, "进程启动失败"),
    STOP_TIMEOUT(504, "进程停止超时");

    private final int code;
    private final String desc;

    BotErrorCode(int code, String desc) {
        this.code = code;
        this.desc = desc;
    }

    public int getCode() {
        return code;
    }

    public String getDesc() {
        return desc;
    }
}
