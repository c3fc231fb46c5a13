package fun.ai.bothost.enums;

import java.util.Locale;

/**
 * 语言提示（仅用于展示与推荐启动命令，不影响部署/运行逻辑）。
 */
public enum BotLanguage {
    PYTHON("python"),
    NODEJS("nodejs");

    private final String value;

    BotLanguage(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * 宽松解析：python/py -> PYTHON；nodejs/node/javascript/typescript -> NODEJS；其它返回 null。
     */
    public static BotLanguage fromValue(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "python", "py", "python3" -> PYTHON;
            case "nodejs", "node", "javascript", "js", "typescript", "ts" -> NODEJS;
            default -> null;
        };
    }
}
