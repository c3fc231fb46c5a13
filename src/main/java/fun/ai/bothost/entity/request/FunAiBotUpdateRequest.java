package fun.ai.bothost.entity.request;

import lombok.Data;

import java.util.Map;

/**
 * 修改 bot 设置（不触发重新部署）；字段为 null 表示不修改。
 */
@Data
public class FunAiBotUpdateRequest {
    private String botId;
    private String runCommand;
    private String buildCommand;
    private String language;
    /**
     * 关闭时会取消已排队的自动重启
     */
    private Boolean autoRestart;
    /**
     * 合并进已存储的环境变量（同名覆盖）
     */
    private Map<String, String> environmentVariables;
}
