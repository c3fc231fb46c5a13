package fun.ai.bothost.entity.request;

import lombok.Data;

@Data
public class FunAiBotRenameRequest {
    private String botId;
    private String fromPath;
    private String toPath;
    /**
     * 是否允许覆盖（默认 false）
     */
    private Boolean overwrite;
}
