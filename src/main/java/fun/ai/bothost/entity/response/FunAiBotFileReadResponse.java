package fun.ai.bothost.entity.response;

import lombok.Data;

@Data
public class FunAiBotFileReadResponse {
    private String botId;
    private String path;
    private String content;
    /**
     * 编辑器语言（按扩展名推断，默认 plaintext）
     */
    private String language;
    private Long size;
    private Long lastModifiedMs;
}
