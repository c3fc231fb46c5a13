package fun.ai.bothost.entity.request;

import lombok.Data;

@Data
public class FunAiBotPathRequest {
    private String botId;
    /**
     * 相对 bot 根目录路径（使用 / 分隔），不能为空
     */
    private String path;
}
