package fun.ai.bothost.entity.request;

import lombok.Data;

@Data
public class FunAiBotFileWriteRequest {
    private String botId;
    /**
     * 相对 bot 根目录路径（使用 / 分隔），不能为空
     */
    private String path;
    /**
     * 文件内容（UTF-8 文本），覆盖写入，父目录自动创建
     */
    private String content;
}
