package fun.ai.bothost.entity.response;

import lombok.Data;

import java.util.List;

@Data
public class FunAiBotFileTreeResponse {
    private String botId;
    private String botName;
    private String rootPath;
    private Integer maxDepth;
    private Integer maxEntries;
    /**
     * 是否因 maxEntries 截断
     */
    private Boolean truncated;
    private List<FunAiBotFileNode> nodes;
}
