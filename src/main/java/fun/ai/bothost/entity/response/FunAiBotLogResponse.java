package fun.ai.bothost.entity.response;

import lombok.Data;

import java.util.List;

@Data
public class FunAiBotLogResponse {
    private String botId;
    /**
     * 部署日志在前，运行日志在后；格式：[ISO 时间] 内容
     */
    private List<String> lines;
    private Integer total;
}
