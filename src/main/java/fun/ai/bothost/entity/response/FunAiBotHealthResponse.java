package fun.ai.bothost.entity.response;

import fun.ai.bothost.enums.BotHealthStatus;
import fun.ai.bothost.enums.FunAiBotStatus;
import lombok.Data;

@Data
public class FunAiBotHealthResponse {
    private String botId;
    private String botName;
    private FunAiBotStatus status;
    private BotHealthStatus health;
    private Long processId;
    private Integer port;
    private Integer restartCount;
}
