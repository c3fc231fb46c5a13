package fun.ai.bothost.entity.response;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
public class FunAiSystemStatsResponse {
    @Schema(description = "服务运行时长（秒）")
    private Long uptimeSeconds;

    @Schema(description = "运行时长（可读）", example = "2h 13m 5s")
    private String uptime;

    private Long heapUsedMb;
    private Long heapTotalMb;
    private Long heapMaxMb;
    private Integer availableProcessors;

    private Integer totalBots;
    private Integer runningBots;
    private Integer stoppedBots;
    private Integer deployingBots;
    private Integer errorBots;

    private Long timestamp;
}
