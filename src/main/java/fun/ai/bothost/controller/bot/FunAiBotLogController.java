package fun.ai.bothost.controller.bot;

import fun.ai.bothost.common.Result;
import fun.ai.bothost.entity.response.FunAiBotLogResponse;
import fun.ai.bothost.service.FunAiBotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fun-ai/bot/logs")
@Tag(name = "Fun AI Bot 日志", description = "日志拉取（非实时）；实时日志走 WebSocket /api/fun-ai/bot/ws/logs")
public class FunAiBotLogController {

    private final FunAiBotService botService;

    public FunAiBotLogController(FunAiBotService botService) {
        this.botService = botService;
    }

    @GetMapping
    @Operation(summary = "获取 bot 日志", description = "部署日志在前、运行日志在后，各自按产生顺序；运行日志保留最近 1000 行")
    public Result<FunAiBotLogResponse> logs(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        return Result.success(botService.getLogs(botId));
    }
}
