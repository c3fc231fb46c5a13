package fun.ai.bothost.controller.bot;

import fun.ai.bothost.common.Result;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.response.FunAiBotHealthResponse;
import fun.ai.bothost.service.FunAiBotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * bot 进程生命周期：start / stop / restart / force-stop / health
 */
@RestController
@RequestMapping("/api/fun-ai/bot/run")
@Tag(name = "Fun AI Bot 运行", description = "进程启动、停止、重启与健康检查")
public class FunAiBotRunController {
    private static final Logger log = LoggerFactory.getLogger(FunAiBotRunController.class);

    private final FunAiBotService botService;

    public FunAiBotRunController(FunAiBotService botService) {
        this.botService = botService;
    }

    @PostMapping("/start")
    @Operation(summary = "启动 bot", description = "已在运行时返回 409（ALREADY_RUNNING）")
    public Result<FunAiBot> start(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        log.info("start bot: botId={}", botId);
        return Result.success(botService.start(botId));
    }

    @PostMapping("/stop")
    @Operation(summary = "停止 bot", description = "默认 SIGTERM，超时后 SIGKILL；immediate=true 直接 SIGKILL。未运行返回 409（NOT_RUNNING）")
    public Result<FunAiBot> stop(
            @Parameter(description = "botId", required = true) @RequestParam String botId,
            @Parameter(description = "是否立即强制停止（默认 false）") @RequestParam(defaultValue = "false") boolean immediate
    ) {
        log.info("stop bot: botId={}, immediate={}", botId, immediate);
        return Result.success(botService.stop(botId, immediate));
    }

    @PostMapping("/restart")
    @Operation(summary = "重启 bot", description = "运行中则强制停止，等待固定间隔后重新启动")
    public Result<FunAiBot> restart(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        log.info("restart bot: botId={}", botId);
        return Result.success(botService.restart(botId));
    }

    @PostMapping("/force-stop")
    @Operation(summary = "强制停止 bot", description = "SIGKILL 整个进程树")
    public Result<FunAiBot> forceStop(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        log.info("force stop bot: botId={}", botId);
        return Result.success(botService.forceStop(botId));
    }

    @GetMapping("/health")
    @Operation(summary = "健康检查", description = "HEALTHY / UNHEALTHY / UNKNOWN")
    public Result<FunAiBotHealthResponse> health(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        return Result.success(botService.healthCheck(botId));
    }
}
