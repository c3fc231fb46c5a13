package fun.ai.bothost.controller.system;

import fun.ai.bothost.common.Result;
import fun.ai.bothost.entity.response.FunAiSystemStatsResponse;
import fun.ai.bothost.service.FunAiBotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/fun-ai/system")
@Tag(name = "Fun AI 系统", description = "服务运行信息")
public class FunAiSystemController {

    private final FunAiBotService botService;

    public FunAiSystemController(FunAiBotService botService) {
        this.botService = botService;
    }

    @GetMapping("/stats")
    @Operation(summary = "系统状态", description = "运行时长、JVM 内存、各状态 bot 数量（仅供展示）")
    public Result<FunAiSystemStatsResponse> stats() {
        return Result.success(botService.systemStats());
    }
}
