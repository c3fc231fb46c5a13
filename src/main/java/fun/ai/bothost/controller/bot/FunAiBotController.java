package fun.ai.bothost.controller.bot;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.common.Result;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.entity.request.FunAiBotUpdateRequest;
import fun.ai.bothost.service.FunAiBotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * bot 部署与记录管理
 */
@RestController
@RequestMapping("/api/fun-ai/bot")
@Tag(name = "Fun AI Bot 部署", description = "压缩包 / Git 仓库 / 容器三种部署方式，bot 查询、修改与删除")
public class FunAiBotController {

    private final FunAiBotService botService;
    private final ObjectMapper objectMapper;

    public FunAiBotController(FunAiBotService botService, ObjectMapper objectMapper) {
        this.botService = botService;
        this.objectMapper = objectMapper;
    }

    @PostMapping(path = "/deploy/archive", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @Operation(summary = "上传 zip 部署", description = "解压到 {storageRoot}/{name}，同名 bot 视为重新部署；部署成功后状态为 STOPPED，需要显式 start")
    public Result<FunAiBot> deployArchive(
            @Parameter(description = "bot 名称（字母/数字/_/-）", required = true) @RequestParam String name,
            @Parameter(description = "zip 文件", required = true) @RequestParam("file") MultipartFile file,
            @Parameter(description = "额外 env 文件（可选）") @RequestParam(value = "envFile", required = false) MultipartFile envFile,
            @Parameter(description = "语言提示 python/nodejs") @RequestParam(required = false) String language,
            @Parameter(description = "启动命令（为空使用推荐命令）") @RequestParam(required = false) String runCommand,
            @Parameter(description = "构建命令") @RequestParam(required = false) String buildCommand,
            @Parameter(description = "异常退出自动重启（默认 true）") @RequestParam(required = false) Boolean autoRestart,
            @Parameter(description = "覆盖环境变量（JSON 对象）") @RequestParam(required = false) String environmentVariables
    ) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("zip 文件不能为空");
        }
        FunAiBotDeployRequest req = new FunAiBotDeployRequest();
        req.setName(name);
        req.setLanguage(language);
        req.setRunCommand(runCommand);
        req.setBuildCommand(buildCommand);
        req.setAutoRestart(autoRestart);
        req.setEnvironmentVariables(parseEnvJson(environmentVariables));
        byte[] envBytes = envFile == null || envFile.isEmpty() ? null : envFile.getBytes();
        return Result.success(botService.deployArchive(req, file.getBytes(), envBytes));
    }

    @PostMapping("/deploy/repository")
    @Operation(summary = "Git 仓库部署", description = "clone 到 {storageRoot}/{name}（整体替换），读取 .env / config.env / .env.example")
    public Result<FunAiBot> deployRepository(@Valid @RequestBody FunAiBotDeployRequest req) {
        return Result.success(botService.deployRepository(req));
    }

    @PostMapping("/deploy/container")
    @Operation(summary = "容器部署", description = "clone 仓库，要求根目录存在 Dockerfile，构建镜像并记录镜像 tag")
    public Result<FunAiBot> deployContainer(@Valid @RequestBody FunAiBotDeployRequest req) {
        return Result.success(botService.deployContainer(req));
    }

    @GetMapping("/list")
    @Operation(summary = "bot 列表", description = "按创建时间排序")
    public Result<List<FunAiBot>> list() {
        return Result.success(botService.listBots());
    }

    @GetMapping("/info")
    @Operation(summary = "bot 详情")
    public Result<FunAiBot> info(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        return Result.success(botService.getBot(botId));
    }

    @PostMapping("/update")
    @Operation(summary = "修改 bot 设置", description = "修改启动命令、构建命令、自动重启与环境变量；下次 start 生效")
    public Result<FunAiBot> update(@RequestBody FunAiBotUpdateRequest req) {
        return Result.success(botService.updateBot(req));
    }

    @PostMapping("/delete")
    @Operation(summary = "删除 bot", description = "运行中会先强制停止，然后删除工作目录、日志与记录")
    public Result<String> delete(@Parameter(description = "botId", required = true) @RequestParam String botId) {
        botService.delete(botId);
        return Result.success("ok");
    }

    private Map<String, String> parseEnvJson(String json) {
        if (json == null || json.isBlank()) {
            return new LinkedHashMap<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<LinkedHashMap<String, String>>() {
            });
        } catch (IOException e) {
            throw new IllegalArgumentException("environmentVariables 不是合法的 JSON 对象: " + e.getMessage(), e);
        }
    }
}
