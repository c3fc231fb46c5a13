package fun.ai.bothost.controller.bot;

import fun.ai.bothost.common.Result;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotFileWriteRequest;
import fun.ai.bothost.entity.request.FunAiBotPathRequest;
import fun.ai.bothost.entity.request.FunAiBotRenameRequest;
import fun.ai.bothost.entity.response.FunAiBotFileReadResponse;
import fun.ai.bothost.entity.response.FunAiBotFileTreeResponse;
import fun.ai.bothost.service.FunAiBotService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.StreamingResponseBody;

/**
 * bot 文件域：文件树 / 读写 / 目录操作 / zip 导出（全部限制在 bot 工作目录内）
 */
@RestController
@RequestMapping("/api/fun-ai/bot/files")
@Tag(name = "Fun AI Bot 文件", description = "在线编辑器：文件树、读写、创建目录、删除、移动、打包下载")
public class FunAiBotFileController {
    private static final Logger log = LoggerFactory.getLogger(FunAiBotFileController.class);

    private final FunAiBotService botService;

    public FunAiBotFileController(FunAiBotService botService) {
        this.botService = botService;
    }

    @GetMapping("/tree")
    @Operation(summary = "获取文件树", description = "目录在前、文件在后，各自按名称排序；忽略 .git/node_modules/__pycache__/.venv")
    public Result<FunAiBotFileTreeResponse> tree(
            @Parameter(description = "botId", required = true) @RequestParam String botId,
            @Parameter(description = "最大递归深度（默认 12）") @RequestParam(required = false) Integer maxDepth,
            @Parameter(description = "最大节点数（默认 5000）") @RequestParam(required = false) Integer maxEntries
    ) {
        return Result.success(botService.listBotFiles(botId, maxDepth, maxEntries));
    }

    @GetMapping("/content")
    @Operation(summary = "读取文件内容", description = "UTF-8 文本，上限 1MB；越界路径返回 400（INVALID_PATH）")
    public Result<FunAiBotFileReadResponse> read(
            @Parameter(description = "botId", required = true) @RequestParam String botId,
            @Parameter(description = "相对路径", required = true) @RequestParam String path
    ) {
        return Result.success(botService.readBotFile(botId, path));
    }

    @PostMapping("/content")
    @Operation(summary = "写入文件内容", description = "覆盖写入（自动创建父目录），上限 1MB")
    public Result<FunAiBotFileReadResponse> write(@RequestBody FunAiBotFileWriteRequest req) {
        if (req == null) return Result.error("请求不能为空");
        return Result.success(botService.writeBotFile(req.getBotId(), req.getPath(), req.getContent()));
    }

    @PostMapping("/mkdir")
    @Operation(summary = "创建目录")
    public Result<String> mkdir(@RequestBody FunAiBotPathRequest req) {
        if (req == null) return Result.error("请求不能为空");
        botService.createDirectory(req.getBotId(), req.getPath());
        return Result.success("ok");
    }

    @PostMapping("/delete")
    @Operation(summary = "删除路径", description = "递归删除文件/目录；不允许删除根目录")
    public Result<String> delete(@RequestBody FunAiBotPathRequest req) {
        if (req == null) return Result.error("请求不能为空");
        botService.deletePath(req.getBotId(), req.getPath());
        return Result.success("ok");
    }

    @PostMapping("/move")
    @Operation(summary = "移动/重命名", description = "在 bot 工作目录内移动/重命名文件或目录")
    public Result<String> move(@RequestBody FunAiBotRenameRequest req) {
        if (req == null) return Result.error("请求不能为空");
        boolean overwrite = req.getOverwrite() != null && req.getOverwrite();
        botService.movePath(req.getBotId(), req.getFromPath(), req.getToPath(), overwrite);
        return Result.success("ok");
    }

    @GetMapping("/download-zip")
    @Operation(summary = "下载 bot 目录（zip）", description = "将 bot 工作目录打包为 zip 下载（排除 .git/node_modules 等）")
    public ResponseEntity<StreamingResponseBody> downloadZip(
            @Parameter(description = "botId", required = true) @RequestParam String botId
    ) {
        // 先校验 bot 存在，避免响应头已写出后才失败
        FunAiBot bot = botService.getBot(botId);
        String filename = bot.getName() + ".zip";

        StreamingResponseBody body = outputStream -> {
            botService.exportArchive(botId, outputStream);
            outputStream.flush();
        };

        ContentDisposition disposition = ContentDisposition.attachment()
                .filename(filename)
                .build();
        log.info("download bot zip: botId={}, name={}", botId, bot.getName());

        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .header(HttpHeaders.CONTENT_DISPOSITION, disposition.toString())
                .contentType(MediaType.parseMediaType("application/zip"))
                .body(body);
    }
}
