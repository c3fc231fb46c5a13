package fun.ai.bothost.service;

import fun.ai.bothost.bot.log.BotEventChannel;
import fun.ai.bothost.bot.log.BotLogEntry;
import fun.ai.bothost.bot.log.BotStatusEvent;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.entity.request.FunAiBotUpdateRequest;
import fun.ai.bothost.entity.response.FunAiBotFileReadResponse;
import fun.ai.bothost.entity.response.FunAiBotFileTreeResponse;
import fun.ai.bothost.entity.response.FunAiBotHealthResponse;
import fun.ai.bothost.entity.response.FunAiBotLogResponse;
import fun.ai.bothost.entity.response.FunAiSystemStatsResponse;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;
import java.util.function.Consumer;

public interface FunAiBotService {

    /**
     * 上传 zip 部署：同名 bot 已存在则重新部署（沿用 id），否则新建记录。
     * 覆盖变量优先级：请求体 environmentVariables > envFile > 压缩包内 env 文件。
     *
     * @param envFile 可选的额外 env 文件内容（与压缩包内 .env 使用同一解析器）
     */
    FunAiBot deployArchive(FunAiBotDeployRequest request, byte[] archive, byte[] envFile);

    /**
     * 克隆 Git 仓库部署（目录整体替换）
     */
    FunAiBot deployRepository(FunAiBotDeployRequest request);

    /**
     * 克隆仓库 + 根目录 Dockerfile 构建镜像；运行时以容器方式启动
     */
    FunAiBot deployContainer(FunAiBotDeployRequest request);

    FunAiBot start(String botId);

    /**
     * @param immediate true：直接 SIGKILL；false：SIGTERM，超时后 SIGKILL
     */
    FunAiBot stop(String botId, boolean immediate);

    FunAiBot restart(String botId);

    FunAiBot forceStop(String botId);

    /**
     * 删除：运行中先强制停止，取消排队的自动重启，清理目录、日志与订阅。
     */
    void delete(String botId);

    FunAiBot getBot(String botId);

    List<FunAiBot> listBots();

    FunAiBot updateBot(FunAiBotUpdateRequest request);

    FunAiBotLogResponse getLogs(String botId);

    /**
     * 实时日志订阅；不回放历史，调用方自行用 getLogs / 聚合器补齐。
     */
    BotEventChannel.Subscription subscribeLogs(String botId, Consumer<BotLogEntry> sink);

    BotEventChannel.Subscription subscribeStatus(String botId, Consumer<BotStatusEvent> sink);

    /**
     * 在线编辑器：目录树（忽略 .git/node_modules/__pycache__/.venv）
     */
    FunAiBotFileTreeResponse listBotFiles(String botId, Integer maxDepth, Integer maxEntries);

    FunAiBotFileReadResponse readBotFile(String botId, String path);

    FunAiBotFileReadResponse writeBotFile(String botId, String path, String content);

    void createDirectory(String botId, String path);

    void deletePath(String botId, String path);

    void movePath(String botId, String fromPath, String toPath, boolean overwrite);

    /**
     * 将 bot 工作目录打包为 zip 写入 out（不关闭 out）
     */
    void exportArchive(String botId, OutputStream out) throws IOException;

    FunAiBotHealthResponse healthCheck(String botId);

    FunAiSystemStatsResponse systemStats();
}
