package fun.ai.bothost.service.impl;

import fun.ai.bothost.bot.BotFileManager;
import fun.ai.bothost.bot.BotRecordStore;
import fun.ai.bothost.bot.EnvFileParser;
import fun.ai.bothost.bot.deploy.BotDeploymentPipeline;
import fun.ai.bothost.bot.git.BotGitService;
import fun.ai.bothost.bot.log.BotEventChannel;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.log.BotLogEntry;
import fun.ai.bothost.bot.log.BotStatusBroadcaster;
import fun.ai.bothost.bot.log.BotStatusEvent;
import fun.ai.bothost.bot.process.BotLockRegistry;
import fun.ai.bothost.bot.process.BotProcessHandle;
import fun.ai.bothost.bot.process.BotProcessRegistry;
import fun.ai.bothost.bot.process.BotProcessSupervisor;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.entity.request.FunAiBotUpdateRequest;
import fun.ai.bothost.entity.response.FunAiBotFileReadResponse;
import fun.ai.bothost.entity.response.FunAiBotFileTreeResponse;
import fun.ai.bothost.entity.response.FunAiBotHealthResponse;
import fun.ai.bothost.entity.response.FunAiBotLogResponse;
import fun.ai.bothost.entity.response.FunAiSystemStatsResponse;
import fun.ai.bothost.enums.BotLanguage;
import fun.ai.bothost.enums.FunAiBotStatus;
import fun.ai.bothost.service.FunAiBotService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.OutputStream;
import java.lang.management.ManagementFactory;
import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

@Service
public class FunAiBotServiceImpl implements FunAiBotService {
    private static final Logger log = LoggerFactory.getLogger(FunAiBotServiceImpl.class);

    private final BotRecordStore recordStore;
    private final BotDeploymentPipeline deploymentPipeline;
    private final BotProcessSupervisor supervisor;
    private final BotProcessRegistry processRegistry;
    private final BotLockRegistry lockRegistry;
    private final BotFileManager fileManager;
    private final BotLogAggregator logAggregator;
    private final BotStatusBroadcaster statusBroadcaster;
    private final EnvFileParser envFileParser;

    public FunAiBotServiceImpl(BotRecordStore recordStore,
                               BotDeploymentPipeline deploymentPipeline,
                               BotProcessSupervisor supervisor,
                               BotProcessRegistry processRegistry,
                               BotLockRegistry lockRegistry,
                               BotFileManager fileManager,
                               BotLogAggregator logAggregator,
                               BotStatusBroadcaster statusBroadcaster,
                               EnvFileParser envFileParser) {
        this.recordStore = recordStore;
        this.deploymentPipeline = deploymentPipeline;
        this.supervisor = supervisor;
        this.processRegistry = processRegistry;
        this.lockRegistry = lockRegistry;
        this.fileManager = fileManager;
        this.logAggregator = logAggregator;
        this.statusBroadcaster = statusBroadcaster;
        this.envFileParser = envFileParser;
    }

    @Override
    public FunAiBot deployArchive(FunAiBotDeployRequest request, byte[] archive, byte[] envFile) {
        FunAiBot bot = resolveRecord(request);
        Map<String, String> overrides = new LinkedHashMap<>();
        if (envFile != null && envFile.length > 0) {
            overrides.putAll(envFileParser.parse(envFile));
        }
        if (request.getEnvironmentVariables() != null) {
            overrides.putAll(request.getEnvironmentVariables());
        }
        return deploymentPipeline.deployArchive(bot.getId(), request, archive, overrides);
    }

    @Override
    public FunAiBot deployRepository(FunAiBotDeployRequest request) {
        requireRepositoryUrl(request);
        FunAiBot bot = resolveRecord(request);
        return deploymentPipeline.deployRepository(bot.getId(), request, request.getEnvironmentVariables());
    }

    @Override
    public FunAiBot deployContainer(FunAiBotDeployRequest request) {
        requireRepositoryUrl(request);
        FunAiBot bot = resolveRecord(request);
        return deploymentPipeline.deployContainer(bot.getId(), request, request.getEnvironmentVariables());
    }

    @Override
    public FunAiBot start(String botId) {
        return supervisor.start(botId);
    }

    @Override
    public FunAiBot stop(String botId, boolean immediate) {
        return supervisor.stop(botId, immediate);
    }

    @Override
    public FunAiBot restart(String botId) {
        return supervisor.restart(botId);
    }

    @Override
    public FunAiBot forceStop(String botId) {
        return supervisor.forceStop(botId);
    }

    @Override
    public void delete(String botId) {
        lockRegistry.withLock(botId, () -> {
            FunAiBot bot = recordStore.require(botId);
            supervisor.stopForDeletion(botId);
            fileManager.deleteAll(bot.getName());
            recordStore.remove(botId);
            logAggregator.remove(botId);
            statusBroadcaster.remove(botId);
            log.info("bot deleted: botId={}, name={}", botId, bot.getName());
        });
        lockRegistry.discard(botId);
    }

    @Override
    public FunAiBot getBot(String botId) {
        return recordStore.require(botId);
    }

    @Override
    public List<FunAiBot> listBots() {
        return recordStore.list();
    }

    @Override
    public FunAiBot updateBot(FunAiBotUpdateRequest request) {
        if (request == null || request.getBotId() == null || request.getBotId().isBlank()) {
            throw new IllegalArgumentException("botId 不能为空");
        }
        String botId = request.getBotId();
        return lockRegistry.withLock(botId, () -> {
            FunAiBot updated = recordStore.update(botId, b -> {
                if (request.getRunCommand() != null) {
                    b.setRunCommand(request.getRunCommand().isBlank() ? null : request.getRunCommand().trim());
                }
                if (request.getBuildCommand() != null) {
                    b.setBuildCommand(request.getBuildCommand().isBlank() ? null : request.getBuildCommand().trim());
                }
                if (request.getLanguage() != null) {
                    BotLanguage language = BotLanguage.fromValue(request.getLanguage());
                    if (language == null) {
                        throw new IllegalArgumentException("不支持的语言: " + request.getLanguage());
                    }
                    b.setLanguage(language.value());
                }
                if (request.getAutoRestart() != null) {
                    b.setAutoRestart(request.getAutoRestart());
                }
                if (request.getEnvironmentVariables() != null) {
                    b.setEnvironmentVariables(envFileParser.merge(b.getEnvironmentVariables(), request.getEnvironmentVariables()));
                }
            });
            if (!updated.isAutoRestartEnabled()) {
                supervisor.cancelPendingRestart(botId);
            }
            return updated;
        });
    }

    @Override
    public FunAiBotLogResponse getLogs(String botId) {
        recordStore.require(botId);
        List<String> lines = logAggregator.getAllLines(botId);
        FunAiBotLogResponse resp = new FunAiBotLogResponse();
        resp.setBotId(botId);
        resp.setLines(lines);
        resp.setTotal(lines.size());
        return resp;
    }

    @Override
    public BotEventChannel.Subscription subscribeLogs(String botId, Consumer<BotLogEntry> sink) {
        recordStore.require(botId);
        return logAggregator.subscribe(botId, sink);
    }

    @Override
    public BotEventChannel.Subscription subscribeStatus(String botId, Consumer<BotStatusEvent> sink) {
        recordStore.require(botId);
        return statusBroadcaster.subscribe(botId, sink);
    }

    @Override
    public FunAiBotFileTreeResponse listBotFiles(String botId, Integer maxDepth, Integer maxEntries) {
        FunAiBot bot = recordStore.require(botId);
        FunAiBotFileTreeResponse resp = fileManager.listFiles(bot.getName(), maxDepth, maxEntries);
        resp.setBotId(botId);
        return resp;
    }

    @Override
    public FunAiBotFileReadResponse readBotFile(String botId, String path) {
        FunAiBot bot = recordStore.require(botId);
        FunAiBotFileReadResponse resp = fileManager.readFile(bot.getName(), path);
        resp.setBotId(botId);
        return resp;
    }

    @Override
    public FunAiBotFileReadResponse writeBotFile(String botId, String path, String content) {
        FunAiBot bot = recordStore.require(botId);
        FunAiBotFileReadResponse resp = fileManager.writeFile(bot.getName(), path, content);
        resp.setBotId(botId);
        return resp;
    }

    @Override
    public void createDirectory(String botId, String path) {
        FunAiBot bot = recordStore.require(botId);
        fileManager.createDirectory(bot.getName(), path);
    }

    @Override
    public void deletePath(String botId, String path) {
        FunAiBot bot = recordStore.require(botId);
        fileManager.deletePath(bot.getName(), path);
    }

    @Override
    public void movePath(String botId, String fromPath, String toPath, boolean overwrite) {
        FunAiBot bot = recordStore.require(botId);
        fileManager.movePath(bot.getName(), fromPath, toPath, overwrite);
    }

    @Override
    public void exportArchive(String botId, OutputStream out) throws IOException {
        FunAiBot bot = recordStore.require(botId);
        fileManager.exportArchive(bot.getName(), out);
    }

    @Override
    public FunAiBotHealthResponse healthCheck(String botId) {
        FunAiBot bot = recordStore.require(botId);
        FunAiBotHealthResponse resp = new FunAiBotHealthResponse();
        resp.setBotId(botId);
        resp.setBotName(bot.getName());
        resp.setHealth(supervisor.healthCheck(botId));
        BotProcessHandle handle = processRegistry.get(botId);
        // 重新读取：健康检查期间状态可能已变化
        FunAiBot current = recordStore.find(botId).orElse(bot);
        resp.setStatus(current.getStatus());
        resp.setProcessId(current.getProcessId());
        resp.setRestartCount(current.getRestartCount());
        if (handle != null) {
            resp.setPort(handle.getPort());
        }
        return resp;
    }

    @Override
    public FunAiSystemStatsResponse systemStats() {
        Runtime rt = Runtime.getRuntime();
        long uptimeMs = ManagementFactory.getRuntimeMXBean().getUptime();
        FunAiSystemStatsResponse resp = new FunAiSystemStatsResponse();
        resp.setUptimeSeconds(uptimeMs / 1000);
        resp.setUptime(formatUptime(Duration.ofMillis(uptimeMs)));
        resp.setHeapUsedMb((rt.totalMemory() - rt.freeMemory()) / (1024 * 1024));
        resp.setHeapTotalMb(rt.totalMemory() / (1024 * 1024));
        resp.setHeapMaxMb(rt.maxMemory() / (1024 * 1024));
        resp.setAvailableProcessors(rt.availableProcessors());

        Map<FunAiBotStatus, Integer> counts = new EnumMap<>(FunAiBotStatus.class);
        List<FunAiBot> bots = recordStore.list();
        for (FunAiBot b : bots) {
            counts.merge(b.getStatus(), 1, Integer::sum);
        }
        resp.setTotalBots(bots.size());
        resp.setRunningBots(counts.getOrDefault(FunAiBotStatus.RUNNING, 0));
        resp.setStoppedBots(counts.getOrDefault(FunAiBotStatus.STOPPED, 0));
        resp.setDeployingBots(counts.getOrDefault(FunAiBotStatus.DEPLOYING, 0));
        resp.setErrorBots(counts.getOrDefault(FunAiBotStatus.ERROR, 0));
        resp.setTimestamp(System.currentTimeMillis());
        return resp;
    }

    /**
     * 同名记录存在则复用（重新部署），否则新建
     */
    private FunAiBot resolveRecord(FunAiBotDeployRequest request) {
        if (request == null || request.getName() == null || request.getName().isBlank()) {
            throw new IllegalArgumentException("name 不能为空");
        }
        String name = request.getName().trim();
        BotFileManager.validateBotName(name);
        if (request.getLanguage() != null && BotLanguage.fromValue(request.getLanguage()) == null) {
            throw new IllegalArgumentException("不支持的语言: " + request.getLanguage());
        }
        request.setName(name);
        return recordStore.findByName(name).orElseGet(() -> {
            FunAiBot draft = new FunAiBot();
            draft.setName(name);
            BotLanguage language = BotLanguage.fromValue(request.getLanguage());
            draft.setLanguage(language == null ? null : language.value());
            try {
                return recordStore.create(draft);
            } catch (IllegalArgumentException e) {
                // 并发创建同名记录：以先创建者为准
                return recordStore.findByName(name).orElseThrow(() -> e);
            }
        });
    }

    private static void requireRepositoryUrl(FunAiBotDeployRequest request) {
        if (request == null || request.getRepositoryUrl() == null || request.getRepositoryUrl().isBlank()) {
            throw new IllegalArgumentException("repositoryUrl 不能为空");
        }
        BotGitService.validateRepoUrl(request.getRepositoryUrl().trim());
        request.setRepositoryUrl(request.getRepositoryUrl().trim());
    }

    private static String formatUptime(Duration d) {
        long h = d.toHours();
        long m = d.toMinutesPart();
        long s = d.toSecondsPart();
        return h + "h " + m + "m " + s + "s";
    }
}
