package fun.ai.bothost.bot.deploy;

import fun.ai.bothost.bot.BotCommandLine;
import fun.ai.bothost.bot.BotExtractResult;
import fun.ai.bothost.bot.BotFileManager;
import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.BotRecordStore;
import fun.ai.bothost.bot.CommandResult;
import fun.ai.bothost.bot.CommandRunner;
import fun.ai.bothost.bot.EnvFileParser;
import fun.ai.bothost.bot.container.BotContainerService;
import fun.ai.bothost.bot.git.BotGitService;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.process.BotLockRegistry;
import fun.ai.bothost.bot.process.BotProcessRegistry;
import fun.ai.bothost.common.BotAlreadyRunningException;
import fun.ai.bothost.common.BotHostException;
import fun.ai.bothost.common.DeploymentFailedException;
import fun.ai.bothost.common.MissingBuildRecipeException;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.entity.response.FunAiBotProjectAnalysis;
import fun.ai.bothost.enums.BotDeploymentSource;
import fun.ai.bothost.enums.BotLanguage;
import fun.ai.bothost.enums.BuildStepPolicy;
import fun.ai.bothost.enums.FunAiBotStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 部署流水线：压缩包 / Git 仓库 / 容器镜像 -> 就绪的工作目录（或镜像）+ 启动命令 + 合并后的环境变量。
 * <p>
 * 公共约定：
 * <ul>
 *     <li>运行中的 bot 不允许部署（AlreadyRunning）</li>
 *     <li>状态 -> DEPLOYING，重新开始一份部署日志，每个关键步骤写一行</li>
 *     <li>成功 -> STOPPED（已部署、等待 start），绝不直接 RUNNING</li>
 *     <li>任一步骤失败：写 "DEPLOYMENT FAILED: 原因"，状态 -> ERROR，异常抛给调用方，不重试</li>
 * </ul>
 */
@Service
public class BotDeploymentPipeline {
    private static final Logger log = LoggerFactory.getLogger(BotDeploymentPipeline.class);

    private final BotHostProperties props;
    private final BotRecordStore recordStore;
    private final BotFileManager fileManager;
    private final EnvFileParser envFileParser;
    private final BotGitService gitService;
    private final BotContainerService containerService;
    private final CommandRunner commandRunner;
    private final BotLogAggregator logAggregator;
    private final BotLockRegistry lockRegistry;
    private final BotProcessRegistry processRegistry;

    public BotDeploymentPipeline(BotHostProperties props,
                                 BotRecordStore recordStore,
                                 BotFileManager fileManager,
                                 EnvFileParser envFileParser,
                                 BotGitService gitService,
                                 BotContainerService containerService,
                                 CommandRunner commandRunner,
                                 BotLogAggregator logAggregator,
                                 BotLockRegistry lockRegistry,
                                 BotProcessRegistry processRegistry) {
        this.props = props;
        this.recordStore = recordStore;
        this.fileManager = fileManager;
        this.envFileParser = envFileParser;
        this.gitService = gitService;
        this.containerService = containerService;
        this.commandRunner = commandRunner;
        this.logAggregator = logAggregator;
        this.lockRegistry = lockRegistry;
        this.processRegistry = processRegistry;
    }

    @FunctionalInterface
    private interface DeploymentStep {
        DeploymentOutcome run(FunAiBot bot, DeploymentLog deployLog) throws IOException;
    }

    /**
     * 单次部署的产出，成功后一次性写回记录
     */
    private static final class DeploymentOutcome {
        String workingDirectory;
        String imageReference;
        Map<String, String> environmentVariables;
        String runCommand;
        FunAiBotProjectAnalysis analysis;
        String commit;
    }

    /**
     * 部署日志：同时写入聚合器（实时推送）、slf4j，并留一份用于失败异常
     */
    private final class DeploymentLog {
        private final String botId;
        private final String botName;
        private final List<String> lines = Collections.synchronizedList(new ArrayList<>());

        DeploymentLog(String botId, String botName) {
            this.botId = botId;
            this.botName = botName;
        }

        void add(String message) {
            lines.add(logAggregator.appendDeployment(botId, message).format());
            log.info("[DEPLOY {}] {}", botName, message);
        }

        void tool(String prefix, String line) {
            lines.add(logAggregator.appendDeployment(botId, prefix + line).format());
            log.debug("[DEPLOY {}] {}{}", botName, prefix, line);
        }

        List<String> lines() {
            synchronized (lines) {
                return List.copyOf(lines);
            }
        }
    }

    public FunAiBot deployArchive(String botId, FunAiBotDeployRequest request, byte[] archive, Map<String, String> overrides) {
        return runDeployment(botId, request, BotDeploymentSource.ARCHIVE, (bot, deployLog) -> {
            deployLog.add("Extracting archive (" + (archive == null ? 0 : archive.length) + " bytes)...");
            BotExtractResult extracted = fileManager.extractArchive(archive, bot.getName());
            Path dir = extracted.getWorkingDirectory();
            deployLog.add("Files extracted to: " + dir + " (" + extracted.getFileCount() + " files)");

            DeploymentOutcome outcome = new DeploymentOutcome();
            outcome.workingDirectory = dir.toString();
            outcome.analysis = extracted.getAnalysis();
            outcome.environmentVariables = mergeEnvironment(extracted.getEnvironmentVariables(), overrides, deployLog);
            outcome.runCommand = resolveRunCommand(bot, outcome.analysis, deployLog);
            runBuildStep(bot, dir, outcome.environmentVariables, deployLog);
            return outcome;
        });
    }

    public FunAiBot deployRepository(String botId, FunAiBotDeployRequest request, Map<String, String> overrides) {
        return runDeployment(botId, request, BotDeploymentSource.REPOSITORY, (bot, deployLog) -> {
            Path dir = cloneRepository(bot, deployLog);
            DeploymentOutcome outcome = new DeploymentOutcome();
            outcome.workingDirectory = dir.toString();
            outcome.commit = gitService.headCommit(dir);
            if (outcome.commit != null) {
                deployLog.add("Checked out commit " + outcome.commit);
            }
            outcome.analysis = fileManager.analyze(bot.getName());
            Map<String, String> discovered = envFileParser.discover(dir, props.getRepositoryEnvFiles());
            outcome.environmentVariables = mergeEnvironment(discovered, overrides, deployLog);
            outcome.runCommand = resolveRunCommand(bot, outcome.analysis, deployLog);
            runBuildStep(bot, dir, outcome.environmentVariables, deployLog);
            return outcome;
        });
    }

    public FunAiBot deployContainer(String botId, FunAiBotDeployRequest request, Map<String, String> overrides) {
        return runDeployment(botId, request, BotDeploymentSource.CONTAINER, (bot, deployLog) -> {
            Path dir = cloneRepository(bot, deployLog);
            if (!fileManager.hasBuildRecipe(dir)) {
                throw new MissingBuildRecipeException(bot.getName(), String.join(" / ", props.getContainer().getRecipeFileNames()));
            }
            DeploymentOutcome outcome = new DeploymentOutcome();
            outcome.commit = gitService.headCommit(dir);
            outcome.analysis = fileManager.analyze(bot.getName());
            Map<String, String> discovered = envFileParser.discover(dir, props.getRepositoryEnvFiles());
            outcome.environmentVariables = mergeEnvironment(discovered, overrides, deployLog);

            String tag = containerService.imageTag(bot.getName());
            deployLog.add("Building container image " + tag + "...");
            CommandResult res = containerService.buildImage(dir, tag, line -> deployLog.tool("BUILD: ", line));
            if (!res.isSuccess()) {
                throw toolFailure("container build", res, deployLog);
            }
            deployLog.add("Container image built: " + tag);
            outcome.imageReference = tag;
            // 容器部署不记录工作目录；启动命令为空时使用镜像自带 CMD
            outcome.workingDirectory = null;
            outcome.runCommand = bot.getRunCommand();
            return outcome;
        });
    }

    private FunAiBot runDeployment(String botId, FunAiBotDeployRequest request, BotDeploymentSource source, DeploymentStep step) {
        return lockRegistry.withLock(botId, () -> {
            FunAiBot bot = recordStore.require(botId);
            if (processRegistry.contains(botId) || bot.getStatus() == FunAiBotStatus.RUNNING) {
                throw new BotAlreadyRunningException(bot.getName());
            }
            logAggregator.beginDeployment(botId);
            FunAiBot deploying = recordStore.transition(botId, FunAiBotStatus.DEPLOYING, b -> applyRequest(b, request, source));
            DeploymentLog deployLog = new DeploymentLog(botId, deploying.getName());
            deployLog.add("Starting " + source.name().toLowerCase() + " deployment for bot " + deploying.getName() + "...");
            try {
                DeploymentOutcome outcome = step.run(deploying, deployLog);
                FunAiBot deployed = recordStore.transition(botId, FunAiBotStatus.STOPPED, b -> applyOutcome(b, outcome));
                deployLog.add("Deployment completed successfully - ready to start");
                return deployed;
            } catch (IOException | RuntimeException e) {
                String reason = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
                deployLog.add("DEPLOYMENT FAILED: " + reason);
                recordStore.transitionIfPresent(botId, FunAiBotStatus.ERROR, null);
                log.error("deploy bot failed: botId={}, name={}, source={}, error={}", botId, deploying.getName(), source, reason, e);
                if (e instanceof DeploymentFailedException dfe) {
                    throw new DeploymentFailedException(dfe.getMessage(), deployLog.lines(), dfe.getCause());
                }
                if (e instanceof BotHostException || e instanceof IllegalArgumentException) {
                    throw (RuntimeException) e;
                }
                throw new DeploymentFailedException("部署失败: " + reason, deployLog.lines(), e);
            }
        });
    }

    private static void applyRequest(FunAiBot b, FunAiBotDeployRequest request, BotDeploymentSource source) {
        b.setDeploymentSource(source);
        if (request == null) {
            return;
        }
        // 别名统一为规范值（py -> python，node -> nodejs）；无法识别时保留原值
        BotLanguage language = BotLanguage.fromValue(request.getLanguage());
        if (language != null) {
            b.setLanguage(language.value());
        }
        if (request.getRunCommand() != null) {
            b.setRunCommand(request.getRunCommand().isBlank() ? null : request.getRunCommand().trim());
        }
        if (request.getBuildCommand() != null) {
            b.setBuildCommand(request.getBuildCommand().isBlank() ? null : request.getBuildCommand().trim());
        }
        if (request.getAutoRestart() != null) {
            b.setAutoRestart(request.getAutoRestart());
        }
        b.setSourceLocator(source == BotDeploymentSource.ARCHIVE ? null : request.getRepositoryUrl());
    }

    private static void applyOutcome(FunAiBot b, DeploymentOutcome outcome) {
        b.setWorkingDirectory(outcome.workingDirectory);
        b.setImageReference(outcome.imageReference);
        b.setEnvironmentVariables(outcome.environmentVariables);
        b.setRunCommand(outcome.runCommand);
        b.setLastCommit(outcome.commit);
        b.setProcessId(null);
        FunAiBotProjectAnalysis a = outcome.analysis;
        if (a != null) {
            b.setEntryFile(a.getEntryFile());
            b.setHasBuildRecipe(a.isHasBuildRecipe());
            b.setHasDependencyManifest(a.isHasDependencyManifest());
            BotLanguage detected = BotLanguage.fromValue(a.getLanguage());
            if (b.getLanguage() == null && detected != null) {
                b.setLanguage(detected.value());
            }
        }
    }

    private Path cloneRepository(FunAiBot bot, DeploymentLog deployLog) throws IOException {
        if (bot.getSourceLocator() == null || bot.getSourceLocator().isBlank()) {
            throw new IllegalArgumentException("repositoryUrl 不能为空");
        }
        fileManager.ensureRoot();
        Path dir = fileManager.botDirectory(bot.getName());
        deployLog.add("Cloning repository...");
        CommandResult res = gitService.cloneInto(bot.getSourceLocator(), dir, line -> deployLog.tool("GIT: ", line));
        if (!res.isSuccess()) {
            fileManager.deleteAll(bot.getName());
            throw toolFailure("git clone", res, deployLog);
        }
        deployLog.add("Repository cloned to: " + dir);
        return dir;
    }

    private Map<String, String> mergeEnvironment(Map<String, String> discovered, Map<String, String> overrides, DeploymentLog deployLog) {
        Map<String, String> merged = envFileParser.merge(discovered, overrides);
        if (overrides != null && !overrides.isEmpty()) {
            deployLog.add("Applied " + overrides.size() + " override environment variables");
        }
        deployLog.add("Environment variables loaded: " + merged.size());
        return merged;
    }

    private String resolveRunCommand(FunAiBot bot, FunAiBotProjectAnalysis analysis, DeploymentLog deployLog) {
        if (bot.getRunCommand() != null && !bot.getRunCommand().isBlank()) {
            return bot.getRunCommand();
        }
        if (analysis != null && analysis.getSuggestedCommand() != null) {
            deployLog.add("No run command given, using detected command: " + analysis.getSuggestedCommand());
            return analysis.getSuggestedCommand();
        }
        deployLog.add("No run command given and no entry file detected - set a run command before starting");
        return null;
    }

    private void runBuildStep(FunAiBot bot, Path dir, Map<String, String> env, DeploymentLog deployLog) {
        String buildCommand = bot.getBuildCommand();
        if (buildCommand == null || buildCommand.isBlank()) {
            deployLog.add("No build command specified");
            return;
        }
        if (props.getBuildPolicy() == BuildStepPolicy.SKIP) {
            deployLog.add("Build step skipped (policy=SKIP, packages are pre-provisioned): " + buildCommand);
            return;
        }
        BotCommandLine commandLine = BotCommandLine.parse(buildCommand);
        List<String> argv = commandLine.toArgv(props.getShell(), props.getInterpreterAliases());
        Map<String, String> buildEnv = envFileParser.merge(env, commandLine.getEnvironment());
        deployLog.add("Running build command: " + buildCommand);
        CommandResult res = commandRunner.run(props.getBuildTimeout(), argv, dir, buildEnv, line -> deployLog.tool("BUILD: ", line));
        if (!res.isSuccess()) {
            throw toolFailure("build command", res, deployLog);
        }
        deployLog.add("Build command completed");
    }

    private DeploymentFailedException toolFailure(String tool, CommandResult res, DeploymentLog deployLog) {
        String reason = res.isTimeout()
                ? tool + " timed out"
                : tool + " failed with exit code " + res.getExitCode();
        List<String> lines = new ArrayList<>(deployLog.lines());
        // 没有逐行回调到的输出（如启动失败信息）也带上
        if (res.getExitCode() == 127) {
            lines.addAll(res.outputLines());
        }
        return new DeploymentFailedException(reason, lines);
    }
}
