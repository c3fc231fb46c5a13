package fun.ai.bothost.bot;

import fun.ai.bothost.enums.BuildStepPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bot 托管配置
 *
 * <pre>
 * funai.bothost.storage-root=deployed_bots
 * funai.bothost.build-policy=RUN
 * funai.bothost.stop-timeout=10s
 * funai.bothost.restart-backoff-base=1s
 * funai.bothost.git.binary=git
 * funai.bothost.container.tool=docker
 * </pre>
 */
@Component
@ConfigurationProperties(prefix = "funai.bothost")
public class BotHostProperties {

    /**
     * bot 工作目录根：{storageRoot}/{botName}
     */
    private String storageRoot = "deployed_bots";

    /**
     * 上传压缩包上限
     */
    private long maxArchiveBytes = 100L * 1024 * 1024;

    /**
     * 压缩包内最多条目数
     */
    private int maxArchiveEntries = 1000;

    /**
     * 单个条目解压后上限
     */
    private long maxEntryBytes = 10L * 1024 * 1024;

    /**
     * 解压总量上限（防 zip bomb）
     */
    private long maxExtractedBytes = 200L * 1024 * 1024;

    /**
     * 在线编辑：单文件读写上限（1MiB）
     */
    private long maxEditableFileBytes = 1024L * 1024;

    /**
     * 文件树默认递归深度 / 最大节点数
     */
    private int treeMaxDepth = 12;
    private int treeMaxEntries = 5000;

    /**
     * 文件树忽略的目录名
     */
    private List<String> treeIgnoredNames = new ArrayList<>(List.of(".git", "node_modules", "__pycache__", ".venv"));

    /**
     * 压缩包部署时按顺序查找的 env 文件（靠前优先）
     */
    private List<String> archiveEnvFiles = new ArrayList<>(List.of(".env", "config.env"));

    /**
     * 仓库部署时按顺序查找的 env 文件（靠前优先）
     */
    private List<String> repositoryEnvFiles = new ArrayList<>(List.of(".env", "config.env", ".env.example"));

    /**
     * 每个 bot 运行日志环形缓冲条数
     */
    private int logCapacity = 1000;

    /**
     * 单次部署日志上限条数
     */
    private int deploymentLogCapacity = 2000;

    /**
     * 每个订阅者的待投递队列上限（超出丢弃最旧）
     */
    private int subscriberQueueCapacity = 10_000;

    /**
     * 优雅停止：SIGTERM 后等待多久升级为 SIGKILL
     */
    private Duration stopTimeout = Duration.ofSeconds(10);

    /**
     * SIGKILL 后等待进程退出的上限；超时报 STOP_TIMEOUT
     */
    private Duration killTimeout = Duration.ofSeconds(5);

    /**
     * restart：停止与启动之间的固定间隔
     */
    private Duration restartDelay = Duration.ofSeconds(3);

    /**
     * 自动重启退避：min(base * 2^n, max)
     */
    private Duration restartBackoffBase = Duration.ofSeconds(1);
    private Duration restartBackoffMax = Duration.ofSeconds(60);

    /**
     * 单次运行超过该时长视为稳定运行，连续崩溃计数归零
     */
    private Duration stableRunThreshold = Duration.ofSeconds(60);

    /**
     * 启动后无成功/失败特征输出时，超过该时长视为 HEALTHY
     */
    private Duration healthGracePeriod = Duration.ofSeconds(15);

    /**
     * stdout 出现即视为启动成功（大小写不敏感）
     */
    private List<String> healthSuccessPatterns = new ArrayList<>(List.of(
            "Started Successfully", "Bot started", "Running on", "Server started",
            "listening on port", "Bot is ready", "Application started", "Ready to receive"));

    /**
     * stderr 出现即视为不健康（大小写不敏感）
     */
    private List<String> healthCriticalPatterns = new ArrayList<>(List.of(
            "ImportError", "ModuleNotFoundError", "SyntaxError", "ConnectionError", "TimeoutError",
            "AuthenticationError", "Permission denied", "No such file or directory"));

    /**
     * 每个 bot 的端口：portBase + hash(botId) mod portRange
     */
    private int portBase = 8080;
    private int portRange = 1000;

    /**
     * 解释器别名：仅替换命令的第一个词
     */
    private Map<String, String> interpreterAliases = new LinkedHashMap<>(Map.of("python", "python3"));

    /**
     * 命令含 shell 语法（管道、&&、变量展开等）时使用的 shell
     */
    private String shell = "/bin/sh";

    /**
     * 构建步骤策略（RUN / SKIP）
     */
    private BuildStepPolicy buildPolicy = BuildStepPolicy.RUN;

    /**
     * 构建命令超时
     */
    private Duration buildTimeout = Duration.ofMinutes(10);

    private Git git = new Git();

    private Container container = new Container();

    public static class Git {
        /**
         * git 可执行文件
         */
        private String binary = "git";

        private Duration cloneTimeout = Duration.ofMinutes(5);

        /**
         * 浅克隆深度；<=0 表示完整克隆
         */
        private int cloneDepth = 1;

        public String getBinary() {
            return binary;
        }

        public void setBinary(String binary) {
            this.binary = binary;
        }

        public Duration getCloneTimeout() {
            return cloneTimeout;
        }

        public void setCloneTimeout(Duration cloneTimeout) {
            this.cloneTimeout = cloneTimeout;
        }

        public int getCloneDepth() {
            return cloneDepth;
        }

        public void setCloneDepth(int cloneDepth) {
            this.cloneDepth = cloneDepth;
        }
    }

    public static class Container {
        /**
         * 容器工具：docker / podman
         */
        private String tool = "docker";

        private Duration buildTimeout = Duration.ofMinutes(20);

        /**
         * 镜像名：{imagePrefix}{botName}:latest
         */
        private String imagePrefix = "funai-bot-";

        /**
         * 容器名：{containerNamePrefix}{botName}
         */
        private String containerNamePrefix = "funai-bot-";

        /**
         * 仓库根目录下的构建描述文件名
         */
        private List<String> recipeFileNames = new ArrayList<>(List.of("Dockerfile", "dockerfile"));

        public String getTool() {
            return tool;
        }

        public void setTool(String tool) {
            this.tool = tool;
        }

        public Duration getBuildTimeout() {
            return buildTimeout;
        }

        public void setBuildTimeout(Duration buildTimeout) {
            this.buildTimeout = buildTimeout;
        }

        public String getImagePrefix() {
            return imagePrefix;
        }

        public void setImagePrefix(String imagePrefix) {
            this.imagePrefix = imagePrefix;
        }

        public String getContainerNamePrefix() {
            return containerNamePrefix;
        }

        public void setContainerNamePrefix(String containerNamePrefix) {
            this.containerNamePrefix = containerNamePrefix;
        }

        public List<String> getRecipeFileNames() {
            return recipeFileNames;
        }

        public void setRecipeFileNames(List<String> recipeFileNames) {
            this.recipeFileNames = recipeFileNames;
        }
    }

    public String getStorageRoot() {
        return storageRoot;
    }

    public void setStorageRoot(String storageRoot) {
        this.storageRoot = storageRoot;
    }

    public long getMaxArchiveBytes() {
        return maxArchiveBytes;
    }

    public void setMaxArchiveBytes(long maxArchiveBytes) {
        this.maxArchiveBytes = maxArchiveBytes;
    }

    public int getMaxArchiveEntries() {
        return maxArchiveEntries;
    }

    public void setMaxArchiveEntries(int maxArchiveEntries) {
        this.maxArchiveEntries = maxArchiveEntries;
    }

    public long getMaxEntryBytes() {
        return maxEntryBytes;
    }

    public void setMaxEntryBytes(long maxEntryBytes) {
        this.maxEntryBytes = maxEntryBytes;
    }

    public long getMaxExtractedBytes() {
        return maxExtractedBytes;
    }

    public void setMaxExtractedBytes(long maxExtractedBytes) {
        this.maxExtractedBytes = maxExtractedBytes;
    }

    public long getMaxEditableFileBytes() {
        return maxEditableFileBytes;
    }

    public void setMaxEditableFileBytes(long maxEditableFileBytes) {
        this.maxEditableFileBytes = maxEditableFileBytes;
    }

    public int getTreeMaxDepth() {
        return treeMaxDepth;
    }

    public void setTreeMaxDepth(int treeMaxDepth) {
        this.treeMaxDepth = treeMaxDepth;
    }

    public int getTreeMaxEntries() {
        return treeMaxEntries;
    }

    public void setTreeMaxEntries(int treeMaxEntries) {
        this.treeMaxEntries = treeMaxEntries;
    }

    public List<String> getTreeIgnoredNames() {
        return treeIgnoredNames;
    }

    public void setTreeIgnoredNames(List<String> treeIgnoredNames) {
        this.treeIgnoredNames = treeIgnoredNames;
    }

    public List<String> getArchiveEnvFiles() {
        return archiveEnvFiles;
    }

    public void setArchiveEnvFiles(List<String> archiveEnvFiles) {
        this.archiveEnvFiles = archiveEnvFiles;
    }

    public List<String> getRepositoryEnvFiles() {
        return repositoryEnvFiles;
    }

    public void setRepositoryEnvFiles(List<String> repositoryEnvFiles) {
        this.repositoryEnvFiles = repositoryEnvFiles;
    }

    public int getLogCapacity() {
        return logCapacity;
    }

    public void setLogCapacity(int logCapacity) {
        this.logCapacity = logCapacity;
    }

    public int getDeploymentLogCapacity() {
        return deploymentLogCapacity;
    }

    public void setDeploymentLogCapacity(int deploymentLogCapacity) {
        this.deploymentLogCapacity = deploymentLogCapacity;
    }

    public int getSubscriberQueueCapacity() {
        return subscriberQueueCapacity;
    }

    public void setSubscriberQueueCapacity(int subscriberQueueCapacity) {
        this.subscriberQueueCapacity = subscriberQueueCapacity;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }

    public void setStopTimeout(Duration stopTimeout) {
        this.stopTimeout = stopTimeout;
    }

    public Duration getKillTimeout() {
        return killTimeout;
    }

    public void setKillTimeout(Duration killTimeout) {
        this.killTimeout = killTimeout;
    }

    public Duration getRestartDelay() {
        return restartDelay;
    }

    public void setRestartDelay(Duration restartDelay) {
        this.restartDelay = restartDelay;
    }

    public Duration getRestartBackoffBase() {
        return restartBackoffBase;
    }

    public void setRestartBackoffBase(Duration restartBackoffBase) {
        this.restartBackoffBase = restartBackoffBase;
    }

    public Duration getRestartBackoffMax() {
        return restartBackoffMax;
    }

    public void setRestartBackoffMax(Duration restartBackoffMax) {
        this.restartBackoffMax = restartBackoffMax;
    }

    public Duration getStableRunThreshold() {
        return stableRunThreshold;
    }

    public void setStableRunThreshold(Duration stableRunThreshold) {
        this.stableRunThreshold = stableRunThreshold;
    }

    public Duration getHealthGracePeriod() {
        return healthGracePeriod;
    }

    public void setHealthGracePeriod(Duration healthGracePeriod) {
        this.healthGracePeriod = healthGracePeriod;
    }

    public List<String> getHealthSuccessPatterns() {
        return healthSuccessPatterns;
    }

    public void setHealthSuccessPatterns(List<String> healthSuccessPatterns) {
        this.healthSuccessPatterns = healthSuccessPatterns;
    }

    public List<String> getHealthCriticalPatterns() {
        return healthCriticalPatterns;
    }

    public void setHealthCriticalPatterns(List<String> healthCriticalPatterns) {
        this.healthCriticalPatterns = healthCriticalPatterns;
    }

    public int getPortBase() {
        return portBase;
    }

    public void setPortBase(int portBase) {
        this.portBase = portBase;
    }

    public int getPortRange() {
        return portRange;
    }

    public void setPortRange(int portRange) {
        this.portRange = portRange;
    }

    public Map<String, String> getInterpreterAliases() {
        return interpreterAliases;
    }

    public void setInterpreterAliases(Map<String, String> interpreterAliases) {
        this.interpreterAliases = interpreterAliases;
    }

    public String getShell() {
        return shell;
    }

    public void setShell(String shell) {
        this.shell = shell;
    }

    public BuildStepPolicy getBuildPolicy() {
        return buildPolicy;
    }

    public void setBuildPolicy(BuildStepPolicy buildPolicy) {
        this.buildPolicy = buildPolicy;
    }

    public Duration getBuildTimeout() {
        return buildTimeout;
    }

    public void setBuildTimeout(Duration buildTimeout) {
        this.buildTimeout = buildTimeout;
    }

    public Git getGit() {
        return git;
    }

    public void setGit(Git git) {
        this.git = git;
    }

    public Container getContainer() {
        return container;
    }

    public void setContainer(Container container) {
        this.container = container;
    }
}
