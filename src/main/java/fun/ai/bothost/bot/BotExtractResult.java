package fun.ai.bothost.bot;

import fun.ai.bothost.entity.response.FunAiBotProjectAnalysis;

import java.nio.file.Path;
import java.util.Map;

/**
 * 压缩包解压结果：工作目录 + env 文件合并结果 + 项目分析。
 */
public class BotExtractResult {
    private final Path workingDirectory;
    private final Map<String, String> environmentVariables;
    private final FunAiBotProjectAnalysis analysis;
    private final int fileCount;

    public BotExtractResult(Path workingDirectory, Map<String, String> environmentVariables,
                            FunAiBotProjectAnalysis analysis, int fileCount) {
        this.workingDirectory = workingDirectory;
        this.environmentVariables = environmentVariables;
        this.analysis = analysis;
        this.fileCount = fileCount;
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public Map<String, String> getEnvironmentVariables() {
        return environmentVariables;
    }

    public FunAiBotProjectAnalysis getAnalysis() {
        return analysis;
    }

    public int getFileCount() {
        return fileCount;
    }
}
