package fun.ai.bothost.common;

import java.util.List;

/**
 * 部署失败：携带失败前采集到的部署日志（含外部工具输出）。
 */
public class DeploymentFailedException extends BotHostException {
    private final List<String> logLines;

    public DeploymentFailedException(String message, List<String> logLines) {
        super(BotErrorCode.DEPLOYMENT_FAILED, message);
        this.logLines = logLines == null ? List.of() : List.copyOf(logLines);
    }

    public DeploymentFailedException(String message, List<String> logLines, Throwable cause) {
        super(BotErrorCode.DEPLOYMENT_FAILED, message, cause);
        this.logLines = logLines == null ? List.of() : List.copyOf(logLines);
    }

    public List<String> getLogLines() {
        return logLines;
    }
}
