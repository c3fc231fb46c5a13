package fun.ai.bothost.enums;

/**
 * 构建步骤策略。
 * <p>
 * RUN：执行 buildCommand（如 pip install / npm install）。
 * SKIP：宿主机已预装依赖，跳过构建并在部署日志中明确记录。
 */
public enum BuildStepPolicy {
    RUN,
    SKIP
}
