package fun.ai.bothost.entity.response;

import lombok.Data;

/**
 * 解压 / 克隆后对项目根目录的分析结果。
 */
@Data
public class FunAiBotProjectAnalysis {
    /**
     * python / typescript / javascript；无法识别为 null
     */
    private String language;
    private String entryFile;
    private boolean hasDependencyManifest;
    private boolean hasBuildRecipe;
    private boolean hasProcfile;
    private boolean hasEnvFile;
    /**
     * Procfile 中 web: 后的命令
     */
    private String procfileCommand;
    /**
     * Dockerfile 最后一个 CMD
     */
    private String recipeCommand;
    /**
     * 推荐启动命令（调用方未指定 runCommand 时使用）
     */
    private String suggestedCommand;
}
