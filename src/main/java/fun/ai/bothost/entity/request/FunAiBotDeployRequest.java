package fun.ai.bothost.entity.request;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 部署请求（三种来源共用）。
 * <p>
 * 同名 bot 已存在时视为重新部署：沿用原记录 id，整体替换工作目录。
 */
@Data
public class FunAiBotDeployRequest {

    @NotBlank(message = "name 不能为空")
    @Pattern(regexp = "^[A-Za-z0-9_-]+$", message = "name 仅允许字母、数字、下划线与中划线")
    @Schema(description = "bot 名称", example = "echo-bot")
    private String name;

    @Schema(description = "语言提示：python / nodejs", example = "python")
    private String language;

    @Schema(description = "启动命令；为空时使用项目分析推荐的命令", example = "python3 bot.py")
    private String runCommand;

    @Schema(description = "构建命令（可选）", example = "pip install -r requirements.txt")
    private String buildCommand;

    @Schema(description = "仓库地址（REPOSITORY / CONTAINER 必填）")
    private String repositoryUrl;

    @Schema(description = "异常退出后是否自动重启（默认 true）")
    private Boolean autoRestart;

    /**
     * 覆盖变量：优先级高于压缩包 / 仓库内的 env 文件。
     */
    @Schema(description = "覆盖环境变量")
    private Map<String, String> environmentVariables = new LinkedHashMap<>();
}
