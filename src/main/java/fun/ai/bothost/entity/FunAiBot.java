package fun.ai.bothost.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import fun.ai.bothost.enums.BotDeploymentSource;
import fun.ai.bothost.enums.FunAiBotStatus;
import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Bot 记录（仅内存保存，随服务进程生命周期存在）。
 */
@Data
@Schema(name = "FunAiBot", description = "托管 bot 记录")
public class FunAiBot {

    @Schema(description = "bot id（UUID）")
    private String id;

    @Schema(description = "bot 名称（唯一，仅允许字母数字下划线与中划线，同时作为磁盘目录名）")
    private String name;

    @Schema(description = "语言提示：python / nodejs")
    private String language;

    @Schema(description = "状态：STOPPED / DEPLOYING / RUNNING / ERROR")
    private FunAiBotStatus status;

    @Schema(description = "启动命令")
    private String runCommand;

    @Schema(description = "构建命令（可选）")
    private String buildCommand;

    @Schema(description = "部署来源：ARCHIVE / REPOSITORY / CONTAINER")
    private BotDeploymentSource deploymentSource;

    @Schema(description = "仓库地址（仅 REPOSITORY / CONTAINER）")
    private String sourceLocator;

    @Schema(description = "工作目录绝对路径（容器部署为空）")
    private String workingDirectory;

    @Schema(description = "容器镜像（仅 CONTAINER）")
    private String imageReference;

    @Schema(description = "合并后的环境变量")
    private Map<String, String> environmentVariables = new LinkedHashMap<>();

    @Schema(description = "异常退出后是否自动重启")
    private Boolean autoRestart = Boolean.TRUE;

    @Schema(description = "运行中进程 pid")
    private Long processId;

    @Schema(description = "当前进程是第几次连续自动重启（显式 start 归零）")
    private Integer restartCount = 0;

    @Schema(description = "检测到的入口文件")
    private String entryFile;

    @Schema(description = "是否存在 Dockerfile")
    private Boolean hasBuildRecipe;

    @Schema(description = "是否存在依赖清单（requirements.txt / package.json 等）")
    private Boolean hasDependencyManifest;

    @Schema(description = "最近一次部署的提交（仅仓库部署）")
    private String lastCommit;

    private Long createdAt;

    private Long updatedAt;

    @JsonIgnore
    public boolean isAutoRestartEnabled() {
        return autoRestart == null || autoRestart;
    }

    /**
     * 深拷贝（环境变量 map 独立），记录仓库对外只暴露副本。
     */
    public FunAiBot copy() {
        FunAiBot c = new FunAiBot();
        c.setId(id);
        c.setName(name);
        c.setLanguage(language);
        c.setStatus(status);
        c.setRunCommand(runCommand);
        c.setBuildCommand(buildCommand);
        c.setDeploymentSource(deploymentSource);
        c.setSourceLocator(sourceLocator);
        c.setWorkingDirectory(workingDirectory);
        c.setImageReference(imageReference);
        c.setEnvironmentVariables(environmentVariables == null ? new LinkedHashMap<>() : new LinkedHashMap<>(environmentVariables));
        c.setAutoRestart(autoRestart);
        c.setProcessId(processId);
        c.setRestartCount(restartCount);
        c.setEntryFile(entryFile);
        c.setHasBuildRecipe(hasBuildRecipe);
        c.setHasDependencyManifest(hasDependencyManifest);
        c.setLastCommit(lastCommit);
        c.setCreatedAt(createdAt);
        c.setUpdatedAt(updatedAt);
        return c;
    }
}
