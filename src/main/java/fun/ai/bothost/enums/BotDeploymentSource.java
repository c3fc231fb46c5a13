package fun.ai.bothost.enums;

/**
 * 部署来源
 */
public enum BotDeploymentSource {
    ARCHIVE("zip 压缩包"),
    REPOSITORY("Git 仓库"),
    CONTAINER("容器镜像（仓库内 Dockerfile）");

    private final String desc;

    BotDeploymentSource(String desc) {
        this.desc = desc;
    }

    public String desc() {
        return desc;
    }
}
