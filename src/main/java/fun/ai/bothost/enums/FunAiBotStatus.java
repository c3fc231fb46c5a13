package fun.ai.bothost.enums;

/**
 * Bot 状态机（4态）
 *
 * STOPPED   : 已部署/已停止（可 start）
 * DEPLOYING : 部署中（解压/克隆/构建中）
 * RUNNING   : 运行中（守护进程持有存活句柄）
 * ERROR     : 部署失败或进程异常退出（可重新部署 / start）
 *
 * 合法迁移：
 * STOPPED   -> DEPLOYING | RUNNING | ERROR
 * DEPLOYING -> STOPPED | ERROR
 * RUNNING   -> STOPPED | ERROR
 * ERROR     -> DEPLOYING | RUNNING | ERROR
 */
public enum FunAiBotStatus {
    STOPPED("已停止"),
    DEPLOYING("部署中"),
    RUNNING("运行中"),
    ERROR("异常");

    private final String desc;

    FunAiBotStatus(String desc) {
        this.desc = desc;
    }

    public String desc() {
        return desc;
    }

    public boolean canTransitionTo(FunAiBotStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case STOPPED -> target == DEPLOYING || target == RUNNING || target == ERROR;
            case DEPLOYING -> target == STOPPED || target == ERROR;
            case RUNNING -> target == STOPPED || target == ERROR;
            // 自动重启失败会再次落到 ERROR
            case ERROR -> target == DEPLOYING || target == RUNNING || target == ERROR;
        };
    }

    /**
     * 校验迁移合法性；非法迁移属于编程错误。
     */
    public FunAiBotStatus transitionTo(FunAiBotStatus target) {
        if (!canTransitionTo(target)) {
            throw new IllegalStateException("illegal bot status transition: " + this + " -> " + target);
        }
        return target;
    }
}
