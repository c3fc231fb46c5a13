package fun.ai.bothost.bot.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 定时巡检运行中的 bot：
 * - 启动宽限期已过且无任何特征输出：UNKNOWN -> HEALTHY
 * - 进程已死但退出回调没执行：补偿执行退出处理，保证 RUNNING 不会比进程活得更久
 */
@Component
public class BotHealthMonitor {
    private static final Logger log = LoggerFactory.getLogger(BotHealthMonitor.class);

    private final BotProcessRegistry processRegistry;
    private final BotProcessSupervisor supervisor;

    public BotHealthMonitor(BotProcessRegistry processRegistry, BotProcessSupervisor supervisor) {
        this.processRegistry = processRegistry;
        this.supervisor = supervisor;
    }

    @Scheduled(fixedDelayString = "${funai.bothost.health-sweep-interval-ms:15000}")
    public void sweep() {
        for (BotProcessHandle handle : processRegistry.snapshot()) {
            try {
                supervisor.promoteIfGraceElapsed(handle);
                supervisor.reconcile(handle);
            } catch (RuntimeException e) {
                log.warn("health sweep failed: botId={}, error={}", handle.getBotId(), e.getMessage(), e);
            }
        }
    }
}
