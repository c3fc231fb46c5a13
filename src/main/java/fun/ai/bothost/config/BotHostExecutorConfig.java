package fun.ai.bothost.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class BotHostExecutorConfig {

    /**
     * 日志 / 状态订阅者投递（每个订阅者一个串行 drain 任务）。
     * - 订阅者（WebSocket 推送）可能较慢，不能占用发布方线程
     */
    @Bean(name = "botEventExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor botEventExecutor() {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(4);
        ex.setMaxPoolSize(32);
        ex.setQueueCapacity(2000);
        ex.setThreadNamePrefix("bot-event-");
        ex.setWaitForTasksToCompleteOnShutdown(false);
        ex.initialize();
        return ex;
    }

    /**
     * bot 进程 stdout/stderr 读取与退出回调：每个运行中的 bot 常驻 2 个阻塞读线程，使用无界 cached pool。
     */
    @Bean(name = "botProcessIoExecutor", destroyMethod = "shutdownNow")
    public ExecutorService botProcessIoExecutor() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "bot-io-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 崩溃后自动重启的延迟调度
     */
    @Bean(name = "botRestartScheduler", destroyMethod = "shutdownNow")
    public ScheduledExecutorService botRestartScheduler() {
        return Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "bot-restart");
            t.setDaemon(true);
            return t;
        });
    }
}
