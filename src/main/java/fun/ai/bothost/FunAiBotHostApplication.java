package fun.ai.bothost;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Bot 托管服务入口：部署（压缩包 / Git 仓库 / 容器镜像）+ 进程守护 + 日志聚合 + 文件管理。
 */
@SpringBootApplication
@EnableScheduling
public class FunAiBotHostApplication {

    public static void main(String[] args) {
        SpringApplication.run(FunAiBotHostApplication.class, args);
    }
}
