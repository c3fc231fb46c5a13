package fun.ai.bothost.bot.container;

import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.CommandResult;
import fun.ai.bothost.bot.CommandRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.Consumer;

/**
 * 容器工具（docker / podman）封装：镜像构建、运行参数拼装、强制删除容器。
 */
@Service
public class BotContainerService {
    private static final Logger log = LoggerFactory.getLogger(BotContainerService.class);

    private final BotHostProperties props;
    private final CommandRunner commandRunner;

    public BotContainerService(BotHostProperties props, CommandRunner commandRunner) {
        this.props = props;
        this.commandRunner = commandRunner;
    }

    public String imageTag(String botName) {
        return props.getContainer().getImagePrefix() + botName.toLowerCase(Locale.ROOT) + ":latest";
    }

    public String containerName(String botName) {
        return props.getContainer().getContainerNamePrefix() + botName;
    }

    /**
     * {tool} build -t {tag} .（在 contextDir 下执行）
     */
    public CommandResult buildImage(Path contextDir, String imageTag, Consumer<String> lineSink) {
        List<String> cmd = List.of(props.getContainer().getTool(), "build", "-t", imageTag, ".");
        log.info("container build: tag={}, context={}", imageTag, contextDir);
        return commandRunner.run(props.getContainer().getBuildTimeout(), cmd, contextDir, Map.of(), lineSink);
    }

    /**
     * 前台运行容器的 argv：{tool} run --rm --name {name} -p {port}:{port} -e K=V ... {image} [args...]
     */
    public List<String> runArguments(String botName, String imageReference, int port, Map<String, String> env,
                                     List<String> commandOverride) {
        List<String> cmd = new ArrayList<>();
        cmd.add(props.getContainer().getTool());
        cmd.add("run");
        cmd.add("--rm");
        cmd.add("--name");
        cmd.add(containerName(botName));
        cmd.add("-p");
        cmd.add(port + ":" + port);
        if (env != null) {
            env.forEach((k, v) -> {
                cmd.add("-e");
                cmd.add(k + "=" + (v == null ? "" : v));
            });
        }
        cmd.add(imageReference);
        if (commandOverride != null) {
            cmd.addAll(commandOverride);
        }
        return cmd;
    }

    /**
     * {tool} rm -f {name}；容器不存在时工具返回非 0，只记录 debug
     */
    public void removeContainer(String botName) {
        String name = containerName(botName);
        CommandResult res = commandRunner.run(Duration.ofSeconds(30), List.of(props.getContainer().getTool(), "rm", "-f", name));
        if (res.isSuccess()) {
            log.info("container removed: name={}", name);
        } else {
            log.debug("container remove skipped: name={}, exitCode={}, output={}", name, res.getExitCode(), res.getOutput().trim());
        }
    }
}
