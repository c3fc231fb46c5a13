package fun.ai.bothost.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.bot.BotFileManager;
import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.BotProjectAnalyzer;
import fun.ai.bothost.bot.BotRecordStore;
import fun.ai.bothost.bot.BotTestArchives;
import fun.ai.bothost.bot.CommandRunner;
import fun.ai.bothost.bot.EnvFileParser;
import fun.ai.bothost.bot.container.BotContainerService;
import fun.ai.bothost.bot.deploy.BotDeploymentPipeline;
import fun.ai.bothost.bot.git.BotGitService;
import fun.ai.bothost.bot.log.BotEventChannel;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.log.BotStatusBroadcaster;
import fun.ai.bothost.bot.log.BotStatusEvent;
import fun.ai.bothost.bot.process.BotLockRegistry;
import fun.ai.bothost.bot.process.BotProcessRegistry;
import fun.ai.bothost.bot.process.BotProcessSupervisor;
import fun.ai.bothost.common.BotNotFoundException;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.entity.request.FunAiBotUpdateRequest;
import fun.ai.bothost.entity.response.FunAiBotHealthResponse;
import fun.ai.bothost.entity.response.FunAiSystemStatsResponse;
import fun.ai.bothost.enums.FunAiBotStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

/**
 * 组件真实装配（git / 容器除外），走一遍 部署 -> 启动 -> 日志 -> 停止 -> 删除
 */
@EnabledOnOs({OS.LINUX, OS.MAC})
class FunAiBotServiceImplTest {

    @TempDir
    Path tempDir;

    private BotHostProperties props;
    private BotRecordStore recordStore;
    private BotProcessRegistry processRegistry;
    private BotLogAggregator logAggregator;
    private BotStatusBroadcaster statusBroadcaster;
    private BotProcessSupervisor supervisor;
    private ExecutorService ioExecutor;
    private ScheduledExecutorService restartScheduler;
    private FunAiBotServiceImpl service;

    @BeforeEach
    void setUp() {
        props = new BotHostProperties();
        props.setStorageRoot(tempDir.resolve("deployed_bots").toString());
        props.setStopTimeout(Duration.ofSeconds(3));
        props.setRestartDelay(Duration.ofMillis(50));

        EnvFileParser envFileParser = new EnvFileParser(Map.of());
        statusBroadcaster = new BotStatusBroadcaster(props, Runnable::run);
        recordStore = new BotRecordStore(statusBroadcaster);
        processRegistry = new BotProcessRegistry();
        BotLockRegistry lockRegistry = new BotLockRegistry();
        logAggregator = new BotLogAggregator(props, Runnable::run);
        BotFileManager fileManager = new BotFileManager(props, envFileParser, new BotProjectAnalyzer(new ObjectMapper()));
        BotContainerService containerService = mock(BotContainerService.class);
        ioExecutor = Executors.newCachedThreadPool();
        restartScheduler = Executors.newSingleThreadScheduledExecutor();

        BotDeploymentPipeline pipeline = new BotDeploymentPipeline(props, recordStore, fileManager, envFileParser,
                mock(BotGitService.class), containerService, mock(CommandRunner.class), logAggregator, lockRegistry, processRegistry);
        supervisor = new BotProcessSupervisor(props, recordStore, processRegistry, lockRegistry, logAggregator,
                containerService, ioExecutor, restartScheduler);
        service = new FunAiBotServiceImpl(recordStore, pipeline, supervisor, processRegistry, lockRegistry,
                fileManager, logAggregator, statusBroadcaster, envFileParser);
    }

    @AfterEach
    void tearDown() {
        supervisor.shutdown();
        restartScheduler.shutdownNow();
        ioExecutor.shutdownNow();
    }

    private FunAiBot deployEchoBot(String name) {
        FunAiBotDeployRequest req = new FunAiBotDeployRequest();
        req.setName(name);
        req.setRunCommand("sh run.sh");
        req.setEnvironmentVariables(Map.of("GREETING", "hello"));
        byte[] zip = BotTestArchives.zip(
                "run.sh", "echo \"$GREETING from $TOKEN\"\nexec sleep 30\n",
                ".env", "TOKEN=archive\nGREETING=ignored");
        return service.deployArchive(req, zip, "TOKEN=envfile".getBytes(StandardCharsets.UTF_8));
    }

    private static void await(String what, java.util.function.BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(10).toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("timed out waiting for " + what);
            }
            Thread.sleep(20);
        }
    }

    @Test
    void fullLifecycle() throws Exception {
        FunAiBot deployed = deployEchoBot("echo-bot");
        assertEquals(FunAiBotStatus.STOPPED, deployed.getStatus());
        // 请求 env > env 文件 > 压缩包内 .env
        assertEquals("hello", deployed.getEnvironmentVariables().get("GREETING"));
        assertEquals("envfile", deployed.getEnvironmentVariables().get("TOKEN"));

        List<BotStatusEvent> events = new CopyOnWriteArrayList<>();
        BotEventChannel.Subscription sub = service.subscribeStatus(deployed.getId(), events::add);

        service.start(deployed.getId());
        await("bot output", () -> service.getLogs(deployed.getId()).getLines().stream()
                .anyMatch(l -> l.contains("hello from envfile")));

        FunAiBotHealthResponse health = service.healthCheck(deployed.getId());
        assertEquals(FunAiBotStatus.RUNNING, health.getStatus());
        assertEquals(supervisor.portFor(deployed.getId()), health.getPort());
        assertNotNull(health.getProcessId());

        service.stop(deployed.getId(), false);
        assertEquals(FunAiBotStatus.STOPPED, service.getBot(deployed.getId()).getStatus());
        sub.unsubscribe();
        assertEquals(List.of(FunAiBotStatus.RUNNING, FunAiBotStatus.STOPPED),
                events.stream().map(BotStatusEvent::getTo).toList());

        service.delete(deployed.getId());
        assertThrows(BotNotFoundException.class, () -> service.getBot(deployed.getId()));
        assertFalse(Files.exists(Path.of(props.getStorageRoot(), "echo-bot")));
    }

    @Test
    void redeployReusesRecordByName() {
        FunAiBot first = deployEchoBot("same-bot");
        FunAiBot second = deployEchoBot("same-bot");
        assertEquals(first.getId(), second.getId());
        assertEquals(1, service.listBots().size());
    }

    @Test
    void deleteRunningBotStopsItFirst() throws Exception {
        FunAiBot bot = deployEchoBot("doomed-bot");
        service.start(bot.getId());
        assertEquals(1, processRegistry.size());

        service.delete(bot.getId());

        assertEquals(0, processRegistry.size());
        assertTrue(service.listBots().isEmpty());
        assertTrue(logAggregator.getAll(bot.getId()).isEmpty());
    }

    @Test
    void concurrentDeleteAndStartLeaveNoProcess() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int round = 0; round < 5; round++) {
                FunAiBot bot = deployEchoBot("contested-bot-" + round);
                CountDownLatch go = new CountDownLatch(1);
                Future<?> deleted = callers.submit(() -> {
                    go.await();
                    service.delete(bot.getId());
                    return null;
                });
                Future<Boolean> started = callers.submit(() -> {
                    go.await();
                    try {
                        service.start(bot.getId());
                        return true;
                    } catch (BotNotFoundException e) {
                        return false;
                    }
                });
                go.countDown();

                deleted.get(20, TimeUnit.SECONDS);
                started.get(20, TimeUnit.SECONDS);

                // 无论谁先拿到锁，删除完成后都不能留下进程或记录
                assertEquals(0, processRegistry.size());
                assertThrows(BotNotFoundException.class, () -> service.getBot(bot.getId()));
                assertThrows(BotNotFoundException.class, () -> service.start(bot.getId()));
                assertEquals(0, processRegistry.size());
                assertFalse(Files.exists(tempDir.resolve("deployed_bots").resolve(bot.getName())));
            }
        } finally {
            callers.shutdownNow();
        }
        assertTrue(service.listBots().isEmpty());
    }

    @Test
    void updateMergesEnvironmentAndKeepsStatus() {
        FunAiBot bot = deployEchoBot("upd-bot");
        FunAiBotUpdateRequest req = new FunAiBotUpdateRequest();
        req.setBotId(bot.getId());
        req.setRunCommand("sh other.sh");
        req.setAutoRestart(false);
        req.setLanguage("py");
        req.setEnvironmentVariables(Map.of("TOKEN", "rotated"));

        FunAiBot updated = service.updateBot(req);

        assertEquals("sh other.sh", updated.getRunCommand());
        assertFalse(updated.isAutoRestartEnabled());
        assertEquals("python", updated.getLanguage());
        assertEquals("rotated", updated.getEnvironmentVariables().get("TOKEN"));
        assertEquals("hello", updated.getEnvironmentVariables().get("GREETING"));
        assertEquals(FunAiBotStatus.STOPPED, updated.getStatus());
    }

    @Test
    void updateRejectsUnknownLanguage() {
        FunAiBot bot = deployEchoBot("lang-bot");
        FunAiBotUpdateRequest req = new FunAiBotUpdateRequest();
        req.setBotId(bot.getId());
        req.setLanguage("cobol");
        assertThrows(IllegalArgumentException.class, () -> service.updateBot(req));
    }

    @Test
    void repositoryDeployRequiresSafeUrl() {
        FunAiBotDeployRequest req = new FunAiBotDeployRequest();
        req.setName("repo-bot");
        req.setRepositoryUrl("--upload-pack=touch /tmp/pwned");
        assertThrows(IllegalArgumentException.class, () -> service.deployRepository(req));
        assertTrue(service.listBots().isEmpty());
    }

    @Test
    void fileOperationsAreScopedToBot() {
        FunAiBot bot = deployEchoBot("files-bot");
        service.writeBotFile(bot.getId(), "src/app.py", "print('x')");
        assertEquals("print('x')", service.readBotFile(bot.getId(), "src/app.py").getContent());
        assertEquals(bot.getId(), service.listBotFiles(bot.getId(), null, null).getBotId());
        service.movePath(bot.getId(), "src/app.py", "app.py", false);
        assertEquals("print('x')", service.readBotFile(bot.getId(), "app.py").getContent());
    }

    @Test
    void systemStatsCountsByStatus() {
        deployEchoBot("stats-a");
        deployEchoBot("stats-b");
        FunAiSystemStatsResponse stats = service.systemStats();
        assertEquals(2, stats.getTotalBots());
        assertEquals(2, stats.getStoppedBots());
        assertEquals(0, stats.getRunningBots());
        assertNotNull(stats.getUptime());
    }
}
