package fun.ai.bothost.bot.deploy;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.bot.BotFileManager;
import fun.ai.bothost.bot.BotHostProperties;
import fun.ai.bothost.bot.BotProjectAnalyzer;
import fun.ai.bothost.bot.BotRecordStore;
import fun.ai.bothost.bot.BotTestArchives;
import fun.ai.bothost.bot.CommandResult;
import fun.ai.bothost.bot.CommandRunner;
import fun.ai.bothost.bot.EnvFileParser;
import fun.ai.bothost.bot.container.BotContainerService;
import fun.ai.bothost.bot.git.BotGitService;
import fun.ai.bothost.bot.log.BotLogAggregator;
import fun.ai.bothost.bot.log.BotStatusBroadcaster;
import fun.ai.bothost.bot.process.BotLockRegistry;
import fun.ai.bothost.bot.process.BotProcessRegistry;
import fun.ai.bothost.common.BotAlreadyRunningException;
import fun.ai.bothost.common.DeploymentFailedException;
import fun.ai.bothost.common.MissingBuildRecipeException;
import fun.ai.bothost.entity.FunAiBot;
import fun.ai.bothost.entity.request.FunAiBotDeployRequest;
import fun.ai.bothost.enums.BotDeploymentSource;
import fun.ai.bothost.enums.BuildStepPolicy;
import fun.ai.bothost.enums.FunAiBotStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BotDeploymentPipelineTest {

    @TempDir
    Path tempDir;

    private BotHostProperties props;
    private BotRecordStore recordStore;
    private BotFileManager fileManager;
    private BotLogAggregator logAggregator;
    private BotGitService gitService;
    private BotContainerService containerService;
    private CommandRunner commandRunner;
    private BotDeploymentPipeline pipeline;

    @BeforeEach
    void setUp() {
        props = new BotHostProperties();
        props.setStorageRoot(tempDir.resolve("deployed_bots").toString());
        EnvFileParser envFileParser = new EnvFileParser(Map.of());
        recordStore = new BotRecordStore(new BotStatusBroadcaster(props, Runnable::run));
        fileManager = new BotFileManager(props, envFileParser, new BotProjectAnalyzer(new ObjectMapper()));
        logAggregator = new BotLogAggregator(props, Runnable::run);
        gitService = mock(BotGitService.class);
        containerService = mock(BotContainerService.class);
        commandRunner = mock(CommandRunner.class);
        pipeline = new BotDeploymentPipeline(props, recordStore, fileManager, envFileParser, gitService,
                containerService, commandRunner, logAggregator, new BotLockRegistry(), new BotProcessRegistry());
    }

    private FunAiBot newBot(String name) {
        FunAiBot draft = new FunAiBot();
        draft.setName(name);
        return recordStore.create(draft);
    }

    private FunAiBotDeployRequest request(String name) {
        FunAiBotDeployRequest req = new FunAiBotDeployRequest();
        req.setName(name);
        return req;
    }

    private List<String> logTexts(String botId) {
        return logAggregator.getAllLines(botId);
    }

    @Nested
    @DisplayName("archive")
    class Archive {

        @Test
        void overrideBeatsArchiveEnvFile() {
            FunAiBot bot = newBot("echo-bot");
            byte[] zip = BotTestArchives.zip("bot.py", "print('hi')", ".env", "KEY=archive\nOTHER=1");

            FunAiBot deployed = pipeline.deployArchive(bot.getId(), request("echo-bot"), zip, Map.of("KEY", "override"));

            assertEquals(FunAiBotStatus.STOPPED, deployed.getStatus());
            assertEquals("override", deployed.getEnvironmentVariables().get("KEY"));
            assertEquals("1", deployed.getEnvironmentVariables().get("OTHER"));
            assertEquals(BotDeploymentSource.ARCHIVE, deployed.getDeploymentSource());
            assertEquals(fileManager.botDirectory("echo-bot").toString(), deployed.getWorkingDirectory());
            assertEquals("bot.py", deployed.getEntryFile());
            assertEquals("python", deployed.getLanguage());
        }

        @Test
        void detectedRunCommandUsedWhenMissing() {
            FunAiBot bot = newBot("auto-bot");
            FunAiBot deployed = pipeline.deployArchive(bot.getId(), request("auto-bot"),
                    BotTestArchives.zip("main.py", "print(1)"), Map.of());
            assertEquals("python3 main.py", deployed.getRunCommand());
            assertTrue(logTexts(bot.getId()).stream().anyMatch(l -> l.contains("using detected command")));
        }

        @Test
        void languageAliasStoredAsCanonicalValue() {
            FunAiBot bot = newBot("alias-bot");
            FunAiBotDeployRequest req = request("alias-bot");
            req.setRunCommand("sh run.sh");
            req.setLanguage("py");
            FunAiBot deployed = pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("run.sh", "echo hi"), null);
            assertEquals("python", deployed.getLanguage());

            req.setLanguage("node");
            FunAiBot redeployed = pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("run.sh", "echo hi"), null);
            assertEquals("nodejs", redeployed.getLanguage());
            assertEquals("nodejs", recordStore.require(bot.getId()).getLanguage());
        }

        @Test
        void explicitRunCommandKept() {
            FunAiBot bot = newBot("cmd-bot");
            FunAiBotDeployRequest req = request("cmd-bot");
            req.setRunCommand("python3 -u main.py --fast");
            FunAiBot deployed = pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("main.py", "print(1)"), null);
            assertEquals("python3 -u main.py --fast", deployed.getRunCommand());
        }

        @Test
        void deploymentLogIsOrdered() {
            FunAiBot bot = newBot("log-bot");
            pipeline.deployArchive(bot.getId(), request("log-bot"), BotTestArchives.zip("bot.py", "x"), Map.of());
            List<String> lines = logTexts(bot.getId());
            assertTrue(lines.get(0).contains("Starting archive deployment"));
            assertTrue(lines.get(lines.size() - 1).contains("Deployment completed successfully - ready to start"));
        }

        @Test
        void invalidArchiveMarksError() {
            FunAiBot bot = newBot("bad-bot");
            assertThrows(IllegalArgumentException.class,
                    () -> pipeline.deployArchive(bot.getId(), request("bad-bot"), new byte[0], Map.of()));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
            assertTrue(logTexts(bot.getId()).stream().anyMatch(l -> l.contains("DEPLOYMENT FAILED: ")));
        }

        @Test
        void redeployAfterErrorSucceeds() {
            FunAiBot bot = newBot("retry-bot");
            assertThrows(IllegalArgumentException.class,
                    () -> pipeline.deployArchive(bot.getId(), request("retry-bot"), new byte[0], Map.of()));
            FunAiBot deployed = pipeline.deployArchive(bot.getId(), request("retry-bot"),
                    BotTestArchives.zip("bot.py", "x"), Map.of());
            assertEquals(FunAiBotStatus.STOPPED, deployed.getStatus());
            // 新一次部署丢弃上次部署日志
            assertTrue(logTexts(bot.getId()).stream().noneMatch(l -> l.contains("DEPLOYMENT FAILED")));
        }

        @Test
        void runningBotCannotBeDeployed() {
            FunAiBot bot = newBot("busy-bot");
            recordStore.transition(bot.getId(), FunAiBotStatus.RUNNING, null);
            assertThrows(BotAlreadyRunningException.class,
                    () -> pipeline.deployArchive(bot.getId(), request("busy-bot"), BotTestArchives.zip("a.py", "x"), Map.of()));
            assertEquals(FunAiBotStatus.RUNNING, recordStore.require(bot.getId()).getStatus());
        }
    }

    @Nested
    @DisplayName("build step")
    class BuildStep {

        @Test
        void buildCommandRunsInWorkingDirectory() {
            when(commandRunner.run(any(), anyList(), any(), anyMap(), any())).thenReturn(new CommandResult(0, "ok"));
            FunAiBot bot = newBot("build-bot");
            FunAiBotDeployRequest req = request("build-bot");
            req.setBuildCommand("pip install -r requirements.txt");

            pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("bot.py", "x", "requirements.txt", ""), Map.of());

            verify(commandRunner).run(eq(props.getBuildTimeout()), eq(List.of("pip", "install", "-r", "requirements.txt")),
                    eq(fileManager.botDirectory("build-bot")), anyMap(), any());
        }

        @Test
        @SuppressWarnings("unchecked")
        void failingBuildRaisesDeploymentFailedWithOutput() {
            when(commandRunner.run(any(), anyList(), any(), anyMap(), any())).thenAnswer(inv -> {
                Consumer<String> sink = inv.getArgument(4);
                sink.accept("ERROR: No matching distribution found for nothing-here");
                return new CommandResult(1, "ERROR: No matching distribution found for nothing-here");
            });
            FunAiBot bot = newBot("broken-build");
            FunAiBotDeployRequest req = request("broken-build");
            req.setBuildCommand("pip install nothing-here");

            DeploymentFailedException e = assertThrows(DeploymentFailedException.class,
                    () -> pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("bot.py", "x"), Map.of()));
            assertTrue(e.getMessage().contains("exit code 1"));
            assertTrue(e.getLogLines().stream().anyMatch(l -> l.contains("BUILD: ERROR: No matching distribution")));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
        }

        @Test
        void skipPolicyIsLoggedNotSilent() {
            props.setBuildPolicy(BuildStepPolicy.SKIP);
            FunAiBot bot = newBot("skip-bot");
            FunAiBotDeployRequest req = request("skip-bot");
            req.setBuildCommand("npm install");

            pipeline.deployArchive(bot.getId(), req, BotTestArchives.zip("index.js", "x"), Map.of());

            verifyNoInteractions(commandRunner);
            assertTrue(logTexts(bot.getId()).stream().anyMatch(l -> l.contains("Build step skipped (policy=SKIP")));
        }
    }

    @Nested
    @DisplayName("repository")
    class Repository {

        private void cloneWrites(Map<String, String> files) throws Exception {
            when(gitService.cloneInto(anyString(), any(Path.class), any())).thenAnswer(inv -> {
                Path dir = inv.getArgument(1);
                Files.createDirectories(dir);
                for (Map.Entry<String, String> f : files.entrySet()) {
                    Files.writeString(dir.resolve(f.getKey()), f.getValue());
                }
                return new CommandResult(0, "Cloning into '" + dir + "'...");
            });
        }

        @Test
        void cloneDiscoversEnvAndRecordsCommit() throws Exception {
            cloneWrites(Map.of("index.js", "console.log(1)", ".env.example", "PREFIX=!\nKEY=example"));
            when(gitService.headCommit(any())).thenReturn("abc1234");
            FunAiBot bot = newBot("repo-bot");
            FunAiBotDeployRequest req = request("repo-bot");
            req.setRepositoryUrl("https://example.com/bots/repo-bot.git");

            FunAiBot deployed = pipeline.deployRepository(bot.getId(), req, Map.of("KEY", "override"));

            assertEquals(FunAiBotStatus.STOPPED, deployed.getStatus());
            assertEquals(BotDeploymentSource.REPOSITORY, deployed.getDeploymentSource());
            assertEquals("https://example.com/bots/repo-bot.git", deployed.getSourceLocator());
            assertEquals("abc1234", deployed.getLastCommit());
            assertEquals("!", deployed.getEnvironmentVariables().get("PREFIX"));
            assertEquals("override", deployed.getEnvironmentVariables().get("KEY"));
            assertEquals("node index.js", deployed.getRunCommand());
        }

        @Test
        void cloneFailureBecomesDeploymentFailed() throws Exception {
            when(gitService.cloneInto(anyString(), any(Path.class), any()))
                    .thenReturn(new CommandResult(128, "fatal: repository not found"));
            FunAiBot bot = newBot("missing-repo");
            FunAiBotDeployRequest req = request("missing-repo");
            req.setRepositoryUrl("https://example.com/none.git");

            DeploymentFailedException e = assertThrows(DeploymentFailedException.class,
                    () -> pipeline.deployRepository(bot.getId(), req, Map.of()));
            assertTrue(e.getMessage().contains("git clone failed"));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
        }

        @Test
        void missingUrlRejected() {
            FunAiBot bot = newBot("no-url");
            assertThrows(IllegalArgumentException.class, () -> pipeline.deployRepository(bot.getId(), request("no-url"), Map.of()));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
        }
    }

    @Nested
    @DisplayName("container")
    class Container {

        @BeforeEach
        void containerNames() {
            when(containerService.imageTag(anyString())).thenAnswer(inv -> "funai-bot-" + inv.getArgument(0) + ":latest");
        }

        @Test
        void missingRecipeRejected() throws Exception {
            when(gitService.cloneInto(anyString(), any(Path.class), any())).thenAnswer(inv -> {
                Path dir = inv.getArgument(1);
                Files.createDirectories(dir);
                Files.writeString(dir.resolve("bot.py"), "x");
                return new CommandResult(0, "");
            });
            FunAiBot bot = newBot("no-recipe");
            FunAiBotDeployRequest req = request("no-recipe");
            req.setRepositoryUrl("https://example.com/no-recipe.git");

            assertThrows(MissingBuildRecipeException.class, () -> pipeline.deployContainer(bot.getId(), req, Map.of()));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
            verify(containerService, never()).buildImage(any(), anyString(), any());
        }

        @Test
        void imageReferenceReplacesWorkingDirectory() throws Exception {
            when(gitService.cloneInto(anyString(), any(Path.class), any())).thenAnswer(inv -> {
                Path dir = inv.getArgument(1);
                Files.createDirectories(dir);
                Files.writeString(dir.resolve("Dockerfile"), "FROM python:3.12\nCMD [\"python\", \"bot.py\"]\n");
                Files.writeString(dir.resolve("bot.py"), "x");
                return new CommandResult(0, "");
            });
            when(containerService.buildImage(any(), anyString(), any())).thenReturn(new CommandResult(0, "built"));
            FunAiBot bot = newBot("docker-bot");
            FunAiBotDeployRequest req = request("docker-bot");
            req.setRepositoryUrl("https://example.com/docker-bot.git");

            FunAiBot deployed = pipeline.deployContainer(bot.getId(), req, Map.of());

            assertEquals(FunAiBotStatus.STOPPED, deployed.getStatus());
            assertEquals("funai-bot-docker-bot:latest", deployed.getImageReference());
            assertNull(deployed.getWorkingDirectory());
            assertEquals(Boolean.TRUE, deployed.getHasBuildRecipe());
        }

        @Test
        void imageBuildFailure() throws Exception {
            when(gitService.cloneInto(anyString(), any(Path.class), any())).thenAnswer(inv -> {
                Path dir = inv.getArgument(1);
                Files.createDirectories(dir);
                Files.writeString(dir.resolve("Dockerfile"), "FROM scratch\n");
                return new CommandResult(0, "");
            });
            when(containerService.buildImage(any(), anyString(), any())).thenReturn(new CommandResult(1, "build error"));
            FunAiBot bot = newBot("docker-broken");
            FunAiBotDeployRequest req = request("docker-broken");
            req.setRepositoryUrl("https://example.com/docker-broken.git");

            assertThrows(DeploymentFailedException.class, () -> pipeline.deployContainer(bot.getId(), req, Map.of()));
            assertEquals(FunAiBotStatus.ERROR, recordStore.require(bot.getId()).getStatus());
        }
    }
}
