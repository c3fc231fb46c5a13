package fun.ai.bothost.bot;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.common.BotFileTooLargeException;
import fun.ai.bothost.common.BotInvalidPathException;
import fun.ai.bothost.common.BotNotFoundException;
import fun.ai.bothost.entity.response.FunAiBotFileNode;
import fun.ai.bothost.entity.response.FunAiBotFileReadResponse;
import fun.ai.bothost.entity.response.FunAiBotFileTreeResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BotFileManagerTest {

    @TempDir
    Path tempDir;

    private BotHostProperties props;
    private BotFileManager fileManager;

    @BeforeEach
    void setUp() {
        props = new BotHostProperties();
        props.setStorageRoot(tempDir.resolve("deployed_bots").toString());
        fileManager = new BotFileManager(props, new EnvFileParser(Map.of()), new BotProjectAnalyzer(new ObjectMapper()));
    }

    @Nested
    @DisplayName("extractArchive")
    class ExtractArchive {

        @Test
        void extractsAndDiscoversEnvFiles() throws Exception {
            byte[] zip = BotTestArchives.zip(
                    "bot.py", "print('hi')",
                    ".env", "KEY=archive\nTOKEN=abc",
                    "config.env", "KEY=config\nEXTRA=1");
            BotExtractResult res = fileManager.extractArchive(zip, "echo-bot");

            assertEquals(fileManager.botDirectory("echo-bot"), res.getWorkingDirectory());
            assertEquals(3, res.getFileCount());
            // .env 为主文件：冲突时胜出
            assertEquals("archive", res.getEnvironmentVariables().get("KEY"));
            assertEquals("abc", res.getEnvironmentVariables().get("TOKEN"));
            assertEquals("1", res.getEnvironmentVariables().get("EXTRA"));
            assertEquals("bot.py", res.getAnalysis().getEntryFile());
            assertEquals("python3 bot.py", res.getAnalysis().getSuggestedCommand());
        }

        @Test
        void secondExtractLeavesNoResidue() throws Exception {
            fileManager.extractArchive(BotTestArchives.zip("old.py", "1", "old/data.txt", "x"), "echo-bot");
            BotExtractResult res = fileManager.extractArchive(BotTestArchives.zip("new.py", "2"), "echo-bot");

            Path dir = res.getWorkingDirectory();
            assertTrue(Files.exists(dir.resolve("new.py")));
            assertFalse(Files.exists(dir.resolve("old.py")));
            assertFalse(Files.exists(dir.resolve("old")));
        }

        @Test
        void hoistsSingleWrapperDirectory() throws Exception {
            BotExtractResult res = fileManager.extractArchive(
                    BotTestArchives.zip("project/", "", "project/main.py", "print(1)", "project/.env", "A=1"), "wrapped");
            assertTrue(Files.isRegularFile(res.getWorkingDirectory().resolve("main.py")));
            assertEquals("1", res.getEnvironmentVariables().get("A"));
        }

        @Test
        void rejectsBadInput() {
            assertThrows(IllegalArgumentException.class, () -> fileManager.extractArchive(new byte[0], "bot"));
            assertThrows(IllegalArgumentException.class,
                    () -> fileManager.extractArchive(BotTestArchives.zip("a.py", "1"), "../escape"));
            assertThrows(IllegalArgumentException.class,
                    () -> fileManager.extractArchive(BotTestArchives.zip("empty/", ""), "empty-bot"));
            assertFalse(Files.exists(fileManager.botDirectory("empty-bot")));
        }

        @Test
        void zipSlipLeavesNoDirectory() {
            assertThrows(BotInvalidPathException.class,
                    () -> fileManager.extractArchive(BotTestArchives.zip("../../evil.py", "x"), "slip-bot"));
            assertFalse(Files.exists(fileManager.botDirectory("slip-bot")));
        }

        @Test
        void archiveSizeLimit() {
            props.setMaxArchiveBytes(10);
            assertThrows(BotFileTooLargeException.class,
                    () -> fileManager.extractArchive(BotTestArchives.zip("bot.py", "print('hello world')"), "big-bot"));
        }
    }

    @Nested
    @DisplayName("editor operations")
    class EditorOperations {

        @BeforeEach
        void deploy() throws Exception {
            fileManager.extractArchive(BotTestArchives.zip(
                    "bot.py", "print('hi')",
                    "README.md", "# bot",
                    "src/", "",
                    "src/util.py", "x = 1",
                    "Assets/", "",
                    "Assets/logo.txt", "logo",
                    "node_modules/", "",
                    "node_modules/pkg.js", "ignored"), "editor-bot");
        }

        @Test
        void listFilesOrdersDirectoriesFirst() {
            FunAiBotFileTreeResponse tree = fileManager.listFiles("editor-bot", null, null);
            List<String> names = tree.getNodes().stream().map(FunAiBotFileNode::getName).toList();
            assertEquals(List.of("Assets", "src", "bot.py", "README.md"), names);
            assertFalse(tree.getTruncated());

            FunAiBotFileNode src = tree.getNodes().get(1);
            assertEquals("DIR", src.getType());
            assertEquals("src/util.py", src.getChildren().get(0).getPath());
            assertEquals(5L, src.getChildren().get(0).getSize());
        }

        @Test
        void listFilesTruncates() {
            FunAiBotFileTreeResponse tree = fileManager.listFiles("editor-bot", null, 2);
            assertTrue(tree.getTruncated());
        }

        @Test
        void readFileDetectsLanguage() {
            FunAiBotFileReadResponse resp = fileManager.readFile("editor-bot", "src/util.py");
            assertEquals("x = 1", resp.getContent());
            assertEquals("python", resp.getLanguage());
            assertEquals("src/util.py", resp.getPath());
            assertEquals("markdown", fileManager.readFile("editor-bot", "README.md").getLanguage());
        }

        @Test
        void pathEscapeRejected() {
            assertThrows(BotInvalidPathException.class, () -> fileManager.readFile("editor-bot", "../../etc/passwd"));
            assertThrows(BotInvalidPathException.class, () -> fileManager.readFile("editor-bot", "src/../../other/x"));
            assertThrows(BotInvalidPathException.class, () -> fileManager.writeFile("editor-bot", "../outside.txt", "x"));
            assertThrows(BotInvalidPathException.class, () -> fileManager.deletePath("editor-bot", "../"));
            assertFalse(Files.exists(tempDir.resolve("deployed_bots/outside.txt")));
        }

        @Test
        void symlinkOutsideRootRejected() throws Exception {
            Path secret = tempDir.resolve("secret.txt");
            Files.writeString(secret, "secret");
            Path link = fileManager.botDirectory("editor-bot").resolve("link.txt");
            try {
                Files.createSymbolicLink(link, secret);
            } catch (UnsupportedOperationException | IOException e) {
                // 文件系统不支持软链
                return;
            }
            assertThrows(BotInvalidPathException.class, () -> fileManager.readFile("editor-bot", "link.txt"));
        }

        @Test
        void newFileUnderSymlinkedDirectoryRejected() throws Exception {
            Path outside = tempDir.resolve("outside");
            Files.createDirectories(outside.resolve("sub"));
            Path link = fileManager.botDirectory("editor-bot").resolve("link");
            try {
                Files.createSymbolicLink(link, outside);
            } catch (UnsupportedOperationException | IOException e) {
                // 文件系统不支持软链
                return;
            }

            assertThrows(BotInvalidPathException.class,
                    () -> fileManager.writeFile("editor-bot", "link/sub/x.txt", "x"));
            assertThrows(BotInvalidPathException.class,
                    () -> fileManager.writeFile("editor-bot", "link/x.txt", "x"));
            assertThrows(BotInvalidPathException.class,
                    () -> fileManager.createDirectory("editor-bot", "link/newdir"));
            assertThrows(BotInvalidPathException.class,
                    () -> fileManager.movePath("editor-bot", "bot.py", "link/sub/bot.py", false));
            assertFalse(Files.exists(outside.resolve("sub/x.txt")));
            assertFalse(Files.exists(outside.resolve("x.txt")));
            assertFalse(Files.exists(outside.resolve("sub/bot.py")));
            assertTrue(Files.exists(fileManager.botDirectory("editor-bot").resolve("bot.py")));
        }

        @Test
        void danglingSymlinkRejected() throws Exception {
            Path link = fileManager.botDirectory("editor-bot").resolve("dangling.txt");
            try {
                Files.createSymbolicLink(link, tempDir.resolve("nowhere/target.txt"));
            } catch (UnsupportedOperationException | IOException e) {
                return;
            }
            assertThrows(BotInvalidPathException.class, () -> fileManager.writeFile("editor-bot", "dangling.txt", "x"));
            assertFalse(Files.exists(tempDir.resolve("nowhere")));
        }

        @Test
        void missingFileAndMissingBot() {
            assertThrows(BotNotFoundException.class, () -> fileManager.readFile("editor-bot", "nope.py"));
            assertThrows(BotNotFoundException.class, () -> fileManager.readFile("ghost-bot", "bot.py"));
            assertThrows(BotNotFoundException.class, () -> fileManager.listFiles("ghost-bot", null, null));
        }

        @Test
        void writeCreatesParentsAndEnforcesLimit() {
            fileManager.writeFile("editor-bot", "config/settings.json", "{\"a\":1}");
            assertEquals("{\"a\":1}", fileManager.readFile("editor-bot", "config/settings.json").getContent());

            props.setMaxEditableFileBytes(5);
            assertThrows(BotFileTooLargeException.class, () -> fileManager.writeFile("editor-bot", "big.txt", "123456789"));
            assertThrows(BotFileTooLargeException.class, () -> fileManager.readFile("editor-bot", "config/settings.json"));
        }

        @Test
        void directoryOperations() {
            fileManager.createDirectory("editor-bot", "data/cache");
            assertTrue(Files.isDirectory(fileManager.botDirectory("editor-bot").resolve("data/cache")));

            fileManager.movePath("editor-bot", "src/util.py", "lib/util.py", false);
            assertEquals("x = 1", fileManager.readFile("editor-bot", "lib/util.py").getContent());
            assertThrows(IllegalArgumentException.class, () -> fileManager.movePath("editor-bot", "bot.py", "README.md", false));
            assertThrows(IllegalArgumentException.class, () -> fileManager.movePath("editor-bot", "lib", "lib/inner", false));

            fileManager.deletePath("editor-bot", "lib");
            assertFalse(Files.exists(fileManager.botDirectory("editor-bot").resolve("lib")));
            assertThrows(BotInvalidPathException.class, () -> fileManager.deletePath("editor-bot", "src/.."));
            assertThrows(IllegalArgumentException.class, () -> fileManager.deletePath("editor-bot", "/"));
            assertThrows(BotNotFoundException.class, () -> fileManager.deletePath("editor-bot", "lib"));
        }

        @Test
        void exportAndDeleteAll() throws Exception {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            fileManager.exportArchive("editor-bot", out);
            assertTrue(out.size() > 0);

            fileManager.deleteAll("editor-bot");
            assertFalse(Files.exists(fileManager.botDirectory("editor-bot")));
            // 重复删除不抛异常
            assertDoesNotThrow(() -> fileManager.deleteAll("editor-bot"));
        }
    }

    @Test
    void languageTable() {
        assertEquals("javascript", BotFileManager.languageOf("index.js"));
        assertEquals("typescript", BotFileManager.languageOf("bot.ts"));
        assertEquals("dockerfile", BotFileManager.languageOf("Dockerfile"));
        assertEquals("properties", BotFileManager.languageOf(".env"));
        assertEquals("plaintext", BotFileManager.languageOf("LICENSE"));
        assertEquals("plaintext", BotFileManager.languageOf("data.unknownext"));
    }
}
