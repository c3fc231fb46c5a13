package fun.ai.bothost.bot;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * EnvFileParser 单元测试
 */
class EnvFileParserTest {

    private EnvFileParser parser;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        parser = new EnvFileParser(Map.of("HOME", "/home/bot", "SHELL_ONLY", "from-process"));
    }

    @Test
    void testParseBasicLines() {
        Map<String, String> vars = parser.parse("""
                # comment
                TOKEN=abc123

                export MODE=prod
                  SPACED = value with spaces  
                NOEQUALS
                =novalue
                """);
        assertEquals("abc123", vars.get("TOKEN"));
        assertEquals("prod", vars.get("MODE"));
        assertEquals("value with spaces", vars.get("SPACED"));
        assertEquals(3, vars.size());
        assertEquals(List.of("TOKEN", "MODE", "SPACED"), List.copyOf(vars.keySet()));
    }

    @Test
    void testQuotesAndExpansion() {
        Map<String, String> vars = parser.parse("""
                BASE=/opt/bot
                DATA="${BASE}/data"
                LOGS=$BASE/logs
                LITERAL='${BASE}/raw'
                HOME_DIR=${HOME}
                MISSING=x${NOPE}y
                """);
        assertEquals("/opt/bot/data", vars.get("DATA"));
        assertEquals("/opt/bot/logs", vars.get("LOGS"));
        // 单引号按字面量
        assertEquals("${BASE}/raw", vars.get("LITERAL"));
        // 文件内未定义时回退到进程环境变量
        assertEquals("/home/bot", vars.get("HOME_DIR"));
        // 无法解析 -> 空串
        assertEquals("xy", vars.get("MISSING"));
    }

    @Test
    void testDiscoverEarlierCandidateWins() throws Exception {
        Files.writeString(tempDir.resolve(".env"), "KEY=primary\nONLY_ENV=1\n");
        Files.writeString(tempDir.resolve("config.env"), "KEY=secondary\nONLY_CONFIG=2\n");

        Map<String, String> vars = parser.discover(tempDir, List.of(".env", "config.env", ".env.example"));
        assertEquals("primary", vars.get("KEY"));
        assertEquals("1", vars.get("ONLY_ENV"));
        assertEquals("2", vars.get("ONLY_CONFIG"));
    }

    @Test
    void testDiscoverMissingFilesIsEmpty() throws Exception {
        assertTrue(parser.discover(tempDir, List.of(".env")).isEmpty());
    }

    @Test
    void testMergeOverridesWin() {
        Map<String, String> merged = parser.merge(Map.of("KEY", "archive", "A", "1"), Map.of("KEY", "override"));
        assertEquals("override", merged.get("KEY"));
        assertEquals("1", merged.get("A"));
    }

    @Test
    void testParseBytes() {
        assertEquals("v", parser.parse("K=v".getBytes()).get("K"));
        assertTrue(parser.parse((byte[]) null).isEmpty());
    }
}
