package fun.ai.bothost.bot;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.ai.bothost.entity.response.FunAiBotProjectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * 项目根目录分析：入口文件、依赖清单、Procfile / Dockerfile，给出推荐启动命令。
 */
@Component
public class BotProjectAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(BotProjectAnalyzer.class);

    private static final List<String> PYTHON_ENTRIES = List.of("main.py", "bot.py", "app.py", "run.py", "start.py", "__main__.py");
    private static final List<String> TS_ENTRIES = List.of("index.ts", "app.ts", "bot.ts", "main.ts", "server.ts");
    private static final List<String> JS_ENTRIES = List.of("index.js", "app.js", "bot.js", "main.js", "server.js", "start.js");
    private static final List<String> DEPENDENCY_MANIFESTS = List.of(
            "requirements.txt", "pyproject.toml", "Pipfile", "setup.py", "package.json");
    private static final List<String> RECIPE_FILES = List.of("Dockerfile", "dockerfile");

    private final ObjectMapper objectMapper;

    public BotProjectAnalyzer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FunAiBotProjectAnalysis analyze(Path dir) {
        FunAiBotProjectAnalysis a = new FunAiBotProjectAnalysis();
        if (dir == null || !Files.isDirectory(dir)) {
            return a;
        }
        a.setHasDependencyManifest(DEPENDENCY_MANIFESTS.stream().anyMatch(f -> Files.isRegularFile(dir.resolve(f))));
        a.setHasEnvFile(Files.isRegularFile(dir.resolve(".env")) || Files.isRegularFile(dir.resolve("config.env")));

        String py = firstExisting(dir, PYTHON_ENTRIES);
        String ts = firstExisting(dir, TS_ENTRIES);
        String js = firstExisting(dir, JS_ENTRIES);
        if (py != null) {
            a.setLanguage("python");
            a.setEntryFile(py);
        } else if (ts != null) {
            a.setLanguage("typescript");
            a.setEntryFile(ts);
        } else if (js != null) {
            a.setLanguage("javascript");
            a.setEntryFile(js);
        }

        boolean npmStart = false;
        Path pkg = dir.resolve("package.json");
        if (Files.isRegularFile(pkg)) {
            try {
                JsonNode root = objectMapper.readTree(Files.readString(pkg, StandardCharsets.UTF_8));
                String main = root.path("main").asText("");
                if (a.getEntryFile() == null && !main.isBlank() && Files.isRegularFile(dir.resolve(main))) {
                    a.setEntryFile(main);
                    a.setLanguage(main.endsWith(".ts") ? "typescript" : "javascript");
                }
                String start = root.path("scripts").path("start").asText("");
                if (!start.isBlank()) {
                    npmStart = true;
                    if (a.getEntryFile() == null && start.startsWith("node ")) {
                        a.setEntryFile(start.substring("node ".length()).trim());
                        a.setLanguage("javascript");
                    }
                }
            } catch (IOException e) {
                log.warn("analyze package.json failed: dir={}, error={}", dir, e.getMessage());
            }
        }

        Path procfile = dir.resolve("Procfile");
        if (Files.isRegularFile(procfile)) {
            a.setHasProcfile(true);
            a.setProcfileCommand(readProcfileWeb(procfile));
        }

        for (String recipe : RECIPE_FILES) {
            Path f = dir.resolve(recipe);
            if (Files.isRegularFile(f)) {
                a.setHasBuildRecipe(true);
                a.setRecipeCommand(readLastCmd(f));
                break;
            }
        }

        a.setSuggestedCommand(suggest(a, npmStart));
        return a;
    }

    private static String suggest(FunAiBotProjectAnalysis a, boolean npmStart) {
        if (a.getProcfileCommand() != null && !a.getProcfileCommand().isBlank()) {
            return a.getProcfileCommand();
        }
        String entry = a.getEntryFile();
        if (entry == null) {
            return npmStart ? "npm start" : null;
        }
        String lower = entry.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".py")) {
            return "python3 " + entry;
        }
        if (lower.endsWith(".ts")) {
            return "npx tsx " + entry;
        }
        if (npmStart) {
            return "npm start";
        }
        return "node " + entry;
    }

    private static String firstExisting(Path dir, List<String> candidates) {
        for (String c : candidates) {
            if (Files.isRegularFile(dir.resolve(c))) {
                return c;
            }
        }
        return null;
    }

    private static String readProcfileWeb(Path procfile) {
        try {
            for (String line : Files.readAllLines(procfile, StandardCharsets.UTF_8)) {
                String t = line.trim();
                if (t.startsWith("web:")) {
                    return t.substring("web:".length()).trim();
                }
            }
        } catch (IOException e) {
            log.warn("read Procfile failed: file={}, error={}", procfile, e.getMessage());
        }
        return null;
    }

    /**
     * Dockerfile 最后一个 CMD；exec 形式 ["python", "bot.py"] 转换为空格拼接。
     */
    private static String readLastCmd(Path dockerfile) {
        String cmd = null;
        try {
            for (String line : Files.readAllLines(dockerfile, StandardCharsets.UTF_8)) {
                String t = line.trim();
                if (t.regionMatches(true, 0, "CMD ", 0, 4)) {
                    cmd = t.substring(4).trim();
                }
            }
        } catch (IOException e) {
            log.warn("read Dockerfile failed: file={}, error={}", dockerfile, e.getMessage());
            return null;
        }
        if (cmd != null && cmd.startsWith("[") && cmd.endsWith("]")) {
            cmd = cmd.substring(1, cmd.length() - 1).replace("\"", "").replaceAll("\\s*,\\s*", " ").trim();
        }
        return cmd;
    }
}
