package fun.ai.bothost.bot;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * .env 文件解析与合并。
 *
 * <ul>
 *     <li>KEY=VALUE，忽略空行与 # 注释，允许 export 前缀</li>
 *     <li>成对引号去除；单引号内容按字面量处理</li>
 *     <li>${VAR} / $VAR 只展开一层：先查同文件已解析的 key，再查服务进程环境，找不到替换为空串</li>
 *     <li>多个候选文件：靠前的文件优先；调用方覆盖变量优先级最高</li>
 * </ul>
 */
@Component
public class EnvFileParser {
    private static final Logger log = LoggerFactory.getLogger(EnvFileParser.class);

    private static final Pattern VAR_REF = Pattern.compile("\\$\\{([A-Za-z_][A-Za-z0-9_]*)}|\\$([A-Za-z_][A-Za-z0-9_]*)");

    private final Map<String, String> processEnv;

    public EnvFileParser() {
        this(System.getenv());
    }

    public EnvFileParser(Map<String, String> processEnv) {
        this.processEnv = processEnv == null ? Map.of() : processEnv;
    }

    public Map<String, String> parse(String content) {
        Map<String, String> vars = new LinkedHashMap<>();
        if (content == null || content.isEmpty()) {
            return vars;
        }
        for (String rawLine : content.split("\\R")) {
            String line = rawLine.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int idx = line.indexOf('=');
            if (idx <= 0) {
                continue;
            }
            String key = line.substring(0, idx).trim();
            if (key.isEmpty()) {
                continue;
            }
            String value = line.substring(idx + 1).trim();
            if (isQuoted(value, '\'')) {
                vars.put(key, value.substring(1, value.length() - 1));
                continue;
            }
            if (isQuoted(value, '"')) {
                value = value.substring(1, value.length() - 1);
            }
            vars.put(key, expand(value, vars));
        }
        return vars;
    }

    public Map<String, String> parse(byte[] content) {
        if (content == null || content.length == 0) {
            return new LinkedHashMap<>();
        }
        return parse(new String(content, StandardCharsets.UTF_8));
    }

    /**
     * 按候选顺序读取 dir 下的 env 文件并合并（靠前的文件在冲突时胜出）。
     */
    public Map<String, String> discover(Path dir, List<String> candidates) throws IOException {
        Map<String, String> merged = new LinkedHashMap<>();
        if (dir == null || candidates == null) {
            return merged;
        }
        for (String name : candidates) {
            Path f = dir.resolve(name);
            if (!Files.isRegularFile(f)) {
                continue;
            }
            Map<String, String> vars = parse(Files.readString(f, StandardCharsets.UTF_8));
            log.info("env file loaded: file={}, vars={}", f, vars.size());
            vars.forEach(merged::putIfAbsent);
        }
        return merged;
    }

    /**
     * overrides 覆盖 base（均不修改入参）。
     */
    public Map<String, String> merge(Map<String, String> base, Map<String, String> overrides) {
        Map<String, String> merged = new LinkedHashMap<>();
        if (base != null) {
            merged.putAll(base);
        }
        if (overrides != null) {
            overrides.forEach((k, v) -> {
                if (k != null && !k.isBlank()) {
                    merged.put(k.trim(), v == null ? "" : v);
                }
            });
        }
        return merged;
    }

    private String expand(String value, Map<String, String> parsedSoFar) {
        if (value.indexOf('$') < 0) {
            return value;
        }
        Matcher m = VAR_REF.matcher(value);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            String name = m.group(1) != null ? m.group(1) : m.group(2);
            String resolved = parsedSoFar.get(name);
            if (resolved == null) {
                resolved = processEnv.getOrDefault(name, "");
            }
            m.appendReplacement(sb, Matcher.quoteReplacement(resolved));
        }
        m.appendTail(sb);
        return sb.toString();
    }

    private static boolean isQuoted(String value, char quote) {
        return value.length() >= 2 && value.charAt(0) == quote && value.charAt(value.length() - 1) == quote;
    }
}
