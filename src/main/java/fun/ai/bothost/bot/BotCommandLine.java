package fun.ai.bothost.bot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 启动 / 构建命令的结构化解析结果。
 * <p>
 * 规则：
 * <ul>
 *     <li>空白分词；单引号内全部按字面量；双引号内仅 \" \\ \$ \` 可转义；引号外反斜杠转义下一个字符</li>
 *     <li>引号未闭合直接报错</li>
 *     <li>开头的 KEY=VALUE 赋值移入环境变量</li>
 *     <li>出现未被引号保护的 shell 语法（管道、&&、;、重定向、$ 展开、反引号、通配符）时，
 *     整条命令交给 shell -c 执行，否则直接 exec argv（不经过 shell）</li>
 * </ul>
 */
public final class BotCommandLine {

    private static final Pattern ASSIGNMENT = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)=(.*)$", Pattern.DOTALL);
    private static final Pattern FIRST_WORD = Pattern.compile("^(\\s*)(\\S+)");
    private static final String SHELL_OPERATOR_CHARS = ";|&<>()*";

    private final String raw;
    private final List<String> arguments;
    private final Map<String, String> environment;
    private final boolean shellRequired;

    private BotCommandLine(String raw, List<String> arguments, Map<String, String> environment, boolean shellRequired) {
        this.raw = raw;
        this.arguments = Collections.unmodifiableList(arguments);
        this.environment = Collections.unmodifiableMap(environment);
        this.shellRequired = shellRequired;
    }

    public static BotCommandLine parse(String commandLine) {
        if (commandLine == null || commandLine.isBlank()) {
            throw new IllegalArgumentException("命令不能为空");
        }
        String raw = commandLine.trim();
        List<String> tokens = new ArrayList<>();
        // 记录 token 的 = 之前是否出现过引号/转义：'KEY=V' 或 \KEY=V 不视为赋值
        List<Boolean> quotedTokens = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        boolean inToken = false;
        boolean tokenQuoted = false;
        boolean shell = false;
        char quote = 0;

        for (int i = 0; i < raw.length(); i++) {
            char c = raw.charAt(i);
            if (quote == '\'') {
                if (c == '\'') {
                    quote = 0;
                } else {
                    cur.append(c);
                }
                continue;
            }
            if (quote == '"') {
                if (c == '"') {
                    quote = 0;
                } else if (c == '\\' && i + 1 < raw.length() && "\"\\$`".indexOf(raw.charAt(i + 1)) >= 0) {
                    cur.append(raw.charAt(++i));
                } else {
                    if (c == '$' || c == '`') {
                        shell = true;
                    }
                    cur.append(c);
                }
                continue;
            }
            if (Character.isWhitespace(c)) {
                if (inToken) {
                    tokens.add(cur.toString());
                    quotedTokens.add(tokenQuoted);
                    cur.setLength(0);
                    inToken = false;
                    tokenQuoted = false;
                }
                continue;
            }
            inToken = true;
            if (c == '\'' || c == '"') {
                quote = c;
                if (cur.indexOf("=") < 0) {
                    tokenQuoted = true;
                }
            } else if (c == '\\') {
                if (i + 1 < raw.length()) {
                    if (cur.indexOf("=") < 0) {
                        tokenQuoted = true;
                    }
                    cur.append(raw.charAt(++i));
                } else {
                    cur.append(c);
                }
            } else {
                if (c == '$' || c == '`' || SHELL_OPERATOR_CHARS.indexOf(c) >= 0
                        || (c == '#' && cur.length() == 0) || (c == '~' && cur.length() == 0)) {
                    shell = true;
                }
                cur.append(c);
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("命令引号未闭合: " + raw);
        }
        if (inToken) {
            tokens.add(cur.toString());
            quotedTokens.add(tokenQuoted);
        }

        Map<String, String> env = new LinkedHashMap<>();
        int first = 0;
        if (!shell) {
            while (first < tokens.size() && !quotedTokens.get(first)) {
                Matcher m = ASSIGNMENT.matcher(tokens.get(first));
                if (!m.matches()) {
                    break;
                }
                env.put(m.group(1), m.group(2));
                first++;
            }
            if (first >= tokens.size()) {
                throw new IllegalArgumentException("命令缺少可执行程序: " + raw);
            }
        }
        List<String> args = new ArrayList<>(tokens.subList(shell ? 0 : first, tokens.size()));
        return new BotCommandLine(raw, args, env, shell);
    }

    /**
     * 生成最终 argv：需要 shell 时为 [shell, -c, raw]，否则为解析后的参数；
     * 解释器别名只替换第一个词（如 python -> python3）。
     */
    public List<String> toArgv(String shellBinary, Map<String, String> interpreterAliases) {
        Map<String, String> aliases = interpreterAliases == null ? Map.of() : interpreterAliases;
        if (shellRequired) {
            String script = raw;
            Matcher m = FIRST_WORD.matcher(raw);
            if (m.find() && aliases.containsKey(m.group(2))) {
                script = m.group(1) + aliases.get(m.group(2)) + raw.substring(m.end());
            }
            String sh = (shellBinary == null || shellBinary.isBlank()) ? "/bin/sh" : shellBinary;
            return List.of(sh, "-c", script);
        }
        List<String> argv = new ArrayList<>(arguments);
        argv.set(0, aliases.getOrDefault(argv.get(0), argv.get(0)));
        return argv;
    }

    public String getRaw() {
        return raw;
    }

    public List<String> getArguments() {
        return arguments;
    }

    /**
     * 命令开头的 KEY=VALUE 赋值（仅非 shell 模式；shell 模式由 shell 自行处理）
     */
    public Map<String, String> getEnvironment() {
        return environment;
    }

    public boolean isShellRequired() {
        return shellRequired;
    }

    @Override
    public String toString() {
        return shellRequired ? "sh -c " + raw : String.join(" ", arguments);
    }
}
