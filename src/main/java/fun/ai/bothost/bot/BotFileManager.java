package fun.ai.bothost.bot;

import fun.ai.bothost.common.BotFileTooLargeException;
import fun.ai.bothost.common.BotInvalidPathException;
import fun.ai.bothost.common.BotNotFoundException;
import fun.ai.bothost.entity.response.FunAiBotFileNode;
import fun.ai.bothost.entity.response.FunAiBotFileReadResponse;
import fun.ai.bothost.entity.response.FunAiBotFileTreeResponse;
import fun.ai.bothost.entity.response.FunAiBotProjectAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * bot 工作目录的沙箱文件管理：{storageRoot}/{botName}/...
 * <p>
 * 所有相对路径先 normalize 再做前缀校验，越界一律 {@link BotInvalidPathException}。
 */
@Component
public class BotFileManager {
    private static final Logger log = LoggerFactory.getLogger(BotFileManager.class);

    private static final Pattern BOT_NAME = Pattern.compile("^[A-Za-z0-9_-]+$");
    private static final Set<String> ARCHIVE_EXCLUDES = Set.of("__MACOSX");

    private static final Map<String, String> LANGUAGE_BY_EXTENSION = Map.ofEntries(
            Map.entry("py", "python"),
            Map.entry("js", "javascript"),
            Map.entry("jsx", "javascript"),
            Map.entry("ts", "typescript"),
            Map.entry("tsx", "typescript"),
            Map.entry("json", "json"),
            Map.entry("html", "html"),
            Map.entry("css", "css"),
            Map.entry("scss", "scss"),
            Map.entry("sass", "sass"),
            Map.entry("md", "markdown"),
            Map.entry("yml", "yaml"),
            Map.entry("yaml", "yaml"),
            Map.entry("xml", "xml"),
            Map.entry("sh", "shell"),
            Map.entry("bat", "batch"),
            Map.entry("php", "php"),
            Map.entry("rb", "ruby"),
            Map.entry("go", "go"),
            Map.entry("java", "java"),
            Map.entry("c", "c"),
            Map.entry("cpp", "cpp"),
            Map.entry("h", "c"),
            Map.entry("hpp", "cpp"),
            Map.entry("rs", "rust"),
            Map.entry("sql", "sql"),
            Map.entry("dockerfile", "dockerfile"),
            Map.entry("env", "properties"),
            Map.entry("txt", "plaintext"),
            Map.entry("log", "plaintext")
    );

    private final BotHostProperties props;
    private final EnvFileParser envFileParser;
    private final BotProjectAnalyzer projectAnalyzer;

    public BotFileManager(BotHostProperties props, EnvFileParser envFileParser, BotProjectAnalyzer projectAnalyzer) {
        this.props = props;
        this.envFileParser = envFileParser;
        this.projectAnalyzer = projectAnalyzer;
    }

    /**
     * 幂等创建存储根目录
     */
    public Path ensureRoot() {
        Path root = storageRoot();
        try {
            Files.createDirectories(root);
        } catch (IOException e) {
            throw new RuntimeException("创建存储根目录失败: " + root + ", " + e.getMessage(), e);
        }
        return root;
    }

    public Path storageRoot() {
        return Paths.get(props.getStorageRoot()).toAbsolutePath().normalize();
    }

    public static void validateBotName(String botName) {
        if (botName == null || !BOT_NAME.matcher(botName).matches()) {
            throw new IllegalArgumentException("bot 名称仅允许字母、数字、下划线与中划线: " + botName);
        }
    }

    public Path botDirectory(String botName) {
        validateBotName(botName);
        return storageRoot().resolve(botName).normalize();
    }

    public BotExtractResult extractArchive(byte[] archive, String botName) throws IOException {
        if (archive == null || archive.length == 0) {
            throw new IllegalArgumentException("压缩包不能为空");
        }
        if (archive.length > props.getMaxArchiveBytes()) {
            throw new BotFileTooLargeException("压缩包过大", props.getMaxArchiveBytes());
        }
        ensureRoot();
        Path dir = botDirectory(botName);
        ZipUtils.deleteDirectoryRecursively(dir);
        Files.createDirectories(dir);

        int files;
        try {
            files = ZipUtils.unzipSafely(new ByteArrayInputStream(archive), dir, ARCHIVE_EXCLUDES, ZipUtils.Limits.of(props));
        } catch (IOException | RuntimeException e) {
            // 半解压目录不保留
            deleteAll(botName);
            throw e;
        }
        if (files == 0) {
            deleteAll(botName);
            throw new IllegalArgumentException("压缩包中没有任何文件");
        }
        if (ZipUtils.hoistSingleDirectory(dir)) {
            log.info("archive wrapper directory hoisted: bot={}", botName);
        }

        Map<String, String> env = envFileParser.discover(dir, props.getArchiveEnvFiles());
        FunAiBotProjectAnalysis analysis = projectAnalyzer.analyze(dir);
        log.info("archive extracted: bot={}, dir={}, files={}, envVars={}", botName, dir, files, env.size());
        return new BotExtractResult(dir, env, analysis, files);
    }

    public FunAiBotProjectAnalysis analyze(String botName) {
        return projectAnalyzer.analyze(botDirectory(botName));
    }

    /**
     * 目录根下是否存在构建描述文件（Dockerfile）
     */
    public boolean hasBuildRecipe(Path dir) {
        if (dir == null) return false;
        for (String name : props.getContainer().getRecipeFileNames()) {
            if (Files.isRegularFile(dir.resolve(name))) {
                return true;
            }
        }
        return false;
    }

    public FunAiBotFileTreeResponse listFiles(String botName, Integer maxDepth, Integer maxEntries) {
        Path root = existingBotDirectory(botName);
        int depth = maxDepth == null ? props.getTreeMaxDepth() : Math.max(0, Math.min(32, maxDepth));
        int limit = maxEntries == null ? props.getTreeMaxEntries() : Math.max(1, Math.min(20000, maxEntries));

        Counter counter = new Counter(limit);
        List<FunAiBotFileNode> nodes = listDirRecursive(root, root, depth, new HashSet<>(props.getTreeIgnoredNames()), counter);

        FunAiBotFileTreeResponse resp = new FunAiBotFileTreeResponse();
        resp.setBotName(botName);
        resp.setRootPath(".");
        resp.setMaxDepth(depth);
        resp.setMaxEntries(limit);
        resp.setTruncated(counter.truncated);
        resp.setNodes(nodes);
        return resp;
    }

    public FunAiBotFileReadResponse readFile(String botName, String relativePath) {
        Path root = existingBotDirectory(botName);
        Path file = resolveSafePath(root, relativePath, false);
        if (Files.notExists(file) || Files.isDirectory(file)) {
            throw new BotNotFoundException("文件不存在: " + normalizeRelPath(root, file));
        }
        try {
            long size = Files.size(file);
            if (size > props.getMaxEditableFileBytes()) {
                throw new BotFileTooLargeException("文件过大（" + size + " bytes），暂不支持在线读取", props.getMaxEditableFileBytes());
            }
            FunAiBotFileReadResponse resp = new FunAiBotFileReadResponse();
            resp.setPath(normalizeRelPath(root, file));
            resp.setContent(Files.readString(file, StandardCharsets.UTF_8));
            resp.setLanguage(languageOf(file.getFileName().toString()));
            resp.setSize(size);
            resp.setLastModifiedMs(Files.getLastModifiedTime(file).toMillis());
            return resp;
        } catch (IOException e) {
            throw new RuntimeException("读取文件失败: " + e.getMessage(), e);
        }
    }

    /**
     * 覆盖写入；父目录自动创建。返回轻响应（不回传 content）。
     */
    public FunAiBotFileReadResponse writeFile(String botName, String relativePath, String content) {
        Path root = existingBotDirectory(botName);
        Path file = resolveSafePath(root, relativePath, false);
        if (Files.isDirectory(file)) {
            throw new IllegalArgumentException("目标是目录，无法写入文件: " + normalizeRelPath(root, file));
        }
        byte[] bytes = (content == null ? "" : content).getBytes(StandardCharsets.UTF_8);
        if (bytes.length > props.getMaxEditableFileBytes()) {
            throw new BotFileTooLargeException("内容过大（" + bytes.length + " bytes）", props.getMaxEditableFileBytes());
        }
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.write(file, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            FunAiBotFileReadResponse resp = new FunAiBotFileReadResponse();
            resp.setPath(normalizeRelPath(root, file));
            resp.setLanguage(languageOf(file.getFileName().toString()));
            resp.setSize((long) bytes.length);
            resp.setLastModifiedMs(Files.getLastModifiedTime(file).toMillis());
            return resp;
        } catch (IOException e) {
            throw new RuntimeException("写入文件失败: " + e.getMessage(), e);
        }
    }

    public void createDirectory(String botName, String relativePath) {
        Path root = existingBotDirectory(botName);
        Path d = resolveSafePath(root, relativePath, false);
        if (Files.exists(d) && !Files.isDirectory(d)) {
            throw new IllegalArgumentException("路径已存在且不是目录: " + normalizeRelPath(root, d));
        }
        try {
            Files.createDirectories(d);
        } catch (IOException e) {
            throw new RuntimeException("创建目录失败: " + e.getMessage(), e);
        }
    }

    public void deletePath(String botName, String relativePath) {
        Path root = existingBotDirectory(botName);
        Path target = resolveSafePath(root, relativePath, false);
        if (target.equals(root)) {
            throw new BotInvalidPathException("禁止删除 bot 根目录");
        }
        if (Files.notExists(target)) {
            throw new BotNotFoundException("路径不存在: " + normalizeRelPath(root, target));
        }
        try {
            if (Files.isDirectory(target) && !Files.isSymbolicLink(target)) {
                ZipUtils.deleteDirectoryRecursively(target);
            } else {
                Files.delete(target);
            }
        } catch (IOException e) {
            throw new RuntimeException("删除失败: " + e.getMessage(), e);
        }
    }

    public void movePath(String botName, String fromPath, String toPath, boolean overwrite) {
        Path root = existingBotDirectory(botName);
        Path from = resolveSafePath(root, fromPath, false);
        Path to = resolveSafePath(root, toPath, false);
        if (from.equals(root) || to.equals(root)) {
            throw new BotInvalidPathException("禁止移动 bot 根目录");
        }
        if (Files.notExists(from)) {
            throw new BotNotFoundException("源路径不存在: " + normalizeRelPath(root, from));
        }
        if (to.startsWith(from)) {
            throw new IllegalArgumentException("不能移动到自身子目录: " + normalizeRelPath(root, to));
        }
        try {
            Path parent = to.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (Files.exists(to)) {
                if (!overwrite) {
                    throw new IllegalArgumentException("目标已存在: " + normalizeRelPath(root, to));
                }
                ZipUtils.deleteDirectoryRecursively(to);
            }
            Files.move(from, to, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new RuntimeException("移动失败: " + e.getMessage(), e);
        }
    }

    /**
     * 将 bot 工作目录打包为 zip 写入 out（忽略 node_modules / .git 等）
     */
    public void exportArchive(String botName, OutputStream out) throws IOException {
        Path root = existingBotDirectory(botName);
        ZipUtils.zipDirectory(root, out, new HashSet<>(props.getTreeIgnoredNames()));
    }

    /**
     * 递归删除 bot 目录：失败只记录日志，不抛出
     */
    public void deleteAll(String botName) {
        Path dir;
        try {
            dir = botDirectory(botName);
        } catch (IllegalArgumentException e) {
            log.warn("delete bot files skipped: invalid name={}", botName);
            return;
        }
        try {
            ZipUtils.deleteDirectoryRecursively(dir);
            log.info("bot files deleted: bot={}, dir={}", botName, dir);
        } catch (IOException e) {
            log.warn("delete bot files failed: bot={}, dir={}, error={}", botName, dir, e.getMessage(), e);
        }
    }

    public static String languageOf(String fileName) {
        if (fileName == null) {
            return "plaintext";
        }
        String lower = fileName.toLowerCase(Locale.ROOT);
        if ("dockerfile".equals(lower)) {
            return "dockerfile";
        }
        if (".env".equals(lower) || lower.startsWith(".env.")) {
            return "properties";
        }
        int dot = lower.lastIndexOf('.');
        if (dot < 0 || dot == lower.length() - 1) {
            return "plaintext";
        }
        return LANGUAGE_BY_EXTENSION.getOrDefault(lower.substring(dot + 1), "plaintext");
    }

    private Path existingBotDirectory(String botName) {
        Path dir = botDirectory(botName);
        if (!Files.isDirectory(dir)) {
            throw new BotNotFoundException("bot 目录不存在: " + botName);
        }
        return dir;
    }

    private static class Counter {
        final int limit;
        int used;
        boolean truncated;

        Counter(int limit) {
            this.limit = limit;
        }

        boolean inc() {
            used++;
            return used <= limit;
        }

        boolean allow() {
            if (used < limit) {
                return true;
            }
            truncated = true;
            return false;
        }
    }

    private List<FunAiBotFileNode> listDirRecursive(Path root, Path dir, int depth, Set<String> ignores, Counter counter) {
        if (depth < 0 || !counter.allow()) return List.of();
        try (var stream = Files.list(dir)) {
            List<Path> children = stream
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString().toLowerCase(Locale.ROOT)))
                    .toList();

            List<FunAiBotFileNode> out = new ArrayList<>();
            for (Path p : children) {
                String name = p.getFileName() == null ? "" : p.getFileName().toString();
                if (ignores.contains(name)) continue;
                if (!counter.allow()) break;

                FunAiBotFileNode n = new FunAiBotFileNode();
                n.setName(name);
                n.setPath(normalizeRelPath(root, p));
                n.setLastModifiedMs(safeLastModifiedMs(p));
                if (Files.isDirectory(p)) {
                    n.setType("DIR");
                    // 软链目录不展开
                    if (counter.inc() && depth > 0 && !Files.isSymbolicLink(p)) {
                        n.setChildren(listDirRecursive(root, p, depth - 1, ignores, counter));
                    } else {
                        n.setChildren(List.of());
                    }
                } else {
                    n.setType("FILE");
                    n.setSize(safeSize(p));
                    counter.inc();
                }
                out.add(n);
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("读取目录失败: " + e.getMessage(), e);
        }
    }

    private Long safeLastModifiedMs(Path p) {
        try {
            return Files.getLastModifiedTime(p).toMillis();
        } catch (IOException e) {
            log.debug("read mtime failed: path={}, error={}", p, e.getMessage());
            return null;
        }
    }

    private Long safeSize(Path p) {
        try {
            return Files.size(p);
        } catch (IOException e) {
            log.debug("read size failed: path={}, error={}", p, e.getMessage());
            return null;
        }
    }

    Path resolveSafePath(Path root, String rel, boolean allowEmpty) {
        if (root == null) throw new IllegalArgumentException("root 不能为空");
        String r = rel == null ? "" : rel.trim();
        r = r.replace("\\", "/");
        while (r.startsWith("/")) r = r.substring(1);
        if (!allowEmpty && (r.isEmpty() || ".".equals(r))) {
            throw new IllegalArgumentException("path 不能为空");
        }
        if (r.contains("\0")) {
            throw new BotInvalidPathException("非法 path");
        }
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path resolved = (r.isEmpty() ? normalizedRoot : normalizedRoot.resolve(r)).normalize();
        if (!resolved.startsWith(normalizedRoot)) {
            throw new BotInvalidPathException("非法 path（越出 bot 目录）: " + rel);
        }
        // 软链指向目录外同样视为越界；目标尚不存在时校验最近的已存在祖先（含悬空软链本身）
        Path existing = resolved;
        while (existing != null && !existing.equals(normalizedRoot)
                && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        if (existing != null && Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            try {
                if (!existing.toRealPath().startsWith(normalizedRoot.toRealPath())) {
                    throw new BotInvalidPathException("非法 path（软链越出 bot 目录）: " + rel);
                }
            } catch (IOException e) {
                throw new BotInvalidPathException("无法解析 path: " + rel);
            }
        }
        return resolved;
    }

    private String normalizeRelPath(Path root, Path p) {
        Path rp = root.toAbsolutePath().normalize().relativize(p.toAbsolutePath().normalize());
        String s = rp.toString().replace("\\", "/");
        return s.isEmpty() ? "." : s;
    }
}
