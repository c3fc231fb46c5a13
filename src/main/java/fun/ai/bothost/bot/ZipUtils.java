package fun.ai.bothost.bot;

import fun.ai.bothost.common.BotFileTooLargeException;
import fun.ai.bothost.common.BotInvalidPathException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;
import java.util.zip.ZipOutputStream;

/**
 * zip 工具：安全解压（防 Zip Slip / zip bomb）、单层包裹目录上提、目录打包。
 */
public final class ZipUtils {
    private ZipUtils() {}

    /**
     * 解压限制：条目数、单条目解压大小、解压总量。
     */
    public static final class Limits {
        private final int maxEntries;
        private final long maxEntryBytes;
        private final long maxTotalBytes;

        public Limits(int maxEntries, long maxEntryBytes, long maxTotalBytes) {
            this.maxEntries = maxEntries;
            this.maxEntryBytes = maxEntryBytes;
            this.maxTotalBytes = maxTotalBytes;
        }

        public static Limits of(BotHostProperties props) {
            return new Limits(props.getMaxArchiveEntries(), props.getMaxEntryBytes(), props.getMaxExtractedBytes());
        }
    }

    public static void deleteDirectoryRecursively(Path dir) throws IOException {
        if (dir == null || Files.notExists(dir)) return;
        // 不跟随软链：软链本身被删除，目标不受影响
        Files.walkFileTree(dir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                Files.deleteIfExists(file);
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult postVisitDirectory(Path d, IOException exc) throws IOException {
                if (exc != null) throw exc;
                Files.deleteIfExists(d);
                return FileVisitResult.CONTINUE;
            }
        });
    }

    /**
     * 安全解压 zip
     *
     * @param excludeNames 排除的目录/文件名（路径中任一 segment 命中则跳过，如 "__MACOSX"）
     * @return 实际写出的文件数
     */
    public static int unzipSafely(InputStream zipStream, Path destDir, Set<String> excludeNames, Limits limits) throws IOException {
        if (zipStream == null) {
            throw new IllegalArgumentException("zipStream 不能为空");
        }
        if (destDir == null) {
            throw new IllegalArgumentException("destDir 不能为空");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits 不能为空");
        }
        Set<String> excludes = (excludeNames == null) ? Set.of() : excludeNames;
        Path root = destDir.toAbsolutePath().normalize();
        Files.createDirectories(root);

        int entries = 0;
        int files = 0;
        long total = 0;
        byte[] buf = new byte[8192];
        try (ZipInputStream zis = new ZipInputStream(zipStream)) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                String name = entry.getName();
                if (name == null || name.isBlank()) {
                    continue;
                }
                entries++;
                if (entries > limits.maxEntries) {
                    throw new BotFileTooLargeException("压缩包条目数超过上限 " + limits.maxEntries, limits.maxEntries);
                }
                if (shouldExcludeEntry(name, excludes)) {
                    zis.closeEntry();
                    continue;
                }
                Path newPath = resolveEntry(root, name);
                if (entry.isDirectory()) {
                    Files.createDirectories(newPath);
                    zis.closeEntry();
                    continue;
                }
                Path parent = newPath.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                // 头部声明的 size 不可信，按实际读出的字节计数
                long written = 0;
                try (OutputStream os = Files.newOutputStream(newPath,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE)) {
                    int n;
                    while ((n = zis.read(buf)) > 0) {
                        written += n;
                        total += n;
                        if (written > limits.maxEntryBytes) {
                            throw new BotFileTooLargeException("压缩包内文件过大: " + name, limits.maxEntryBytes);
                        }
                        if (total > limits.maxTotalBytes) {
                            throw new BotFileTooLargeException("压缩包解压总量超过上限", limits.maxTotalBytes);
                        }
                        os.write(buf, 0, n);
                    }
                }
                files++;
                zis.closeEntry();
            }
        }
        return files;
    }

    private static Path resolveEntry(Path root, String name) {
        if (name.startsWith("/") || name.startsWith("\\") || name.contains("\0")) {
            throw new BotInvalidPathException("非法zip条目路径: " + name);
        }
        for (String part : name.split("[/\\\\]")) {
            if ("..".equals(part)) {
                throw new BotInvalidPathException("非法zip条目路径: " + name);
            }
        }
        Path p = root.resolve(name).normalize();
        if (!p.startsWith(root) || p.equals(root)) {
            throw new BotInvalidPathException("非法zip条目路径: " + name);
        }
        return p;
    }

    private static boolean shouldExcludeEntry(String entryName, Set<String> excludes) {
        if (entryName == null || excludes == null || excludes.isEmpty()) return false;
        String[] parts = entryName.split("/");
        for (String part : parts) {
            if (part != null && !part.isEmpty() && excludes.contains(part)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 若 dir 下恰好只有一个子目录且没有任何文件（常见于 "项目名/..." 打包方式），把该子目录内容上提到 dir。
     *
     * @return 是否发生了上提
     */
    public static boolean hoistSingleDirectory(Path dir) throws IOException {
        if (dir == null || !Files.isDirectory(dir)) {
            return false;
        }
        List<Path> children = new ArrayList<>();
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(dir)) {
            for (Path p : ds) {
                children.add(p);
            }
        }
        if (children.size() != 1 || !Files.isDirectory(children.get(0)) || Files.isSymbolicLink(children.get(0))) {
            return false;
        }
        // 先改名为临时目录，避免与其子项同名（如 bot/bot.py 与 bot/）冲突
        Path wrapper = children.get(0);
        Path tmp = dir.resolve(".hoist-" + UUID.randomUUID());
        Files.move(wrapper, tmp, StandardCopyOption.ATOMIC_MOVE);
        try (DirectoryStream<Path> ds = Files.newDirectoryStream(tmp)) {
            for (Path p : ds) {
                Files.move(p, dir.resolve(p.getFileName().toString()));
            }
        }
        Files.delete(tmp);
        return true;
    }

    /**
     * 将目录打包为 zip（相对路径写入 zip；不跟随软链）。
     *
     * @param excludeNames 排除的目录/文件名（若相对路径任一 segment 命中则跳过）
     */
    public static void zipDirectory(Path sourceDir, OutputStream out, Set<String> excludeNames) throws IOException {
        if (sourceDir == null || Files.notExists(sourceDir) || !Files.isDirectory(sourceDir)) {
            throw new IOException("sourceDir 不存在或不是目录: " + sourceDir);
        }
        if (out == null) {
            throw new IllegalArgumentException("out 不能为空");
        }
        Set<String> excludes = (excludeNames == null) ? Set.of() : excludeNames;
        ZipOutputStream zos = new ZipOutputStream(out);
        Files.walkFileTree(sourceDir, new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
                if (!d.equals(sourceDir) && excludes.contains(d.getFileName().toString())) {
                    return FileVisitResult.SKIP_SUBTREE;
                }
                return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                if (attrs.isSymbolicLink() || !attrs.isRegularFile() || excludes.contains(file.getFileName().toString())) {
                    return FileVisitResult.CONTINUE;
                }
                String entryName = sourceDir.relativize(file).toString().replace("\\", "/");
                zos.putNextEntry(new ZipEntry(entryName));
                Files.copy(file, zos);
                zos.closeEntry();
                return FileVisitResult.CONTINUE;
            }
        });
        zos.finish();
    }
}
