package fun.ai.bothost.bot;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * 测试用 zip 构造
 */
public final class BotTestArchives {

    private BotTestArchives() {
    }

    /**
     * @param entries 条目名 -> 内容；以 / 结尾的条目名写为目录
     */
    public static byte[] zip(Map<String, String> entries) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream();
        try (ZipOutputStream zos = new ZipOutputStream(bos)) {
            for (Map.Entry<String, String> e : entries.entrySet()) {
                zos.putNextEntry(new ZipEntry(e.getKey()));
                if (!e.getKey().endsWith("/")) {
                    zos.write(e.getValue().getBytes(StandardCharsets.UTF_8));
                }
                zos.closeEntry();
            }
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return bos.toByteArray();
    }

    public static byte[] zip(String... nameContentPairs) {
        Map<String, String> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < nameContentPairs.length; i += 2) {
            m.put(nameContentPairs[i], nameContentPairs[i + 1]);
        }
        return zip(m);
    }
}
