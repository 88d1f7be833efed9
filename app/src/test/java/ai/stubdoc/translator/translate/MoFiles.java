package ai.stubdoc.translator.translate;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds gettext {@code .mo} files for tests.
 */
public final class MoFiles {

    public static final String UTF8_HEADER = "Content-Type: text/plain; charset=UTF-8\n";

    private MoFiles() {
    }

    public static Path write(Path localeDir, String language, String domain, Map<String, String> messages) throws IOException {
        Path target = localeDir.resolve(language).resolve("LC_MESSAGES").resolve(domain + ".mo");
        Files.createDirectories(target.getParent());
        Files.write(target, build(messages));
        return target;
    }

    public static byte[] build(Map<String, String> messages) {
        Map<String, String> withHeader = new LinkedHashMap<>();
        withHeader.put("", UTF8_HEADER);
        withHeader.putAll(messages);
        return build(withHeader, ByteOrder.LITTLE_ENDIAN, StandardCharsets.UTF_8);
    }

    public static byte[] build(Map<String, String> entries, ByteOrder order, Charset charset) {
        List<byte[]> originals = new ArrayList<>();
        List<byte[]> translations = new ArrayList<>();
        entries.forEach((original, translation) -> {
            originals.add(original.getBytes(charset));
            translations.add(translation.getBytes(charset));
        });
        int count = originals.size();
        int originalsOffset = 28;
        int translationsOffset = originalsOffset + 8 * count;
        int dataOffset = translationsOffset + 8 * count;
        int size = dataOffset;
        for (int i = 0; i < count; i++) {
            size += originals.get(i).length + 1 + translations.get(i).length + 1;
        }

        ByteBuffer buffer = ByteBuffer.allocate(size).order(order);
        buffer.putInt(0, 0x950412de);
        buffer.putInt(4, 0);
        buffer.putInt(8, count);
        buffer.putInt(12, originalsOffset);
        buffer.putInt(16, translationsOffset);
        buffer.putInt(20, 0);
        buffer.putInt(24, 0);
        int cursor = dataOffset;
        cursor = writeTable(buffer, originalsOffset, originals, cursor);
        writeTable(buffer, translationsOffset, translations, cursor);
        return buffer.array();
    }

    private static int writeTable(ByteBuffer buffer, int tableOffset, List<byte[]> strings, int cursor) {
        for (int i = 0; i < strings.size(); i++) {
            byte[] value = strings.get(i);
            buffer.putInt(tableOffset + 8 * i, value.length);
            buffer.putInt(tableOffset + 8 * i + 4, cursor);
            buffer.put(cursor, value);
            cursor += value.length + 1;
        }
        return cursor;
    }
}
