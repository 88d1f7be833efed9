package ai.stubdoc.translator.translate;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads GNU gettext binary message catalogs ({@code .mo} files).
 *
 * <p>Only plain singular entries are kept. Entries with a message context, plural entries and the header entry
 * are skipped; an entry with an empty translation counts as untranslated.
 */
public class MoCatalogLoader {

    private static final Logger LOGGER = LoggerFactory.getLogger(MoCatalogLoader.class);

    static final int MAGIC = 0x950412de;
    private static final int HEADER_SIZE = 20;
    private static final char CONTEXT_SEPARATOR = '\u0004';
    private static final Pattern CHARSET_PATTERN = Pattern.compile("charset=([^\\s;]+)", Pattern.CASE_INSENSITIVE);

    /**
     * Resolves {@code <localeDir>/<language>/LC_MESSAGES/<domain>.mo}, trying less specific language tags
     * ({@code ja_JP.UTF-8}, {@code ja_JP}, {@code ja}) until a file exists.
     */
    public Path resolve(Path localeDir, String language, String domain) {
        Objects.requireNonNull(localeDir, "localeDir");
        requireNonBlank(language, "language");
        requireNonBlank(domain, "domain");
        List<String> candidates = expandLanguage(language);
        for (String candidate : candidates) {
            Path path = localeDir.resolve(candidate).resolve("LC_MESSAGES").resolve(domain + ".mo");
            if (Files.isRegularFile(path)) {
                return path;
            }
        }
        throw new CatalogException("No translation file found for domain '" + domain + "' and language '"
                + language + "' under " + localeDir);
    }

    public MessageCatalog load(Path localeDir, String language, String domain) {
        return load(resolve(localeDir, language, domain));
    }

    public MessageCatalog load(Path moFile) {
        Objects.requireNonNull(moFile, "moFile");
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(moFile);
        } catch (IOException ex) {
            throw new CatalogException("Failed to read message catalog: " + moFile, ex);
        }
        MapMessageCatalog catalog = parse(bytes, moFile.toString());
        LOGGER.info("Loaded {} messages from {}", catalog.size(), moFile);
        return catalog;
    }

    MapMessageCatalog parse(byte[] bytes, String source) {
        if (bytes.length < HEADER_SIZE) {
            throw new CatalogException("Message catalog is truncated: " + source);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
        int magic = buffer.getInt(0);
        if (magic != MAGIC) {
            buffer.order(ByteOrder.BIG_ENDIAN);
            if (buffer.getInt(0) != MAGIC) {
                throw new CatalogException("Not a gettext message catalog: " + source);
            }
        }
        int revision = buffer.getInt(4);
        int major = revision >>> 16;
        if (major > 1) {
            throw new CatalogException("Unsupported message catalog revision " + major + ": " + source);
        }
        int count = buffer.getInt(8);
        int originalsOffset = buffer.getInt(12);
        int translationsOffset = buffer.getInt(16);
        if (count < 0 || !fitsTable(buffer, originalsOffset, count) || !fitsTable(buffer, translationsOffset, count)) {
            throw new CatalogException("Corrupt message catalog entry count: " + source);
        }

        List<byte[]> originals = new ArrayList<>(count);
        List<byte[]> translations = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            originals.add(readEntry(buffer, originalsOffset, i, source));
            translations.add(readEntry(buffer, translationsOffset, i, source));
        }

        Charset charset = StandardCharsets.UTF_8;
        for (int i = 0; i < count; i++) {
            if (originals.get(i).length == 0) {
                charset = charsetOf(new String(translations.get(i), StandardCharsets.US_ASCII));
                break;
            }
        }

        Map<String, String> messages = new LinkedHashMap<>();
        for (int i = 0; i < count; i++) {
            String original = new String(originals.get(i), charset);
            String translation = new String(translations.get(i), charset);
            if (original.isEmpty() || original.indexOf('\0') >= 0 || original.indexOf(CONTEXT_SEPARATOR) >= 0) {
                continue;
            }
            if (translation.isEmpty()) {
                continue;
            }
            messages.put(original, translation);
        }
        return new MapMessageCatalog(messages);
    }

    private static boolean fitsTable(ByteBuffer buffer, int tableOffset, int count) {
        return tableOffset >= 0 && (long) tableOffset + 8L * count <= buffer.limit();
    }

    private byte[] readEntry(ByteBuffer buffer, int tableOffset, int index, String source) {
        long descriptor = (long) tableOffset + 8L * index;
        if (tableOffset < 0 || descriptor + 8 > buffer.limit()) {
            throw new CatalogException("Corrupt message catalog table: " + source);
        }
        int length = buffer.getInt((int) descriptor);
        int offset = buffer.getInt((int) descriptor + 4);
        if (length < 0 || offset < 0 || (long) offset + length > buffer.limit()) {
            throw new CatalogException("Corrupt message catalog entry " + index + ": " + source);
        }
        byte[] value = new byte[length];
        buffer.get(offset, value);
        return value;
    }

    static Charset charsetOf(String header) {
        for (String line : header.split("\n")) {
            if (!line.toLowerCase(Locale.ROOT).startsWith("content-type:")) {
                continue;
            }
            Matcher matcher = CHARSET_PATTERN.matcher(line);
            if (matcher.find()) {
                try {
                    return Charset.forName(matcher.group(1));
                } catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
                    throw new CatalogException("Unsupported message catalog charset: " + matcher.group(1), ex);
                }
            }
        }
        return StandardCharsets.UTF_8;
    }

    static List<String> expandLanguage(String language) {
        String tag = language.trim();
        String modifier = "";
        int at = tag.indexOf('@');
        if (at >= 0) {
            modifier = tag.substring(at);
            tag = tag.substring(0, at);
        }
        String codeset = "";
        int dot = tag.indexOf('.');
        if (dot >= 0) {
            codeset = tag.substring(dot);
            tag = tag.substring(0, dot);
        }
        String territory = "";
        int underscore = tag.indexOf('_');
        if (underscore >= 0) {
            territory = tag.substring(underscore);
            tag = tag.substring(0, underscore);
        }

        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(tag + territory + codeset + modifier);
        candidates.add(tag + territory + modifier);
        candidates.add(tag + territory);
        candidates.add(tag + modifier);
        candidates.add(tag);
        return List.copyOf(candidates);
    }

    private static void requireNonBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }
}
