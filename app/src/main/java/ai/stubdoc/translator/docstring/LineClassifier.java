package ai.stubdoc.translator.docstring;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies docstring lines into blank, section decoration, list, list-table or plain prose lines.
 * Classification is total: anything unrecognised is plain text.
 */
public class LineClassifier {

    static final String SECTION_DECORATION_SYMBOLS = "=-`:.'\"~^_*+#";
    static final List<String> LIST_MARKERS = List.of("-", "*", "#.", "|");
    static final List<String> LIST_TABLE_MARKERS = List.of(".. list-table::", "* -");

    private static final Pattern ORDERED_LIST_PATTERN = Pattern.compile("^(\\d+\\.) ");

    public ClassifiedLine classify(String line, int lineIndex) {
        String raw = line == null ? "" : line;
        String text = raw.strip();
        if (text.isEmpty()) {
            return new ClassifiedLine(lineIndex, raw, "", "", LineKind.BLANK, "", "");
        }
        String indent = leadingWhitespace(raw);

        if (isSectionDecoration(text)) {
            return new ClassifiedLine(lineIndex, raw, indent, text, LineKind.SECTION_DECORATION, "", text);
        }
        for (String marker : LIST_MARKERS) {
            if (text.startsWith(marker + " ")) {
                return split(lineIndex, raw, indent, text, marker, LineKind.LIST_ITEM);
            }
        }
        Matcher ordered = ORDERED_LIST_PATTERN.matcher(text);
        if (ordered.find()) {
            return split(lineIndex, raw, indent, text, ordered.group(1), LineKind.LIST_ITEM);
        }
        for (String marker : LIST_TABLE_MARKERS) {
            if (text.startsWith(marker + " ")) {
                return split(lineIndex, raw, indent, text, marker, LineKind.LIST_TABLE_ITEM);
            }
        }
        return new ClassifiedLine(lineIndex, raw, indent, text, LineKind.PLAIN, "", text);
    }

    static boolean isSectionDecoration(String text) {
        if (text.isEmpty()) {
            return false;
        }
        char symbol = text.charAt(0);
        if (SECTION_DECORATION_SYMBOLS.indexOf(symbol) < 0) {
            return false;
        }
        for (int i = 1; i < text.length(); i++) {
            if (text.charAt(i) != symbol) {
                return false;
            }
        }
        return true;
    }

    static String leadingWhitespace(String line) {
        int end = 0;
        while (end < line.length() && Character.isWhitespace(line.charAt(end))) {
            end++;
        }
        return line.substring(0, end);
    }

    private ClassifiedLine split(int lineIndex, String raw, String indent, String text, String marker, LineKind kind) {
        // text is stripped, so the body always runs to the end of it
        String body = text.substring(marker.length()).strip();
        String header = text.substring(0, text.length() - body.length());
        return new ClassifiedLine(lineIndex, raw, indent, text, kind, header, body);
    }
}
