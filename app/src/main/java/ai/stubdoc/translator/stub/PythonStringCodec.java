package ai.stubdoc.translator.stub;

import java.util.Optional;

/**
 * Converts between the body of a triple-quoted Python text literal and the string value it denotes.
 */
public class PythonStringCodec {

    /**
     * Decodes escape sequences. Raw bodies are returned as written; unknown escapes are kept verbatim.
     */
    public String decode(String body, boolean raw) {
        if (raw || body.indexOf('\\') < 0) {
            return body;
        }
        StringBuilder value = new StringBuilder(body.length());
        int index = 0;
        while (index < body.length()) {
            char ch = body.charAt(index);
            if (ch != '\\' || index + 1 >= body.length()) {
                value.append(ch);
                index++;
                continue;
            }
            char escape = body.charAt(index + 1);
            switch (escape) {
                case '\n' -> index += 2;
                case '\\', '\'', '"' -> {
                    value.append(escape);
                    index += 2;
                }
                case 'a' -> index = append(value, '\u0007', index);
                case 'b' -> index = append(value, '\b', index);
                case 'f' -> index = append(value, '\f', index);
                case 'n' -> index = append(value, '\n', index);
                case 'r' -> index = append(value, '\r', index);
                case 't' -> index = append(value, '\t', index);
                case 'v' -> index = append(value, '\u000B', index);
                case 'x' -> index = appendHex(value, body, index, 2);
                case 'u' -> index = appendHex(value, body, index, 4);
                case 'U' -> index = appendHex(value, body, index, 8);
                case 'N' -> index = appendNamed(value, body, index);
                default -> {
                    if (escape >= '0' && escape <= '7') {
                        index = appendOctal(value, body, index);
                    } else {
                        value.append('\\').append(escape);
                        index += 2;
                    }
                }
            }
        }
        return value.toString();
    }

    /**
     * Encodes a value as the body of a literal delimited by three {@code quote} characters.
     * Returns empty when a raw literal cannot represent the value.
     */
    public Optional<String> encode(String value, char quote, boolean raw) {
        if (raw) {
            String tripleQuote = String.valueOf(quote).repeat(3);
            if (value.contains(tripleQuote) || value.endsWith(String.valueOf(quote)) || value.endsWith("\\")) {
                return Optional.empty();
            }
            return Optional.of(value);
        }
        StringBuilder body = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch == '\\') {
                body.append("\\\\");
            } else if (ch == quote && (i + 1 == value.length() || value.charAt(i + 1) == quote)) {
                body.append('\\').append(ch);
            } else if (ch == '\r') {
                body.append("\\r");
            } else if (ch < 0x20 && ch != '\n' && ch != '\t') {
                body.append(String.format("\\x%02x", (int) ch));
            } else {
                body.append(ch);
            }
        }
        return Optional.of(body.toString());
    }

    private static int append(StringBuilder value, char decoded, int index) {
        value.append(decoded);
        return index + 2;
    }

    private static int appendHex(StringBuilder value, String body, int index, int digits) {
        int start = index + 2;
        int end = start + digits;
        if (end > body.length()) {
            value.append(body, index, index + 2);
            return index + 2;
        }
        if (!isHex(body, start, end)) {
            value.append(body, index, index + 2);
            return index + 2;
        }
        int codePoint = Integer.parseUnsignedInt(body.substring(start, end), 16);
        if (!Character.isValidCodePoint(codePoint)) {
            value.append(body, index, index + 2);
            return index + 2;
        }
        value.appendCodePoint(codePoint);
        return end;
    }

    private static int appendOctal(StringBuilder value, String body, int index) {
        int start = index + 1;
        int end = start;
        while (end < body.length() && end - start < 3 && body.charAt(end) >= '0' && body.charAt(end) <= '7') {
            end++;
        }
        value.append((char) Integer.parseInt(body.substring(start, end), 8));
        return end;
    }

    private static int appendNamed(StringBuilder value, String body, int index) {
        int open = index + 2;
        int close = body.indexOf('}', open);
        if (open >= body.length() || body.charAt(open) != '{' || close < 0) {
            value.append(body, index, index + 2);
            return index + 2;
        }
        try {
            value.appendCodePoint(Character.codePointOf(body.substring(open + 1, close)));
            return close + 1;
        } catch (IllegalArgumentException ex) {
            value.append(body, index, close + 1);
            return close + 1;
        }
    }

    private static boolean isHex(String body, int start, int end) {
        for (int i = start; i < end; i++) {
            if (Character.digit(body.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
