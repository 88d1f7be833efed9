package ai.stubdoc.translator.stub;

import java.util.Locale;
import java.util.Objects;

/**
 * Location of a triple-quoted docstring literal inside stub source text.
 *
 * @param start     offset of the first prefix character (or the opening quote when there is no prefix)
 * @param bodyStart offset just past the opening delimiter
 * @param bodyEnd   offset of the closing delimiter
 * @param end       offset just past the closing delimiter
 * @param line      1-based line number of the opening delimiter
 * @param prefix    string prefix as written, e.g. {@code r} or empty
 * @param quote     quote character, {@code "} or {@code '}
 */
public record StubLiteral(int start, int bodyStart, int bodyEnd, int end, int line, String prefix, char quote) {

    public StubLiteral {
        Objects.requireNonNull(prefix, "prefix");
        if (start < 0 || bodyStart < start || bodyEnd < bodyStart || end < bodyEnd) {
            throw new IllegalArgumentException("Invalid literal boundaries");
        }
        if (quote != '"' && quote != '\'') {
            throw new IllegalArgumentException("Unsupported quote character: " + quote);
        }
    }

    public boolean isRaw() {
        return prefix.toLowerCase(Locale.ROOT).indexOf('r') >= 0;
    }

    public String delimiter() {
        return String.valueOf(quote).repeat(3);
    }

    /**
     * Width of everything written before the body on the opening line: prefix plus three quotes.
     */
    public int openingDelimiterWidth() {
        return prefix.length() + 3;
    }

    public String body(String source) {
        return source.substring(bodyStart, bodyEnd);
    }
}
