package ai.stubdoc.translator.stub;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Lexical scanner locating docstring literals in Python stub source.
 *
 * <p>A docstring is a triple-quoted text literal (no {@code b} or {@code f} prefix) that begins a statement
 * outside any bracket: either first on its line, or directly after the colon of a {@code def} or
 * {@code class} header, whose signature may span several physical lines. Comments and all other string literals are skipped so quotes inside them never
 * confuse the scan.
 */
public class StubSourceScanner {

    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "f", "br", "rb", "fr", "rf");

    public List<StubLiteral> scan(String source) {
        String text = source == null ? "" : source;
        List<StubLiteral> literals = new ArrayList<>();
        int depth = 0;
        int index = 0;
        int line = 1;
        int statementStart = 0;
        while (index < text.length()) {
            char ch = text.charAt(index);
            if (ch == '\n') {
                if (depth == 0 && !continuesPreviousLine(text, index)) {
                    statementStart = index + 1;
                }
                line++;
                index++;
            } else if (ch == '#') {
                int newline = text.indexOf('\n', index);
                index = newline < 0 ? text.length() : newline;
            } else if (ch == '(' || ch == '[' || ch == '{') {
                depth++;
                index++;
            } else if (ch == ')' || ch == ']' || ch == '}') {
                depth = Math.max(0, depth - 1);
                index++;
            } else if (ch == '"' || ch == '\'') {
                StubLiteral literal = readLiteral(text, index, index, "", line);
                if (depth == 0 && isDocstring(text, literal, statementStart)) {
                    literals.add(literal);
                }
                line += countLines(text, literal.start(), literal.end());
                index = literal.end();
            } else if (Character.isJavaIdentifierStart(ch)) {
                int end = index + 1;
                while (end < text.length() && Character.isJavaIdentifierPart(text.charAt(end))) {
                    end++;
                }
                String word = text.substring(index, end);
                boolean quoteFollows = end < text.length() && (text.charAt(end) == '"' || text.charAt(end) == '\'');
                if (quoteFollows && STRING_PREFIXES.contains(word.toLowerCase(Locale.ROOT))) {
                    StubLiteral literal = readLiteral(text, index, end, word, line);
                    if (depth == 0 && isDocstring(text, literal, statementStart)) {
                        literals.add(literal);
                    }
                    line += countLines(text, literal.start(), literal.end());
                    index = literal.end();
                } else {
                    index = end;
                }
            } else {
                index++;
            }
        }
        return literals;
    }

    private StubLiteral readLiteral(String text, int start, int quoteIndex, String prefix, int line) {
        char quote = text.charAt(quoteIndex);
        String tripleQuote = String.valueOf(quote).repeat(3);
        boolean triple = text.startsWith(tripleQuote, quoteIndex);
        int bodyStart = quoteIndex + (triple ? 3 : 1);
        int cursor = bodyStart;
        while (cursor < text.length()) {
            char ch = text.charAt(cursor);
            if (ch == '\\') {
                boolean crlf = text.startsWith("\r\n", cursor + 1);
                cursor += crlf ? 3 : 2;
                continue;
            }
            if (triple && text.startsWith(tripleQuote, cursor)) {
                return new StubLiteral(start, bodyStart, cursor, cursor + 3, line, prefix, quote);
            }
            if (!triple && ch == quote) {
                return new StubLiteral(start, bodyStart, cursor, cursor + 1, line, prefix, quote);
            }
            if (!triple && ch == '\n') {
                break;
            }
            cursor++;
        }
        throw new StubSourceException("Unterminated string literal starting at line " + line);
    }

    private boolean isDocstring(String text, StubLiteral literal, int statementStart) {
        boolean triple = literal.bodyStart() - literal.start() - literal.prefix().length() == 3;
        if (!triple) {
            return false;
        }
        String prefix = literal.prefix().toLowerCase(Locale.ROOT);
        if (prefix.contains("b") || prefix.contains("f")) {
            return false;
        }
        return startsStatement(text, literal.start(), statementStart);
    }

    private boolean startsStatement(String text, int start, int statementStart) {
        int cursor = start - 1;
        while (cursor >= 0 && (text.charAt(cursor) == ' ' || text.charAt(cursor) == '\t')) {
            cursor--;
        }
        if (cursor < 0) {
            return true;
        }
        char previous = text.charAt(cursor);
        if (previous == '\n') {
            return !continuesPreviousLine(text, cursor);
        }
        if (previous == ':') {
            String header = text.substring(Math.min(statementStart, cursor), cursor).strip();
            return header.startsWith("def ") || header.startsWith("async def ") || header.startsWith("class ");
        }
        return false;
    }

    private boolean continuesPreviousLine(String text, int newline) {
        int cursor = newline - 1;
        if (cursor >= 0 && text.charAt(cursor) == '\r') {
            cursor--;
        }
        return cursor >= 0 && text.charAt(cursor) == '\\';
    }

    private static int countLines(String text, int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
