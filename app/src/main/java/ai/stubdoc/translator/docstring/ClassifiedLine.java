package ai.stubdoc.translator.docstring;

import java.util.Objects;

/**
 * A raw docstring line together with its indentation, stripped text and structural role.
 *
 * <p>For list and list-table items {@code header} holds the marker (including the spaces that follow it)
 * and {@code body} the translatable remainder. For every other kind the header is empty and the body equals
 * the stripped text.
 */
public record ClassifiedLine(int lineIndex,
                             String original,
                             String indent,
                             String text,
                             LineKind kind,
                             String header,
                             String body) {

    public ClassifiedLine {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(indent, "indent");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(header, "header");
        Objects.requireNonNull(body, "body");
        if (lineIndex < 0) {
            throw new IllegalArgumentException("lineIndex must be zero or greater");
        }
    }

    /**
     * Indent to record for a unit started by this line: list markers become part of it.
     */
    public String unitIndent() {
        return indent + header;
    }
}
