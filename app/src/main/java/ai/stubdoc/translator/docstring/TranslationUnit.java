package ai.stubdoc.translator.docstring;

import java.util.ArrayList;
import java.util.List;

/**
 * Mutable accumulator for one contiguous run of prose lines sharing an indent.
 */
final class TranslationUnit {

    private int startLine = -1;
    private String indent = "";
    private final List<String> texts = new ArrayList<>();
    private final List<String> originals = new ArrayList<>();

    void put(String indent, String text, String original, int lineIndex) {
        if (texts.isEmpty()) {
            this.indent = indent;
            this.startLine = lineIndex;
        }
        texts.add(text);
        originals.add(original);
    }

    boolean isEmpty() {
        return texts.isEmpty();
    }

    int startLine() {
        return startLine;
    }

    String indent() {
        return indent;
    }

    String joinedText() {
        return String.join(" ", texts);
    }

    List<String> originals() {
        return List.copyOf(originals);
    }

    void reset() {
        startLine = -1;
        indent = "";
        texts.clear();
        originals.clear();
    }
}
