package ai.stubdoc.translator.stub;

import java.util.Objects;

/**
 * Rewritten stub text together with docstring counters for the run summary.
 */
public record StubTranslationResult(String text, int docstringCount, int rewrittenCount) {

    public StubTranslationResult {
        Objects.requireNonNull(text, "text");
        if (docstringCount < 0 || rewrittenCount < 0 || rewrittenCount > docstringCount) {
            throw new IllegalArgumentException("Invalid docstring counters");
        }
    }
}
