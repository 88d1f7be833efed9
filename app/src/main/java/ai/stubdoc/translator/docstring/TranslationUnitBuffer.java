package ai.stubdoc.translator.docstring;

import ai.stubdoc.translator.translate.MessageCatalog;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects prose lines into translation units and emits them either translated and re-wrapped, or verbatim.
 *
 * <p>One buffer serves exactly one docstring. Every flush consumes the current unit, so a unit is never
 * emitted twice.
 */
public class TranslationUnitBuffer {

    private static final Logger LOGGER = LoggerFactory.getLogger(TranslationUnitBuffer.class);

    private final MessageCatalog catalog;
    private final RewrapEngine rewrapEngine;
    private final int lineWidth;
    private final String baseIndent;
    private final int openingDelimiterWidth;
    private final TranslationUnit unit = new TranslationUnit();

    public TranslationUnitBuffer(MessageCatalog catalog,
                                 RewrapEngine rewrapEngine,
                                 int lineWidth,
                                 String baseIndent,
                                 int openingDelimiterWidth) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.rewrapEngine = Objects.requireNonNull(rewrapEngine, "rewrapEngine");
        if (lineWidth < 0) {
            throw new IllegalArgumentException("lineWidth must be zero or greater");
        }
        if (openingDelimiterWidth < 0) {
            throw new IllegalArgumentException("openingDelimiterWidth must be zero or greater");
        }
        this.lineWidth = lineWidth;
        this.baseIndent = baseIndent == null ? "" : baseIndent;
        this.openingDelimiterWidth = openingDelimiterWidth;
    }

    public void put(String indent, String text, String original, int lineIndex) {
        unit.put(indent, text, original, lineIndex);
    }

    public boolean isEmpty() {
        return unit.isEmpty();
    }

    /**
     * Indent captured when the active unit started, or the empty string when no unit is active.
     */
    public String indent() {
        return unit.indent();
    }

    /**
     * Joins the unit into one paragraph, looks it up in the catalog and re-emits it at the unit's indent.
     */
    public List<String> flushTranslated() {
        if (unit.isEmpty()) {
            return List.of();
        }
        String source = unit.joinedText();
        String translated = catalog.lookup(source);
        if (LOGGER.isDebugEnabled() && translated.equals(source)) {
            LOGGER.debug("No translation for unit starting at line {}: {}", unit.startLine(), source);
        }
        String indent = unit.indent();
        int startLine = unit.startLine();
        unit.reset();

        if (lineWidth == 0) {
            return List.of(indent + translated);
        }
        int effectiveIndent = Math.max(indent.length(), baseIndent.length());
        int width = lineWidth - effectiveIndent;
        int firstLineWidth = startLine == 0 ? width - openingDelimiterWidth : width;
        return rewrapEngine.rewrap(translated, indent, firstLineWidth, width, " ".repeat(effectiveIndent));
    }

    /**
     * Emits the unit's raw lines untouched.
     */
    public List<String> flushOriginal() {
        List<String> originals = unit.originals();
        unit.reset();
        return originals;
    }
}
