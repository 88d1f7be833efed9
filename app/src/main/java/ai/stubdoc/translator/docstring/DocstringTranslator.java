package ai.stubdoc.translator.docstring;

import ai.stubdoc.translator.translate.MessageCatalog;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Rewrites one docstring: prose paragraphs are translated and re-wrapped, structural lines are kept as they are.
 *
 * <p>The last line of a docstring is expected to hold the indentation of the closing delimiter; that indentation
 * is the base indent every re-wrapped unit is aligned to. Instances hold no per-docstring state and can be shared.
 */
public class DocstringTranslator {

    public static final int DEFAULT_OPENING_DELIMITER_WIDTH = 3;

    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|\r|\n");

    private final MessageCatalog catalog;
    private final int lineWidth;
    private final int openingDelimiterWidth;
    private final LineClassifier classifier;
    private final RewrapEngine rewrapEngine;

    public DocstringTranslator(MessageCatalog catalog, int lineWidth) {
        this(catalog, lineWidth, DEFAULT_OPENING_DELIMITER_WIDTH);
    }

    public DocstringTranslator(MessageCatalog catalog, int lineWidth, int openingDelimiterWidth) {
        this(catalog, lineWidth, openingDelimiterWidth, new LineClassifier(), new RewrapEngine());
    }

    public DocstringTranslator(MessageCatalog catalog,
                               int lineWidth,
                               int openingDelimiterWidth,
                               LineClassifier classifier,
                               RewrapEngine rewrapEngine) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        if (lineWidth < 0) {
            throw new IllegalArgumentException("lineWidth must be zero or greater");
        }
        if (openingDelimiterWidth < 0) {
            throw new IllegalArgumentException("openingDelimiterWidth must be zero or greater");
        }
        this.lineWidth = lineWidth;
        this.openingDelimiterWidth = openingDelimiterWidth;
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.rewrapEngine = Objects.requireNonNull(rewrapEngine, "rewrapEngine");
    }

    public String translate(String docstring) {
        return translate(docstring, openingDelimiterWidth);
    }

    /**
     * Translates a docstring whose opening delimiter is {@code delimiterWidth} characters wide.
     */
    public String translate(String docstring, int delimiterWidth) {
        if (docstring == null || docstring.isEmpty()) {
            return "";
        }
        List<String> lines = List.of(LINE_BREAK.split(docstring, -1));
        String baseIndent = baseIndent(lines);
        TranslationUnitBuffer buffer = new TranslationUnitBuffer(catalog, rewrapEngine, lineWidth, baseIndent,
                Math.max(0, delimiterWidth));
        List<String> translated = new ArrayList<>(lines.size());

        for (int lineIndex = 0; lineIndex < lines.size(); lineIndex++) {
            String line = lines.get(lineIndex);
            ClassifiedLine classified = classifier.classify(line, lineIndex);
            switch (classified.kind()) {
                case BLANK -> {
                    translated.addAll(buffer.flushTranslated());
                    translated.add(line);
                }
                case SECTION_DECORATION -> {
                    translated.addAll(buffer.flushOriginal());
                    translated.add(line);
                }
                case LIST_ITEM, LIST_TABLE_ITEM -> {
                    translated.addAll(buffer.flushTranslated());
                    buffer.put(classified.unitIndent(), classified.body(), line, lineIndex);
                }
                case PLAIN -> {
                    if (startsNewUnit(classified, buffer, baseIndent)) {
                        translated.addAll(buffer.flushTranslated());
                    }
                    buffer.put(classified.indent(), classified.text(), line, lineIndex);
                }
            }
        }
        translated.addAll(buffer.flushTranslated());
        return String.join("\n", translated);
    }

    private boolean startsNewUnit(ClassifiedLine line, TranslationUnitBuffer buffer, String baseIndent) {
        int indent = line.indent().length();
        int unitIndent = buffer.indent().length();
        // the opening line has no indent of its own, so the line after it is measured against the base indent
        int reference = line.lineIndex() == 1 ? baseIndent.length() : unitIndent;
        return indent > reference || indent < unitIndent;
    }

    static String baseIndent(List<String> lines) {
        if (lines.isEmpty()) {
            return "";
        }
        return LineClassifier.leadingWhitespace(lines.get(lines.size() - 1));
    }
}
