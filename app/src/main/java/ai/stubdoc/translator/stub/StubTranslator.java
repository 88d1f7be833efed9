package ai.stubdoc.translator.stub;

import ai.stubdoc.translator.docstring.DocstringTranslator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites every docstring of a stub file and leaves all other source text untouched.
 */
public class StubTranslator {

    private static final Logger LOGGER = LoggerFactory.getLogger(StubTranslator.class);

    private final DocstringTranslator docstringTranslator;
    private final StubSourceScanner scanner;
    private final PythonStringCodec codec;

    public StubTranslator(DocstringTranslator docstringTranslator) {
        this(docstringTranslator, new StubSourceScanner(), new PythonStringCodec());
    }

    public StubTranslator(DocstringTranslator docstringTranslator, StubSourceScanner scanner, PythonStringCodec codec) {
        this.docstringTranslator = Objects.requireNonNull(docstringTranslator, "docstringTranslator");
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.codec = Objects.requireNonNull(codec, "codec");
    }

    public StubTranslationResult translate(String source) {
        String text = source == null ? "" : source;
        List<StubLiteral> literals = scanner.scan(text);
        StringBuilder output = new StringBuilder(text.length() + text.length() / 4);
        int cursor = 0;
        int rewritten = 0;
        for (StubLiteral literal : literals) {
            output.append(text, cursor, literal.start());
            Optional<String> replacement = rewrite(text, literal);
            if (replacement.isPresent()) {
                output.append(replacement.get());
                rewritten++;
            } else {
                output.append(text, literal.start(), literal.end());
            }
            cursor = literal.end();
        }
        output.append(text, cursor, text.length());
        LOGGER.debug("Rewrote {} of {} docstrings", rewritten, literals.size());
        return new StubTranslationResult(output.toString(), literals.size(), rewritten);
    }

    private Optional<String> rewrite(String source, StubLiteral literal) {
        String body = literal.body(source);
        boolean crlf = body.contains("\r\n");
        String normalized = body.replace("\r\n", "\n").replace('\r', '\n');
        String value = codec.decode(normalized, literal.isRaw());
        String translated = docstringTranslator.translate(value, literal.openingDelimiterWidth());
        if (translated.equals(value)) {
            return Optional.empty();
        }
        Optional<String> encoded = codec.encode(translated, literal.quote(), literal.isRaw());
        if (encoded.isEmpty()) {
            LOGGER.warn("Docstring at line {} cannot be written back as a raw literal; keeping the original", literal.line());
            return Optional.empty();
        }
        String newBody = crlf ? encoded.get().replace("\n", "\r\n") : encoded.get();
        return Optional.of(literal.prefix() + literal.delimiter() + newBody + literal.delimiter());
    }
}
