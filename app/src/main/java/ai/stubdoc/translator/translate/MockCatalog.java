package ai.stubdoc.translator.translate;

/**
 * Mock catalog marking every looked-up unit, handy to see how a stub is split into translation units.
 */
public class MockCatalog implements MessageCatalog {

    static final String MARKER = "[MOCK] ";

    @Override
    public String lookup(String sourceText) {
        if (sourceText == null || sourceText.isEmpty()) {
            return "";
        }
        return MARKER + sourceText;
    }
}
