package ai.stubdoc.translator.translate;

/**
 * Catalog used for dry runs: every lookup returns the source text unchanged.
 */
public class PassThroughCatalog implements MessageCatalog {

    @Override
    public String lookup(String sourceText) {
        return sourceText == null ? "" : sourceText;
    }
}
