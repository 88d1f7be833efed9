package ai.stubdoc.translator.translate;

/**
 * Read-only mapping from source text to translated text.
 *
 * <p>Lookups are total: when no translation exists the source text itself is returned.
 */
@FunctionalInterface
public interface MessageCatalog {

    String lookup(String sourceText);
}
