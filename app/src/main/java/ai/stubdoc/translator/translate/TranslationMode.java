package ai.stubdoc.translator.translate;

/**
 * Mode controlling where translations come from.
 */
public enum TranslationMode {
    CATALOG,
    DRY_RUN,
    MOCK;

    public static TranslationMode from(String raw) {
        if (raw == null || raw.isBlank()) {
            return CATALOG;
        }
        String normalized = raw.trim().replace('-', '_');
        for (TranslationMode mode : values()) {
            if (mode.name().equalsIgnoreCase(normalized)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unsupported translation mode: " + raw);
    }
}
