package ai.stubdoc.translator.config;

import ai.stubdoc.translator.translate.TranslationMode;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path stubPath,
        String domain,
        Path localeDir,
        String language,
        Optional<Path> outputPath,
        int lineWidth,
        TranslationMode translationMode,
        LogFormat logFormat,
        boolean verbose
) {

    public Config {
        Objects.requireNonNull(stubPath, "stubPath");
        domain = requireNonBlank(domain, "domain");
        Objects.requireNonNull(localeDir, "localeDir");
        language = requireNonBlank(language, "language");
        outputPath = outputPath == null ? Optional.empty() : outputPath;
        if (lineWidth < 0) {
            throw new IllegalArgumentException("lineWidth must be greater than or equal to zero");
        }
        translationMode = Objects.requireNonNull(translationMode, "translationMode");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value.trim();
    }
}
