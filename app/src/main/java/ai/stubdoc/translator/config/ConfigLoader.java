package ai.stubdoc.translator.config;

import ai.stubdoc.translator.cli.CliArguments;
import ai.stubdoc.translator.translate.TranslationMode;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_LINE_WIDTH = "STUBDOC_LINE_WIDTH";
    static final String ENV_TRANSLATION_MODE = "STUBDOC_TRANSLATION_MODE";
    static final String ENV_LOG_FORMAT = "STUBDOC_LOG_FORMAT";
    static final String ENV_VERBOSE = "STUBDOC_VERBOSE";

    private static final int DEFAULT_LINE_WIDTH = 0;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.stubPath() == null || arguments.localeDir() == null) {
            throw new IllegalArgumentException("stub file and locale directory must be provided");
        }
        int lineWidth = resolveLineWidth(arguments);
        TranslationMode translationMode = resolveTranslationMode(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = resolveVerbose(arguments);

        return new Config(arguments.stubPath(), arguments.domain(), arguments.localeDir(), arguments.language(),
                Optional.ofNullable(arguments.outputPath()), lineWidth, translationMode, logFormat, verbose);
    }

    private int resolveLineWidth(CliArguments arguments) {
        Integer cliWidth = arguments.lineWidth();
        if (cliWidth != null) {
            if (cliWidth < 0) {
                throw new IllegalArgumentException("--line-width must be zero or greater");
            }
            return cliWidth;
        }
        return environmentReader.setting(ENV_LINE_WIDTH)
                .map(ConfigLoader::parseLineWidth)
                .orElse(DEFAULT_LINE_WIDTH);
    }

    private TranslationMode resolveTranslationMode(CliArguments arguments) {
        TranslationMode cliMode = arguments.translationMode();
        if (cliMode != null) {
            return cliMode;
        }
        return environmentReader.setting(ENV_TRANSLATION_MODE)
                .map(TranslationMode::from)
                .orElse(TranslationMode.CATALOG);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.setting(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private boolean resolveVerbose(CliArguments arguments) {
        if (arguments.verbose()) {
            return true;
        }
        return environmentReader.setting(ENV_VERBOSE)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static int parseLineWidth(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 0) {
                throw new IllegalArgumentException(ENV_LINE_WIDTH + " must be zero or greater");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_LINE_WIDTH + " must be an integer", ex);
        }
    }
}
