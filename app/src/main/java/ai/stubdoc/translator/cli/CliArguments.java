package ai.stubdoc.translator.cli;

import ai.stubdoc.translator.config.LogFormat;
import ai.stubdoc.translator.translate.TranslationMode;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "stubdoc-translator", mixinStandardHelpOptions = true,
        version = "stubdoc-translator 0.1.0",
        description = "Translates the docstrings of a .pyi stub file with a gettext message catalog")
public class CliArguments {

    @CommandLine.Parameters(index = "0", description = ".pyi file to translate", paramLabel = "PYI")
    private Path stubPath;

    @CommandLine.Parameters(index = "1", description = "Translation domain (name of the .mo file)", paramLabel = "DOMAIN")
    private String domain;

    @CommandLine.Parameters(index = "2", description = "Locale directory containing <language>/LC_MESSAGES/<domain>.mo", paramLabel = "LOCALE_DIR")
    private Path localeDir;

    @CommandLine.Parameters(index = "3", description = "Language to translate into, e.g. ja", paramLabel = "LANGUAGE")
    private String language;

    @CommandLine.Option(names = {"-o", "--output"}, description = "Output .pyi file; standard output when omitted", paramLabel = "FILE")
    private Path outputPath;

    @CommandLine.Option(names = {"-w", "--line-width"}, description = "Wrap translated paragraphs to this width; 0 disables wrapping", paramLabel = "COLUMNS")
    private Integer lineWidth;

    @CommandLine.Option(names = "--translation-mode", description = "Translation source: catalog, dry-run or mock", converter = TranslationModeConverter.class)
    private TranslationMode translationMode;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    @CommandLine.Option(names = {"-v", "--verbose"}, description = "Log every paragraph without a translation")
    private boolean verbose;

    public Path stubPath() {
        return stubPath;
    }

    public String domain() {
        return domain;
    }

    public Path localeDir() {
        return localeDir;
    }

    public String language() {
        return language;
    }

    public Path outputPath() {
        return outputPath;
    }

    public Integer lineWidth() {
        return lineWidth;
    }

    public TranslationMode translationMode() {
        return translationMode;
    }

    public LogFormat logFormat() {
        return logFormat;
    }

    public boolean verbose() {
        return verbose;
    }
}
