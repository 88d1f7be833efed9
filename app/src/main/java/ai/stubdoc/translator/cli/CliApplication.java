package ai.stubdoc.translator.cli;

import ai.stubdoc.translator.config.Config;
import ai.stubdoc.translator.config.ConfigLoader;
import ai.stubdoc.translator.config.SystemEnvironmentReader;
import ai.stubdoc.translator.docstring.DocstringTranslator;
import ai.stubdoc.translator.logging.LoggingConfigurator;
import ai.stubdoc.translator.stub.StubDocumentWriter;
import ai.stubdoc.translator.stub.StubTranslationResult;
import ai.stubdoc.translator.stub.StubTranslator;
import ai.stubdoc.translator.translate.CatalogFactory;
import ai.stubdoc.translator.translate.MessageCatalog;
import ai.stubdoc.translator.translate.MoCatalogLoader;
import java.io.PrintStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and stub translation pipeline.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final MoCatalogLoader catalogLoader;
    private final StubDocumentWriter documentWriter;
    private final PrintStream stdout;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new MoCatalogLoader(), new StubDocumentWriter(), System.out);
    }

    CliApplication(ConfigLoader configLoader, MoCatalogLoader catalogLoader, StubDocumentWriter documentWriter,
                   PrintStream stdout) {
        this.configLoader = Objects.requireNonNull(configLoader, "configLoader");
        this.catalogLoader = Objects.requireNonNull(catalogLoader, "catalogLoader");
        this.documentWriter = Objects.requireNonNull(documentWriter, "documentWriter");
        this.stdout = Objects.requireNonNull(stdout, "stdout");
    }

    public static void main(String[] args) {
        int exitCode = new CliApplication().run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        try {
            Config config = configLoader.load(cliArguments);
            LoggingConfigurator.configure(config.logFormat(), config.verbose());
            return translate(config);
        } catch (RuntimeException ex) {
            LOGGER.error("Translation failed: {}", ex.getMessage());
            LOGGER.debug("Failure details", ex);
            commandLine.getErr().println("error: " + ex.getMessage());
            return EXIT_FAILURE;
        }
    }

    private int translate(Config config) {
        LOGGER.info("Translating {} into '{}' (domain={}, mode={}, lineWidth={})",
                config.stubPath(), config.language(), config.domain(), config.translationMode(), config.lineWidth());

        CatalogFactory catalogFactory = new CatalogFactory(
                () -> catalogLoader.load(config.localeDir(), config.language(), config.domain()));
        MessageCatalog catalog = catalogFactory.select(config.translationMode());
        StubTranslator stubTranslator = new StubTranslator(new DocstringTranslator(catalog, config.lineWidth()));

        String source = documentWriter.read(config.stubPath());
        StubTranslationResult result = stubTranslator.translate(source);
        LOGGER.info("Rewrote {} of {} docstrings", result.rewrittenCount(), result.docstringCount());

        if (config.outputPath().isPresent()) {
            documentWriter.write(config.outputPath().get(), result.text());
            LOGGER.info("Wrote translated stub to {}", config.outputPath().get());
        } else {
            documentWriter.write(stdout, result.text());
        }
        return 0;
    }
}
