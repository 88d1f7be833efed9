package ai.stubdoc.translator.cli;

import ai.stubdoc.translator.translate.TranslationMode;
import picocli.CommandLine;

/**
 * Parses {@code --translation-mode} values such as {@code dry-run}.
 */
public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        try {
            return TranslationMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(ex.getMessage());
        }
    }
}
