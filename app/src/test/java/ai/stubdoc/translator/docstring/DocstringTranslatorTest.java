package ai.stubdoc.translator.docstring;

import static org.assertj.core.api.Assertions.assertThat;

import ai.stubdoc.translator.translate.MapMessageCatalog;
import ai.stubdoc.translator.translate.MockCatalog;
import ai.stubdoc.translator.translate.PassThroughCatalog;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class DocstringTranslatorTest {

    private static final String STRUCTURED = String.join("\n",
            "Summary of the function.",
            "",
            "Parameters",
            "----------",
            "value : int",
            "    The value to inspect, which is",
            "    described over two lines.",
            "",
            "Notes",
            "=====",
            "- first point",
            "- second point that is long",
            "",
            "    ");

    private final LineClassifier classifier = new LineClassifier();

    @Test
    void mergesParagraphLinesIntoOneTranslation() {
        DocstringTranslator translator = new DocstringTranslator(
                new MapMessageCatalog(Map.of("Hello world. This continues.", "Bonjour le monde. Ceci continue.")), 0);

        assertThat(translator.translate("Hello world.\nThis continues."))
                .isEqualTo("Bonjour le monde. Ceci continue.");
    }

    @Test
    void paragraphBeforeDecorationIsKeptVerbatim() {
        DocstringTranslator translator = new DocstringTranslator(
                new MapMessageCatalog(Map.of("Title", "Titre", "Body text.", "Corps du texte.")), 0);

        assertThat(translator.translate("Title\n=====\n\nBody text."))
                .isEqualTo("Title\n=====\n\nCorps du texte.");
    }

    @Test
    void listItemBodyWrappingOntoNextLineIsOneUnit() {
        DocstringTranslator translator = new DocstringTranslator(
                new MapMessageCatalog(Map.of("item one continued", "élément un suite")), 0);

        assertThat(translator.translate("- item one\n  continued")).isEqualTo("- élément un suite");
    }

    @Test
    void wrapsTranslatedTextWithUnitIndent() {
        DocstringTranslator translator = new DocstringTranslator(
                new MapMessageCatalog(Map.of("Some text.", "a very long sentence that exceeds twenty chars")), 20);

        String translated = translator.translate("\n    Some text.\n    ");

        assertThat(translated).isEqualTo(String.join("\n",
                "",
                "    a very long",
                "    sentence that",
                "    exceeds twenty",
                "    chars",
                "    "));
        assertThat(translated.lines()).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(20));
    }

    @Test
    void openingLineLeavesRoomForTheDelimiter() {
        DocstringTranslator translator = new DocstringTranslator(new PassThroughCatalog(), 24);

        assertThat(translator.translate("Summary line that is long.\n    "))
                .isEqualTo("Summary line that\n    is long.\n    ");
    }

    @Test
    void openingDelimiterWidthCanBeOverridden() {
        DocstringTranslator translator = new DocstringTranslator(new PassThroughCatalog(), 24);

        assertThat(translator.translate("Summary line that is long.\n    ", 0))
                .isEqualTo("Summary line that is\n    long.\n    ");
    }

    @Test
    void lineAfterOpeningLineIsMeasuredAgainstBaseIndent() {
        DocstringTranslator translator = new DocstringTranslator(new MapMessageCatalog(
                Map.of("Summary starts here and continues.", "Resumen que continúa.")), 0);

        assertThat(translator.translate("Summary starts here\n    and continues.\n    "))
                .isEqualTo("Resumen que continúa.\n    ");
    }

    @Test
    void indentationChangesStartNewUnits() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        String translated = translator.translate(String.join("\n",
                "",
                "    Para line.",
                "        deeper line",
                "    shallow again",
                "    "));

        assertThat(translated).isEqualTo(String.join("\n",
                "",
                "    [MOCK] Para line.",
                "        [MOCK] deeper line",
                "    [MOCK] shallow again",
                "    "));
    }

    @Test
    void literalBlockAfterBlankLineIsItsOwnUnit() {
        DocstringTranslator translator = new DocstringTranslator(new MapMessageCatalog(
                Map.of("Example::", "Ejemplo::", "Back to prose.", "De vuelta.")), 0);

        String translated = translator.translate(String.join("\n",
                "Example::",
                "",
                "        code = 1",
                "",
                "    Back to prose.",
                "    "));

        assertThat(translated).isEqualTo(String.join("\n",
                "Ejemplo::",
                "",
                "        code = 1",
                "",
                "    De vuelta.",
                "    "));
    }

    @Test
    void multiLineParagraphBeforeDecorationStaysUntranslated() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        assertThat(translator.translate("\n    A two line\n    heading\n    -------\n    Text.\n    "))
                .isEqualTo("\n    A two line\n    heading\n    -------\n    [MOCK] Text.\n    ");
    }

    @Test
    void numberedListMarkersArePreserved() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        String translated = translator.translate("Args:\n    1. first item\n    2. second item\n    ");

        assertThat(translated).isEqualTo("[MOCK] Args:\n    1. [MOCK] first item\n    2. [MOCK] second item\n    ");
    }

    @Test
    void listTableDirectiveKeepsItsMarkerBeforeTheTranslatedCaption() {
        DocstringTranslator translator = new DocstringTranslator(
                new MapMessageCatalog(Map.of("Supported formats", "対応形式")), 0);

        String translated = translator.translate("Formats:\n\n    .. list-table:: Supported formats\n    ");

        assertThat(translated).isEqualTo("Formats:\n\n    .. list-table:: 対応形式\n    ");
    }

    @Test
    void wrappedListItemAlignsContinuationUnderItsBody() {
        DocstringTranslator translator = new DocstringTranslator(new PassThroughCatalog(), 20);

        assertThat(translator.translate("\n    - alpha beta gamma delta\n    "))
                .isEqualTo("\n    - alpha beta\n      gamma delta\n    ");
    }

    @Test
    void blankLinesAndDecorationsSurviveUnchanged() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 30);

        String translated = translator.translate(STRUCTURED);

        assertThat(structuralLines(translated)).isEqualTo(structuralLines(STRUCTURED));
    }

    @Test
    void everyWrappedLineFitsTheWidth() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 30);

        String translated = translator.translate(STRUCTURED);

        assertThat(translated.split("\n", -1))
                .allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(30));
    }

    @Test
    void noWrapModeEmitsOneLinePerUnit() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        List<String> lines = Arrays.asList(translator.translate(STRUCTURED).split("\n", -1));

        assertThat(lines).contains(
                "[MOCK] Summary of the function.",
                "    [MOCK] The value to inspect, which is described over two lines.",
                "- [MOCK] first point",
                "- [MOCK] second point that is long");
        assertThat(lines).filteredOn(line -> line.contains("[MOCK]")).hasSize(5);
    }

    @Test
    void identityCatalogPreservesProse() {
        DocstringTranslator translator = new DocstringTranslator(new PassThroughCatalog(), 25);

        String translated = translator.translate(STRUCTURED);

        assertThat(words(translated)).isEqualTo(words(STRUCTURED));
    }

    @Test
    void identityCatalogWithoutWrappingRoundTripsSingleLineUnits() {
        DocstringTranslator translator = new DocstringTranslator(new PassThroughCatalog(), 0);
        String docstring = "Summary.\n\n    Details here.\n\n    - point\n    ";

        assertThat(translator.translate(docstring)).isEqualTo(docstring);
    }

    @Test
    void degenerateDocstrings() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 10);

        assertThat(translator.translate("")).isEmpty();
        assertThat(translator.translate(null)).isEmpty();
        assertThat(translator.translate("Hello")).isEqualTo("[MOCK]\nHello");
        assertThat(new DocstringTranslator(new MockCatalog(), 0).translate("Hello")).isEqualTo("[MOCK] Hello");
    }

    @Test
    void trailingNewlineIsKept() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        assertThat(translator.translate("Text\n")).isEqualTo("[MOCK] Text\n");
    }

    @Test
    void windowsLineBreaksAreNormalised() {
        DocstringTranslator translator = new DocstringTranslator(new MockCatalog(), 0);

        assertThat(translator.translate("One\r\ntwo\r\n")).isEqualTo("[MOCK] One two\n");
    }

    @Test
    void baseIndentComesFromTheLastLine() {
        assertThat(DocstringTranslator.baseIndent(List.of("Text", "        "))).isEqualTo("        ");
        assertThat(DocstringTranslator.baseIndent(List.of("  single"))).isEqualTo("  ");
        assertThat(DocstringTranslator.baseIndent(List.of())).isEmpty();
    }

    private List<String> structuralLines(String docstring) {
        String[] lines = docstring.split("\n", -1);
        return Arrays.stream(lines)
                .filter(line -> {
                    LineKind kind = classifier.classify(line, 1).kind();
                    return kind == LineKind.BLANK || kind == LineKind.SECTION_DECORATION;
                })
                .collect(Collectors.toList());
    }

    private static List<String> words(String text) {
        return Arrays.stream(text.split("\\s+"))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toList());
    }
}
