package ai.stubdoc.translator.stub;

import static org.assertj.core.api.Assertions.assertThat;

import ai.stubdoc.translator.docstring.DocstringTranslator;
import ai.stubdoc.translator.translate.MapMessageCatalog;
import ai.stubdoc.translator.translate.PassThroughCatalog;
import java.util.Map;
import org.junit.jupiter.api.Test;

class StubTranslatorTest {

    private static final String GREETER = String.join("\n",
            "class Greeter:",
            "    \"\"\"Greets people.",
            "",
            "    Longer description",
            "    over two lines.",
            "    \"\"\"",
            "",
            "    def greet(self, name: str) -> str:",
            "        \"\"\"Return a greeting.\"\"\"",
            "        ...",
            "");

    @Test
    void translatesEveryDocstringAndKeepsTheRest() {
        StubTranslator translator = translator(Map.of(
                "Greets people.", "Saluda a la gente.",
                "Longer description over two lines.", "Descripción larga en dos líneas.",
                "Return a greeting.", "Devuelve un saludo."), 0);

        StubTranslationResult result = translator.translate(GREETER);

        assertThat(result.text()).isEqualTo(String.join("\n",
                "class Greeter:",
                "    \"\"\"Saluda a la gente.",
                "",
                "    Descripción larga en dos líneas.",
                "    \"\"\"",
                "",
                "    def greet(self, name: str) -> str:",
                "        \"\"\"Devuelve un saludo.\"\"\"",
                "        ...",
                ""));
        assertThat(result.docstringCount()).isEqualTo(2);
        assertThat(result.rewrittenCount()).isEqualTo(2);
    }

    @Test
    void untouchedDocstringsKeepTheirOriginalSpelling() {
        String source = "def f():\n    \"\"\"Uses \\x41 escapes.\"\"\"\n";
        StubTranslator translator = new StubTranslator(new DocstringTranslator(new PassThroughCatalog(), 0));

        StubTranslationResult result = translator.translate(source);

        assertThat(result.text()).isEqualTo(source);
        assertThat(result.docstringCount()).isEqualTo(1);
        assertThat(result.rewrittenCount()).isZero();
    }

    @Test
    void lookupUsesTheDecodedValue() {
        String source = "def f():\n    \"\"\"Use \\\"quotes\\\" here.\"\"\"\n";
        StubTranslator translator = translator(Map.of("Use \"quotes\" here.", "Utilisez \"\"\" ici."), 0);

        assertThat(translator.translate(source).text())
                .isEqualTo("def f():\n    \"\"\"Utilisez \\\"\\\"\" ici.\"\"\"\n");
    }

    @Test
    void keepsWindowsLineEndings() {
        String source = "class A:\r\n    \"\"\"First line\r\n    second line.\r\n    \"\"\"\r\n";
        StubTranslator translator = translator(Map.of("First line second line.", "Erste Zeile."), 0);

        assertThat(translator.translate(source).text())
                .isEqualTo("class A:\r\n    \"\"\"Erste Zeile.\r\n    \"\"\"\r\n");
    }

    @Test
    void rawLiteralThatCannotHoldTheTranslationIsLeftAlone() {
        String source = "def f():\n    r\"\"\"Raw doc.\"\"\"\n";
        StubTranslator translator = translator(Map.of("Raw doc.", "ends with backslash \\"), 0);

        StubTranslationResult result = translator.translate(source);

        assertThat(result.text()).isEqualTo(source);
        assertThat(result.rewrittenCount()).isZero();
    }

    @Test
    void wrapsAtTheConfiguredWidth() {
        String source = String.join("\n",
                "def f():",
                "    \"\"\"",
                "    Short.",
                "    \"\"\"",
                "");
        StubTranslator translator = translator(Map.of("Short.", "one two three four five six seven"), 20);

        assertThat(translator.translate(source).text()).isEqualTo(String.join("\n",
                "def f():",
                "    \"\"\"",
                "    one two three",
                "    four five six",
                "    seven",
                "    \"\"\"",
                ""));
    }

    private static StubTranslator translator(Map<String, String> messages, int lineWidth) {
        return new StubTranslator(new DocstringTranslator(new MapMessageCatalog(messages), lineWidth));
    }
}
