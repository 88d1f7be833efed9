package ai.stubdoc.translator.docstring;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Re-flows translated text to a width budget and restores the indentation the wrap primitive knows nothing about.
 */
public class RewrapEngine {

    private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\n\\x0B\\f\\r]+");

    private final WordWrapper wordWrapper;

    public RewrapEngine() {
        this(new GreedyWordWrapper());
    }

    public RewrapEngine(WordWrapper wordWrapper) {
        this.wordWrapper = Objects.requireNonNull(wordWrapper, "wordWrapper");
    }

    /**
     * Wraps {@code text} so that the first line fits {@code firstLineWidth} and every other line fits {@code width}.
     *
     * @param text               text to wrap
     * @param firstPrefix        prefix of the first output line
     * @param firstLineWidth     budget for the first line, excluding its prefix
     * @param width              budget for continuation lines, excluding their prefix
     * @param continuationPrefix prefix of every line after the first
     * @return at least one line
     */
    public List<String> rewrap(String text, String firstPrefix, int firstLineWidth, int width, String continuationPrefix) {
        String source = text == null ? "" : text;
        int firstBudget = Math.max(1, firstLineWidth);
        int budget = Math.max(1, width);

        List<String> wrapped;
        if (firstBudget == budget) {
            wrapped = wordWrapper.wrap(source, budget);
        } else {
            wrapped = wrapWithNarrowerFirstLine(source, firstBudget, budget);
        }

        List<String> lines = new ArrayList<>(wrapped.size());
        for (int i = 0; i < wrapped.size(); i++) {
            String line = wrapped.get(i);
            lines.add(i == 0 ? firstPrefix + line : continuationPrefix + line);
        }
        return lines;
    }

    private List<String> wrapWithNarrowerFirstLine(String source, int firstBudget, int budget) {
        List<String> firstPass = wordWrapper.wrap(source, firstBudget);
        String head = firstPass.get(0);
        String[] words = words(source);
        int consumed = words(head).length;
        List<String> lines = new ArrayList<>();
        lines.add(head);
        if (consumed < words.length) {
            String remainder = String.join(" ", Arrays.asList(words).subList(consumed, words.length));
            lines.addAll(wordWrapper.wrap(remainder, budget));
        }
        return lines;
    }

    static String[] words(String text) {
        if (text == null) {
            return new String[0];
        }
        List<String> words = new ArrayList<>();
        for (String word : WHITESPACE.split(text)) {
            if (!word.isEmpty()) {
                words.add(word);
            }
        }
        return words.toArray(new String[0]);
    }
}
