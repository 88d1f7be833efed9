package ai.stubdoc.translator.docstring;

import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link WordWrapper}: fills each line with as many whitespace-separated words as fit.
 * Runs of whitespace collapse to a single space.
 */
public class GreedyWordWrapper implements WordWrapper {

    @Override
    public List<String> wrap(String text, int width) {
        String[] words = RewrapEngine.words(text);
        if (words.length == 0) {
            return List.of("");
        }
        int limit = Math.max(1, width);
        List<String> lines = new ArrayList<>();
        StringBuilder current = new StringBuilder(words[0]);
        for (int i = 1; i < words.length; i++) {
            String word = words[i];
            if (current.length() + 1 + word.length() <= limit) {
                current.append(' ').append(word);
            } else {
                lines.add(current.toString());
                current.setLength(0);
                current.append(word);
            }
        }
        lines.add(current.toString());
        return lines;
    }
}
