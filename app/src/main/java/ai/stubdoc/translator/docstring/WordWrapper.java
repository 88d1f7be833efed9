package ai.stubdoc.translator.docstring;

import java.util.List;

/**
 * Greedy word-wrap primitive.
 *
 * <p>Implementations break only at whitespace, never inside a word, and always return at least one line.
 * A word longer than {@code width} is placed on a line of its own.
 */
@FunctionalInterface
public interface WordWrapper {

    List<String> wrap(String text, int width);
}
