package ai.stubdoc.translator.translate;

import java.util.Map;
import java.util.Objects;

/**
 * In-memory catalog backed by an immutable map of exact source strings.
 */
public class MapMessageCatalog implements MessageCatalog {

    private final Map<String, String> messages;

    public MapMessageCatalog(Map<String, String> messages) {
        this.messages = Map.copyOf(Objects.requireNonNull(messages, "messages"));
    }

    @Override
    public String lookup(String sourceText) {
        if (sourceText == null || sourceText.isEmpty()) {
            return sourceText == null ? "" : sourceText;
        }
        return messages.getOrDefault(sourceText, sourceText);
    }

    public int size() {
        return messages.size();
    }
}
