package ai.stubdoc.translator.config;

import java.util.Optional;

/**
 * Source of {@code STUBDOC_*} settings, injectable so tests never touch the real environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Returns the trimmed value of {@code key}, treating blank values as unset.
     */
    default Optional<String> setting(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
