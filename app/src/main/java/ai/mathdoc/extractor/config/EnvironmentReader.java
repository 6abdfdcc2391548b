package ai.mathdoc.extractor.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value of {@code key}, empty when unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key).map(String::trim).filter(value -> !value.isEmpty());
    }
}
