package ai.mathdoc.extractor.config;

import java.util.Optional;

/**
 * Reads settings from environment variables, falling back to a JVM system property of the same name.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value != null) {
            return Optional.of(value);
        }
        return Optional.ofNullable(System.getProperty(key));
    }
}
