package ai.localizer.config;

import java.util.Optional;

/**
 * Reads environment variables from the host system, falling back to a JVM system property of
 * the same name.
 */
public class SystemEnvironmentReader implements EnvironmentReader {

    @Override
    public Optional<String> get(String key) {
        String value = System.getenv(key);
        if (value == null) {
            value = System.getProperty(key);
        }
        return Optional.ofNullable(value);
    }
}
