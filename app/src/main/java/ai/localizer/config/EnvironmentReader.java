package ai.localizer.config;

import java.util.Optional;

/**
 * Source of named configuration values, usually the process environment.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    /**
     * Trimmed value for {@code key}, empty when unset or blank.
     */
    default Optional<String> find(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
