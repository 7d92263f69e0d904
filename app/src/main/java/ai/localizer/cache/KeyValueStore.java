package ai.localizer.cache;

import java.util.Map;
import java.util.Optional;

/**
 * String-keyed string storage used as the persistent cache tier. Durability is best effort.
 */
public interface KeyValueStore {

    Map<String, String> readAll();

    default Optional<String> get(String key) {
        return Optional.ofNullable(readAll().get(key));
    }

    void put(String key, String value);

    void remove(String key);

    void clear();

    default int size() {
        return readAll().size();
    }
}
