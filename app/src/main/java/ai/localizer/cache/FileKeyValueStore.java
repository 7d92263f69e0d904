package ai.localizer.cache;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link KeyValueStore} kept in a properties file. The file is read once on construction and
 * rewritten through a temporary file and an atomic move after every mutation.
 */
public class FileKeyValueStore implements KeyValueStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(FileKeyValueStore.class);
    private static final String HEADER = "ai-text-localizer translation cache";

    private final Path file;
    private final Map<String, String> values = new HashMap<>();

    public FileKeyValueStore(Path file) {
        this.file = Objects.requireNonNull(file, "file").toAbsolutePath();
        load();
    }

    public Path file() {
        return file;
    }

    @Override
    public synchronized Map<String, String> readAll() {
        return Map.copyOf(values);
    }

    @Override
    public synchronized Optional<String> get(String key) {
        return Optional.ofNullable(values.get(Objects.requireNonNull(key, "key")));
    }

    @Override
    public synchronized void put(String key, String value) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
        String previous = values.put(key, value);
        try {
            flush();
        } catch (CacheStorageException ex) {
            if (previous == null) {
                values.remove(key);
            } else {
                values.put(key, previous);
            }
            throw ex;
        }
    }

    @Override
    public synchronized void remove(String key) {
        String previous = values.remove(Objects.requireNonNull(key, "key"));
        if (previous == null) {
            return;
        }
        try {
            flush();
        } catch (CacheStorageException ex) {
            values.put(key, previous);
            throw ex;
        }
    }

    @Override
    public synchronized void clear() {
        if (values.isEmpty()) {
            flush();
            return;
        }
        Map<String, String> previous = new HashMap<>(values);
        values.clear();
        try {
            flush();
        } catch (CacheStorageException ex) {
            values.putAll(previous);
            throw ex;
        }
    }

    @Override
    public synchronized int size() {
        return values.size();
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        Properties properties = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
        } catch (IOException | IllegalArgumentException ex) {
            throw new CacheStorageException("Failed to read cache file " + file, ex);
        }
        for (String name : properties.stringPropertyNames()) {
            values.put(name, properties.getProperty(name));
        }
        LOGGER.debug("Loaded {} cached translations from {}", values.size(), file);
    }

    private void flush() {
        Properties properties = new Properties();
        properties.putAll(values);
        Path temp = null;
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
            try (Writer writer = Files.newBufferedWriter(temp, StandardCharsets.UTF_8)) {
                properties.store(writer, HEADER);
            }
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException ex) {
            deleteQuietly(temp);
            throw new CacheStorageException("Failed to write cache file " + file, ex);
        }
    }

    private static void deleteQuietly(Path temp) {
        if (temp == null) {
            return;
        }
        try {
            Files.deleteIfExists(temp);
        } catch (IOException ex) {
            LOGGER.debug("Could not delete temporary cache file {}", temp, ex);
        }
    }
}
