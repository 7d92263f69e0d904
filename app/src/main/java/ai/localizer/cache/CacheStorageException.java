package ai.localizer.cache;

/**
 * Raised when the storage layer behind a cache cannot complete an operation.
 */
public class CacheStorageException extends RuntimeException {

    public CacheStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
