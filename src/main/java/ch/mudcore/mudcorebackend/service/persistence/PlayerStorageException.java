package ch.mudcore.mudcorebackend.service.persistence;

/**
 * Raised by a storage backend when reading or writing player records fails.
 */
public class PlayerStorageException extends RuntimeException {

    public PlayerStorageException(String message) {
        super(message);
    }

    public PlayerStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
