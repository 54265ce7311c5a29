package dev.vankka.supportdesk.storage;

/**
 * Thrown when the database is unavailable or a read/write against it fails.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
