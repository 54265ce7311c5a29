package dev.vankka.supportdesk.ticket;

/**
 * A chat platform call failed.
 */
public class ExternalResourceException extends Exception {

    private final boolean notFound;

    public ExternalResourceException(String message, Throwable cause, boolean notFound) {
        super(message, cause);
        this.notFound = notFound;
    }

    public static ExternalResourceException notFound(String what) {
        return new ExternalResourceException(what + " not found", null, true);
    }

    /**
     * Whether the resource was deleted or never existed.
     */
    public boolean isNotFound() {
        return notFound;
    }
}
