package dev.vankka.supportdesk.outcome;

/**
 * Why an operation failed. Every reason belongs to exactly one {@link ErrorKind}.
 */
public enum Reason {

    TENANT_DISABLED(ErrorKind.VALIDATION, "The ticket system is disabled in this server."),
    CATEGORY_UNAVAILABLE(ErrorKind.VALIDATION, "That ticket category is not available."),
    TICKET_NOT_FOUND(ErrorKind.VALIDATION, "This is not a valid ticket."),
    CATEGORY_NOT_FOUND(ErrorKind.VALIDATION, "Ticket category not found."),
    INVALID_INPUT(ErrorKind.VALIDATION, "Invalid input."),

    DUPLICATE_OPEN_TICKET(ErrorKind.CONFLICT, "You already have an open ticket."),
    ALREADY_CLOSED(ErrorKind.CONFLICT, "This ticket is already closed."),
    ALREADY_OPEN(ErrorKind.CONFLICT, "This ticket is already open."),
    ALREADY_ARCHIVED(ErrorKind.CONFLICT, "This ticket is already archived."),
    ALREADY_CLAIMED(ErrorKind.CONFLICT, "This ticket is already claimed by someone else."),
    LAST_CATEGORY(ErrorKind.CONFLICT, "The last remaining category cannot be deleted."),
    CONFIRMATION_REQUIRED(ErrorKind.CONFLICT, "This category still has tickets, deletion must be confirmed."),

    INSUFFICIENT_PRIVILEGE(ErrorKind.PERMISSION, "You don't have permission to do that."),

    CHANNEL_UNAVAILABLE(ErrorKind.EXTERNAL_RESOURCE, "The ticket channel could not be created or reached."),

    PERSISTENCE_FAILURE(ErrorKind.PERSISTENCE, "The database is unavailable, please try again later."),

    TIMED_OUT(ErrorKind.TIMED_OUT, "Timed out.");

    private final ErrorKind kind;
    private final String defaultMessage;

    Reason(ErrorKind kind, String defaultMessage) {
        this.kind = kind;
        this.defaultMessage = defaultMessage;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
