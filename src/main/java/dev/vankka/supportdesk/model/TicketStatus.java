package dev.vankka.supportdesk.model;

public enum TicketStatus {

    OPEN,
    CLOSED,
    ARCHIVED;

    public String channelPrefix() {
        switch (this) {
            case OPEN:
                return "ticket";
            case CLOSED:
                return "closed-ticket";
            case ARCHIVED:
                return "archived-ticket";
            default:
                throw new IllegalStateException("Unknown status " + this);
        }
    }
}
