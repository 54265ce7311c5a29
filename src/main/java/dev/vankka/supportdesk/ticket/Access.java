package dev.vankka.supportdesk.ticket;

/**
 * Send permission of a principal in a ticket channel.
 */
public enum Access {

    /**
     * May see, read and write in the channel.
     */
    ALLOW,
    /**
     * May not write in the channel.
     */
    DENY,
    /**
     * No explicit send override, falls back to what the principal would otherwise have.
     */
    INHERIT
}
