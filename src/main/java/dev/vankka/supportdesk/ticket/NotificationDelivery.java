package dev.vankka.supportdesk.ticket;

import dev.vankka.supportdesk.message.OutboundMessage;

/**
 * Best-effort direct messages. Implementations never throw and never block on delivery.
 */
public interface NotificationDelivery {

    void notify(String userRef, OutboundMessage message);
}
