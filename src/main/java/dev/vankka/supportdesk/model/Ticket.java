package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Ticket {

    long id;
    String tenantId;
    /**
     * {@code null} once the category has been deleted.
     */
    Long categoryId;
    long ticketNumber;
    String channelRef;
    String requesterRef;
    String closedByRef;
    Instant closedAt;
    String closeReason;
    String claimedByRef;
    TicketStatus status;
    Instant createdAt;
    Instant updatedAt;

    public boolean isOpen() {
        return status == TicketStatus.OPEN;
    }

    /**
     * Zero padded ticket number, as used in channel names and notices.
     */
    public String getDisplayNumber() {
        return StringUtils.leftPad(String.valueOf(ticketNumber), 4, '0');
    }

    public String channelNameFor(TicketStatus status) {
        return status.channelPrefix() + "-" + getDisplayNumber();
    }
}
