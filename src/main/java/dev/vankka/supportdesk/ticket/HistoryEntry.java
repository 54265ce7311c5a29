package dev.vankka.supportdesk.ticket;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A message read back from a ticket channel.
 */
@Value
@Builder
public class HistoryEntry {

    String authorRef;
    String authorName;
    Instant sentAt;
    /**
     * Text with mentions already resolved to readable names.
     */
    String content;
    @Singular List<String> attachmentUrls;
}
