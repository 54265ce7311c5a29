package dev.vankka.supportdesk.ticket;

import dev.vankka.supportdesk.message.FileAttachment;
import dev.vankka.supportdesk.model.Ticket;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Plain text transcripts of ticket channels.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class Transcripts {

    static final int HISTORY_LIMIT = 1000;

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss").withZone(ZoneOffset.UTC);

    static FileAttachment render(Ticket ticket, String categoryName, List<HistoryEntry> history) {
        Set<String> participants = new LinkedHashSet<>();
        StringBuilder discussion = new StringBuilder();
        for (HistoryEntry entry : history) {
            String author = entry.getAuthorName() + " (" + entry.getAuthorRef() + ")";
            participants.add(author);

            discussion.append('[').append(TIME.format(entry.getSentAt())).append(" UTC] ")
                    .append(author).append(": ")
                    .append(StringUtils.defaultString(entry.getContent()));
            for (String url : entry.getAttachmentUrls()) {
                discussion.append(' ').append(url);
            }
            discussion.append('\n');
        }

        StringBuilder text = new StringBuilder()
                .append("Ticket #").append(ticket.getDisplayNumber()).append('\n')
                .append("Category: ").append(StringUtils.defaultIfEmpty(categoryName, "Uncategorized")).append('\n')
                .append("Author: ").append(ticket.getRequesterRef()).append('\n');
        if (ticket.getClaimedByRef() != null) {
            text.append("Handled by: ").append(ticket.getClaimedByRef()).append('\n');
        }
        text.append("Closed by: ").append(ticket.getClosedByRef()).append('\n')
                .append("Reason: ").append(StringUtils.defaultIfBlank(ticket.getCloseReason(), TicketNotices.NO_REASON)).append('\n')
                .append('\n')
                .append("Participants:\n");
        participants.forEach(participant -> text.append(participant).append('\n'));
        text.append('\n').append(discussion);

        return new FileAttachment("ticket-" + ticket.getDisplayNumber() + ".txt", text.toString());
    }
}
