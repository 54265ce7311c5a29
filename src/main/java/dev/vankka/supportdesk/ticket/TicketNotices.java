package dev.vankka.supportdesk.ticket;

import dev.vankka.supportdesk.message.FileAttachment;
import dev.vankka.supportdesk.message.MessageAction;
import dev.vankka.supportdesk.message.Mentions;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonStyle;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.object.Emoji;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.Locale;

/**
 * The messages a ticket posts into its channel over its lifetime.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class TicketNotices {

    static final String NO_REASON = "No reason provided";

    private static final MessageAction CLOSE = new MessageAction(TicketActions.CLOSE, "Close", Emoji.LOCK, ButtonStyle.DANGER);
    private static final MessageAction CLAIM = new MessageAction(TicketActions.CLAIM, "Claim", Emoji.RAISING_HAND, ButtonStyle.SECONDARY);
    private static final MessageAction REOPEN = new MessageAction(TicketActions.REOPEN, "Reopen", Emoji.UNLOCK, ButtonStyle.SUCCESS);
    private static final MessageAction ARCHIVE = new MessageAction(TicketActions.ARCHIVE, "Archive", Emoji.FILE_FOLDER, ButtonStyle.SECONDARY);
    private static final MessageAction DELETE = new MessageAction(TicketActions.DELETE, "Delete", Emoji.WASTEBASKET, ButtonStyle.DANGER);

    static OutboundMessage welcome(Ticket ticket, Category category, MessageTemplate template) {
        String content = Mentions.user(ticket.getRequesterRef());
        if (template.isIncludeSupportTeam() && category.hasSupportRole()) {
            content += " " + Mentions.role(category.getSupportRoleRef());
        }
        return OutboundMessage.builder()
                .content(content)
                .title(StringUtils.defaultIfEmpty(category.getGlyph(), Emoji.TICKET) + " Ticket #" + ticket.getDisplayNumber() + " | " + category.getName())
                .description(StringUtils.defaultIfBlank(template.getWelcomeMessage(),
                        MessageTemplate.defaults(category.getId(), category.getName()).getWelcomeMessage()))
                .color("#5865F2")
                .action(CLOSE)
                .action(CLAIM)
                .build();
    }

    static OutboundMessage closed(Ticket ticket, String closeText) {
        return OutboundMessage.builder()
                .title(Emoji.LOCK + " Ticket #" + ticket.getDisplayNumber() + " closed")
                .description(closeText + "\n\nClosed by " + Mentions.user(ticket.getClosedByRef())
                        + "\nReason: " + StringUtils.defaultIfBlank(ticket.getCloseReason(), NO_REASON))
                .color("#ED4245")
                .action(REOPEN)
                .action(ARCHIVE)
                .action(DELETE)
                .build();
    }

    static OutboundMessage closeLog(Ticket ticket, String categoryName, FileAttachment transcript) {
        OutboundMessage.OutboundMessageBuilder message = OutboundMessage.builder()
                .title("Ticket #" + ticket.getDisplayNumber() + " was closed")
                .description("Category: " + StringUtils.defaultIfEmpty(categoryName, "Uncategorized")
                        + "\nAuthor: " + Mentions.user(ticket.getRequesterRef())
                        + (ticket.getClaimedByRef() != null ? "\nHandled by: " + Mentions.user(ticket.getClaimedByRef()) : "")
                        + "\nClosed by: " + Mentions.user(ticket.getClosedByRef())
                        + "\nReason: " + StringUtils.defaultIfBlank(ticket.getCloseReason(), NO_REASON))
                .color("#ED4245");
        if (transcript != null) {
            message.file(transcript);
        }
        return message.build();
    }

    static OutboundMessage reopened(Ticket ticket, String reopenedBy) {
        return OutboundMessage.builder()
                .title(Emoji.UNLOCK + " Ticket #" + ticket.getDisplayNumber() + " reopened")
                .description("Reopened by " + Mentions.user(reopenedBy))
                .color("#57F287")
                .action(CLOSE)
                .build();
    }

    static OutboundMessage archived(Ticket ticket) {
        return OutboundMessage.builder()
                .title(Emoji.FILE_FOLDER + " Ticket #" + ticket.getDisplayNumber() + " archived")
                .description("Archived by " + Mentions.user(ticket.getClosedByRef()))
                .color("#99AAB5")
                .action(REOPEN)
                .action(DELETE)
                .build();
    }

    static OutboundMessage claimed(Ticket ticket, String staffRef, boolean claimed) {
        return OutboundMessage.text(claimed
                ? Emoji.RAISING_HAND + " " + Mentions.user(staffRef) + " will be handling ticket #" + ticket.getDisplayNumber() + "."
                : Mentions.user(staffRef) + " is no longer handling ticket #" + ticket.getDisplayNumber() + ".");
    }

    static OutboundMessage participantAdded(String userRef, String requestedBy) {
        return OutboundMessage.text(Emoji.HEAVY_PLUS_SIGN + " " + Mentions.user(userRef) + " was added to this ticket by " + Mentions.user(requestedBy));
    }

    static OutboundMessage participantRemoved(String userRef, String requestedBy) {
        return OutboundMessage.text(Emoji.HEAVY_MINUS_SIGN + " " + Mentions.user(userRef) + " was removed from this ticket by " + Mentions.user(requestedBy));
    }

    static OutboundMessage ownerTransferred(String previousOwner, String newOwner, String requestedBy) {
        return OutboundMessage.builder()
                .title(Emoji.TICKET + " Ticket ownership transferred")
                .description("Ownership moved from " + Mentions.user(previousOwner) + " to " + Mentions.user(newOwner)
                        + " by " + Mentions.user(requestedBy) + ".")
                .color("#5865F2")
                .build();
    }

    static OutboundMessage info(Ticket ticket, String categoryName) {
        StringBuilder description = new StringBuilder()
                .append("**Status:** ").append(StringUtils.capitalize(ticket.getStatus().name().toLowerCase(Locale.ROOT)))
                .append("\n**Category:** ").append(StringUtils.defaultIfEmpty(categoryName, "Uncategorized"))
                .append("\n**Owner:** ").append(Mentions.user(ticket.getRequesterRef()))
                .append("\n**Created:** ").append(Mentions.time(ticket.getCreatedAt()))
                .append("\n**Claimed by:** ").append(ticket.getClaimedByRef() != null ? Mentions.user(ticket.getClaimedByRef()) : "Nobody");
        if (!ticket.isOpen()) {
            description.append("\n**Closed by:** ").append(Mentions.user(ticket.getClosedByRef()));
            if (ticket.getClosedAt() != null) {
                description.append("\n**Closed:** ").append(Mentions.time(ticket.getClosedAt()));
            }
            description.append("\n**Reason:** ").append(StringUtils.defaultIfBlank(ticket.getCloseReason(), NO_REASON));
        }
        return OutboundMessage.builder()
                .title(Emoji.TICKET + " Ticket #" + ticket.getDisplayNumber())
                .description(description.toString())
                .color(ticket.isOpen() ? "#57F287" : "#ED4245")
                .build();
    }

    static OutboundMessage deleted(Ticket ticket) {
        return OutboundMessage.builder()
                .title("Ticket Deleted")
                .description("Ticket #" + ticket.getDisplayNumber() + " has been deleted.")
                .color("#ED4245")
                .build();
    }
}
