package dev.vankka.supportdesk.listener;

import dev.vankka.supportdesk.collector.Interaction;
import dev.vankka.supportdesk.collector.InteractionCollector;
import dev.vankka.supportdesk.discord.JdaMessages;
import dev.vankka.supportdesk.message.MessageAction;
import dev.vankka.supportdesk.message.ModalForm;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonStyle;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import dev.vankka.supportdesk.ticket.PrivilegeResolver;
import dev.vankka.supportdesk.ticket.TicketActions;
import dev.vankka.supportdesk.ticket.TicketStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.events.interaction.ModalInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.modals.ModalMapping;

import javax.annotation.Nonnull;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * Handles the buttons on ticket messages: close, reopen, archive, delete and claim.
 */
@Slf4j
@RequiredArgsConstructor
public class TicketActionsListener extends ListenerAdapter {

    private static final ModalForm CLOSE_FORM = ModalForm.builder()
            .id(TicketActions.CLOSE_MODAL)
            .title("Close Ticket")
            .field(ModalForm.Field.builder()
                    .id(TicketActions.CLOSE_REASON)
                    .label("Reason for closing")
                    .paragraph(true)
                    .required(false)
                    .maxLength(1000)
                    .build())
            .build();

    private final TicketStateMachine tickets;
    private final PrivilegeResolver privileges;
    private final InteractionCollector collector;
    private final ExecutorService workers;
    private final Duration confirmationTimeout;
    private final Duration channelDeleteDelay;

    @Override
    public void onButtonInteraction(@Nonnull ButtonInteractionEvent event) {
        if (event.getGuild() == null) {
            return;
        }
        String channelId = event.getChannel().getId();
        String userId = event.getUser().getId();

        switch (event.getComponentId()) {
            case TicketActions.CLOSE:
                event.replyModal(JdaMessages.modal(CLOSE_FORM)).queue();
                break;
            case TicketActions.REOPEN:
                event.deferReply(true).queue();
                run(event.getHook(), channelId, id -> tickets.reopen(id, userId), Emoji.UNLOCK + " Ticket reopened.");
                break;
            case TicketActions.ARCHIVE:
                event.deferReply(true).queue();
                run(event.getHook(), channelId, id -> tickets.archive(id, userId), Emoji.FILE_FOLDER + " Ticket archived.");
                break;
            case TicketActions.CLAIM:
                event.deferReply(true).queue();
                run(event.getHook(), channelId, id -> tickets.claim(id, userId), Emoji.RAISING_HAND + " Done.");
                break;
            case TicketActions.DELETE:
                event.deferReply(true).queue();
                String tenantId = event.getGuild().getId();
                workers.execute(() -> confirmDeletion(event.getHook(), tenantId, channelId, userId));
                break;
            default:
                break;
        }
    }

    @Override
    public void onModalInteraction(@Nonnull ModalInteractionEvent event) {
        if (!TicketActions.CLOSE_MODAL.equals(event.getModalId()) || event.getGuild() == null) {
            return;
        }
        String userId = event.getUser().getId();
        ModalMapping reason = event.getValue(TicketActions.CLOSE_REASON);
        String reasonText = reason != null ? reason.getAsString() : null;
        event.deferReply(true).queue();
        run(event.getHook(), event.getChannel().getId(), id -> tickets.close(id, userId, reasonText), Emoji.LOCK + " Ticket closed.");
    }

    private void run(InteractionHook hook, String channelId, Function<Long, Outcome<Ticket>> action, String success) {
        workers.execute(() -> {
            Outcome<Ticket> ticket = tickets.findByChannel(channelId);
            if (ticket.isFailure()) {
                reply(hook, ticket, success);
                return;
            }
            reply(hook, action.apply(ticket.getValue().getId()), success);
        });
    }

    private void confirmDeletion(InteractionHook hook, String tenantId, String channelId, String userId) {
        Outcome<Ticket> found = tickets.findByChannel(channelId);
        if (found.isFailure()) {
            reply(hook, found, null);
            return;
        }
        if (!privileges.isElevated(tenantId, userId)) {
            reply(hook, Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "You need the Manage Channels permission to delete tickets."), null);
            return;
        }
        Ticket ticket = found.getValue();

        hook.editOriginal(JdaMessages.edit(OutboundMessage.builder()
                .title(Emoji.WARNING + " Delete ticket #" + ticket.getDisplayNumber() + "?")
                .description("The channel will be deleted. The ticket record is kept.")
                .color("#ED4245")
                .action(new MessageAction(TicketActions.DELETE_CONFIRM, "Delete", Emoji.WASTEBASKET, ButtonStyle.DANGER))
                .action(new MessageAction(TicketActions.DELETE_CANCEL, "Cancel", null, ButtonStyle.SECONDARY))
                .build())).queue(
                prompt -> collector.waitFor(prompt.getId(), userId,
                        interaction -> interaction.getType() == Interaction.Type.BUTTON,
                        answer -> {
                            answer.getResponder().deferEdit();
                            if (!TicketActions.DELETE_CONFIRM.equals(answer.getComponentId())) {
                                hook.editOriginal(JdaMessages.text("Deletion cancelled.")).queue();
                                return;
                            }
                            workers.execute(() -> reply(hook, tickets.delete(ticket.getId(), userId),
                                    Emoji.WASTEBASKET + " This ticket will be deleted in " + channelDeleteDelay.getSeconds() + " seconds."));
                        },
                        confirmationTimeout,
                        () -> hook.editOriginal(JdaMessages.text("Deletion cancelled, no response was received in time.")).queue()),
                error -> log.debug("Couldn't show the deletion prompt: {}", error.getMessage())
        );
    }

    private static void reply(InteractionHook hook, Outcome<?> outcome, String success) {
        hook.editOriginal(JdaMessages.text(JdaMessages.describe(outcome, success))).queue(
                null,
                error -> log.debug("Couldn't answer ticket interaction: {}", error.getMessage())
        );
    }
}
