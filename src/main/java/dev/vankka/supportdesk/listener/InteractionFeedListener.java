package dev.vankka.supportdesk.listener;

import dev.vankka.supportdesk.collector.Interaction;
import dev.vankka.supportdesk.collector.InteractionCollector;
import dev.vankka.supportdesk.discord.JdaInteractions;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.ticket.TicketActions;
import lombok.RequiredArgsConstructor;
import net.dv8tion.jda.api.events.interaction.ModalInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.StringSelectInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.callbacks.IReplyCallback;

import javax.annotation.Nonnull;

/**
 * Hands component interactions to whoever is waiting for them on their message.
 */
@RequiredArgsConstructor
public class InteractionFeedListener extends ListenerAdapter {

    private final InteractionCollector collector;

    @Override
    public void onButtonInteraction(@Nonnull ButtonInteractionEvent event) {
        feed(event, event.getComponentId(), JdaInteractions.of(event));
    }

    @Override
    public void onStringSelectInteraction(@Nonnull StringSelectInteractionEvent event) {
        feed(event, event.getComponentId(), JdaInteractions.of(event));
    }

    @Override
    public void onModalInteraction(@Nonnull ModalInteractionEvent event) {
        Interaction interaction = JdaInteractions.of(event);
        if (interaction != null) {
            feed(event, event.getModalId(), interaction);
        }
    }

    private void feed(IReplyCallback event, String componentId, Interaction interaction) {
        if (TicketActions.isDirect(componentId) || collector.submit(interaction)) {
            return;
        }
        String reply = collector.isWaiting(interaction.getSurfaceId())
                ? Emoji.CROSS_MARK + " This menu belongs to someone else."
                : Emoji.WARNING + " This menu has expired.";
        event.reply(reply).setEphemeral(true).queue();
    }
}
