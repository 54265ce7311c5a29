package dev.vankka.supportdesk.discord;

import dev.vankka.supportdesk.collector.Interaction;
import dev.vankka.supportdesk.collector.Responder;
import dev.vankka.supportdesk.message.ModalForm;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import net.dv8tion.jda.api.events.interaction.ModalInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.GenericComponentInteractionCreateEvent;
import net.dv8tion.jda.api.events.interaction.component.StringSelectInteractionEvent;
import net.dv8tion.jda.api.interactions.modals.ModalMapping;

/**
 * Converts Discord interaction events into collector interactions.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class JdaInteractions {

    public static Interaction of(ButtonInteractionEvent event) {
        return component(event, Interaction.Type.BUTTON).build();
    }

    public static Interaction of(StringSelectInteractionEvent event) {
        return component(event, Interaction.Type.SELECT)
                .values(event.getValues())
                .build();
    }

    /**
     * @return {@code null} if the form wasn't opened from a message, such forms have no surface
     */
    public static Interaction of(ModalInteractionEvent event) {
        if (event.getMessage() == null) {
            return null;
        }
        Interaction.InteractionBuilder builder = Interaction.builder()
                .id(event.getId())
                .surfaceId(event.getMessage().getId())
                .principalId(event.getUser().getId())
                .type(Interaction.Type.MODAL)
                .componentId(event.getModalId())
                .responder(new Responder() {
                    @Override
                    public void deferEdit() {
                        event.deferEdit().queue();
                    }

                    @Override
                    public void openModal(ModalForm form) {
                        throw new IllegalStateException("A form submission can't be answered with another form");
                    }
                });
        for (ModalMapping mapping : event.getValues()) {
            builder.field(mapping.getId(), mapping.getAsString());
        }
        return builder.build();
    }

    private static Interaction.InteractionBuilder component(GenericComponentInteractionCreateEvent event, Interaction.Type type) {
        return Interaction.builder()
                .id(event.getId())
                .surfaceId(event.getMessageId())
                .principalId(event.getUser().getId())
                .type(type)
                .componentId(event.getComponentId())
                .responder(new Responder() {
                    @Override
                    public void deferEdit() {
                        event.deferEdit().queue();
                    }

                    @Override
                    public void openModal(ModalForm form) {
                        event.replyModal(JdaMessages.modal(form)).queue();
                    }
                });
    }
}
