package dev.vankka.supportdesk.discord;

import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.wizard.WizardSurface;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.interactions.InteractionHook;

/**
 * The reply to a {@code /config} command, edited through the command's interaction hook.
 */
@Slf4j
public class JdaWizardSurface implements WizardSurface {

    private final InteractionHook hook;
    private volatile String messageId;

    public JdaWizardSurface(InteractionHook hook) {
        this.hook = hook;
    }

    @Override
    public String getId() {
        if (messageId == null) {
            throw new IllegalStateException("Nothing rendered yet");
        }
        return messageId;
    }

    @Override
    public void render(OutboundMessage screen) {
        messageId = hook.editOriginal(JdaMessages.edit(screen)).complete().getId();
    }

    @Override
    public void finish(String message) {
        hook.editOriginal(JdaMessages.text(message)).queue(
                null,
                error -> log.warn("Couldn't finish configuration message: {}", error.getMessage())
        );
    }
}
