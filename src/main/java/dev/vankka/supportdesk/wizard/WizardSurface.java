package dev.vankka.supportdesk.wizard;

import dev.vankka.supportdesk.message.OutboundMessage;

/**
 * The single message a configuration session is displayed on.
 */
public interface WizardSurface {

    /**
     * The id interactions on this surface carry. Available once the first screen has been rendered.
     */
    String getId();

    /**
     * Replaces the surface's content with {@code screen}.
     */
    void render(OutboundMessage screen);

    /**
     * Replaces the surface's content with a final text and removes all components.
     */
    void finish(String message);
}
