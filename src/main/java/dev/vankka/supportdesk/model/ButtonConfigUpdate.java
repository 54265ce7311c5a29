package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

/**
 * Partial button update. {@code null} leaves a field unchanged, an empty string clears an optional text field.
 */
@Value
@Builder
public class ButtonConfigUpdate {

    String label;
    String glyph;
    ButtonStyle style;
    String messageRef;
    String channelRef;
    String embedTitle;
    String embedDescription;
    String embedColor;
    String logChannelRef;
}
