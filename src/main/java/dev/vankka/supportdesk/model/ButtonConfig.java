package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ButtonConfig {

    public static final String DEFAULT_LABEL = "Create Ticket";
    public static final String DEFAULT_GLYPH = "🎫";

    String tenantId;
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
