package dev.vankka.supportdesk.message;

import dev.vankka.supportdesk.model.ButtonStyle;
import lombok.Value;

/**
 * A clickable action attached to a message.
 */
@Value
public class MessageAction {

    String id;
    String label;
    String glyph;
    ButtonStyle style;
}
