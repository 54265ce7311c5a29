package dev.vankka.supportdesk.message;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Platform independent content of a message the engine posts or edits. The chat adapter decides how it looks.
 */
@Value
@Builder(toBuilder = true)
public class OutboundMessage {

    /**
     * Plain text outside of any embed, used for mentions.
     */
    String content;
    String title;
    String description;
    String color;
    @Singular List<MessageAction> actions;
    MenuSpec menu;
    @Singular List<FileAttachment> files;

    public static OutboundMessage text(String content) {
        return OutboundMessage.builder().content(content).build();
    }
}
