package dev.vankka.supportdesk.message;

import lombok.Value;

/**
 * A text file sent along with a message.
 */
@Value
public class FileAttachment {

    String fileName;
    String content;
}
