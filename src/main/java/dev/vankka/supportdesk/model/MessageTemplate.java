package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class MessageTemplate {

    long categoryId;
    String welcomeMessage;
    String closeMessage;
    boolean includeSupportTeam;

    public static MessageTemplate defaults(long categoryId, String categoryName) {
        return MessageTemplate.builder()
                .categoryId(categoryId)
                .welcomeMessage("Welcome to your ticket in the " + categoryName + " category!")
                .closeMessage("This ticket in the " + categoryName + " category has been closed.")
                .includeSupportTeam(true)
                .build();
    }
}
