package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class SelectMenuConfig {

    public static final String DEFAULT_PLACEHOLDER = "Select a ticket category";

    String tenantId;
    String placeholder;
    String messageRef;
    int minValues;
    int maxValues;
    String embedTitle;
    String embedDescription;
    String embedColor;
}
