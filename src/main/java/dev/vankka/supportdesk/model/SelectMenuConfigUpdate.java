package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SelectMenuConfigUpdate {

    String placeholder;
    String messageRef;
    Integer minValues;
    Integer maxValues;
    String embedTitle;
    String embedDescription;
    String embedColor;
}
