package dev.vankka.supportdesk.message;

import lombok.Value;

@Value
public class MenuOption {

    String value;
    String label;
    String description;
    String glyph;
}
