package dev.vankka.supportdesk.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * The visual styles the ticket creation button can be rendered with.
 */
public enum ButtonStyle {

    PRIMARY("Blurple"),
    SECONDARY("Grey"),
    SUCCESS("Green"),
    DANGER("Red");

    private final String displayName;

    ButtonStyle(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Optional<ButtonStyle> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(style -> style.name().equalsIgnoreCase(name.trim()))
                .findAny();
    }
}
