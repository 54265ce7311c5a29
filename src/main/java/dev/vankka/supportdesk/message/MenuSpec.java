package dev.vankka.supportdesk.message;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A selection menu attached to a message.
 */
@Value
@Builder
public class MenuSpec {

    String id;
    String placeholder;
    @Builder.Default int minValues = 1;
    @Builder.Default int maxValues = 1;
    @Singular List<MenuOption> options;
}
