package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

/**
 * Partial category update. {@code null} leaves a field unchanged, an empty string clears an optional text field.
 */
@Value
@Builder
public class CategoryUpdate {

    String name;
    String description;
    String glyph;
    String supportRoleRef;
    Integer position;
    Boolean enabled;
}
