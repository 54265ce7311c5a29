package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

/**
 * Input for a new category. A {@code null} position appends the category after the existing ones.
 */
@Value
@Builder
public class CategoryDraft {

    String name;
    String description;
    String glyph;
    String supportRoleRef;
    Integer position;
}
