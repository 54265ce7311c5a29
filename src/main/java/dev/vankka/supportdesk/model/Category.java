package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Category {

    long id;
    String tenantId;
    String name;
    String description;
    String glyph;
    String supportRoleRef;
    long ticketCount;
    boolean enabled;
    int position;
    Instant createdAt;
    Instant updatedAt;

    public boolean hasSupportRole() {
        return supportRoleRef != null && !supportRoleRef.isEmpty();
    }
}
