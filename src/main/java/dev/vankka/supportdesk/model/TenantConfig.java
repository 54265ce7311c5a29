package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class TenantConfig {

    public static final String DEFAULT_CATEGORY_NAME = "tickets";

    String tenantId;
    String defaultCategoryName;
    boolean enabled;
    long ticketCounter;
    Instant createdAt;
    Instant updatedAt;
}
