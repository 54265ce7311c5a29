package dev.vankka.supportdesk.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TenantConfigUpdate {

    String defaultCategoryName;
    Boolean enabled;
}
