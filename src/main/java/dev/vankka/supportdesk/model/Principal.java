package dev.vankka.supportdesk.model;

import lombok.NonNull;
import lombok.Value;

/**
 * An actor reference used for channel permissions: a single user or a role.
 */
@Value
public class Principal {

    public enum Type {
        USER,
        ROLE
    }

    @NonNull String id;
    @NonNull Type type;

    public static Principal user(String id) {
        return new Principal(id, Type.USER);
    }

    public static Principal role(String id) {
        return new Principal(id, Type.ROLE);
    }

    /**
     * The role every member of the tenant holds; on Discord its id is the guild id.
     */
    public static Principal everyone(String tenantId) {
        return role(tenantId);
    }
}
