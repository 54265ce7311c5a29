package dev.vankka.supportdesk.ticket;

/**
 * The host platform's permission checks.
 */
public interface PrivilegeResolver {

    /**
     * Whether the principal is server staff allowed to perform destructive ticket actions.
     */
    boolean isElevated(String tenantId, String principalRef);

    boolean hasRole(String tenantId, String principalRef, String roleRef);

    /**
     * Whether the principal is an automated account.
     */
    boolean isBot(String principalRef);
}
