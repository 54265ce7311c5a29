package dev.vankka.supportdesk.ticket;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

import java.util.Set;

/**
 * Component ids of the interactive elements tickets and panels carry.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class TicketActions {

    public static final String CREATE = "create_ticket";
    public static final String CATEGORY_SELECT = "ticket_category_select";
    public static final String CLOSE = "ticket_close";
    public static final String CLOSE_MODAL = "ticket_close_modal";
    public static final String CLOSE_REASON = "ticket_close_reason";
    public static final String REOPEN = "ticket_reopen";
    public static final String ARCHIVE = "ticket_archive";
    public static final String DELETE = "ticket_delete";
    public static final String DELETE_CONFIRM = "confirm_delete";
    public static final String DELETE_CANCEL = "cancel_delete";
    public static final String CLAIM = "ticket_claim";

    private static final Set<String> DIRECT = Set.of(CREATE, CATEGORY_SELECT, CLOSE, CLOSE_MODAL, REOPEN, ARCHIVE, DELETE, CLAIM);

    /**
     * Whether the component is handled on its own rather than answering a pending wait.
     */
    public static boolean isDirect(String componentId) {
        return DIRECT.contains(componentId);
    }
}
