package dev.vankka.supportdesk.storage;

import lombok.Value;

/**
 * Proof that an administrator explicitly confirmed deleting a category that still has tickets.
 */
@Value
public class DeletionConfirmation {

    long categoryId;

    public static DeletionConfirmation confirmed(long categoryId) {
        return new DeletionConfirmation(categoryId);
    }

    boolean covers(long categoryId) {
        return this.categoryId == categoryId;
    }
}
