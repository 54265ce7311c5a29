package dev.vankka.supportdesk.storage;

import com.google.common.util.concurrent.Striped;
import dev.vankka.supportdesk.model.CategoryDraft;
import dev.vankka.supportdesk.model.TenantConfig;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.locks.Lock;

/**
 * Provisions a tenant the first time it uses the ticket system.
 */
@Slf4j
@RequiredArgsConstructor
public class TenantSetup {

    static final String DEFAULT_CATEGORY = "General Support";

    private final ConfigStore configStore;
    private final CategoryRegistry categoryRegistry;
    private final String defaultCategoryName;
    private final Striped<Lock> tenantLocks = Striped.lock(16);

    /**
     * Returns the tenant's configuration, creating it with one default category if it doesn't exist yet. Calls for
     * the same tenant run one at a time.
     */
    public Outcome<TenantConfig> ensure(String tenantId) {
        Lock lock = tenantLocks.get(tenantId);
        lock.lock();
        try {
            Optional<TenantConfig> existing = configStore.find(tenantId);
            if (existing.isPresent()) {
                if (categoryRegistry.list(tenantId).isEmpty()) {
                    createDefaultCategory(tenantId);
                }
                return Outcome.success(existing.get());
            }
            TenantConfig created = configStore.create(tenantId, defaultCategoryName);
            createDefaultCategory(tenantId);
            return Outcome.success(created);
        } catch (PersistenceException e) {
            log.error("Failed to set up tenant {}", tenantId, e);
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        } finally {
            lock.unlock();
        }
    }

    private void createDefaultCategory(String tenantId) throws PersistenceException {
        Outcome<?> outcome = categoryRegistry.create(tenantId, CategoryDraft.builder()
                .name(DEFAULT_CATEGORY)
                .description("Get help from the support team")
                .glyph("🎫")
                .build());
        if (outcome.isFailure()) {
            throw new PersistenceException("Failed to create default category: " + outcome.getMessage(), null);
        }
    }
}
