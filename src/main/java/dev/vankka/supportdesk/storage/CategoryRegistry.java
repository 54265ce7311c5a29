package dev.vankka.supportdesk.storage;

import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.CategoryDraft;
import dev.vankka.supportdesk.model.CategoryUpdate;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The ordered ticket categories of each tenant.
 * <p>
 * A tenant always keeps at least one category. Deleting a category leaves its tickets in place with no category.
 */
@Slf4j
@RequiredArgsConstructor
public class CategoryRegistry {

    static final int MAX_NAME_LENGTH = 100;

    private final Database database;
    private final ConfigStore configStore;
    private final MessageTemplateStore messageTemplateStore;
    private final Clock clock;

    public Outcome<Category> create(String tenantId, CategoryDraft draft) {
        if (StringUtils.isBlank(draft.getName()) || draft.getName().trim().length() > MAX_NAME_LENGTH) {
            return Outcome.failure(Reason.INVALID_INPUT, "Category name is required and may be at most " + MAX_NAME_LENGTH + " characters.");
        }
        Instant now = now();
        try {
            Category created = database.inTransaction("create ticket category", connection -> {
                configStore.lockTenant(connection, tenantId);
                int position = draft.getPosition() != null ? draft.getPosition() : nextPosition(connection, tenantId);
                long id;
                try (PreparedStatement statement = connection.prepareStatement(
                        "INSERT INTO ticket_categories (tenant_id, name, description, glyph, support_role_ref, ticket_count, enabled, position, created_at, updated_at) " +
                                "VALUES (?, ?, ?, ?, ?, 0, TRUE, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS)) {
                    statement.setString(1, tenantId);
                    statement.setString(2, draft.getName().trim());
                    statement.setString(3, StringUtils.trimToNull(draft.getDescription()));
                    statement.setString(4, StringUtils.trimToNull(draft.getGlyph()));
                    statement.setString(5, StringUtils.trimToNull(draft.getSupportRoleRef()));
                    statement.setInt(6, position);
                    statement.setTimestamp(7, Database.timestamp(now));
                    statement.setTimestamp(8, Database.timestamp(now));
                    statement.executeUpdate();
                    try (ResultSet keys = statement.getGeneratedKeys()) {
                        keys.next();
                        id = keys.getLong(1);
                    }
                }
                messageTemplateStore.insertDefaults(connection, id, draft.getName().trim());
                return find(connection, id).orElseThrow(() -> new SQLException("Category vanished after insert"));
            });
            log.info("Created ticket category '{}' ({}) for tenant {}", created.getName(), created.getId(), tenantId);
            return Outcome.success(created);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Merges the non-null fields of {@code update} into the category.
     */
    public Outcome<Category> update(long categoryId, CategoryUpdate update) {
        if (Fields.isInvalidRequired(update.getName(), MAX_NAME_LENGTH)) {
            return Outcome.failure(Reason.INVALID_INPUT, "Category name must be 1-" + MAX_NAME_LENGTH + " characters.");
        }
        try {
            Optional<Category> merged = database.inTransaction("update ticket category", connection -> {
                Optional<Category> existing = find(connection, categoryId);
                if (existing.isEmpty()) {
                    return Optional.<Category>empty();
                }
                Category current = existing.get();
                Category next = current.toBuilder()
                        .name(Fields.merge(update.getName() != null ? update.getName().trim() : null, current.getName()))
                        .description(Fields.mergeOptional(update.getDescription(), current.getDescription()))
                        .glyph(Fields.mergeOptional(update.getGlyph(), current.getGlyph()))
                        .supportRoleRef(Fields.mergeOptional(update.getSupportRoleRef(), current.getSupportRoleRef()))
                        .position(Fields.merge(update.getPosition(), current.getPosition()))
                        .enabled(Fields.merge(update.getEnabled(), current.isEnabled()))
                        .updatedAt(now())
                        .build();
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE ticket_categories SET name = ?, description = ?, glyph = ?, support_role_ref = ?, position = ?, enabled = ?, updated_at = ? " +
                                "WHERE id = ?")) {
                    statement.setString(1, next.getName());
                    setNullableString(statement, 2, next.getDescription());
                    setNullableString(statement, 3, next.getGlyph());
                    setNullableString(statement, 4, next.getSupportRoleRef());
                    statement.setInt(5, next.getPosition());
                    statement.setBoolean(6, next.isEnabled());
                    statement.setTimestamp(7, Database.timestamp(next.getUpdatedAt()));
                    statement.setLong(8, categoryId);
                    statement.executeUpdate();
                }
                return Optional.of(next);
            });
            return merged.map(Outcome::success).orElseGet(() -> Outcome.failure(Reason.CATEGORY_NOT_FOUND));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Deletes a category and its message template. Its tickets are kept, with their category reference cleared.
     *
     * @param confirmation required when the category has ever had tickets, may be {@code null} otherwise
     */
    public Outcome<Category> delete(long categoryId, DeletionConfirmation confirmation) {
        try {
            return database.inTransaction("delete ticket category", connection -> {
                Optional<Category> existing = find(connection, categoryId);
                if (existing.isEmpty()) {
                    return Outcome.<Category>failure(Reason.CATEGORY_NOT_FOUND);
                }
                Category category = existing.get();
                configStore.lockTenant(connection, category.getTenantId());
                if (count(connection, category.getTenantId()) <= 1) {
                    return Outcome.<Category>failure(Reason.LAST_CATEGORY);
                }
                if (category.getTicketCount() > 0 && (confirmation == null || !confirmation.covers(categoryId))) {
                    return Outcome.<Category>failure(Reason.CONFIRMATION_REQUIRED,
                            "Category " + category.getName() + " has " + category.getTicketCount() + " ticket(s), deletion must be confirmed.");
                }
                try (PreparedStatement statement = connection.prepareStatement("DELETE FROM ticket_categories WHERE id = ?")) {
                    statement.setLong(1, categoryId);
                    statement.executeUpdate();
                }
                log.info("Deleted ticket category '{}' ({}) of tenant {}", category.getName(), categoryId, category.getTenantId());
                return Outcome.success(category);
            });
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Optional<Category> find(long categoryId) throws PersistenceException {
        return database.withConnection("load ticket category", connection -> find(connection, categoryId));
    }

    /**
     * All categories of a tenant ordered by position.
     */
    public List<Category> list(String tenantId) throws PersistenceException {
        return database.withConnection("list ticket categories", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT * FROM ticket_categories WHERE tenant_id = ? ORDER BY position, id")) {
                statement.setString(1, tenantId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    List<Category> categories = new ArrayList<>();
                    while (resultSet.next()) {
                        categories.add(map(resultSet));
                    }
                    return categories;
                }
            }
        });
    }

    public List<Category> listEnabled(String tenantId) throws PersistenceException {
        return list(tenantId).stream().filter(Category::isEnabled).collect(Collectors.toList());
    }

    void incrementTicketCount(Connection connection, long categoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE ticket_categories SET ticket_count = ticket_count + 1 WHERE id = ?")) {
            statement.setLong(1, categoryId);
            statement.executeUpdate();
        }
    }

    private Optional<Category> find(Connection connection, long categoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM ticket_categories WHERE id = ?")) {
            statement.setLong(1, categoryId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
            }
        }
    }

    private int count(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT COUNT(*) FROM ticket_categories WHERE tenant_id = ?")) {
            statement.setString(1, tenantId);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        }
    }

    private int nextPosition(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT COALESCE(MAX(position) + 1, 0) FROM ticket_categories WHERE tenant_id = ?")) {
            statement.setString(1, tenantId);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getInt(1);
            }
        }
    }

    private static Category map(ResultSet resultSet) throws SQLException {
        return Category.builder()
                .id(resultSet.getLong("id"))
                .tenantId(resultSet.getString("tenant_id"))
                .name(resultSet.getString("name"))
                .description(resultSet.getString("description"))
                .glyph(resultSet.getString("glyph"))
                .supportRoleRef(resultSet.getString("support_role_ref"))
                .ticketCount(resultSet.getLong("ticket_count"))
                .enabled(resultSet.getBoolean("enabled"))
                .position(resultSet.getInt("position"))
                .createdAt(Database.instant(resultSet.getTimestamp("created_at")))
                .updatedAt(Database.instant(resultSet.getTimestamp("updated_at")))
                .build();
    }

    private static void setNullableString(PreparedStatement statement, int index, String value) throws SQLException {
        if (value == null) {
            statement.setNull(index, Types.VARCHAR);
        } else {
            statement.setString(index, value);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
