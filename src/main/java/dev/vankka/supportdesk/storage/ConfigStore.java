package dev.vankka.supportdesk.storage;

import dev.vankka.supportdesk.model.ButtonConfig;
import dev.vankka.supportdesk.model.ButtonConfigUpdate;
import dev.vankka.supportdesk.model.ButtonStyle;
import dev.vankka.supportdesk.model.SelectMenuConfig;
import dev.vankka.supportdesk.model.SelectMenuConfigUpdate;
import dev.vankka.supportdesk.model.TenantConfig;
import dev.vankka.supportdesk.model.TenantConfigUpdate;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Owns the per-tenant configuration rows: the tenant itself, its creation button and its category select menu.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigStore {

    static final int MAX_SELECT_VALUES = 25;

    private final Database database;
    private final Clock clock;

    public Optional<TenantConfig> find(String tenantId) throws PersistenceException {
        return database.withConnection("load tenant config", connection -> find(connection, tenantId));
    }

    /**
     * Creates the tenant row together with its default button and select menu configuration.
     */
    public TenantConfig create(String tenantId, String defaultCategoryName) throws PersistenceException {
        Instant now = now();
        database.inTransaction("create tenant config", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO tenant_configs (tenant_id, default_category_name, enabled, ticket_counter, created_at, updated_at) " +
                            "VALUES (?, ?, TRUE, 0, ?, ?)")) {
                statement.setString(1, tenantId);
                statement.setString(2, defaultCategoryName);
                statement.setTimestamp(3, Database.timestamp(now));
                statement.setTimestamp(4, Database.timestamp(now));
                statement.executeUpdate();
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO button_configs (tenant_id, label, glyph, style) VALUES (?, ?, ?, ?)")) {
                statement.setString(1, tenantId);
                statement.setString(2, ButtonConfig.DEFAULT_LABEL);
                statement.setString(3, ButtonConfig.DEFAULT_GLYPH);
                statement.setString(4, ButtonStyle.PRIMARY.name());
                statement.executeUpdate();
            }
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO select_menu_configs (tenant_id, placeholder, min_values, max_values) VALUES (?, ?, 1, 1)")) {
                statement.setString(1, tenantId);
                statement.setString(2, SelectMenuConfig.DEFAULT_PLACEHOLDER);
                statement.executeUpdate();
            }
            return null;
        });
        log.info("Created ticket configuration for tenant {}", tenantId);
        return find(tenantId).orElseThrow(() -> new IllegalStateException("Tenant vanished after creation: " + tenantId));
    }

    public Outcome<TenantConfig> update(String tenantId, TenantConfigUpdate update) {
        if (Fields.isInvalidRequired(update.getDefaultCategoryName(), 100)) {
            return Outcome.failure(Reason.INVALID_INPUT, "The default category name must be 1-100 characters.");
        }
        try {
            Optional<TenantConfig> existing = find(tenantId);
            if (existing.isEmpty()) {
                return Outcome.failure(Reason.INVALID_INPUT, "The ticket system is not set up in this server.");
            }
            TenantConfig current = existing.get();
            TenantConfig merged = current.toBuilder()
                    .defaultCategoryName(Fields.merge(trim(update.getDefaultCategoryName()), current.getDefaultCategoryName()))
                    .enabled(Fields.merge(update.getEnabled(), current.isEnabled()))
                    .updatedAt(now())
                    .build();
            database.withConnection("update tenant config", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE tenant_configs SET default_category_name = ?, enabled = ?, updated_at = ? WHERE tenant_id = ?")) {
                    statement.setString(1, merged.getDefaultCategoryName());
                    statement.setBoolean(2, merged.isEnabled());
                    statement.setTimestamp(3, Database.timestamp(merged.getUpdatedAt()));
                    statement.setString(4, tenantId);
                    return statement.executeUpdate();
                }
            });
            return Outcome.success(merged);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Outcome<TenantConfig> setEnabled(String tenantId, boolean enabled) {
        return update(tenantId, TenantConfigUpdate.builder().enabled(enabled).build());
    }

    /**
     * Removes the tenant and, through cascading keys, everything it owns.
     */
    public boolean delete(String tenantId) throws PersistenceException {
        int deleted = database.withConnection("delete tenant config", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("DELETE FROM tenant_configs WHERE tenant_id = ?")) {
                statement.setString(1, tenantId);
                return statement.executeUpdate();
            }
        });
        if (deleted > 0) {
            log.info("Deleted ticket configuration for tenant {}", tenantId);
        }
        return deleted > 0;
    }

    public Optional<ButtonConfig> findButtonConfig(String tenantId) throws PersistenceException {
        return database.withConnection("load button config", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM button_configs WHERE tenant_id = ?")) {
                statement.setString(1, tenantId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(ButtonConfig.builder()
                            .tenantId(tenantId)
                            .label(resultSet.getString("label"))
                            .glyph(resultSet.getString("glyph"))
                            .style(ButtonStyle.fromName(resultSet.getString("style")).orElse(ButtonStyle.PRIMARY))
                            .messageRef(resultSet.getString("message_ref"))
                            .channelRef(resultSet.getString("channel_ref"))
                            .embedTitle(resultSet.getString("embed_title"))
                            .embedDescription(resultSet.getString("embed_description"))
                            .embedColor(resultSet.getString("embed_color"))
                            .logChannelRef(resultSet.getString("log_channel_ref"))
                            .build());
                }
            }
        });
    }

    public Outcome<ButtonConfig> updateButtonConfig(String tenantId, ButtonConfigUpdate update) {
        if (Fields.isInvalidRequired(update.getLabel(), 80)) {
            return Outcome.failure(Reason.INVALID_INPUT, "The button label must be 1-80 characters.");
        }
        if (Fields.isInvalidColorUpdate(update.getEmbedColor())) {
            return Outcome.failure(Reason.INVALID_INPUT, "Please provide a valid hex color code (e.g., #FF5733).");
        }
        try {
            Optional<ButtonConfig> existing = findButtonConfig(tenantId);
            if (existing.isEmpty()) {
                return Outcome.failure(Reason.INVALID_INPUT, "Ticket button configuration not found.");
            }
            ButtonConfig current = existing.get();
            ButtonConfig merged = current.toBuilder()
                    .label(Fields.merge(trim(update.getLabel()), current.getLabel()))
                    .glyph(Fields.mergeOptional(update.getGlyph(), current.getGlyph()))
                    .style(Fields.merge(update.getStyle(), current.getStyle()))
                    .messageRef(Fields.mergeOptional(update.getMessageRef(), current.getMessageRef()))
                    .channelRef(Fields.mergeOptional(update.getChannelRef(), current.getChannelRef()))
                    .embedTitle(Fields.mergeOptional(update.getEmbedTitle(), current.getEmbedTitle()))
                    .embedDescription(Fields.mergeOptional(update.getEmbedDescription(), current.getEmbedDescription()))
                    .embedColor(Fields.mergeColor(update.getEmbedColor(), current.getEmbedColor()))
                    .logChannelRef(Fields.mergeOptional(update.getLogChannelRef(), current.getLogChannelRef()))
                    .build();
            database.inTransaction("update button config", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE button_configs SET label = ?, glyph = ?, style = ?, message_ref = ?, channel_ref = ?, " +
                                "embed_title = ?, embed_description = ?, embed_color = ?, log_channel_ref = ? WHERE tenant_id = ?")) {
                    statement.setString(1, merged.getLabel());
                    statement.setString(2, merged.getGlyph());
                    statement.setString(3, merged.getStyle().name());
                    statement.setString(4, merged.getMessageRef());
                    statement.setString(5, merged.getChannelRef());
                    statement.setString(6, merged.getEmbedTitle());
                    statement.setString(7, merged.getEmbedDescription());
                    statement.setString(8, merged.getEmbedColor());
                    statement.setString(9, merged.getLogChannelRef());
                    statement.setString(10, tenantId);
                    statement.executeUpdate();
                }
                touch(connection, tenantId);
                return null;
            });
            return Outcome.success(merged);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Optional<SelectMenuConfig> findSelectMenuConfig(String tenantId) throws PersistenceException {
        return database.withConnection("load select menu config", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM select_menu_configs WHERE tenant_id = ?")) {
                statement.setString(1, tenantId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    if (!resultSet.next()) {
                        return Optional.empty();
                    }
                    return Optional.of(SelectMenuConfig.builder()
                            .tenantId(tenantId)
                            .placeholder(resultSet.getString("placeholder"))
                            .messageRef(resultSet.getString("message_ref"))
                            .minValues(resultSet.getInt("min_values"))
                            .maxValues(resultSet.getInt("max_values"))
                            .embedTitle(resultSet.getString("embed_title"))
                            .embedDescription(resultSet.getString("embed_description"))
                            .embedColor(resultSet.getString("embed_color"))
                            .build());
                }
            }
        });
    }

    public Outcome<SelectMenuConfig> updateSelectMenuConfig(String tenantId, SelectMenuConfigUpdate update) {
        if (Fields.isInvalidRequired(update.getPlaceholder(), 150)) {
            return Outcome.failure(Reason.INVALID_INPUT, "The placeholder must be 1-150 characters.");
        }
        if (Fields.isInvalidColorUpdate(update.getEmbedColor())) {
            return Outcome.failure(Reason.INVALID_INPUT, "Please provide a valid hex color code (e.g., #FF5733).");
        }
        try {
            Optional<SelectMenuConfig> existing = findSelectMenuConfig(tenantId);
            if (existing.isEmpty()) {
                return Outcome.failure(Reason.INVALID_INPUT, "Select menu configuration not found.");
            }
            SelectMenuConfig current = existing.get();
            SelectMenuConfig merged = current.toBuilder()
                    .placeholder(Fields.merge(trim(update.getPlaceholder()), current.getPlaceholder()))
                    .messageRef(Fields.mergeOptional(update.getMessageRef(), current.getMessageRef()))
                    .minValues(Fields.merge(update.getMinValues(), current.getMinValues()))
                    .maxValues(Fields.merge(update.getMaxValues(), current.getMaxValues()))
                    .embedTitle(Fields.mergeOptional(update.getEmbedTitle(), current.getEmbedTitle()))
                    .embedDescription(Fields.mergeOptional(update.getEmbedDescription(), current.getEmbedDescription()))
                    .embedColor(Fields.mergeColor(update.getEmbedColor(), current.getEmbedColor()))
                    .build();
            if (merged.getMinValues() < 1 || merged.getMaxValues() > MAX_SELECT_VALUES || merged.getMinValues() > merged.getMaxValues()) {
                return Outcome.failure(Reason.INVALID_INPUT,
                        "Selectable values must satisfy 1 <= min <= max <= " + MAX_SELECT_VALUES + ".");
            }
            database.inTransaction("update select menu config", connection -> {
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE select_menu_configs SET placeholder = ?, message_ref = ?, min_values = ?, max_values = ?, " +
                                "embed_title = ?, embed_description = ?, embed_color = ? WHERE tenant_id = ?")) {
                    statement.setString(1, merged.getPlaceholder());
                    statement.setString(2, merged.getMessageRef());
                    statement.setInt(3, merged.getMinValues());
                    statement.setInt(4, merged.getMaxValues());
                    statement.setString(5, merged.getEmbedTitle());
                    statement.setString(6, merged.getEmbedDescription());
                    statement.setString(7, merged.getEmbedColor());
                    statement.setString(8, tenantId);
                    statement.executeUpdate();
                }
                touch(connection, tenantId);
                return null;
            });
            return Outcome.success(merged);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Allocates the next ticket number for a tenant. The row stays locked until {@code connection} commits,
     * which serializes allocation per tenant.
     */
    long nextTicketNumber(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "UPDATE tenant_configs SET ticket_counter = ticket_counter + 1 WHERE tenant_id = ?")) {
            statement.setString(1, tenantId);
            if (statement.executeUpdate() != 1) {
                throw new SQLException("No tenant configuration for " + tenantId);
            }
        }
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT ticket_counter FROM tenant_configs WHERE tenant_id = ?")) {
            statement.setString(1, tenantId);
            try (ResultSet resultSet = statement.executeQuery()) {
                resultSet.next();
                return resultSet.getLong(1);
            }
        }
    }

    /**
     * Locks the tenant row for the rest of the transaction.
     */
    void lockTenant(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "SELECT tenant_id FROM tenant_configs WHERE tenant_id = ? FOR UPDATE")) {
            statement.setString(1, tenantId);
            statement.executeQuery().close();
        }
    }

    private Optional<TenantConfig> find(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM tenant_configs WHERE tenant_id = ?")) {
            statement.setString(1, tenantId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(TenantConfig.builder()
                        .tenantId(tenantId)
                        .defaultCategoryName(resultSet.getString("default_category_name"))
                        .enabled(resultSet.getBoolean("enabled"))
                        .ticketCounter(resultSet.getLong("ticket_counter"))
                        .createdAt(Database.instant(resultSet.getTimestamp("created_at")))
                        .updatedAt(Database.instant(resultSet.getTimestamp("updated_at")))
                        .build());
            }
        }
    }

    private void touch(Connection connection, String tenantId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("UPDATE tenant_configs SET updated_at = ? WHERE tenant_id = ?")) {
            statement.setTimestamp(1, Database.timestamp(now()));
            statement.setString(2, tenantId);
            statement.executeUpdate();
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String trim(String value) {
        return value != null ? value.trim() : null;
    }
}
