package dev.vankka.supportdesk.storage;

import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.model.MessageTemplateUpdate;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import lombok.RequiredArgsConstructor;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;

/**
 * Welcome and closing texts per category.
 */
@RequiredArgsConstructor
public class MessageTemplateStore {

    private final Database database;

    public Optional<MessageTemplate> find(long categoryId) throws PersistenceException {
        return database.withConnection("load ticket messages", connection -> find(connection, categoryId));
    }

    /**
     * The category's template, or the defaults for a category named {@code categoryName} if it has none.
     */
    public MessageTemplate findOrDefault(long categoryId, String categoryName) throws PersistenceException {
        return find(categoryId).orElseGet(() -> MessageTemplate.defaults(categoryId, categoryName));
    }

    public Outcome<MessageTemplate> update(long categoryId, MessageTemplateUpdate update) {
        try {
            return database.inTransaction("update ticket messages", connection -> {
                String categoryName = categoryName(connection, categoryId);
                if (categoryName == null) {
                    return Outcome.<MessageTemplate>failure(Reason.CATEGORY_NOT_FOUND);
                }
                Optional<MessageTemplate> existing = find(connection, categoryId);
                if (existing.isEmpty()) {
                    insertDefaults(connection, categoryId, categoryName);
                }
                MessageTemplate current = existing.orElseGet(() -> MessageTemplate.defaults(categoryId, categoryName));
                MessageTemplate merged = current.toBuilder()
                        .welcomeMessage(Fields.mergeOptional(update.getWelcomeMessage(), current.getWelcomeMessage()))
                        .closeMessage(Fields.mergeOptional(update.getCloseMessage(), current.getCloseMessage()))
                        .includeSupportTeam(Fields.merge(update.getIncludeSupportTeam(), current.isIncludeSupportTeam()))
                        .build();
                try (PreparedStatement statement = connection.prepareStatement(
                        "UPDATE ticket_messages SET welcome_message = ?, close_message = ?, include_support_team = ? WHERE category_id = ?")) {
                    statement.setString(1, merged.getWelcomeMessage());
                    statement.setString(2, merged.getCloseMessage());
                    statement.setBoolean(3, merged.isIncludeSupportTeam());
                    statement.setLong(4, categoryId);
                    statement.executeUpdate();
                }
                return Outcome.success(merged);
            });
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    void insertDefaults(Connection connection, long categoryId, String categoryName) throws SQLException {
        MessageTemplate defaults = MessageTemplate.defaults(categoryId, categoryName);
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO ticket_messages (category_id, welcome_message, close_message, include_support_team) VALUES (?, ?, ?, ?)")) {
            statement.setLong(1, categoryId);
            statement.setString(2, defaults.getWelcomeMessage());
            statement.setString(3, defaults.getCloseMessage());
            statement.setBoolean(4, defaults.isIncludeSupportTeam());
            statement.executeUpdate();
        }
    }

    private Optional<MessageTemplate> find(Connection connection, long categoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM ticket_messages WHERE category_id = ?")) {
            statement.setLong(1, categoryId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                return Optional.of(MessageTemplate.builder()
                        .categoryId(categoryId)
                        .welcomeMessage(resultSet.getString("welcome_message"))
                        .closeMessage(resultSet.getString("close_message"))
                        .includeSupportTeam(resultSet.getBoolean("include_support_team"))
                        .build());
            }
        }
    }

    private String categoryName(Connection connection, long categoryId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("SELECT name FROM ticket_categories WHERE id = ?")) {
            statement.setLong(1, categoryId);
            try (ResultSet resultSet = statement.executeQuery()) {
                return resultSet.next() ? resultSet.getString(1) : null;
            }
        }
    }
}
