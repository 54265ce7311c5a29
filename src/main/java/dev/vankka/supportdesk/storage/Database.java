package dev.vankka.supportdesk.storage;

import lombok.extern.slf4j.Slf4j;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

/**
 * Embedded H2 database holding the ticket system tables.
 * <p>
 * Every unit of work gets its own connection, so concurrent events don't share transaction state.
 * One extra connection is held open for the lifetime of this object, which keeps in-memory databases alive.
 */
@Slf4j
public class Database implements AutoCloseable {

    private static final List<String> SCHEMA = Arrays.asList(
            "CREATE TABLE IF NOT EXISTS tenant_configs (" +
                    "tenant_id VARCHAR(32) PRIMARY KEY, " +
                    "default_category_name VARCHAR(100) NOT NULL, " +
                    "enabled BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "ticket_counter BIGINT NOT NULL DEFAULT 0, " +
                    "created_at TIMESTAMP NOT NULL, " +
                    "updated_at TIMESTAMP NOT NULL)",
            "CREATE TABLE IF NOT EXISTS button_configs (" +
                    "tenant_id VARCHAR(32) PRIMARY KEY REFERENCES tenant_configs(tenant_id) ON DELETE CASCADE, " +
                    "label VARCHAR(80) NOT NULL, " +
                    "glyph VARCHAR(64), " +
                    "style VARCHAR(16) NOT NULL, " +
                    "message_ref VARCHAR(32), " +
                    "channel_ref VARCHAR(32), " +
                    "embed_title VARCHAR(256), " +
                    "embed_description VARCHAR(4096), " +
                    "embed_color VARCHAR(7), " +
                    "log_channel_ref VARCHAR(32))",
            "CREATE TABLE IF NOT EXISTS select_menu_configs (" +
                    "tenant_id VARCHAR(32) PRIMARY KEY REFERENCES tenant_configs(tenant_id) ON DELETE CASCADE, " +
                    "placeholder VARCHAR(150) NOT NULL, " +
                    "message_ref VARCHAR(32), " +
                    "min_values INT NOT NULL DEFAULT 1, " +
                    "max_values INT NOT NULL DEFAULT 1, " +
                    "embed_title VARCHAR(256), " +
                    "embed_description VARCHAR(4096), " +
                    "embed_color VARCHAR(7))",
            "CREATE TABLE IF NOT EXISTS ticket_categories (" +
                    "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "tenant_id VARCHAR(32) NOT NULL REFERENCES tenant_configs(tenant_id) ON DELETE CASCADE, " +
                    "name VARCHAR(100) NOT NULL, " +
                    "description VARCHAR(1024), " +
                    "glyph VARCHAR(64), " +
                    "support_role_ref VARCHAR(32), " +
                    "ticket_count BIGINT NOT NULL DEFAULT 0, " +
                    "enabled BOOLEAN NOT NULL DEFAULT TRUE, " +
                    "position INT NOT NULL DEFAULT 0, " +
                    "created_at TIMESTAMP NOT NULL, " +
                    "updated_at TIMESTAMP NOT NULL)",
            "CREATE TABLE IF NOT EXISTS ticket_messages (" +
                    "category_id BIGINT PRIMARY KEY REFERENCES ticket_categories(id) ON DELETE CASCADE, " +
                    "welcome_message VARCHAR(4000), " +
                    "close_message VARCHAR(4000), " +
                    "include_support_team BOOLEAN NOT NULL DEFAULT TRUE)",
            // category_id is nulled rather than cascaded, closed tickets are the audit trail
            "CREATE TABLE IF NOT EXISTS tickets (" +
                    "id BIGINT GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY, " +
                    "tenant_id VARCHAR(32) NOT NULL REFERENCES tenant_configs(tenant_id) ON DELETE CASCADE, " +
                    "category_id BIGINT REFERENCES ticket_categories(id) ON DELETE SET NULL, " +
                    "ticket_number BIGINT NOT NULL, " +
                    "channel_ref VARCHAR(32) NOT NULL, " +
                    "requester_ref VARCHAR(32) NOT NULL, " +
                    "closed_by_ref VARCHAR(32), " +
                    "closed_at TIMESTAMP, " +
                    "close_reason VARCHAR(1024), " +
                    "claimed_by_ref VARCHAR(32), " +
                    "status VARCHAR(16) NOT NULL, " +
                    "created_at TIMESTAMP NOT NULL, " +
                    "updated_at TIMESTAMP NOT NULL, " +
                    "CONSTRAINT uq_ticket_number UNIQUE (tenant_id, ticket_number))",
            "CREATE INDEX IF NOT EXISTS idx_tickets_channel ON tickets(channel_ref)",
            "CREATE INDEX IF NOT EXISTS idx_tickets_requester ON tickets(tenant_id, requester_ref, status)"
    );

    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection connection) throws SQLException;
    }

    private final String url;
    private Connection keepAlive;

    public Database(String url) {
        this.url = url;
    }

    public void initialize() throws PersistenceException {
        try {
            keepAlive = DriverManager.getConnection(url);
            try (Statement statement = keepAlive.createStatement()) {
                for (String ddl : SCHEMA) {
                    statement.execute(ddl);
                }
            }
            log.info("Database initialized at {}", url);
        } catch (SQLException e) {
            throw new PersistenceException("Failed to initialize database", e);
        }
    }

    public <T> T withConnection(String operation, SqlWork<T> work) throws PersistenceException {
        try (Connection connection = DriverManager.getConnection(url)) {
            return work.apply(connection);
        } catch (SQLException e) {
            log.error("Database operation '{}' failed", operation, e);
            throw new PersistenceException("Failed to " + operation, e);
        }
    }

    /**
     * Runs {@code work} in a single transaction, rolling back if it throws.
     */
    public <T> T inTransaction(String operation, SqlWork<T> work) throws PersistenceException {
        return withConnection(operation, connection -> {
            connection.setAutoCommit(false);
            try {
                T result = work.apply(connection);
                connection.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                connection.rollback();
                throw e;
            }
        });
    }

    @Override
    public void close() {
        if (keepAlive == null) {
            return;
        }
        try {
            keepAlive.close();
        } catch (SQLException e) {
            log.error("Failed to close database connection", e);
        }
    }

    static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }
}
