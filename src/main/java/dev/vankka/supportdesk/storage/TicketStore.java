package dev.vankka.supportdesk.storage;

import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.model.TicketStats;
import dev.vankka.supportdesk.model.TicketStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Ticket rows. Ticket numbers come from the tenant's counter row, incremented in the same transaction that inserts the ticket.
 */
@Slf4j
@RequiredArgsConstructor
public class TicketStore {

    private final Database database;
    private final ConfigStore configStore;
    private final CategoryRegistry categoryRegistry;
    private final Clock clock;

    /**
     * Inserts a new open ticket, allocating its number and counting it towards its category, atomically.
     */
    public Ticket create(String tenantId, long categoryId, String requesterRef, String channelRef) throws PersistenceException {
        Instant now = now();
        return database.inTransaction("create ticket", connection -> {
            long ticketNumber = configStore.nextTicketNumber(connection, tenantId);
            long id;
            try (PreparedStatement statement = connection.prepareStatement(
                    "INSERT INTO tickets (tenant_id, category_id, ticket_number, channel_ref, requester_ref, status, created_at, updated_at) " +
                            "VALUES (?, ?, ?, ?, ?, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS)) {
                statement.setString(1, tenantId);
                statement.setLong(2, categoryId);
                statement.setLong(3, ticketNumber);
                statement.setString(4, channelRef);
                statement.setString(5, requesterRef);
                statement.setString(6, TicketStatus.OPEN.name());
                statement.setTimestamp(7, Database.timestamp(now));
                statement.setTimestamp(8, Database.timestamp(now));
                statement.executeUpdate();
                try (ResultSet keys = statement.getGeneratedKeys()) {
                    keys.next();
                    id = keys.getLong(1);
                }
            }
            categoryRegistry.incrementTicketCount(connection, categoryId);
            return Ticket.builder()
                    .id(id)
                    .tenantId(tenantId)
                    .categoryId(categoryId)
                    .ticketNumber(ticketNumber)
                    .channelRef(channelRef)
                    .requesterRef(requesterRef)
                    .status(TicketStatus.OPEN)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        });
    }

    /**
     * Writes {@code updated} only if the stored row still has {@code current}'s status.
     *
     * @return the written ticket, or empty if the status changed concurrently
     */
    public Optional<Ticket> compareAndSet(Ticket current, Ticket updated) throws PersistenceException {
        Instant now = now();
        Instant updatedAt = now.isAfter(current.getUpdatedAt()) ? now : current.getUpdatedAt().plusMillis(1);
        Ticket written = updated.toBuilder().updatedAt(updatedAt).build();
        int rows = database.withConnection("update ticket", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "UPDATE tickets SET status = ?, closed_by_ref = ?, closed_at = ?, close_reason = ?, claimed_by_ref = ?, " +
                            "requester_ref = ?, updated_at = ? WHERE id = ? AND status = ?")) {
                statement.setString(1, written.getStatus().name());
                setNullable(statement, 2, written.getClosedByRef());
                statement.setTimestamp(3, Database.timestamp(written.getClosedAt()));
                setNullable(statement, 4, written.getCloseReason());
                setNullable(statement, 5, written.getClaimedByRef());
                statement.setString(6, written.getRequesterRef());
                statement.setTimestamp(7, Database.timestamp(written.getUpdatedAt()));
                statement.setLong(8, current.getId());
                statement.setString(9, current.getStatus().name());
                return statement.executeUpdate();
            }
        });
        return rows == 1 ? Optional.of(written) : Optional.empty();
    }

    public Optional<Ticket> find(long ticketId) throws PersistenceException {
        return database.withConnection("load ticket", connection -> {
            try (PreparedStatement statement = connection.prepareStatement("SELECT * FROM tickets WHERE id = ?")) {
                statement.setLong(1, ticketId);
                return single(statement);
            }
        });
    }

    public Optional<Ticket> findByChannel(String channelRef) throws PersistenceException {
        return database.withConnection("load ticket by channel", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT * FROM tickets WHERE channel_ref = ? ORDER BY id DESC LIMIT 1")) {
                statement.setString(1, channelRef);
                return single(statement);
            }
        });
    }

    public List<Ticket> findOpenByRequester(String tenantId, String requesterRef) throws PersistenceException {
        return database.withConnection("load open tickets", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT * FROM tickets WHERE tenant_id = ? AND requester_ref = ? AND status = ? ORDER BY id")) {
                statement.setString(1, tenantId);
                statement.setString(2, requesterRef);
                statement.setString(3, TicketStatus.OPEN.name());
                return list(statement);
            }
        });
    }

    public List<Ticket> listByTenant(String tenantId) throws PersistenceException {
        return database.withConnection("list tickets", connection -> {
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT * FROM tickets WHERE tenant_id = ? ORDER BY ticket_number")) {
                statement.setString(1, tenantId);
                return list(statement);
            }
        });
    }

    public TicketStats stats(String tenantId) throws PersistenceException {
        return database.withConnection("load ticket stats", connection -> {
            long open = 0;
            long closed = 0;
            long archived = 0;
            Map<String, Long> perCategory = new LinkedHashMap<>();
            try (PreparedStatement statement = connection.prepareStatement(
                    "SELECT c.name AS category_name, t.status AS status, COUNT(*) AS amount FROM tickets t " +
                            "LEFT JOIN ticket_categories c ON c.id = t.category_id " +
                            "WHERE t.tenant_id = ? GROUP BY c.name, t.status ORDER BY c.name")) {
                statement.setString(1, tenantId);
                try (ResultSet resultSet = statement.executeQuery()) {
                    while (resultSet.next()) {
                        String category = resultSet.getString("category_name");
                        long amount = resultSet.getLong("amount");
                        switch (TicketStatus.valueOf(resultSet.getString("status"))) {
                            case OPEN:
                                open += amount;
                                break;
                            case CLOSED:
                                closed += amount;
                                break;
                            case ARCHIVED:
                                archived += amount;
                                break;
                        }
                        perCategory.merge(category != null ? category : TicketStats.UNCATEGORIZED, amount, Long::sum);
                    }
                }
            }
            return new TicketStats(open + closed + archived, open, closed, archived, perCategory);
        });
    }

    private Optional<Ticket> single(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            return resultSet.next() ? Optional.of(map(resultSet)) : Optional.empty();
        }
    }

    private List<Ticket> list(PreparedStatement statement) throws SQLException {
        try (ResultSet resultSet = statement.executeQuery()) {
            List<Ticket> tickets = new ArrayList<>();
            while (resultSet.next()) {
                tickets.add(map(resultSet));
            }
            return tickets;
        }
    }

    private static Ticket map(ResultSet resultSet) throws SQLException {
        long categoryId = resultSet.getLong("category_id");
        return Ticket.builder()
                .id(resultSet.getLong("id"))
                .tenantId(resultSet.getString("tenant_id"))
                .categoryId(resultSet.wasNull() ? null : categoryId)
                .ticketNumber(resultSet.getLong("ticket_number"))
                .channelRef(resultSet.getString("channel_ref"))
                .requesterRef(resultSet.getString("requester_ref"))
                .closedByRef(resultSet.getString("closed_by_ref"))
                .closedAt(Database.instant(resultSet.getTimestamp("closed_at")))
                .closeReason(resultSet.getString("close_reason"))
                .claimedByRef(resultSet.getString("claimed_by_ref"))
                .status(TicketStatus.valueOf(resultSet.getString("status")))
                .createdAt(Database.instant(resultSet.getTimestamp("created_at")))
                .updatedAt(Database.instant(resultSet.getTimestamp("updated_at")))
                .build();
    }

    private static void setNullable(PreparedStatement statement, int index, String value) throws SQLException {
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
