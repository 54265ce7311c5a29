package dev.vankka.supportdesk.storage;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * The stores wired against a fresh in-memory database.
 */
public class TestStores implements AutoCloseable {

    public static final String TENANT = "100000000000000001";

    public final Clock clock = Clock.fixed(Instant.parse("2024-03-01T12:00:00Z"), ZoneOffset.UTC);
    public final Database database;
    public final ConfigStore configStore;
    public final MessageTemplateStore messageTemplateStore;
    public final CategoryRegistry categoryRegistry;
    public final TicketStore ticketStore;
    public final TenantSetup tenantSetup;

    public TestStores() throws PersistenceException {
        database = new Database("jdbc:h2:mem:" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000");
        database.initialize();
        configStore = new ConfigStore(database, clock);
        messageTemplateStore = new MessageTemplateStore(database);
        categoryRegistry = new CategoryRegistry(database, configStore, messageTemplateStore, clock);
        ticketStore = new TicketStore(database, configStore, categoryRegistry, clock);
        tenantSetup = new TenantSetup(configStore, categoryRegistry, "tickets");
    }

    /**
     * Sets up {@link #TENANT} and returns the id of its default category.
     */
    public long setUpTenant() throws PersistenceException {
        tenantSetup.ensure(TENANT);
        return categoryRegistry.list(TENANT).get(0).getId();
    }

    @Override
    public void close() throws PersistenceException {
        database.withConnection("drop database", connection -> connection.createStatement().execute("DROP ALL OBJECTS"));
        database.close();
    }
}
