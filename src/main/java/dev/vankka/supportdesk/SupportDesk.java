package dev.vankka.supportdesk;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import dev.vankka.supportdesk.collector.InteractionCollector;
import dev.vankka.supportdesk.configuration.Configuration;
import dev.vankka.supportdesk.discord.JdaChannelResourceManager;
import dev.vankka.supportdesk.discord.JdaNotificationDelivery;
import dev.vankka.supportdesk.discord.JdaPrivilegeResolver;
import dev.vankka.supportdesk.listener.InteractionFeedListener;
import dev.vankka.supportdesk.listener.SlashCommandListener;
import dev.vankka.supportdesk.listener.TicketActionsListener;
import dev.vankka.supportdesk.listener.TicketPanelListener;
import dev.vankka.supportdesk.panel.PanelService;
import dev.vankka.supportdesk.storage.CategoryRegistry;
import dev.vankka.supportdesk.storage.ConfigStore;
import dev.vankka.supportdesk.storage.Database;
import dev.vankka.supportdesk.storage.MessageTemplateStore;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.storage.TenantSetup;
import dev.vankka.supportdesk.storage.TicketStore;
import dev.vankka.supportdesk.ticket.PrivilegeResolver;
import dev.vankka.supportdesk.ticket.TicketStateMachine;
import dev.vankka.supportdesk.wizard.ConfigurationWizard;
import dev.vankka.supportdesk.wizard.WizardTimeouts;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.JDABuilder;
import net.dv8tion.jda.api.requests.GatewayIntent;
import net.dv8tion.jda.api.utils.MemberCachePolicy;
import org.apache.commons.lang3.StringUtils;

import java.io.IOException;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.HashSet;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

@Slf4j
public class SupportDesk {

    public static void main(String[] args) throws Exception {
        new SupportDesk();
    }

    private final Database database;
    private final ExecutorService workers;
    private final ExecutorService sessions;
    private final ScheduledExecutorService scheduler;
    private final InteractionCollector collector;
    private final JDA jda;
    private Configuration configuration;

    public SupportDesk() throws IOException, PersistenceException, InterruptedException {
        reloadConfiguration();

        String botToken = configuration.botToken;
        if (StringUtils.isBlank(botToken)) {
            log.error("+--------------------+");
            log.error("| Bot token is blank |");
            log.error("+--------------------+");
            System.exit(1);
            throw new IllegalStateException("Bot token is blank");
        }

        database = new Database(configuration.databaseUrl);
        database.initialize();

        workers = Executors.newFixedThreadPool(Math.max(1, configuration.workerThreads),
                new ThreadFactoryBuilder().setNameFormat("SupportDesk - Worker #%d").setDaemon(true).build());
        sessions = Executors.newCachedThreadPool(
                new ThreadFactoryBuilder().setNameFormat("SupportDesk - Session #%d").setDaemon(true).build());
        scheduler = Executors.newSingleThreadScheduledExecutor(
                new ThreadFactoryBuilder().setNameFormat("SupportDesk - Scheduler").setDaemon(true).build());
        collector = new InteractionCollector(scheduler);

        jda = JDABuilder.createDefault(botToken, GatewayIntent.GUILD_MEMBERS)
                .setMemberCachePolicy(MemberCachePolicy.DEFAULT)
                .build();
        jda.awaitReady();

        Clock clock = Clock.systemUTC();
        ConfigStore configStore = new ConfigStore(database, clock);
        MessageTemplateStore messageTemplateStore = new MessageTemplateStore(database);
        CategoryRegistry categoryRegistry = new CategoryRegistry(database, configStore, messageTemplateStore, clock);
        TicketStore ticketStore = new TicketStore(database, configStore, categoryRegistry, clock);
        TenantSetup tenantSetup = new TenantSetup(configStore, categoryRegistry, configuration.defaultCategoryName);

        JdaChannelResourceManager channels = new JdaChannelResourceManager(jda);
        PrivilegeResolver privileges = new JdaPrivilegeResolver(jda, new HashSet<>(configuration.adminRoleIds));
        TicketStateMachine tickets = new TicketStateMachine(ticketStore, configStore, categoryRegistry, messageTemplateStore,
                channels, new JdaNotificationDelivery(jda), privileges, scheduler, configuration.channelDeleteDelay(), clock);
        PanelService panelService = new PanelService(configStore, categoryRegistry, channels);
        ConfigurationWizard wizard = new ConfigurationWizard(configStore, categoryRegistry, messageTemplateStore, panelService,
                collector, new WizardTimeouts(configuration.confirmationTimeout(), configuration.menuTimeout(), configuration.modalTimeout()), sessions);

        jda.addEventListener(
                new InteractionFeedListener(collector),
                new TicketPanelListener(tickets, categoryRegistry, panelService, workers),
                new TicketActionsListener(tickets, privileges, collector, workers,
                        configuration.confirmationTimeout(), configuration.channelDeleteDelay()),
                new SlashCommandListener(tickets, tenantSetup, panelService, wizard, privileges, workers)
        );
        jda.updateCommands().addCommands(SlashCommandListener.commands()).queue(
                commands -> log.info("Registered {} commands", commands.size()),
                error -> log.error("Failed to register commands", error)
        );

        Runtime.getRuntime().addShutdownHook(new Thread(this::stop, "SupportDesk - Shutdown"));
        log.info("SupportDesk is ready in {} servers", jda.getGuilds().size());
    }

    public void reloadConfiguration() throws IOException {
        this.configuration = Configuration.load(Paths.get("config.conf"));
    }

    public void stop() {
        log.info("Shutting down");
        collector.shutdown();
        jda.shutdown();
        workers.shutdown();
        sessions.shutdown();
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Scheduled tasks did not finish in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        database.close();
    }

    public Configuration getConfiguration() {
        return configuration;
    }
}
