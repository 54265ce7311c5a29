package dev.vankka.supportdesk.wizard;

import dev.vankka.supportdesk.collector.Interaction;
import dev.vankka.supportdesk.collector.InteractionCollector;
import dev.vankka.supportdesk.collector.Responder;
import dev.vankka.supportdesk.message.ModalForm;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.CategoryDraft;
import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.panel.PanelMode;
import dev.vankka.supportdesk.panel.PanelService;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.storage.TestStores;
import dev.vankka.supportdesk.ticket.ExternalResourceException;
import dev.vankka.supportdesk.ticket.InMemoryChannelResourceManager;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static dev.vankka.supportdesk.storage.TestStores.TENANT;
import static org.assertj.core.api.Assertions.assertThat;

class ConfigurationWizardTest {

    private static final String ADMIN = "3003";
    private static final String SURFACE = "wizard-message";

    private TestStores stores;
    private InMemoryChannelResourceManager channels;
    private PanelService panels;
    private ScheduledExecutorService scheduler;
    private ExecutorService sessionThread;
    private InteractionCollector collector;
    private RecordingSurface surface;
    private RecordingResponder responder;
    private AtomicInteger interactionIds;

    @BeforeEach
    void setUp() throws PersistenceException {
        stores = new TestStores();
        stores.setUpTenant();
        channels = new InMemoryChannelResourceManager();
        panels = new PanelService(stores.configStore, stores.categoryRegistry, channels);
        scheduler = Executors.newSingleThreadScheduledExecutor();
        sessionThread = Executors.newSingleThreadExecutor();
        collector = new InteractionCollector(scheduler);
        surface = new RecordingSurface();
        responder = new RecordingResponder();
        interactionIds = new AtomicInteger();
    }

    @AfterEach
    void tearDown() throws PersistenceException {
        collector.shutdown();
        sessionThread.shutdownNow();
        scheduler.shutdownNow();
        stores.close();
    }

    private ConfigurationWizard wizard(WizardTimeouts timeouts, ExecutorService sessions) {
        return new ConfigurationWizard(stores.configStore, stores.categoryRegistry,
                stores.messageTemplateStore, panels, collector, timeouts, sessions);
    }

    private CompletableFuture<Void> start(WizardTimeouts timeouts) {
        return wizard(timeouts, sessionThread).start(TENANT, ADMIN, surface);
    }

    private CompletableFuture<Void> start() {
        return start(new WizardTimeouts(Duration.ofSeconds(10), Duration.ofSeconds(10), Duration.ofSeconds(10)));
    }

    private void awaitWaiting() {
        awaitWaiting(SURFACE);
    }

    private void awaitWaiting(String surfaceId) {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!collector.isWaitingFor(surfaceId, ADMIN)) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Configuration session is not waiting for input");
            }
            Thread.onSpinWait();
        }
    }

    private Interaction.InteractionBuilder interaction(Interaction.Type type, String componentId) {
        return Interaction.builder()
                .id(String.valueOf(interactionIds.incrementAndGet()))
                .surfaceId(SURFACE)
                .principalId(ADMIN)
                .type(type)
                .componentId(componentId)
                .responder(responder);
    }

    private void submit(Interaction interaction) {
        awaitWaiting();
        assertThat(collector.submit(interaction)).as("consumed %s", interaction.getComponentId()).isTrue();
    }

    private void click(String componentId) {
        submit(interaction(Interaction.Type.BUTTON, componentId).build());
    }

    private void select(String componentId, String value) {
        submit(interaction(Interaction.Type.SELECT, componentId).value(value).build());
    }

    private void answer(String componentId, Map<String, String> fields) {
        submit(interaction(Interaction.Type.MODAL, WizardIds.modalId(componentId)).fields(fields).build());
    }

    private void finish(CompletableFuture<Void> session) throws Exception {
        session.get(10, TimeUnit.SECONDS);
    }

    @Test
    void closingEndsTheSession() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.CLOSE);
        finish(session);

        assertThat(surface.finished).isEqualTo(ConfigurationWizard.CLOSED);
        assertThat(responder.deferred).hasValue(1);
        assertThat(surface.screens.get(0).getActions()).extracting("id").contains(WizardIds.BUTTON, WizardIds.CLOSE);
    }

    @Test
    @DisplayName("a session nobody answers ends cancelled")
    void timeoutCancelsSession() throws Exception {
        CompletableFuture<Void> session = start(new WizardTimeouts(Duration.ofMillis(50), Duration.ofMillis(50), Duration.ofMillis(50)));

        finish(session);

        assertThat(surface.finished).isEqualTo(ConfigurationWizard.CANCELLED);
        assertThat(collector.isWaiting(SURFACE)).isFalse();
    }

    @Test
    void otherUsersCannotDriveTheSession() throws Exception {
        CompletableFuture<Void> session = start();
        awaitWaiting();

        Interaction intruder = interaction(Interaction.Type.BUTTON, WizardIds.CLOSE).principalId("4004").build();
        assertThat(collector.submit(intruder)).isFalse();

        click(WizardIds.CLOSE);
        finish(session);
        assertThat(surface.finished).isEqualTo(ConfigurationWizard.CLOSED);
    }

    @Test
    void unknownTenantIsNotConfigured() {
        wizard(WizardTimeouts.DEFAULTS, sessionThread).run("unknown", ADMIN, surface);

        assertThat(surface.finished).contains("not set up");
        assertThat(surface.screens).isEmpty();
    }

    @Test
    @DisplayName("idle sessions don't hold up the workers that started them")
    void idleSessionsDoNotOccupyWorkers() throws Exception {
        ExecutorService workers = Executors.newFixedThreadPool(2);
        ExecutorService sessions = Executors.newCachedThreadPool();
        try {
            ConfigurationWizard wizard = wizard(WizardTimeouts.DEFAULTS, sessions);
            List<RecordingSurface> surfaces = IntStream.range(0, 4)
                    .mapToObj(i -> new RecordingSurface("surface-" + i))
                    .collect(Collectors.toList());
            surfaces.forEach(idle -> workers.execute(() -> wizard.start(TENANT, ADMIN, idle)));

            Future<String> otherRequest = workers.submit(() -> "ticket created");

            assertThat(otherRequest.get(3, TimeUnit.SECONDS)).isEqualTo("ticket created");
            surfaces.forEach(idle -> awaitWaiting(idle.getId()));

            collector.shutdown();
            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
            while (surfaces.stream().anyMatch(idle -> idle.finished == null) && System.nanoTime() < deadline) {
                Thread.onSpinWait();
            }
            assertThat(surfaces).extracting(idle -> idle.finished).containsOnly(ConfigurationWizard.CANCELLED);
        } finally {
            workers.shutdownNow();
            sessions.shutdownNow();
        }
    }

    @Test
    @DisplayName("removing the ticket configuration mid-session ends it")
    void removedConfigurationEndsTheSession() throws Exception {
        CompletableFuture<Void> session = start();
        awaitWaiting();

        stores.configStore.delete(TENANT);
        click(WizardIds.BUTTON);
        finish(session);

        assertThat(surface.finished).isEqualTo(ConfigurationWizard.UNAVAILABLE);
    }

    @Test
    @DisplayName("changing the button label updates the deployed panel")
    void buttonLabelIsUpdated() throws Exception {
        String panelChannel = channels.createChannel(TENANT, null, "support", List.of());
        String panelMessage = panels.deploy(TENANT, panelChannel, PanelMode.BUTTON).getValue();
        CompletableFuture<Void> session = start();

        click(WizardIds.BUTTON);
        click(WizardIds.BUTTON_LABEL);
        answer(WizardIds.BUTTON_LABEL, Map.of(WizardIds.FIELD_VALUE, "Get help"));
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(responder.forms).extracting(ModalForm::getId).containsExactly(WizardIds.modalId(WizardIds.BUTTON_LABEL));
        assertThat(stores.configStore.findButtonConfig(TENANT).orElseThrow().getLabel()).isEqualTo("Get help");
        assertThat(channels.channel(panelChannel).messages.get(panelMessage).getActions().get(0).getLabel()).isEqualTo("Get help");
        assertThat(surface.descriptions()).anyMatch(description -> description.contains("Ticket button updated."));
    }

    @Test
    void invalidColorShowsError() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.BUTTON);
        click(WizardIds.BUTTON_COLOR);
        answer(WizardIds.BUTTON_COLOR, Map.of(WizardIds.FIELD_VALUE, "purple"));
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.configStore.findButtonConfig(TENANT).orElseThrow().getEmbedColor()).isNull();
        assertThat(surface.descriptions()).anyMatch(description -> description.contains("valid hex color"));
    }

    @Test
    @DisplayName("clicking elsewhere while a form is open abandons the form")
    void abandonedFormChangesNothing() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.BUTTON);
        click(WizardIds.BUTTON_LABEL);
        click(WizardIds.BACK);
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(surface.finished).isEqualTo(ConfigurationWizard.CLOSED);
        assertThat(stores.configStore.findButtonConfig(TENANT).orElseThrow().getLabel()).isEqualTo("Create Ticket");
    }

    @Test
    void buttonStyleIsPickedFromMenu() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.BUTTON);
        select(WizardIds.BUTTON_STYLE, "DANGER");
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.configStore.findButtonConfig(TENANT).orElseThrow().getStyle().name()).isEqualTo("DANGER");
    }

    @Test
    void categoryIsAdded() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.CATEGORIES);
        click(WizardIds.CATEGORY_ADD);
        answer(WizardIds.CATEGORY_ADD, Map.of(
                WizardIds.FIELD_NAME, "Billing",
                WizardIds.FIELD_DESCRIPTION, "Payments",
                WizardIds.FIELD_ROLE, "<@&777>"));
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        List<Category> categories = stores.categoryRegistry.list(TENANT);
        assertThat(categories).extracting(Category::getName).containsExactly("General Support", "Billing");
        assertThat(categories.get(1).getSupportRoleRef()).isEqualTo("777");
        assertThat(categories.get(1).getDescription()).isEqualTo("Payments");
    }

    @Test
    @DisplayName("deleting a category asks for confirmation first")
    void categoryIsDeletedAfterConfirmation() throws Exception {
        Category billing = stores.categoryRegistry.create(TENANT, CategoryDraft.builder().name("Billing").build()).getValue();
        stores.ticketStore.create(TENANT, billing.getId(), "1001", "c1");
        CompletableFuture<Void> session = start();

        click(WizardIds.CATEGORIES);
        select(WizardIds.CATEGORY_PICK, String.valueOf(billing.getId()));
        click(WizardIds.CATEGORY_DELETE);
        click(WizardIds.CANCEL);
        assertThat(stores.categoryRegistry.find(billing.getId())).isPresent();

        click(WizardIds.CATEGORY_DELETE);
        click(WizardIds.CONFIRM);
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.categoryRegistry.find(billing.getId())).isEmpty();
        assertThat(stores.ticketStore.findByChannel("c1").orElseThrow().getCategoryId()).isNull();
    }

    @Test
    void categoryIsDisabled() throws Exception {
        long categoryId = stores.categoryRegistry.list(TENANT).get(0).getId();
        CompletableFuture<Void> session = start();

        click(WizardIds.CATEGORIES);
        select(WizardIds.CATEGORY_PICK, String.valueOf(categoryId));
        click(WizardIds.CATEGORY_TOGGLE);
        click(WizardIds.BACK);
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.categoryRegistry.find(categoryId).orElseThrow().isEnabled()).isFalse();
    }

    @Test
    void welcomeMessageIsEdited() throws Exception {
        long categoryId = stores.categoryRegistry.list(TENANT).get(0).getId();
        CompletableFuture<Void> session = start();

        click(WizardIds.MESSAGES);
        select(WizardIds.MESSAGES_PICK, String.valueOf(categoryId));
        click(WizardIds.WELCOME_MESSAGE);
        answer(WizardIds.WELCOME_MESSAGE, Map.of(WizardIds.FIELD_VALUE, "Hello, describe your issue."));
        click(WizardIds.INCLUDE_SUPPORT);
        click(WizardIds.BACK);
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        MessageTemplate template = stores.messageTemplateStore.find(categoryId).orElseThrow();
        assertThat(template.getWelcomeMessage()).isEqualTo("Hello, describe your issue.");
        assertThat(template.isIncludeSupportTeam()).isFalse();
    }

    @Test
    void selectMenuPlaceholderIsEdited() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.SELECT_MENU);
        click(WizardIds.MENU_PLACEHOLDER);
        answer(WizardIds.MENU_PLACEHOLDER, Map.of(WizardIds.FIELD_VALUE, "What do you need?"));
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.configStore.findSelectMenuConfig(TENANT).orElseThrow().getPlaceholder()).isEqualTo("What do you need?");
    }

    @Test
    void ticketSystemIsDisabled() throws Exception {
        CompletableFuture<Void> session = start();

        click(WizardIds.GENERAL);
        click(WizardIds.TOGGLE_ENABLED);
        click(WizardIds.BACK);
        click(WizardIds.CLOSE);
        finish(session);

        assertThat(stores.configStore.find(TENANT).orElseThrow().isEnabled()).isFalse();
    }

    private static class RecordingSurface implements WizardSurface {

        private final String id;
        private final List<OutboundMessage> screens = new CopyOnWriteArrayList<>();
        private volatile String finished;

        private RecordingSurface() {
            this(SURFACE);
        }

        private RecordingSurface(String id) {
            this.id = id;
        }

        @Override
        public String getId() {
            return id;
        }

        @Override
        public void render(OutboundMessage screen) {
            screens.add(screen);
        }

        @Override
        public void finish(String message) {
            finished = message;
        }

        private List<String> descriptions() {
            return screens.stream().map(OutboundMessage::getDescription).collect(Collectors.toList());
        }
    }

    private static class RecordingResponder implements Responder {

        private final List<ModalForm> forms = new CopyOnWriteArrayList<>();
        private final AtomicInteger deferred = new AtomicInteger();

        @Override
        public void deferEdit() {
            deferred.incrementAndGet();
        }

        @Override
        public void openModal(ModalForm form) {
            forms.add(form);
        }
    }
}
