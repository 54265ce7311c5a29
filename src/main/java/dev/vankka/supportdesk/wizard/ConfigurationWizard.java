package dev.vankka.supportdesk.wizard;

import dev.vankka.supportdesk.collector.Interaction;
import dev.vankka.supportdesk.collector.InteractionCollector;
import dev.vankka.supportdesk.message.ModalForm;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonConfig;
import dev.vankka.supportdesk.model.ButtonConfigUpdate;
import dev.vankka.supportdesk.model.ButtonStyle;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.CategoryDraft;
import dev.vankka.supportdesk.model.CategoryUpdate;
import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.model.MessageTemplateUpdate;
import dev.vankka.supportdesk.model.SelectMenuConfig;
import dev.vankka.supportdesk.model.SelectMenuConfigUpdate;
import dev.vankka.supportdesk.model.TenantConfig;
import dev.vankka.supportdesk.model.TenantConfigUpdate;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.panel.PanelService;
import dev.vankka.supportdesk.storage.CategoryRegistry;
import dev.vankka.supportdesk.storage.ConfigStore;
import dev.vankka.supportdesk.storage.DeletionConfirmation;
import dev.vankka.supportdesk.storage.MessageTemplateStore;
import dev.vankka.supportdesk.storage.PersistenceException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Predicate;

/**
 * The interactive {@code /config} session.
 * <p>
 * A session is one task with a suspension point per screen, it blocks while it waits for the administrator.
 * {@link #start} runs sessions on their own executor, apart from the workers that handle tickets, so an idle
 * administrator never holds up anyone else. Every screen waits for one interaction, acts on it and either shows itself again or returns to
 * its parent. Only the administrator that started the session can drive it. If they stop responding the session ends
 * on a cancelled screen without changing anything.
 */
@Slf4j
@RequiredArgsConstructor
public class ConfigurationWizard {

    static final String CLOSED = Emoji.WHITE_CHECK_MARK + " Configuration closed.";
    static final String CANCELLED = Emoji.WARNING + " Configuration cancelled, no response was received in time.";
    static final String UNAVAILABLE = Emoji.CROSS_MARK + " The database is unavailable, please try again later.";

    private final ConfigStore configStore;
    private final CategoryRegistry categoryRegistry;
    private final MessageTemplateStore messageTemplateStore;
    private final PanelService panelService;
    private final InteractionCollector collector;
    private final WizardTimeouts timeouts;
    private final Executor sessions;

    /**
     * Starts a session on the session executor and returns right away.
     */
    public CompletableFuture<Void> start(String tenantId, String adminId, WizardSurface surface) {
        return CompletableFuture.runAsync(() -> run(tenantId, adminId, surface), sessions)
                .whenComplete((ignored, t) -> {
                    if (t != null) {
                        log.error("Configuration session of {} in tenant {} crashed", adminId, tenantId, t);
                    }
                });
    }

    public void run(String tenantId, String adminId, WizardSurface surface) {
        Session session = new Session(tenantId, adminId, surface);
        try {
            if (configStore.find(tenantId).isEmpty()) {
                surface.finish(Emoji.CROSS_MARK + " The ticket system is not set up in this server.");
                return;
            }
            main(session);
            surface.finish(CLOSED);
        } catch (SessionTimedOut e) {
            log.debug("Configuration session of {} in tenant {} timed out", adminId, tenantId);
            surface.finish(CANCELLED);
        } catch (PersistenceException e) {
            log.error("Configuration session of {} in tenant {} failed", adminId, tenantId, e);
            surface.finish(UNAVAILABLE);
        } catch (ConfigurationMissing e) {
            log.warn("Ticket configuration of tenant {} was removed during {}'s session", tenantId, adminId);
            surface.finish(UNAVAILABLE);
        }
    }

    private void main(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            TenantConfig config = required(configStore.find(session.tenantId));
            int categoryCount = categoryRegistry.list(session.tenantId).size();
            Interaction interaction = show(session, WizardScreens.main(config, categoryCount, session.takeNotice()));
            interaction.getResponder().deferEdit();

            switch (interaction.getComponentId()) {
                case WizardIds.BUTTON:
                    button(session);
                    break;
                case WizardIds.CATEGORIES:
                    categories(session);
                    break;
                case WizardIds.MESSAGES:
                    messages(session);
                    break;
                case WizardIds.SELECT_MENU:
                    selectMenu(session);
                    break;
                case WizardIds.GENERAL:
                    general(session);
                    break;
                case WizardIds.CLOSE:
                    return;
                default:
                    break;
            }
        }
    }

    private void button(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            ButtonConfig config = required(configStore.findButtonConfig(session.tenantId));
            Interaction interaction = show(session, WizardScreens.button(config, session.takeNotice()));

            ButtonConfigUpdate.ButtonConfigUpdateBuilder update = ButtonConfigUpdate.builder();
            Optional<String> value;
            switch (interaction.getComponentId()) {
                case WizardIds.BUTTON_LABEL:
                    value = ask(session, interaction, WizardIds.BUTTON_LABEL, "Button Label", "Label", config.getLabel(), false, true, 80);
                    value.ifPresent(update::label);
                    break;
                case WizardIds.BUTTON_GLYPH:
                    value = ask(session, interaction, WizardIds.BUTTON_GLYPH, "Button Emoji", "Emoji (empty for none)", config.getGlyph(), false, false, 64);
                    value.ifPresent(update::glyph);
                    break;
                case WizardIds.BUTTON_TITLE:
                    value = ask(session, interaction, WizardIds.BUTTON_TITLE, "Embed Title", "Title (empty for default)", config.getEmbedTitle(), false, false, 256);
                    value.ifPresent(update::embedTitle);
                    break;
                case WizardIds.BUTTON_DESCRIPTION:
                    value = ask(session, interaction, WizardIds.BUTTON_DESCRIPTION, "Embed Description", "Description (empty for default)", config.getEmbedDescription(), true, false, 4000);
                    value.ifPresent(update::embedDescription);
                    break;
                case WizardIds.BUTTON_COLOR:
                    value = ask(session, interaction, WizardIds.BUTTON_COLOR, "Embed Color", "Hex color, e.g. #5865F2", config.getEmbedColor(), false, false, 7);
                    value.ifPresent(update::embedColor);
                    break;
                case WizardIds.BUTTON_LOG_CHANNEL:
                    value = ask(session, interaction, WizardIds.BUTTON_LOG_CHANNEL, "Log Channel", "Channel id (empty to disable)", config.getLogChannelRef(), false, false, 25)
                            .map(ConfigurationWizard::digits);
                    value.ifPresent(update::logChannelRef);
                    break;
                case WizardIds.BUTTON_STYLE:
                    interaction.getResponder().deferEdit();
                    value = interaction.firstValue();
                    value.flatMap(ButtonStyle::fromName).ifPresent(update::style);
                    break;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    value = Optional.empty();
                    break;
            }
            if (value.isPresent()) {
                Outcome<ButtonConfig> outcome = configStore.updateButtonConfig(session.tenantId, update.build());
                session.notice(describe(outcome, "Ticket button updated."));
                if (outcome.isCompleted()) {
                    refreshPanel(session);
                }
            }
        }
    }

    private void categories(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            List<Category> categories = categoryRegistry.list(session.tenantId);
            Interaction interaction = show(session, WizardScreens.categories(categories, session.takeNotice()));

            switch (interaction.getComponentId()) {
                case WizardIds.CATEGORY_ADD:
                    addCategory(session, interaction);
                    break;
                case WizardIds.CATEGORY_PICK:
                    interaction.getResponder().deferEdit();
                    Optional<Long> categoryId = interaction.firstValue().map(ConfigurationWizard::parseId);
                    if (categoryId.isPresent()) {
                        category(session, categoryId.get());
                    }
                    break;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    break;
            }
        }
    }

    private void addCategory(Session session, Interaction trigger) throws SessionTimedOut {
        ModalForm form = categoryForm(WizardIds.CATEGORY_ADD, "Add Category", null);
        Optional<Interaction> submitted = askForm(session, trigger, form);
        if (submitted.isEmpty()) {
            return;
        }
        Interaction answer = submitted.get();
        Outcome<Category> outcome = categoryRegistry.create(session.tenantId, CategoryDraft.builder()
                .name(answer.field(WizardIds.FIELD_NAME))
                .description(StringUtils.trimToNull(answer.field(WizardIds.FIELD_DESCRIPTION)))
                .glyph(StringUtils.trimToNull(answer.field(WizardIds.FIELD_GLYPH)))
                .supportRoleRef(StringUtils.trimToNull(digits(answer.field(WizardIds.FIELD_ROLE))))
                .build());
        session.notice(describe(outcome, "Category created."));
        if (outcome.isCompleted()) {
            refreshPanel(session);
        }
    }

    private void category(Session session, long categoryId) throws SessionTimedOut, PersistenceException {
        while (true) {
            Optional<Category> found = categoryRegistry.find(categoryId);
            if (found.isEmpty() || !found.get().getTenantId().equals(session.tenantId)) {
                session.notice(Emoji.CROSS_MARK + " Ticket category not found.");
                return;
            }
            Category category = found.get();
            Interaction interaction = show(session, WizardScreens.category(category, session.takeNotice()));

            Outcome<?> outcome;
            switch (interaction.getComponentId()) {
                case WizardIds.CATEGORY_EDIT:
                    Optional<Interaction> submitted = askForm(session, interaction, categoryForm(WizardIds.CATEGORY_EDIT, "Edit Category", category));
                    if (submitted.isEmpty()) {
                        continue;
                    }
                    Interaction answer = submitted.get();
                    outcome = categoryRegistry.update(categoryId, CategoryUpdate.builder()
                            .name(answer.field(WizardIds.FIELD_NAME))
                            .description(StringUtils.defaultString(answer.field(WizardIds.FIELD_DESCRIPTION)))
                            .glyph(StringUtils.defaultString(answer.field(WizardIds.FIELD_GLYPH)))
                            .supportRoleRef(digits(answer.field(WizardIds.FIELD_ROLE)))
                            .build());
                    session.notice(describe(outcome, "Category updated."));
                    break;
                case WizardIds.CATEGORY_TOGGLE:
                    interaction.getResponder().deferEdit();
                    outcome = categoryRegistry.update(categoryId, CategoryUpdate.builder().enabled(!category.isEnabled()).build());
                    session.notice(describe(outcome, category.isEnabled() ? "Category disabled." : "Category enabled."));
                    break;
                case WizardIds.CATEGORY_DELETE:
                    interaction.getResponder().deferEdit();
                    Interaction answerDelete = show(session, WizardScreens.confirmDelete(category), timeouts.getConfirmation());
                    answerDelete.getResponder().deferEdit();
                    if (!WizardIds.CONFIRM.equals(answerDelete.getComponentId())) {
                        session.notice("Deletion cancelled.");
                        continue;
                    }
                    outcome = categoryRegistry.delete(categoryId, DeletionConfirmation.confirmed(categoryId));
                    session.notice(describe(outcome, "Category " + category.getName() + " deleted."));
                    if (outcome.isCompleted()) {
                        refreshPanel(session);
                        return;
                    }
                    continue;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    continue;
            }
            if (outcome.isCompleted()) {
                refreshPanel(session);
            }
        }
    }

    private void messages(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            List<Category> categories = categoryRegistry.list(session.tenantId);
            Interaction interaction = show(session, WizardScreens.messageCategories(categories, session.takeNotice()));
            interaction.getResponder().deferEdit();

            if (WizardIds.BACK.equals(interaction.getComponentId())) {
                return;
            }
            if (WizardIds.MESSAGES_PICK.equals(interaction.getComponentId())) {
                Optional<Long> categoryId = interaction.firstValue().map(ConfigurationWizard::parseId);
                if (categoryId.isPresent()) {
                    categoryMessages(session, categoryId.get());
                }
            }
        }
    }

    private void categoryMessages(Session session, long categoryId) throws SessionTimedOut, PersistenceException {
        while (true) {
            Optional<Category> found = categoryRegistry.find(categoryId);
            if (found.isEmpty() || !found.get().getTenantId().equals(session.tenantId)) {
                session.notice(Emoji.CROSS_MARK + " Ticket category not found.");
                return;
            }
            Category category = found.get();
            MessageTemplate template = messageTemplateStore.findOrDefault(categoryId, category.getName());
            Interaction interaction = show(session, WizardScreens.messages(category, template, session.takeNotice()));

            MessageTemplateUpdate.MessageTemplateUpdateBuilder update = MessageTemplateUpdate.builder();
            Optional<String> value;
            switch (interaction.getComponentId()) {
                case WizardIds.WELCOME_MESSAGE:
                    value = ask(session, interaction, WizardIds.WELCOME_MESSAGE, "Welcome Message", "Welcome message", template.getWelcomeMessage(), true, true, 2000);
                    value.ifPresent(update::welcomeMessage);
                    break;
                case WizardIds.CLOSE_MESSAGE:
                    value = ask(session, interaction, WizardIds.CLOSE_MESSAGE, "Close Message", "Close message", template.getCloseMessage(), true, true, 2000);
                    value.ifPresent(update::closeMessage);
                    break;
                case WizardIds.INCLUDE_SUPPORT:
                    interaction.getResponder().deferEdit();
                    update.includeSupportTeam(!template.isIncludeSupportTeam());
                    value = Optional.of("toggle");
                    break;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    value = Optional.empty();
                    break;
            }
            if (value.isPresent()) {
                session.notice(describe(messageTemplateStore.update(categoryId, update.build()), "Messages updated."));
            }
        }
    }

    private void selectMenu(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            SelectMenuConfig config = required(configStore.findSelectMenuConfig(session.tenantId));
            Interaction interaction = show(session, WizardScreens.selectMenu(config, session.takeNotice()));

            SelectMenuConfigUpdate.SelectMenuConfigUpdateBuilder update = SelectMenuConfigUpdate.builder();
            Optional<String> value;
            switch (interaction.getComponentId()) {
                case WizardIds.MENU_PLACEHOLDER:
                    value = ask(session, interaction, WizardIds.MENU_PLACEHOLDER, "Menu Placeholder", "Placeholder", config.getPlaceholder(), false, true, 150);
                    value.ifPresent(update::placeholder);
                    break;
                case WizardIds.MENU_TITLE:
                    value = ask(session, interaction, WizardIds.MENU_TITLE, "Embed Title", "Title (empty for default)", config.getEmbedTitle(), false, false, 256);
                    value.ifPresent(update::embedTitle);
                    break;
                case WizardIds.MENU_DESCRIPTION:
                    value = ask(session, interaction, WizardIds.MENU_DESCRIPTION, "Embed Description", "Description (empty for default)", config.getEmbedDescription(), true, false, 4000);
                    value.ifPresent(update::embedDescription);
                    break;
                case WizardIds.MENU_COLOR:
                    value = ask(session, interaction, WizardIds.MENU_COLOR, "Embed Color", "Hex color, e.g. #5865F2", config.getEmbedColor(), false, false, 7);
                    value.ifPresent(update::embedColor);
                    break;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    value = Optional.empty();
                    break;
            }
            if (value.isPresent()) {
                Outcome<SelectMenuConfig> outcome = configStore.updateSelectMenuConfig(session.tenantId, update.build());
                session.notice(describe(outcome, "Select menu updated."));
                if (outcome.isCompleted()) {
                    refreshPanel(session);
                }
            }
        }
    }

    private void general(Session session) throws SessionTimedOut, PersistenceException {
        while (true) {
            TenantConfig config = required(configStore.find(session.tenantId));
            Interaction interaction = show(session, WizardScreens.general(config, session.takeNotice()));

            switch (interaction.getComponentId()) {
                case WizardIds.TOGGLE_ENABLED:
                    interaction.getResponder().deferEdit();
                    session.notice(describe(configStore.setEnabled(session.tenantId, !config.isEnabled()),
                            config.isEnabled() ? "Ticket system disabled." : "Ticket system enabled."));
                    break;
                case WizardIds.DEFAULT_CATEGORY_NAME:
                    Optional<String> value = ask(session, interaction, WizardIds.DEFAULT_CATEGORY_NAME, "Ticket Channel Category",
                            "Channel category name", config.getDefaultCategoryName(), false, true, 100);
                    if (value.isPresent()) {
                        session.notice(describe(configStore.update(session.tenantId,
                                TenantConfigUpdate.builder().defaultCategoryName(value.get()).build()), "Channel category updated."));
                    }
                    break;
                case WizardIds.BACK:
                    interaction.getResponder().deferEdit();
                    return;
                default:
                    interaction.getResponder().deferEdit();
                    break;
            }
        }
    }

    private Interaction show(Session session, OutboundMessage screen) throws SessionTimedOut {
        return show(session, screen, timeouts.getMenu());
    }

    private Interaction show(Session session, OutboundMessage screen, Duration timeout) throws SessionTimedOut {
        session.surface.render(screen);
        return await(session, interaction -> interaction.getType() != Interaction.Type.MODAL, timeout);
    }

    private Interaction await(Session session, Predicate<Interaction> predicate, Duration timeout) throws SessionTimedOut {
        return collector.awaitNext(session.surface.getId(), session.adminId, predicate, timeout)
                .join()
                .orElseThrow(SessionTimedOut::new);
    }

    private Optional<String> ask(Session session, Interaction trigger, String componentId, String title, String label,
                                 String current, boolean paragraph, boolean required, int maxLength) throws SessionTimedOut {
        ModalForm form = ModalForm.builder()
                .id(WizardIds.modalId(componentId))
                .title(title)
                .field(ModalForm.Field.builder()
                        .id(WizardIds.FIELD_VALUE)
                        .label(label)
                        .value(StringUtils.abbreviate(current, maxLength))
                        .paragraph(paragraph)
                        .required(required)
                        .maxLength(maxLength)
                        .build())
                .build();
        return askForm(session, trigger, form)
                .map(answer -> StringUtils.defaultString(answer.field(WizardIds.FIELD_VALUE)));
    }

    /**
     * Opens {@code form} and waits for its submission. A dismissed form can't be observed, so any other interaction
     * on the surface abandons it and the current screen is shown again.
     */
    private Optional<Interaction> askForm(Session session, Interaction trigger, ModalForm form) throws SessionTimedOut {
        trigger.getResponder().openModal(form);
        Interaction answer = await(session, interaction -> interaction.getType() != Interaction.Type.MODAL
                || form.getId().equals(interaction.getComponentId()), timeouts.getModal());
        answer.getResponder().deferEdit();
        return answer.getType() == Interaction.Type.MODAL ? Optional.of(answer) : Optional.empty();
    }

    private void refreshPanel(Session session) {
        Outcome<Boolean> refreshed = panelService.refresh(session.tenantId);
        if (refreshed.isFailure()) {
            session.notice(Emoji.WARNING + " " + refreshed.getMessage());
        } else {
            refreshed.getWarnings().forEach(warning -> session.notice(Emoji.WARNING + " " + warning));
        }
    }

    private static ModalForm categoryForm(String componentId, String title, Category current) {
        return ModalForm.builder()
                .id(WizardIds.modalId(componentId))
                .title(title)
                .field(ModalForm.Field.builder().id(WizardIds.FIELD_NAME).label("Name")
                        .value(current != null ? current.getName() : null).maxLength(100).build())
                .field(ModalForm.Field.builder().id(WizardIds.FIELD_DESCRIPTION).label("Description")
                        .value(current != null ? current.getDescription() : null).paragraph(true).required(false).maxLength(100).build())
                .field(ModalForm.Field.builder().id(WizardIds.FIELD_GLYPH).label("Emoji")
                        .value(current != null ? current.getGlyph() : null).required(false).maxLength(64).build())
                .field(ModalForm.Field.builder().id(WizardIds.FIELD_ROLE).label("Support role id")
                        .value(current != null ? current.getSupportRoleRef() : null).required(false).maxLength(25).build())
                .build();
    }

    private static String describe(Outcome<?> outcome, String success) {
        if (outcome.isFailure()) {
            return Emoji.CROSS_MARK + " " + outcome.getMessage();
        }
        StringBuilder text = new StringBuilder(Emoji.WHITE_CHECK_MARK).append(' ').append(success);
        outcome.getWarnings().forEach(warning -> text.append('\n').append(Emoji.WARNING).append(' ').append(warning));
        return text.toString();
    }

    private static String digits(String value) {
        return value == null ? "" : value.replaceAll("[^0-9]", "");
    }

    private static Long parseId(String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            log.debug("Ignoring malformed category id {}", value);
            return null;
        }
    }

    private static <T> T required(Optional<T> value) {
        return value.orElseThrow(ConfigurationMissing::new);
    }

    private static class Session {

        private final String tenantId;
        private final String adminId;
        private final WizardSurface surface;
        private final StringBuilder notice = new StringBuilder();

        private Session(String tenantId, String adminId, WizardSurface surface) {
            this.tenantId = tenantId;
            this.adminId = adminId;
            this.surface = surface;
        }

        private void notice(String text) {
            if (notice.length() > 0) {
                notice.append('\n');
            }
            notice.append(text);
        }

        private String takeNotice() {
            String text = notice.toString();
            notice.setLength(0);
            return text;
        }
    }

    private static class SessionTimedOut extends Exception {

        private SessionTimedOut() {
            super("No response in time");
        }
    }

    private static class ConfigurationMissing extends RuntimeException {

        private ConfigurationMissing() {
            super("Ticket configuration disappeared during configuration");
        }
    }
}
