package dev.vankka.supportdesk.panel;

import dev.vankka.supportdesk.message.MenuOption;
import dev.vankka.supportdesk.message.MenuSpec;
import dev.vankka.supportdesk.message.MessageAction;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonConfig;
import dev.vankka.supportdesk.model.ButtonConfigUpdate;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.SelectMenuConfig;
import dev.vankka.supportdesk.model.SelectMenuConfigUpdate;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import dev.vankka.supportdesk.storage.CategoryRegistry;
import dev.vankka.supportdesk.storage.ConfigStore;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.ticket.ChannelResourceManager;
import dev.vankka.supportdesk.ticket.ExternalResourceException;
import dev.vankka.supportdesk.ticket.TicketActions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Posts the message members open tickets from, and keeps it in sync with the tenant's configuration.
 */
@Slf4j
@RequiredArgsConstructor
public class PanelService {

    static final String DEFAULT_TITLE = "Support Tickets";
    static final String DEFAULT_BUTTON_DESCRIPTION = "Click the button below to create a support ticket.";
    static final String DEFAULT_MENU_DESCRIPTION = "Select a category below to create a support ticket.";
    static final int MAX_MENU_OPTIONS = 25;

    private final ConfigStore configStore;
    private final CategoryRegistry categoryRegistry;
    private final ChannelResourceManager channels;

    /**
     * Posts a new panel into {@code channelRef} and remembers it as the tenant's panel.
     *
     * @return the posted message reference
     */
    public Outcome<String> deploy(String tenantId, String channelRef, PanelMode mode) {
        try {
            Optional<ButtonConfig> buttonConfig = configStore.findButtonConfig(tenantId);
            Optional<SelectMenuConfig> menuConfig = configStore.findSelectMenuConfig(tenantId);
            if (buttonConfig.isEmpty() || menuConfig.isEmpty()) {
                return Outcome.failure(Reason.TENANT_DISABLED, "The ticket system is not set up in this server.");
            }

            OutboundMessage panel;
            if (mode == PanelMode.BUTTON) {
                panel = buttonPanel(buttonConfig.get());
            } else {
                List<Category> categories = categoryRegistry.listEnabled(tenantId);
                if (categories.isEmpty()) {
                    return Outcome.failure(Reason.CATEGORY_UNAVAILABLE, "There are no enabled ticket categories.");
                }
                panel = menuPanel(menuConfig.get(), categories);
            }

            String messageRef;
            try {
                messageRef = channels.postMessage(channelRef, panel);
            } catch (ExternalResourceException e) {
                log.warn("Could not post ticket panel in channel {} of tenant {}", channelRef, tenantId, e);
                return Outcome.failure(Reason.CHANNEL_UNAVAILABLE, "Could not post the ticket panel in that channel.");
            }

            Outcome<ButtonConfig> buttonUpdate = configStore.updateButtonConfig(tenantId, ButtonConfigUpdate.builder()
                    .channelRef(channelRef)
                    .messageRef(mode == PanelMode.BUTTON ? messageRef : "")
                    .build());
            if (buttonUpdate.isFailure()) {
                return buttonUpdate.castFailure();
            }
            Outcome<SelectMenuConfig> menuUpdate = configStore.updateSelectMenuConfig(tenantId, SelectMenuConfigUpdate.builder()
                    .messageRef(mode == PanelMode.SELECT_MENU ? messageRef : "")
                    .build());
            if (menuUpdate.isFailure()) {
                return menuUpdate.castFailure();
            }

            log.info("Deployed {} ticket panel {} in channel {} of tenant {}", mode, messageRef, channelRef, tenantId);
            return Outcome.success(messageRef);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Re-renders the deployed panel after a configuration change.
     *
     * @return whether a panel was edited; a panel that was deleted in the meantime is forgotten with a warning
     */
    public Outcome<Boolean> refresh(String tenantId) {
        try {
            Optional<ButtonConfig> buttonConfig = configStore.findButtonConfig(tenantId);
            Optional<SelectMenuConfig> menuConfig = configStore.findSelectMenuConfig(tenantId);
            if (buttonConfig.isEmpty() || menuConfig.isEmpty() || buttonConfig.get().getChannelRef() == null) {
                return Outcome.success(false);
            }
            String channelRef = buttonConfig.get().getChannelRef();

            String messageRef;
            OutboundMessage panel;
            if (buttonConfig.get().getMessageRef() != null) {
                messageRef = buttonConfig.get().getMessageRef();
                panel = buttonPanel(buttonConfig.get());
            } else if (menuConfig.get().getMessageRef() != null) {
                messageRef = menuConfig.get().getMessageRef();
                List<Category> categories = categoryRegistry.listEnabled(tenantId);
                if (categories.isEmpty()) {
                    return Outcome.of(false, Collections.singletonList(
                            "The ticket panel was not updated, there are no enabled categories."));
                }
                panel = menuPanel(menuConfig.get(), categories);
            } else {
                return Outcome.success(false);
            }

            try {
                if (channels.fetchMessage(channelRef, messageRef).isEmpty()) {
                    forget(tenantId);
                    return Outcome.of(false, Collections.singletonList(
                            "The ticket panel message no longer exists, deploy it again with /panel."));
                }
                channels.editMessage(channelRef, messageRef, panel);
            } catch (ExternalResourceException e) {
                if (e.isNotFound()) {
                    forget(tenantId);
                    return Outcome.of(false, Collections.singletonList(
                            "The ticket panel message no longer exists, deploy it again with /panel."));
                }
                log.warn("Could not refresh ticket panel {} of tenant {}", messageRef, tenantId, e);
                return Outcome.of(false, Collections.singletonList("The ticket panel could not be updated."));
            }
            return Outcome.success(true);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * The category picker shown after the creation button is clicked.
     */
    public Outcome<MenuSpec> categoryMenu(String tenantId) {
        try {
            List<Category> categories = categoryRegistry.listEnabled(tenantId);
            if (categories.isEmpty()) {
                return Outcome.failure(Reason.CATEGORY_UNAVAILABLE, "There are no enabled ticket categories.");
            }
            String placeholder = configStore.findSelectMenuConfig(tenantId)
                    .map(SelectMenuConfig::getPlaceholder)
                    .orElse(SelectMenuConfig.DEFAULT_PLACEHOLDER);
            return Outcome.success(menu(placeholder, 1, 1, categories));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    private void forget(String tenantId) {
        Outcome<?> buttonUpdate = configStore.updateButtonConfig(tenantId, ButtonConfigUpdate.builder().messageRef("").build());
        Outcome<?> menuUpdate = configStore.updateSelectMenuConfig(tenantId, SelectMenuConfigUpdate.builder().messageRef("").build());
        if (buttonUpdate.isFailure() || menuUpdate.isFailure()) {
            log.warn("Could not clear the stale panel reference of tenant {}", tenantId);
        }
    }

    static OutboundMessage buttonPanel(ButtonConfig config) {
        return OutboundMessage.builder()
                .title(StringUtils.defaultIfBlank(config.getEmbedTitle(), DEFAULT_TITLE))
                .description(StringUtils.defaultIfBlank(config.getEmbedDescription(), DEFAULT_BUTTON_DESCRIPTION))
                .color(config.getEmbedColor())
                .action(new MessageAction(TicketActions.CREATE, config.getLabel(), config.getGlyph(), config.getStyle()))
                .build();
    }

    static OutboundMessage menuPanel(SelectMenuConfig config, List<Category> categories) {
        int options = Math.min(categories.size(), MAX_MENU_OPTIONS);
        return OutboundMessage.builder()
                .title(StringUtils.defaultIfBlank(config.getEmbedTitle(), DEFAULT_TITLE))
                .description(StringUtils.defaultIfBlank(config.getEmbedDescription(), DEFAULT_MENU_DESCRIPTION))
                .color(config.getEmbedColor())
                .menu(menu(config.getPlaceholder(), Math.min(config.getMinValues(), options),
                        Math.min(config.getMaxValues(), options), categories))
                .build();
    }

    private static MenuSpec menu(String placeholder, int minValues, int maxValues, List<Category> categories) {
        MenuSpec.MenuSpecBuilder builder = MenuSpec.builder()
                .id(TicketActions.CATEGORY_SELECT)
                .placeholder(placeholder)
                .minValues(minValues)
                .maxValues(maxValues);
        categories.stream()
                .limit(MAX_MENU_OPTIONS)
                .forEach(category -> builder.option(new MenuOption(
                        String.valueOf(category.getId()),
                        category.getName(),
                        StringUtils.abbreviate(category.getDescription(), 100),
                        category.getGlyph())));
        return builder.build();
    }
}
