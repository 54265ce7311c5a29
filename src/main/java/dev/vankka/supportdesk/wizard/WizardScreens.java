package dev.vankka.supportdesk.wizard;

import dev.vankka.supportdesk.message.MenuOption;
import dev.vankka.supportdesk.message.MenuSpec;
import dev.vankka.supportdesk.message.MessageAction;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonConfig;
import dev.vankka.supportdesk.model.ButtonStyle;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.model.SelectMenuConfig;
import dev.vankka.supportdesk.model.TenantConfig;
import dev.vankka.supportdesk.object.Emoji;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import org.apache.commons.lang3.StringUtils;

import java.util.List;

@NoArgsConstructor(access = AccessLevel.PRIVATE)
final class WizardScreens {

    static final String COLOR = "#5865F2";
    static final int MAX_OPTIONS = 25;
    private static final String NOT_SET = "Not set";

    private static final MessageAction BACK = new MessageAction(WizardIds.BACK, "Back", null, ButtonStyle.SECONDARY);

    static OutboundMessage main(TenantConfig config, int categoryCount, String notice) {
        return screen()
                .title(Emoji.WRENCH + " Ticket System Configuration")
                .description(withNotice(notice,
                        "Status: " + (config.isEnabled() ? Emoji.WHITE_CHECK_MARK + " Enabled" : Emoji.CROSS_MARK + " Disabled")
                                + "\nTicket channel category: " + config.getDefaultCategoryName()
                                + "\nTicket categories: " + categoryCount
                                + "\n\nChoose what to configure."))
                .action(new MessageAction(WizardIds.BUTTON, "Button", Emoji.TICKET, ButtonStyle.PRIMARY))
                .action(new MessageAction(WizardIds.CATEGORIES, "Categories", Emoji.FILE_FOLDER, ButtonStyle.PRIMARY))
                .action(new MessageAction(WizardIds.MESSAGES, "Messages", null, ButtonStyle.PRIMARY))
                .action(new MessageAction(WizardIds.SELECT_MENU, "Select Menu", null, ButtonStyle.PRIMARY))
                .action(new MessageAction(WizardIds.GENERAL, "General", Emoji.WRENCH, ButtonStyle.SECONDARY))
                .action(new MessageAction(WizardIds.CLOSE, "Close", Emoji.CROSS_MARK, ButtonStyle.DANGER))
                .build();
    }

    static OutboundMessage button(ButtonConfig config, String notice) {
        MenuSpec.MenuSpecBuilder styles = MenuSpec.builder()
                .id(WizardIds.BUTTON_STYLE)
                .placeholder("Button style: " + config.getStyle().getDisplayName());
        for (ButtonStyle style : ButtonStyle.values()) {
            styles.option(new MenuOption(style.name(), style.getDisplayName(), null, null));
        }
        return screen()
                .title(Emoji.TICKET + " Ticket Button")
                .description(withNotice(notice,
                        "Label: " + config.getLabel()
                                + "\nEmoji: " + valueOrUnset(config.getGlyph())
                                + "\nStyle: " + config.getStyle().getDisplayName()
                                + "\nEmbed title: " + valueOrUnset(config.getEmbedTitle())
                                + "\nEmbed description: " + valueOrUnset(StringUtils.abbreviate(config.getEmbedDescription(), 200))
                                + "\nEmbed color: " + valueOrUnset(config.getEmbedColor())
                                + "\nLog channel: " + (config.getLogChannelRef() != null ? "<#" + config.getLogChannelRef() + ">" : NOT_SET)))
                .action(edit(WizardIds.BUTTON_LABEL, "Label"))
                .action(edit(WizardIds.BUTTON_GLYPH, "Emoji"))
                .action(edit(WizardIds.BUTTON_TITLE, "Title"))
                .action(edit(WizardIds.BUTTON_DESCRIPTION, "Description"))
                .action(edit(WizardIds.BUTTON_COLOR, "Color"))
                .action(edit(WizardIds.BUTTON_LOG_CHANNEL, "Log Channel"))
                .action(BACK)
                .menu(styles.build())
                .build();
    }

    static OutboundMessage categories(List<Category> categories, String notice) {
        StringBuilder list = new StringBuilder();
        for (Category category : categories) {
            list.append(category.isEnabled() ? Emoji.WHITE_CHECK_MARK : Emoji.CROSS_MARK)
                    .append(' ')
                    .append(StringUtils.defaultIfEmpty(category.getGlyph(), ""))
                    .append(' ')
                    .append(category.getName())
                    .append(" (")
                    .append(category.getTicketCount())
                    .append(" tickets)\n");
        }
        OutboundMessage.OutboundMessageBuilder builder = screen()
                .title(Emoji.FILE_FOLDER + " Ticket Categories")
                .description(withNotice(notice, list.length() > 0 ? list.toString() : "No categories yet."))
                .action(new MessageAction(WizardIds.CATEGORY_ADD, "Add Category", Emoji.HEAVY_PLUS_SIGN, ButtonStyle.SUCCESS))
                .action(BACK);
        if (!categories.isEmpty()) {
            builder.menu(categoryPicker(WizardIds.CATEGORY_PICK, "Select a category to edit", categories));
        }
        return builder.build();
    }

    static OutboundMessage category(Category category, String notice) {
        return screen()
                .title(StringUtils.defaultIfEmpty(category.getGlyph(), "") + " " + category.getName())
                .description(withNotice(notice,
                        "Description: " + valueOrUnset(category.getDescription())
                                + "\nSupport role: " + (category.hasSupportRole() ? "<@&" + category.getSupportRoleRef() + ">" : NOT_SET)
                                + "\nTickets created: " + category.getTicketCount()
                                + "\nStatus: " + (category.isEnabled() ? "Enabled" : "Disabled")))
                .action(edit(WizardIds.CATEGORY_EDIT, "Edit"))
                .action(new MessageAction(WizardIds.CATEGORY_TOGGLE, category.isEnabled() ? "Disable" : "Enable", null,
                        category.isEnabled() ? ButtonStyle.SECONDARY : ButtonStyle.SUCCESS))
                .action(new MessageAction(WizardIds.CATEGORY_DELETE, "Delete", Emoji.WASTEBASKET, ButtonStyle.DANGER))
                .action(BACK)
                .build();
    }

    static OutboundMessage confirmDelete(Category category) {
        String tickets = category.getTicketCount() > 0
                ? "\n\nIts " + category.getTicketCount() + " tickets will be kept without a category."
                : "";
        return OutboundMessage.builder()
                .title(Emoji.WARNING + " Delete " + category.getName() + "?")
                .description("This cannot be undone." + tickets)
                .color("#ED4245")
                .action(new MessageAction(WizardIds.CONFIRM, "Delete", Emoji.WASTEBASKET, ButtonStyle.DANGER))
                .action(new MessageAction(WizardIds.CANCEL, "Cancel", null, ButtonStyle.SECONDARY))
                .build();
    }

    static OutboundMessage messageCategories(List<Category> categories, String notice) {
        OutboundMessage.OutboundMessageBuilder builder = screen()
                .title("Ticket Messages")
                .description(withNotice(notice, categories.isEmpty()
                        ? "No categories yet."
                        : "Select the category whose messages you want to edit."))
                .action(BACK);
        if (!categories.isEmpty()) {
            builder.menu(categoryPicker(WizardIds.MESSAGES_PICK, "Select a category", categories));
        }
        return builder.build();
    }

    static OutboundMessage messages(Category category, MessageTemplate template, String notice) {
        return screen()
                .title("Messages of " + category.getName())
                .description(withNotice(notice,
                        "**Welcome message**\n" + template.getWelcomeMessage()
                                + "\n\n**Close message**\n" + template.getCloseMessage()
                                + "\n\nMention support team: " + (template.isIncludeSupportTeam() ? "Yes" : "No")))
                .action(edit(WizardIds.WELCOME_MESSAGE, "Welcome Message"))
                .action(edit(WizardIds.CLOSE_MESSAGE, "Close Message"))
                .action(new MessageAction(WizardIds.INCLUDE_SUPPORT,
                        template.isIncludeSupportTeam() ? "Don't Mention Support" : "Mention Support", null, ButtonStyle.SECONDARY))
                .action(BACK)
                .build();
    }

    static OutboundMessage selectMenu(SelectMenuConfig config, String notice) {
        return screen()
                .title("Category Select Menu")
                .description(withNotice(notice,
                        "Placeholder: " + config.getPlaceholder()
                                + "\nEmbed title: " + valueOrUnset(config.getEmbedTitle())
                                + "\nEmbed description: " + valueOrUnset(StringUtils.abbreviate(config.getEmbedDescription(), 200))
                                + "\nEmbed color: " + valueOrUnset(config.getEmbedColor())))
                .action(edit(WizardIds.MENU_PLACEHOLDER, "Placeholder"))
                .action(edit(WizardIds.MENU_TITLE, "Title"))
                .action(edit(WizardIds.MENU_DESCRIPTION, "Description"))
                .action(edit(WizardIds.MENU_COLOR, "Color"))
                .action(BACK)
                .build();
    }

    static OutboundMessage general(TenantConfig config, String notice) {
        return screen()
                .title(Emoji.WRENCH + " General Settings")
                .description(withNotice(notice,
                        "Ticket system: " + (config.isEnabled() ? "Enabled" : "Disabled")
                                + "\nTicket channel category: " + config.getDefaultCategoryName()))
                .action(new MessageAction(WizardIds.TOGGLE_ENABLED, config.isEnabled() ? "Disable Tickets" : "Enable Tickets", null,
                        config.isEnabled() ? ButtonStyle.DANGER : ButtonStyle.SUCCESS))
                .action(edit(WizardIds.DEFAULT_CATEGORY_NAME, "Channel Category"))
                .action(BACK)
                .build();
    }

    private static MenuSpec categoryPicker(String id, String placeholder, List<Category> categories) {
        MenuSpec.MenuSpecBuilder menu = MenuSpec.builder().id(id).placeholder(placeholder);
        categories.stream()
                .limit(MAX_OPTIONS)
                .forEach(category -> menu.option(new MenuOption(String.valueOf(category.getId()), category.getName(),
                        StringUtils.abbreviate(category.getDescription(), 100), category.getGlyph())));
        return menu.build();
    }

    private static OutboundMessage.OutboundMessageBuilder screen() {
        return OutboundMessage.builder().color(COLOR);
    }

    private static String withNotice(String notice, String body) {
        return StringUtils.isBlank(notice) ? body : notice + "\n\n" + body;
    }

    private static MessageAction edit(String id, String label) {
        return new MessageAction(id, label, null, ButtonStyle.SECONDARY);
    }

    private static String valueOrUnset(String value) {
        return StringUtils.isBlank(value) ? NOT_SET : value;
    }
}
