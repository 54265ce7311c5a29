package dev.vankka.supportdesk.wizard;

import lombok.AccessLevel;
import lombok.NoArgsConstructor;

/**
 * Component ids used on configuration screens.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class WizardIds {

    public static final String PREFIX = "config_";

    public static final String BUTTON = PREFIX + "button";
    public static final String CATEGORIES = PREFIX + "categories";
    public static final String MESSAGES = PREFIX + "messages";
    public static final String SELECT_MENU = PREFIX + "select_menu";
    public static final String GENERAL = PREFIX + "general";
    public static final String CLOSE = PREFIX + "close";
    public static final String BACK = PREFIX + "back";

    public static final String BUTTON_LABEL = PREFIX + "button_label";
    public static final String BUTTON_GLYPH = PREFIX + "button_emoji";
    public static final String BUTTON_STYLE = PREFIX + "button_style";
    public static final String BUTTON_TITLE = PREFIX + "button_title";
    public static final String BUTTON_DESCRIPTION = PREFIX + "button_desc";
    public static final String BUTTON_COLOR = PREFIX + "button_color";
    public static final String BUTTON_LOG_CHANNEL = PREFIX + "button_log_channel";

    public static final String CATEGORY_ADD = PREFIX + "category_add";
    public static final String CATEGORY_PICK = PREFIX + "category_pick";
    public static final String CATEGORY_EDIT = PREFIX + "category_edit";
    public static final String CATEGORY_TOGGLE = PREFIX + "category_toggle";
    public static final String CATEGORY_DELETE = PREFIX + "category_delete";
    public static final String CONFIRM = PREFIX + "confirm";
    public static final String CANCEL = PREFIX + "cancel";

    public static final String MESSAGES_PICK = PREFIX + "messages_pick";
    public static final String WELCOME_MESSAGE = PREFIX + "welcome_message";
    public static final String CLOSE_MESSAGE = PREFIX + "close_message";
    public static final String INCLUDE_SUPPORT = PREFIX + "include_support";

    public static final String MENU_PLACEHOLDER = PREFIX + "menu_placeholder";
    public static final String MENU_TITLE = PREFIX + "menu_title";
    public static final String MENU_DESCRIPTION = PREFIX + "menu_description";
    public static final String MENU_COLOR = PREFIX + "menu_color";

    public static final String TOGGLE_ENABLED = PREFIX + "toggle_enabled";
    public static final String DEFAULT_CATEGORY_NAME = PREFIX + "default_category";

    /**
     * Field ids inside configuration forms.
     */
    public static final String FIELD_VALUE = "value";
    public static final String FIELD_NAME = "name";
    public static final String FIELD_DESCRIPTION = "description";
    public static final String FIELD_GLYPH = "emoji";
    public static final String FIELD_ROLE = "role";

    public static String modalId(String componentId) {
        return componentId + "_modal";
    }
}
