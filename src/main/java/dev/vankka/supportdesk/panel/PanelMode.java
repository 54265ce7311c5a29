package dev.vankka.supportdesk.panel;

/**
 * How members pick a category when opening a ticket from the panel.
 */
public enum PanelMode {

    /**
     * A single creation button, categories are asked for after clicking it when there is more than one.
     */
    BUTTON,

    /**
     * A menu listing the enabled categories.
     */
    SELECT_MENU
}
