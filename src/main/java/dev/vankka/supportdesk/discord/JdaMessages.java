package dev.vankka.supportdesk.discord;

import dev.vankka.supportdesk.message.FileAttachment;
import dev.vankka.supportdesk.message.MenuOption;
import dev.vankka.supportdesk.message.MenuSpec;
import dev.vankka.supportdesk.message.MessageAction;
import dev.vankka.supportdesk.message.ModalForm;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.storage.Fields;
import lombok.AccessLevel;
import lombok.NoArgsConstructor;
import net.dv8tion.jda.api.EmbedBuilder;
import net.dv8tion.jda.api.interactions.components.ActionRow;
import net.dv8tion.jda.api.interactions.components.ItemComponent;
import net.dv8tion.jda.api.interactions.components.LayoutComponent;
import net.dv8tion.jda.api.interactions.components.buttons.Button;
import net.dv8tion.jda.api.interactions.components.buttons.ButtonStyle;
import net.dv8tion.jda.api.interactions.components.selections.SelectOption;
import net.dv8tion.jda.api.interactions.components.selections.StringSelectMenu;
import net.dv8tion.jda.api.interactions.components.text.TextInput;
import net.dv8tion.jda.api.interactions.components.text.TextInputStyle;
import net.dv8tion.jda.api.interactions.modals.Modal;
import net.dv8tion.jda.api.utils.FileUpload;
import net.dv8tion.jda.api.utils.messages.MessageCreateBuilder;
import net.dv8tion.jda.api.utils.messages.MessageCreateData;
import net.dv8tion.jda.api.utils.messages.MessageEditBuilder;
import net.dv8tion.jda.api.utils.messages.MessageEditData;
import org.apache.commons.lang3.StringUtils;

import java.awt.Color;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns the engine's plain message descriptions into Discord embeds and components.
 */
@NoArgsConstructor(access = AccessLevel.PRIVATE)
public final class JdaMessages {

    public static MessageCreateData create(OutboundMessage message) {
        MessageCreateBuilder builder = new MessageCreateBuilder();
        if (StringUtils.isNotEmpty(message.getContent())) {
            builder.setContent(message.getContent());
        }
        if (message.getTitle() != null || message.getDescription() != null) {
            EmbedBuilder embed = new EmbedBuilder()
                    .setTitle(StringUtils.abbreviate(message.getTitle(), 256))
                    .setDescription(StringUtils.abbreviate(message.getDescription(), 4096));
            Color color = color(message.getColor());
            if (color != null) {
                embed.setColor(color);
            }
            builder.setEmbeds(embed.build());
        }
        builder.setComponents(components(message));
        for (FileAttachment file : message.getFiles()) {
            builder.addFiles(FileUpload.fromData(file.getContent().getBytes(StandardCharsets.UTF_8), file.getFileName()));
        }
        return builder.build();
    }

    public static MessageEditData edit(OutboundMessage message) {
        return MessageEditBuilder.fromCreateData(create(message)).setReplace(true).build();
    }

    public static MessageEditData text(String text) {
        return new MessageEditBuilder().setContent(text).setReplace(true).build();
    }

    public static Modal modal(ModalForm form) {
        Modal.Builder modal = Modal.create(form.getId(), StringUtils.abbreviate(form.getTitle(), 45));
        for (ModalForm.Field field : form.getFields()) {
            TextInput.Builder input = TextInput.create(field.getId(), StringUtils.abbreviate(field.getLabel(), 45),
                            field.isParagraph() ? TextInputStyle.PARAGRAPH : TextInputStyle.SHORT)
                    .setRequired(field.isRequired())
                    .setMaxLength(field.getMaxLength());
            if (StringUtils.isNotEmpty(field.getValue())) {
                input.setValue(StringUtils.abbreviate(field.getValue(), field.getMaxLength()));
            }
            modal.addActionRow(input.build());
        }
        return modal.build();
    }

    /**
     * The text shown to the member who triggered an operation.
     */
    public static String describe(Outcome<?> outcome, String success) {
        if (outcome.isFailure()) {
            return Emoji.CROSS_MARK + " " + outcome.getMessage();
        }
        StringBuilder text = new StringBuilder(success);
        for (String warning : outcome.getWarnings()) {
            text.append('\n').append(Emoji.WARNING).append(' ').append(warning);
        }
        return text.toString();
    }

    private static List<LayoutComponent> components(OutboundMessage message) {
        List<LayoutComponent> rows = new ArrayList<>();
        if (message.getMenu() != null && !message.getMenu().getOptions().isEmpty()) {
            rows.add(ActionRow.of(menu(message.getMenu())));
        }
        List<ItemComponent> buttons = new ArrayList<>();
        for (MessageAction action : message.getActions()) {
            buttons.add(button(action));
        }
        if (!buttons.isEmpty()) {
            rows.addAll(ActionRow.partitionOf(buttons));
        }
        return rows;
    }

    static Button button(MessageAction action) {
        ButtonStyle style = style(action.getStyle());
        net.dv8tion.jda.api.entities.emoji.Emoji emoji = emoji(action.getGlyph());
        if (StringUtils.isBlank(action.getLabel()) && emoji != null) {
            return Button.of(style, action.getId(), emoji);
        }
        Button button = Button.of(style, action.getId(), StringUtils.abbreviate(action.getLabel(), 80));
        return emoji != null ? button.withEmoji(emoji) : button;
    }

    private static StringSelectMenu menu(MenuSpec spec) {
        StringSelectMenu.Builder menu = StringSelectMenu.create(spec.getId())
                .setRequiredRange(spec.getMinValues(), spec.getMaxValues());
        if (StringUtils.isNotBlank(spec.getPlaceholder())) {
            menu.setPlaceholder(StringUtils.abbreviate(spec.getPlaceholder(), 150));
        }
        for (MenuOption option : spec.getOptions()) {
            menu.addOptions(SelectOption.of(StringUtils.abbreviate(option.getLabel(), 100), option.getValue())
                    .withDescription(StringUtils.abbreviate(option.getDescription(), 100))
                    .withEmoji(emoji(option.getGlyph())));
        }
        return menu.build();
    }

    static ButtonStyle style(dev.vankka.supportdesk.model.ButtonStyle style) {
        if (style == null) {
            return ButtonStyle.PRIMARY;
        }
        switch (style) {
            case SECONDARY:
                return ButtonStyle.SECONDARY;
            case SUCCESS:
                return ButtonStyle.SUCCESS;
            case DANGER:
                return ButtonStyle.DANGER;
            case PRIMARY:
            default:
                return ButtonStyle.PRIMARY;
        }
    }

    static net.dv8tion.jda.api.entities.emoji.Emoji emoji(String glyph) {
        return StringUtils.isBlank(glyph) ? null : net.dv8tion.jda.api.entities.emoji.Emoji.fromFormatted(glyph.trim());
    }

    static Color color(String hex) {
        String normalized = Fields.normalizeColor(hex);
        if (normalized == null) {
            return null;
        }
        if (normalized.length() == 4) {
            normalized = "#" + normalized.charAt(1) + normalized.charAt(1)
                    + normalized.charAt(2) + normalized.charAt(2)
                    + normalized.charAt(3) + normalized.charAt(3);
        }
        return Color.decode(normalized);
    }
}
