package dev.vankka.supportdesk.listener;

import dev.vankka.supportdesk.discord.JdaMessages;
import dev.vankka.supportdesk.message.MenuSpec;
import dev.vankka.supportdesk.message.Mentions;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import dev.vankka.supportdesk.panel.PanelService;
import dev.vankka.supportdesk.storage.CategoryRegistry;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.ticket.TicketActions;
import dev.vankka.supportdesk.ticket.TicketStateMachine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.events.interaction.component.ButtonInteractionEvent;
import net.dv8tion.jda.api.events.interaction.component.StringSelectInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.InteractionHook;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Opens tickets from the panel's button or category menu.
 */
@Slf4j
@RequiredArgsConstructor
public class TicketPanelListener extends ListenerAdapter {

    private final TicketStateMachine tickets;
    private final CategoryRegistry categoryRegistry;
    private final PanelService panelService;
    private final ExecutorService workers;

    @Override
    public void onButtonInteraction(@Nonnull ButtonInteractionEvent event) {
        if (!TicketActions.CREATE.equals(event.getComponentId()) || event.getGuild() == null) {
            return;
        }
        String tenantId = event.getGuild().getId();
        String userId = event.getUser().getId();
        event.deferReply(true).queue();
        workers.execute(() -> chooseCategory(event.getHook(), tenantId, userId));
    }

    @Override
    public void onStringSelectInteraction(@Nonnull StringSelectInteractionEvent event) {
        if (!TicketActions.CATEGORY_SELECT.equals(event.getComponentId()) || event.getGuild() == null) {
            return;
        }
        String tenantId = event.getGuild().getId();
        String userId = event.getUser().getId();
        List<String> values = event.getValues();
        event.deferReply(true).queue();
        workers.execute(() -> {
            long categoryId;
            try {
                categoryId = Long.parseLong(values.get(0));
            } catch (NumberFormatException | IndexOutOfBoundsException e) {
                log.debug("Invalid category selection {} by {}", values, userId);
                reply(event.getHook(), Outcome.failure(Reason.CATEGORY_UNAVAILABLE), null);
                return;
            }
            create(event.getHook(), tenantId, userId, categoryId);
        });
    }

    private void chooseCategory(InteractionHook hook, String tenantId, String userId) {
        List<Category> categories;
        try {
            categories = categoryRegistry.listEnabled(tenantId);
        } catch (PersistenceException e) {
            reply(hook, Outcome.failure(Reason.PERSISTENCE_FAILURE), null);
            return;
        }
        if (categories.size() == 1) {
            create(hook, tenantId, userId, categories.get(0).getId());
            return;
        }

        Outcome<MenuSpec> menu = panelService.categoryMenu(tenantId);
        if (menu.isFailure()) {
            reply(hook, menu, null);
            return;
        }
        hook.editOriginal(JdaMessages.edit(OutboundMessage.builder()
                .content(Emoji.TICKET + " What do you need help with?")
                .menu(menu.getValue())
                .build())).queue();
    }

    private void create(InteractionHook hook, String tenantId, String userId, long categoryId) {
        Outcome<Ticket> outcome = tickets.create(tenantId, userId, categoryId);
        reply(hook, outcome, outcome.value()
                .map(ticket -> Emoji.WHITE_CHECK_MARK + " Your ticket has been created: " + Mentions.channel(ticket.getChannelRef()))
                .orElse(null));
    }

    private static void reply(InteractionHook hook, Outcome<?> outcome, String success) {
        hook.editOriginal(JdaMessages.text(JdaMessages.describe(outcome, success))).queue();
    }
}
