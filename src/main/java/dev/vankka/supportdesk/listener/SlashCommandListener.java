package dev.vankka.supportdesk.listener;

import dev.vankka.supportdesk.discord.JdaMessages;
import dev.vankka.supportdesk.discord.JdaWizardSurface;
import dev.vankka.supportdesk.message.Mentions;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.model.TicketStats;
import dev.vankka.supportdesk.object.Emoji;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.panel.PanelMode;
import dev.vankka.supportdesk.panel.PanelService;
import dev.vankka.supportdesk.storage.TenantSetup;
import dev.vankka.supportdesk.ticket.PrivilegeResolver;
import dev.vankka.supportdesk.ticket.TicketStateMachine;
import dev.vankka.supportdesk.wizard.ConfigurationWizard;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.events.interaction.command.SlashCommandInteractionEvent;
import net.dv8tion.jda.api.hooks.ListenerAdapter;
import net.dv8tion.jda.api.interactions.InteractionHook;
import net.dv8tion.jda.api.interactions.commands.DefaultMemberPermissions;
import net.dv8tion.jda.api.interactions.commands.OptionMapping;
import net.dv8tion.jda.api.interactions.commands.OptionType;
import net.dv8tion.jda.api.interactions.commands.build.CommandData;
import net.dv8tion.jda.api.interactions.commands.build.Commands;
import net.dv8tion.jda.api.interactions.commands.build.OptionData;
import net.dv8tion.jda.api.interactions.commands.build.SubcommandData;

import javax.annotation.Nonnull;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Function;

/**
 * {@code /config}, {@code /panel} and {@code /ticket}.
 */
@Slf4j
@RequiredArgsConstructor
public class SlashCommandListener extends ListenerAdapter {

    private final TicketStateMachine tickets;
    private final TenantSetup tenantSetup;
    private final PanelService panelService;
    private final ConfigurationWizard wizard;
    private final PrivilegeResolver privileges;
    private final ExecutorService workers;

    public static List<CommandData> commands() {
        return Arrays.asList(
                Commands.slash("config", "Configure the ticket system")
                        .setGuildOnly(true)
                        .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_CHANNEL)),
                Commands.slash("panel", "Post the ticket panel members open tickets from")
                        .setGuildOnly(true)
                        .setDefaultPermissions(DefaultMemberPermissions.enabledFor(Permission.MANAGE_CHANNEL))
                        .addOptions(
                                new OptionData(OptionType.STRING, "mode", "How members pick a category", true)
                                        .addChoice("Button", PanelMode.BUTTON.name())
                                        .addChoice("Select menu", PanelMode.SELECT_MENU.name()),
                                new OptionData(OptionType.CHANNEL, "channel", "Where to post the panel, defaults to this channel", false)
                        ),
                Commands.slash("ticket", "Manage tickets")
                        .setGuildOnly(true)
                        .addSubcommands(
                                new SubcommandData("stats", "Show ticket statistics for this server"),
                                new SubcommandData("add", "Add a user to this ticket")
                                        .addOption(OptionType.USER, "user", "The user to add", true),
                                new SubcommandData("remove", "Remove a user from this ticket")
                                        .addOption(OptionType.USER, "user", "The user to remove", true),
                                new SubcommandData("info", "Show information about this ticket"),
                                new SubcommandData("close", "Close this ticket")
                                        .addOption(OptionType.STRING, "reason", "Why the ticket is closed", false),
                                new SubcommandData("reopen", "Reopen this ticket"),
                                new SubcommandData("transfer_owner", "Make another user the owner of this ticket")
                                        .addOption(OptionType.USER, "user", "The new owner", true)
                                        .addOption(OptionType.BOOLEAN, "remove_previous", "Remove the previous owner's access", false)
                        )
        );
    }

    @Override
    public void onSlashCommandInteraction(@Nonnull SlashCommandInteractionEvent event) {
        if (event.getGuild() == null) {
            return;
        }
        String tenantId = event.getGuild().getId();
        String userId = event.getUser().getId();
        String channelId = event.getChannel().getId();

        switch (event.getName()) {
            case "config":
                event.deferReply(true).queue();
                workers.execute(() -> configure(event.getHook(), tenantId, userId));
                break;
            case "panel":
                PanelMode mode = PanelMode.valueOf(event.getOption("mode", OptionMapping::getAsString));
                String target = event.getOption("channel", channelId, option -> option.getAsChannel().getId());
                event.deferReply(true).queue();
                workers.execute(() -> deployPanel(event.getHook(), tenantId, userId, target, mode));
                break;
            case "ticket":
                handleTicket(event, tenantId, userId, channelId);
                break;
            default:
                break;
        }
    }

    private void handleTicket(SlashCommandInteractionEvent event, String tenantId, String userId, String channelId) {
        String subcommand = event.getSubcommandName();
        if (subcommand == null) {
            return;
        }
        event.deferReply(true).queue();
        InteractionHook hook = event.getHook();

        switch (subcommand) {
            case "stats":
                workers.execute(() -> stats(hook, tenantId, userId));
                break;
            case "add":
            case "remove":
                String targetId = event.getOption("user", option -> option.getAsUser().getId());
                boolean add = "add".equals(subcommand);
                inTicket(hook, channelId, ticketId -> add
                                ? tickets.addParticipant(ticketId, targetId, userId)
                                : tickets.removeParticipant(ticketId, targetId, userId),
                        add
                                ? Emoji.HEAVY_PLUS_SIGN + " Added " + Mentions.user(targetId) + " to this ticket."
                                : Emoji.HEAVY_MINUS_SIGN + " Removed " + Mentions.user(targetId) + " from this ticket.");
                break;
            case "info":
                workers.execute(() -> {
                    Outcome<Ticket> ticket = tickets.findByChannel(channelId);
                    Outcome<OutboundMessage> info = ticket.isFailure() ? ticket.castFailure() : tickets.info(ticket.getValue().getId());
                    if (info.isFailure()) {
                        reply(hook, info, null);
                        return;
                    }
                    hook.editOriginal(JdaMessages.edit(info.getValue())).queue();
                });
                break;
            case "close":
                String reason = event.getOption("reason", OptionMapping::getAsString);
                inTicket(hook, channelId, ticketId -> tickets.close(ticketId, userId, reason), Emoji.LOCK + " Ticket closed.");
                break;
            case "reopen":
                inTicket(hook, channelId, ticketId -> tickets.reopen(ticketId, userId), Emoji.UNLOCK + " Ticket reopened.");
                break;
            case "transfer_owner":
                String newOwnerId = event.getOption("user", option -> option.getAsUser().getId());
                boolean removePrevious = event.getOption("remove_previous", false, OptionMapping::getAsBoolean);
                inTicket(hook, channelId, ticketId -> tickets.transferOwner(ticketId, newOwnerId, userId, removePrevious),
                        Emoji.WHITE_CHECK_MARK + " " + Mentions.user(newOwnerId) + " now owns this ticket.");
                break;
            default:
                hook.editOriginal(JdaMessages.text(Emoji.CROSS_MARK + " Unknown subcommand.")).queue();
                break;
        }
    }

    private void inTicket(InteractionHook hook, String channelId, Function<Long, Outcome<Ticket>> action, String success) {
        workers.execute(() -> {
            Outcome<Ticket> ticket = tickets.findByChannel(channelId);
            if (ticket.isFailure()) {
                reply(hook, ticket, null);
                return;
            }
            reply(hook, action.apply(ticket.getValue().getId()), success);
        });
    }

    private void configure(InteractionHook hook, String tenantId, String userId) {
        if (!privileges.isElevated(tenantId, userId)) {
            hook.editOriginal(JdaMessages.text(Emoji.CROSS_MARK + " You need the Manage Channels permission to configure tickets.")).queue();
            return;
        }
        Outcome<?> setup = tenantSetup.ensure(tenantId);
        if (setup.isFailure()) {
            reply(hook, setup, null);
            return;
        }
        log.info("User {} started configuring tickets in tenant {}", userId, tenantId);
        wizard.start(tenantId, userId, new JdaWizardSurface(hook));
    }

    private void deployPanel(InteractionHook hook, String tenantId, String userId, String channelId, PanelMode mode) {
        if (!privileges.isElevated(tenantId, userId)) {
            hook.editOriginal(JdaMessages.text(Emoji.CROSS_MARK + " You need the Manage Channels permission to post the ticket panel.")).queue();
            return;
        }
        Outcome<?> setup = tenantSetup.ensure(tenantId);
        if (setup.isFailure()) {
            reply(hook, setup, null);
            return;
        }
        reply(hook, panelService.deploy(tenantId, channelId, mode),
                Emoji.WHITE_CHECK_MARK + " Ticket panel posted in " + Mentions.channel(channelId) + ".");
    }

    private void stats(InteractionHook hook, String tenantId, String userId) {
        if (!privileges.isElevated(tenantId, userId)) {
            hook.editOriginal(JdaMessages.text(Emoji.CROSS_MARK + " Only staff can view ticket statistics.")).queue();
            return;
        }
        Outcome<TicketStats> outcome = tickets.stats(tenantId);
        if (outcome.isFailure()) {
            reply(hook, outcome, null);
            return;
        }
        TicketStats stats = outcome.getValue();
        StringBuilder description = new StringBuilder()
                .append("Total: ").append(stats.getTotal())
                .append("\nOpen: ").append(stats.getOpen())
                .append("\nClosed: ").append(stats.getClosed())
                .append("\nArchived: ").append(stats.getArchived());
        if (!stats.getPerCategory().isEmpty()) {
            description.append("\n\n**Per category**");
            for (Map.Entry<String, Long> entry : stats.getPerCategory().entrySet()) {
                description.append('\n').append(entry.getKey()).append(": ").append(entry.getValue());
            }
        }
        hook.editOriginal(JdaMessages.edit(OutboundMessage.builder()
                .title(Emoji.TICKET + " Ticket Statistics")
                .description(description.toString())
                .color("#5865F2")
                .build())).queue();
    }

    private static void reply(InteractionHook hook, Outcome<?> outcome, String success) {
        hook.editOriginal(JdaMessages.text(JdaMessages.describe(outcome, success))).queue();
    }
}
