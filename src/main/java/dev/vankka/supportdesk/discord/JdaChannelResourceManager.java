package dev.vankka.supportdesk.discord;

import com.google.common.collect.Lists;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.Principal;
import dev.vankka.supportdesk.ticket.Access;
import dev.vankka.supportdesk.ticket.ChannelResourceManager;
import dev.vankka.supportdesk.ticket.ExternalResourceException;
import dev.vankka.supportdesk.ticket.HistoryEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.dv8tion.jda.api.JDA;
import net.dv8tion.jda.api.Permission;
import net.dv8tion.jda.api.entities.Guild;
import net.dv8tion.jda.api.entities.IPermissionHolder;
import net.dv8tion.jda.api.entities.Message;
import net.dv8tion.jda.api.entities.PermissionOverride;
import net.dv8tion.jda.api.entities.channel.concrete.Category;
import net.dv8tion.jda.api.entities.channel.concrete.TextChannel;
import net.dv8tion.jda.api.exceptions.ErrorResponseException;
import net.dv8tion.jda.api.requests.ErrorResponse;
import net.dv8tion.jda.api.requests.restaction.ChannelAction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.stream.Collectors;

/**
 * Ticket channels as Discord text channels. Calls block, so they must run on a worker thread.
 */
@Slf4j
@RequiredArgsConstructor
public class JdaChannelResourceManager implements ChannelResourceManager {

    private static final EnumSet<Permission> PARTICIPANT = EnumSet.of(
            Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND, Permission.MESSAGE_HISTORY, Permission.MESSAGE_ATTACH_FILES);
    private static final EnumSet<Permission> BOT = EnumSet.of(
            Permission.VIEW_CHANNEL, Permission.MESSAGE_SEND, Permission.MESSAGE_HISTORY,
            Permission.MESSAGE_EMBED_LINKS, Permission.MANAGE_CHANNEL, Permission.MANAGE_PERMISSIONS);

    private final JDA jda;

    @Override
    public Principal self() {
        return Principal.user(jda.getSelfUser().getId());
    }

    @Override
    public String createChannel(String tenantId, String parentName, String name, Collection<Principal> participants)
            throws ExternalResourceException {
        Guild guild = jda.getGuildById(tenantId);
        if (guild == null) {
            throw ExternalResourceException.notFound("guild " + tenantId);
        }
        try {
            Category parent = parent(guild, parentName);
            ChannelAction<TextChannel> action = guild.createTextChannel(name, parent)
                    .addRolePermissionOverride(guild.getPublicRole().getIdLong(), null, EnumSet.of(Permission.VIEW_CHANNEL));
            for (Principal participant : participants) {
                long id = Long.parseLong(participant.getId());
                if (participant.getType() == Principal.Type.ROLE) {
                    action = action.addRolePermissionOverride(id, PARTICIPANT, null);
                } else if (participant.getId().equals(jda.getSelfUser().getId())) {
                    action = action.addMemberPermissionOverride(id, BOT, null);
                } else {
                    action = action.addMemberPermissionOverride(id, PARTICIPANT, null);
                }
            }
            TextChannel channel = action.complete();
            log.debug("Created channel {} ({}) in guild {}", channel.getName(), channel.getId(), tenantId);
            return channel.getId();
        } catch (RuntimeException e) {
            throw wrap("create channel " + name, e);
        }
    }

    @Override
    public void renameChannel(String channelRef, String name) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        if (channel.getName().equals(name)) {
            return;
        }
        try {
            channel.getManager().setName(name).complete();
        } catch (RuntimeException e) {
            throw wrap("rename channel " + channelRef, e);
        }
    }

    @Override
    public void setPermission(String channelRef, Principal principal, Access access) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        try {
            IPermissionHolder holder = holder(channel.getGuild(), principal);
            switch (access) {
                case ALLOW:
                    channel.upsertPermissionOverride(holder).grant(PARTICIPANT).complete();
                    break;
                case DENY:
                    channel.upsertPermissionOverride(holder).deny(Permission.MESSAGE_SEND).complete();
                    break;
                case INHERIT:
                    channel.upsertPermissionOverride(holder).clear(Permission.MESSAGE_SEND).complete();
                    break;
                default:
                    throw new IllegalArgumentException("Unknown access " + access);
            }
        } catch (RuntimeException e) {
            throw wrap("update permissions in " + channelRef, e);
        }
    }

    @Override
    public void revokeAccess(String channelRef, Principal principal) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        try {
            PermissionOverride override = channel.getPermissionOverride(holder(channel.getGuild(), principal));
            if (override != null) {
                override.delete().complete();
            }
        } catch (RuntimeException e) {
            throw wrap("revoke access in " + channelRef, e);
        }
    }

    @Override
    public String postMessage(String channelRef, OutboundMessage message) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        try {
            return channel.sendMessage(JdaMessages.create(message)).complete().getId();
        } catch (RuntimeException e) {
            throw wrap("post in " + channelRef, e);
        }
    }

    @Override
    public void editMessage(String channelRef, String messageRef, OutboundMessage message) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        try {
            channel.editMessageById(messageRef, JdaMessages.edit(message)).complete();
        } catch (RuntimeException e) {
            throw wrap("edit message " + messageRef, e);
        }
    }

    @Override
    public Optional<String> fetchMessage(String channelRef, String messageRef) throws ExternalResourceException {
        TextChannel channel = jda.getTextChannelById(channelRef);
        if (channel == null) {
            return Optional.empty();
        }
        try {
            channel.retrieveMessageById(messageRef).complete();
            return Optional.of(messageRef);
        } catch (ErrorResponseException e) {
            if (e.getErrorResponse() == ErrorResponse.UNKNOWN_MESSAGE) {
                return Optional.empty();
            }
            throw wrap("fetch message " + messageRef, e);
        } catch (RuntimeException e) {
            throw wrap("fetch message " + messageRef, e);
        }
    }

    @Override
    public List<HistoryEntry> fetchHistory(String channelRef, int limit) throws ExternalResourceException {
        TextChannel channel = channel(channelRef);
        List<Message> messages;
        try {
            messages = channel.getIterableHistory().takeAsync(limit).join();
        } catch (CompletionException e) {
            throw wrap("read the history of " + channelRef, e.getCause() instanceof RuntimeException ? (RuntimeException) e.getCause() : e);
        } catch (RuntimeException e) {
            throw wrap("read the history of " + channelRef, e);
        }

        List<HistoryEntry> history = new ArrayList<>(messages.size());
        for (Message message : Lists.reverse(messages)) {
            history.add(HistoryEntry.builder()
                    .authorRef(message.getAuthor().getId())
                    .authorName(message.getAuthor().getName())
                    .sentAt(message.getTimeCreated().toInstant())
                    .content(message.getContentDisplay())
                    .attachmentUrls(message.getAttachments().stream().map(Message.Attachment::getUrl).collect(Collectors.toList()))
                    .build());
        }
        return history;
    }

    @Override
    public void deleteChannel(String channelRef) throws ExternalResourceException {
        TextChannel channel = jda.getTextChannelById(channelRef);
        if (channel == null) {
            log.debug("Channel {} is already gone", channelRef);
            return;
        }
        try {
            channel.delete().complete();
        } catch (ErrorResponseException e) {
            if (e.getErrorResponse() != ErrorResponse.UNKNOWN_CHANNEL) {
                throw wrap("delete channel " + channelRef, e);
            }
        } catch (RuntimeException e) {
            throw wrap("delete channel " + channelRef, e);
        }
    }

    @Override
    public boolean channelExists(String channelRef) {
        return jda.getTextChannelById(channelRef) != null;
    }

    private TextChannel channel(String channelRef) throws ExternalResourceException {
        TextChannel channel = jda.getTextChannelById(channelRef);
        if (channel == null) {
            throw ExternalResourceException.notFound("channel " + channelRef);
        }
        return channel;
    }

    private Category parent(Guild guild, String name) {
        List<Category> categories = guild.getCategoriesByName(name, true);
        if (!categories.isEmpty()) {
            return categories.get(0);
        }
        log.info("Creating channel category {} in guild {}", name, guild.getId());
        return guild.createCategory(name).complete();
    }

    private static IPermissionHolder holder(Guild guild, Principal principal) {
        if (principal.getType() == Principal.Type.ROLE) {
            IPermissionHolder role = guild.getRoleById(principal.getId());
            if (role == null) {
                throw new IllegalArgumentException("Unknown role " + principal.getId());
            }
            return role;
        }
        return guild.retrieveMemberById(principal.getId()).complete();
    }

    private static ExternalResourceException wrap(String action, RuntimeException e) {
        boolean notFound = e instanceof ErrorResponseException
                && (((ErrorResponseException) e).getErrorResponse() == ErrorResponse.UNKNOWN_CHANNEL
                || ((ErrorResponseException) e).getErrorResponse() == ErrorResponse.UNKNOWN_MESSAGE);
        return new ExternalResourceException("Failed to " + action + ": " + e.getMessage(), e, notFound);
    }
}
