package dev.vankka.supportdesk.ticket;

import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.Principal;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * The chat platform operations a ticket drives.
 * <p>
 * Implementations tolerate "already in the requested state" responses: deleting a channel that is already gone
 * or setting a permission to its current value succeeds.
 */
public interface ChannelResourceManager {

    /**
     * The principal the bot itself acts as.
     */
    Principal self();

    /**
     * Creates a text channel only {@code participants} can see.
     *
     * @param parentName name of the channel group to create the channel under, created if missing; {@code null} for none
     * @return the new channel's reference
     */
    String createChannel(String tenantId, String parentName, String name, Collection<Principal> participants) throws ExternalResourceException;

    void renameChannel(String channelRef, String name) throws ExternalResourceException;

    void setPermission(String channelRef, Principal principal, Access access) throws ExternalResourceException;

    /**
     * Removes every explicit permission the principal has in the channel.
     */
    void revokeAccess(String channelRef, Principal principal) throws ExternalResourceException;

    /**
     * @return the posted message's reference
     */
    String postMessage(String channelRef, OutboundMessage message) throws ExternalResourceException;

    void editMessage(String channelRef, String messageRef, OutboundMessage message) throws ExternalResourceException;

    /**
     * @return the message's reference, or empty if the message no longer exists
     */
    Optional<String> fetchMessage(String channelRef, String messageRef) throws ExternalResourceException;

    /**
     * Reads up to {@code limit} of the channel's most recent messages.
     *
     * @return the messages, oldest first
     */
    List<HistoryEntry> fetchHistory(String channelRef, int limit) throws ExternalResourceException;

    void deleteChannel(String channelRef) throws ExternalResourceException;

    /**
     * Whether the channel still resolves.
     */
    boolean channelExists(String channelRef) throws ExternalResourceException;
}
