package dev.vankka.supportdesk.ticket;

import com.google.common.util.concurrent.Striped;
import dev.vankka.supportdesk.message.FileAttachment;
import dev.vankka.supportdesk.message.Mentions;
import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonConfig;
import dev.vankka.supportdesk.model.Category;
import dev.vankka.supportdesk.model.MessageTemplate;
import dev.vankka.supportdesk.model.Principal;
import dev.vankka.supportdesk.model.TenantConfig;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.model.TicketStats;
import dev.vankka.supportdesk.model.TicketStatus;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import dev.vankka.supportdesk.storage.CategoryRegistry;
import dev.vankka.supportdesk.storage.ConfigStore;
import dev.vankka.supportdesk.storage.MessageTemplateStore;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.storage.TicketStore;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;

/**
 * Drives tickets through {@code open -> closed -> archived}, with reopening and an audit-retaining delete,
 * and keeps each ticket's backing channel in step with its status.
 * <p>
 * The database status is authoritative: once a transition is written, failing channel side effects only
 * downgrade the outcome to a partial success. The exception is ticket creation, where a channel without a row
 * (or a row without a channel) would be an orphan, so failures there are compensated.
 */
@Slf4j
public class TicketStateMachine {

    public static final String SYSTEM_PRINCIPAL = "system";
    public static final String REASON_CHANNEL_MISSING = "channel missing";
    public static final String REASON_DELETED = "deleted by staff";
    static final String REASON_ARCHIVED = "Ticket archived";
    static final String NEW_CHANNEL_NAME = "ticket-new";

    private final TicketStore ticketStore;
    private final ConfigStore configStore;
    private final CategoryRegistry categoryRegistry;
    private final MessageTemplateStore messageTemplateStore;
    private final ChannelResourceManager channels;
    private final NotificationDelivery notifications;
    private final PrivilegeResolver privileges;
    private final ScheduledExecutorService scheduler;
    private final Duration channelDeleteDelay;
    private final Clock clock;
    private final Striped<Lock> createLocks = Striped.lock(64);

    public TicketStateMachine(TicketStore ticketStore, ConfigStore configStore, CategoryRegistry categoryRegistry,
                              MessageTemplateStore messageTemplateStore, ChannelResourceManager channels,
                              NotificationDelivery notifications, PrivilegeResolver privileges,
                              ScheduledExecutorService scheduler, Duration channelDeleteDelay, Clock clock) {
        this.ticketStore = ticketStore;
        this.configStore = configStore;
        this.categoryRegistry = categoryRegistry;
        this.messageTemplateStore = messageTemplateStore;
        this.channels = channels;
        this.notifications = notifications;
        this.privileges = privileges;
        this.scheduler = scheduler;
        this.channelDeleteDelay = channelDeleteDelay;
        this.clock = clock;
    }

    /**
     * Opens a new ticket for {@code requesterRef} in the given category.
     * <p>
     * A requester may only have one open ticket per tenant. An open ticket whose channel was deleted behind our back
     * doesn't count: it is closed on the spot and creation continues.
     */
    public Outcome<Ticket> create(String tenantId, String requesterRef, long categoryId) {
        Lock lock = createLocks.get(tenantId + ':' + requesterRef);
        lock.lock();
        try {
            return doCreate(tenantId, requesterRef, categoryId);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        } finally {
            lock.unlock();
        }
    }

    private Outcome<Ticket> doCreate(String tenantId, String requesterRef, long categoryId) throws PersistenceException {
        Optional<TenantConfig> tenant = configStore.find(tenantId);
        if (tenant.isEmpty()) {
            return Outcome.failure(Reason.TENANT_DISABLED, "The ticket system is not set up in this server.");
        }
        if (!tenant.get().isEnabled()) {
            return Outcome.failure(Reason.TENANT_DISABLED);
        }

        for (Ticket open : ticketStore.findOpenByRequester(tenantId, requesterRef)) {
            if (channelResolves(open)) {
                return Outcome.failure(Reason.DUPLICATE_OPEN_TICKET,
                        "You already have an open ticket: " + Mentions.channel(open.getChannelRef()));
            }
            closeStale(open);
        }

        Optional<Category> found = categoryRegistry.find(categoryId);
        if (found.isEmpty() || !found.get().getTenantId().equals(tenantId) || !found.get().isEnabled()) {
            return Outcome.failure(Reason.CATEGORY_UNAVAILABLE);
        }
        Category category = found.get();

        List<Principal> participants = new ArrayList<>();
        participants.add(channels.self());
        participants.add(Principal.user(requesterRef));
        if (category.hasSupportRole()) {
            participants.add(Principal.role(category.getSupportRoleRef()));
        }

        String channelRef;
        try {
            channelRef = channels.createChannel(tenantId, tenant.get().getDefaultCategoryName(), NEW_CHANNEL_NAME, participants);
        } catch (ExternalResourceException e) {
            log.warn("Could not create a ticket channel for {} in tenant {}", requesterRef, tenantId, e);
            return Outcome.failure(Reason.CHANNEL_UNAVAILABLE);
        }

        Ticket ticket;
        try {
            ticket = ticketStore.create(tenantId, categoryId, requesterRef, channelRef);
        } catch (PersistenceException e) {
            log.error("Failed to store ticket for channel {}, deleting the channel", channelRef, e);
            try {
                channels.deleteChannel(channelRef);
            } catch (ExternalResourceException deleteError) {
                log.error("Failed to delete orphaned ticket channel {}", channelRef, deleteError);
            }
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }

        List<String> warnings = new ArrayList<>();
        rename(ticket, TicketStatus.OPEN, warnings);
        try {
            MessageTemplate template = messageTemplateStore.findOrDefault(categoryId, category.getName());
            post(ticket.getChannelRef(), TicketNotices.welcome(ticket, category, template), "welcome message", warnings);
        } catch (PersistenceException e) {
            warnings.add("Could not load the welcome message.");
        }

        log.info("User {} created ticket #{} in category {} of tenant {}", requesterRef, ticket.getTicketNumber(), category.getName(), tenantId);
        return Outcome.of(ticket, warnings);
    }

    /**
     * Closes an open ticket and makes its channel read-only for everyone but staff.
     */
    public Outcome<Ticket> close(long ticketId, String closedBy, String reason) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (!ticket.isOpen()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            Category category = categoryOf(ticket);
            if (!canManage(ticket, category, closedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "You don't have permission to close this ticket.");
            }

            Optional<Ticket> written = ticketStore.compareAndSet(ticket, ticket.toBuilder()
                    .status(TicketStatus.CLOSED)
                    .closedByRef(closedBy)
                    .closedAt(now())
                    .closeReason(StringUtils.trimToNull(reason))
                    .build());
            if (written.isEmpty()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            Ticket closed = written.get();

            List<String> warnings = new ArrayList<>();
            try {
                channels.setPermission(closed.getChannelRef(), Principal.everyone(closed.getTenantId()), Access.DENY);
            } catch (ExternalResourceException e) {
                log.warn("Could not lock channel of ticket #{} in tenant {}", closed.getTicketNumber(), closed.getTenantId(), e);
                warnings.add("Could not update the channel permissions.");
            }
            post(closed.getChannelRef(), TicketNotices.closed(closed, closeText(closed, category)), "close notice", warnings);
            rename(closed, TicketStatus.CLOSED, warnings);
            postCloseLog(closed, category, warnings);

            log.info("Ticket #{} of tenant {} closed by {}", closed.getTicketNumber(), closed.getTenantId(), closedBy);
            return Outcome.of(closed, warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Reopens a closed or archived ticket and gives the requester and support team their access back.
     */
    public Outcome<Ticket> reopen(long ticketId, String reopenedBy) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (ticket.isOpen()) {
                return Outcome.failure(Reason.ALREADY_OPEN);
            }
            Category category = categoryOf(ticket);
            if (!canManage(ticket, category, reopenedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "You don't have permission to reopen this ticket.");
            }

            Optional<Ticket> written = ticketStore.compareAndSet(ticket, ticket.toBuilder()
                    .status(TicketStatus.OPEN)
                    .closedByRef(null)
                    .closedAt(null)
                    .closeReason(null)
                    .build());
            if (written.isEmpty()) {
                return Outcome.failure(Reason.ALREADY_OPEN);
            }
            Ticket reopened = written.get();

            List<String> warnings = new ArrayList<>();
            try {
                channels.setPermission(reopened.getChannelRef(), Principal.everyone(reopened.getTenantId()), Access.INHERIT);
                channels.setPermission(reopened.getChannelRef(), Principal.user(reopened.getRequesterRef()), Access.ALLOW);
                if (category != null && category.hasSupportRole()) {
                    channels.setPermission(reopened.getChannelRef(), Principal.role(category.getSupportRoleRef()), Access.ALLOW);
                }
            } catch (ExternalResourceException e) {
                log.warn("Could not restore permissions of ticket #{} in tenant {}", reopened.getTicketNumber(), reopened.getTenantId(), e);
                warnings.add("Could not restore the channel permissions.");
            }
            post(reopened.getChannelRef(), TicketNotices.reopened(reopened, reopenedBy), "reopen notice", warnings);
            rename(reopened, TicketStatus.OPEN, warnings);

            log.info("Ticket #{} of tenant {} reopened by {}", reopened.getTicketNumber(), reopened.getTenantId(), reopenedBy);
            return Outcome.of(reopened, warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Marks a ticket as archived. Archival classifies the ticket, it leaves channel permissions untouched.
     */
    public Outcome<Ticket> archive(long ticketId, String archivedBy) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (ticket.getStatus() == TicketStatus.ARCHIVED) {
                return Outcome.failure(Reason.ALREADY_ARCHIVED);
            }
            Category category = categoryOf(ticket);
            if (!isStaff(ticket, category, archivedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "Only support team members can archive tickets.");
            }

            Optional<Ticket> written = ticketStore.compareAndSet(ticket, ticket.toBuilder()
                    .status(TicketStatus.ARCHIVED)
                    .closedByRef(archivedBy)
                    .closedAt(ticket.getClosedAt() != null ? ticket.getClosedAt() : now())
                    .closeReason(StringUtils.defaultIfBlank(ticket.getCloseReason(), REASON_ARCHIVED))
                    .build());
            if (written.isEmpty()) {
                return Outcome.failure(Reason.ALREADY_ARCHIVED);
            }
            Ticket archived = written.get();

            List<String> warnings = new ArrayList<>();
            post(archived.getChannelRef(), TicketNotices.archived(archived), "archive notice", warnings);
            rename(archived, TicketStatus.ARCHIVED, warnings);

            log.info("Ticket #{} of tenant {} archived by {}", archived.getTicketNumber(), archived.getTenantId(), archivedBy);
            return Outcome.of(archived, warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Audit-retaining delete: the ticket row is kept, closed with {@value #REASON_DELETED}, and only its channel is
     * removed, after a grace delay so the confirming interaction can still render.
     */
    public Outcome<Ticket> delete(long ticketId, String requestedBy) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            if (!privileges.isElevated(found.get().getTenantId(), requestedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "You need the Manage Channels permission to delete tickets.");
            }

            Optional<Ticket> written = Optional.empty();
            for (int attempt = 0; attempt < 3 && written.isEmpty() && found.isPresent(); attempt++) {
                Ticket current = found.get();
                written = ticketStore.compareAndSet(current, current.toBuilder()
                        .status(TicketStatus.CLOSED)
                        .closedByRef(requestedBy)
                        .closedAt(now())
                        .closeReason(REASON_DELETED)
                        .build());
                if (written.isEmpty()) {
                    found = ticketStore.find(ticketId);
                }
            }
            if (written.isEmpty()) {
                return Outcome.failure(Reason.PERSISTENCE_FAILURE, "The ticket kept changing, please try again.");
            }
            Ticket deleted = written.get();

            try {
                notifications.notify(deleted.getRequesterRef(), TicketNotices.deleted(deleted));
            } catch (RuntimeException e) {
                log.warn("Could not notify {} about the deletion of ticket #{}", deleted.getRequesterRef(), deleted.getTicketNumber(), e);
            }
            scheduleChannelDeletion(deleted);

            log.info("Ticket #{} of tenant {} deleted by {}", deleted.getTicketNumber(), deleted.getTenantId(), requestedBy);
            return Outcome.success(deleted);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Claims an open ticket for a staff member, or releases it when the same staff member claims it again.
     */
    public Outcome<Ticket> claim(long ticketId, String staffRef) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (!ticket.isOpen()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            Category category = categoryOf(ticket);
            if (!isStaff(ticket, category, staffRef)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "Only support team members can claim tickets.");
            }
            if (ticket.getClaimedByRef() != null && !ticket.getClaimedByRef().equals(staffRef)) {
                return Outcome.failure(Reason.ALREADY_CLAIMED,
                        "This ticket is already claimed by " + Mentions.user(ticket.getClaimedByRef()) + ".");
            }

            boolean claiming = ticket.getClaimedByRef() == null;
            Optional<Ticket> written = ticketStore.compareAndSet(ticket, ticket.toBuilder()
                    .claimedByRef(claiming ? staffRef : null)
                    .build());
            if (written.isEmpty()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }

            List<String> warnings = new ArrayList<>();
            post(ticket.getChannelRef(), TicketNotices.claimed(ticket, staffRef, claiming), "claim notice", warnings);
            log.info("Ticket #{} of tenant {} {} by {}", ticket.getTicketNumber(), ticket.getTenantId(), claiming ? "claimed" : "unclaimed", staffRef);
            return Outcome.of(written.get(), warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Outcome<Ticket> addParticipant(long ticketId, String userRef, String requestedBy) {
        return changeParticipant(ticketId, userRef, requestedBy, true);
    }

    public Outcome<Ticket> removeParticipant(long ticketId, String userRef, String requestedBy) {
        return changeParticipant(ticketId, userRef, requestedBy, false);
    }

    private Outcome<Ticket> changeParticipant(long ticketId, String userRef, String requestedBy, boolean add) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (!ticket.isOpen()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            if (!canManage(ticket, categoryOf(ticket), requestedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE, "You don't have permission to manage users in this ticket.");
            }
            if (userRef.equals(ticket.getRequesterRef())) {
                return Outcome.failure(Reason.INVALID_INPUT, add
                        ? "That user created this ticket and already has access."
                        : "Cannot remove the ticket creator from the ticket.");
            }
            if (userRef.equals(channels.self().getId())) {
                return Outcome.failure(Reason.INVALID_INPUT, "The bot's own access cannot be changed.");
            }

            try {
                if (add) {
                    channels.setPermission(ticket.getChannelRef(), Principal.user(userRef), Access.ALLOW);
                } else {
                    channels.revokeAccess(ticket.getChannelRef(), Principal.user(userRef));
                }
            } catch (ExternalResourceException e) {
                log.warn("Could not change access of {} to ticket #{}", userRef, ticket.getTicketNumber(), e);
                return Outcome.failure(Reason.CHANNEL_UNAVAILABLE, "Could not update the ticket channel.");
            }

            List<String> warnings = new ArrayList<>();
            post(ticket.getChannelRef(), add
                    ? TicketNotices.participantAdded(userRef, requestedBy)
                    : TicketNotices.participantRemoved(userRef, requestedBy), "participant notice", warnings);
            log.info("User {} {} ticket #{} of tenant {} by {}", userRef, add ? "added to" : "removed from",
                    ticket.getTicketNumber(), ticket.getTenantId(), requestedBy);
            return Outcome.of(ticket, warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Makes another user the requester of an open ticket. The new owner gets channel access, the previous owner keeps
     * theirs unless {@code revokePrevious} is set.
     */
    public Outcome<Ticket> transferOwner(long ticketId, String newOwnerRef, String requestedBy, boolean revokePrevious) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Ticket ticket = found.get();
            if (!ticket.isOpen()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            if (!canManage(ticket, categoryOf(ticket), requestedBy)) {
                return Outcome.failure(Reason.INSUFFICIENT_PRIVILEGE,
                        "Only administrators, the ticket creator or the support team can transfer ticket ownership.");
            }
            if (newOwnerRef.equals(ticket.getRequesterRef())) {
                return Outcome.failure(Reason.INVALID_INPUT, Mentions.user(newOwnerRef) + " is already the ticket owner.");
            }
            if (newOwnerRef.equals(channels.self().getId()) || privileges.isBot(newOwnerRef)) {
                return Outcome.failure(Reason.INVALID_INPUT, "You cannot transfer ticket ownership to a bot.");
            }

            String previousOwner = ticket.getRequesterRef();
            Optional<Ticket> written = ticketStore.compareAndSet(ticket, ticket.toBuilder().requesterRef(newOwnerRef).build());
            if (written.isEmpty()) {
                return Outcome.failure(Reason.ALREADY_CLOSED);
            }
            Ticket transferred = written.get();

            List<String> warnings = new ArrayList<>();
            try {
                channels.setPermission(transferred.getChannelRef(), Principal.user(newOwnerRef), Access.ALLOW);
            } catch (ExternalResourceException e) {
                log.warn("Could not give {} access to ticket #{}", newOwnerRef, transferred.getTicketNumber(), e);
                warnings.add("Could not give the new owner access to the channel.");
            }
            if (revokePrevious) {
                try {
                    channels.revokeAccess(transferred.getChannelRef(), Principal.user(previousOwner));
                } catch (ExternalResourceException e) {
                    log.warn("Could not revoke {}'s access to ticket #{}", previousOwner, transferred.getTicketNumber(), e);
                    warnings.add("Could not remove the previous owner's access.");
                }
            }
            post(transferred.getChannelRef(), TicketNotices.ownerTransferred(previousOwner, newOwnerRef, requestedBy),
                    "ownership notice", warnings);

            log.info("Ticket #{} of tenant {} transferred from {} to {} by {}", transferred.getTicketNumber(),
                    transferred.getTenantId(), previousOwner, newOwnerRef, requestedBy);
            return Outcome.of(transferred, warnings);
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Outcome<Ticket> find(long ticketId) {
        try {
            return ticketStore.find(ticketId)
                    .map(Outcome::success)
                    .orElseGet(() -> Outcome.failure(Reason.TICKET_NOT_FOUND));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Outcome<Ticket> findByChannel(String channelRef) {
        try {
            return ticketStore.findByChannel(channelRef)
                    .map(Outcome::success)
                    .orElseGet(() -> Outcome.failure(Reason.TICKET_NOT_FOUND));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * A summary of the ticket for anyone who can see its channel.
     */
    public Outcome<OutboundMessage> info(long ticketId) {
        try {
            Optional<Ticket> found = ticketStore.find(ticketId);
            if (found.isEmpty()) {
                return Outcome.failure(Reason.TICKET_NOT_FOUND);
            }
            Category category = categoryOf(found.get());
            return Outcome.success(TicketNotices.info(found.get(), category != null ? category.getName() : null));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    public Outcome<TicketStats> stats(String tenantId) {
        try {
            return Outcome.success(ticketStore.stats(tenantId));
        } catch (PersistenceException e) {
            return Outcome.failure(Reason.PERSISTENCE_FAILURE);
        }
    }

    /**
     * Whether the principal may close, reopen or manage users of the ticket: its requester or support staff.
     */
    public boolean canManage(Ticket ticket, Category category, String principalRef) {
        return ticket.getRequesterRef().equals(principalRef) || isStaff(ticket, category, principalRef);
    }

    private boolean isStaff(Ticket ticket, Category category, String principalRef) {
        if (privileges.isElevated(ticket.getTenantId(), principalRef)) {
            return true;
        }
        return category != null && category.hasSupportRole()
                && privileges.hasRole(ticket.getTenantId(), principalRef, category.getSupportRoleRef());
    }

    private boolean channelResolves(Ticket ticket) {
        try {
            return channels.channelExists(ticket.getChannelRef());
        } catch (ExternalResourceException e) {
            if (e.isNotFound()) {
                return false;
            }
            // can't tell, keep treating the ticket as live rather than opening a second one
            log.warn("Could not check channel {} of ticket #{}", ticket.getChannelRef(), ticket.getTicketNumber(), e);
            return true;
        }
    }

    private void closeStale(Ticket ticket) throws PersistenceException {
        Optional<Ticket> closed = ticketStore.compareAndSet(ticket, ticket.toBuilder()
                .status(TicketStatus.CLOSED)
                .closedByRef(SYSTEM_PRINCIPAL)
                .closedAt(now())
                .closeReason(REASON_CHANNEL_MISSING)
                .build());
        if (closed.isPresent()) {
            log.info("Closed ticket #{} of tenant {}, its channel no longer exists", ticket.getTicketNumber(), ticket.getTenantId());
        }
    }

    private void scheduleChannelDeletion(Ticket ticket) {
        scheduler.schedule(() -> {
            try {
                channels.deleteChannel(ticket.getChannelRef());
                log.info("Deleted channel of ticket #{} in tenant {}", ticket.getTicketNumber(), ticket.getTenantId());
            } catch (ExternalResourceException e) {
                log.error("Failed to delete channel {} of ticket #{}", ticket.getChannelRef(), ticket.getTicketNumber(), e);
            }
        }, channelDeleteDelay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void postCloseLog(Ticket ticket, Category category, List<String> warnings) {
        String logChannel;
        try {
            logChannel = configStore.findButtonConfig(ticket.getTenantId()).map(ButtonConfig::getLogChannelRef).orElse(null);
        } catch (PersistenceException e) {
            log.warn("Could not load the log channel of tenant {}", ticket.getTenantId(), e);
            warnings.add("Could not post the close log.");
            return;
        }
        if (logChannel == null) {
            return;
        }
        String categoryName = category != null ? category.getName() : null;

        FileAttachment transcript = null;
        try {
            transcript = Transcripts.render(ticket, categoryName,
                    channels.fetchHistory(ticket.getChannelRef(), Transcripts.HISTORY_LIMIT));
        } catch (ExternalResourceException e) {
            log.warn("Could not read the history of ticket #{} in tenant {}", ticket.getTicketNumber(), ticket.getTenantId(), e);
            warnings.add("Could not create the ticket transcript.");
        }
        try {
            channels.postMessage(logChannel, TicketNotices.closeLog(ticket, categoryName, transcript));
        } catch (ExternalResourceException e) {
            log.warn("Could not post close log of ticket #{} in tenant {}", ticket.getTicketNumber(), ticket.getTenantId(), e);
            warnings.add("Could not post the close log.");
        }
    }

    private String closeText(Ticket ticket, Category category) {
        if (category == null) {
            return "This ticket has been closed.";
        }
        try {
            MessageTemplate template = messageTemplateStore.findOrDefault(category.getId(), category.getName());
            return StringUtils.defaultIfBlank(template.getCloseMessage(), "This ticket has been closed.");
        } catch (PersistenceException e) {
            log.warn("Could not load close message of category {}", category.getId(), e);
            return "This ticket has been closed.";
        }
    }

    private Category categoryOf(Ticket ticket) throws PersistenceException {
        return ticket.getCategoryId() != null ? categoryRegistry.find(ticket.getCategoryId()).orElse(null) : null;
    }

    private void rename(Ticket ticket, TicketStatus status, List<String> warnings) {
        try {
            channels.renameChannel(ticket.getChannelRef(), ticket.channelNameFor(status));
        } catch (ExternalResourceException e) {
            log.warn("Could not rename channel of ticket #{} in tenant {}", ticket.getTicketNumber(), ticket.getTenantId(), e);
            warnings.add("Could not rename the ticket channel.");
        }
    }

    private void post(String channelRef, OutboundMessage message, String what, List<String> warnings) {
        try {
            channels.postMessage(channelRef, message);
        } catch (ExternalResourceException e) {
            log.warn("Could not post {} in channel {}", what, channelRef, e);
            warnings.add("Could not post the " + what + ".");
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }
}
