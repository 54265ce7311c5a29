package dev.vankka.supportdesk.ticket;

import dev.vankka.supportdesk.message.OutboundMessage;
import dev.vankka.supportdesk.model.ButtonConfigUpdate;
import dev.vankka.supportdesk.model.CategoryDraft;
import dev.vankka.supportdesk.model.CategoryUpdate;
import dev.vankka.supportdesk.model.Principal;
import dev.vankka.supportdesk.model.Ticket;
import dev.vankka.supportdesk.model.TicketStatus;
import dev.vankka.supportdesk.outcome.ErrorKind;
import dev.vankka.supportdesk.outcome.Outcome;
import dev.vankka.supportdesk.outcome.Reason;
import dev.vankka.supportdesk.storage.PersistenceException;
import dev.vankka.supportdesk.storage.TestStores;
import dev.vankka.supportdesk.storage.TicketStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static dev.vankka.supportdesk.storage.TestStores.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TicketStateMachineTest {

    private static final String REQUESTER = "1001";
    private static final String STAFF = "2002";
    private static final String ADMIN = "3003";
    private static final String STRANGER = "4004";
    private static final String SUPPORT_ROLE = "777";

    private TestStores stores;
    private InMemoryChannelResourceManager channels;
    private NotificationDelivery notifications;
    private PrivilegeResolver privileges;
    private ScheduledExecutorService scheduler;
    private TicketStateMachine tickets;
    private long categoryId;

    @BeforeEach
    void setUp() throws PersistenceException {
        stores = new TestStores();
        categoryId = stores.setUpTenant();
        stores.categoryRegistry.update(categoryId, CategoryUpdate.builder().supportRoleRef(SUPPORT_ROLE).build());

        channels = new InMemoryChannelResourceManager();
        notifications = mock(NotificationDelivery.class);
        privileges = mock(PrivilegeResolver.class);
        when(privileges.isElevated(TENANT, ADMIN)).thenReturn(true);
        when(privileges.hasRole(TENANT, STAFF, SUPPORT_ROLE)).thenReturn(true);
        scheduler = mock(ScheduledExecutorService.class);
        tickets = machine(stores.ticketStore);
    }

    @AfterEach
    void tearDown() throws PersistenceException {
        stores.close();
    }

    private TicketStateMachine machine(TicketStore ticketStore) {
        return new TicketStateMachine(ticketStore, stores.configStore, stores.categoryRegistry, stores.messageTemplateStore,
                channels, notifications, privileges, scheduler, Duration.ofSeconds(3), stores.clock);
    }

    private Ticket open() {
        Outcome<Ticket> outcome = tickets.create(TENANT, REQUESTER, categoryId);
        assertThat(outcome.isSuccess()).as("create: %s", outcome).isTrue();
        return outcome.getValue();
    }

    private Ticket stored(Ticket ticket) throws PersistenceException {
        return stores.ticketStore.find(ticket.getId()).orElseThrow();
    }

    @Nested
    class Create {

        @Test
        @DisplayName("creates a private, numbered channel with a welcome message")
        void createsTicket() {
            Ticket ticket = open();

            assertThat(ticket.getStatus()).isEqualTo(TicketStatus.OPEN);
            assertThat(ticket.getTicketNumber()).isEqualTo(1);
            InMemoryChannelResourceManager.Channel channel = channels.channel(ticket.getChannelRef());
            assertThat(channel.name).isEqualTo("ticket-0001");
            assertThat(channel.parentName).isEqualTo("tickets");
            assertThat(channel.permissions)
                    .containsEntry(Principal.everyone(TENANT), Access.DENY)
                    .containsEntry(Principal.user(REQUESTER), Access.ALLOW)
                    .containsEntry(Principal.role(SUPPORT_ROLE), Access.ALLOW)
                    .containsEntry(Principal.user(InMemoryChannelResourceManager.BOT_ID), Access.ALLOW);

            OutboundMessage welcome = channel.posted().get(0);
            assertThat(welcome.getContent()).isEqualTo("<@" + REQUESTER + "> <@&" + SUPPORT_ROLE + ">");
            assertThat(welcome.getTitle()).contains("Ticket #0001");
            assertThat(welcome.getActions()).extracting("id").containsExactly(TicketActions.CLOSE, TicketActions.CLAIM);
        }

        @Test
        void secondOpenTicketIsRejected() {
            Ticket first = open();

            Outcome<Ticket> second = tickets.create(TENANT, REQUESTER, categoryId);

            assertThat(second.getReason()).isEqualTo(Reason.DUPLICATE_OPEN_TICKET);
            assertThat(second.getKind()).isEqualTo(ErrorKind.CONFLICT);
            assertThat(second.getMessage()).contains(first.getChannelRef());
            assertThat(channels.channels).hasSize(1);
        }

        @Test
        @DisplayName("an open ticket whose channel is gone is closed and replaced")
        void staleTicketIsClosed() throws PersistenceException {
            Ticket stale = open();
            channels.channels.remove(stale.getChannelRef());

            Outcome<Ticket> replacement = tickets.create(TENANT, REQUESTER, categoryId);

            assertThat(replacement.isSuccess()).isTrue();
            assertThat(replacement.getValue().getTicketNumber()).isEqualTo(2);
            Ticket closed = stored(stale);
            assertThat(closed.getStatus()).isEqualTo(TicketStatus.CLOSED);
            assertThat(closed.getClosedByRef()).isEqualTo(TicketStateMachine.SYSTEM_PRINCIPAL);
            assertThat(closed.getCloseReason()).isEqualTo(TicketStateMachine.REASON_CHANNEL_MISSING);
        }

        @Test
        void unknownChannelStateCountsAsDuplicate() {
            open();
            channels.failing.add("exists");

            assertThat(tickets.create(TENANT, REQUESTER, categoryId).getReason()).isEqualTo(Reason.DUPLICATE_OPEN_TICKET);
        }

        @Test
        void disabledTenantIsRejected() {
            stores.configStore.setEnabled(TENANT, false);

            assertThat(tickets.create(TENANT, REQUESTER, categoryId).getReason()).isEqualTo(Reason.TENANT_DISABLED);
            assertThat(channels.channels).isEmpty();
        }

        @Test
        void unknownTenantIsRejected() {
            assertThat(tickets.create("unknown", REQUESTER, categoryId).getReason()).isEqualTo(Reason.TENANT_DISABLED);
        }

        @Test
        void disabledCategoryIsRejected() {
            stores.categoryRegistry.update(categoryId, CategoryUpdate.builder().enabled(false).build());

            assertThat(tickets.create(TENANT, REQUESTER, categoryId).getReason()).isEqualTo(Reason.CATEGORY_UNAVAILABLE);
        }

        @Test
        void otherTenantsCategoryIsRejected() throws PersistenceException {
            stores.tenantSetup.ensure("other");
            long foreign = stores.categoryRegistry.list("other").get(0).getId();

            assertThat(tickets.create(TENANT, REQUESTER, foreign).getReason()).isEqualTo(Reason.CATEGORY_UNAVAILABLE);
        }

        @Test
        void channelFailureStoresNothing() throws PersistenceException {
            channels.failing.add("create");

            Outcome<Ticket> outcome = tickets.create(TENANT, REQUESTER, categoryId);

            assertThat(outcome.getReason()).isEqualTo(Reason.CHANNEL_UNAVAILABLE);
            assertThat(stores.ticketStore.listByTenant(TENANT)).isEmpty();
        }

        @Test
        @DisplayName("a failed insert deletes the channel that was created for it")
        void databaseFailureRemovesChannel() throws PersistenceException {
            TicketStore failingStore = spy(stores.ticketStore);
            doThrow(new PersistenceException("down", null))
                    .when(failingStore).create(anyString(), anyLong(), anyString(), anyString());

            Outcome<Ticket> outcome = machine(failingStore).create(TENANT, REQUESTER, categoryId);

            assertThat(outcome.getReason()).isEqualTo(Reason.PERSISTENCE_FAILURE);
            assertThat(channels.channels).isEmpty();
        }

        @Test
        void failedWelcomeIsPartialSuccess() throws PersistenceException {
            channels.failing.add("post");

            Outcome<Ticket> outcome = tickets.create(TENANT, REQUESTER, categoryId);

            assertThat(outcome.isPartial()).isTrue();
            assertThat(outcome.isCompleted()).isTrue();
            assertThat(outcome.getWarnings()).containsExactly("Could not post the welcome message.");
            assertThat(stored(outcome.getValue()).isOpen()).isTrue();
        }

        @Test
        void concurrentRequestsOpenOneTicket() throws Exception {
            ExecutorService executor = Executors.newFixedThreadPool(4);
            try {
                Callable<Outcome<Ticket>> task = () -> tickets.create(TENANT, REQUESTER, categoryId);
                List<Outcome<Ticket>> outcomes = new ArrayList<>();
                for (Future<Outcome<Ticket>> future : executor.invokeAll(Collections.nCopies(4, task))) {
                    outcomes.add(future.get());
                }

                assertThat(outcomes).filteredOn(Outcome::isSuccess).hasSize(1);
                assertThat(outcomes).filteredOn(Outcome::isFailure)
                        .extracting(Outcome::getReason)
                        .containsOnly(Reason.DUPLICATE_OPEN_TICKET);
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    class Close {

        @Test
        void requesterClosesTicket() throws PersistenceException {
            Ticket ticket = open();

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), REQUESTER, " solved ");

            assertThat(outcome.isSuccess()).isTrue();
            Ticket closed = stored(ticket);
            assertThat(closed.getStatus()).isEqualTo(TicketStatus.CLOSED);
            assertThat(closed.getClosedByRef()).isEqualTo(REQUESTER);
            assertThat(closed.getCloseReason()).isEqualTo("solved");
            assertThat(closed.getClosedAt()).isNotNull();

            InMemoryChannelResourceManager.Channel channel = channels.channel(ticket.getChannelRef());
            assertThat(channel.name).isEqualTo("closed-ticket-0001");
            assertThat(channel.permissions).containsEntry(Principal.everyone(TENANT), Access.DENY);
            OutboundMessage notice = channel.posted().get(channel.posted().size() - 1);
            assertThat(notice.getDescription()).contains("solved");
            assertThat(notice.getActions()).extracting("id")
                    .containsExactly(TicketActions.REOPEN, TicketActions.ARCHIVE, TicketActions.DELETE);
        }

        @Test
        void closingTwiceIsRejected() {
            Ticket ticket = open();
            tickets.close(ticket.getId(), REQUESTER, null);

            assertThat(tickets.close(ticket.getId(), STAFF, null).getReason()).isEqualTo(Reason.ALREADY_CLOSED);
        }

        @Test
        @DisplayName("closing an archived ticket is rejected and changes nothing")
        void closingArchivedTicketLeavesItUnchanged() throws PersistenceException {
            Ticket ticket = open();
            tickets.archive(ticket.getId(), STAFF);
            Ticket before = stored(ticket);
            String channelName = channels.channel(ticket.getChannelRef()).name;
            int posted = channels.channel(ticket.getChannelRef()).posted().size();

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), ADMIN, "again");

            assertThat(outcome.getReason()).isEqualTo(Reason.ALREADY_CLOSED);
            assertThat(stored(ticket)).isEqualTo(before);
            assertThat(channels.channel(ticket.getChannelRef()).name).isEqualTo(channelName);
            assertThat(channels.channel(ticket.getChannelRef()).posted()).hasSize(posted);
        }

        @Test
        void closingClosedTicketLeavesItUnchanged() throws PersistenceException {
            Ticket ticket = open();
            tickets.close(ticket.getId(), REQUESTER, "first");
            Ticket before = stored(ticket);

            assertThat(tickets.close(ticket.getId(), STAFF, "second").getReason()).isEqualTo(Reason.ALREADY_CLOSED);
            assertThat(stored(ticket)).isEqualTo(before);
        }

        @Test
        void strangerCannotClose() throws PersistenceException {
            Ticket ticket = open();

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), STRANGER, null);

            assertThat(outcome.getReason()).isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
            assertThat(stored(ticket).isOpen()).isTrue();
        }

        @Test
        void unknownTicketIsNotFound() {
            assertThat(tickets.close(999, ADMIN, null).getReason()).isEqualTo(Reason.TICKET_NOT_FOUND);
        }

        @Test
        void closeIsLoggedToTheLogChannel() throws ExternalResourceException {
            String logChannel = channels.createChannel(TENANT, null, "ticket-logs", Collections.emptyList());
            stores.configStore.updateButtonConfig(TENANT, ButtonConfigUpdate.builder().logChannelRef(logChannel).build());
            Ticket ticket = open();

            tickets.close(ticket.getId(), STAFF, "done");

            assertThat(channels.channel(logChannel).posted())
                    .singleElement()
                    .satisfies(message -> assertThat(message.getTitle()).isEqualTo("Ticket #0001 was closed"));
        }

        @Test
        @DisplayName("the close log carries a transcript of the ticket channel")
        void closeLogCarriesTranscript() throws ExternalResourceException {
            String logChannel = channels.createChannel(TENANT, null, "ticket-logs", Collections.emptyList());
            stores.configStore.updateButtonConfig(TENANT, ButtonConfigUpdate.builder().logChannelRef(logChannel).build());
            Ticket ticket = open();
            channels.say(ticket.getChannelRef(), REQUESTER, "alice", "My invoice is wrong", "https://cdn.example/invoice.png");
            channels.say(ticket.getChannelRef(), STAFF, "bob", "Fixed it");

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), STAFF, "refunded");

            assertThat(outcome.isSuccess()).isTrue();
            OutboundMessage logged = channels.channel(logChannel).posted().get(0);
            assertThat(logged.getFiles()).singleElement().satisfies(file -> {
                assertThat(file.getFileName()).isEqualTo("ticket-0001.txt");
                assertThat(file.getContent())
                        .contains("Ticket #0001")
                        .contains("Reason: refunded")
                        .contains("alice (" + REQUESTER + ")\nbob (" + STAFF + ")")
                        .contains("alice (" + REQUESTER + "): My invoice is wrong https://cdn.example/invoice.png")
                        .contains("bob (" + STAFF + "): Fixed it");
                assertThat(file.getContent().indexOf("My invoice is wrong")).isLessThan(file.getContent().indexOf("Fixed it"));
            });
        }

        @Test
        @DisplayName("an unreadable channel history only costs the transcript")
        void transcriptFailureIsPartial() throws ExternalResourceException, PersistenceException {
            String logChannel = channels.createChannel(TENANT, null, "ticket-logs", Collections.emptyList());
            stores.configStore.updateButtonConfig(TENANT, ButtonConfigUpdate.builder().logChannelRef(logChannel).build());
            Ticket ticket = open();
            channels.failing.add("history");

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), STAFF, null);

            assertThat(outcome.isPartial()).isTrue();
            assertThat(outcome.getWarnings()).containsExactly("Could not create the ticket transcript.");
            assertThat(stored(ticket).getStatus()).isEqualTo(TicketStatus.CLOSED);
            assertThat(channels.channel(logChannel).posted()).singleElement()
                    .satisfies(message -> assertThat(message.getFiles()).isEmpty());
        }

        @Test
        void withoutLogChannelNoTranscriptIsRead() {
            Ticket ticket = open();
            channels.failing.add("history");

            assertThat(tickets.close(ticket.getId(), STAFF, null).isSuccess()).isTrue();
        }

        @Test
        @DisplayName("channel failures after the status change only downgrade the outcome")
        void channelFailureIsPartial() throws PersistenceException {
            Ticket ticket = open();
            channels.failing.add("permission");
            channels.failing.add("rename");

            Outcome<Ticket> outcome = tickets.close(ticket.getId(), ADMIN, null);

            assertThat(outcome.isPartial()).isTrue();
            assertThat(outcome.getWarnings()).hasSize(2);
            assertThat(stored(ticket).getStatus()).isEqualTo(TicketStatus.CLOSED);
        }
    }

    @Nested
    class Reopen {

        @Test
        void reopeningRestoresAccess() throws PersistenceException {
            Ticket ticket = open();
            tickets.close(ticket.getId(), REQUESTER, "done");

            Outcome<Ticket> outcome = tickets.reopen(ticket.getId(), STAFF);

            assertThat(outcome.isSuccess()).isTrue();
            Ticket reopened = stored(ticket);
            assertThat(reopened.getStatus()).isEqualTo(TicketStatus.OPEN);
            assertThat(reopened.getClosedByRef()).isNull();
            assertThat(reopened.getClosedAt()).isNull();
            assertThat(reopened.getCloseReason()).isNull();

            InMemoryChannelResourceManager.Channel channel = channels.channel(ticket.getChannelRef());
            assertThat(channel.name).isEqualTo("ticket-0001");
            assertThat(channel.permissions)
                    .containsEntry(Principal.everyone(TENANT), Access.INHERIT)
                    .containsEntry(Principal.user(REQUESTER), Access.ALLOW)
                    .containsEntry(Principal.role(SUPPORT_ROLE), Access.ALLOW);
        }

        @Test
        void openTicketCannotBeReopened() {
            Ticket ticket = open();

            assertThat(tickets.reopen(ticket.getId(), REQUESTER).getReason()).isEqualTo(Reason.ALREADY_OPEN);
        }

        @Test
        @DisplayName("closing and reopening alternates the status with increasing timestamps")
        void closeReopenCycle() throws PersistenceException {
            Ticket ticket = open();
            List<TicketStatus> statuses = new ArrayList<>();
            List<Instant> updates = new ArrayList<>();
            statuses.add(stored(ticket).getStatus());
            updates.add(stored(ticket).getUpdatedAt());

            assertThat(tickets.close(ticket.getId(), REQUESTER, "done").isSuccess()).isTrue();
            statuses.add(stored(ticket).getStatus());
            updates.add(stored(ticket).getUpdatedAt());
            assertThat(tickets.reopen(ticket.getId(), REQUESTER).isSuccess()).isTrue();
            statuses.add(stored(ticket).getStatus());
            updates.add(stored(ticket).getUpdatedAt());
            assertThat(tickets.close(ticket.getId(), STAFF, "really done").isSuccess()).isTrue();
            statuses.add(stored(ticket).getStatus());
            updates.add(stored(ticket).getUpdatedAt());

            assertThat(statuses).containsExactly(TicketStatus.OPEN, TicketStatus.CLOSED, TicketStatus.OPEN, TicketStatus.CLOSED);
            assertThat(updates).doesNotHaveDuplicates().isSorted();
            assertThat(stored(ticket).getClosedByRef()).isEqualTo(STAFF);
            assertThat(stored(ticket).getCloseReason()).isEqualTo("really done");
        }

        @Test
        void archivedTicketCanBeReopened() throws PersistenceException {
            Ticket ticket = open();
            tickets.archive(ticket.getId(), STAFF);

            assertThat(tickets.reopen(ticket.getId(), REQUESTER).isCompleted()).isTrue();
            assertThat(stored(ticket).isOpen()).isTrue();
        }
    }

    @Nested
    class Archive {

        @Test
        void staffArchivesClosedTicket() throws PersistenceException {
            Ticket ticket = open();
            tickets.close(ticket.getId(), REQUESTER, "thanks");

            Outcome<Ticket> outcome = tickets.archive(ticket.getId(), STAFF);

            assertThat(outcome.isSuccess()).isTrue();
            Ticket archived = stored(ticket);
            assertThat(archived.getStatus()).isEqualTo(TicketStatus.ARCHIVED);
            assertThat(archived.getCloseReason()).isEqualTo("thanks");
            assertThat(channels.channel(ticket.getChannelRef()).name).isEqualTo("archived-ticket-0001");
        }

        @Test
        void archivingOpenTicketSetsDefaultReason() throws PersistenceException {
            Ticket ticket = open();

            tickets.archive(ticket.getId(), ADMIN);

            Ticket archived = stored(ticket);
            assertThat(archived.getCloseReason()).isEqualTo(TicketStateMachine.REASON_ARCHIVED);
            assertThat(archived.getClosedAt()).isNotNull();
        }

        @Test
        void requesterCannotArchive() {
            Ticket ticket = open();

            assertThat(tickets.archive(ticket.getId(), REQUESTER).getReason()).isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
        }

        @Test
        void archivingTwiceIsRejected() {
            Ticket ticket = open();
            tickets.archive(ticket.getId(), STAFF);

            assertThat(tickets.archive(ticket.getId(), STAFF).getReason()).isEqualTo(Reason.ALREADY_ARCHIVED);
        }
    }

    @Nested
    class Delete {

        @Test
        @DisplayName("keeps the ticket record and removes the channel after the delay")
        void deleteKeepsRecord() throws PersistenceException {
            Ticket ticket = open();

            Outcome<Ticket> outcome = tickets.delete(ticket.getId(), ADMIN);

            assertThat(outcome.isSuccess()).isTrue();
            Ticket deleted = stored(ticket);
            assertThat(deleted.getStatus()).isEqualTo(TicketStatus.CLOSED);
            assertThat(deleted.getCloseReason()).isEqualTo(TicketStateMachine.REASON_DELETED);
            assertThat(deleted.getClosedByRef()).isEqualTo(ADMIN);
            verify(notifications).notify(eq(REQUESTER), any(OutboundMessage.class));

            ArgumentCaptor<Runnable> deletion = ArgumentCaptor.forClass(Runnable.class);
            verify(scheduler).schedule(deletion.capture(), eq(3000L), eq(TimeUnit.MILLISECONDS));
            assertThat(channels.channels).containsKey(ticket.getChannelRef());
            deletion.getValue().run();
            assertThat(channels.channels).doesNotContainKey(ticket.getChannelRef());
        }

        @Test
        void onlyElevatedStaffCanDelete() throws PersistenceException {
            Ticket ticket = open();

            assertThat(tickets.delete(ticket.getId(), STAFF).getReason()).isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
            assertThat(stored(ticket).isOpen()).isTrue();
            verify(scheduler, never()).schedule(any(Runnable.class), anyLong(), any(TimeUnit.class));
        }

        @Test
        void failedNotificationDoesNotFailDelete() {
            Ticket ticket = open();
            doThrow(new IllegalStateException("dm closed")).when(notifications).notify(anyString(), any(OutboundMessage.class));

            assertThat(tickets.delete(ticket.getId(), ADMIN).isSuccess()).isTrue();
        }

        @Test
        void closedTicketCanBeDeleted() throws PersistenceException {
            Ticket ticket = open();
            tickets.archive(ticket.getId(), ADMIN);

            assertThat(tickets.delete(ticket.getId(), ADMIN).isSuccess()).isTrue();
            assertThat(stored(ticket).getStatus()).isEqualTo(TicketStatus.CLOSED);
        }
    }

    @Nested
    class Claim {

        @Test
        void claimingTwiceReleases() throws PersistenceException {
            Ticket ticket = open();

            assertThat(tickets.claim(ticket.getId(), STAFF).isSuccess()).isTrue();
            assertThat(stored(ticket).getClaimedByRef()).isEqualTo(STAFF);

            assertThat(tickets.claim(ticket.getId(), STAFF).isSuccess()).isTrue();
            assertThat(stored(ticket).getClaimedByRef()).isNull();
        }

        @Test
        void claimedTicketCannotBeTakenOver() {
            Ticket ticket = open();
            tickets.claim(ticket.getId(), STAFF);

            assertThat(tickets.claim(ticket.getId(), ADMIN).getReason()).isEqualTo(Reason.ALREADY_CLAIMED);
        }

        @Test
        void requesterCannotClaim() {
            Ticket ticket = open();

            assertThat(tickets.claim(ticket.getId(), REQUESTER).getReason()).isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
        }
    }

    @Nested
    class Participants {

        @Test
        void addAndRemoveUser() {
            Ticket ticket = open();
            InMemoryChannelResourceManager.Channel channel = channels.channel(ticket.getChannelRef());

            assertThat(tickets.addParticipant(ticket.getId(), STRANGER, REQUESTER).isSuccess()).isTrue();
            assertThat(channel.permissions).containsEntry(Principal.user(STRANGER), Access.ALLOW);

            assertThat(tickets.removeParticipant(ticket.getId(), STRANGER, STAFF).isSuccess()).isTrue();
            assertThat(channel.permissions).doesNotContainKey(Principal.user(STRANGER));
        }

        @Test
        void requesterAndBotCannotBeChanged() {
            Ticket ticket = open();

            assertThat(tickets.removeParticipant(ticket.getId(), REQUESTER, ADMIN).getReason()).isEqualTo(Reason.INVALID_INPUT);
            assertThat(tickets.removeParticipant(ticket.getId(), InMemoryChannelResourceManager.BOT_ID, ADMIN).getReason())
                    .isEqualTo(Reason.INVALID_INPUT);
        }

        @Test
        void strangerCannotAddUsers() {
            Ticket ticket = open();

            assertThat(tickets.addParticipant(ticket.getId(), "5005", STRANGER).getReason()).isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
        }

        @Test
        void channelFailureFailsTheChange() {
            Ticket ticket = open();
            channels.failing.add("permission");

            assertThat(tickets.addParticipant(ticket.getId(), STRANGER, ADMIN).getReason()).isEqualTo(Reason.CHANNEL_UNAVAILABLE);
        }
    }

    @Nested
    class TransferOwner {

        private static final String NEW_OWNER = "5005";

        @Test
        void staffTransfersOwnership() throws PersistenceException {
            Ticket ticket = open();

            Outcome<Ticket> outcome = tickets.transferOwner(ticket.getId(), NEW_OWNER, STAFF, false);

            assertThat(outcome.isSuccess()).isTrue();
            assertThat(stored(ticket).getRequesterRef()).isEqualTo(NEW_OWNER);
            InMemoryChannelResourceManager.Channel channel = channels.channel(ticket.getChannelRef());
            assertThat(channel.permissions)
                    .containsEntry(Principal.user(NEW_OWNER), Access.ALLOW)
                    .containsEntry(Principal.user(REQUESTER), Access.ALLOW);
            assertThat(channel.posted().get(channel.posted().size() - 1).getDescription())
                    .contains("<@" + REQUESTER + ">", "<@" + NEW_OWNER + ">");
        }

        @Test
        void previousOwnerAccessCanBeRemoved() {
            Ticket ticket = open();

            assertThat(tickets.transferOwner(ticket.getId(), NEW_OWNER, REQUESTER, true).isSuccess()).isTrue();
            assertThat(channels.channel(ticket.getChannelRef()).permissions).doesNotContainKey(Principal.user(REQUESTER));
        }

        @Test
        @DisplayName("the new owner's duplicate check follows the ticket")
        void newOwnerNowHasTheOpenTicket() {
            Ticket ticket = open();
            tickets.transferOwner(ticket.getId(), NEW_OWNER, ADMIN, false);

            assertThat(tickets.create(TENANT, NEW_OWNER, categoryId).getReason()).isEqualTo(Reason.DUPLICATE_OPEN_TICKET);
            assertThat(tickets.create(TENANT, REQUESTER, categoryId).isSuccess()).isTrue();
        }

        @Test
        void currentOwnerIsRejected() throws PersistenceException {
            Ticket ticket = open();

            Outcome<Ticket> outcome = tickets.transferOwner(ticket.getId(), REQUESTER, ADMIN, false);

            assertThat(outcome.getReason()).isEqualTo(Reason.INVALID_INPUT);
            assertThat(outcome.getMessage()).contains("already the ticket owner");
            assertThat(stored(ticket).getRequesterRef()).isEqualTo(REQUESTER);
        }

        @Test
        void botsCannotOwnTickets() throws PersistenceException {
            Ticket ticket = open();
            when(privileges.isBot(NEW_OWNER)).thenReturn(true);

            assertThat(tickets.transferOwner(ticket.getId(), NEW_OWNER, ADMIN, false).getReason()).isEqualTo(Reason.INVALID_INPUT);
            assertThat(tickets.transferOwner(ticket.getId(), InMemoryChannelResourceManager.BOT_ID, ADMIN, false).getReason())
                    .isEqualTo(Reason.INVALID_INPUT);
            assertThat(stored(ticket).getRequesterRef()).isEqualTo(REQUESTER);
        }

        @Test
        void strangerCannotTransfer() {
            Ticket ticket = open();

            assertThat(tickets.transferOwner(ticket.getId(), NEW_OWNER, STRANGER, false).getReason())
                    .isEqualTo(Reason.INSUFFICIENT_PRIVILEGE);
        }

        @Test
        void closedTicketCannotBeTransferred() {
            Ticket ticket = open();
            tickets.close(ticket.getId(), REQUESTER, null);

            assertThat(tickets.transferOwner(ticket.getId(), NEW_OWNER, ADMIN, false).getReason()).isEqualTo(Reason.ALREADY_CLOSED);
        }
    }

    @Test
    void infoSummarizesTicket() {
        Ticket ticket = open();
        tickets.claim(ticket.getId(), STAFF);
        tickets.close(ticket.getId(), STAFF, "resolved");

        OutboundMessage info = tickets.info(ticket.getId()).getValue();

        assertThat(info.getTitle()).contains("Ticket #0001");
        assertThat(info.getDescription())
                .contains("**Status:** Closed")
                .contains("**Category:** General Support")
                .contains("**Claimed by:** <@" + STAFF + ">")
                .contains("**Reason:** resolved");
        assertThat(tickets.info(999).getReason()).isEqualTo(Reason.TICKET_NOT_FOUND);
    }

    @Test
    @DisplayName("create, duplicate, close, reopen and delete in one lifecycle")
    void fullLifecycle() throws PersistenceException {
        Ticket ticket = open();
        assertThat(stored(ticket).getStatus()).isEqualTo(TicketStatus.OPEN);
        assertThat(ticket.getTicketNumber()).isEqualTo(1);

        Outcome<Ticket> duplicate = tickets.create(TENANT, REQUESTER, categoryId);
        assertThat(duplicate.getReason()).isEqualTo(Reason.DUPLICATE_OPEN_TICKET);
        assertThat(stores.ticketStore.listByTenant(TENANT)).hasSize(1);

        assertThat(tickets.close(ticket.getId(), REQUESTER, "fixed").isSuccess()).isTrue();
        Ticket closed = stored(ticket);
        assertThat(closed.getStatus()).isEqualTo(TicketStatus.CLOSED);
        assertThat(closed.getCloseReason()).isEqualTo("fixed");

        assertThat(tickets.reopen(ticket.getId(), STAFF).isSuccess()).isTrue();
        Ticket reopened = stored(ticket);
        assertThat(reopened.getStatus()).isEqualTo(TicketStatus.OPEN);
        assertThat(reopened.getCloseReason()).isNull();
        assertThat(reopened.getUpdatedAt()).isAfter(closed.getUpdatedAt());

        assertThat(tickets.delete(ticket.getId(), ADMIN).isSuccess()).isTrue();
        Ticket deleted = stored(ticket);
        assertThat(deleted.getStatus()).isEqualTo(TicketStatus.CLOSED);
        assertThat(deleted.getCloseReason()).isEqualTo(TicketStateMachine.REASON_DELETED);
        assertThat(deleted.getUpdatedAt()).isAfter(reopened.getUpdatedAt());

        ArgumentCaptor<Runnable> deletion = ArgumentCaptor.forClass(Runnable.class);
        verify(scheduler).schedule(deletion.capture(), eq(3000L), eq(TimeUnit.MILLISECONDS));
        deletion.getValue().run();
        assertThat(channels.channels).doesNotContainKey(ticket.getChannelRef());
        assertThat(stores.ticketStore.find(ticket.getId())).isPresent();
    }

    @Test
    void statsAndLookups() {
        Ticket ticket = open();
        stores.categoryRegistry.create(TENANT, CategoryDraft.builder().name("Billing").build());

        assertThat(tickets.findByChannel(ticket.getChannelRef()).getValue().getId()).isEqualTo(ticket.getId());
        assertThat(tickets.findByChannel("nope").getReason()).isEqualTo(Reason.TICKET_NOT_FOUND);
        assertThat(tickets.find(ticket.getId()).isSuccess()).isTrue();
        assertThat(tickets.stats(TENANT).getValue().getOpen()).isEqualTo(1);
    }
}
