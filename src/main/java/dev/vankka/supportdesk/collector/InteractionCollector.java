package dev.vankka.supportdesk.collector;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Waits for the next qualifying interaction on a surface.
 * <p>
 * A surface (usually a message) has at most one outstanding wait. Only interactions by the principal the wait was
 * registered for, matching its predicate, complete it. The collector only routes interactions, acknowledging them
 * is left to whoever receives them.
 * <p>
 * Waits never hold a thread. {@link #waitFor} runs its callbacks on the thread that completes the wait, either the
 * one submitting the interaction or the scheduler when the deadline passes.
 */
@Slf4j
public class InteractionCollector {

    private final ScheduledExecutorService scheduler;
    private final Map<String, Waiting> waiting = new ConcurrentHashMap<>();

    public InteractionCollector(ScheduledExecutorService scheduler) {
        this.scheduler = scheduler;
    }

    /**
     * Registers a wait on {@code surfaceId}.
     *
     * @return a future completing with the interaction, or empty when the deadline passed or the wait was stopped
     * @throws IllegalStateException if something is already waiting on the surface
     */
    public CompletableFuture<Optional<Interaction>> awaitNext(String surfaceId, String principalId,
                                                               Predicate<Interaction> predicate, Duration timeout) {
        Waiting entry = new Waiting(principalId, predicate);
        if (waiting.putIfAbsent(surfaceId, entry) != null) {
            throw new IllegalStateException("Already waiting for an interaction on " + surfaceId);
        }
        entry.timeout = scheduler.schedule(() -> {
            if (waiting.remove(surfaceId, entry)) {
                log.debug("Wait on {} for {} timed out", surfaceId, principalId);
                entry.future.complete(Optional.empty());
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
        return entry.future;
    }

    /**
     * Registers a wait on {@code surfaceId} and runs {@code action} with the interaction that completes it, or
     * {@code timeoutAction} when the deadline passes or the wait is stopped. Callbacks should hand slow work off.
     *
     * @throws IllegalStateException if something is already waiting on the surface
     */
    public void waitFor(String surfaceId, String principalId, Predicate<Interaction> predicate,
                        Consumer<Interaction> action, Duration timeout, Runnable timeoutAction) {
        awaitNext(surfaceId, principalId, predicate, timeout)
                .thenAccept(result -> {
                    if (result.isPresent()) {
                        action.accept(result.get());
                    } else {
                        timeoutAction.run();
                    }
                })
                .exceptionally(t -> {
                    log.error("Handling the interaction on {} for {} failed", surfaceId, principalId, t);
                    return null;
                });
    }

    /**
     * Offers an interaction to the wait on its surface.
     *
     * @return {@code true} if a wait consumed it
     */
    public boolean submit(Interaction interaction) {
        String surfaceId = interaction.getSurfaceId();
        Waiting entry = waiting.get(surfaceId);
        if (entry == null || !entry.principalId.equals(interaction.getPrincipalId())) {
            return false;
        }
        if (!entry.predicate.test(interaction) || !waiting.remove(surfaceId, entry)) {
            return false;
        }
        entry.cancelTimeout();
        entry.future.complete(Optional.of(interaction));
        return true;
    }

    /**
     * Cancels the wait on the surface, its future completes empty.
     */
    public void stop(String surfaceId) {
        Waiting entry = waiting.remove(surfaceId);
        if (entry != null) {
            entry.cancelTimeout();
            entry.future.complete(Optional.empty());
        }
    }

    public boolean isWaiting(String surfaceId) {
        return waiting.containsKey(surfaceId);
    }

    /**
     * Whether the surface is being waited on for {@code principalId}.
     */
    public boolean isWaitingFor(String surfaceId, String principalId) {
        Waiting entry = waiting.get(surfaceId);
        return entry != null && entry.principalId.equals(principalId);
    }

    public void shutdown() {
        waiting.keySet().forEach(this::stop);
    }

    private static class Waiting {

        private final String principalId;
        private final Predicate<Interaction> predicate;
        private final CompletableFuture<Optional<Interaction>> future = new CompletableFuture<>();
        private volatile ScheduledFuture<?> timeout;

        private Waiting(String principalId, Predicate<Interaction> predicate) {
            this.principalId = principalId;
            this.predicate = predicate;
        }

        private void cancelTimeout() {
            ScheduledFuture<?> scheduled = timeout;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }
    }
}
