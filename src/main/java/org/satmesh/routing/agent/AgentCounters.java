package org.satmesh.routing.agent;

import lombok.Builder;
import lombok.Value;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic per-agent counters, safe to read from any thread.
 */
public final class AgentCounters {

    private final AtomicLong messagesProcessed = new AtomicLong();
    private final AtomicLong duplicatesDropped = new AtomicLong();
    private final AtomicLong updatesSent = new AtomicLong();
    private final AtomicLong messagesSent = new AtomicLong();
    private final AtomicLong failedDeliveries = new AtomicLong();
    private final AtomicLong routesAccepted = new AtomicLong();
    private final AtomicLong routesRemoved = new AtomicLong();
    private final AtomicLong neighborEventsApplied = new AtomicLong();
    private final AtomicLong cycleFailures = new AtomicLong();

    /**
     * Immutable counter snapshot.
     */
    @Value
    @Builder
    public static class Snapshot {
        /** Non-duplicate routing messages processed. */
        long messagesProcessed;
        /** Replayed {@code (sender, sequence)} pairs dropped. */
        long duplicatesDropped;
        /** Routing updates originated (one per broadcast round). */
        long updatesSent;
        /** Per-neighbor deliveries that reached a queue. */
        long messagesSent;
        /** Deliveries dropped: unresolved target or full queue. */
        long failedDeliveries;
        /** Routes installed or replaced from advertisements. */
        long routesAccepted;
        /** Routes removed by cascade, withdrawal or staleness. */
        long routesRemoved;
        /** Neighbor events applied. */
        long neighborEventsApplied;
        /** Unexpected failures caught inside the control loop. */
        long cycleFailures;
    }

    void messageProcessed() {
        messagesProcessed.incrementAndGet();
    }

    void duplicateDropped() {
        duplicatesDropped.incrementAndGet();
    }

    void updateSent() {
        updatesSent.incrementAndGet();
    }

    void messageSent() {
        messagesSent.incrementAndGet();
    }

    void deliveryFailed() {
        failedDeliveries.incrementAndGet();
    }

    void routesAccepted(int count) {
        routesAccepted.addAndGet(count);
    }

    void routesRemoved(int count) {
        routesRemoved.addAndGet(count);
    }

    void neighborEventApplied() {
        neighborEventsApplied.incrementAndGet();
    }

    void cycleFailed() {
        cycleFailures.incrementAndGet();
    }

    public long failedDeliveries() {
        return failedDeliveries.get();
    }

    public Snapshot snapshot() {
        return Snapshot.builder()
                .messagesProcessed(messagesProcessed.get())
                .duplicatesDropped(duplicatesDropped.get())
                .updatesSent(updatesSent.get())
                .messagesSent(messagesSent.get())
                .failedDeliveries(failedDeliveries.get())
                .routesAccepted(routesAccepted.get())
                .routesRemoved(routesRemoved.get())
                .neighborEventsApplied(neighborEventsApplied.get())
                .cycleFailures(cycleFailures.get())
                .build();
    }
}
