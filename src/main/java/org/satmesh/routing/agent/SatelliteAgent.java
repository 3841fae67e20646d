package org.satmesh.routing.agent;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.satmesh.core.time.MeshClock;
import org.satmesh.routing.core.MeshRoutingConfig;
import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;
import org.satmesh.routing.cost.LinkCostStrategy;
import org.satmesh.routing.engine.AdvertisementOutcome;
import org.satmesh.routing.engine.DistanceVectorEngine;
import org.satmesh.routing.engine.RoutingMessage;
import org.satmesh.routing.metadata.NodeMetadata;
import org.satmesh.routing.neighbor.NeighborEvent;
import org.satmesh.routing.neighbor.NeighborInfo;
import org.satmesh.routing.neighbor.NeighborLifecycleManager;
import org.satmesh.routing.neighbor.NeighborTable;
import org.satmesh.routing.table.RouteEntry;
import org.satmesh.routing.table.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Routing agent of one node: owns its neighbor table, routing table, metadata and queues, and
 * runs the control loop.
 * <p>
 * One cycle ({@link #runCycle()}) drains neighbor events, then inbound routing messages, then
 * fires due timers:
 * </p>
 * <ol>
 * <li>liveness check (window expiry with route cascade, soft deactivation);</li>
 * <li>stale-route collection;</li>
 * <li>periodic full-table broadcast, or a pending triggered broadcast.</li>
 * </ol>
 * <p>
 * Cycles are confined to one thread at a time: either the agent's own loop ({@link #run()})
 * or a caller stepping it under a virtual clock. Outgoing messages are built from table
 * snapshots and dispatched after every table lock has been released.
 * </p>
 */
public final class SatelliteAgent implements AgentHandle, Runnable {
    private static final Logger log = LoggerFactory.getLogger(SatelliteAgent.class);
    private static final AtomicLong INCARNATIONS = new AtomicLong();

    @Getter
    @Accessors(fluent = true)
    private final String nodeId;
    @Getter
    @Accessors(fluent = true)
    private final MeshRoutingConfig config;
    @Getter
    @Accessors(fluent = true)
    private final NodeMetadata metadata;
    @Getter
    @Accessors(fluent = true)
    private final AgentCounters counters = new AgentCounters();

    private final MeshClock clock;
    private final NeighborTable neighborTable = new NeighborTable();
    private final RoutingTable routingTable = new RoutingTable();
    private final DistanceVectorEngine engine;
    private final NeighborLifecycleManager lifecycle;
    private final MessageDispatcher dispatcher;
    private final Random jitterRandom;

    private final LinkedBlockingQueue<NeighborEvent> neighborEvents = new LinkedBlockingQueue<>();
    private final LinkedBlockingQueue<RoutingMessage> inbound;

    private final ReentrantLock signalLock = new ReentrantLock();
    private final Condition wakeup = signalLock.newCondition();
    private boolean signalled;

    private final AtomicBoolean stopRequested = new AtomicBoolean(false);
    private final AtomicBoolean inCycle = new AtomicBoolean(false);
    private volatile boolean running;

    // Timer state, confined to the cycle thread.
    private boolean timersArmed;
    private long cycleNow;
    private long nextLivenessAt;
    private long nextStaleAt;
    private long nextPeriodicAt;
    private long pendingBroadcastAt = Long.MAX_VALUE;

    /**
     * @param nodeId node id, unique within the mesh.
     * @param config validated mesh configuration.
     * @param clock mesh time source.
     * @param registry delivery directory of the owning mesh.
     * @param costStrategy link-cost strategy.
     * @param metadata node metadata holder.
     */
    public SatelliteAgent(
            String nodeId,
            MeshRoutingConfig config,
            MeshClock clock,
            AgentRegistry registry,
            LinkCostStrategy costStrategy,
            NodeMetadata metadata
    ) {
        this.nodeId = Objects.requireNonNull(nodeId, "nodeId");
        if (nodeId.isBlank()) {
            throw new IllegalArgumentException("nodeId must be non-blank");
        }
        this.config = Objects.requireNonNull(config, "config");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.engine = new DistanceVectorEngine(
                nodeId,
                routingTable,
                neighborTable,
                Objects.requireNonNull(costStrategy, "costStrategy"),
                config.getKHops(),
                config.effectiveMaxRouteAgeMillis(),
                config.getSeenSetRetention(),
                INCARNATIONS.incrementAndGet()
        );
        this.lifecycle = new NeighborLifecycleManager(
                nodeId,
                neighborTable,
                engine,
                config.livenessTimeoutMillis(),
                new BroadcastScheduler()
        );
        this.dispatcher = new MessageDispatcher(Objects.requireNonNull(registry, "registry"), counters);
        this.inbound = new LinkedBlockingQueue<>(config.getInboundQueueCapacity());
        this.jitterRandom = new Random(config.getJitterSeed() ^ nodeId.hashCode());
    }

    @Override
    public boolean deliver(RoutingMessage message) {
        Objects.requireNonNull(message, "message");
        if (stopRequested.get()) {
            return false;
        }
        boolean queued = inbound.offer(message);
        if (queued) {
            signal();
        }
        return queued;
    }

    @Override
    public boolean submit(NeighborEvent event) {
        Objects.requireNonNull(event, "event");
        if (stopRequested.get()) {
            return false;
        }
        neighborEvents.add(event);
        signal();
        return true;
    }

    /**
     * Control loop: runs cycles until {@link #requestStop()} or interruption.
     * A failure inside one cycle is logged and the loop continues.
     */
    @Override
    public void run() {
        running = true;
        log.info("agent {} started", nodeId);
        try {
            while (!stopRequested.get() && !Thread.currentThread().isInterrupted()) {
                long deadline;
                try {
                    deadline = runCycle();
                } catch (RuntimeException ex) {
                    counters.cycleFailed();
                    log.error("agent {} cycle failed", nodeId, ex);
                    deadline = clock.millis() + config.getMaxIdleWaitMillis();
                }
                awaitWork(deadline);
            }
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
        } finally {
            running = false;
            log.info("agent {} stopped", nodeId);
        }
    }

    /**
     * Runs one control cycle at the clock's current time.
     *
     * @return mesh time of the next timer deadline.
     * @throws MeshRoutingException {@link SatelliteMesh#REASON_MESH_STATE} when another thread is
     *         inside a cycle of this agent.
     */
    public long runCycle() {
        if (!inCycle.compareAndSet(false, true)) {
            throw new MeshRoutingException(
                    SatelliteMesh.REASON_MESH_STATE,
                    "agent " + nodeId + " is already running a cycle on another thread"
            );
        }
        try {
            long now = clock.millis();
            cycleNow = now;
            if (!timersArmed) {
                armTimers(now);
            }
            drainNeighborEvents(now);
            drainInbound(now);
            fireTimers(now);
            return nextDeadline();
        } finally {
            inCycle.set(false);
        }
    }

    /**
     * Asks the loop to exit; queued work is abandoned and further deliveries are refused.
     */
    public void requestStop() {
        stopRequested.set(true);
        signal();
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isStopRequested() {
        return stopRequested.get();
    }

    /**
     * @return current route to {@code destination} through a usable neighbor, or {@code null}.
     */
    public RouteEntry route(String destination) {
        return engine.visibleRoute(destination, clock.millis());
    }

    /**
     * @return destination-ordered copy of the routes through usable neighbors.
     */
    public Map<String, RouteEntry> routes() {
        return engine.visibleRoutes(clock.millis());
    }

    /**
     * @return process-unique incarnation stamped on this agent's updates.
     */
    public long incarnation() {
        return engine.incarnation();
    }

    /**
     * @return ids of neighbors usable now.
     */
    public List<String> usableNeighbors() {
        return neighborTable.usableNeighborIds(clock.millis());
    }

    /**
     * Neighbors are copied before routes, and only routes through a neighbor that is usable in
     * that copy are kept, so every route in the snapshot resolves to an active neighbor.
     */
    public AgentSnapshot snapshot() {
        long now = clock.millis();
        List<NeighborInfo> neighbors = List.copyOf(neighborTable.snapshot());
        Set<String> usable = new HashSet<>();
        for (NeighborInfo info : neighbors) {
            if (info.usableAt(now)) {
                usable.add(info.neighborId());
            }
        }
        return AgentSnapshot.builder()
                .nodeId(nodeId)
                .takenAtMillis(now)
                .neighbors(neighbors)
                .routes(routingTable.snapshot(usable::contains))
                .sequence(engine.currentSequence())
                .counters(counters.snapshot())
                .metadata(metadata.snapshot())
                .coordinates(metadata.coordinates())
                .pendingMessages(inbound.size())
                .build();
    }

    private void armTimers(long now) {
        nextLivenessAt = now + config.getLivenessCheckIntervalMillis();
        nextStaleAt = now + config.getStaleCheckIntervalMillis();
        nextPeriodicAt = now + config.getUpdateIntervalMillis();
        timersArmed = true;
    }

    private void drainNeighborEvents(long now) {
        NeighborEvent event;
        while ((event = neighborEvents.poll()) != null) {
            try {
                List<RouteEntry> purged = lifecycle.apply(event, now);
                counters.neighborEventApplied();
                counters.routesRemoved(purged.size());
            } catch (MeshRoutingException ex) {
                log.warn("agent {} rejected neighbor event {}: {}", nodeId, event, ex.getMessage());
            }
        }
    }

    private void drainInbound(long now) {
        RoutingMessage message;
        while ((message = inbound.poll()) != null) {
            AdvertisementOutcome outcome = engine.processAdvertisement(message, now);
            if (outcome.duplicate()) {
                counters.duplicateDropped();
                continue;
            }
            counters.messageProcessed();
            counters.routesAccepted(outcome.accepted());
            counters.routesRemoved(outcome.withdrawn());
            if (outcome.changed()) {
                scheduleTriggeredBroadcast(now + nextJitter());
            }
        }
    }

    private void fireTimers(long now) {
        if (now >= nextLivenessAt) {
            NeighborLifecycleManager.LivenessResult result = lifecycle.checkLiveness(now);
            counters.routesRemoved(result.purgedRoutes().size());
            nextLivenessAt = now + config.getLivenessCheckIntervalMillis();
        }
        if (now >= nextStaleAt) {
            List<RouteEntry> stale = engine.cleanupStaleRoutes(now);
            if (!stale.isEmpty()) {
                counters.routesRemoved(stale.size());
                log.debug("agent {} collected {} stale routes", nodeId, stale.size());
            }
            nextStaleAt = now + config.getStaleCheckIntervalMillis();
        }
        if (now >= nextPeriodicAt) {
            engine.refreshDirectRoutes(now);
            broadcast(now);
            nextPeriodicAt = now + config.getUpdateIntervalMillis();
            pendingBroadcastAt = Long.MAX_VALUE;
        } else if (now >= pendingBroadcastAt) {
            broadcast(now);
            pendingBroadcastAt = Long.MAX_VALUE;
        }
    }

    private void broadcast(long now) {
        List<String> targets = neighborTable.usableNeighborIds(now);
        if (targets.isEmpty()) {
            return;
        }
        RoutingMessage update = engine.prepareUpdate(now);
        counters.updateSent();
        int delivered = dispatcher.broadcast(update, targets);
        log.debug("agent {} sent update #{} with {} routes to {}/{} neighbors",
                nodeId, update.sequence(), update.routes().size(), delivered, targets.size());
    }

    private long nextDeadline() {
        return Math.min(Math.min(nextLivenessAt, nextStaleAt), Math.min(nextPeriodicAt, pendingBroadcastAt));
    }

    private void scheduleTriggeredBroadcast(long at) {
        pendingBroadcastAt = Math.min(pendingBroadcastAt, at);
    }

    private long nextJitter() {
        long min = config.getJitterMinMillis();
        long max = config.getJitterMaxMillis();
        return min == max ? min : jitterRandom.nextLong(min, max + 1);
    }

    private void awaitWork(long deadline) throws InterruptedException {
        long waitMillis = Math.min(deadline - clock.millis(), config.getMaxIdleWaitMillis());
        signalLock.lock();
        try {
            if (!signalled && !stopRequested.get() && waitMillis > 0) {
                wakeup.await(waitMillis, TimeUnit.MILLISECONDS);
            }
            signalled = false;
        } finally {
            signalLock.unlock();
        }
    }

    private void signal() {
        signalLock.lock();
        try {
            signalled = true;
            wakeup.signalAll();
        } finally {
            signalLock.unlock();
        }
    }

    private final class BroadcastScheduler implements NeighborLifecycleManager.BroadcastTrigger {

        @Override
        public void broadcastNow() {
            scheduleTriggeredBroadcast(cycleNow);
        }

        @Override
        public void broadcastSoon() {
            scheduleTriggeredBroadcast(cycleNow + nextJitter());
        }
    }
}
