package org.satmesh.routing.core;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.satmesh.core.time.MeshClock;
import org.satmesh.core.time.VirtualMeshClock;
import org.satmesh.routing.agent.AgentRegistry;
import org.satmesh.routing.agent.AgentSnapshot;
import org.satmesh.routing.agent.SatelliteAgent;
import org.satmesh.routing.cost.LinkCostStrategy;
import org.satmesh.routing.cost.LinkCostStrategyRegistry;
import org.satmesh.routing.metadata.Coordinates;
import org.satmesh.routing.metadata.NodeMetadata;
import org.satmesh.routing.metadata.SatelliteMetadata;
import org.satmesh.routing.neighbor.NeighborEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One simulated satellite mesh: a clock, a delivery registry and the agents bound to them.
 * <p>
 * Two run modes are supported and are mutually exclusive:
 * </p>
 * <ul>
 * <li>threaded: {@link #start()} runs every agent loop on its own thread until {@link #stop()};</li>
 * <li>stepped: {@link #stepAll()} runs one cycle of each agent in insertion order on the
 * caller's thread, typically under a {@link VirtualMeshClock}.</li>
 * </ul>
 * <p>
 * Topology changes ({@link #link}, {@link #unlink}, {@link #updateLink}) are queued as neighbor
 * events on both endpoints and take effect on each endpoint's next cycle. Meshes share no
 * state, so several can run in one process.
 * </p>
 */
public final class SatelliteMesh implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SatelliteMesh.class);

    public static final String REASON_UNKNOWN_METADATA_FIELD = "UNKNOWN_METADATA_FIELD";
    public static final String REASON_INVALID_METADATA_VALUE = "INVALID_METADATA_VALUE";
    public static final String REASON_INVALID_COORDINATES = "INVALID_COORDINATES";
    public static final String REASON_INVALID_CONFIG = "INVALID_CONFIG";
    public static final String REASON_UNKNOWN_COST_STRATEGY = "UNKNOWN_COST_STRATEGY";
    public static final String REASON_DUPLICATE_NODE = "DUPLICATE_NODE";
    public static final String REASON_UNKNOWN_NODE = "UNKNOWN_NODE";
    public static final String REASON_INVALID_NEIGHBOR_EVENT = "INVALID_NEIGHBOR_EVENT";
    public static final String REASON_MESH_STATE = "MESH_STATE";

    private static final long STOP_TIMEOUT_MILLIS = 5_000L;

    @Getter
    @Accessors(fluent = true)
    private final MeshRoutingConfig config;
    @Getter
    @Accessors(fluent = true)
    private final MeshClock clock;
    @Getter
    @Accessors(fluent = true)
    private final AgentRegistry registry = new AgentRegistry();
    private final LinkCostStrategy costStrategy;

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, SatelliteAgent> agents = new LinkedHashMap<>();
    private ExecutorService executor;
    private boolean started;
    private boolean closed;

    public SatelliteMesh(MeshRoutingConfig config, MeshClock clock) {
        this(config, clock, LinkCostStrategyRegistry.defaultRegistry());
    }

    /**
     * @param config mesh configuration; validated here.
     * @param clock mesh time source.
     * @param costStrategies registry resolving {@link MeshRoutingConfig#getLinkCostStrategyId()}.
     */
    public SatelliteMesh(MeshRoutingConfig config, MeshClock clock, LinkCostStrategyRegistry costStrategies) {
        this.config = Objects.requireNonNull(config, "config").validate();
        this.clock = Objects.requireNonNull(clock, "clock");
        this.costStrategy = Objects.requireNonNull(costStrategies, "costStrategies")
                .require(config.getLinkCostStrategyId());
    }

    /**
     * Adds a node with default metadata.
     */
    public SatelliteAgent addNode(String nodeId) {
        return addNode(nodeId, NodeMetadata.withDefaults());
    }

    /**
     * Adds a node; when the mesh is running its loop starts immediately.
     *
     * @throws MeshRoutingException {@link #REASON_DUPLICATE_NODE} when the id is taken,
     *         {@link #REASON_MESH_STATE} after close.
     */
    public SatelliteAgent addNode(String nodeId, NodeMetadata metadata) {
        lock.lock();
        try {
            ensureOpen();
            SatelliteAgent agent = new SatelliteAgent(nodeId, config, clock, registry, costStrategy, metadata);
            registry.register(agent);
            agents.put(nodeId, agent);
            if (started) {
                executor.execute(agent);
            }
            return agent;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes a node: stops its loop and queues a REMOVE for it on every other node.
     *
     * @throws MeshRoutingException {@link #REASON_UNKNOWN_NODE} when the id is not registered.
     */
    public void removeNode(String nodeId) {
        List<SatelliteAgent> others;
        SatelliteAgent removed;
        lock.lock();
        try {
            removed = agents.remove(nodeId);
            if (removed == null) {
                throw unknownNode(nodeId);
            }
            registry.unregister(nodeId);
            others = new ArrayList<>(agents.values());
        } finally {
            lock.unlock();
        }
        removed.requestStop();
        for (SatelliteAgent other : others) {
            other.submit(NeighborEvent.remove(nodeId));
        }
        log.info("removed node {} from mesh", nodeId);
    }

    /**
     * Links two nodes with default quality.
     */
    public void link(String a, String b, long startTime, long endTime) {
        link(a, b, startTime, endTime, NeighborEvent.DEFAULT_QUALITY);
    }

    /**
     * Queues a symmetric ADD on both endpoints.
     */
    public void link(String a, String b, long startTime, long endTime, double quality) {
        requireDistinct(a, b);
        NeighborEvent toA = NeighborEvent.add(b, startTime, endTime, quality);
        NeighborEvent toB = NeighborEvent.add(a, startTime, endTime, quality);
        SatelliteAgent agentA = requireAgent(a);
        SatelliteAgent agentB = requireAgent(b);
        submit(agentA, toA);
        submit(agentB, toB);
    }

    /**
     * Queues a symmetric REMOVE on both endpoints.
     */
    public void unlink(String a, String b) {
        requireDistinct(a, b);
        SatelliteAgent agentA = requireAgent(a);
        SatelliteAgent agentB = requireAgent(b);
        submit(agentA, NeighborEvent.remove(b));
        submit(agentB, NeighborEvent.remove(a));
    }

    /**
     * Queues a symmetric UPDATE on both endpoints; {@code null} fields keep their value.
     */
    public void updateLink(String a, String b, Double quality, Double signalStrength, Double bandwidthAvailable) {
        requireDistinct(a, b);
        SatelliteAgent agentA = requireAgent(a);
        SatelliteAgent agentB = requireAgent(b);
        submit(agentA, NeighborEvent.update(b, quality, signalStrength, bandwidthAvailable));
        submit(agentB, NeighborEvent.update(a, quality, signalStrength, bandwidthAvailable));
    }

    /**
     * Queues one neighbor event on one node.
     */
    public void submit(String nodeId, NeighborEvent event) {
        submit(requireAgent(nodeId), event);
    }

    /**
     * Applies named metadata updates on one node.
     */
    public SatelliteMetadata updateMetadata(String nodeId, Map<String, ?> updates) {
        return requireAgent(nodeId).metadata().update(updates);
    }

    /**
     * Replaces the coordinates of one node.
     */
    public Coordinates updateCoordinates(String nodeId, Map<String, ? extends Number> values) {
        return requireAgent(nodeId).metadata().updateCoordinates(values);
    }

    /**
     * Starts one loop thread per agent.
     *
     * @throws MeshRoutingException {@link #REASON_MESH_STATE} when already started or closed.
     */
    public void start() {
        lock.lock();
        try {
            ensureOpen();
            if (started) {
                throw new MeshRoutingException(REASON_MESH_STATE, "mesh is already started");
            }
            executor = Executors.newCachedThreadPool(new AgentThreadFactory());
            for (SatelliteAgent agent : agents.values()) {
                executor.execute(agent);
            }
            started = true;
            log.info("mesh started with {} agents", agents.size());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Signals every agent to stop and waits for the loop threads. The mesh cannot be restarted.
     */
    public void stop() {
        List<SatelliteAgent> snapshot;
        ExecutorService running;
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            snapshot = new ArrayList<>(agents.values());
            running = executor;
            executor = null;
            started = false;
        } finally {
            lock.unlock();
        }
        for (SatelliteAgent agent : snapshot) {
            agent.requestStop();
        }
        if (running != null) {
            running.shutdown();
            try {
                if (!running.awaitTermination(STOP_TIMEOUT_MILLIS, TimeUnit.MILLISECONDS)) {
                    log.warn("agents did not stop within {} ms, interrupting", STOP_TIMEOUT_MILLIS);
                    running.shutdownNow();
                }
            } catch (InterruptedException ex) {
                running.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("mesh stopped");
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * Runs one cycle of every agent in insertion order on the calling thread.
     *
     * @return earliest next timer deadline across agents; {@link Long#MAX_VALUE} for an empty mesh.
     * @throws MeshRoutingException {@link #REASON_MESH_STATE} while threaded or after close.
     */
    public long stepAll() {
        List<SatelliteAgent> snapshot;
        lock.lock();
        try {
            ensureOpen();
            if (started) {
                throw new MeshRoutingException(REASON_MESH_STATE, "cannot step a started mesh");
            }
            snapshot = new ArrayList<>(agents.values());
        } finally {
            lock.unlock();
        }
        long earliest = Long.MAX_VALUE;
        for (SatelliteAgent agent : snapshot) {
            earliest = Math.min(earliest, agent.runCycle());
        }
        return earliest;
    }

    /**
     * Steps the mesh through {@code durationMillis} of virtual time, one {@link #stepAll()} per
     * {@code stepMillis} tick.
     *
     * @throws MeshRoutingException {@link #REASON_MESH_STATE} when the clock is not a {@link VirtualMeshClock}.
     */
    public void runVirtual(long durationMillis, long stepMillis) {
        if (!(clock instanceof VirtualMeshClock virtualClock)) {
            throw new MeshRoutingException(REASON_MESH_STATE, "runVirtual requires a virtual clock");
        }
        if (durationMillis < 0 || stepMillis <= 0) {
            throw new IllegalArgumentException("durationMillis must be >= 0 and stepMillis > 0");
        }
        long end = virtualClock.millis() + durationMillis;
        stepAll();
        while (virtualClock.millis() < end) {
            virtualClock.advance(Math.min(stepMillis, end - virtualClock.millis()));
            stepAll();
        }
    }

    public MeshSnapshot snapshot() {
        List<SatelliteAgent> snapshot;
        lock.lock();
        try {
            snapshot = new ArrayList<>(agents.values());
        } finally {
            lock.unlock();
        }
        Map<String, AgentSnapshot> views = new LinkedHashMap<>();
        for (SatelliteAgent agent : snapshot) {
            views.put(agent.nodeId(), agent.snapshot());
        }
        return new MeshSnapshot(clock.millis(), views);
    }

    /**
     * @return agent for {@code nodeId}, or {@code null}.
     */
    public SatelliteAgent agent(String nodeId) {
        lock.lock();
        try {
            return agents.get(nodeId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return node ids in insertion order.
     */
    public List<String> nodeIds() {
        lock.lock();
        try {
            return new ArrayList<>(agents.keySet());
        } finally {
            lock.unlock();
        }
    }

    public boolean isStarted() {
        lock.lock();
        try {
            return started;
        } finally {
            lock.unlock();
        }
    }

    private SatelliteAgent requireAgent(String nodeId) {
        SatelliteAgent agent = agent(nodeId);
        if (agent == null) {
            throw unknownNode(nodeId);
        }
        return agent;
    }

    private static void submit(SatelliteAgent agent, NeighborEvent event) {
        if (!agent.submit(event)) {
            throw new MeshRoutingException(REASON_MESH_STATE, "node " + agent.nodeId() + " is stopping");
        }
    }

    private static void requireDistinct(String a, String b) {
        if (Objects.equals(a, b)) {
            throw new MeshRoutingException(REASON_INVALID_NEIGHBOR_EVENT, "cannot link node " + a + " to itself");
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new MeshRoutingException(REASON_MESH_STATE, "mesh is closed");
        }
    }

    private static MeshRoutingException unknownNode(String nodeId) {
        return new MeshRoutingException(REASON_UNKNOWN_NODE, "unknown node: " + nodeId);
    }

    private static final class AgentThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "satmesh-agent-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
