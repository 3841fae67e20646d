package org.satmesh.routing.neighbor;

import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;
import org.satmesh.routing.engine.DistanceVectorEngine;
import org.satmesh.routing.table.RouteEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Applies neighbor events to one agent's {@link NeighborTable} and keeps the routing table
 * consistent with it.
 * <ul>
 * <li>ADD seeds the direct route and asks for an immediate broadcast.</li>
 * <li>REMOVE and window expiry cascade-delete every route through the neighbor. Destinations
 * still reachable another way stay unrouted until some other neighbor advertises them again.</li>
 * <li>Liveness timeouts only mark the neighbor inactive. Its routes stay suspended until it
 * revives or they age out.</li>
 * </ul>
 */
public final class NeighborLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(NeighborLifecycleManager.class);

    /**
     * Callback into the owning agent's broadcast timers.
     */
    public interface BroadcastTrigger {

        /** Broadcast in the current cycle. */
        void broadcastNow();

        /** Broadcast after the configured jitter. */
        void broadcastSoon();
    }

    /**
     * Result of one liveness pass including the cascaded route deletions.
     *
     * @param report affected neighbors.
     * @param purgedRoutes routes deleted because their next hop expired.
     */
    public record LivenessResult(NeighborTable.LivenessReport report, List<RouteEntry> purgedRoutes) {
        public LivenessResult {
            purgedRoutes = List.copyOf(purgedRoutes);
        }
    }

    private final String selfId;
    private final NeighborTable neighborTable;
    private final DistanceVectorEngine engine;
    private final long livenessTimeoutMillis;
    private final BroadcastTrigger trigger;

    public NeighborLifecycleManager(
            String selfId,
            NeighborTable neighborTable,
            DistanceVectorEngine engine,
            long livenessTimeoutMillis,
            BroadcastTrigger trigger
    ) {
        if (livenessTimeoutMillis <= 0) {
            throw new IllegalArgumentException("livenessTimeoutMillis must be > 0");
        }
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.neighborTable = Objects.requireNonNull(neighborTable, "neighborTable");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.livenessTimeoutMillis = livenessTimeoutMillis;
        this.trigger = Objects.requireNonNull(trigger, "trigger");
    }

    /**
     * Dispatches one queued neighbor event.
     *
     * @return routes deleted by a REMOVE cascade; empty for ADD and UPDATE.
     */
    public List<RouteEntry> apply(NeighborEvent event, long now) {
        Objects.requireNonNull(event, "event");
        return switch (event.type()) {
            case ADD -> {
                addNeighbor(event.neighborId(), event.startTime(), event.endTime(), event.quality(), now);
                yield List.of();
            }
            case UPDATE -> {
                updateNeighbor(
                        event.neighborId(),
                        event.quality(),
                        event.signalStrength(),
                        event.bandwidthAvailable(),
                        now
                );
                yield List.of();
            }
            case REMOVE -> removeNeighbor(event.neighborId());
        };
    }

    /**
     * Creates or overwrites a neighbor, seeds its direct route and requests a broadcast.
     *
     * @return stored neighbor entry.
     */
    public NeighborInfo addNeighbor(String neighborId, long startTime, long endTime, double quality, long now) {
        if (selfId.equals(neighborId)) {
            throw new MeshRoutingException(
                    SatelliteMesh.REASON_INVALID_NEIGHBOR_EVENT,
                    "node " + selfId + " cannot be its own neighbor"
            );
        }
        NeighborInfo info = neighborTable.add(neighborId, startTime, endTime, quality, now);
        engine.installDirectRoute(neighborId, now);
        log.debug("{} added neighbor {} window=[{}, {}] quality={}", selfId, neighborId, startTime, endTime, quality);
        trigger.broadcastNow();
        return info;
    }

    /**
     * Deletes a neighbor and every route forwarding through it.
     *
     * @return routes removed by the cascade; empty when the neighbor was unknown.
     */
    public List<RouteEntry> removeNeighbor(String neighborId) {
        NeighborInfo removed = neighborTable.remove(neighborId);
        List<RouteEntry> purged = engine.purgeNextHop(neighborId);
        engine.forgetSender(neighborId);
        if (removed != null) {
            log.debug("{} removed neighbor {}, purged {} routes", selfId, neighborId, purged.size());
        }
        return purged;
    }

    /**
     * Merges the provided link fields and refreshes liveness.
     *
     * @return merged entry, or {@code null} when the neighbor is unknown (the update is ignored).
     */
    public NeighborInfo updateNeighbor(
            String neighborId,
            Double quality,
            Double signalStrength,
            Double bandwidthAvailable,
            long now
    ) {
        NeighborInfo merged = neighborTable.update(neighborId, quality, signalStrength, bandwidthAvailable, now);
        if (merged == null) {
            log.warn("{} ignored UPDATE for unknown neighbor {}", selfId, neighborId);
            return null;
        }
        if (engine.installDirectRoute(neighborId, now)) {
            trigger.broadcastSoon();
        }
        return merged;
    }

    /**
     * Hard-expires closed windows (with cascade) and soft-deactivates silent neighbors.
     */
    public LivenessResult checkLiveness(long now) {
        NeighborTable.LivenessReport report = neighborTable.checkLiveness(now, livenessTimeoutMillis);
        List<RouteEntry> purged = new ArrayList<>();
        for (String expired : report.expired()) {
            purged.addAll(engine.purgeNextHop(expired));
            engine.forgetSender(expired);
        }
        if (!report.isEmpty()) {
            log.debug("{} liveness: expired={} deactivated={} purgedRoutes={}",
                    selfId, report.expired(), report.deactivated(), purged.size());
        }
        return new LivenessResult(report, purged);
    }

    /**
     * Current link cost to a neighbor; {@code +INF} when absent or unusable.
     */
    public double linkCost(String neighborId, long now) {
        return engine.linkCost(neighborId, now);
    }
}
