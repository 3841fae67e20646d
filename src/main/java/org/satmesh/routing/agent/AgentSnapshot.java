package org.satmesh.routing.agent;

import lombok.Builder;
import lombok.Value;
import org.satmesh.routing.metadata.Coordinates;
import org.satmesh.routing.metadata.SatelliteMetadata;
import org.satmesh.routing.neighbor.NeighborInfo;
import org.satmesh.routing.table.RouteEntry;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of one agent.
 * <p>
 * Each table is copied under its own lock, one after the other, so the parts are individually
 * consistent but may straddle a concurrent cycle.
 * </p>
 */
@Value
@Builder
public class AgentSnapshot {
    String nodeId;
    long takenAtMillis;
    /** Known neighbors sorted by id. */
    List<NeighborInfo> neighbors;
    /** Routes keyed and ordered by destination. */
    Map<String, RouteEntry> routes;
    /** Last routing-update sequence sent. */
    long sequence;
    AgentCounters.Snapshot counters;
    SatelliteMetadata metadata;
    Coordinates coordinates;
    /** Routing messages waiting in the inbound queue. */
    int pendingMessages;

    /**
     * @return route to {@code destination}, or {@code null}.
     */
    public RouteEntry route(String destination) {
        return routes.get(destination);
    }

    /**
     * @return neighbor entry for {@code neighborId}, or {@code null}.
     */
    public NeighborInfo neighbor(String neighborId) {
        for (NeighborInfo info : neighbors) {
            if (info.neighborId().equals(neighborId)) {
                return info;
            }
        }
        return null;
    }
}
