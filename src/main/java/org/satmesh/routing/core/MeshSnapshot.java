package org.satmesh.routing.core;

import lombok.Value;
import org.satmesh.routing.agent.AgentSnapshot;
import org.satmesh.routing.table.RouteEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-node snapshots of one mesh, keyed and ordered by node id.
 */
@Value
public class MeshSnapshot {
    long takenAtMillis;
    Map<String, AgentSnapshot> agents;

    public MeshSnapshot(long takenAtMillis, Map<String, AgentSnapshot> agents) {
        this.takenAtMillis = takenAtMillis;
        this.agents = Collections.unmodifiableMap(new TreeMap<>(agents));
    }

    /**
     * @return snapshot of {@code nodeId}, or {@code null}.
     */
    public AgentSnapshot agent(String nodeId) {
        return agents.get(nodeId);
    }

    /**
     * @return route held by {@code from} towards {@code to}, or {@code null}.
     */
    public RouteEntry route(String from, String to) {
        AgentSnapshot snapshot = agents.get(from);
        return snapshot == null ? null : snapshot.route(to);
    }

    /**
     * @return node ids, sorted.
     */
    public List<String> nodeIds() {
        return new ArrayList<>(agents.keySet());
    }

    /**
     * @return total number of routes across all nodes.
     */
    public int routeCount() {
        int count = 0;
        for (AgentSnapshot snapshot : agents.values()) {
            count += snapshot.getRoutes().size();
        }
        return count;
    }
}
