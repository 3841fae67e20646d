package org.satmesh.routing.agent;

import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Directory of node id to {@link AgentHandle} for one mesh, used only to resolve delivery targets.
 * <p>
 * Thread-safe for concurrent registration, lookup and removal. Each mesh constructs its own
 * registry and hands it to its agents, so several meshes can run in one process.
 * </p>
 */
public final class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);

    private final ConcurrentHashMap<String, AgentHandle> handles = new ConcurrentHashMap<>();

    /**
     * Registers a handle under its node id.
     *
     * @throws MeshRoutingException with {@link SatelliteMesh#REASON_DUPLICATE_NODE} when the id is taken.
     */
    public void register(AgentHandle handle) {
        Objects.requireNonNull(handle, "handle");
        String nodeId = Objects.requireNonNull(handle.nodeId(), "handle.nodeId");
        AgentHandle previous = handles.putIfAbsent(nodeId, handle);
        if (previous != null) {
            throw new MeshRoutingException(
                    SatelliteMesh.REASON_DUPLICATE_NODE,
                    "node id already registered: " + nodeId
            );
        }
        log.debug("registered node {}", nodeId);
    }

    /**
     * Removes the handle registered under {@code nodeId}.
     *
     * @return the removed handle, or {@code null} when none was registered.
     */
    public AgentHandle unregister(String nodeId) {
        AgentHandle removed = handles.remove(nodeId);
        if (removed != null) {
            log.debug("unregistered node {}", nodeId);
        }
        return removed;
    }

    /**
     * @return handle for {@code nodeId}, or {@code null} when unresolved.
     */
    public AgentHandle lookup(String nodeId) {
        if (nodeId == null) {
            return null;
        }
        return handles.get(nodeId);
    }

    public boolean contains(String nodeId) {
        return lookup(nodeId) != null;
    }

    /**
     * @return registered ids, sorted.
     */
    public List<String> nodeIds() {
        List<String> ids = new ArrayList<>(handles.keySet());
        Collections.sort(ids);
        return ids;
    }

    public int size() {
        return handles.size();
    }
}
