package org.satmesh.routing.agent;

import org.satmesh.routing.engine.RoutingMessage;
import org.satmesh.routing.neighbor.NeighborEvent;

/**
 * Delivery endpoint of one agent as seen through the {@link AgentRegistry}.
 * Both methods only enqueue; they never touch the target's tables.
 */
public interface AgentHandle {

    /**
     * Node id this handle is registered under.
     */
    String nodeId();

    /**
     * Enqueues a routing message into the inbound queue.
     *
     * @return false when the queue is full or the agent is stopping.
     */
    boolean deliver(RoutingMessage message);

    /**
     * Enqueues a neighbor event.
     *
     * @return false when the agent is stopping.
     */
    boolean submit(NeighborEvent event);
}
