package org.satmesh.routing.cost;

import org.satmesh.routing.neighbor.NeighborInfo;

/**
 * Strategy contract for the cost of one hop over a neighbor link.
 * <p>
 * Implementations see only usable links; absent or unusable neighbors are mapped to
 * {@code +INF} by the caller. Returned costs must be {@code >= 1.0} or {@code +INF}.
 * </p>
 */
public interface LinkCostStrategy {

    /**
     * Lower bound of every finite link cost.
     */
    double MIN_LINK_COST = 1.0d;

    /**
     * Stable strategy identifier.
     */
    String id();

    /**
     * Computes the hop cost over one usable neighbor link.
     *
     * @param neighbor current link state.
     * @return cost in {@code [1.0, +INF]}.
     */
    double cost(NeighborInfo neighbor);
}
