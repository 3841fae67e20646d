package org.satmesh.routing.cost;

import org.satmesh.routing.neighbor.NeighborInfo;

/**
 * Constant link cost of one (pure hop counting).
 */
public final class UnitLinkCostStrategy implements LinkCostStrategy {

    @Override
    public String id() {
        return LinkCostStrategyRegistry.STRATEGY_UNIT;
    }

    @Override
    public double cost(NeighborInfo neighbor) {
        return MIN_LINK_COST;
    }
}
