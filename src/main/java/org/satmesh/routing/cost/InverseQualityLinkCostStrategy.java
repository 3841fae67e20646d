package org.satmesh.routing.cost;

import org.satmesh.routing.neighbor.NeighborInfo;

/**
 * Link cost {@code 1 / quality}; quality zero yields {@code +INF}.
 */
public final class InverseQualityLinkCostStrategy implements LinkCostStrategy {

    @Override
    public String id() {
        return LinkCostStrategyRegistry.STRATEGY_INVERSE_QUALITY;
    }

    @Override
    public double cost(NeighborInfo neighbor) {
        double quality = neighbor.quality();
        if (quality <= 0.0d) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.max(MIN_LINK_COST, 1.0d / quality);
    }
}
