package org.satmesh.routing.cost;

import org.satmesh.routing.neighbor.NeighborInfo;

/**
 * Weighted quality/signal/bandwidth link cost; the default strategy.
 * <p>
 * {@code cost = max(1.0, 0.5 / quality + 0.3 * |signal| / 100 + 0.2 / (bandwidth + 1))}.
 * A quality of zero yields {@code +INF}.
 * </p>
 */
public final class CompositeLinkCostStrategy implements LinkCostStrategy {

    static final double QUALITY_WEIGHT = 0.5d;
    static final double SIGNAL_WEIGHT = 0.3d;
    static final double BANDWIDTH_WEIGHT = 0.2d;

    @Override
    public String id() {
        return LinkCostStrategyRegistry.STRATEGY_COMPOSITE;
    }

    @Override
    public double cost(NeighborInfo neighbor) {
        double quality = neighbor.quality();
        if (quality <= 0.0d) {
            return Double.POSITIVE_INFINITY;
        }
        double composite = QUALITY_WEIGHT * (1.0d / quality)
                + SIGNAL_WEIGHT * (Math.abs(neighbor.signalStrength()) / 100.0d)
                + BANDWIDTH_WEIGHT * (1.0d / (neighbor.bandwidthAvailable() + 1.0d));
        return Math.max(MIN_LINK_COST, composite);
    }
}
