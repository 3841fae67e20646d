package org.satmesh.routing.engine;

/**
 * One advertised distance-vector element: the sender's own hop count and cost to a destination.
 *
 * @param hopCount sender's hop count, {@code >= 1}.
 * @param cost sender's cost, finite and {@code >= 1.0}.
 */
public record Advertisement(int hopCount, double cost) {

    public Advertisement {
        if (hopCount < 1) {
            throw new IllegalArgumentException("hopCount must be >= 1, got " + hopCount);
        }
        if (!Double.isFinite(cost) || cost < 1.0d) {
            throw new IllegalArgumentException("cost must be finite and >= 1.0, got " + cost);
        }
    }
}
