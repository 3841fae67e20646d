package org.satmesh.routing.table;

import java.util.Objects;

/**
 * Immutable distance-vector route to one destination.
 *
 * @param destination destination node id.
 * @param nextHop neighbor the route forwards through.
 * @param hopCount hops to the destination, {@code >= 1}.
 * @param cost accumulated link cost, finite and {@code >= 1.0}.
 * @param timestamp mesh time the entry was installed or last refreshed.
 */
public record RouteEntry(String destination, String nextHop, int hopCount, double cost, long timestamp) {

    public RouteEntry {
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(nextHop, "nextHop");
        if (hopCount < 1) {
            throw new IllegalArgumentException("hopCount must be >= 1, got " + hopCount);
        }
        if (!Double.isFinite(cost) || cost < 1.0d) {
            throw new IllegalArgumentException("cost must be finite and >= 1.0, got " + cost);
        }
    }

    /**
     * @param now current mesh time.
     * @return milliseconds since the entry was installed or refreshed.
     */
    public long ageAt(long now) {
        return now - timestamp;
    }

    /**
     * @return true when both entries describe the same path and metric, ignoring timestamps.
     */
    public boolean samePathAs(RouteEntry other) {
        return other != null
                && destination.equals(other.destination)
                && nextHop.equals(other.nextHop)
                && hopCount == other.hopCount
                && Double.compare(cost, other.cost) == 0;
    }

    /**
     * Copy with a new timestamp.
     */
    public RouteEntry refreshedAt(long now) {
        return new RouteEntry(destination, nextHop, hopCount, cost, now);
    }
}
