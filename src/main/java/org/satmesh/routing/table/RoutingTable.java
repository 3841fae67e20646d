package org.satmesh.routing.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * Per-agent distance-vector table: one {@link RouteEntry} per destination.
 * <p>
 * Every mutation is a check-and-replace under one exclusive lock, so concurrent offers for
 * the same destination are linearized. Acceptance order for a candidate route:
 * </p>
 * <ol>
 * <li>no current route, or its next hop is suspended: install;</li>
 * <li>candidate comes from the current next hop: refresh, adopting the new metric if it changed;</li>
 * <li>fewer hops: replace (regardless of cost);</li>
 * <li>equal hops and strictly lower cost: replace;</li>
 * <li>current entry older than the route age limit: replace;</li>
 * <li>otherwise reject.</li>
 * </ol>
 * <p>
 * A route is suspended while its next hop is not a usable neighbor. Suspended routes stay in
 * the table until they age out or are replaced, but are left out of the filtered views and
 * of advertisements. Usability is passed in as a predicate evaluated under this table's lock,
 * so it must not take other locks.
 * </p>
 */
public final class RoutingTable {

    /**
     * Outcome of {@link #offer(String, String, int, double, long, long)}.
     */
    public enum OfferOutcome {
        /** No route existed; candidate installed. */
        INSTALLED,
        /** Candidate replaced the current route (different path or metric). */
        REPLACED,
        /** Same path and metric re-confirmed; timestamp refreshed only. */
        REFRESHED,
        /** Current route kept. */
        REJECTED;

        /**
         * @return true when the visible routing state changed.
         */
        public boolean changed() {
            return this == INSTALLED || this == REPLACED;
        }
    }

    private final Map<String, RouteEntry> routes = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Installs or refreshes the one-hop route to a directly linked neighbor.
     *
     * @return true when the visible routing state changed.
     */
    public boolean installDirect(String neighborId, double linkCost, long now) {
        RouteEntry direct = new RouteEntry(neighborId, neighborId, 1, linkCost, now);
        lock.lock();
        try {
            RouteEntry previous = routes.put(neighborId, direct);
            return !direct.samePathAs(previous);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offers a candidate route learned from an advertisement.
     *
     * @param destination destination node id.
     * @param nextHop advertising neighbor.
     * @param hopCount candidate hop count (already incremented).
     * @param cost candidate cost (already including the link to {@code nextHop}).
     * @param now current mesh time.
     * @param maxRouteAgeMillis age beyond which the current route yields to any candidate.
     * @return acceptance outcome.
     */
    public OfferOutcome offer(
            String destination,
            String nextHop,
            int hopCount,
            double cost,
            long now,
            long maxRouteAgeMillis
    ) {
        return offer(destination, nextHop, hopCount, cost, now, maxRouteAgeMillis, hop -> true);
    }

    /**
     * Offers a candidate route, treating a current route through a suspended next hop as absent.
     *
     * @param usableNextHop true for next hops that are currently usable neighbors.
     * @return acceptance outcome.
     */
    public OfferOutcome offer(
            String destination,
            String nextHop,
            int hopCount,
            double cost,
            long now,
            long maxRouteAgeMillis,
            Predicate<String> usableNextHop
    ) {
        Objects.requireNonNull(usableNextHop, "usableNextHop");
        RouteEntry candidate = new RouteEntry(destination, nextHop, hopCount, cost, now);
        lock.lock();
        try {
            RouteEntry current = routes.get(destination);
            if (current == null) {
                routes.put(destination, candidate);
                return OfferOutcome.INSTALLED;
            }
            if (!current.nextHop().equals(nextHop) && !usableNextHop.test(current.nextHop())) {
                routes.put(destination, candidate);
                return OfferOutcome.REPLACED;
            }
            if (current.nextHop().equals(nextHop)) {
                routes.put(destination, candidate);
                return candidate.samePathAs(current) ? OfferOutcome.REFRESHED : OfferOutcome.REPLACED;
            }
            if (hopCount < current.hopCount()
                    || (hopCount == current.hopCount() && cost < current.cost())
                    || current.ageAt(now) > maxRouteAgeMillis) {
                routes.put(destination, candidate);
                return OfferOutcome.REPLACED;
            }
            return OfferOutcome.REJECTED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes routes through {@code nextHop} whose destination the next hop no longer advertises.
     * The direct route to {@code nextHop} itself is never withdrawn here.
     *
     * @param nextHop advertising neighbor.
     * @param advertisedDestinations full set of destinations in its latest advertisement.
     * @return withdrawn entries.
     */
    public List<RouteEntry> withdrawMissing(String nextHop, Set<String> advertisedDestinations) {
        Objects.requireNonNull(advertisedDestinations, "advertisedDestinations");
        List<RouteEntry> withdrawn = new ArrayList<>();
        lock.lock();
        try {
            var iterator = routes.values().iterator();
            while (iterator.hasNext()) {
                RouteEntry entry = iterator.next();
                if (entry.nextHop().equals(nextHop)
                        && !entry.destination().equals(nextHop)
                        && !advertisedDestinations.contains(entry.destination())) {
                    iterator.remove();
                    withdrawn.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return sorted(withdrawn);
    }

    /**
     * Removes a single route whose next hop is {@code nextHop}.
     *
     * @return the removed entry, or {@code null} when no such route exists.
     */
    public RouteEntry removeIfNextHop(String destination, String nextHop) {
        lock.lock();
        try {
            RouteEntry current = routes.get(destination);
            if (current != null && current.nextHop().equals(nextHop)) {
                routes.remove(destination);
                return current;
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cascading delete of every route forwarding through {@code nextHop}.
     *
     * @return removed entries.
     */
    public List<RouteEntry> removeByNextHop(String nextHop) {
        List<RouteEntry> removed = new ArrayList<>();
        lock.lock();
        try {
            var iterator = routes.values().iterator();
            while (iterator.hasNext()) {
                RouteEntry entry = iterator.next();
                if (entry.nextHop().equals(nextHop)) {
                    iterator.remove();
                    removed.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return sorted(removed);
    }

    /**
     * Deletes routes older than {@code maxRouteAgeMillis}.
     *
     * @return removed entries.
     */
    public List<RouteEntry> removeStale(long now, long maxRouteAgeMillis) {
        List<RouteEntry> removed = new ArrayList<>();
        lock.lock();
        try {
            var iterator = routes.values().iterator();
            while (iterator.hasNext()) {
                RouteEntry entry = iterator.next();
                if (entry.ageAt(now) > maxRouteAgeMillis) {
                    iterator.remove();
                    removed.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return sorted(removed);
    }

    /**
     * Routes eligible for advertisement: those with {@code hopCount < kHops}.
     *
     * @return entries sorted by destination.
     */
    public List<RouteEntry> advertisable(int kHops) {
        return advertisable(kHops, hop -> true);
    }

    /**
     * Routes eligible for advertisement whose next hop is usable.
     *
     * @return entries sorted by destination.
     */
    public List<RouteEntry> advertisable(int kHops, Predicate<String> usableNextHop) {
        Objects.requireNonNull(usableNextHop, "usableNextHop");
        List<RouteEntry> eligible = new ArrayList<>();
        lock.lock();
        try {
            for (RouteEntry entry : routes.values()) {
                if (entry.hopCount() < kHops && usableNextHop.test(entry.nextHop())) {
                    eligible.add(entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return sorted(eligible);
    }

    /**
     * @return current route or {@code null}.
     */
    public RouteEntry get(String destination) {
        lock.lock();
        try {
            return routes.get(destination);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable destination-ordered copy of the table.
     */
    public Map<String, RouteEntry> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new TreeMap<>(routes));
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return immutable destination-ordered copy of the routes whose next hop is usable.
     */
    public Map<String, RouteEntry> snapshot(Predicate<String> usableNextHop) {
        Objects.requireNonNull(usableNextHop, "usableNextHop");
        TreeMap<String, RouteEntry> visible = new TreeMap<>();
        lock.lock();
        try {
            for (RouteEntry entry : routes.values()) {
                if (usableNextHop.test(entry.nextHop())) {
                    visible.put(entry.destination(), entry);
                }
            }
        } finally {
            lock.unlock();
        }
        return Collections.unmodifiableMap(visible);
    }

    /**
     * @return number of destinations.
     */
    public int size() {
        lock.lock();
        try {
            return routes.size();
        } finally {
            lock.unlock();
        }
    }

    private static List<RouteEntry> sorted(List<RouteEntry> entries) {
        entries.sort(Comparator.comparing(RouteEntry::destination));
        return entries;
    }
}
