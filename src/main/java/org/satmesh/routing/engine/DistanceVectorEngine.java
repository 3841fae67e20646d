package org.satmesh.routing.engine;

import lombok.Getter;
import lombok.experimental.Accessors;
import org.satmesh.routing.cost.LinkCostStrategy;
import org.satmesh.routing.neighbor.NeighborInfo;
import org.satmesh.routing.neighbor.NeighborTable;
import org.satmesh.routing.table.RouteEntry;
import org.satmesh.routing.table.RoutingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded-hop distance-vector engine of one agent.
 * <p>
 * The engine owns the agent's {@link RoutingTable} and {@link SeenSet} and reads link costs
 * from the agent's {@link NeighborTable}. Each step takes at most one table lock at a time:
 * the link cost is resolved first, then the routing table is updated.
 * </p>
 * <p>
 * Horizon contract: a candidate with {@code hopCount > kHops} is never accepted, and only
 * routes with {@code hopCount < kHops} are advertised.
 * </p>
 * <p>
 * Routes whose next hop is not a usable neighbor are suspended: they are neither advertised
 * nor returned by {@link #visibleRoutes(long)}, and any candidate replaces them.
 * </p>
 */
public final class DistanceVectorEngine {
    private static final Logger log = LoggerFactory.getLogger(DistanceVectorEngine.class);

    @Getter
    @Accessors(fluent = true)
    private final String selfId;
    @Getter
    @Accessors(fluent = true)
    private final RoutingTable routingTable;
    private final NeighborTable neighborTable;
    private final LinkCostStrategy costStrategy;
    private final SeenSet seenSet;
    @Getter
    @Accessors(fluent = true)
    private final int kHops;
    @Getter
    @Accessors(fluent = true)
    private final long maxRouteAgeMillis;
    @Getter
    @Accessors(fluent = true)
    private final long incarnation;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * @param selfId id of the owning node.
     * @param routingTable routing table owned by this engine.
     * @param neighborTable neighbor table of the same agent, read for link costs.
     * @param costStrategy link-cost strategy.
     * @param kHops routing horizon, {@code > 0}.
     * @param maxRouteAgeMillis route age limit, {@code > 0}.
     * @param seenSetRetention per-sender dedup retention, {@code > 0}.
     */
    public DistanceVectorEngine(
            String selfId,
            RoutingTable routingTable,
            NeighborTable neighborTable,
            LinkCostStrategy costStrategy,
            int kHops,
            long maxRouteAgeMillis,
            int seenSetRetention
    ) {
        this(selfId, routingTable, neighborTable, costStrategy, kHops, maxRouteAgeMillis, seenSetRetention, 0L);
    }

    /**
     * @param incarnation stamped on every outgoing message; a node re-created under the same id
     *        must use a higher value than its previous life.
     */
    public DistanceVectorEngine(
            String selfId,
            RoutingTable routingTable,
            NeighborTable neighborTable,
            LinkCostStrategy costStrategy,
            int kHops,
            long maxRouteAgeMillis,
            int seenSetRetention,
            long incarnation
    ) {
        if (incarnation < 0) {
            throw new IllegalArgumentException("incarnation must be >= 0");
        }
        if (kHops <= 0) {
            throw new IllegalArgumentException("kHops must be > 0");
        }
        if (maxRouteAgeMillis <= 0) {
            throw new IllegalArgumentException("maxRouteAgeMillis must be > 0");
        }
        this.selfId = Objects.requireNonNull(selfId, "selfId");
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
        this.neighborTable = Objects.requireNonNull(neighborTable, "neighborTable");
        this.costStrategy = Objects.requireNonNull(costStrategy, "costStrategy");
        this.kHops = kHops;
        this.maxRouteAgeMillis = maxRouteAgeMillis;
        this.incarnation = incarnation;
        this.seenSet = new SeenSet(seenSetRetention);
    }

    /**
     * Installs the one-hop route to a neighbor when its link is usable.
     *
     * @return true when the routing table changed.
     */
    public boolean installDirectRoute(String neighborId, long now) {
        double cost = neighborTable.linkCost(neighborId, now, costStrategy);
        if (!Double.isFinite(cost)) {
            return false;
        }
        return routingTable.installDirect(neighborId, cost, now);
    }

    /**
     * Re-installs direct routes of every usable neighbor, refreshing their timestamps.
     *
     * @return number of direct routes whose path or metric changed.
     */
    public int refreshDirectRoutes(long now) {
        int changed = 0;
        for (String neighborId : neighborTable.usableNeighborIds(now)) {
            if (installDirectRoute(neighborId, now)) {
                changed++;
            }
        }
        return changed;
    }

    /**
     * Applies one received advertisement.
     *
     * @param message advertisement from a neighbor.
     * @param now current mesh time.
     * @return per-message outcome; {@link AdvertisementOutcome#duplicate()} for replays.
     */
    public AdvertisementOutcome processAdvertisement(RoutingMessage message, long now) {
        Objects.requireNonNull(message, "message");
        String sender = message.sender();
        if (!seenSet.markSeen(sender, message.incarnation(), message.sequence())) {
            log.debug("{} dropped duplicate update {}/{}#{}", selfId, sender, message.incarnation(), message.sequence());
            return AdvertisementOutcome.duplicateMessage();
        }
        if (sender.equals(selfId)) {
            return AdvertisementOutcome.unusableSender();
        }

        NeighborInfo previous = neighborTable.get(sender);
        boolean revived = neighborTable.touch(sender, now) && previous != null && !previous.active();
        double linkCost = neighborTable.linkCost(sender, now, costStrategy);
        if (!Double.isFinite(linkCost)) {
            log.debug("{} ignored update {}#{} from unusable neighbor", selfId, sender, message.sequence());
            return AdvertisementOutcome.unusableSender();
        }
        if (revived) {
            installDirectRoute(sender, now);
            log.debug("{} revived neighbor {}", selfId, sender);
        }

        Set<String> usable = Set.copyOf(neighborTable.usableNeighborIds(now));
        int accepted = 0;
        int refreshed = 0;
        int rejected = 0;
        int rejectedHorizon = 0;
        int withdrawn = 0;
        for (Map.Entry<String, Advertisement> entry : message.routes().entrySet()) {
            String destination = entry.getKey();
            if (destination.equals(selfId)) {
                continue;
            }
            Advertisement advertisement = entry.getValue();
            int newHop = advertisement.hopCount() + 1;
            if (newHop > kHops) {
                rejectedHorizon++;
                if (routingTable.removeIfNextHop(destination, sender) != null) {
                    withdrawn++;
                }
                continue;
            }
            double newCost = advertisement.cost() + linkCost;
            switch (routingTable.offer(destination, sender, newHop, newCost, now, maxRouteAgeMillis, usable::contains)) {
                case INSTALLED, REPLACED -> accepted++;
                case REFRESHED -> refreshed++;
                case REJECTED -> rejected++;
            }
        }
        withdrawn += routingTable.withdrawMissing(sender, message.routes().keySet()).size();

        return new AdvertisementOutcome(false, true, revived, accepted, refreshed, rejected, rejectedHorizon, withdrawn);
    }

    /**
     * Builds the next outgoing advertisement, consuming one sequence number.
     *
     * @param now current mesh time.
     * @return message carrying every unsuspended route with {@code hopCount < kHops}.
     */
    public RoutingMessage prepareUpdate(long now) {
        Set<String> usable = Set.copyOf(neighborTable.usableNeighborIds(now));
        Map<String, Advertisement> advertised = new LinkedHashMap<>();
        for (RouteEntry entry : routingTable.advertisable(kHops, usable::contains)) {
            advertised.put(entry.destination(), new Advertisement(entry.hopCount(), entry.cost()));
        }
        return RoutingMessage.of(selfId, incarnation, sequence.incrementAndGet(), now, advertised);
    }

    /**
     * @return destination-ordered routes whose next hop is usable at {@code now}.
     */
    public Map<String, RouteEntry> visibleRoutes(long now) {
        Set<String> usable = Set.copyOf(neighborTable.usableNeighborIds(now));
        return routingTable.snapshot(usable::contains);
    }

    /**
     * @return route to {@code destination} when its next hop is usable at {@code now}, else {@code null}.
     */
    public RouteEntry visibleRoute(String destination, long now) {
        RouteEntry entry = routingTable.get(destination);
        if (entry == null || !Double.isFinite(neighborTable.linkCost(entry.nextHop(), now, costStrategy))) {
            return null;
        }
        return entry;
    }

    /**
     * Drops the duplicate-detection state of a departed neighbor.
     */
    public void forgetSender(String neighborId) {
        seenSet.forget(neighborId);
    }

    /**
     * Cascading delete of every route through a departed neighbor.
     *
     * @return removed entries.
     */
    public List<RouteEntry> purgeNextHop(String neighborId) {
        return routingTable.removeByNextHop(neighborId);
    }

    /**
     * Deletes routes older than the route age limit.
     *
     * @return removed entries.
     */
    public List<RouteEntry> cleanupStaleRoutes(long now) {
        return routingTable.removeStale(now, maxRouteAgeMillis);
    }

    /**
     * @return last sequence number used, {@code 0} before the first update.
     */
    public long currentSequence() {
        return sequence.get();
    }

    /**
     * Link cost to a neighbor under this engine's strategy.
     */
    public double linkCost(String neighborId, long now) {
        return neighborTable.linkCost(neighborId, now, costStrategy);
    }
}
