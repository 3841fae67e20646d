package org.satmesh.routing.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.satmesh.routing.cost.CompositeLinkCostStrategy;
import org.satmesh.routing.cost.LinkCostStrategy;
import org.satmesh.routing.cost.UnitLinkCostStrategy;
import org.satmesh.routing.neighbor.NeighborTable;
import org.satmesh.routing.table.RouteEntry;
import org.satmesh.routing.table.RoutingTable;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Distance Vector Engine Tests")
class DistanceVectorEngineTest {

    private static final long WINDOW_END = 1_000_000L;
    private static final long MAX_AGE = 30_000L;

    private NeighborTable neighbors;
    private RoutingTable routes;

    @BeforeEach
    void setUp() {
        neighbors = new NeighborTable();
        routes = new RoutingTable();
    }

    private DistanceVectorEngine engine(int kHops, LinkCostStrategy strategy) {
        return new DistanceVectorEngine("A", routes, neighbors, strategy, kHops, MAX_AGE, 64);
    }

    private void neighbor(DistanceVectorEngine engine, String id, double quality) {
        neighbors.add(id, 0L, WINDOW_END, quality, 0L);
        engine.installDirectRoute(id, 0L);
    }

    private static RoutingMessage message(String sender, long sequence, Object... entries) {
        Map<String, Advertisement> routes = new LinkedHashMap<>();
        for (int i = 0; i < entries.length; i += 3) {
            routes.put((String) entries[i], new Advertisement((Integer) entries[i + 1], (Double) entries[i + 2]));
        }
        return RoutingMessage.of(sender, sequence, 0L, routes);
    }

    @Test
    @DisplayName("Advertised routes are installed one hop further at accumulated cost")
    void testInstallsLearnedRoutes() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);

        AdvertisementOutcome outcome = engine.processAdvertisement(
                message("B", 1L, "C", 1, 1.0d, "D", 2, 3.5d), 100L);

        assertFalse(outcome.duplicate());
        assertTrue(outcome.senderUsable());
        assertFalse(outcome.senderRevived());
        assertEquals(2, outcome.accepted());
        assertTrue(outcome.changed());
        assertEquals(new RouteEntry("C", "B", 2, 2.0d, 100L), routes.get("C"));
        assertEquals(new RouteEntry("D", "B", 3, 4.5d, 100L), routes.get("D"));
    }

    @Test
    @DisplayName("Own id in an advertisement is ignored")
    void testIgnoresSelfDestination() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);

        engine.processAdvertisement(message("B", 1L, "A", 1, 1.0d), 100L);
        assertNull(routes.get("A"));
    }

    @Test
    @DisplayName("Candidates beyond the horizon are rejected")
    void testHorizonBound() {
        DistanceVectorEngine engine = engine(2, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);

        AdvertisementOutcome outcome = engine.processAdvertisement(
                message("B", 1L, "C", 1, 1.0d, "D", 2, 2.0d), 100L);

        assertEquals(1, outcome.accepted());
        assertEquals(1, outcome.rejectedHorizon());
        assertNotNull(routes.get("C"));
        assertNull(routes.get("D"));
        for (RouteEntry entry : routes.snapshot().values()) {
            assertTrue(entry.hopCount() <= 2);
        }
    }

    @Test
    @DisplayName("A route pushed past the horizon by its next hop is removed")
    void testHorizonOverflowFromNextHopRemoves() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        engine.processAdvertisement(message("B", 1L, "D", 2, 2.0d), 100L);
        assertEquals(3, routes.get("D").hopCount());

        AdvertisementOutcome outcome = engine.processAdvertisement(message("B", 2L, "D", 3, 3.0d), 200L);
        assertEquals(1, outcome.withdrawn());
        assertNull(routes.get("D"));
    }

    @Test
    @DisplayName("Replayed messages are dropped without touching the table")
    void testIdempotence() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        RoutingMessage update = message("B", 7L, "C", 1, 1.0d);

        engine.processAdvertisement(update, 100L);
        Map<String, RouteEntry> before = routes.snapshot();

        AdvertisementOutcome replay = engine.processAdvertisement(update, 5_000L);
        assertTrue(replay.duplicate());
        assertFalse(replay.changed());
        assertEquals(before, routes.snapshot());
    }

    @Test
    @DisplayName("Equal hop counts are broken by lower cost")
    void testTieBreakByCost() {
        DistanceVectorEngine engine = engine(3, new CompositeLinkCostStrategy());
        neighbor(engine, "WEAK", 0.3d);
        neighbor(engine, "STRONG", 0.9d);

        engine.processAdvertisement(message("WEAK", 1L, "D", 1, 1.0d), 100L);
        assertEquals("WEAK", routes.get("D").nextHop());

        AdvertisementOutcome outcome = engine.processAdvertisement(message("STRONG", 1L, "D", 1, 1.0d), 200L);
        assertEquals(1, outcome.accepted());
        assertEquals("STRONG", routes.get("D").nextHop());
        assertEquals(2.0d, routes.get("D").cost(), 1e-12);

        AdvertisementOutcome worse = engine.processAdvertisement(message("WEAK", 2L, "D", 1, 1.0d), 300L);
        assertEquals(1, worse.rejected());
        assertEquals("STRONG", routes.get("D").nextHop());
    }

    @Test
    @DisplayName("Fewer hops beat lower cost")
    void testFewerHopsBeatCost() {
        DistanceVectorEngine engine = engine(3, new CompositeLinkCostStrategy());
        neighbor(engine, "CHEAP", 0.9d);
        neighbor(engine, "SHORT", 0.2d);

        engine.processAdvertisement(message("CHEAP", 1L, "D", 2, 1.0d), 100L);
        engine.processAdvertisement(message("SHORT", 1L, "D", 1, 1.0d), 200L);
        assertEquals("SHORT", routes.get("D").nextHop());
        assertEquals(2, routes.get("D").hopCount());
    }

    @Test
    @DisplayName("The current next hop may lengthen its own route")
    void testNextHopAuthorityOverridesHopCount() {
        DistanceVectorEngine engine = engine(4, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        neighbor(engine, "C", 1.0d);
        engine.processAdvertisement(message("B", 1L, "D", 1, 1.0d), 100L);
        engine.processAdvertisement(message("C", 1L, "D", 2, 2.0d), 150L);
        assertEquals(new RouteEntry("D", "B", 2, 2.0d, 100L), routes.get("D"));

        AdvertisementOutcome outcome = engine.processAdvertisement(message("B", 2L, "D", 3, 3.0d), 200L);
        assertEquals(1, outcome.accepted());
        assertEquals(new RouteEntry("D", "B", 4, 4.0d, 200L), routes.get("D"),
                "the next hop's report replaces the route even with more hops");

        engine.processAdvertisement(message("C", 2L, "D", 2, 2.0d), 300L);
        assertEquals(new RouteEntry("D", "C", 3, 3.0d, 300L), routes.get("D"));
    }

    @Test
    @DisplayName("Routes through an inactive neighbor are neither visible nor advertised")
    void testSuspendedRoutesHidden() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        neighbor(engine, "C", 1.0d);
        engine.processAdvertisement(message("B", 1L, "D", 1, 1.0d), 100L);
        neighbors.update("C", null, null, null, 40_000L);
        neighbors.checkLiveness(40_000L, 20_000L);
        assertFalse(neighbors.get("B").active());

        assertEquals(List.of("C"), List.copyOf(engine.visibleRoutes(40_000L).keySet()));
        assertNull(engine.visibleRoute("D", 40_000L));
        assertNotNull(engine.visibleRoute("C", 40_000L));
        assertEquals(List.of("C"), List.copyOf(engine.prepareUpdate(40_000L).routes().keySet()));
        assertEquals(3, routes.size(), "suspended routes stay until they age out");

        AdvertisementOutcome outcome = engine.processAdvertisement(message("C", 1L, "D", 2, 2.0d), 40_100L);
        assertEquals(1, outcome.accepted());
        assertEquals("C", routes.get("D").nextHop());
    }

    @Test
    @DisplayName("Updates carry the engine incarnation and a re-created sender is not a duplicate")
    void testIncarnation() {
        DistanceVectorEngine sender = new DistanceVectorEngine(
                "B", new RoutingTable(), new NeighborTable(), new UnitLinkCostStrategy(), 3, MAX_AGE, 64, 9L);
        assertEquals(9L, sender.incarnation());
        assertEquals(9L, sender.prepareUpdate(0L).incarnation());

        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        assertFalse(engine.processAdvertisement(RoutingMessage.of("B", 1L, 1L, 0L, Map.of()), 100L).duplicate());
        assertTrue(engine.processAdvertisement(RoutingMessage.of("B", 1L, 1L, 0L, Map.of()), 200L).duplicate());

        AdvertisementOutcome reborn = engine.processAdvertisement(
                RoutingMessage.of("B", 2L, 1L, 0L, Map.of("C", new Advertisement(1, 1.0d))), 300L);
        assertFalse(reborn.duplicate());
        assertEquals(1, reborn.accepted());
        assertTrue(engine.processAdvertisement(RoutingMessage.of("B", 1L, 5L, 0L, Map.of()), 400L).duplicate(),
                "messages from the previous incarnation are dropped");
    }

    @Test
    @DisplayName("Destinations dropped by the next hop are withdrawn")
    void testImplicitWithdrawal() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        engine.processAdvertisement(message("B", 1L, "C", 1, 1.0d, "D", 2, 2.0d), 100L);

        AdvertisementOutcome outcome = engine.processAdvertisement(message("B", 2L, "C", 1, 1.0d), 200L);
        assertEquals(1, outcome.withdrawn());
        assertTrue(outcome.changed());
        assertNull(routes.get("D"));
        assertNotNull(routes.get("C"));
        assertNotNull(routes.get("B"));
    }

    @Test
    @DisplayName("Advertisements from unknown or closed-window senders are ignored")
    void testUnusableSender() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        AdvertisementOutcome unknown = engine.processAdvertisement(message("X", 1L, "C", 1, 1.0d), 100L);
        assertFalse(unknown.senderUsable());
        assertEquals(0, routes.size());

        neighbors.add("B", 0L, 50L, 1.0d, 0L);
        AdvertisementOutcome closed = engine.processAdvertisement(message("B", 1L, "C", 1, 1.0d), 100L);
        assertFalse(closed.senderUsable());
        assertEquals(0, routes.size());
    }

    @Test
    @DisplayName("An advertisement revives a soft-inactive sender")
    void testAdvertisementIsSignOfLife() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        neighbors.checkLiveness(50_000L, 20_000L);
        assertFalse(neighbors.get("B").active());

        AdvertisementOutcome outcome = engine.processAdvertisement(message("B", 1L, "C", 1, 1.0d), 50_100L);
        assertTrue(outcome.senderUsable());
        assertTrue(outcome.senderRevived());
        assertEquals(50_100L, routes.get("B").timestamp(), "revival refreshes the direct route");
        assertTrue(neighbors.get("B").active());
        assertEquals(50_100L, neighbors.get("B").lastSeen());
        assertNotNull(routes.get("C"));
    }

    @Test
    @DisplayName("Outgoing updates advertise below the horizon with increasing sequence")
    void testPrepareUpdate() {
        DistanceVectorEngine engine = engine(2, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        engine.processAdvertisement(message("B", 1L, "C", 1, 1.0d), 100L);
        assertEquals(0L, engine.currentSequence());

        RoutingMessage first = engine.prepareUpdate(200L);
        RoutingMessage second = engine.prepareUpdate(300L);
        assertEquals("A", first.sender());
        assertEquals(1L, first.sequence());
        assertEquals(2L, second.sequence());
        assertEquals(2L, engine.currentSequence());
        assertEquals(List.of("B"), List.copyOf(first.routes().keySet()));
        assertEquals(new Advertisement(1, 1.0d), first.routes().get("B"));
    }

    @Test
    @DisplayName("Stale routes are collected and direct routes refreshed")
    void testStaleCleanupAndDirectRefresh() {
        DistanceVectorEngine engine = engine(3, new UnitLinkCostStrategy());
        neighbor(engine, "B", 1.0d);
        engine.processAdvertisement(message("B", 1L, "C", 1, 1.0d), 0L);

        assertEquals(0, engine.refreshDirectRoutes(20_000L));
        assertEquals(20_000L, routes.get("B").timestamp());

        List<RouteEntry> stale = engine.cleanupStaleRoutes(MAX_AGE + 1);
        assertEquals(List.of("C"), stale.stream().map(RouteEntry::destination).toList());
        assertNotNull(routes.get("B"));
    }

    @Test
    @DisplayName("Constructor validates horizon and age")
    void testConstructorValidation() {
        UnitLinkCostStrategy unit = new UnitLinkCostStrategy();
        assertThrows(IllegalArgumentException.class,
                () -> new DistanceVectorEngine("A", routes, neighbors, unit, 0, MAX_AGE, 8));
        assertThrows(IllegalArgumentException.class,
                () -> new DistanceVectorEngine("A", routes, neighbors, unit, 3, 0L, 8));
        assertThrows(IllegalArgumentException.class,
                () -> new DistanceVectorEngine("A", routes, neighbors, unit, 3, MAX_AGE, 0));
    }
}
