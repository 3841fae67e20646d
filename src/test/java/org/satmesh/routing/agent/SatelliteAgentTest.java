package org.satmesh.routing.agent;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.satmesh.core.time.MeshClock;
import org.satmesh.core.time.VirtualMeshClock;
import org.satmesh.routing.core.MeshRoutingConfig;
import org.satmesh.routing.cost.UnitLinkCostStrategy;
import org.satmesh.routing.engine.Advertisement;
import org.satmesh.routing.engine.RoutingMessage;
import org.satmesh.routing.metadata.NodeMetadata;
import org.satmesh.routing.neighbor.NeighborEvent;
import org.satmesh.routing.table.RouteEntry;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Satellite Agent Tests")
class SatelliteAgentTest {

    private static final long T0 = 1_000_000L;

    private VirtualMeshClock clock;
    private AgentRegistry registry;
    private AgentRegistryTest.StubHandle b;

    @BeforeEach
    void setUp() {
        clock = new VirtualMeshClock(T0);
        registry = new AgentRegistry();
        b = new AgentRegistryTest.StubHandle("B");
        registry.register(b);
    }

    private SatelliteAgent agent(MeshRoutingConfig config, MeshClock agentClock) {
        SatelliteAgent agent = new SatelliteAgent(
                "A", config.validate(), agentClock, registry, new UnitLinkCostStrategy(), NodeMetadata.withDefaults());
        registry.register(agent);
        return agent;
    }

    @Test
    @DisplayName("ADD installs the direct route and broadcasts in the same cycle")
    void testAddBroadcastsImmediately() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        assertTrue(a.submit(NeighborEvent.add("B", T0, T0 + 60_000L)));
        a.runCycle();

        assertEquals(new RouteEntry("B", "B", 1, 1.0d, T0), a.route("B"));
        List<RoutingMessage> sent = b.delivered();
        assertEquals(1, sent.size());
        assertEquals("A", sent.get(0).sender());
        assertEquals(1L, sent.get(0).sequence());
        assertEquals(Map.of("B", new Advertisement(1, 1.0d)), sent.get(0).routes());

        AgentSnapshot snapshot = a.snapshot();
        assertEquals(1L, snapshot.getSequence());
        assertEquals(1L, snapshot.getCounters().getUpdatesSent());
        assertEquals(1L, snapshot.getCounters().getMessagesSent());
        assertEquals(1L, snapshot.getCounters().getNeighborEventsApplied());
        assertEquals("B", snapshot.neighbor("B").neighborId());
    }

    @Test
    @DisplayName("Learned routes trigger a jittered re-broadcast")
    void testTriggeredBroadcastIsJittered() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.submit(NeighborEvent.add("B", T0, T0 + 60_000L));
        a.runCycle();

        clock.advance(1_000L);
        assertTrue(a.deliver(RoutingMessage.of("B", 1L, clock.millis(), Map.of("C", new Advertisement(1, 1.0d)))));
        long deadline = a.runCycle();
        assertEquals(new RouteEntry("C", "B", 2, 2.0d, clock.millis()), a.route("C"));
        assertEquals(1, b.delivered().size(), "re-broadcast waits for the jitter");
        assertTrue(deadline >= clock.millis() + 100L && deadline <= clock.millis() + 300L);

        clock.advance(300L);
        a.runCycle();
        assertEquals(2, b.delivered().size());
        RoutingMessage update = b.delivered().get(1);
        assertEquals(2L, update.sequence());
        assertEquals(new Advertisement(2, 2.0d), update.routes().get("C"));

        AgentCounters.Snapshot counters = a.counters().snapshot();
        assertEquals(1L, counters.getMessagesProcessed());
        assertEquals(1L, counters.getRoutesAccepted());
    }

    @Test
    @DisplayName("Replayed messages are counted as duplicates")
    void testDuplicateCounted() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.submit(NeighborEvent.add("B", T0, T0 + 60_000L));
        a.runCycle();

        RoutingMessage message = RoutingMessage.of("B", 1L, T0, Map.of("C", new Advertisement(1, 1.0d)));
        a.deliver(message);
        a.deliver(message);
        a.runCycle();

        AgentCounters.Snapshot counters = a.counters().snapshot();
        assertEquals(1L, counters.getMessagesProcessed());
        assertEquals(1L, counters.getDuplicatesDropped());
    }

    @Test
    @DisplayName("Periodic broadcast fires every update interval")
    void testPeriodicBroadcast() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.submit(NeighborEvent.add("B", T0, T0 + 60_000L));
        a.runCycle();

        clock.advance(9_999L);
        a.runCycle();
        assertEquals(1, b.delivered().size());

        clock.advance(1L);
        a.runCycle();
        assertEquals(2, b.delivered().size());

        clock.advance(10_000L);
        a.runCycle();
        assertEquals(3, b.delivered().size());
        assertEquals(3L, b.delivered().get(2).sequence());
    }

    @Test
    @DisplayName("Window expiry removes the neighbor and its routes without a REMOVE")
    void testWindowExpiry() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.submit(NeighborEvent.add("B", T0, T0 + 5_000L));
        a.runCycle();
        a.deliver(RoutingMessage.of("B", 1L, T0, Map.of("C", new Advertisement(1, 1.0d))));
        a.runCycle();
        assertEquals(2, a.routes().size());

        clock.advanceTo(T0 + 10_000L);
        a.runCycle();

        AgentSnapshot snapshot = a.snapshot();
        assertTrue(snapshot.getNeighbors().isEmpty());
        assertTrue(snapshot.getRoutes().isEmpty());
        assertEquals(2L, snapshot.getCounters().getRoutesRemoved());
    }

    @Test
    @DisplayName("Invalid neighbor events are rejected without breaking the cycle")
    void testInvalidEventRejected() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.submit(NeighborEvent.add("A", T0, T0 + 1_000L));
        a.submit(NeighborEvent.add("B", T0, T0 + 1_000L));
        a.runCycle();

        assertNull(a.route("A"));
        assertNotNull(a.route("B"));
        assertEquals(1L, a.counters().snapshot().getNeighborEventsApplied());
    }

    @Test
    @DisplayName("Full inbound queue refuses further messages")
    void testBoundedInbound() {
        SatelliteAgent a = agent(MeshRoutingConfig.builder().inboundQueueCapacity(1).build(), clock);
        assertTrue(a.deliver(RoutingMessage.of("B", 1L, T0, Map.of())));
        assertFalse(a.deliver(RoutingMessage.of("B", 2L, T0, Map.of())));
        assertEquals(1, a.snapshot().getPendingMessages());
    }

    @Test
    @DisplayName("Stopped agent refuses deliveries and events")
    void testStopRefusesWork() {
        SatelliteAgent a = agent(MeshRoutingConfig.defaults(), clock);
        a.requestStop();
        assertTrue(a.isStopRequested());
        assertFalse(a.deliver(RoutingMessage.of("B", 1L, T0, Map.of())));
        assertFalse(a.submit(NeighborEvent.remove("B")));
    }

    @Test
    @Timeout(value = 10, unit = TimeUnit.SECONDS)
    @DisplayName("Agent loop reacts to queued events and stops on request")
    void testRunLoop() throws Exception {
        MeshRoutingConfig config = MeshRoutingConfig.builder()
                .updateIntervalMillis(200L)
                .livenessCheckIntervalMillis(150L)
                .staleCheckIntervalMillis(200L)
                .jitterMinMillis(5L)
                .jitterMaxMillis(20L)
                .maxIdleWaitMillis(10L)
                .build();
        MeshClock system = MeshClock.system();
        SatelliteAgent a = agent(config, system);
        Thread thread = new Thread(a, "agent-A-test");
        thread.start();
        try {
            long now = system.millis();
            a.submit(NeighborEvent.add("B", now, now + 60_000L));
            while (b.delivered().isEmpty()) {
                Thread.sleep(5L);
            }
            assertTrue(a.isRunning());
            assertNotNull(a.route("B"));
        } finally {
            a.requestStop();
            thread.join(5_000L);
        }
        assertFalse(thread.isAlive());
        assertFalse(a.isRunning());
    }
}
