package org.satmesh.routing.core;

import org.satmesh.routing.agent.AgentSnapshot;
import org.satmesh.routing.neighbor.NeighborInfo;
import org.satmesh.routing.table.RouteEntry;

import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Shared assertions for mesh scenario tests.
 */
final class MeshTestSupport {

    static final long T0 = 1_700_000_000_000L;
    static final long STEP_MILLIS = 100L;
    static final long ONE_HOUR = 3_600_000L;

    private MeshTestSupport() {
    }

    static String sat(int index) {
        return "SAT-" + index;
    }

    /**
     * Every route forwards through a currently active neighbor of its owner.
     */
    static void assertReferentialIntegrity(MeshSnapshot snapshot) {
        for (AgentSnapshot agent : snapshot.getAgents().values()) {
            Set<String> activeNeighbors = agent.getNeighbors().stream()
                    .filter(NeighborInfo::active)
                    .map(NeighborInfo::neighborId)
                    .collect(Collectors.toSet());
            for (RouteEntry route : agent.getRoutes().values()) {
                assertTrue(activeNeighbors.contains(route.nextHop()),
                        agent.getNodeId() + " routes " + route.destination() + " via inactive or unknown neighbor "
                                + route.nextHop());
            }
        }
    }

    static void assertHorizon(MeshSnapshot snapshot, int kHops) {
        for (AgentSnapshot agent : snapshot.getAgents().values()) {
            for (RouteEntry route : agent.getRoutes().values()) {
                assertTrue(route.hopCount() <= kHops,
                        agent.getNodeId() + " holds " + route + " beyond horizon " + kHops);
            }
        }
    }

    static void assertRoute(MeshSnapshot snapshot, String from, String to, String nextHop, int hopCount) {
        RouteEntry route = snapshot.route(from, to);
        assertNotNull(route, from + " has no route to " + to);
        assertEquals(nextHop, route.nextHop(), from + " -> " + to + " next hop");
        assertEquals(hopCount, route.hopCount(), from + " -> " + to + " hop count");
    }

    /**
     * Builds a ring {@code SAT-1 .. SAT-n} with every link open for an hour.
     */
    static void ring(SatelliteMesh mesh, int nodes, double quality) {
        for (int i = 1; i <= nodes; i++) {
            mesh.addNode(sat(i));
        }
        for (int i = 1; i <= nodes; i++) {
            mesh.link(sat(i), sat(i % nodes + 1), T0, T0 + ONE_HOUR, quality);
        }
    }

    /**
     * Ring distance between {@code SAT-i} and {@code SAT-j}.
     */
    static int ringDistance(int i, int j, int nodes) {
        int forward = Math.floorMod(j - i, nodes);
        return Math.min(forward, nodes - forward);
    }

    /**
     * Neighbor of {@code SAT-i} on the shortest ring path to {@code SAT-j} (distance must be unique).
     */
    static String ringNextHop(int i, int j, int nodes) {
        int forward = Math.floorMod(j - i, nodes);
        int step = forward <= nodes - forward ? 1 : -1;
        return sat(Math.floorMod(i - 1 + step, nodes) + 1);
    }
}
