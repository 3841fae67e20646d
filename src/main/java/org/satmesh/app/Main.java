package org.satmesh.app;

import org.satmesh.core.time.VirtualMeshClock;
import org.satmesh.routing.agent.AgentSnapshot;
import org.satmesh.routing.core.MeshRoutingConfig;
import org.satmesh.routing.core.MeshSnapshot;
import org.satmesh.routing.core.SatelliteMesh;
import org.satmesh.routing.probe.ConvergenceProbe;
import org.satmesh.routing.probe.ConvergenceResult;
import org.satmesh.routing.table.RouteEntry;

import java.io.PrintStream;
import java.util.Locale;

/**
 * Ring-mesh demo for local smoke runs.
 * <p>
 * Usage: {@code Main [nodes] [kHops]}. Builds a ring of {@code nodes} satellites (default 5),
 * runs it under virtual time until the routing tables converge and prints every table.
 * </p>
 */
public class Main {
    static final long START_MILLIS = 1_700_000_000_000L;
    static final long STEP_MILLIS = 100L;
    static final double RING_LINK_QUALITY = 0.9d;
    static final int STABLE_SAMPLES = 20;

    /**
     * Launches the ring demo.
     *
     * @param args optional node count and horizon.
     */
    public static void main(String[] args) {
        int status = run(args, System.out);
        if (status != 0) {
            System.exit(status);
        }
    }

    static int run(String[] args, PrintStream out) {
        int nodes;
        int kHops;
        try {
            nodes = args.length > 0 ? Integer.parseInt(args[0]) : 5;
            kHops = args.length > 1 ? Integer.parseInt(args[1]) : 3;
        } catch (NumberFormatException ex) {
            out.println("usage: Main [nodes] [kHops]");
            return 2;
        }
        if (nodes < 2 || kHops < 1) {
            out.println("usage: Main [nodes>=2] [kHops>=1]");
            return 2;
        }

        VirtualMeshClock clock = new VirtualMeshClock(START_MILLIS);
        MeshRoutingConfig config = MeshRoutingConfig.builder().kHops(kHops).build();
        try (SatelliteMesh mesh = new SatelliteMesh(config, clock)) {
            for (int i = 1; i <= nodes; i++) {
                mesh.addNode(nodeId(i));
            }
            long windowEnd = START_MILLIS + 3_600_000L;
            for (int i = 1; i <= nodes; i++) {
                // A two-node ring is a single link.
                if (nodes > 2 || i == 1) {
                    mesh.link(nodeId(i), nodeId(i % nodes + 1), START_MILLIS, windowEnd, RING_LINK_QUALITY);
                }
            }

            ConvergenceProbe probe = new ConvergenceProbe(STABLE_SAMPLES);
            ConvergenceResult result = probe.await(
                    mesh::snapshot,
                    () -> {
                        clock.advance(STEP_MILLIS);
                        mesh.stepAll();
                    },
                    10_000
            );
            MeshSnapshot snapshot = result.getFinalSnapshot();
            out.printf(Locale.ROOT, "ring of %d nodes, k=%d: %s after %d samples (%d ms virtual)%n",
                    nodes,
                    kHops,
                    result.isConverged() ? "converged" : "NOT converged",
                    result.getSamples(),
                    snapshot.getTakenAtMillis() - START_MILLIS);
            for (AgentSnapshot agent : snapshot.getAgents().values()) {
                out.println(agent.getNodeId());
                for (RouteEntry route : agent.getRoutes().values()) {
                    out.printf(Locale.ROOT, "  -> %s via %s hops=%d cost=%.3f%n",
                            route.destination(), route.nextHop(), route.hopCount(), route.cost());
                }
            }
            return result.isConverged() ? 0 : 1;
        }
    }

    static String nodeId(int index) {
        return "SAT-" + index;
    }
}
