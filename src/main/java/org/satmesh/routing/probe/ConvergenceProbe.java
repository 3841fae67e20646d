package org.satmesh.routing.probe;

import org.satmesh.routing.agent.AgentSnapshot;
import org.satmesh.routing.core.MeshSnapshot;
import org.satmesh.routing.table.RouteEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.function.Supplier;

/**
 * Read-only convergence observer.
 * <p>
 * Each sample is reduced to a fingerprint {@code node -> destination -> (nextHop, hopCount, cost)};
 * route timestamps are excluded because periodic refreshes move them without changing routing.
 * The mesh counts as converged once {@code requiredStableSamples} consecutive fingerprints are
 * identical.
 * </p>
 */
public final class ConvergenceProbe {
    private static final Logger log = LoggerFactory.getLogger(ConvergenceProbe.class);

    /**
     * Timestamp-free view of one route.
     */
    public record RouteFingerprint(String nextHop, int hopCount, double cost) {
    }

    private final int requiredStableSamples;
    private Map<String, Map<String, RouteFingerprint>> lastFingerprint;
    private int stableSamples;

    /**
     * @param requiredStableSamples identical consecutive samples required, {@code >= 2}.
     */
    public ConvergenceProbe(int requiredStableSamples) {
        if (requiredStableSamples < 2) {
            throw new IllegalArgumentException("requiredStableSamples must be >= 2");
        }
        this.requiredStableSamples = requiredStableSamples;
    }

    /**
     * Reduces a snapshot to its routing fingerprint.
     */
    public static Map<String, Map<String, RouteFingerprint>> fingerprint(MeshSnapshot snapshot) {
        Map<String, Map<String, RouteFingerprint>> nodes = new TreeMap<>();
        for (Map.Entry<String, AgentSnapshot> agent : snapshot.getAgents().entrySet()) {
            Map<String, RouteFingerprint> routes = new TreeMap<>();
            for (RouteEntry entry : agent.getValue().getRoutes().values()) {
                routes.put(entry.destination(), new RouteFingerprint(entry.nextHop(), entry.hopCount(), entry.cost()));
            }
            nodes.put(agent.getKey(), Collections.unmodifiableMap(routes));
        }
        return Collections.unmodifiableMap(nodes);
    }

    /**
     * Records one sample.
     *
     * @return true when the last {@code requiredStableSamples} samples were identical.
     */
    public boolean observe(MeshSnapshot snapshot) {
        Map<String, Map<String, RouteFingerprint>> current = fingerprint(Objects.requireNonNull(snapshot, "snapshot"));
        if (current.equals(lastFingerprint)) {
            stableSamples++;
        } else {
            lastFingerprint = current;
            stableSamples = 1;
        }
        return isConverged();
    }

    public boolean isConverged() {
        return stableSamples >= requiredStableSamples;
    }

    /**
     * Forgets every sample taken so far.
     */
    public void reset() {
        lastFingerprint = null;
        stableSamples = 0;
    }

    /**
     * Samples until convergence, running {@code betweenSamples} (for example a virtual-time step)
     * after each non-converged sample.
     *
     * @param sampler snapshot source.
     * @param betweenSamples step run between two samples.
     * @param maxSamples sample budget.
     */
    public ConvergenceResult await(Supplier<MeshSnapshot> sampler, Runnable betweenSamples, int maxSamples) {
        Objects.requireNonNull(sampler, "sampler");
        Objects.requireNonNull(betweenSamples, "betweenSamples");
        if (maxSamples <= 0) {
            throw new IllegalArgumentException("maxSamples must be > 0");
        }
        MeshSnapshot last = null;
        for (int sample = 1; sample <= maxSamples; sample++) {
            last = sampler.get();
            if (observe(last)) {
                log.debug("converged after {} samples", sample);
                return new ConvergenceResult(true, sample, last);
            }
            betweenSamples.run();
        }
        log.debug("not converged after {} samples", maxSamples);
        return new ConvergenceResult(false, maxSamples, last);
    }

    /**
     * Samples in real time, sleeping {@code sampleIntervalMillis} between samples, until
     * convergence or {@code timeoutMillis}.
     *
     * @throws InterruptedException when interrupted while sleeping.
     */
    public ConvergenceResult awaitRealTime(
            Supplier<MeshSnapshot> sampler,
            long sampleIntervalMillis,
            long timeoutMillis
    ) throws InterruptedException {
        Objects.requireNonNull(sampler, "sampler");
        if (sampleIntervalMillis <= 0 || timeoutMillis <= 0) {
            throw new IllegalArgumentException("sampleIntervalMillis and timeoutMillis must be > 0");
        }
        long deadlineNanos = System.nanoTime() + timeoutMillis * 1_000_000L;
        MeshSnapshot last = null;
        int samples = 0;
        while (true) {
            last = sampler.get();
            samples++;
            if (observe(last)) {
                log.debug("converged after {} samples", samples);
                return new ConvergenceResult(true, samples, last);
            }
            if (System.nanoTime() >= deadlineNanos) {
                log.debug("not converged within {} ms", timeoutMillis);
                return new ConvergenceResult(false, samples, last);
            }
            Thread.sleep(sampleIntervalMillis);
        }
    }
}
