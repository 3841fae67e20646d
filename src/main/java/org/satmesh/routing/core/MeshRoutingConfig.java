package org.satmesh.routing.core;

import lombok.Builder;
import lombok.Value;
import org.satmesh.routing.cost.LinkCostStrategyRegistry;

/**
 * Immutable protocol and runtime configuration shared by every agent of one mesh.
 * <p>
 * All durations are milliseconds of mesh time. Call {@link #validate()} before binding a
 * config to agents; {@link SatelliteMesh} does so on construction.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class MeshRoutingConfig {

    /** Routing horizon: maximum accepted hop count. */
    @Builder.Default
    int kHops = 3;

    /** Period of the unconditional full-table broadcast. */
    @Builder.Default
    long updateIntervalMillis = 10_000L;

    /** Period of the neighbor liveness check; a neighbor silent for twice this is soft-inactive. */
    @Builder.Default
    long livenessCheckIntervalMillis = 10_000L;

    /** Period of stale-route collection. */
    @Builder.Default
    long staleCheckIntervalMillis = 10_000L;

    /** Maximum route age; {@code <= 0} selects three update intervals. */
    @Builder.Default
    long maxRouteAgeMillis = 0L;

    /** Lower bound of the triggered re-broadcast jitter. */
    @Builder.Default
    long jitterMinMillis = 100L;

    /** Upper bound (inclusive) of the triggered re-broadcast jitter. */
    @Builder.Default
    long jitterMaxMillis = 300L;

    /** Longest real-time wait of an idle agent loop before it re-reads the clock. */
    @Builder.Default
    long maxIdleWaitMillis = 50L;

    /** Capacity of each agent's inbound message queue. */
    @Builder.Default
    int inboundQueueCapacity = 4096;

    /** Sequence numbers retained per sender before the seen-set floor is raised. */
    @Builder.Default
    int seenSetRetention = 1024;

    /** Link-cost strategy id resolved through {@link LinkCostStrategyRegistry}. */
    @Builder.Default
    String linkCostStrategyId = LinkCostStrategyRegistry.STRATEGY_COMPOSITE;

    /** Seed mixed with each node id to derive that agent's jitter sequence. */
    @Builder.Default
    long jitterSeed = 0x5A7E_11E5L;

    /**
     * Returns the route age limit actually enforced.
     */
    public long effectiveMaxRouteAgeMillis() {
        return maxRouteAgeMillis > 0 ? maxRouteAgeMillis : Math.multiplyExact(updateIntervalMillis, 3L);
    }

    /**
     * Soft-liveness timeout: twice the liveness-check interval.
     */
    public long livenessTimeoutMillis() {
        return Math.multiplyExact(livenessCheckIntervalMillis, 2L);
    }

    /**
     * Validates value domains and cross-field constraints.
     *
     * @return this config, for chaining.
     * @throws MeshRoutingException with {@link SatelliteMesh#REASON_INVALID_CONFIG}.
     */
    public MeshRoutingConfig validate() {
        requirePositive(kHops, "kHops");
        requirePositive(updateIntervalMillis, "updateIntervalMillis");
        requirePositive(livenessCheckIntervalMillis, "livenessCheckIntervalMillis");
        requirePositive(staleCheckIntervalMillis, "staleCheckIntervalMillis");
        requirePositive(maxIdleWaitMillis, "maxIdleWaitMillis");
        requirePositive(inboundQueueCapacity, "inboundQueueCapacity");
        requirePositive(seenSetRetention, "seenSetRetention");
        if (jitterMinMillis < 0 || jitterMaxMillis < jitterMinMillis) {
            throw invalid("jitter bounds must satisfy 0 <= jitterMinMillis <= jitterMaxMillis, got ["
                    + jitterMinMillis + ", " + jitterMaxMillis + "]");
        }
        if (linkCostStrategyId == null || linkCostStrategyId.isBlank()) {
            throw invalid("linkCostStrategyId must be non-blank");
        }
        // Neighbors refresh liveness by broadcasting; a shorter timeout would flap every link.
        if (livenessTimeoutMillis() <= updateIntervalMillis) {
            throw invalid("liveness timeout (2 x livenessCheckIntervalMillis = " + livenessTimeoutMillis()
                    + ") must exceed updateIntervalMillis (" + updateIntervalMillis + ")");
        }
        return this;
    }

    /**
     * Returns the default runtime configuration.
     */
    public static MeshRoutingConfig defaults() {
        return MeshRoutingConfig.builder().build();
    }

    private static void requirePositive(long value, String fieldName) {
        if (value <= 0) {
            throw invalid(fieldName + " must be > 0, got " + value);
        }
    }

    private static MeshRoutingException invalid(String message) {
        return new MeshRoutingException(SatelliteMesh.REASON_INVALID_CONFIG, message);
    }
}
