package org.satmesh.routing.neighbor;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Objects;

/**
 * Immutable per-neighbor link state owned by one agent's {@link NeighborTable}.
 * <p>
 * Window contract: the link is usable at {@code now} only when it is marked active and
 * {@code startTime <= now <= endTime} (both bounds inclusive). A link with
 * {@code now > endTime} is expired and is removed by the next liveness check.
 * </p>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class NeighborInfo {

    /** Signal strength assumed when an ADD carries none. */
    public static final double DEFAULT_SIGNAL_STRENGTH_DBM = -60.0d;
    /** Available bandwidth assumed when an ADD carries none. */
    public static final double DEFAULT_BANDWIDTH_MBPS = 100.0d;

    /** Neighbor node id. */
    private final String neighborId;
    /** Link quality in {@code [0.0, 1.0]}. */
    private final double quality;
    /** Inclusive window start, epoch millis. */
    private final long startTime;
    /** Inclusive window end, epoch millis. */
    private final long endTime;
    /** Last time an event or advertisement proved the neighbor alive. */
    private final long lastSeen;
    /** Received signal strength in dBm. */
    private final double signalStrength;
    /** Available link bandwidth in Mbps. */
    private final double bandwidthAvailable;
    /** Liveness flag; cleared by a liveness timeout, set again by any sign of life. */
    private final boolean active;

    @Builder(toBuilder = true)
    private NeighborInfo(
            String neighborId,
            double quality,
            long startTime,
            long endTime,
            long lastSeen,
            double signalStrength,
            double bandwidthAvailable,
            boolean active
    ) {
        this.neighborId = Objects.requireNonNull(neighborId, "neighborId");
        if (!Double.isFinite(quality) || quality < 0.0d || quality > 1.0d) {
            throw new IllegalArgumentException("quality must be within [0.0, 1.0], got " + quality);
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must be >= startTime");
        }
        if (!Double.isFinite(signalStrength)) {
            throw new IllegalArgumentException("signalStrength must be finite");
        }
        if (!Double.isFinite(bandwidthAvailable) || bandwidthAvailable < 0.0d) {
            throw new IllegalArgumentException("bandwidthAvailable must be finite and >= 0");
        }
        this.quality = quality;
        this.startTime = startTime;
        this.endTime = endTime;
        this.lastSeen = lastSeen;
        this.signalStrength = signalStrength;
        this.bandwidthAvailable = bandwidthAvailable;
        this.active = active;
    }

    /**
     * @param now current mesh time.
     * @return true when {@code now} lies inside the visibility window.
     */
    public boolean withinWindow(long now) {
        return startTime <= now && now <= endTime;
    }

    /**
     * @param now current mesh time.
     * @return true when the window has closed.
     */
    public boolean expiredAt(long now) {
        return now > endTime;
    }

    /**
     * @param now current mesh time.
     * @return true when the link may carry traffic right now.
     */
    public boolean usableAt(long now) {
        return active && withinWindow(now);
    }

    /**
     * Builder seeded with the default signal and bandwidth figures.
     */
    public static final class NeighborInfoBuilder {
        private double signalStrength = DEFAULT_SIGNAL_STRENGTH_DBM;
        private double bandwidthAvailable = DEFAULT_BANDWIDTH_MBPS;
    }
}
