package org.satmesh.routing.neighbor;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;
import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;

import java.util.Objects;

/**
 * Canonical neighbor-event payload consumed by an agent's neighbor-event queue.
 * <p>
 * Three shapes exist:
 * </p>
 * <ul>
 * <li>{@link Type#ADD}: neighbor id, visibility window and quality (default {@code 1.0}).</li>
 * <li>{@link Type#UPDATE}: neighbor id plus any subset of quality, signal and bandwidth;
 * absent fields are {@code null} and keep their current value.</li>
 * <li>{@link Type#REMOVE}: neighbor id only.</li>
 * </ul>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class NeighborEvent {

    /**
     * Event kind.
     */
    public enum Type {
        ADD,
        UPDATE,
        REMOVE
    }

    /** Quality assumed by an ADD without an explicit quality. */
    public static final double DEFAULT_QUALITY = 1.0d;

    private final Type type;
    private final String neighborId;
    /** Window start for ADD; {@code 0} otherwise. */
    private final long startTime;
    /** Window end for ADD; {@code 0} otherwise. */
    private final long endTime;
    /** Quality for ADD (never null) and optional for UPDATE. */
    private final Double quality;
    /** Optional signal strength for UPDATE. */
    private final Double signalStrength;
    /** Optional bandwidth for UPDATE. */
    private final Double bandwidthAvailable;

    private NeighborEvent(
            Type type,
            String neighborId,
            long startTime,
            long endTime,
            Double quality,
            Double signalStrength,
            Double bandwidthAvailable
    ) {
        this.type = type;
        this.neighborId = requireNeighborId(neighborId);
        this.startTime = startTime;
        this.endTime = endTime;
        this.quality = quality;
        this.signalStrength = signalStrength;
        this.bandwidthAvailable = bandwidthAvailable;
    }

    /**
     * ADD with default quality.
     */
    public static NeighborEvent add(String neighborId, long startTime, long endTime) {
        return add(neighborId, startTime, endTime, DEFAULT_QUALITY);
    }

    /**
     * ADD with explicit quality.
     *
     * @param neighborId neighbor node id.
     * @param startTime inclusive window start.
     * @param endTime inclusive window end; must be {@code >= startTime}.
     * @param quality link quality in {@code [0.0, 1.0]}.
     * @return immutable ADD event.
     */
    public static NeighborEvent add(String neighborId, long startTime, long endTime, double quality) {
        if (endTime < startTime) {
            throw invalid("ADD window end must be >= start for neighbor " + neighborId);
        }
        requireQuality(quality);
        return new NeighborEvent(Type.ADD, neighborId, startTime, endTime, quality, null, null);
    }

    /**
     * UPDATE merging only the non-null fields.
     *
     * @param neighborId neighbor node id.
     * @param quality optional new quality.
     * @param signalStrength optional new signal strength (dBm).
     * @param bandwidthAvailable optional new bandwidth (Mbps).
     * @return immutable UPDATE event.
     */
    public static NeighborEvent update(
            String neighborId,
            Double quality,
            Double signalStrength,
            Double bandwidthAvailable
    ) {
        if (quality != null) {
            requireQuality(quality);
        }
        if (signalStrength != null && !Double.isFinite(signalStrength)) {
            throw invalid("UPDATE signal strength must be finite");
        }
        if (bandwidthAvailable != null && (!Double.isFinite(bandwidthAvailable) || bandwidthAvailable < 0.0d)) {
            throw invalid("UPDATE bandwidth must be finite and >= 0");
        }
        return new NeighborEvent(Type.UPDATE, neighborId, 0L, 0L, quality, signalStrength, bandwidthAvailable);
    }

    /**
     * UPDATE of the quality only.
     */
    public static NeighborEvent updateQuality(String neighborId, double quality) {
        return update(neighborId, quality, null, null);
    }

    /**
     * REMOVE of one neighbor.
     */
    public static NeighborEvent remove(String neighborId) {
        return new NeighborEvent(Type.REMOVE, neighborId, 0L, 0L, null, null, null);
    }

    private static String requireNeighborId(String neighborId) {
        String id = Objects.requireNonNull(neighborId, "neighborId");
        if (id.isBlank()) {
            throw invalid("neighborId must be non-blank");
        }
        return id;
    }

    private static void requireQuality(double quality) {
        if (!Double.isFinite(quality) || quality < 0.0d || quality > 1.0d) {
            throw invalid("quality must be within [0.0, 1.0], got " + quality);
        }
    }

    private static MeshRoutingException invalid(String message) {
        return new MeshRoutingException(SatelliteMesh.REASON_INVALID_NEIGHBOR_EVENT, message);
    }
}
