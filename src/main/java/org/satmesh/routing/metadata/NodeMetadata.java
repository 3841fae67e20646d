package org.satmesh.routing.metadata;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Lock-guarded holder of one agent's {@link SatelliteMetadata} and {@link Coordinates}.
 * <p>
 * Reads and writes both go through the same exclusive lock. Writers validate first and
 * publish a new immutable value only on success, so a failed call keeps the prior value.
 * </p>
 */
public final class NodeMetadata {

    private final ReentrantLock lock = new ReentrantLock();
    private SatelliteMetadata metadata;
    private Coordinates coordinates;

    public NodeMetadata(SatelliteMetadata metadata, Coordinates coordinates) {
        this.metadata = Objects.requireNonNull(metadata, "metadata").validated();
        this.coordinates = Objects.requireNonNull(coordinates, "coordinates");
    }

    /**
     * Default attributes positioned at the origin, 550 km up.
     */
    public static NodeMetadata withDefaults() {
        return new NodeMetadata(SatelliteMetadata.builder().build(), new Coordinates(0.0d, 0.0d, 550.0d));
    }

    /**
     * Attributes drawn from the ranges of a typical LEO fleet.
     */
    public static NodeMetadata randomized(Random random) {
        Objects.requireNonNull(random, "random");
        SatelliteMetadata metadata = SatelliteMetadata.builder()
                .computationalCapacity(uniform(random, 1000.0d, 2000.0d))
                .bandwidthCapacity(uniform(random, 100.0d, 1000.0d))
                .processingPower(uniform(random, 1.0d, 4.0d))
                .communicationRange(uniform(random, 1000.0d, 2000.0d))
                .packetLossRate(uniform(random, 0.0d, 0.1d))
                .transmissionDelay(uniform(random, 10.0d, 100.0d))
                .bufferSize(pick(random, List.of(512, 1024, 2048)))
                .queueCapacity(500 + random.nextInt(1501))
                .maxBandwidthUtilization(uniform(random, 0.6d, 0.9d))
                .minSignalStrength(uniform(random, -100.0d, -80.0d))
                .frequencyBand(pick(random, List.of("Ka", "Ku", "X")))
                .modulationScheme(pick(random, List.of("BPSK", "QPSK", "8PSK")))
                .build();
        Coordinates coordinates = new Coordinates(
                uniform(random, -90.0d, 90.0d),
                uniform(random, -180.0d, 180.0d),
                uniform(random, 500.0d, 1000.0d)
        );
        return new NodeMetadata(metadata, coordinates);
    }

    public SatelliteMetadata snapshot() {
        lock.lock();
        try {
            return metadata;
        } finally {
            lock.unlock();
        }
    }

    public Coordinates coordinates() {
        lock.lock();
        try {
            return coordinates;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies named updates atomically; see {@link SatelliteMetadata#withUpdates(Map)}.
     *
     * @return the published metadata.
     */
    public SatelliteMetadata update(Map<String, ?> updates) {
        lock.lock();
        try {
            metadata = metadata.withUpdates(updates);
            return metadata;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces the coordinates; all of latitude, longitude and altitude are required.
     *
     * @return the published coordinates.
     */
    public Coordinates updateCoordinates(Map<String, ? extends Number> values) {
        Coordinates next = Coordinates.fromMap(values);
        lock.lock();
        try {
            coordinates = next;
            return next;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Accumulates transmission counters.
     *
     * @return the published metadata.
     */
    public SatelliteMetadata recordTransmission(long packetsSent, long packetsReceived) {
        lock.lock();
        try {
            metadata = metadata.withTransmission(packetsSent, packetsReceived);
            return metadata;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return current throughput in Mbps.
     */
    public double throughput() {
        return snapshot().throughput();
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static <T> T pick(Random random, List<T> choices) {
        return choices.get(random.nextInt(choices.size()));
    }
}
