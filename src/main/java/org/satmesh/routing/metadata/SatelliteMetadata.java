package org.satmesh.routing.metadata;

import lombok.Builder;
import lombok.Value;
import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.BiConsumer;

/**
 * Immutable capacity and performance attributes of one satellite.
 * <p>
 * Named updates go through {@link #withUpdates(Map)}: every field name and value is checked
 * before a new instance is built, so a rejected update leaves no partial change behind.
 * </p>
 */
@Value
@Builder(toBuilder = true)
public class SatelliteMetadata {

    /** Computational capacity in MIPS. */
    @Builder.Default
    double computationalCapacity = 1500.0d;
    /** Bandwidth capacity in Mbps. */
    @Builder.Default
    double bandwidthCapacity = 500.0d;
    /** Processing power in GHz. */
    @Builder.Default
    double processingPower = 2.5d;
    /** Communication range in km. */
    @Builder.Default
    double communicationRange = 1500.0d;

    /** Packet loss rate in {@code [0, 1]}. */
    @Builder.Default
    double packetLossRate = 0.0d;
    /** Transmission delay in milliseconds. */
    @Builder.Default
    double transmissionDelay = 0.0d;
    /** Buffer size in KB. */
    @Builder.Default
    int bufferSize = 1024;
    /** Queue capacity in packets. */
    @Builder.Default
    int queueCapacity = 1000;

    /** Usable share of the bandwidth capacity in {@code [0, 1]}. */
    @Builder.Default
    double maxBandwidthUtilization = 0.8d;
    /** Minimum usable signal strength in dBm. */
    @Builder.Default
    double minSignalStrength = -90.0d;
    /** Radio frequency band. */
    @Builder.Default
    String frequencyBand = "Ka";
    /** Modulation scheme. */
    @Builder.Default
    String modulationScheme = "QPSK";

    @Builder.Default
    long totalPacketsSent = 0L;
    @Builder.Default
    long totalPacketsReceived = 0L;
    /** {@code totalPacketsReceived / totalPacketsSent}, {@code 1.0} before any traffic. */
    @Builder.Default
    double successfulTransmissionRate = 1.0d;

    private static final Map<String, FieldBinding> FIELDS = buildFieldBindings();

    private record FieldBinding(Class<?> valueType, BiConsumer<SatelliteMetadataBuilder, Object> setter) {
    }

    /**
     * @return {@code bandwidthCapacity * maxBandwidthUtilization} in Mbps.
     */
    public double throughput() {
        return bandwidthCapacity * maxBandwidthUtilization;
    }

    /**
     * Accumulates packet counters and recomputes the success rate.
     *
     * @param packetsSent packets sent since the last call, {@code >= 0}.
     * @param packetsReceived packets received since the last call, {@code >= 0}.
     * @return updated copy.
     */
    public SatelliteMetadata withTransmission(long packetsSent, long packetsReceived) {
        if (packetsSent < 0 || packetsReceived < 0) {
            throw invalidValue("packet counts must be >= 0");
        }
        long sent = Math.addExact(totalPacketsSent, packetsSent);
        long received = Math.addExact(totalPacketsReceived, packetsReceived);
        double rate = sent > 0 ? (double) received / (double) sent : successfulTransmissionRate;
        return toBuilder()
                .totalPacketsSent(sent)
                .totalPacketsReceived(received)
                .successfulTransmissionRate(rate)
                .build();
    }

    /**
     * Applies named field updates atomically.
     *
     * @param updates field name to new value; names are the Java property names.
     * @return updated copy.
     * @throws MeshRoutingException {@link SatelliteMesh#REASON_UNKNOWN_METADATA_FIELD} when any name
     *         is unknown, {@link SatelliteMesh#REASON_INVALID_METADATA_VALUE} when any value has the
     *         wrong type or domain.
     */
    public SatelliteMetadata withUpdates(Map<String, ?> updates) {
        Objects.requireNonNull(updates, "updates");
        Set<String> unknown = new TreeSet<>();
        for (String name : updates.keySet()) {
            if (name == null || !FIELDS.containsKey(name)) {
                unknown.add(String.valueOf(name));
            }
        }
        if (!unknown.isEmpty()) {
            throw new MeshRoutingException(
                    SatelliteMesh.REASON_UNKNOWN_METADATA_FIELD,
                    "unknown metadata field(s) " + unknown + ", known: " + fieldNames()
            );
        }

        SatelliteMetadataBuilder builder = toBuilder();
        for (Map.Entry<String, ?> entry : updates.entrySet()) {
            FieldBinding binding = FIELDS.get(entry.getKey());
            Object value = entry.getValue();
            if (value == null || !binding.valueType().isInstance(value)) {
                throw invalidValue("metadata field " + entry.getKey() + " expects "
                        + binding.valueType().getSimpleName() + ", got " + describe(value));
            }
            try {
                binding.setter().accept(builder, value);
            } catch (ArithmeticException ex) {
                throw new MeshRoutingException(
                        SatelliteMesh.REASON_INVALID_METADATA_VALUE,
                        "metadata field " + entry.getKey() + " out of range: " + value,
                        ex
                );
            }
        }
        return builder.build().validated();
    }

    /**
     * @return names accepted by {@link #withUpdates(Map)}, sorted.
     */
    public static List<String> fieldNames() {
        List<String> names = new ArrayList<>(FIELDS.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Checks value domains.
     *
     * @return this instance.
     */
    public SatelliteMetadata validated() {
        requireNonNegative(computationalCapacity, "computationalCapacity");
        requireNonNegative(bandwidthCapacity, "bandwidthCapacity");
        requireNonNegative(processingPower, "processingPower");
        requireNonNegative(communicationRange, "communicationRange");
        requireNonNegative(transmissionDelay, "transmissionDelay");
        requireUnitInterval(packetLossRate, "packetLossRate");
        requireUnitInterval(maxBandwidthUtilization, "maxBandwidthUtilization");
        requireUnitInterval(successfulTransmissionRate, "successfulTransmissionRate");
        if (!Double.isFinite(minSignalStrength)) {
            throw invalidValue("minSignalStrength must be finite");
        }
        if (bufferSize < 0 || queueCapacity < 0 || totalPacketsSent < 0 || totalPacketsReceived < 0) {
            throw invalidValue("sizes and packet counters must be >= 0");
        }
        if (frequencyBand == null || frequencyBand.isBlank() || modulationScheme == null || modulationScheme.isBlank()) {
            throw invalidValue("frequencyBand and modulationScheme must be non-blank");
        }
        return this;
    }

    private static Map<String, FieldBinding> buildFieldBindings() {
        LinkedHashMap<String, FieldBinding> fields = new LinkedHashMap<>();
        fields.put("computationalCapacity", number((b, v) -> b.computationalCapacity(v.doubleValue())));
        fields.put("bandwidthCapacity", number((b, v) -> b.bandwidthCapacity(v.doubleValue())));
        fields.put("processingPower", number((b, v) -> b.processingPower(v.doubleValue())));
        fields.put("communicationRange", number((b, v) -> b.communicationRange(v.doubleValue())));
        fields.put("packetLossRate", number((b, v) -> b.packetLossRate(v.doubleValue())));
        fields.put("transmissionDelay", number((b, v) -> b.transmissionDelay(v.doubleValue())));
        fields.put("bufferSize", integral((b, v) -> b.bufferSize(Math.toIntExact(v))));
        fields.put("queueCapacity", integral((b, v) -> b.queueCapacity(Math.toIntExact(v))));
        fields.put("maxBandwidthUtilization", number((b, v) -> b.maxBandwidthUtilization(v.doubleValue())));
        fields.put("minSignalStrength", number((b, v) -> b.minSignalStrength(v.doubleValue())));
        fields.put("frequencyBand", new FieldBinding(String.class, (b, v) -> b.frequencyBand((String) v)));
        fields.put("modulationScheme", new FieldBinding(String.class, (b, v) -> b.modulationScheme((String) v)));
        fields.put("totalPacketsSent", integral(SatelliteMetadataBuilder::totalPacketsSent));
        fields.put("totalPacketsReceived", integral(SatelliteMetadataBuilder::totalPacketsReceived));
        fields.put("successfulTransmissionRate",
                number((b, v) -> b.successfulTransmissionRate(v.doubleValue())));
        return Map.copyOf(fields);
    }

    private static FieldBinding number(BiConsumer<SatelliteMetadataBuilder, Number> setter) {
        return new FieldBinding(Number.class, (b, v) -> setter.accept(b, (Number) v));
    }

    private static FieldBinding integral(IntegralSetter setter) {
        return new FieldBinding(Number.class, (b, v) -> {
            Number number = (Number) v;
            if (number instanceof Double || number instanceof Float) {
                double d = number.doubleValue();
                if (d != Math.rint(d) || Double.isInfinite(d)) {
                    throw invalidValue("integral metadata field got fractional value " + d);
                }
            }
            setter.accept(b, number.longValue());
        });
    }

    @FunctionalInterface
    private interface IntegralSetter {
        void accept(SatelliteMetadataBuilder builder, long value);
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + "(" + value + ")";
    }

    private static void requireNonNegative(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d) {
            throw invalidValue(fieldName + " must be finite and >= 0, got " + value);
        }
    }

    private static void requireUnitInterval(double value, String fieldName) {
        if (!Double.isFinite(value) || value < 0.0d || value > 1.0d) {
            throw invalidValue(fieldName + " must be within [0.0, 1.0], got " + value);
        }
    }

    private static MeshRoutingException invalidValue(String message) {
        return new MeshRoutingException(SatelliteMesh.REASON_INVALID_METADATA_VALUE, message);
    }
}
