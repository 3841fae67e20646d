package org.satmesh.routing.metadata;

import org.satmesh.routing.core.MeshRoutingException;
import org.satmesh.routing.core.SatelliteMesh;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Geographic position of a satellite.
 *
 * @param latitude degrees in {@code [-90, 90]}.
 * @param longitude degrees in {@code [-180, 180]}.
 * @param altitude kilometres, finite.
 */
public record Coordinates(double latitude, double longitude, double altitude) {

    public static final String LATITUDE = "latitude";
    public static final String LONGITUDE = "longitude";
    public static final String ALTITUDE = "altitude";

    private static final Set<String> REQUIRED_KEYS = Set.of(LATITUDE, LONGITUDE, ALTITUDE);

    public Coordinates {
        if (!Double.isFinite(latitude) || latitude < -90.0d || latitude > 90.0d) {
            throw invalid("latitude must be within [-90, 90], got " + latitude);
        }
        if (!Double.isFinite(longitude) || longitude < -180.0d || longitude > 180.0d) {
            throw invalid("longitude must be within [-180, 180], got " + longitude);
        }
        if (!Double.isFinite(altitude)) {
            throw invalid("altitude must be finite, got " + altitude);
        }
    }

    /**
     * Builds coordinates from a keyed update; all three keys are required.
     *
     * @throws MeshRoutingException with {@link SatelliteMesh#REASON_INVALID_COORDINATES}.
     */
    public static Coordinates fromMap(Map<String, ? extends Number> values) {
        Objects.requireNonNull(values, "values");
        Set<String> missing = new TreeSet<>();
        for (String key : REQUIRED_KEYS) {
            if (values.get(key) == null) {
                missing.add(key);
            }
        }
        if (!missing.isEmpty()) {
            throw invalid("coordinates must contain all required keys " + new TreeSet<>(REQUIRED_KEYS)
                    + ", missing " + missing);
        }
        return new Coordinates(
                values.get(LATITUDE).doubleValue(),
                values.get(LONGITUDE).doubleValue(),
                values.get(ALTITUDE).doubleValue()
        );
    }

    private static MeshRoutingException invalid(String message) {
        return new MeshRoutingException(SatelliteMesh.REASON_INVALID_COORDINATES, message);
    }
}
