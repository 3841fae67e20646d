package org.satmesh.topology;

import java.util.Objects;

/**
 * One row of a parsed link-interval table.
 *
 * @param source source endpoint name, {@code "<node> <suffix>"} or a bare node id.
 * @param destination destination endpoint name.
 * @param startTime inclusive window start (epoch millis).
 * @param endTime inclusive window end (epoch millis).
 * @param linkType link class; only {@link #LINK_TYPE_MESH} rows feed the mesh.
 */
public record LinkRecord(String source, String destination, long startTime, long endTime, String linkType) {

    /** Inter-satellite link type. */
    public static final String LINK_TYPE_MESH = "LEO_LEO";

    public LinkRecord {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(linkType, "linkType");
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must be >= startTime");
        }
    }

    public String sourceNodeId() {
        return nodeId(source);
    }

    public String destinationNodeId() {
        return nodeId(destination);
    }

    public boolean isMeshLink() {
        return LINK_TYPE_MESH.equals(linkType);
    }

    /**
     * Node id of an endpoint name: its first whitespace-separated token.
     */
    public static String nodeId(String endpointName) {
        String trimmed = endpointName.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("endpoint name must be non-blank");
        }
        return trimmed.split("\\s+", 2)[0];
    }
}
