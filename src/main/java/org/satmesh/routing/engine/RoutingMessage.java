package org.satmesh.routing.engine;

import lombok.Getter;
import lombok.ToString;
import lombok.experimental.Accessors;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable routing advertisement exchanged between neighboring agents.
 * <p>
 * {@code (sender, incarnation, sequence)} identifies a message; sequences are strictly
 * increasing per sender incarnation starting at {@code 1}. The advertised map is the sender's complete advertisable table
 * at {@code timestamp}, so a destination missing from it is withdrawn by receivers that route
 * through the sender.
 * </p>
 */
@Getter
@ToString
@Accessors(fluent = true)
public final class RoutingMessage {

    private final String sender;
    private final long incarnation;
    private final long sequence;
    private final long timestamp;
    private final Map<String, Advertisement> routes;

    private RoutingMessage(
            String sender,
            long incarnation,
            long sequence,
            long timestamp,
            Map<String, Advertisement> routes
    ) {
        this.sender = Objects.requireNonNull(sender, "sender");
        if (incarnation < 0) {
            throw new IllegalArgumentException("incarnation must be >= 0, got " + incarnation);
        }
        this.incarnation = incarnation;
        if (sequence < 1) {
            throw new IllegalArgumentException("sequence must be >= 1, got " + sequence);
        }
        this.sequence = sequence;
        this.timestamp = timestamp;
        TreeMap<String, Advertisement> copy = new TreeMap<>();
        for (Map.Entry<String, Advertisement> entry : Objects.requireNonNull(routes, "routes").entrySet()) {
            copy.put(
                    Objects.requireNonNull(entry.getKey(), "destination"),
                    Objects.requireNonNull(entry.getValue(), "advertisement")
            );
        }
        this.routes = Collections.unmodifiableMap(copy);
    }

    /**
     * Creates a routing message of incarnation {@code 0}.
     */
    public static RoutingMessage of(String sender, long sequence, long timestamp, Map<String, Advertisement> routes) {
        return new RoutingMessage(sender, 0L, sequence, timestamp, routes);
    }

    /**
     * Creates a routing message.
     *
     * @param sender originating node id.
     * @param incarnation sender incarnation, {@code >= 0}.
     * @param sequence per-sender sequence number, {@code >= 1}.
     * @param timestamp mesh time of creation.
     * @param routes destination to advertised hop count and cost.
     * @return immutable message.
     */
    public static RoutingMessage of(
            String sender,
            long incarnation,
            long sequence,
            long timestamp,
            Map<String, Advertisement> routes
    ) {
        return new RoutingMessage(sender, incarnation, sequence, timestamp, routes);
    }
}
