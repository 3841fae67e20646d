package org.satmesh.topology;

import org.satmesh.routing.agent.AgentHandle;
import org.satmesh.routing.agent.AgentRegistry;
import org.satmesh.routing.neighbor.NeighborEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns parsed link records into neighbor events as their windows open and close.
 * <p>
 * Each mesh link goes through {@code PENDING -> OPEN -> CLOSED} at most once: ADD is emitted
 * on the first pump with {@code startTime <= now}, REMOVE on the first pump with
 * {@code now > endTime}. A window that has already closed before its first pump emits nothing.
 * Records of another link type, self links and links naming an unregistered node are skipped.
 * </p>
 * <p>
 * Not thread-safe; pump from one thread.
 * </p>
 */
public final class LinkEventFeed {
    private static final Logger log = LoggerFactory.getLogger(LinkEventFeed.class);

    /** Quality given to links opened by the feed unless configured otherwise. */
    public static final double DEFAULT_LINK_QUALITY = 0.9d;

    private enum Phase {
        PENDING,
        OPEN,
        CLOSED
    }

    private static final class TrackedLink {
        private final LinkRecord record;
        private Phase phase = Phase.PENDING;

        private TrackedLink(LinkRecord record) {
            this.record = record;
        }
    }

    private final List<TrackedLink> links = new ArrayList<>();
    private final double quality;
    private final boolean bidirectional;

    public LinkEventFeed(List<LinkRecord> records) {
        this(records, DEFAULT_LINK_QUALITY, true);
    }

    /**
     * @param records link records in table order.
     * @param quality quality of every emitted ADD, within {@code [0.0, 1.0]}.
     * @param bidirectional emit on the destination node as well as the source node.
     */
    public LinkEventFeed(List<LinkRecord> records, double quality, boolean bidirectional) {
        Objects.requireNonNull(records, "records");
        if (!Double.isFinite(quality) || quality < 0.0d || quality > 1.0d) {
            throw new IllegalArgumentException("quality must be within [0.0, 1.0]");
        }
        this.quality = quality;
        this.bidirectional = bidirectional;
        int ignored = 0;
        for (LinkRecord record : records) {
            if (!record.isMeshLink() || record.sourceNodeId().equals(record.destinationNodeId())) {
                ignored++;
                continue;
            }
            links.add(new TrackedLink(record));
        }
        if (ignored > 0) {
            log.debug("link feed ignored {} non-mesh or self-link records", ignored);
        }
    }

    /**
     * Emits every transition due at {@code now}.
     *
     * @param now current mesh time.
     * @param registry delivery directory of the target mesh.
     * @return number of neighbor events submitted.
     */
    public int pump(long now, AgentRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        int emitted = 0;
        for (TrackedLink link : links) {
            LinkRecord record = link.record;
            switch (link.phase) {
                case PENDING -> {
                    if (now > record.endTime()) {
                        link.phase = Phase.CLOSED;
                    } else if (record.startTime() <= now) {
                        link.phase = Phase.OPEN;
                        emitted += emitAdd(record, registry);
                    }
                }
                case OPEN -> {
                    if (now > record.endTime()) {
                        link.phase = Phase.CLOSED;
                        emitted += emitRemove(record, registry);
                    }
                }
                case CLOSED -> {
                }
            }
        }
        return emitted;
    }

    /**
     * @return mesh links still waiting to open or close.
     */
    public int pendingTransitions() {
        int pending = 0;
        for (TrackedLink link : links) {
            if (link.phase != Phase.CLOSED) {
                pending++;
            }
        }
        return pending;
    }

    private int emitAdd(LinkRecord record, AgentRegistry registry) {
        String source = record.sourceNodeId();
        String destination = record.destinationNodeId();
        int emitted = submit(registry, source,
                NeighborEvent.add(destination, record.startTime(), record.endTime(), quality));
        if (bidirectional) {
            emitted += submit(registry, destination,
                    NeighborEvent.add(source, record.startTime(), record.endTime(), quality));
        }
        return emitted;
    }

    private int emitRemove(LinkRecord record, AgentRegistry registry) {
        String source = record.sourceNodeId();
        String destination = record.destinationNodeId();
        int emitted = submit(registry, source, NeighborEvent.remove(destination));
        if (bidirectional) {
            emitted += submit(registry, destination, NeighborEvent.remove(source));
        }
        return emitted;
    }

    private static int submit(AgentRegistry registry, String nodeId, NeighborEvent event) {
        AgentHandle handle = registry.lookup(nodeId);
        if (handle == null) {
            log.warn("link feed skipped {} for unknown node {}", event.type(), nodeId);
            return 0;
        }
        if (!handle.submit(event)) {
            log.warn("link feed could not queue {} on stopping node {}", event.type(), nodeId);
            return 0;
        }
        return 1;
    }
}
