package org.satmesh.routing.neighbor;

import org.satmesh.routing.cost.LinkCostStrategy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-agent neighbor store bound to visibility windows.
 * <p>
 * Entries are immutable {@link NeighborInfo} values replaced atomically under one exclusive
 * lock. No method calls out of this class while holding the lock, so callers may combine it
 * with other per-agent tables as long as they never nest the locks.
 * </p>
 * <p>
 * Expiry contract: a neighbor is expired when {@code now > endTime} (the end is inclusive)
 * and is hard-removed by {@link #checkLiveness(long, long)}. A neighbor silent for longer
 * than the liveness timeout is only marked inactive.
 * </p>
 */
public final class NeighborTable {

    private final Map<String, NeighborInfo> neighbors = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * Result of one liveness pass.
     *
     * @param expired neighbors removed because their window closed.
     * @param deactivated neighbors marked inactive because they fell silent.
     */
    public record LivenessReport(List<String> expired, List<String> deactivated) {
        public LivenessReport {
            expired = List.copyOf(expired);
            deactivated = List.copyOf(deactivated);
        }

        public boolean isEmpty() {
            return expired.isEmpty() && deactivated.isEmpty();
        }
    }

    /**
     * Creates or overwrites a neighbor as freshly seen and active.
     *
     * @param neighborId neighbor id.
     * @param startTime inclusive window start.
     * @param endTime inclusive window end.
     * @param quality link quality in {@code [0.0, 1.0]}.
     * @param now current mesh time.
     * @return the stored entry.
     */
    public NeighborInfo add(String neighborId, long startTime, long endTime, double quality, long now) {
        NeighborInfo info = NeighborInfo.builder()
                .neighborId(Objects.requireNonNull(neighborId, "neighborId"))
                .quality(quality)
                .startTime(startTime)
                .endTime(endTime)
                .lastSeen(now)
                .active(true)
                .build();
        lock.lock();
        try {
            neighbors.put(neighborId, info);
        } finally {
            lock.unlock();
        }
        return info;
    }

    /**
     * Merges the non-null fields into an existing neighbor, refreshing liveness.
     *
     * @return the new entry, or {@code null} when the neighbor is unknown.
     */
    public NeighborInfo update(
            String neighborId,
            Double quality,
            Double signalStrength,
            Double bandwidthAvailable,
            long now
    ) {
        lock.lock();
        try {
            NeighborInfo current = neighbors.get(neighborId);
            if (current == null) {
                return null;
            }
            NeighborInfo.NeighborInfoBuilder builder = current.toBuilder()
                    .lastSeen(now)
                    .active(true);
            if (quality != null) {
                builder.quality(quality);
            }
            if (signalStrength != null) {
                builder.signalStrength(signalStrength);
            }
            if (bandwidthAvailable != null) {
                builder.bandwidthAvailable(bandwidthAvailable);
            }
            NeighborInfo merged = builder.build();
            neighbors.put(neighborId, merged);
            return merged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes one neighbor.
     *
     * @return the removed entry, or {@code null} when absent.
     */
    public NeighborInfo remove(String neighborId) {
        lock.lock();
        try {
            return neighbors.remove(neighborId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a sign of life from a neighbor whose window is open.
     *
     * @return true when the neighbor is known and inside its window.
     */
    public boolean touch(String neighborId, long now) {
        lock.lock();
        try {
            NeighborInfo current = neighbors.get(neighborId);
            if (current == null || !current.withinWindow(now)) {
                return false;
            }
            if (current.lastSeen() < now || !current.active()) {
                neighbors.put(neighborId, current.toBuilder()
                        .lastSeen(Math.max(now, current.lastSeen()))
                        .active(true)
                        .build());
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes expired neighbors and soft-deactivates silent ones.
     *
     * @param now current mesh time.
     * @param livenessTimeoutMillis silence after which a neighbor is marked inactive.
     * @return ids affected by this pass.
     */
    public LivenessReport checkLiveness(long now, long livenessTimeoutMillis) {
        List<String> expired = new ArrayList<>();
        List<String> deactivated = new ArrayList<>();
        lock.lock();
        try {
            var iterator = neighbors.entrySet().iterator();
            while (iterator.hasNext()) {
                Map.Entry<String, NeighborInfo> entry = iterator.next();
                NeighborInfo info = entry.getValue();
                if (info.expiredAt(now)) {
                    iterator.remove();
                    expired.add(entry.getKey());
                } else if (info.active() && now - info.lastSeen() > livenessTimeoutMillis) {
                    entry.setValue(info.toBuilder().active(false).build());
                    deactivated.add(entry.getKey());
                }
            }
        } finally {
            lock.unlock();
        }
        expired.sort(Comparator.naturalOrder());
        deactivated.sort(Comparator.naturalOrder());
        return new LivenessReport(expired, deactivated);
    }

    /**
     * Cost of one hop over the link to {@code neighborId}.
     *
     * @return strategy cost, or {@code +INF} when the neighbor is absent or unusable at {@code now}.
     */
    public double linkCost(String neighborId, long now, LinkCostStrategy strategy) {
        NeighborInfo info = get(neighborId);
        if (info == null || !info.usableAt(now)) {
            return Double.POSITIVE_INFINITY;
        }
        return strategy.cost(info);
    }

    /**
     * @return ids of neighbors usable at {@code now}, sorted.
     */
    public List<String> usableNeighborIds(long now) {
        List<String> ids = new ArrayList<>();
        lock.lock();
        try {
            for (NeighborInfo info : neighbors.values()) {
                if (info.usableAt(now)) {
                    ids.add(info.neighborId());
                }
            }
        } finally {
            lock.unlock();
        }
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    /**
     * @return current entry or {@code null}.
     */
    public NeighborInfo get(String neighborId) {
        lock.lock();
        try {
            return neighbors.get(neighborId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true when the neighbor is known (regardless of window or activity).
     */
    public boolean contains(String neighborId) {
        return get(neighborId) != null;
    }

    /**
     * @return all entries sorted by neighbor id.
     */
    public List<NeighborInfo> snapshot() {
        List<NeighborInfo> copy;
        lock.lock();
        try {
            copy = new ArrayList<>(neighbors.values());
        } finally {
            lock.unlock();
        }
        copy.sort(Comparator.comparing(NeighborInfo::neighborId));
        return copy;
    }

    /**
     * @return number of known neighbors.
     */
    public int size() {
        lock.lock();
        try {
            return neighbors.size();
        } finally {
            lock.unlock();
        }
    }
}
