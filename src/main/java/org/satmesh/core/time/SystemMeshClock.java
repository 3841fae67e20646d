package org.satmesh.core.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Wall-clock {@link MeshClock} clamped to be monotonic.
 */
public final class SystemMeshClock implements MeshClock {

    static final SystemMeshClock INSTANCE = new SystemMeshClock();

    private final AtomicLong lastReturned = new AtomicLong(Long.MIN_VALUE);

    private SystemMeshClock() {
    }

    @Override
    public long millis() {
        long now = System.currentTimeMillis();
        // System time may step backwards (NTP); never report an earlier value than before.
        return lastReturned.accumulateAndGet(now, Math::max);
    }
}
