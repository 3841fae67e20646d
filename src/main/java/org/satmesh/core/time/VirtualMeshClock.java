package org.satmesh.core.time;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Manually advanced {@link MeshClock} for deterministic simulation runs and tests.
 * <p>
 * Time only moves through {@link #advance(long)} or {@link #advanceTo(long)}; both reject
 * attempts to move backwards.
 * </p>
 */
public final class VirtualMeshClock implements MeshClock {

    private final AtomicLong nowMillis;

    /**
     * Creates a virtual clock positioned at {@code startMillis}.
     *
     * @param startMillis initial epoch milliseconds.
     */
    public VirtualMeshClock(long startMillis) {
        this.nowMillis = new AtomicLong(startMillis);
    }

    @Override
    public long millis() {
        return nowMillis.get();
    }

    @Override
    public boolean isVirtual() {
        return true;
    }

    /**
     * Moves time forward by {@code deltaMillis}.
     *
     * @param deltaMillis non-negative step.
     * @return new current time.
     */
    public long advance(long deltaMillis) {
        if (deltaMillis < 0) {
            throw new IllegalArgumentException("deltaMillis must be >= 0");
        }
        return nowMillis.addAndGet(deltaMillis);
    }

    /**
     * Moves time forward to an absolute instant.
     *
     * @param targetMillis absolute epoch milliseconds; must not be earlier than now.
     * @return new current time.
     */
    public long advanceTo(long targetMillis) {
        return nowMillis.updateAndGet(current -> {
            if (targetMillis < current) {
                throw new IllegalArgumentException(
                        "virtual clock cannot move backwards: now=" + current + ", target=" + targetMillis);
            }
            return targetMillis;
        });
    }
}
