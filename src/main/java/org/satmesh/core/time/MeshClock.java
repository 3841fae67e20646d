package org.satmesh.core.time;

/**
 * Time source shared by every agent of one mesh.
 *
 * <p>All link windows, route timestamps and timer deadlines are expressed in epoch
 * milliseconds read from this clock. Implementations must never move backwards.</p>
 */
public interface MeshClock {

    /**
     * Returns the current mesh time.
     *
     * @return epoch milliseconds; non-decreasing across calls.
     */
    long millis();

    /**
     * Returns true when the clock only advances on explicit request.
     * Agent loops use this to bound real-time waits instead of sleeping until a virtual deadline.
     */
    default boolean isVirtual() {
        return false;
    }

    /**
     * Returns the wall-clock implementation.
     */
    static MeshClock system() {
        return SystemMeshClock.INSTANCE;
    }
}
