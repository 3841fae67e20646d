package org.satmesh.routing.engine;

import it.unimi.dsi.fastutil.longs.LongIterator;
import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import it.unimi.dsi.fastutil.objects.Object2ObjectOpenHashMap;

import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Deduplication set of processed {@code (sender, sequence)} pairs.
 * <p>
 * Sequences are scoped to the sender's incarnation. A higher incarnation starts a fresh
 * window, so a node re-created under the same id is not mistaken for a replay. Messages from
 * an older incarnation than the latest one seen are rejected.
 * </p>
 * <p>
 * Memory is bounded per sender: once more than {@code retention} sequences are held, a
 * per-sender floor is raised to {@code maxSeen - retention} and every sequence at or below the
 * floor is reported as already seen. Each pair is therefore accepted at most once.
 * </p>
 */
public final class SeenSet {

    private final int retention;
    private final Object2ObjectOpenHashMap<String, SenderWindow> bySender = new Object2ObjectOpenHashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    private static final class SenderWindow {
        private final LongOpenHashSet sequences = new LongOpenHashSet();
        private long incarnation;
        private long floor;
        private long maxSeen;

        private SenderWindow(long incarnation) {
            this.incarnation = incarnation;
        }

        private void restart(long newIncarnation) {
            sequences.clear();
            incarnation = newIncarnation;
            floor = 0L;
            maxSeen = 0L;
        }
    }

    /**
     * @param retention sequences kept per sender before the floor moves; must be {@code > 0}.
     */
    public SeenSet(int retention) {
        if (retention <= 0) {
            throw new IllegalArgumentException("retention must be > 0");
        }
        this.retention = retention;
    }

    /**
     * Records a pair of incarnation {@code 0}.
     *
     * @return true when the pair had not been seen before.
     */
    public boolean markSeen(String sender, long sequence) {
        return markSeen(sender, 0L, sequence);
    }

    /**
     * Records a pair.
     *
     * @param sender sender id.
     * @param incarnation sender incarnation; a higher value than the last one seen resets the window.
     * @param sequence per-incarnation sequence.
     * @return true when the pair had not been seen before in this incarnation.
     */
    public boolean markSeen(String sender, long incarnation, long sequence) {
        Objects.requireNonNull(sender, "sender");
        lock.lock();
        try {
            SenderWindow window = bySender.get(sender);
            if (window == null) {
                window = new SenderWindow(incarnation);
                bySender.put(sender, window);
            } else if (incarnation < window.incarnation) {
                return false;
            } else if (incarnation > window.incarnation) {
                window.restart(incarnation);
            }
            if (sequence <= window.floor || !window.sequences.add(sequence)) {
                return false;
            }
            window.maxSeen = Math.max(window.maxSeen, sequence);
            if (window.sequences.size() > retention) {
                raiseFloor(window, window.maxSeen - retention);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return true when the pair would be rejected by {@link #markSeen(String, long)}.
     */
    public boolean hasSeen(String sender, long sequence) {
        lock.lock();
        try {
            SenderWindow window = bySender.get(sender);
            return window != null && (sequence <= window.floor || window.sequences.contains(sequence));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drops everything retained for {@code sender}.
     *
     * @return true when the sender had a window.
     */
    public boolean forget(String sender) {
        lock.lock();
        try {
            return bySender.remove(sender) != null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of sequences currently retained for {@code sender}.
     */
    public int retainedFor(String sender) {
        lock.lock();
        try {
            SenderWindow window = bySender.get(sender);
            return window == null ? 0 : window.sequences.size();
        } finally {
            lock.unlock();
        }
    }

    private static void raiseFloor(SenderWindow window, long newFloor) {
        window.floor = Math.max(window.floor, newFloor);
        LongIterator iterator = window.sequences.iterator();
        while (iterator.hasNext()) {
            if (iterator.nextLong() <= window.floor) {
                iterator.remove();
            }
        }
    }
}
