package de.bsommerfeld.spellbook.core.progress;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, single-producer channel carrying {@link ProgressState} from the
 * setup worker to whoever renders progress.
 *
 * <h3>Monotonicity</h3>
 * The producer side owns the invariant: every published fraction is raised
 * to the highest fraction published so far, so consumers observe a
 * non-decreasing sequence regardless of how stages report.
 *
 * <h3>Back-pressure</h3>
 * The producer never blocks. When the buffer is full the oldest snapshot
 * is discarded; progress is a series of snapshots and only the newest one
 * matters. A terminal snapshot is always the newest entry and therefore
 * never discarded.
 *
 * <h3>Lifecycle</h3>
 * Publishing a terminal state ({@link SetupStage#COMPLETE} or
 * {@link SetupStage#ERROR}) closes the channel; later publishes are ignored.
 */
public final class ProgressChannel {

    public static final int DEFAULT_CAPACITY = 256;

    private final BlockingQueue<ProgressState> queue;
    private final Object publishLock = new Object();

    private double highWater;
    private volatile boolean closed;

    public ProgressChannel() {
        this(DEFAULT_CAPACITY);
    }

    public ProgressChannel(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    /**
     * Publishes a snapshot. Returns the snapshot as enqueued (with its
     * fraction possibly raised), or {@code null} if the channel is closed.
     */
    public ProgressState publish(ProgressState state) {
        synchronized (publishLock) {
            if (closed) {
                return null;
            }
            ProgressState monotonic = state.atLeast(highWater);
            highWater = monotonic.fraction();

            while (!queue.offer(monotonic)) {
                queue.poll();
            }
            if (monotonic.isTerminal()) {
                closed = true;
            }
            return monotonic;
        }
    }

    /** Blocks until the next snapshot is available. */
    public ProgressState take() throws InterruptedException {
        return queue.take();
    }

    /** Waits up to the given time for the next snapshot, {@code null} on timeout. */
    public ProgressState poll(long timeout, TimeUnit unit) throws InterruptedException {
        return queue.poll(timeout, unit);
    }

    /** Removes and returns everything currently buffered. */
    public List<ProgressState> drain() {
        List<ProgressState> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    public boolean isClosed() {
        return closed;
    }

    /** Highest fraction published so far. */
    public double highWater() {
        synchronized (publishLock) {
            return highWater;
        }
    }
}
