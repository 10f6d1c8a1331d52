package io.syncstore.core.sequence;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;

/**
 * Padded, CAS-capable position cursor shared between allocating threads and
 * token readers.
 */
public final class Sequence {
    private static final VarHandle VH;

    static {
        try {
            VH = MethodHandles.lookup().findVarHandle(Sequence.class, "value", long.class);
        } catch (final ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    // padding to avoid false sharing
    @SuppressWarnings("unused")
    private long p1, p2, p3, p4, p5, p6, p7;

    private volatile long value;

    @SuppressWarnings("unused")
    private long p8, p9, p10, p11, p12, p13, p14;

    public Sequence(final long initial) {
        VH.setRelease(this, initial);
    }

    public long get() {
        return (long) VH.getAcquire(this);
    }

    /**
     * Release-ordered publish of a value computed by the single writer that
     * currently owns the cursor (the holder of the bookkeeping lock).
     */
    public void set(final long newValue) {
        VH.setRelease(this, newValue);
    }

    /**
     * Atomically claims {@code count} values and returns the highest one.
     */
    public long addAndGet(final long count) {
        return (long) VH.getAndAdd(this, count) + count;
    }

    public long incrementAndGet() {
        return addAndGet(1L);
    }
}
