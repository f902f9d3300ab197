package org.maptracker.merge.interaction;

import org.maptracker.merge.mask.BinaryMask;

/**
 * Barrier raster for a partition step, or the decision to skip splitting.
 */
public class BarrierResponse {

    private static final BarrierResponse SKIP = new BarrierResponse(null);

    private final BinaryMask barrier;

    private BarrierResponse(final BinaryMask barrier) {
        this.barrier = barrier;
    }

    public static BarrierResponse skip() {
        return SKIP;
    }

    public static BarrierResponse of(final BinaryMask barrier)
            throws IllegalArgumentException {
        if (barrier == null) {
            throw new IllegalArgumentException("barrier must be specified, use skip() instead");
        }
        return new BarrierResponse(barrier);
    }

    public boolean isSkip() {
        return barrier == null;
    }

    /**
     * @return the barrier raster (null when splitting is skipped).
     */
    public BinaryMask getBarrier() {
        return barrier;
    }

    @Override
    public String toString() {
        return isSkip() ? "skip" : "barrier with " + barrier.count() + " pixels";
    }
}
