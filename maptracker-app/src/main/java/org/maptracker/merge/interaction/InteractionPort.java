package org.maptracker.merge.interaction;

import org.maptracker.merge.tile.AlignDirection;

/**
 * Synchronous request/response boundary for decisions that the merge pipeline cannot make on its own.
 * Implementations may ask a person (through a user interface), read prepared answers from files,
 * or return scripted answers in tests.
 */
public interface InteractionPort {

    /**
     * @return anchor direction for a tile whose alignment could not be detected automatically.
     */
    AlignDirection resolveAlignment(AlignmentRequest request);

    /**
     * @return barrier that separates overlapping maps, or {@link BarrierResponse#skip()}
     *         to keep overlapping land shared by all maps that cover it.
     */
    BarrierResponse collectBarrier(BarrierRequest request);

}
