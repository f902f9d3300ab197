package org.maptracker.merge.split;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.maptracker.merge.mask.BinaryMask;

/**
 * Ownership masks produced by a {@link TerritoryPartitioner}, one per map in the order of the map names.
 */
public class PartitionResult {

    public enum Outcome {
        /** Masks did not overlap, every map keeps its own land. */
        NO_OVERLAP,
        /** Splitting was skipped, every map keeps its own land (masks may overlap). */
        SKIPPED,
        /** Overlapping land was split along the barrier. */
        PARTITIONED
    }

    private final List<String> mapNames;
    private final List<BinaryMask> ownershipMasks;
    private final Outcome outcome;
    private final int overlapPixelCount;
    private final int unresolvedPixelCount;

    public PartitionResult(final List<String> mapNames,
                           final List<BinaryMask> ownershipMasks,
                           final Outcome outcome,
                           final int overlapPixelCount,
                           final int unresolvedPixelCount) {
        if (mapNames.size() != ownershipMasks.size()) {
            throw new IllegalArgumentException(mapNames.size() + " map names but " +
                                               ownershipMasks.size() + " ownership masks");
        }
        this.mapNames = Collections.unmodifiableList(new ArrayList<>(mapNames));
        this.ownershipMasks = Collections.unmodifiableList(new ArrayList<>(ownershipMasks));
        this.outcome = outcome;
        this.overlapPixelCount = overlapPixelCount;
        this.unresolvedPixelCount = unresolvedPixelCount;
    }

    public List<String> getMapNames() {
        return mapNames;
    }

    public List<BinaryMask> getOwnershipMasks() {
        return ownershipMasks;
    }

    /**
     * @throws IllegalArgumentException
     *   if the map is not part of this result.
     */
    public BinaryMask getOwnershipMask(final String mapName)
            throws IllegalArgumentException {
        final int index = mapNames.indexOf(mapName);
        if (index < 0) {
            throw new IllegalArgumentException("map '" + mapName + "' is not part of this result");
        }
        return ownershipMasks.get(index);
    }

    public Outcome getOutcome() {
        return outcome;
    }

    public boolean isSkipped() {
        return outcome == Outcome.SKIPPED;
    }

    public int getOverlapPixelCount() {
        return overlapPixelCount;
    }

    public int getUnresolvedPixelCount() {
        return unresolvedPixelCount;
    }

    @Override
    public String toString() {
        return "PartitionResult{" + outcome +
               ", maps=" + mapNames +
               ", overlapPixels=" + overlapPixelCount +
               ", unresolvedPixels=" + unresolvedPixelCount + '}';
    }
}
