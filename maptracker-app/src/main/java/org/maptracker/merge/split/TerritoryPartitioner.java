package org.maptracker.merge.split;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

import org.maptracker.merge.interaction.BarrierRequest;
import org.maptracker.merge.interaction.BarrierResponse;
import org.maptracker.merge.interaction.InteractionPort;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.ComponentLabels;
import org.maptracker.merge.mask.ConnectedComponents;
import org.maptracker.merge.mask.DistanceMaps;
import org.maptracker.merge.mask.Morphology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Splits overlapping land of several maps on one canvas into disjoint territories.
 *
 * <p>
 * Land covered by exactly one map belongs to that map. Land covered by two or more maps
 * is cut by a barrier raster requested from the {@link InteractionPort}. The barrier is
 * dilated with a 3x3 cross so that diagonal strokes separate 4-connected regions. Each
 * 4-connected region of the remaining overlap is then assigned as a whole:
 * </p>
 * <ol>
 *     <li>to the map with the most exclusive land pixels on the region's outer ring, or</li>
 *     <li>if the region touches no exclusive land, to the map whose exclusive land is nearest.</li>
 * </ol>
 * <p>
 * Overlap pixels left after that (barrier pixels) go to the alphabetically first map with land there.
 * </p>
 */
public class TerritoryPartitioner {

    static final int NONE = -1;
    static final int UNRESOLVED = -2;

    /**
     * @param  groupKey       key of the stitched group (passed on to the port).
     * @param  mapNames       map names, the index of each name is its owner index.
     * @param  landMasks      canvas sized land mask for each map.
     * @param  canvasPreview  stitched canvas shown to the port.
     * @param  port           source of the barrier raster.
     *
     * @return ownership mask for each map.
     *
     * @throws IllegalArgumentException
     *   if the names and masks do not correspond or the masks have different sizes.
     */
    public PartitionResult partition(final String groupKey,
                                     final List<String> mapNames,
                                     final List<BinaryMask> landMasks,
                                     final BufferedImage canvasPreview,
                                     final InteractionPort port)
            throws IllegalArgumentException {

        validate(mapNames, landMasks);

        final int mapCount = landMasks.size();
        final int width = landMasks.get(0).getWidth();
        final int height = landMasks.get(0).getHeight();
        final int pixelCount = width * height;

        final BinaryMask anyLand = new BinaryMask(width, height);
        final BinaryMask overlap = new BinaryMask(width, height);
        for (final BinaryMask mask : landMasks) {
            for (int i = 0; i < pixelCount; i++) {
                if (mask.get(i)) {
                    if (anyLand.get(i)) {
                        overlap.set(i, true);
                    } else {
                        anyLand.set(i, true);
                    }
                }
            }
        }

        final int overlapPixelCount = overlap.count();

        if (overlapPixelCount == 0) {
            LOG.info("partition: no overlaps in group {}, keeping land masks as is", groupKey);
            return new PartitionResult(mapNames, copyAll(landMasks), PartitionResult.Outcome.NO_OVERLAP, 0, 0);
        }

        LOG.info("partition: group {} has {} overlap pixels", groupKey, overlapPixelCount);

        final BarrierResponse response =
                port.collectBarrier(new BarrierRequest(groupKey,
                                                       Collections.unmodifiableList(new ArrayList<>(mapNames)),
                                                       canvasPreview,
                                                       overlap.copy()));

        if ((response == null) || response.isSkip()) {
            LOG.warn("partition: splitting skipped for group {}, each map retains its full land", groupKey);
            return new PartitionResult(mapNames,
                                       copyAll(landMasks),
                                       PartitionResult.Outcome.SKIPPED,
                                       overlapPixelCount,
                                       0);
        }

        final BinaryMask barrier = response.getBarrier();
        if ((barrier.getWidth() != width) || (barrier.getHeight() != height)) {
            LOG.warn("partition: barrier for group {} is {}x{} but canvas is {}x{}, " +
                     "splitting skipped and each map retains its full land",
                     groupKey, barrier.getWidth(), barrier.getHeight(), width, height);
            return new PartitionResult(mapNames,
                                       copyAll(landMasks),
                                       PartitionResult.Outcome.SKIPPED,
                                       overlapPixelCount,
                                       0);
        }

        final int[] owner = new int[pixelCount];
        Arrays.fill(owner, NONE);
        for (int m = 0; m < mapCount; m++) {
            final BinaryMask mask = landMasks.get(m);
            for (int i = 0; i < pixelCount; i++) {
                if (mask.get(i) && (! overlap.get(i))) {
                    owner[i] = m;
                }
            }
        }
        for (int i = 0; i < pixelCount; i++) {
            if (overlap.get(i)) {
                owner[i] = UNRESOLVED;
            }
        }

        final BinaryMask wall = Morphology.dilateCross(barrier);
        LOG.info("partition: barrier pixels (after dilate): {}", wall.count());

        final BinaryMask fillable = overlap.copy();
        fillable.andNot(wall);

        final ComponentLabels components = ConnectedComponents.label(fillable, ConnectedComponents.Connectivity.FOUR);
        LOG.info("partition: fillable components: {}", components.getComponentCount());

        // exclusive ownership before any component is assigned
        final int[] exclusiveOwner = owner.clone();

        final List<BinaryMask> exclusiveMasks = new ArrayList<>(mapCount);
        for (int m = 0; m < mapCount; m++) {
            final BinaryMask exclusive = new BinaryMask(width, height);
            for (int i = 0; i < pixelCount; i++) {
                if (exclusiveOwner[i] == m) {
                    exclusive.set(i, true);
                }
            }
            exclusiveMasks.add(exclusive);
        }

        final float[][] distanceMaps = new float[mapCount][];
        final int[] ringStamp = new int[pixelCount];
        final int[] ringCounts = new int[mapCount];

        for (int label = 1; label <= components.getComponentCount(); label++) {

            final int[] componentPixels = components.getComponentPixels(label);

            Arrays.fill(ringCounts, 0);
            for (final int index : componentPixels) {
                final int x = index % width;
                final int y = index / width;
                countRingPixel(components, exclusiveOwner, ringStamp, ringCounts, label, x - 1, y, width, height);
                countRingPixel(components, exclusiveOwner, ringStamp, ringCounts, label, x + 1, y, width, height);
                countRingPixel(components, exclusiveOwner, ringStamp, ringCounts, label, x, y - 1, width, height);
                countRingPixel(components, exclusiveOwner, ringStamp, ringCounts, label, x, y + 1, width, height);
            }

            int bestMap = NONE;
            int bestCount = 0;
            for (int m = 0; m < mapCount; m++) {
                if (ringCounts[m] > bestCount) {
                    bestCount = ringCounts[m];
                    bestMap = m;
                }
            }

            if (bestMap == NONE) {
                bestMap = findNearestMap(exclusiveMasks, distanceMaps, componentPixels);
                if (bestMap != NONE) {
                    LOG.debug("partition: isolated component {} assigned to nearest map {}",
                              label, mapNames.get(bestMap));
                }
            }

            if (bestMap != NONE) {
                for (final int index : componentPixels) {
                    owner[index] = bestMap;
                }
            }
        }

        // remaining overlap (barrier) pixels
        final List<Integer> alphabeticalOrder = new ArrayList<>(mapCount);
        for (int m = 0; m < mapCount; m++) {
            alphabeticalOrder.add(m);
        }
        alphabeticalOrder.sort(Comparator.comparing(mapNames::get));

        for (int i = 0; i < pixelCount; i++) {
            if ((owner[i] == UNRESOLVED) && anyLand.get(i)) {
                for (final Integer m : alphabeticalOrder) {
                    if (landMasks.get(m).get(i)) {
                        owner[i] = m;
                        break;
                    }
                }
            }
        }

        int unresolvedPixelCount = 0;
        for (final int o : owner) {
            if (o == UNRESOLVED) {
                unresolvedPixelCount++;
            }
        }

        if (unresolvedPixelCount > 0) {
            LOG.error("partition: {} overlap pixels of group {} could not be assigned to any map",
                      unresolvedPixelCount, groupKey);
        } else {
            LOG.info("partition: split of group {} complete", groupKey);
        }

        final List<BinaryMask> ownershipMasks = new ArrayList<>(mapCount);
        for (int m = 0; m < mapCount; m++) {
            final BinaryMask ownership = new BinaryMask(width, height);
            for (int i = 0; i < pixelCount; i++) {
                if (owner[i] == m) {
                    ownership.set(i, true);
                }
            }
            ownershipMasks.add(ownership);
        }

        return new PartitionResult(mapNames,
                                   ownershipMasks,
                                   PartitionResult.Outcome.PARTITIONED,
                                   overlapPixelCount,
                                   unresolvedPixelCount);
    }

    private static void countRingPixel(final ComponentLabels components,
                                       final int[] exclusiveOwner,
                                       final int[] ringStamp,
                                       final int[] ringCounts,
                                       final int label,
                                       final int x,
                                       final int y,
                                       final int width,
                                       final int height) {
        if ((x < 0) || (x >= width) || (y < 0) || (y >= height)) {
            return;
        }
        final int index = (y * width) + x;
        if ((components.getLabel(index) == label) || (ringStamp[index] == label)) {
            return;
        }
        ringStamp[index] = label;
        final int exclusive = exclusiveOwner[index];
        if (exclusive >= 0) {
            ringCounts[exclusive]++;
        }
    }

    /**
     * Distance maps are derived lazily and reused for later isolated components.
     */
    private static int findNearestMap(final List<BinaryMask> exclusiveMasks,
                                      final float[][] distanceMaps,
                                      final int[] componentPixels) {
        int bestMap = NONE;
        double bestDistance = Double.POSITIVE_INFINITY;
        for (int m = 0; m < exclusiveMasks.size(); m++) {
            final BinaryMask exclusive = exclusiveMasks.get(m);
            if (exclusive.isEmpty()) {
                continue;
            }
            if (distanceMaps[m] == null) {
                distanceMaps[m] = DistanceMaps.distanceToMask(exclusive);
            }
            final float[] distances = distanceMaps[m];
            double minDistance = Double.POSITIVE_INFINITY;
            for (final int index : componentPixels) {
                minDistance = Math.min(minDistance, distances[index]);
            }
            if (minDistance < bestDistance) {
                bestDistance = minDistance;
                bestMap = m;
            }
        }
        return bestMap;
    }

    private static void validate(final List<String> mapNames,
                                 final List<BinaryMask> landMasks)
            throws IllegalArgumentException {
        if (landMasks.isEmpty()) {
            throw new IllegalArgumentException("at least one land mask must be specified");
        }
        if (mapNames.size() != landMasks.size()) {
            throw new IllegalArgumentException(mapNames.size() + " map names specified for " +
                                               landMasks.size() + " land masks");
        }
        final int width = landMasks.get(0).getWidth();
        final int height = landMasks.get(0).getHeight();
        for (int m = 1; m < landMasks.size(); m++) {
            final BinaryMask mask = landMasks.get(m);
            if ((mask.getWidth() != width) || (mask.getHeight() != height)) {
                throw new IllegalArgumentException("land mask for " + mapNames.get(m) + " is " +
                                                   mask.getWidth() + "x" + mask.getHeight() +
                                                   " but expected " + width + "x" + height);
            }
        }
    }

    private static List<BinaryMask> copyAll(final List<BinaryMask> masks) {
        final List<BinaryMask> copies = new ArrayList<>(masks.size());
        for (final BinaryMask mask : masks) {
            copies.add(mask.copy());
        }
        return copies;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TerritoryPartitioner.class);
}
