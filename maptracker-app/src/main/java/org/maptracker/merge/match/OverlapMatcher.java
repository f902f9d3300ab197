package org.maptracker.merge.match;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.PixelBounds;
import org.maptracker.merge.parameters.OverlapMatchParameters;
import org.maptracker.merge.parameters.TileGridParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finds the grid-aligned offset at which two merged maps overlap best.
 *
 * Only offsets that are (rounded) multiples of the tile grid step are evaluated.
 * Offsets whose translated content bounding boxes do not intersect are pruned before any
 * pixel comparison. The remaining offsets are scored by the mean absolute gray value
 * difference of the pixels that are land in both maps:
 * <pre>
 *     score = 1 - mean(|grayA - grayB|) / 255
 * </pre>
 * The highest score above the threshold wins. Offsets are scanned column by column
 * (x outer, y inner) and the first offset with the maximum score is kept.
 */
public class OverlapMatcher {

    private final double stepX;
    private final double stepY;
    private final double scoreThreshold;
    private final double minOverlapContent;
    private final boolean includeZeroOffset;

    public OverlapMatcher(final TileGridParameters gridParameters,
                          final OverlapMatchParameters matchParameters) {
        this(gridParameters.getStepX(),
             gridParameters.getStepY(),
             matchParameters.matchScoreThreshold,
             matchParameters.minOverlapContentFraction,
             matchParameters.includeZeroOffset);
    }

    /**
     * @param  stepX                      horizontal grid step in map pixels.
     * @param  stepY                      vertical grid step in map pixels.
     * @param  scoreThreshold             a match score must be greater than this value.
     * @param  minOverlapContentFraction  minimum jointly land pixel count as a fraction of one step cell.
     * @param  includeZeroOffset          indicates whether the (0, 0) offset should be evaluated.
     */
    public OverlapMatcher(final double stepX,
                          final double stepY,
                          final double scoreThreshold,
                          final double minOverlapContentFraction,
                          final boolean includeZeroOffset) {
        if ((stepX <= 0) || (stepY <= 0)) {
            throw new IllegalArgumentException("grid steps must be positive");
        }
        this.stepX = stepX;
        this.stepY = stepY;
        this.scoreThreshold = scoreThreshold;
        this.minOverlapContent = Math.rint(stepX) * Math.rint(stepY) * minOverlapContentFraction;
        this.includeZeroOffset = includeZeroOffset;
    }

    public double getMinOverlapContent() {
        return minOverlapContent;
    }

    /**
     * @return best offset of map b relative to map a, or null if no offset scores above the threshold.
     */
    public OverlapMatch match(final MapContent a,
                              final MapContent b) {

        final PixelBounds boundsA = a.getContentBounds();
        final PixelBounds boundsB = b.getContentBounds();
        if ((boundsA == null) || (boundsB == null)) {
            return null;
        }

        final int widthA = a.getWidth();
        final int heightA = a.getHeight();
        final int widthB = b.getWidth();
        final int heightB = b.getHeight();

        final int tilesAx = toGridCount(widthA, stepX);
        final int tilesAy = toGridCount(heightA, stepY);
        final int tilesBx = toGridCount(widthB, stepX);
        final int tilesBy = toGridCount(heightB, stepY);

        final BinaryMask landA = a.getLandMask();
        final BinaryMask landB = b.getLandMask();

        OverlapMatch best = null;

        for (int nx = -(tilesBx - 1); nx < tilesAx; nx++) {
            for (int ny = -(tilesBy - 1); ny < tilesAy; ny++) {

                if ((nx == 0) && (ny == 0) && (! includeZeroOffset)) {
                    continue;
                }

                final int dx = (int) Math.rint(nx * stepX);
                final int dy = (int) Math.rint(ny * stepY);

                if (! boundsA.intersects(boundsB, dx, dy)) {
                    continue;
                }

                final int overlapMinX = Math.max(0, dx);
                final int overlapMinY = Math.max(0, dy);
                final int overlapMaxX = Math.min(widthA, dx + widthB);
                final int overlapMaxY = Math.min(heightA, dy + heightB);
                if ((overlapMaxX <= overlapMinX) || (overlapMaxY <= overlapMinY)) {
                    continue;
                }

                long jointLandCount = 0;
                long differenceSum = 0;
                for (int y = overlapMinY; y < overlapMaxY; y++) {
                    final int yB = y - dy;
                    for (int x = overlapMinX; x < overlapMaxX; x++) {
                        final int xB = x - dx;
                        if (landA.get(x, y) && landB.get(xB, yB)) {
                            jointLandCount++;
                            differenceSum += Math.abs(a.getGray(x, y) - b.getGray(xB, yB));
                        }
                    }
                }

                if ((jointLandCount == 0) || (jointLandCount < minOverlapContent)) {
                    continue;
                }

                final double score = 1.0 - (((double) differenceSum / jointLandCount) / 255.0);

                if ((score > scoreThreshold) && ((best == null) || (score > best.getScore()))) {
                    best = new OverlapMatch(dx, dy, score);
                }
            }
        }

        return best;
    }

    /**
     * Matches every pair of maps (in name order).
     *
     * @return edges for all matched pairs, where each edge's p map precedes its q map in name order.
     */
    public List<OverlapEdge> matchAllPairs(final List<MapContent> maps) {

        final List<MapContent> sortedMaps = new ArrayList<>(maps);
        sortedMaps.sort(Comparator.comparing(MapContent::getName));

        final int mapCount = sortedMaps.size();
        final int pairCount = mapCount * (mapCount - 1) / 2;

        LOG.info("matchAllPairs: searching for overlaps across {} pair(s)", pairCount);

        final List<OverlapEdge> edges = new ArrayList<>();
        int pairIndex = 0;
        for (int i = 0; i < mapCount; i++) {
            for (int j = i + 1; j < mapCount; j++) {
                pairIndex++;
                final MapContent a = sortedMaps.get(i);
                final MapContent b = sortedMaps.get(j);
                final OverlapMatch match = match(a, b);
                if (match == null) {
                    LOG.info("matchAllPairs: [{}/{}] {} <-> {} no overlap",
                             pairIndex, pairCount, a.getName(), b.getName());
                } else {
                    LOG.info("matchAllPairs: [{}/{}] {} <-> {} matched {}",
                             pairIndex, pairCount, a.getName(), b.getName(), match);
                    edges.add(new OverlapEdge(a.getName(), b.getName(), match));
                }
            }
        }

        return edges;
    }

    private static int toGridCount(final int size,
                                   final double step) {
        return (int) Math.rint(size / step);
    }

    private static final Logger LOG = LoggerFactory.getLogger(OverlapMatcher.class);
}
