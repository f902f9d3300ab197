package org.maptracker.merge.split;

import java.awt.image.BufferedImage;
import java.util.HashSet;
import java.util.Set;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.ComponentLabels;
import org.maptracker.merge.mask.ConnectedComponents;
import org.maptracker.merge.mask.ContentMasks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Removes land fragments that are not connected to the center of a map.
 *
 * Merged maps often contain slivers of neighboring maps along their edges.
 * The land component(s) touching a small region around the map center form the map's
 * continent, every other 8-connected land component is an island and is painted opaque black.
 */
public class IslandFilter {

    private final double centerMargin;
    private final int landGrayThreshold;

    /**
     * @param  centerMargin       half size of the center region as a fraction of the map width and height.
     * @param  landGrayThreshold  pixels with a gray value above this threshold are land.
     */
    public IslandFilter(final double centerMargin,
                        final int landGrayThreshold) {
        this.centerMargin = centerMargin;
        this.landGrayThreshold = landGrayThreshold;
    }

    public IslandFilterResult filter(final String mapName,
                                     final BufferedImage image) {

        final BufferedImage result = ArgbImages.toOpaque(image);
        final int width = result.getWidth();
        final int height = result.getHeight();

        final BinaryMask land = ContentMasks.land(result, landGrayThreshold);
        final ComponentLabels labels = ConnectedComponents.label(land, ConnectedComponents.Connectivity.EIGHT);

        final int centerX = width / 2;
        final int centerY = height / 2;
        final int marginX = Math.max(1, (int) (width * centerMargin));
        final int marginY = Math.max(1, (int) (height * centerMargin));

        final int minX = Math.max(0, centerX - marginX);
        final int maxX = Math.min(width - 1, centerX + marginX);
        final int minY = Math.max(0, centerY - marginY);
        final int maxY = Math.min(height - 1, centerY + marginY);

        final Set<Integer> continentLabels = new HashSet<>();
        for (int y = minY; y <= maxY; y++) {
            for (int x = minX; x <= maxX; x++) {
                final int label = labels.getLabel(x, y);
                if (label > 0) {
                    continentLabels.add(label);
                }
            }
        }

        if (continentLabels.isEmpty()) {
            LOG.warn("filter: {} has no land at its center, keeping all {} component(s)",
                     mapName, labels.getComponentCount());
            return new IslandFilterResult(result, 0, 0, false);
        }

        final int[] pixels = ArgbImages.getPixels(result);
        int removedPixelCount = 0;
        for (int i = 0; i < pixels.length; i++) {
            final int label = labels.getLabel(i);
            if ((label > 0) && (! continentLabels.contains(label))) {
                pixels[i] = ArgbImages.OPAQUE_BLACK;
                removedPixelCount++;
            }
        }

        final int removedComponentCount = labels.getComponentCount() - continentLabels.size();

        if (removedPixelCount > 0) {
            LOG.info("filter: {} removed {} island pixels ({} component(s))",
                     mapName, removedPixelCount, removedComponentCount);
        }

        return new IslandFilterResult(result, removedPixelCount, removedComponentCount, true);
    }

    private static final Logger LOG = LoggerFactory.getLogger(IslandFilter.class);
}
