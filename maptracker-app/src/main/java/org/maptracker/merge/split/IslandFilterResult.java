package org.maptracker.merge.split;

import java.awt.image.BufferedImage;

/**
 * Outcome of removing islands from one map.
 */
public class IslandFilterResult {

    private final BufferedImage image;
    private final int removedPixelCount;
    private final int removedComponentCount;
    private final boolean centerHasLand;

    public IslandFilterResult(final BufferedImage image,
                              final int removedPixelCount,
                              final int removedComponentCount,
                              final boolean centerHasLand) {
        this.image = image;
        this.removedPixelCount = removedPixelCount;
        this.removedComponentCount = removedComponentCount;
        this.centerHasLand = centerHasLand;
    }

    /**
     * @return filtered copy of the map (never the instance that was filtered).
     */
    public BufferedImage getImage() {
        return image;
    }

    public int getRemovedPixelCount() {
        return removedPixelCount;
    }

    public int getRemovedComponentCount() {
        return removedComponentCount;
    }

    /**
     * @return false if the center region held no land and the map was therefore kept unchanged.
     */
    public boolean isCenterHasLand() {
        return centerHasLand;
    }
}
