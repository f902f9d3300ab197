package org.maptracker.merge.split;

import java.awt.image.BufferedImage;

import org.maptracker.merge.mask.PixelBounds;

/**
 * Exported part of a stitched canvas owned by one map.
 */
public class Territory {

    private final String mapName;
    private final PixelBounds canvasBounds;
    private final BufferedImage image;

    public Territory(final String mapName,
                     final PixelBounds canvasBounds,
                     final BufferedImage image) {
        this.mapName = mapName;
        this.canvasBounds = canvasBounds;
        this.image = image;
    }

    public String getMapName() {
        return mapName;
    }

    /**
     * @return canvas bounds (exclusive max) of the owned pixels.
     */
    public PixelBounds getCanvasBounds() {
        return canvasBounds;
    }

    /**
     * @return opaque image cropped to the canvas bounds where pixels not owned by the map are black.
     */
    public BufferedImage getImage() {
        return image;
    }

    @Override
    public String toString() {
        return mapName + " " + canvasBounds;
    }
}
