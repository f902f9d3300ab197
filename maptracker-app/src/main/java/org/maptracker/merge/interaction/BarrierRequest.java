package org.maptracker.merge.interaction;

import java.awt.image.BufferedImage;
import java.util.List;

import org.maptracker.merge.mask.BinaryMask;

/**
 * Request for a barrier raster that separates the overlapping maps of one stitched group.
 */
public class BarrierRequest {

    private final String groupKey;
    private final List<String> mapNames;
    private final BufferedImage canvasPreview;
    private final BinaryMask overlap;

    /**
     * @param  groupKey       key of the stitched group.
     * @param  mapNames       names of the maps on the canvas.
     * @param  canvasPreview  copy of the stitched canvas.
     * @param  overlap        canvas pixels covered by two or more maps.
     */
    public BarrierRequest(final String groupKey,
                          final List<String> mapNames,
                          final BufferedImage canvasPreview,
                          final BinaryMask overlap) {
        this.groupKey = groupKey;
        this.mapNames = mapNames;
        this.canvasPreview = canvasPreview;
        this.overlap = overlap;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public List<String> getMapNames() {
        return mapNames;
    }

    public BufferedImage getCanvasPreview() {
        return canvasPreview;
    }

    public BinaryMask getOverlap() {
        return overlap;
    }

    public int getCanvasWidth() {
        return overlap.getWidth();
    }

    public int getCanvasHeight() {
        return overlap.getHeight();
    }

    @Override
    public String toString() {
        return "BarrierRequest{" + groupKey + ", maps=" + mapNames + ", overlapPixels=" + overlap.count() + '}';
    }
}
