package org.maptracker.merge.match;

import java.awt.image.BufferedImage;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.ContentMasks;
import org.maptracker.merge.mask.PixelBounds;

/**
 * A merged map together with the derived data needed to match it against other maps.
 * Derived data is computed once at construction.
 */
public class MapContent {

    private final String name;
    private final BufferedImage image;
    private final int[] grayValues;
    private final BinaryMask landMask;
    private final PixelBounds contentBounds;

    /**
     * @param  name           map name.
     * @param  image          map pixels (the alpha channel is ignored).
     * @param  grayThreshold  pixels with a gray value above this threshold are land.
     */
    public MapContent(final String name,
                      final BufferedImage image,
                      final int grayThreshold) {
        this.name = name;
        this.image = ArgbImages.toOpaque(image);
        this.grayValues = ArgbImages.grayValues(this.image);
        this.landMask = ContentMasks.land(this.image, grayThreshold);
        this.contentBounds = landMask.getBounds();
    }

    public String getName() {
        return name;
    }

    /**
     * @return opaque copy of the map pixels.
     */
    public BufferedImage getImage() {
        return image;
    }

    public int getWidth() {
        return image.getWidth();
    }

    public int getHeight() {
        return image.getHeight();
    }

    public int getGray(final int x,
                       final int y) {
        return grayValues[(y * image.getWidth()) + x];
    }

    public BinaryMask getLandMask() {
        return landMask;
    }

    /**
     * @return tight bounds of the map's land pixels, or null if the map has no land.
     */
    public PixelBounds getContentBounds() {
        return contentBounds;
    }

    @Override
    public String toString() {
        return name + " (" + getWidth() + "x" + getHeight() + ")";
    }
}
