package org.maptracker.merge.mask;

import java.awt.image.BufferedImage;

import org.maptracker.merge.image.ArgbImages;

/**
 * Derives binary content masks from ARGB images.
 */
public class ContentMasks {

    /** Fraction of full brightness that a pixel must exceed to be included in exported map bounds. */
    public static final double DEFAULT_BOUNDS_BRIGHTNESS_FRACTION = 0.05;

    private ContentMasks() {
    }

    /**
     * @return mask of land pixels, i.e. pixels whose gray value is greater than the threshold
     *         (the alpha channel is ignored).
     */
    public static BinaryMask land(final BufferedImage image,
                                  final int grayThreshold) {
        final int[] pixels = ArgbImages.getPixels(image);
        final boolean[] values = new boolean[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            values[i] = ArgbImages.gray(pixels[i]) > grayThreshold;
        }
        return new BinaryMask(image.getWidth(), image.getHeight(), values);
    }

    /**
     * @return mask of pixels whose mean red, green and blue value is greater than the threshold.
     */
    public static BinaryMask bright(final BufferedImage image,
                                    final double brightnessThreshold) {
        final int[] pixels = ArgbImages.getPixels(image);
        final boolean[] values = new boolean[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            final int p = pixels[i];
            final double brightness = (ArgbImages.red(p) + ArgbImages.green(p) + ArgbImages.blue(p)) / 3.0;
            values[i] = brightness > brightnessThreshold;
        }
        return new BinaryMask(image.getWidth(), image.getHeight(), values);
    }

    /**
     * @return bounds of the bright content in the specified image, or null if the image has no bright content.
     */
    public static PixelBounds brightContentBounds(final BufferedImage image) {
        return bright(image, DEFAULT_BOUNDS_BRIGHTNESS_FRACTION * 255.0).getBounds();
    }

    /**
     * @return copy of the specified image with the alpha of every non-land pixel set to zero
     *         so that compositing it cannot erase content already on a canvas.
     */
    public static BufferedImage withLandOnlyAlpha(final BufferedImage image,
                                                  final BinaryMask landMask) {
        final BufferedImage copy = ArgbImages.toOpaque(image);
        final int[] pixels = ArgbImages.getPixels(copy);
        for (int i = 0; i < pixels.length; i++) {
            if (! landMask.get(i)) {
                pixels[i] = pixels[i] & 0x00ffffff;
            }
        }
        return copy;
    }

    /**
     * @return a canvas sized mask containing the specified mask with its top left corner at (x, y)
     *         (pixels outside of the canvas are dropped).
     */
    public static BinaryMask placeOnCanvas(final BinaryMask mask,
                                           final int x,
                                           final int y,
                                           final int canvasWidth,
                                           final int canvasHeight) {
        final BinaryMask placed = new BinaryMask(canvasWidth, canvasHeight);
        final int fromX = Math.max(0, x);
        final int toX = Math.min(canvasWidth, x + mask.getWidth());
        for (int canvasY = Math.max(0, y); canvasY < Math.min(canvasHeight, y + mask.getHeight()); canvasY++) {
            for (int canvasX = fromX; canvasX < toX; canvasX++) {
                if (mask.get(canvasX - x, canvasY - y)) {
                    placed.set(canvasX, canvasY, true);
                }
            }
        }
        return placed;
    }

}
