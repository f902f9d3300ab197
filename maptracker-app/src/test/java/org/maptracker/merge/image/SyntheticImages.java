package org.maptracker.merge.image;

import java.awt.image.BufferedImage;
import java.util.Random;

/**
 * Builds small deterministic images for tests.
 */
public class SyntheticImages {

    private SyntheticImages() {
    }

    public static int opaqueGray(final int value) {
        return ArgbImages.argb(255, value, value, value);
    }

    /**
     * Paints the rectangle [x, x + width) x [y, y + height), clipped to the image.
     */
    public static void fillRect(final BufferedImage image,
                                final int x,
                                final int y,
                                final int width,
                                final int height,
                                final int argb) {
        final int[] pixels = ArgbImages.getPixels(image);
        for (int row = Math.max(0, y); row < Math.min(image.getHeight(), y + height); row++) {
            for (int column = Math.max(0, x); column < Math.min(image.getWidth(), x + width); column++) {
                pixels[(row * image.getWidth()) + column] = argb;
            }
        }
    }

    /**
     * @return opaque image where every pixel is land with a random gray value between 20 and 235.
     */
    public static BufferedImage texturedLand(final int width,
                                             final int height,
                                             final long seed) {
        final Random random = new Random(seed);
        final BufferedImage image = ArgbImages.newImage(width, height);
        final int[] pixels = ArgbImages.getPixels(image);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = opaqueGray(20 + random.nextInt(216));
        }
        return image;
    }

    public static BufferedImage crop(final BufferedImage source,
                                     final int x,
                                     final int y,
                                     final int width,
                                     final int height) {
        return ArgbImages.toArgb(source.getSubimage(x, y, width, height));
    }

}
