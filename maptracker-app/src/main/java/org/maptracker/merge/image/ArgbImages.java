package org.maptracker.merge.image;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.util.Arrays;

/**
 * Utility methods for packed ARGB images.
 * All rasters produced by this project are {@link BufferedImage#TYPE_INT_ARGB} images
 * whose pixel arrays can be accessed directly.
 */
public class ArgbImages {

    public static final int OPAQUE_BLACK = 0xff000000;

    private ArgbImages() {
    }

    public static BufferedImage newImage(final int width,
                                         final int height) {
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    public static BufferedImage newFilledImage(final int width,
                                               final int height,
                                               final int argb) {
        final BufferedImage image = newImage(width, height);
        Arrays.fill(getPixels(image), argb);
        return image;
    }

    /**
     * @return the backing pixel array of the specified image (changes write through to the image).
     *
     * @throws IllegalArgumentException
     *   if the image is not a TYPE_INT_ARGB image.
     */
    public static int[] getPixels(final BufferedImage image)
            throws IllegalArgumentException {
        if (image.getType() != BufferedImage.TYPE_INT_ARGB) {
            throw new IllegalArgumentException("image type " + image.getType() + " is not TYPE_INT_ARGB");
        }
        return ((DataBufferInt) image.getRaster().getDataBuffer()).getData();
    }

    /**
     * @return a TYPE_INT_ARGB copy of the specified image with non-premultiplied pixel values.
     *         Images without an alpha channel become fully opaque.
     */
    public static BufferedImage toArgb(final BufferedImage source) {
        final int width = source.getWidth();
        final int height = source.getHeight();
        final BufferedImage copy = newImage(width, height);
        source.getRGB(0, 0, width, height, getPixels(copy), 0, width);
        return copy;
    }

    /**
     * @return copy of the specified image with every alpha value set to 255 (color values are kept).
     */
    public static BufferedImage toOpaque(final BufferedImage source) {
        final BufferedImage copy = toArgb(source);
        final int[] pixels = getPixels(copy);
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = pixels[i] | OPAQUE_BLACK;
        }
        return copy;
    }

    public static int alpha(final int argb) {
        return (argb >>> 24) & 0xff;
    }

    public static int red(final int argb) {
        return (argb >> 16) & 0xff;
    }

    public static int green(final int argb) {
        return (argb >> 8) & 0xff;
    }

    public static int blue(final int argb) {
        return argb & 0xff;
    }

    public static int argb(final int alpha,
                           final int red,
                           final int green,
                           final int blue) {
        return (alpha << 24) | (red << 16) | (green << 8) | blue;
    }

    /**
     * @return ITU-R 601 luma of the specified pixel using 14 bit fixed point weights (alpha is ignored).
     */
    public static int gray(final int argb) {
        return (red(argb) * 4899 + green(argb) * 9617 + blue(argb) * 1868 + 8192) >> 14;
    }

    /**
     * @return gray values for every pixel of the specified image.
     */
    public static int[] grayValues(final BufferedImage image) {
        final int[] pixels = getPixels(image);
        final int[] gray = new int[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            gray[i] = gray(pixels[i]);
        }
        return gray;
    }

}
