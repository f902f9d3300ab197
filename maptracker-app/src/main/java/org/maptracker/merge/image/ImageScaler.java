package org.maptracker.merge.image;

import ij.process.ByteProcessor;
import ij.process.ColorProcessor;
import ij.process.ImageProcessor;

import java.awt.image.BufferedImage;

/**
 * Bilinear resizing of ARGB images.
 * Color and alpha are resized independently so that transparent areas keep their color values.
 */
public class ImageScaler {

    private ImageScaler() {
    }

    /**
     * @return the scaled size for one dimension (never less than one pixel).
     */
    public static int getScaledSize(final int size,
                                    final double scale) {
        return Math.max(1, (int) (size * scale));
    }

    public static BufferedImage scale(final BufferedImage source,
                                      final double scale) {
        return resize(source,
                      getScaledSize(source.getWidth(), scale),
                      getScaledSize(source.getHeight(), scale));
    }

    public static BufferedImage resize(final BufferedImage source,
                                       final int width,
                                       final int height) {

        final BufferedImage argbSource = ArgbImages.toArgb(source);
        if ((width == argbSource.getWidth()) && (height == argbSource.getHeight())) {
            return argbSource;
        }

        final int[] sourcePixels = ArgbImages.getPixels(argbSource);
        final int[] rgb = new int[sourcePixels.length];
        final byte[] alpha = new byte[sourcePixels.length];
        for (int i = 0; i < sourcePixels.length; i++) {
            rgb[i] = sourcePixels[i] & 0x00ffffff;
            alpha[i] = (byte) ArgbImages.alpha(sourcePixels[i]);
        }

        final ImageProcessor colorProcessor = new ColorProcessor(argbSource.getWidth(), argbSource.getHeight(), rgb);
        colorProcessor.setInterpolationMethod(ImageProcessor.BILINEAR);
        final ImageProcessor alphaProcessor = new ByteProcessor(argbSource.getWidth(), argbSource.getHeight(), alpha);
        alphaProcessor.setInterpolationMethod(ImageProcessor.BILINEAR);

        final int[] scaledRgb = (int[]) colorProcessor.resize(width, height).getPixels();
        final byte[] scaledAlpha = (byte[]) alphaProcessor.resize(width, height).getPixels();

        final BufferedImage scaled = ArgbImages.newImage(width, height);
        final int[] scaledPixels = ArgbImages.getPixels(scaled);
        for (int i = 0; i < scaledPixels.length; i++) {
            scaledPixels[i] = ((scaledAlpha[i] & 0xff) << 24) | (scaledRgb[i] & 0x00ffffff);
        }

        return scaled;
    }

}
