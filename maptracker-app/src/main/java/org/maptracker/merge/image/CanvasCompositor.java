package org.maptracker.merge.image;

import java.awt.image.BufferedImage;

/**
 * Pastes images onto a canvas, optionally blending them with the canvas using their alpha channel.
 *
 * The canvas is modified in place and must not be shared with another compositing step
 * while a paste is in progress.
 */
public class CanvasCompositor {

    /**
     * Pastes the source image onto the canvas with its top left corner at (x, y).
     * Source pixels that fall outside of the canvas are dropped.
     *
     * @param  canvas     TYPE_INT_ARGB canvas to modify.
     * @param  source     image to paste.
     * @param  x          canvas x position for the left edge of the source.
     * @param  y          canvas y position for the top edge of the source.
     * @param  withAlpha  if true and the source has an alpha channel, blend source over canvas;
     *                    otherwise overwrite the covered canvas region.
     */
    public void paste(final BufferedImage canvas,
                      final BufferedImage source,
                      final int x,
                      final int y,
                      final boolean withAlpha) {

        final int canvasWidth = canvas.getWidth();
        final int canvasHeight = canvas.getHeight();

        final int x0 = Math.max(0, x);
        final int y0 = Math.max(0, y);
        final int x1 = Math.min(canvasWidth, x + source.getWidth());
        final int y1 = Math.min(canvasHeight, y + source.getHeight());

        if ((x1 <= x0) || (y1 <= y0)) {
            return;
        }

        final int regionWidth = x1 - x0;
        final int regionHeight = y1 - y0;
        final int[] sourcePixels = source.getRGB(x0 - x, y0 - y, regionWidth, regionHeight, null, 0, regionWidth);
        final int[] canvasPixels = ArgbImages.getPixels(canvas);

        final boolean blend = withAlpha && source.getColorModel().hasAlpha();

        for (int row = 0; row < regionHeight; row++) {
            final int canvasOffset = ((y0 + row) * canvasWidth) + x0;
            final int sourceOffset = row * regionWidth;
            if (blend) {
                for (int column = 0; column < regionWidth; column++) {
                    final int canvasIndex = canvasOffset + column;
                    canvasPixels[canvasIndex] = blend(sourcePixels[sourceOffset + column], canvasPixels[canvasIndex]);
                }
            } else {
                System.arraycopy(sourcePixels, sourceOffset, canvasPixels, canvasOffset, regionWidth);
            }
        }
    }

    /**
     * @return result of placing the foreground pixel over the background pixel
     *         (zero when the combined alpha is zero).
     */
    public static int blend(final int foreground,
                            final int background) {

        final float alphaForeground = ArgbImages.alpha(foreground) / 255.0f;
        final float alphaBackground = ArgbImages.alpha(background) / 255.0f;
        final float backgroundWeight = alphaBackground * (1.0f - alphaForeground);
        final float outAlpha = alphaForeground + backgroundWeight;

        if (outAlpha <= 0.0f) {
            return 0;
        }

        final int red = blendChannel(ArgbImages.red(foreground), ArgbImages.red(background),
                                     alphaForeground, backgroundWeight, outAlpha);
        final int green = blendChannel(ArgbImages.green(foreground), ArgbImages.green(background),
                                       alphaForeground, backgroundWeight, outAlpha);
        final int blue = blendChannel(ArgbImages.blue(foreground), ArgbImages.blue(background),
                                      alphaForeground, backgroundWeight, outAlpha);

        // alpha is rounded so that blending over an opaque pixel stays opaque
        return ArgbImages.argb(clip((outAlpha * 255.0f) + 0.5f), red, green, blue);
    }

    private static int blendChannel(final int foreground,
                                    final int background,
                                    final float alphaForeground,
                                    final float backgroundWeight,
                                    final float outAlpha) {
        return clip(((foreground * alphaForeground) + (background * backgroundWeight)) / outAlpha);
    }

    private static int clip(final float value) {
        if (value <= 0.0f) {
            return 0;
        } else if (value >= 255.0f) {
            return 255;
        }
        return (int) value;
    }

}
