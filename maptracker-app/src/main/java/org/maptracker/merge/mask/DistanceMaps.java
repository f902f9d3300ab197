package org.maptracker.merge.mask;

import ij.plugin.filter.EDM;
import ij.process.ByteProcessor;
import ij.process.FloatProcessor;

/**
 * Euclidean distance maps backed by the ImageJ EDM implementation.
 */
public class DistanceMaps {

    private DistanceMaps() {
    }

    /**
     * @return for every pixel, the Euclidean distance to the nearest set pixel of the target mask
     *         (0 for the target pixels themselves).
     *
     * @throws IllegalArgumentException
     *   if the target mask is empty.
     */
    public static float[] distanceToMask(final BinaryMask target)
            throws IllegalArgumentException {

        if (target.isEmpty()) {
            throw new IllegalArgumentException("cannot derive distances to an empty mask");
        }

        // EDM measures distance from foreground pixels to the nearest background pixel,
        // so the target has to be the background (0) of the processed image
        final byte[] pixels = new byte[target.getPixelCount()];
        for (int i = 0; i < pixels.length; i++) {
            if (! target.get(i)) {
                pixels[i] = (byte) 255;
            }
        }
        final ByteProcessor notTarget = new ByteProcessor(target.getWidth(), target.getHeight(), pixels);

        final FloatProcessor distances = new EDM().makeFloatEDM(notTarget, 0, false);
        return (float[]) distances.getPixels();
    }

}
