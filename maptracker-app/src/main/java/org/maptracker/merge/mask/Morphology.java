package org.maptracker.merge.mask;

/**
 * Binary dilation with small structuring elements.
 * Pixels outside of a mask never contribute to a dilation.
 */
public class Morphology {

    /** 3x3 cross: the center pixel and its four edge neighbors. */
    public static final boolean[][] CROSS_3X3 = {
            { false, true, false },
            { true,  true, true  },
            { false, true, false }
    };

    /** 5x5 ellipse with the same shape as the common image processing library element of that size. */
    public static final boolean[][] ELLIPSE_5X5 = {
            { false, false, true, false, false },
            { true,  true,  true, true,  true  },
            { true,  true,  true, true,  true  },
            { true,  true,  true, true,  true  },
            { false, false, true, false, false }
    };

    private Morphology() {
    }

    /**
     * @return the mask dilated once with a 3x3 cross, which closes diagonal one pixel gaps.
     */
    public static BinaryMask dilateCross(final BinaryMask mask) {
        return dilate(mask, CROSS_3X3, 1);
    }

    /**
     * @return copy of the mask dilated the specified number of times with the specified
     *         (odd sized, centered) structuring element.
     */
    public static BinaryMask dilate(final BinaryMask mask,
                                    final boolean[][] element,
                                    final int iterations) {

        final int width = mask.getWidth();
        final int height = mask.getHeight();
        final int radiusY = element.length / 2;
        final int radiusX = element[0].length / 2;

        BinaryMask current = mask.copy();
        for (int i = 0; i < iterations; i++) {
            final BinaryMask dilated = new BinaryMask(width, height);
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    if (current.get(x, y)) {
                        for (int ey = 0; ey < element.length; ey++) {
                            final int ty = y + ey - radiusY;
                            if ((ty < 0) || (ty >= height)) {
                                continue;
                            }
                            for (int ex = 0; ex < element[ey].length; ex++) {
                                final int tx = x + ex - radiusX;
                                if (element[ey][ex] && (tx >= 0) && (tx < width)) {
                                    dilated.set(tx, ty, true);
                                }
                            }
                        }
                    }
                }
            }
            current = dilated;
        }

        return current;
    }

}
