package org.maptracker.merge.mask;

import java.util.Arrays;

/**
 * Two dimensional binary raster stored in row major order.
 */
public class BinaryMask {

    private final int width;
    private final int height;
    private final boolean[] values;

    public BinaryMask(final int width,
                      final int height) {
        this(width, height, new boolean[width * height]);
    }

    public BinaryMask(final int width,
                      final int height,
                      final boolean[] values)
            throws IllegalArgumentException {
        if (values.length != width * height) {
            throw new IllegalArgumentException("mask with " + values.length + " values cannot have dimensions " +
                                               width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.values = values;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int getPixelCount() {
        return values.length;
    }

    public boolean get(final int index) {
        return values[index];
    }

    public boolean get(final int x,
                       final int y) {
        return values[(y * width) + x];
    }

    public void set(final int index,
                    final boolean value) {
        values[index] = value;
    }

    public void set(final int x,
                    final int y,
                    final boolean value) {
        values[(y * width) + x] = value;
    }

    /**
     * Sets every pixel of the rectangle [minX, maxX) x [minY, maxY) (clipped to this mask).
     */
    public void fill(final int minX,
                     final int minY,
                     final int maxX,
                     final int maxY,
                     final boolean value) {
        final int fromX = Math.max(0, minX);
        final int toX = Math.min(width, maxX);
        for (int y = Math.max(0, minY); y < Math.min(height, maxY); y++) {
            for (int x = fromX; x < toX; x++) {
                values[(y * width) + x] = value;
            }
        }
    }

    public int count() {
        int count = 0;
        for (final boolean value : values) {
            if (value) {
                count++;
            }
        }
        return count;
    }

    public boolean isEmpty() {
        for (final boolean value : values) {
            if (value) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return tight bounds of all set pixels, or null if no pixel is set.
     */
    public PixelBounds getBounds() {
        int minX = width;
        int minY = height;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < height; y++) {
            final int rowOffset = y * width;
            for (int x = 0; x < width; x++) {
                if (values[rowOffset + x]) {
                    if (x < minX) {
                        minX = x;
                    }
                    if (x > maxX) {
                        maxX = x;
                    }
                    if (y < minY) {
                        minY = y;
                    }
                    maxY = y;
                }
            }
        }
        return maxX < 0 ? null : new PixelBounds(minX, minY, maxX + 1, maxY + 1);
    }

    public BinaryMask copy() {
        return new BinaryMask(width, height, values.clone());
    }

    /**
     * Sets every pixel of this mask that is set in the other mask.
     */
    public void or(final BinaryMask other) {
        validateSameSize(other);
        for (int i = 0; i < values.length; i++) {
            values[i] = values[i] || other.values[i];
        }
    }

    /**
     * Clears every pixel of this mask that is set in the other mask.
     */
    public void andNot(final BinaryMask other) {
        validateSameSize(other);
        for (int i = 0; i < values.length; i++) {
            values[i] = values[i] && (! other.values[i]);
        }
    }

    /**
     * @return true if any pixel is set in both this mask and the other mask.
     */
    public boolean intersects(final BinaryMask other) {
        validateSameSize(other);
        for (int i = 0; i < values.length; i++) {
            if (values[i] && other.values[i]) {
                return true;
            }
        }
        return false;
    }

    private void validateSameSize(final BinaryMask other)
            throws IllegalArgumentException {
        if ((width != other.width) || (height != other.height)) {
            throw new IllegalArgumentException("mask dimensions " + other.width + "x" + other.height +
                                               " differ from " + width + "x" + height);
        }
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final BinaryMask that = (BinaryMask) o;
        return (width == that.width) && (height == that.height) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "BinaryMask{" + width + "x" + height + ", count=" + count() + '}';
    }
}
