package org.maptracker.merge.mask;

import java.io.Serializable;

/**
 * Rectangular pixel region with inclusive minimum and exclusive maximum coordinates.
 */
public class PixelBounds
        implements Serializable {

    private final int minX;
    private final int minY;
    private final int maxX;
    private final int maxY;

    public PixelBounds(final int minX,
                       final int minY,
                       final int maxX,
                       final int maxY) {
        this.minX = minX;
        this.minY = minY;
        this.maxX = maxX;
        this.maxY = maxY;
    }

    public int getMinX() {
        return minX;
    }

    public int getMinY() {
        return minY;
    }

    public int getMaxX() {
        return maxX;
    }

    public int getMaxY() {
        return maxY;
    }

    public int getWidth() {
        return maxX - minX;
    }

    public int getHeight() {
        return maxY - minY;
    }

    /**
     * @return true if these bounds intersect the other bounds after translating the other bounds by (dx, dy).
     */
    public boolean intersects(final PixelBounds other,
                              final int dx,
                              final int dy) {
        return (other.minX + dx < maxX) && (other.maxX + dx > minX) &&
               (other.minY + dy < maxY) && (other.maxY + dy > minY);
    }

    /**
     * @return [minX, minY, maxX, maxY] array for JSON export.
     */
    public int[] toArray() {
        return new int[] { minX, minY, maxX, maxY };
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final PixelBounds that = (PixelBounds) o;
        return (minX == that.minX) && (minY == that.minY) && (maxX == that.maxX) && (maxY == that.maxY);
    }

    @Override
    public int hashCode() {
        int result = minX;
        result = 31 * result + minY;
        result = 31 * result + maxX;
        result = 31 * result + maxY;
        return result;
    }

    @Override
    public String toString() {
        return "[" + minX + "," + minY + "]-[" + maxX + "," + maxY + "]";
    }
}
