package org.maptracker.merge.tile;

import java.io.Serializable;
import java.util.Collection;

/**
 * Maximum one based grid coordinates covered by a map group.
 */
public class GridExtent
        implements Serializable {

    private final int maxX;
    private final int maxY;

    public GridExtent(final int maxX,
                      final int maxY)
            throws IllegalArgumentException {
        if ((maxX < 1) || (maxY < 1)) {
            throw new IllegalArgumentException("grid extent " + maxX + "x" + maxY + " must be at least 1x1");
        }
        this.maxX = maxX;
        this.maxY = maxY;
    }

    /**
     * @return extent that covers all of the specified keys.
     *
     * @throws IllegalArgumentException
     *   if no keys are specified.
     */
    public static GridExtent of(final Collection<TileKey> keys)
            throws IllegalArgumentException {
        int maxX = 0;
        int maxY = 0;
        for (final TileKey key : keys) {
            maxX = Math.max(maxX, key.getX());
            maxY = Math.max(maxY, key.getY());
        }
        return new GridExtent(maxX, maxY);
    }

    public int getMaxX() {
        return maxX;
    }

    public int getMaxY() {
        return maxY;
    }

    @Override
    public String toString() {
        return maxX + "x" + maxY;
    }
}
