package org.maptracker.merge.tile;

import java.io.Serializable;
import java.util.Comparator;

/**
 * One based grid coordinates of a tile within its map group.
 * Keys sort in row major order (y, then x).
 */
public class TileKey
        implements Comparable<TileKey>, Serializable {

    private final int x;
    private final int y;

    public TileKey(final int x,
                   final int y) {
        this.x = x;
        this.y = y;
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public int compareTo(final TileKey that) {
        return COMPARATOR.compare(this, that);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final TileKey that = (TileKey) o;
        return (x == that.x) && (y == that.y);
    }

    @Override
    public int hashCode() {
        return 31 * x + y;
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }

    private static final Comparator<TileKey> COMPARATOR =
            Comparator.comparingInt(TileKey::getY).thenComparingInt(TileKey::getX);
}
