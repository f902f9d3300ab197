package org.maptracker.merge.match;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Integer canvas position of a map's top left corner.
 */
public class CanvasPosition
        implements Comparable<CanvasPosition>, Serializable {

    private final int x;
    private final int y;

    public CanvasPosition(final int x,
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
    public int compareTo(final CanvasPosition that) {
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
        final CanvasPosition that = (CanvasPosition) o;
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

    private static final Comparator<CanvasPosition> COMPARATOR =
            Comparator.comparingInt(CanvasPosition::getX).thenComparingInt(CanvasPosition::getY);
}
