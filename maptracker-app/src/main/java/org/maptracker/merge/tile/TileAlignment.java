package org.maptracker.merge.tile;

import java.io.Serializable;
import java.util.Objects;

/**
 * Alignment decision for one tile.
 */
public class TileAlignment
        implements Serializable {

    private final AlignMode mode;
    private final AlignDirection direction;

    public TileAlignment(final AlignMode mode,
                         final AlignDirection direction) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.direction = Objects.requireNonNull(direction, "direction");
    }

    public static TileAlignment auto(final AlignDirection direction) {
        return new TileAlignment(AlignMode.AUTO, direction);
    }

    /**
     * @return manual alignment marker with the initial direction used until the direction is resolved.
     */
    public static TileAlignment manual() {
        return new TileAlignment(AlignMode.MANUAL, AlignDirection.LT);
    }

    public AlignMode getMode() {
        return mode;
    }

    public AlignDirection getDirection() {
        return direction;
    }

    public boolean isManual() {
        return AlignMode.MANUAL.equals(mode);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final TileAlignment that = (TileAlignment) o;
        return (mode == that.mode) && (direction == that.direction);
    }

    @Override
    public int hashCode() {
        return Objects.hash(mode, direction);
    }

    @Override
    public String toString() {
        return mode + ":" + direction;
    }
}
