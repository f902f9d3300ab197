package org.maptracker.merge.tile;

/**
 * Corner of a grid cell that a non-standard sized tile is anchored to.
 */
public enum AlignDirection {

    LT("lt", false, false),
    RT("rt", true, false),
    LB("lb", false, true),
    RB("rb", true, true);

    private final String code;
    private final boolean right;
    private final boolean bottom;

    AlignDirection(final String code,
                   final boolean right,
                   final boolean bottom) {
        this.code = code;
        this.right = right;
        this.bottom = bottom;
    }

    public boolean isRight() {
        return right;
    }

    public boolean isBottom() {
        return bottom;
    }

    /**
     * @return direction for the specified code, where single edge codes are normalized to a corner
     *         (l and t to lt, r to rt, b to lb).
     *
     * @throws IllegalArgumentException
     *   if the code is not recognized.
     */
    public static AlignDirection fromCode(final String code)
            throws IllegalArgumentException {

        final String normalizedCode = code == null ? "" : code.trim().toLowerCase();
        switch (normalizedCode) {
            case "l":
            case "t":
                return LT;
            case "r":
                return RT;
            case "b":
                return LB;
            default:
                for (final AlignDirection direction : values()) {
                    if (direction.code.equals(normalizedCode)) {
                        return direction;
                    }
                }
        }
        throw new IllegalArgumentException("unknown alignment direction '" + code + "'");
    }

    @Override
    public String toString() {
        return code;
    }
}
