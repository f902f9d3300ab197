package org.maptracker.merge.match;

import java.io.Serializable;

/**
 * Offset of one map relative to another along with the similarity of their overlapping land.
 */
public class OverlapMatch
        implements Serializable {

    private final int dx;
    private final int dy;
    private final double score;

    public OverlapMatch(final int dx,
                        final int dy,
                        final double score) {
        this.dx = dx;
        this.dy = dy;
        this.score = score;
    }

    public int getDx() {
        return dx;
    }

    public int getDy() {
        return dy;
    }

    public double getScore() {
        return score;
    }

    @Override
    public String toString() {
        return String.format("offset=(%d,%d) score=%.4f", dx, dy, score);
    }
}
