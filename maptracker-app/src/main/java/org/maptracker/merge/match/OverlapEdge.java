package org.maptracker.merge.match;

import java.io.Serializable;

/**
 * Matched pair of maps where the q map is located at offset (dx, dy) relative to the p map.
 */
public class OverlapEdge
        implements Serializable {

    private final String pName;
    private final String qName;
    private final int dx;
    private final int dy;
    private final double score;

    public OverlapEdge(final String pName,
                       final String qName,
                       final int dx,
                       final int dy,
                       final double score) {
        this.pName = pName;
        this.qName = qName;
        this.dx = dx;
        this.dy = dy;
        this.score = score;
    }

    public OverlapEdge(final String pName,
                       final String qName,
                       final OverlapMatch match) {
        this(pName, qName, match.getDx(), match.getDy(), match.getScore());
    }

    public String getpName() {
        return pName;
    }

    public String getqName() {
        return qName;
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

    /**
     * @return the same relationship seen from the q map.
     */
    public OverlapEdge reverse() {
        return new OverlapEdge(qName, pName, -dx, -dy, score);
    }

    @Override
    public String toString() {
        return String.format("%s <-> %s offset=(%d,%d) score=%.4f", pName, qName, dx, dy, score);
    }
}
