package org.maptracker.merge.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for finding grid-aligned overlaps between merged maps.
 * The default threshold values were tuned for one tile set and may need adjustment for others.
 */
public class OverlapMatchParameters
        implements Serializable {

    @Parameter(
            names = "--matchScoreThreshold",
            description = "Minimum grayscale similarity score (0 to 1) for an offset to be accepted as a match")
    public Double matchScoreThreshold = 0.85;

    @Parameter(
            names = "--minOverlapContentFraction",
            description = "Minimum number of jointly land pixels in an overlap, " +
                          "expressed as a fraction of one grid step cell")
    public Double minOverlapContentFraction = 0.30;

    @Parameter(
            names = "--landGrayThreshold",
            description = "Pixels with a gray value above this threshold are considered land")
    public Integer landGrayThreshold = 1;

    @Parameter(
            names = "--includeZeroOffset",
            description = "Also evaluate the (0, 0) offset when matching maps (skipped by default)",
            arity = 0)
    public boolean includeZeroOffset = false;

    public void validate()
            throws IllegalArgumentException {
        if ((matchScoreThreshold == null) || (matchScoreThreshold < 0.0) || (matchScoreThreshold > 1.0)) {
            throw new IllegalArgumentException("matchScoreThreshold must be between 0 and 1");
        }
        if ((minOverlapContentFraction == null) || (minOverlapContentFraction < 0.0)) {
            throw new IllegalArgumentException("minOverlapContentFraction must not be negative");
        }
    }

}
