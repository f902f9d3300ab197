package org.maptracker.merge.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for stitched layouts, island removal and territory partitioning.
 */
public class TerritoryParameters
        implements Serializable {

    @Parameter(
            names = "--componentGap",
            description = "Horizontal pixel gap between disconnected groups of stitched maps")
    public Integer componentGap = 20;

    @Parameter(
            names = "--islandCenterMargin",
            description = "Half size of the center region used to identify a map's continent, " +
                          "expressed as a fraction of the map width and height")
    public Double islandCenterMargin = 0.05;

    @Parameter(
            names = "--landMaskDilation",
            description = "Number of 5x5 elliptical dilation iterations applied to each map's land mask " +
                          "before partitioning (0 to disable)")
    public Integer landMaskDilation = 2;

    public void validate()
            throws IllegalArgumentException {
        if ((componentGap == null) || (componentGap < 0)) {
            throw new IllegalArgumentException("componentGap must not be negative");
        }
        if ((islandCenterMargin == null) || (islandCenterMargin < 0.0) || (islandCenterMargin > 0.5)) {
            throw new IllegalArgumentException("islandCenterMargin must be between 0 and 0.5");
        }
        if ((landMaskDilation == null) || (landMaskDilation < 0)) {
            throw new IllegalArgumentException("landMaskDilation must not be negative");
        }
    }

}
