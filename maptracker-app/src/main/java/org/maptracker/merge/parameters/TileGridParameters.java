package org.maptracker.merge.parameters;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters describing the tile grid of a map group and the scale of merged map output.
 */
public class TileGridParameters
        implements Serializable {

    @Parameter(
            names = "--cellWidth",
            description = "Full scale pixel width of one standard tile grid cell")
    public Integer cellWidth = 600;

    @Parameter(
            names = "--cellHeight",
            description = "Full scale pixel height of one standard tile grid cell")
    public Integer cellHeight = 600;

    @Parameter(
            names = "--flipX",
            description = "Place tile column 1 at the right edge of the canvas instead of the left edge",
            arity = 1)
    public boolean flipX = false;

    @Parameter(
            names = "--flipY",
            description = "Place tile row 1 at the bottom edge of the canvas instead of the top edge",
            arity = 1)
    public boolean flipY = true;

    @Parameter(
            names = "--scale",
            description = "Scale factor applied to full scale merged canvases when they are saved")
    public Double scale = 0.1625;

    @Parameter(
            names = "--edgeOpacityThreshold",
            description = "Minimum alpha value for an edge pixel to count as opaque during tile alignment")
    public Integer edgeOpacityThreshold = 4;

    /**
     * @return grid step (in merged map pixels) between horizontally adjacent tiles.
     */
    public double getStepX() {
        return cellWidth * scale;
    }

    /**
     * @return grid step (in merged map pixels) between vertically adjacent tiles.
     */
    public double getStepY() {
        return cellHeight * scale;
    }

    public void validate()
            throws IllegalArgumentException {
        if ((cellWidth == null) || (cellWidth < 1) || (cellHeight == null) || (cellHeight < 1)) {
            throw new IllegalArgumentException("cell width and height must be positive");
        }
        if ((scale == null) || (scale <= 0.0) || (scale > 1.0)) {
            throw new IllegalArgumentException("scale must be in the range (0, 1]");
        }
    }

}
