package org.maptracker.merge.tile;

import org.maptracker.merge.parameters.TileGridParameters;

/**
 * Full scale placement math for tiles in a grid of standard sized cells.
 */
public class TileGrid {

    private final int cellWidth;
    private final int cellHeight;
    private final boolean flipX;
    private final boolean flipY;

    public TileGrid(final TileGridParameters parameters) {
        this(parameters.cellWidth, parameters.cellHeight, parameters.flipX, parameters.flipY);
    }

    public TileGrid(final int cellWidth,
                    final int cellHeight,
                    final boolean flipX,
                    final boolean flipY) {
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.flipX = flipX;
        this.flipY = flipY;
    }

    public int getCanvasWidth(final GridExtent extent) {
        return extent.getMaxX() * cellWidth;
    }

    public int getCanvasHeight(final GridExtent extent) {
        return extent.getMaxY() * cellHeight;
    }

    public boolean isStandardSize(final Tile tile) {
        return (tile.getWidth() == cellWidth) && (tile.getHeight() == cellHeight);
    }

    /**
     * @return canvas x position of the left edge of the cell in grid column gridX.
     */
    public int getCellX(final int gridX,
                        final int maxX) {
        return flipX ? (maxX - gridX) * cellWidth : (gridX - 1) * cellWidth;
    }

    /**
     * @return canvas y position of the top edge of the cell in grid row gridY.
     */
    public int getCellY(final int gridY,
                        final int maxY) {
        return flipY ? (maxY - gridY) * cellHeight : (gridY - 1) * cellHeight;
    }

    /**
     * @return canvas x position of the tile's left edge when it is anchored in the specified direction.
     */
    public int getAnchorX(final Tile tile,
                          final AlignDirection direction,
                          final int maxX) {
        final int cellX = getCellX(tile.getKey().getX(), maxX);
        return direction.isRight() ? cellX + cellWidth - tile.getWidth() : cellX;
    }

    /**
     * @return canvas y position of the tile's top edge when it is anchored in the specified direction.
     */
    public int getAnchorY(final Tile tile,
                          final AlignDirection direction,
                          final int maxY) {
        final int cellY = getCellY(tile.getKey().getY(), maxY);
        return direction.isBottom() ? cellY + cellHeight - tile.getHeight() : cellY;
    }

}
