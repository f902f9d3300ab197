package org.maptracker.merge.interaction;

import java.awt.image.BufferedImage;

import org.maptracker.merge.tile.Tile;

/**
 * Request to choose the anchor direction of a tile.
 */
public class AlignmentRequest {

    private final String groupName;
    private final Tile tile;
    private final BufferedImage canvasPreview;

    /**
     * @param  groupName      name of the map group being merged.
     * @param  tile           tile to align (its current direction is the suggested default).
     * @param  canvasPreview  copy of the group canvas with all automatically placed tiles.
     */
    public AlignmentRequest(final String groupName,
                            final Tile tile,
                            final BufferedImage canvasPreview) {
        this.groupName = groupName;
        this.tile = tile;
        this.canvasPreview = canvasPreview;
    }

    public String getGroupName() {
        return groupName;
    }

    public Tile getTile() {
        return tile;
    }

    public BufferedImage getCanvasPreview() {
        return canvasPreview;
    }

    @Override
    public String toString() {
        return "AlignmentRequest{" + groupName + ", " + tile + '}';
    }
}
