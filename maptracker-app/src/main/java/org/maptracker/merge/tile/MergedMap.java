package org.maptracker.merge.tile;

import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Result of merging all tiles of one map group.
 */
public class MergedMap {

    private final String name;
    private final GridExtent extent;
    private final BufferedImage canvas;
    private final BufferedImage output;
    private final List<Tile> tiles;

    public MergedMap(final String name,
                     final GridExtent extent,
                     final BufferedImage canvas,
                     final BufferedImage output,
                     final List<Tile> tiles) {
        this.name = name;
        this.extent = extent;
        this.canvas = canvas;
        this.output = output;
        this.tiles = tiles;
    }

    public String getName() {
        return name;
    }

    public GridExtent getExtent() {
        return extent;
    }

    /**
     * @return full scale canvas with every tile composited.
     */
    public BufferedImage getCanvas() {
        return canvas;
    }

    /**
     * @return scaled canvas composited over an opaque background, ready to be saved.
     */
    public BufferedImage getOutput() {
        return output;
    }

    /**
     * @return merged tiles (in compositing order) with their final alignment.
     */
    public List<Tile> getTiles() {
        return tiles;
    }

    public long getManuallyAlignedTileCount() {
        return tiles.stream()
                .filter(tile -> (tile.getAlignment() != null) && tile.getAlignment().isManual())
                .count();
    }

    @Override
    public String toString() {
        return name + " (" + extent + " cells, " + tiles.size() + " tiles)";
    }
}
