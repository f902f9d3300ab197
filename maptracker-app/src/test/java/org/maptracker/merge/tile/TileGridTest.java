package org.maptracker.merge.tile;

import java.util.Arrays;

import org.junit.Assert;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;

/**
 * Tests the {@link TileGrid} class.
 */
public class TileGridTest {

    private final GridExtent extent = new GridExtent(3, 2);

    @Test
    public void testCanvasSize() {
        final TileGrid grid = new TileGrid(60, 50, false, true);
        Assert.assertEquals("invalid canvas width", 180, grid.getCanvasWidth(extent));
        Assert.assertEquals("invalid canvas height", 100, grid.getCanvasHeight(extent));
    }

    @Test
    public void testFlippedRows() {
        final TileGrid grid = new TileGrid(60, 60, false, true);
        Assert.assertEquals("column 1 should be on the left", 0, grid.getCellX(1, extent.getMaxX()));
        Assert.assertEquals("column 3 should be on the right", 120, grid.getCellX(3, extent.getMaxX()));
        Assert.assertEquals("row 1 should be at the bottom", 60, grid.getCellY(1, extent.getMaxY()));
        Assert.assertEquals("row 2 should be at the top", 0, grid.getCellY(2, extent.getMaxY()));
    }

    @Test
    public void testFlippedColumns() {
        final TileGrid grid = new TileGrid(60, 60, true, false);
        Assert.assertEquals("column 1 should be on the right", 120, grid.getCellX(1, extent.getMaxX()));
        Assert.assertEquals("row 1 should be at the top", 0, grid.getCellY(1, extent.getMaxY()));
    }

    @Test
    public void testAnchors() {

        final TileGrid grid = new TileGrid(60, 60, false, true);
        final Tile tile = new Tile("a.png", new TileKey(2, 1), ArgbImages.newImage(30, 40));

        Assert.assertEquals("invalid lt x", 60, grid.getAnchorX(tile, AlignDirection.LT, extent.getMaxX()));
        Assert.assertEquals("invalid lt y", 60, grid.getAnchorY(tile, AlignDirection.LT, extent.getMaxY()));
        Assert.assertEquals("invalid rb x", 90, grid.getAnchorX(tile, AlignDirection.RB, extent.getMaxX()));
        Assert.assertEquals("invalid rb y", 80, grid.getAnchorY(tile, AlignDirection.RB, extent.getMaxY()));
    }

    @Test
    public void testGridExtent() {
        final GridExtent derived = GridExtent.of(Arrays.asList(new TileKey(1, 4), new TileKey(3, 2)));
        Assert.assertEquals("invalid max x", 3, derived.getMaxX());
        Assert.assertEquals("invalid max y", 4, derived.getMaxY());
    }

    @Test
    public void testTileKeyOrder() {
        Assert.assertTrue("keys should sort by row first",
                          new TileKey(5, 1).compareTo(new TileKey(1, 2)) < 0);
        Assert.assertTrue("keys should sort by column within a row",
                          new TileKey(1, 2).compareTo(new TileKey(2, 2)) < 0);
    }

}
