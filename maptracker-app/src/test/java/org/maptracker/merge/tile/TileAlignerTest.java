package org.maptracker.merge.tile;

import java.awt.image.BufferedImage;

import org.junit.Assert;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.SyntheticImages;

/**
 * Tests the {@link TileAligner} class.
 */
public class TileAlignerTest {

    private static final int CELL_SIZE = 60;
    private static final int LAND = SyntheticImages.opaqueGray(150);

    private final TileAligner aligner = new TileAligner(CELL_SIZE, CELL_SIZE, 4);

    @Test
    public void testStandardTile() {
        final Tile tile = tile(CELL_SIZE, CELL_SIZE);
        Assert.assertEquals("invalid alignment", TileAlignment.auto(AlignDirection.LT), aligner.align(tile));
    }

    @Test
    public void testStandardWidthTiles() {

        final BufferedImage topOnlyImage = ArgbImages.newImage(CELL_SIZE, 20);
        SyntheticImages.fillRect(topOnlyImage, 0, 0, CELL_SIZE, 5, LAND);
        final Tile topOnly = tile(topOnlyImage);
        Assert.assertEquals("invalid alignment for top content",
                            TileAlignment.auto(AlignDirection.LT), aligner.align(topOnly));

        final BufferedImage bottomOnlyImage = ArgbImages.newImage(CELL_SIZE, 20);
        SyntheticImages.fillRect(bottomOnlyImage, 10, 15, 20, 5, LAND);
        final Tile bottomOnly = tile(bottomOnlyImage);
        Assert.assertEquals("invalid alignment for bottom content",
                            TileAlignment.auto(AlignDirection.LB), aligner.align(bottomOnly));

        final BufferedImage bothImage = ArgbImages.newImage(CELL_SIZE, 20);
        SyntheticImages.fillRect(bothImage, 0, 0, CELL_SIZE, 20, LAND);
        final Tile both = tile(bothImage);
        Assert.assertTrue("content on top and bottom should need manual alignment",
                          aligner.align(both).isManual());
    }

    @Test
    public void testStandardHeightTiles() {

        final BufferedImage leftOnlyImage = ArgbImages.newImage(25, CELL_SIZE);
        SyntheticImages.fillRect(leftOnlyImage, 0, 10, 5, 5, LAND);
        final Tile leftOnly = tile(leftOnlyImage);
        Assert.assertEquals("invalid alignment for left content",
                            TileAlignment.auto(AlignDirection.LT), aligner.align(leftOnly));

        final BufferedImage rightOnlyImage = ArgbImages.newImage(25, CELL_SIZE);
        SyntheticImages.fillRect(rightOnlyImage, 20, 0, 5, CELL_SIZE, LAND);
        final Tile rightOnly = tile(rightOnlyImage);
        Assert.assertEquals("invalid alignment for right content",
                            TileAlignment.auto(AlignDirection.RT), aligner.align(rightOnly));
    }

    @Test
    public void testCornerTile() {

        final BufferedImage cornerImage = ArgbImages.newImage(30, 30);
        SyntheticImages.fillRect(cornerImage, 20, 20, 10, 10, LAND);
        final Tile corner = tile(cornerImage);
        Assert.assertEquals("invalid alignment for bottom right content",
                            TileAlignment.auto(AlignDirection.RB), aligner.align(corner));

        final BufferedImage opaqueImage = ArgbImages.newImage(30, 30);
        SyntheticImages.fillRect(opaqueImage, 0, 0, 30, 30, LAND);
        final Tile opaque = tile(opaqueImage);
        Assert.assertTrue("fully opaque tile should need manual alignment", aligner.align(opaque).isManual());

        Assert.assertTrue("transparent tile should need manual alignment", aligner.align(tile(30, 30)).isManual());
    }

    @Test
    public void testNearlyTransparentPixelsAreIgnored() {

        final BufferedImage tileImage = ArgbImages.newImage(CELL_SIZE, 20);
        SyntheticImages.fillRect(tileImage, 0, 0, CELL_SIZE, 5, LAND);
        SyntheticImages.fillRect(tileImage, 0, 19, CELL_SIZE, 1, ArgbImages.argb(3, 255, 255, 255));
        final Tile tile = tile(tileImage);

        Assert.assertFalse("alpha 3 should not count as opaque",
                           aligner.hasOpaquePixelsOnEdge(tile, TileAligner.Edge.BOTTOM));
        Assert.assertEquals("invalid alignment", TileAlignment.auto(AlignDirection.LT), aligner.align(tile));

        SyntheticImages.fillRect(tileImage, 0, 19, 1, 1, ArgbImages.argb(4, 255, 255, 255));
        Assert.assertTrue("alpha 4 should count as opaque",
                          aligner.hasOpaquePixelsOnEdge(tile(tileImage), TileAligner.Edge.BOTTOM));
    }

    @Test
    public void testTileKeepsItsOwnPixels() {

        final BufferedImage sourceImage = ArgbImages.newImage(CELL_SIZE, 20);
        SyntheticImages.fillRect(sourceImage, 0, 0, CELL_SIZE, 5, LAND);
        final Tile tile = tile(sourceImage);

        SyntheticImages.fillRect(sourceImage, 0, 15, CELL_SIZE, 5, LAND);

        Assert.assertNotSame("tile should not share the source image", sourceImage, tile.getImage());
        Assert.assertEquals("later source changes should not reach the tile",
                            0, tile.getImage().getRGB(10, 17));
        Assert.assertEquals("invalid alignment", TileAlignment.auto(AlignDirection.LT), aligner.align(tile));
    }

    @Test
    public void testFromCode() {
        Assert.assertEquals("invalid direction", AlignDirection.RB, AlignDirection.fromCode("rb"));
        Assert.assertEquals("invalid direction", AlignDirection.LT, AlignDirection.fromCode("t"));
        Assert.assertEquals("invalid direction", AlignDirection.RT, AlignDirection.fromCode(" R "));
        Assert.assertEquals("invalid direction", AlignDirection.LB, AlignDirection.fromCode("b"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownCode() {
        AlignDirection.fromCode("xy");
    }

    private static Tile tile(final int width,
                             final int height) {
        return tile(ArgbImages.newImage(width, height));
    }

    private static Tile tile(final BufferedImage image) {
        return new Tile("tile.png", new TileKey(1, 1), image);
    }

}
