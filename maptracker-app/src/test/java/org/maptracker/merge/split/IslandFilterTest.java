package org.maptracker.merge.split;

import java.awt.image.BufferedImage;

import org.junit.Assert;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.SyntheticImages;

/**
 * Tests the {@link IslandFilter} class.
 */
public class IslandFilterTest {

    private static final int LAND = SyntheticImages.opaqueGray(200);

    @Test
    public void testIslandsAreRemoved() {

        final BufferedImage image = ArgbImages.newFilledImage(100, 100, ArgbImages.OPAQUE_BLACK);
        SyntheticImages.fillRect(image, 30, 30, 40, 40, LAND);
        SyntheticImages.fillRect(image, 0, 0, 10, 10, LAND);
        image.setRGB(29, 29, LAND); // only diagonally connected to the continent

        final IslandFilterResult result = new IslandFilter(0.05, 1).filter("map01_lv001", image);

        Assert.assertTrue("center should have land", result.isCenterHasLand());
        Assert.assertEquals("invalid removed pixel count", 100, result.getRemovedPixelCount());
        Assert.assertEquals("invalid removed component count", 1, result.getRemovedComponentCount());

        final BufferedImage filtered = result.getImage();
        Assert.assertEquals("island pixel should be black", ArgbImages.OPAQUE_BLACK, filtered.getRGB(5, 5));
        Assert.assertEquals("continent pixel should be kept", LAND, filtered.getRGB(50, 50));
        Assert.assertEquals("diagonal neighbor should be kept", LAND, filtered.getRGB(29, 29));
        Assert.assertEquals("source image should not be changed", LAND, image.getRGB(5, 5));
    }

    @Test
    public void testMapWithoutCenterLandIsKept() {

        final BufferedImage image = ArgbImages.newFilledImage(100, 100, ArgbImages.OPAQUE_BLACK);
        SyntheticImages.fillRect(image, 0, 0, 10, 10, LAND);
        SyntheticImages.fillRect(image, 80, 80, 20, 20, LAND);

        final IslandFilterResult result = new IslandFilter(0.05, 1).filter("map01_lv002", image);

        Assert.assertFalse("center should not have land", result.isCenterHasLand());
        Assert.assertEquals("invalid removed pixel count", 0, result.getRemovedPixelCount());
        Assert.assertEquals("corner land should be kept", LAND, result.getImage().getRGB(5, 5));
        Assert.assertEquals("corner land should be kept", LAND, result.getImage().getRGB(90, 90));
    }

    @Test
    public void testCenterRegionIsClampedForTinyMaps() {

        final BufferedImage image = ArgbImages.newFilledImage(2, 2, ArgbImages.OPAQUE_BLACK);
        image.setRGB(0, 0, LAND);

        final IslandFilterResult result = new IslandFilter(0.05, 1).filter("tiny", image);

        Assert.assertTrue("clamped center should include the only land pixel", result.isCenterHasLand());
        Assert.assertEquals("invalid removed pixel count", 0, result.getRemovedPixelCount());
    }

}
