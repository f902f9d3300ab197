package org.maptracker.merge.mask;

import java.awt.image.BufferedImage;

import org.junit.Assert;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.SyntheticImages;

/**
 * Tests the {@link ContentMasks} class.
 */
public class ContentMasksTest {

    @Test
    public void testLand() {

        final BufferedImage image = ArgbImages.newFilledImage(4, 1, ArgbImages.OPAQUE_BLACK);
        image.setRGB(1, 0, SyntheticImages.opaqueGray(1));
        image.setRGB(2, 0, SyntheticImages.opaqueGray(2));
        image.setRGB(3, 0, 0x00ffffff); // transparent white is still land

        final BinaryMask land = ContentMasks.land(image, 1);

        Assert.assertFalse("black should not be land", land.get(0));
        Assert.assertFalse("gray 1 should not be land", land.get(1));
        Assert.assertTrue("gray 2 should be land", land.get(2));
        Assert.assertTrue("alpha should be ignored", land.get(3));
    }

    @Test
    public void testBrightContentBounds() {

        final BufferedImage image = ArgbImages.newFilledImage(30, 20, ArgbImages.OPAQUE_BLACK);
        SyntheticImages.fillRect(image, 5, 3, 10, 4, SyntheticImages.opaqueGray(200));
        // dim pixel below the 5% brightness threshold
        image.setRGB(25, 15, SyntheticImages.opaqueGray(12));

        Assert.assertEquals("invalid bounds",
                            new PixelBounds(5, 3, 15, 7), ContentMasks.brightContentBounds(image));
        Assert.assertArrayEquals("invalid bounds array",
                                 new int[] { 5, 3, 15, 7 }, ContentMasks.brightContentBounds(image).toArray());

        Assert.assertNull("black image should have no bounds",
                          ContentMasks.brightContentBounds(ArgbImages.newFilledImage(5, 5, ArgbImages.OPAQUE_BLACK)));
    }

    @Test
    public void testWithLandOnlyAlpha() {

        final BufferedImage image = ArgbImages.newFilledImage(2, 1, ArgbImages.OPAQUE_BLACK);
        image.setRGB(1, 0, SyntheticImages.opaqueGray(100));

        final BufferedImage landOnly = ContentMasks.withLandOnlyAlpha(image, ContentMasks.land(image, 1));

        Assert.assertEquals("non-land pixel should be transparent", 0, ArgbImages.alpha(landOnly.getRGB(0, 0)));
        Assert.assertEquals("land pixel should be opaque", 255, ArgbImages.alpha(landOnly.getRGB(1, 0)));
    }

    @Test
    public void testPlaceOnCanvas() {

        final BinaryMask mask = new BinaryMask(3, 3);
        mask.fill(0, 0, 3, 3, true);

        final BinaryMask placed = ContentMasks.placeOnCanvas(mask, 8, -1, 10, 10);

        Assert.assertEquals("invalid number of placed pixels", 4, placed.count());
        Assert.assertEquals("invalid placed bounds", new PixelBounds(8, 0, 10, 2), placed.getBounds());
    }

    @Test
    public void testPixelBoundsIntersects() {
        final PixelBounds a = new PixelBounds(0, 0, 10, 10);
        final PixelBounds b = new PixelBounds(0, 0, 5, 5);
        Assert.assertTrue("translated bounds should intersect", a.intersects(b, 9, 9));
        Assert.assertFalse("touching bounds should not intersect", a.intersects(b, 10, 0));
        Assert.assertFalse("bounds left of a should not intersect", a.intersects(b, -5, 0));
    }

}
