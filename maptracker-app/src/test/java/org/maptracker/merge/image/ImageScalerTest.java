package org.maptracker.merge.image;

import java.awt.image.BufferedImage;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ImageScaler} class.
 */
public class ImageScalerTest {

    @Test
    public void testGetScaledSize() {
        Assert.assertEquals("invalid size for one standard cell", 97, ImageScaler.getScaledSize(600, 0.1625));
        Assert.assertEquals("scaled size should never be zero", 1, ImageScaler.getScaledSize(3, 0.1625));
    }

    @Test
    public void testScaleUniformImage() {

        final int color = ArgbImages.argb(255, 40, 120, 200);
        final BufferedImage source = ArgbImages.newFilledImage(60, 40, color);

        final BufferedImage scaled = ImageScaler.scale(source, 0.5);

        Assert.assertEquals("invalid scaled width", 30, scaled.getWidth());
        Assert.assertEquals("invalid scaled height", 20, scaled.getHeight());
        Assert.assertEquals("uniform color should be preserved", color, scaled.getRGB(15, 10));
        Assert.assertEquals("uniform color should be preserved at corner", color, scaled.getRGB(0, 0));
    }

    @Test
    public void testScaleKeepsTransparency() {

        final BufferedImage source = ArgbImages.newImage(40, 40);
        SyntheticImages.fillRect(source, 0, 0, 20, 40, ArgbImages.argb(255, 255, 255, 255));

        final BufferedImage scaled = ImageScaler.scale(source, 0.5);

        Assert.assertEquals("left side should stay opaque", 255, ArgbImages.alpha(scaled.getRGB(2, 10)));
        Assert.assertEquals("right side should stay transparent", 0, ArgbImages.alpha(scaled.getRGB(17, 10)));
    }

}
