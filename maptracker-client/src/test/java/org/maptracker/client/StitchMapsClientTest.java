package org.maptracker.client;

import java.awt.image.BufferedImage;
import java.io.File;
import java.util.Collections;
import java.util.List;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;

/**
 * Tests the {@link StitchMapsClient} class.
 */
public class StitchMapsClientTest {

    private File testDirectory;
    private File inputDirectory;
    private File outputDirectory;
    private BufferedImage world;

    @Before
    public void setup() throws Exception {

        testDirectory = ClientTestFiles.createTestDirectory("test-stitch");
        inputDirectory = new File(testDirectory, "maps");
        outputDirectory = new File(testDirectory, "stitched");

        world = ClientTestFiles.texturedLand(100, 80, 42L);

        saveMap("map01_lv001", ClientTestFiles.crop(world, 0, 0, 60, 60));
        saveMap("map01_lv002", ClientTestFiles.crop(world, 40, 20, 60, 60));
        saveMap("map02_lv001", ClientTestFiles.texturedLand(60, 60, 7L));
        saveMap("map01_lv001_tier_a", ClientTestFiles.texturedLand(60, 60, 8L));
        saveMap("_preview_old", ClientTestFiles.texturedLand(60, 60, 9L));
    }

    @After
    public void tearDown() {
        ClientTestFiles.deleteRecursive(testDirectory);
    }

    @Test
    public void testStitchWithoutBarrier() throws Exception {

        final List<String> stitchedGroupKeys = new StitchMapsClient(buildParameters()).stitchAllGroups();

        Assert.assertEquals("invalid stitched groups", Collections.singletonList("map01"), stitchedGroupKeys);

        final BufferedImage stitched = ImageFiles.openImage(new File(outputDirectory, "_stitched_map01.png"));
        Assert.assertNotNull("stitched canvas should be saved", stitched);
        Assert.assertEquals("invalid stitched width", 100, stitched.getWidth());
        Assert.assertEquals("invalid stitched height", 80, stitched.getHeight());

        Assert.assertTrue("preview should be written for missing barrier",
                          new File(outputDirectory, "_preview_map01.png").isFile());
        Assert.assertTrue("tier map should be copied",
                          new File(outputDirectory, "map01_lv001_tier_a.png").isFile());
        Assert.assertFalse("single map group should not be written",
                           new File(outputDirectory, "map02_lv001.png").exists());

        final BufferedImage level2 = ImageFiles.openImage(new File(outputDirectory, "map01_lv002.png"));
        Assert.assertNotNull("level 2 territory should be saved", level2);
        Assert.assertEquals("unsplit territory should keep overlap", world.getRGB(45, 40), level2.getRGB(5, 20));
    }

    @Test
    public void testStitchWithBarrier() throws Exception {

        final BufferedImage barrier = ClientTestFiles.filledImage(100, 80, ArgbImages.OPAQUE_BLACK);
        for (int y = 0; y < 80; y++) {
            barrier.setRGB(50, y, 0xffffffff);
        }
        final File barrierDirectory = new File(testDirectory, "barriers");
        ImageFiles.savePng(barrier, new File(barrierDirectory, "_barrier_map01.png"));

        final StitchMapsClient.Parameters parameters = buildParameters();
        parameters.barrierDir = barrierDirectory.getAbsolutePath();

        new StitchMapsClient(parameters).stitchAllGroups();

        final BufferedImage level1 = ImageFiles.openImage(new File(outputDirectory, "map01_lv001.png"));
        final BufferedImage level2 = ImageFiles.openImage(new File(outputDirectory, "map01_lv002.png"));
        Assert.assertNotNull("level 1 territory should be saved", level1);
        Assert.assertNotNull("level 2 territory should be saved", level2);

        Assert.assertEquals("level 1 should keep land left of the barrier", world.getRGB(45, 40), level1.getRGB(45, 40));
        Assert.assertEquals("level 1 should lose land right of the barrier",
                            ArgbImages.OPAQUE_BLACK, level1.getRGB(55, 40));
        Assert.assertEquals("level 2 should lose land left of the barrier",
                            ArgbImages.OPAQUE_BLACK, level2.getRGB(5, 20));
        Assert.assertEquals("level 2 should keep land right of the barrier", world.getRGB(55, 40), level2.getRGB(15, 20));
    }

    private StitchMapsClient.Parameters buildParameters() {
        final StitchMapsClient.Parameters parameters = new StitchMapsClient.Parameters();
        parameters.inputDir = inputDirectory.getAbsolutePath();
        parameters.outputDir = outputDirectory.getAbsolutePath();
        parameters.tileGrid.cellWidth = 100;
        parameters.tileGrid.cellHeight = 100;
        parameters.tileGrid.scale = 0.2;
        parameters.territory.landMaskDilation = 0;
        return parameters;
    }

    private void saveMap(final String name,
                         final BufferedImage image)
            throws Exception {
        ImageFiles.savePng(image, new File(inputDirectory, name + ImageFiles.PNG_EXTENSION));
    }

}
