package org.maptracker.client;

import java.awt.image.BufferedImage;
import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.util.FileUtil;

/**
 * Tests the {@link MergeTilesClient} class.
 */
public class MergeTilesClientTest {

    private File testDirectory;
    private File inputDirectory;
    private File outputDirectory;

    @Before
    public void setup() throws Exception {

        testDirectory = ClientTestFiles.createTestDirectory("test-merge");
        inputDirectory = new File(testDirectory, "tiles");
        outputDirectory = new File(testDirectory, "maps");

        final int gray = ArgbImages.argb(255, 120, 120, 120);
        ImageFiles.savePng(ClientTestFiles.filledImage(60, 60, gray),
                           new File(inputDirectory, "map01_lv001_1_1.png"));
        ImageFiles.savePng(ClientTestFiles.filledImage(60, 60, gray),
                           new File(inputDirectory, "map01_lv001_2_1.png"));

        // 30x30 fully opaque tile needs an override
        ImageFiles.savePng(ClientTestFiles.filledImage(30, 30, 0xffc80000),
                           new File(inputDirectory, "map01_lv001_1_1_tier_a.png"));

        final File overridesFile = new File(testDirectory, "overrides.json");
        Files.write(overridesFile.toPath(),
                    "{ \"map01_lv001_1_1_tier_a.png\": \"rb\" }".getBytes(StandardCharsets.UTF_8));
    }

    @After
    public void tearDown() {
        ClientTestFiles.deleteRecursive(testDirectory);
    }

    @Test
    public void testMergeAllGroups() throws Exception {

        final MergeTilesClient.Parameters parameters = new MergeTilesClient.Parameters();
        parameters.inputDir = inputDirectory.getAbsolutePath();
        parameters.outputDir = outputDirectory.getAbsolutePath();
        parameters.alignmentOverrides = new File(testDirectory, "overrides.json").getAbsolutePath();
        parameters.tileGrid.cellWidth = 60;
        parameters.tileGrid.cellHeight = 60;
        parameters.tileGrid.scale = 0.5;

        final MergeTilesClient client = new MergeTilesClient(parameters);
        Assert.assertEquals("invalid number of saved maps", 2, client.mergeAllGroups());

        Assert.assertTrue("output directory should be ignored by git",
                          new File(outputDirectory, FileUtil.GITIGNORE_FILE_NAME).isFile());

        final BufferedImage normalMap = ImageFiles.openImage(new File(outputDirectory, "map01_lv001.png"));
        Assert.assertNotNull("normal map should be saved", normalMap);
        Assert.assertEquals("invalid normal map width", 60, normalMap.getWidth());
        Assert.assertEquals("invalid normal map height", 30, normalMap.getHeight());

        final BufferedImage tierMap = ImageFiles.openImage(new File(outputDirectory, "map01_lv001_tier_a.png"));
        Assert.assertNotNull("tier map should be saved", tierMap);
        Assert.assertEquals("tier map should use normal map width", 60, tierMap.getWidth());
        Assert.assertEquals("tier map should use normal map height", 30, tierMap.getHeight());

        // bottom right quarter of cell (1, 1) at half scale
        Assert.assertEquals("tier tile should be anchored bottom right",
                            200, ArgbImages.red(tierMap.getRGB(22, 22)));
        Assert.assertEquals("area outside tier tile should be black",
                            ArgbImages.OPAQUE_BLACK, tierMap.getRGB(5, 5));
    }

}
