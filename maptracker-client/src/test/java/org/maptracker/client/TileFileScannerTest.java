package org.maptracker.client;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.SortedMap;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.maptracker.merge.tile.GridExtent;
import org.maptracker.merge.tile.MapGroup;
import org.maptracker.merge.tile.TileKey;

/**
 * Tests the {@link TileFileScanner} class.
 */
public class TileFileScannerTest {

    private File testDirectory;

    @Before
    public void setup() throws Exception {
        testDirectory = ClientTestFiles.createTestDirectory("test-scan");
        touch("map01_lv001_1_1.png");
        touch("map01_lv001_2_3.png");
        touch("sub/map01_lv001_2_1.png");
        touch("sub2/map01_lv001_1_1.png");
        touch("map01_lv001_1_1_tier_a.png");
        touch("map02_lv001_1_1_tier_b.png");
        touch("base01_lv001_4_2.png");
        touch("map01_lv001_1_1.png.bak");
        touch("notes.txt");
    }

    @After
    public void tearDown() {
        ClientTestFiles.deleteRecursive(testDirectory);
    }

    @Test
    public void testScanNormalAndTierTiles() throws Exception {

        final SortedMap<String, MapGroup<File>> groups =
                new TileFileScanner(TileFileScanner.MapType.NORMAL_TIER).scan(testDirectory);

        Assert.assertEquals("invalid group names",
                            Arrays.asList("map01_lv001", "map01_lv001_tier_a", "map02_lv001_tier_b"),
                            Arrays.asList(groups.keySet().toArray(new String[0])));

        final MapGroup<File> normalGroup = groups.get("map01_lv001");
        Assert.assertEquals("duplicate tile should be ignored", 3, normalGroup.size());
        Assert.assertEquals("first tile found should be kept",
                            testDirectory.getName(),
                            normalGroup.getTiles().get(new TileKey(1, 1)).getParentFile().getName());
        Assert.assertTrue("nested tile should be found",
                          normalGroup.getTiles().containsKey(new TileKey(2, 1)));

        final SortedMap<String, GridExtent> extents = TileFileScanner.getCanvasExtents(groups);
        Assert.assertEquals("invalid normal extent", "2x3", extents.get("map01_lv001").toString());
        Assert.assertEquals("tier group should use normal extent", "2x3", extents.get("map01_lv001_tier_a").toString());
        Assert.assertEquals("orphan tier group should use own extent", "1x1", extents.get("map02_lv001_tier_b").toString());
    }

    @Test
    public void testScanBaseTiles() throws Exception {

        final SortedMap<String, MapGroup<File>> groups =
                new TileFileScanner(TileFileScanner.MapType.BASE).scan(testDirectory);

        Assert.assertEquals("invalid group names",
                            Arrays.asList("base01_lv001"),
                            Arrays.asList(groups.keySet().toArray(new String[0])));
        Assert.assertTrue("invalid tile key", groups.get("base01_lv001").getTiles().containsKey(new TileKey(4, 2)));
    }

    @Test
    public void testGroupNames() {
        Assert.assertTrue("tier group not detected", TileFileScanner.isTierGroup("map01_lv001_tier_a"));
        Assert.assertFalse("normal group detected as tier", TileFileScanner.isTierGroup("map01_lv001"));
        Assert.assertEquals("invalid normal group name",
                            "map01_lv001", TileFileScanner.getNormalGroupName("map01_lv001_tier_a"));
    }

    private void touch(final String relativePath)
            throws IOException {
        final File file = new File(testDirectory, relativePath);
        if (! file.getParentFile().isDirectory() && ! file.getParentFile().mkdirs()) {
            throw new IOException("failed to create " + file.getParentFile());
        }
        Files.write(file.toPath(), "tile".getBytes(StandardCharsets.UTF_8));
    }

}
