package org.maptracker.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.Map;
import java.util.SortedMap;

import org.maptracker.client.parameter.CommandLineParameters;
import org.maptracker.merge.interaction.InteractionPort;
import org.maptracker.merge.parameters.TileGridParameters;
import org.maptracker.merge.tile.AlignDirection;
import org.maptracker.merge.tile.GridExtent;
import org.maptracker.merge.tile.MapGroup;
import org.maptracker.merge.tile.MapGroupMerger;
import org.maptracker.merge.tile.MergedMap;
import org.maptracker.merge.tile.Tile;
import org.maptracker.merge.tile.TileKey;
import org.maptracker.merge.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for merging map tile files into one scaled image per map group.
 */
public class MergeTilesClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--inputDir",
                description = "Directory containing tile files (searched recursively)",
                required = true)
        public String inputDir;

        @Parameter(
                names = "--outputDir",
                description = "Directory for merged map images",
                required = true)
        public String outputDir;

        @Parameter(
                names = "--mapType",
                description = "Type of maps to merge, determines which tile file names are recognized")
        public TileFileScanner.MapType mapType = TileFileScanner.MapType.NORMAL_TIER;

        @Parameter(
                names = "--alignmentOverrides",
                description = "JSON file mapping tile file names to alignment directions (lt, rt, lb, rb) " +
                              "for tiles that cannot be aligned automatically")
        public String alignmentOverrides;

        @ParametersDelegate
        public TileGridParameters tileGrid = new TileGridParameters();

        public File getAlignmentOverridesFile() {
            return alignmentOverrides == null ? null : new File(alignmentOverrides);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(MergeTilesClient.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    final MergeTilesClient client = new MergeTilesClient(parameters);
                    client.mergeAllGroups();
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final MapGroupMerger merger;

    MergeTilesClient(final Parameters parameters)
            throws IOException {
        this.parameters = parameters;
        final Map<String, AlignDirection> overrides =
                FileInteractionPort.loadAlignmentOverrides(parameters.getAlignmentOverridesFile());
        final InteractionPort port = new FileInteractionPort(overrides, new File(parameters.outputDir), false);
        this.merger = new MapGroupMerger(parameters.tileGrid, port);
    }

    /**
     * @return number of merged maps that were saved.
     */
    int mergeAllGroups()
            throws IOException {

        final File outputDirectory = new File(parameters.outputDir);
        FileUtil.ensureOutputDirectory(outputDirectory);

        final TileFileScanner scanner = new TileFileScanner(parameters.mapType);
        final SortedMap<String, MapGroup<File>> groups = scanner.scan(new File(parameters.inputDir));
        final SortedMap<String, GridExtent> extents = TileFileScanner.getCanvasExtents(groups);

        int savedCount = 0;
        for (final MapGroup<File> fileGroup : groups.values()) {

            final MapGroup<Tile> tileGroup = loadTiles(fileGroup);
            if (tileGroup.isEmpty()) {
                LOG.warn("mergeAllGroups: no readable tiles in group {}, skipping it", fileGroup.getName());
                continue;
            }

            final MergedMap mergedMap = merger.merge(tileGroup, extents.get(fileGroup.getName()));
            final File outputFile = new File(outputDirectory, mergedMap.getName() + ImageFiles.PNG_EXTENSION);
            try {
                ImageFiles.savePng(mergedMap.getOutput(), outputFile);
                savedCount++;
            } catch (final IOException e) {
                LOG.error("mergeAllGroups: failed to save " + outputFile.getAbsolutePath(), e);
            }
        }

        LOG.info("mergeAllGroups: exit, saved {} of {} group(s) to {}",
                 savedCount, groups.size(), outputDirectory.getAbsolutePath());

        return savedCount;
    }

    private static MapGroup<Tile> loadTiles(final MapGroup<File> fileGroup) {
        final MapGroup<Tile> tileGroup = new MapGroup<>(fileGroup.getName());
        for (final Map.Entry<TileKey, File> entry : fileGroup.getTiles().entrySet()) {
            final File file = entry.getValue();
            final BufferedImage image = ImageFiles.openImage(file);
            if (image != null) {
                tileGroup.addTile(entry.getKey(), new Tile(file.getName(), entry.getKey(), image));
            }
        }
        return tileGroup;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MergeTilesClient.class);
}
