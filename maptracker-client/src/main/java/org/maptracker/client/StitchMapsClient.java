package org.maptracker.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.maptracker.client.parameter.CommandLineParameters;
import org.maptracker.merge.parameters.OverlapMatchParameters;
import org.maptracker.merge.parameters.TerritoryParameters;
import org.maptracker.merge.parameters.TileGridParameters;
import org.maptracker.merge.split.Territory;
import org.maptracker.merge.stitch.GroupStitcher;
import org.maptracker.merge.stitch.MapGroupKeys;
import org.maptracker.merge.stitch.StitchResult;
import org.maptracker.merge.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for stitching merged maps that share a map id and splitting them into disjoint territories.
 */
public class StitchMapsClient {

    public static final String STITCHED_FILE_PREFIX = "_stitched_";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--inputDir",
                description = "Directory containing merged map images",
                required = true)
        public String inputDir;

        @Parameter(
                names = "--outputDir",
                description = "Directory for stitched and split map images",
                required = true)
        public String outputDir;

        @Parameter(
                names = "--barrierDir",
                description = "Directory containing _barrier_{mapId}.png files (default is outputDir)")
        public String barrierDir;

        @Parameter(
                names = "--skipSplit",
                description = "Keep overlapping land in every map that covers it instead of splitting it",
                arity = 0)
        public boolean skipSplit = false;

        @ParametersDelegate
        public TileGridParameters tileGrid = new TileGridParameters();

        @ParametersDelegate
        public OverlapMatchParameters overlapMatch = new OverlapMatchParameters();

        @ParametersDelegate
        public TerritoryParameters territory = new TerritoryParameters();

        public File getBarrierDirectory() {
            return new File(barrierDir == null ? outputDir : barrierDir);
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(StitchMapsClient.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    final StitchMapsClient client = new StitchMapsClient(parameters);
                    client.stitchAllGroups();
                }
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final File inputDirectory;
    private final File outputDirectory;
    private final GroupStitcher stitcher;

    StitchMapsClient(final Parameters parameters) {
        this.parameters = parameters;
        this.inputDirectory = new File(parameters.inputDir);
        this.outputDirectory = new File(parameters.outputDir);
        final FileInteractionPort port = new FileInteractionPort(Collections.emptyMap(),
                                                                 parameters.getBarrierDirectory(),
                                                                 parameters.skipSplit);
        this.stitcher = new GroupStitcher(parameters.tileGrid, parameters.overlapMatch, parameters.territory, port);
    }

    /**
     * @return keys of the groups that were stitched.
     */
    List<String> stitchAllGroups()
            throws IOException {

        LOG.info("stitchAllGroups: entry, grid step is {} x {} px",
                 parameters.tileGrid.getStepX(), parameters.tileGrid.getStepY());

        FileUtil.ensureOutputDirectory(outputDirectory);
        copyTierMaps();

        final SortedMap<String, BufferedImage> allMaps = loadNormalMaps();
        final List<String> stitchedGroupKeys = new ArrayList<>();

        if (allMaps.isEmpty()) {
            LOG.warn("stitchAllGroups: no normal maps found in {}", inputDirectory.getAbsolutePath());
            return stitchedGroupKeys;
        }

        final SortedMap<String, SortedMap<String, BufferedImage>> groups = MapGroupKeys.groupByKey(allMaps);

        LOG.info("stitchAllGroups: loaded {} normal map(s) in {} group(s): {}",
                 allMaps.size(), groups.size(), groups.keySet());

        for (final String groupKey : groups.keySet()) {
            final SortedMap<String, BufferedImage> groupMaps = groups.get(groupKey);
            if (groupMaps.size() < 2) {
                LOG.info("stitchAllGroups: group {} has only 1 map, skipping stitch", groupKey);
                continue;
            }
            final StitchResult result = stitcher.stitch(groupKey, groupMaps);
            saveResult(result);
            stitchedGroupKeys.add(groupKey);
        }

        return stitchedGroupKeys;
    }

    private void saveResult(final StitchResult result) {

        final File stitchedFile = new File(outputDirectory,
                                           STITCHED_FILE_PREFIX + result.getGroupKey() + ImageFiles.PNG_EXTENSION);
        savePng(result.getStitchedCanvas(), stitchedFile);

        for (final Territory territory : result.getTerritories()) {
            savePng(territory.getImage(),
                    new File(outputDirectory, territory.getMapName() + ImageFiles.PNG_EXTENSION));
        }
    }

    private void savePng(final BufferedImage image,
                         final File file) {
        try {
            ImageFiles.savePng(image, file);
        } catch (final IOException e) {
            LOG.error("savePng: failed to save " + file.getAbsolutePath(), e);
        }
    }

    /**
     * Loads every png in the input directory that is neither a tier map nor an underscore prefixed file.
     */
    private SortedMap<String, BufferedImage> loadNormalMaps()
            throws IOException {
        final SortedMap<String, BufferedImage> maps = new TreeMap<>();
        for (final File file : listPngFiles()) {
            final String fileName = file.getName();
            if (fileName.contains(TileFileScanner.TIER_SEPARATOR) || fileName.startsWith("_")) {
                continue;
            }
            final BufferedImage image = ImageFiles.openImage(file);
            if (image != null) {
                maps.put(ImageFiles.getBaseName(file), image);
            }
        }
        return maps;
    }

    private void copyTierMaps()
            throws IOException {
        int copiedCount = 0;
        for (final File file : listPngFiles()) {
            final String fileName = file.getName();
            if (fileName.contains(TileFileScanner.TIER_SEPARATOR) && (! fileName.startsWith("_"))) {
                Files.copy(file.toPath(),
                           new File(outputDirectory, fileName).toPath(),
                           StandardCopyOption.REPLACE_EXISTING,
                           StandardCopyOption.COPY_ATTRIBUTES);
                copiedCount++;
            }
        }
        if (copiedCount > 0) {
            LOG.info("copyTierMaps: copied {} tier map(s) to {}", copiedCount, outputDirectory.getAbsolutePath());
        } else {
            LOG.warn("copyTierMaps: no tier maps found to copy");
        }
    }

    private List<File> listPngFiles()
            throws IOException {
        final File[] files = inputDirectory.listFiles();
        if (files == null) {
            throw new IOException("failed to list " + inputDirectory.getAbsolutePath());
        }
        final List<File> pngFiles = new ArrayList<>();
        for (final File file : files) {
            if (ImageFiles.isPng(file)) {
                pngFiles.add(file);
            }
        }
        Collections.sort(pngFiles);
        return pngFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(StitchMapsClient.class);
}
