package org.maptracker.client;

import com.beust.jcommander.Parameter;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.maptracker.client.parameter.CommandLineParameters;
import org.maptracker.merge.mask.ContentMasks;
import org.maptracker.merge.mask.PixelBounds;
import org.maptracker.merge.util.FileUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for generating the bounding box index of exported maps.
 */
public class MapBoundsClient {

    public static final String BOUNDS_FILE_NAME = "map_bbox.json";

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--mapDir",
                description = "Directory containing exported map images (searched recursively), " +
                              "the index is written to " + BOUNDS_FILE_NAME + " in this directory",
                required = true)
        public String mapDir;
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(MapBoundsClient.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                if (parameters.parse(args)) {

                    LOG.info("runClient: entry, parameters={}", parameters);

                    writeBoundsIndex(new File(parameters.mapDir));
                }
            }
        };
        clientRunner.run();
    }

    /**
     * Derives the bounds index for a directory and saves it as {@value #BOUNDS_FILE_NAME} in that directory.
     *
     * @return path of the saved index.
     */
    public static Path writeBoundsIndex(final File mapDirectory)
            throws IOException {

        FileUtil.ensureOutputDirectory(mapDirectory);

        final SortedMap<String, int[]> index = buildBoundsIndex(mapDirectory);
        final Path indexPath = new File(mapDirectory, BOUNDS_FILE_NAME).toPath();
        FileUtil.saveJsonFile(indexPath, index);

        LOG.info("writeBoundsIndex: saved {} map rectangle(s) to {}", index.size(), indexPath);

        return indexPath;
    }

    /**
     * @return [minX, minY, maxX, maxY] (exclusive max) of the bright content in each map keyed by map name,
     *         maps without bright content are omitted.
     */
    public static SortedMap<String, int[]> buildBoundsIndex(final File mapDirectory)
            throws IOException {

        final List<Path> paths;
        try (final Stream<Path> stream = Files.walk(mapDirectory.toPath())) {
            paths = stream.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }

        final SortedMap<String, int[]> index = new TreeMap<>();
        for (final Path path : paths) {
            final File file = path.toFile();
            if ((! ImageFiles.isPng(file)) || file.getName().startsWith("_")) {
                continue;
            }
            final BufferedImage image = ImageFiles.openImage(file);
            if (image == null) {
                continue;
            }
            final PixelBounds bounds = ContentMasks.brightContentBounds(image);
            if (bounds == null) {
                LOG.debug("buildBoundsIndex: {} has no bright content", file);
            } else {
                index.put(ImageFiles.getBaseName(file), bounds.toArray());
            }
        }

        return index;
    }

    private static final Logger LOG = LoggerFactory.getLogger(MapBoundsClient.class);
}
