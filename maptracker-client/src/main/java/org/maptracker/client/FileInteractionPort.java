package org.maptracker.client;

import com.fasterxml.jackson.core.type.TypeReference;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.interaction.AlignmentRequest;
import org.maptracker.merge.interaction.BarrierRequest;
import org.maptracker.merge.interaction.BarrierResponse;
import org.maptracker.merge.interaction.InteractionPort;
import org.maptracker.merge.json.JsonUtils;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.ContentMasks;
import org.maptracker.merge.tile.AlignDirection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Headless interaction port that reads prepared answers from files.
 *
 * <ul>
 *     <li>
 *         Alignment directions for tiles that cannot be aligned automatically come from a
 *         JSON object mapping tile file names to direction codes (e.g. { "map01_lv001_2_3.png": "rb" }).
 *         Tiles without an override keep their suggested direction.
 *     </li>
 *     <li>
 *         Barriers come from {@value #BARRIER_FILE_PREFIX}{groupKey}.png files where bright pixels are
 *         barrier pixels. When the file does not exist, a preview of the canvas with the overlapping
 *         land highlighted is written as {@value #PREVIEW_FILE_PREFIX}{groupKey}.png (a template for
 *         drawing the barrier) and splitting of the group is skipped.
 *     </li>
 * </ul>
 */
public class FileInteractionPort
        implements InteractionPort {

    public static final String BARRIER_FILE_PREFIX = "_barrier_";
    public static final String PREVIEW_FILE_PREFIX = "_preview_";

    /** Mean red, green and blue value a barrier file pixel must exceed to be part of the barrier. */
    public static final double BARRIER_BRIGHTNESS_THRESHOLD = 127.0;

    private static final int OVERLAP_HIGHLIGHT_RGB = 0xff8c00;
    private static final double OVERLAP_HIGHLIGHT_WEIGHT = 0.65;

    private final Map<String, AlignDirection> tileFileNameToDirection;
    private final File barrierDirectory;
    private final boolean skipSplit;

    /**
     * @param  tileFileNameToDirection  alignment overrides keyed by tile file name.
     * @param  barrierDirectory         directory containing barrier files.
     * @param  skipSplit                if true, never split overlapping land.
     */
    public FileInteractionPort(final Map<String, AlignDirection> tileFileNameToDirection,
                               final File barrierDirectory,
                               final boolean skipSplit) {
        this.tileFileNameToDirection = new HashMap<>(tileFileNameToDirection);
        this.barrierDirectory = barrierDirectory;
        this.skipSplit = skipSplit;
    }

    /**
     * @return alignment overrides parsed from the specified JSON file (empty if the file is null).
     *
     * @throws IOException
     *   if the file cannot be read.
     *
     * @throws IllegalArgumentException
     *   if the file content is not a JSON object of known direction codes.
     */
    public static Map<String, AlignDirection> loadAlignmentOverrides(final File jsonFile)
            throws IOException, IllegalArgumentException {

        if (jsonFile == null) {
            return Collections.emptyMap();
        }

        final Map<String, String> codes;
        try (final Reader reader = Files.newBufferedReader(jsonFile.toPath(), StandardCharsets.UTF_8)) {
            codes = ALIGNMENT_HELPER.fromJson(reader);
        }

        final Map<String, AlignDirection> overrides = new HashMap<>();
        if (codes != null) {
            for (final Map.Entry<String, String> entry : codes.entrySet()) {
                overrides.put(entry.getKey(), AlignDirection.fromCode(entry.getValue()));
            }
        }

        LOG.info("loadAlignmentOverrides: loaded {} override(s) from {}", overrides.size(), jsonFile);

        return overrides;
    }

    public File getBarrierFile(final String groupKey) {
        return new File(barrierDirectory, BARRIER_FILE_PREFIX + groupKey + ImageFiles.PNG_EXTENSION);
    }

    public File getPreviewFile(final String groupKey) {
        return new File(barrierDirectory, PREVIEW_FILE_PREFIX + groupKey + ImageFiles.PNG_EXTENSION);
    }

    @Override
    public AlignDirection resolveAlignment(final AlignmentRequest request) {
        final String tileFileName = request.getTile().getFileName();
        AlignDirection direction = tileFileNameToDirection.get(tileFileName);
        if (direction == null) {
            direction = request.getTile().getAlignment().getDirection();
            LOG.warn("resolveAlignment: no override for tile {} of group {}, using {}",
                     tileFileName, request.getGroupName(), direction);
        }
        return direction;
    }

    @Override
    public BarrierResponse collectBarrier(final BarrierRequest request) {

        final String groupKey = request.getGroupKey();

        if (skipSplit) {
            LOG.info("collectBarrier: splitting disabled, skipping group {}", groupKey);
            return BarrierResponse.skip();
        }

        final File barrierFile = getBarrierFile(groupKey);

        if (! barrierFile.isFile()) {
            final File previewFile = getPreviewFile(groupKey);
            try {
                ImageFiles.savePng(buildPreview(request), previewFile);
                LOG.warn("collectBarrier: {} not found, draw the barrier on {} and save it as {} to split group {}",
                         barrierFile.getName(), previewFile.getAbsolutePath(), barrierFile.getName(), groupKey);
            } catch (final IOException e) {
                LOG.warn("collectBarrier: failed to save preview " + previewFile.getAbsolutePath(), e);
            }
            return BarrierResponse.skip();
        }

        final BufferedImage barrierImage = ImageFiles.openImage(barrierFile);
        if (barrierImage == null) {
            return BarrierResponse.skip();
        }

        if ((barrierImage.getWidth() != request.getCanvasWidth()) ||
            (barrierImage.getHeight() != request.getCanvasHeight())) {
            LOG.warn("collectBarrier: {} is {}x{} but the canvas of group {} is {}x{}, skipping split",
                     barrierFile.getAbsolutePath(), barrierImage.getWidth(), barrierImage.getHeight(),
                     groupKey, request.getCanvasWidth(), request.getCanvasHeight());
            return BarrierResponse.skip();
        }

        final BinaryMask barrier = ContentMasks.bright(barrierImage, BARRIER_BRIGHTNESS_THRESHOLD);

        LOG.info("collectBarrier: loaded {} barrier pixels for group {} from {}",
                 barrier.count(), groupKey, barrierFile.getAbsolutePath());

        return BarrierResponse.of(barrier);
    }

    /**
     * @return opaque copy of the request's canvas with overlapping land tinted orange.
     */
    static BufferedImage buildPreview(final BarrierRequest request) {
        final BufferedImage preview = ArgbImages.toOpaque(request.getCanvasPreview());
        final int[] pixels = ArgbImages.getPixels(preview);
        final BinaryMask overlap = request.getOverlap();
        final int highlightRed = (OVERLAP_HIGHLIGHT_RGB >> 16) & 0xff;
        final int highlightGreen = (OVERLAP_HIGHLIGHT_RGB >> 8) & 0xff;
        final int highlightBlue = OVERLAP_HIGHLIGHT_RGB & 0xff;
        for (int i = 0; i < pixels.length; i++) {
            if (overlap.get(i)) {
                final int p = pixels[i];
                pixels[i] = ArgbImages.argb(255,
                                            tint(ArgbImages.red(p), highlightRed),
                                            tint(ArgbImages.green(p), highlightGreen),
                                            tint(ArgbImages.blue(p), highlightBlue));
            }
        }
        return preview;
    }

    private static int tint(final int value,
                            final int highlight) {
        return (int) ((value * (1.0 - OVERLAP_HIGHLIGHT_WEIGHT)) + (highlight * OVERLAP_HIGHLIGHT_WEIGHT));
    }

    private static final JsonUtils.GenericHelper<Map<String, String>> ALIGNMENT_HELPER =
            new JsonUtils.GenericHelper<>(new TypeReference<Map<String, String>>() {});

    private static final Logger LOG = LoggerFactory.getLogger(FileInteractionPort.class);
}
