package org.maptracker.merge.stitch;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.CanvasCompositor;
import org.maptracker.merge.interaction.InteractionPort;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.ContentMasks;
import org.maptracker.merge.mask.Morphology;
import org.maptracker.merge.match.CanvasPosition;
import org.maptracker.merge.match.Layout;
import org.maptracker.merge.match.LayoutAssembler;
import org.maptracker.merge.match.MapContent;
import org.maptracker.merge.match.OverlapEdge;
import org.maptracker.merge.match.OverlapMatcher;
import org.maptracker.merge.parameters.OverlapMatchParameters;
import org.maptracker.merge.parameters.TerritoryParameters;
import org.maptracker.merge.parameters.TileGridParameters;
import org.maptracker.merge.split.IslandFilter;
import org.maptracker.merge.split.IslandFilterResult;
import org.maptracker.merge.split.PartitionResult;
import org.maptracker.merge.split.Territory;
import org.maptracker.merge.split.TerritoryExporter;
import org.maptracker.merge.split.TerritoryPartitioner;
import org.maptracker.merge.util.ProcessTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stitches the merged maps of one group onto a shared canvas and splits the result into
 * disjoint per-map territories.
 */
public class GroupStitcher {

    private final OverlapMatcher matcher;
    private final LayoutAssembler layoutAssembler;
    private final IslandFilter islandFilter;
    private final TerritoryPartitioner partitioner;
    private final TerritoryExporter exporter;
    private final CanvasCompositor compositor;
    private final int landGrayThreshold;
    private final int landMaskDilation;
    private final InteractionPort interactionPort;

    public GroupStitcher(final TileGridParameters gridParameters,
                         final OverlapMatchParameters matchParameters,
                         final TerritoryParameters territoryParameters,
                         final InteractionPort interactionPort) {

        gridParameters.validate();
        matchParameters.validate();
        territoryParameters.validate();

        this.matcher = new OverlapMatcher(gridParameters, matchParameters);
        this.layoutAssembler = new LayoutAssembler(territoryParameters.componentGap);
        this.islandFilter = new IslandFilter(territoryParameters.islandCenterMargin,
                                             matchParameters.landGrayThreshold);
        this.partitioner = new TerritoryPartitioner();
        this.exporter = new TerritoryExporter();
        this.compositor = new CanvasCompositor();
        this.landGrayThreshold = matchParameters.landGrayThreshold;
        this.landMaskDilation = territoryParameters.landMaskDilation;
        this.interactionPort = interactionPort;
    }

    /**
     * @param  groupKey  key shared by the maps (see {@link MapGroupKeys#groupKey}).
     * @param  maps      merged map images keyed by map name.
     *
     * @return stitched canvas, layout, partition and exported territories.
     *
     * @throws IllegalArgumentException
     *   if no maps are specified.
     */
    public StitchResult stitch(final String groupKey,
                               final Map<String, BufferedImage> maps)
            throws IllegalArgumentException {

        if (maps.isEmpty()) {
            throw new IllegalArgumentException("no maps specified for group " + groupKey);
        }

        final ProcessTimer timer = new ProcessTimer();

        LOG.info("stitch: entry, stitching {} map(s) of group {}", maps.size(), groupKey);

        final SortedMap<String, BufferedImage> opaqueMaps = new TreeMap<>();
        for (final Map.Entry<String, BufferedImage> entry : maps.entrySet()) {
            opaqueMaps.put(entry.getKey(), ArgbImages.toOpaque(entry.getValue()));
        }

        final List<MapContent> contents = new ArrayList<>(opaqueMaps.size());
        final Map<String, Integer> mapWidths = new TreeMap<>();
        for (final Map.Entry<String, BufferedImage> entry : opaqueMaps.entrySet()) {
            contents.add(new MapContent(entry.getKey(), entry.getValue(), landGrayThreshold));
            mapWidths.put(entry.getKey(), entry.getValue().getWidth());
        }

        final List<OverlapEdge> edges = matcher.matchAllPairs(contents);
        final Layout layout = layoutAssembler.assemble(mapWidths, edges);

        if (layout.getComponentCount() > 1) {
            LOG.warn("stitch: {} disconnected component(s) placed side by side", layout.getComponentCount());
        }

        int canvasWidth = 0;
        int canvasHeight = 0;
        for (final Map.Entry<String, CanvasPosition> entry : layout.getNameToPosition().entrySet()) {
            final BufferedImage image = opaqueMaps.get(entry.getKey());
            canvasWidth = Math.max(canvasWidth, entry.getValue().getX() + image.getWidth());
            canvasHeight = Math.max(canvasHeight, entry.getValue().getY() + image.getHeight());
        }

        LOG.info("stitch: compositing onto {} x {} canvas", canvasWidth, canvasHeight);

        final BufferedImage stitchedCanvas = compositeCanvas(opaqueMaps, layout, canvasWidth, canvasHeight);

        final SortedMap<String, BufferedImage> filteredMaps = new TreeMap<>();
        for (final Map.Entry<String, BufferedImage> entry : opaqueMaps.entrySet()) {
            final IslandFilterResult filterResult = islandFilter.filter(entry.getKey(), entry.getValue());
            filteredMaps.put(entry.getKey(), filterResult.getImage());
        }

        final BufferedImage filteredCanvas = compositeCanvas(filteredMaps, layout, canvasWidth, canvasHeight);

        // owner indexes follow layout visit order
        final List<String> mapNames = new ArrayList<>(filteredMaps.size());
        for (final List<String> component : layout.getComponents()) {
            mapNames.addAll(component);
        }

        final List<BinaryMask> landMasks = new ArrayList<>(mapNames.size());
        for (final String mapName : mapNames) {
            final CanvasPosition position = layout.getPosition(mapName);
            final BinaryMask land = ContentMasks.land(filteredMaps.get(mapName), landGrayThreshold);
            final BinaryMask placed = ContentMasks.placeOnCanvas(land,
                                                                 position.getX(),
                                                                 position.getY(),
                                                                 canvasWidth,
                                                                 canvasHeight);
            landMasks.add(Morphology.dilate(placed, Morphology.ELLIPSE_5X5, landMaskDilation));
        }

        final PartitionResult partition = partitioner.partition(groupKey,
                                                                mapNames,
                                                                landMasks,
                                                                filteredCanvas,
                                                                interactionPort);

        final List<Territory> territories = exporter.export(filteredMaps, layout, partition);

        LOG.info("stitch: exit, exported {} territories for group {} in {}",
                 territories.size(), groupKey, timer);

        return new StitchResult(groupKey, edges, layout, stitchedCanvas, partition, territories);
    }

    /**
     * @return opaque black canvas with the land of each map composited in order of position and name.
     */
    BufferedImage compositeCanvas(final Map<String, BufferedImage> maps,
                                  final Layout layout,
                                  final int canvasWidth,
                                  final int canvasHeight) {

        final BufferedImage canvas = ArgbImages.newFilledImage(canvasWidth, canvasHeight, ArgbImages.OPAQUE_BLACK);

        final List<String> drawOrder = new ArrayList<>(layout.getNameToPosition().keySet());
        final Comparator<String> byPosition = Comparator.comparing(layout::getPosition);
        drawOrder.sort(byPosition.thenComparing(Comparator.naturalOrder()));

        for (final String mapName : drawOrder) {
            final BufferedImage image = maps.get(mapName);
            final CanvasPosition position = layout.getPosition(mapName);
            final BinaryMask land = ContentMasks.land(image, landGrayThreshold);
            LOG.debug("compositeCanvas: {} -> {}", mapName, position);
            compositor.paste(canvas,
                             ContentMasks.withLandOnlyAlpha(image, land),
                             position.getX(),
                             position.getY(),
                             true);
        }

        return canvas;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GroupStitcher.class);
}
