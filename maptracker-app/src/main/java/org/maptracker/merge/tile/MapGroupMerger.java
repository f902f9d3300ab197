package org.maptracker.merge.tile;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.CanvasCompositor;
import org.maptracker.merge.image.ImageScaler;
import org.maptracker.merge.interaction.AlignmentRequest;
import org.maptracker.merge.interaction.InteractionPort;
import org.maptracker.merge.parameters.TileGridParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Composites the tiles of one map group into a full scale canvas and renders the scaled merged map.
 *
 * Standard sized and automatically aligned tiles are composited first (in grid key order).
 * Tiles that need manual alignment are then resolved through the {@link InteractionPort}
 * and composited in the same order.
 */
public class MapGroupMerger {

    private final TileGrid tileGrid;
    private final TileAligner tileAligner;
    private final CanvasCompositor compositor;
    private final double scale;
    private final InteractionPort interactionPort;

    public MapGroupMerger(final TileGridParameters parameters,
                          final InteractionPort interactionPort) {
        parameters.validate();
        this.tileGrid = new TileGrid(parameters);
        this.tileAligner = new TileAligner(parameters);
        this.compositor = new CanvasCompositor();
        this.scale = parameters.scale;
        this.interactionPort = interactionPort;
    }

    /**
     * Merges the tiles of a group using the group's own grid extent.
     */
    public MergedMap merge(final MapGroup<Tile> group) {
        return merge(group, group.getGridExtent());
    }

    /**
     * Merges the tiles of a group.
     *
     * @param  group   tiles to merge.
     * @param  extent  grid extent for the canvas (tier groups use the extent of their normal group).
     *
     * @return merged map with full scale canvas and scaled output.
     */
    public MergedMap merge(final MapGroup<Tile> group,
                           final GridExtent extent) {

        final String name = group.getName();
        final int maxX = extent.getMaxX();
        final int maxY = extent.getMaxY();

        LOG.info("merge: entry, group {} with {} tiles on {} grid", name, group.size(), extent);

        final BufferedImage canvas = ArgbImages.newImage(tileGrid.getCanvasWidth(extent),
                                                         tileGrid.getCanvasHeight(extent));

        final List<Tile> mergedTiles = new ArrayList<>(group.size());
        final List<Tile> manualTiles = new ArrayList<>();

        for (final Tile tile : group.getTiles().values()) {
            if (tileGrid.isStandardSize(tile)) {
                compositeTile(canvas, tile, AlignDirection.LT, maxX, maxY);
                mergedTiles.add(tile);
            } else {
                final Tile alignedTile = tile.withAlignment(tileAligner.align(tile));
                if (alignedTile.getAlignment().isManual()) {
                    LOG.info("merge: tile {} requires manual alignment ({}x{})",
                             tile.getFileName(), tile.getWidth(), tile.getHeight());
                    manualTiles.add(alignedTile);
                } else {
                    final AlignDirection direction = alignedTile.getAlignment().getDirection();
                    LOG.info("merge: tile {} auto aligned to {} ({}x{})",
                             tile.getFileName(), direction, tile.getWidth(), tile.getHeight());
                    compositeTile(canvas, alignedTile, direction, maxX, maxY);
                    mergedTiles.add(alignedTile);
                }
            }
        }

        if (manualTiles.isEmpty()) {
            LOG.info("merge: no manual adjustments needed for {}", name);
        } else {
            LOG.info("merge: {} non-standard tiles of {} cannot be auto aligned", manualTiles.size(), name);
            // every request sees the same preview, manual tiles are composited once all are resolved
            final List<Tile> resolvedTiles = new ArrayList<>(manualTiles.size());
            for (final Tile manualTile : manualTiles) {
                resolvedTiles.add(resolveManualAlignment(name, manualTile, canvas));
            }
            for (final Tile resolvedTile : resolvedTiles) {
                compositeTile(canvas, resolvedTile, resolvedTile.getAlignment().getDirection(), maxX, maxY);
            }
            mergedTiles.addAll(resolvedTiles);
        }

        final BufferedImage output = renderOutput(canvas);

        LOG.info("merge: exit, merged {} into {}x{} output", name, output.getWidth(), output.getHeight());

        return new MergedMap(name, extent, canvas, output, mergedTiles);
    }

    /**
     * @return the canvas scaled by the configured factor and composited over an opaque black background.
     */
    private BufferedImage renderOutput(final BufferedImage canvas) {
        final BufferedImage scaled = ImageScaler.scale(canvas, scale);
        final BufferedImage output = ArgbImages.newFilledImage(scaled.getWidth(),
                                                               scaled.getHeight(),
                                                               ArgbImages.OPAQUE_BLACK);
        compositor.paste(output, scaled, 0, 0, true);
        return output;
    }

    private Tile resolveManualAlignment(final String groupName,
                                        final Tile manualTile,
                                        final BufferedImage canvas) {

        final AlignmentRequest request = new AlignmentRequest(groupName, manualTile, ArgbImages.toArgb(canvas));
        final AlignDirection direction = interactionPort.resolveAlignment(request);

        final Tile resolvedTile;
        if (direction == null) {
            LOG.warn("resolveManualAlignment: no direction provided for tile {}, keeping {}",
                     manualTile.getFileName(), manualTile.getAlignment().getDirection());
            resolvedTile = manualTile;
        } else {
            LOG.info("resolveManualAlignment: tile {} aligned to {}", manualTile.getFileName(), direction);
            resolvedTile = manualTile.withDirection(direction);
        }
        return resolvedTile;
    }

    private void compositeTile(final BufferedImage canvas,
                               final Tile tile,
                               final AlignDirection direction,
                               final int maxX,
                               final int maxY) {
        compositor.paste(canvas,
                         tile.getImage(),
                         tileGrid.getAnchorX(tile, direction, maxX),
                         tileGrid.getAnchorY(tile, direction, maxY),
                         true);
    }

    private static final Logger LOG = LoggerFactory.getLogger(MapGroupMerger.class);
}
