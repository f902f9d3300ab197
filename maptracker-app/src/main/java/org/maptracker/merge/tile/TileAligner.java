package org.maptracker.merge.tile;

import java.util.ArrayList;
import java.util.List;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.parameters.TileGridParameters;

/**
 * Decides which corner of its grid cell a non-standard sized tile should be anchored to
 * by checking which of its edges contain opaque pixels.
 *
 * A tile cut from the border of the map only has content on the edges that touch
 * the rest of the map, so exactly one candidate edge (or corner) identifies the anchor.
 * Tiles with no or several candidates are marked for manual alignment.
 */
public class TileAligner {

    public enum Edge {
        LEFT, RIGHT, TOP, BOTTOM
    }

    private final int cellWidth;
    private final int cellHeight;
    private final int opacityThreshold;

    public TileAligner(final TileGridParameters parameters) {
        this(parameters.cellWidth, parameters.cellHeight, parameters.edgeOpacityThreshold);
    }

    /**
     * @param  cellWidth         standard tile width.
     * @param  cellHeight        standard tile height.
     * @param  opacityThreshold  minimum alpha value for an edge pixel to count as opaque
     *                           (tolerates compression noise in transparent areas).
     */
    public TileAligner(final int cellWidth,
                       final int cellHeight,
                       final int opacityThreshold) {
        this.cellWidth = cellWidth;
        this.cellHeight = cellHeight;
        this.opacityThreshold = opacityThreshold;
    }

    /**
     * @return auto alignment if exactly one edge or corner candidate exists, otherwise a manual marker.
     *         Standard sized tiles are always auto aligned to the top left corner.
     */
    public TileAlignment align(final Tile tile) {

        final boolean isStandardWidth = tile.getWidth() == cellWidth;
        final boolean isStandardHeight = tile.getHeight() == cellHeight;

        if (isStandardWidth && isStandardHeight) {
            return TileAlignment.auto(AlignDirection.LT);
        }

        final boolean left = hasOpaquePixelsOnEdge(tile, Edge.LEFT);
        final boolean right = hasOpaquePixelsOnEdge(tile, Edge.RIGHT);
        final boolean top = hasOpaquePixelsOnEdge(tile, Edge.TOP);
        final boolean bottom = hasOpaquePixelsOnEdge(tile, Edge.BOTTOM);

        final List<AlignDirection> candidates = new ArrayList<>();
        if (isStandardWidth) {
            addIf(top, AlignDirection.LT, candidates);
            addIf(bottom, AlignDirection.LB, candidates);
        } else if (isStandardHeight) {
            addIf(left, AlignDirection.LT, candidates);
            addIf(right, AlignDirection.RT, candidates);
        } else {
            addIf(left && top, AlignDirection.LT, candidates);
            addIf(right && top, AlignDirection.RT, candidates);
            addIf(left && bottom, AlignDirection.LB, candidates);
            addIf(right && bottom, AlignDirection.RB, candidates);
        }

        return candidates.size() == 1 ? TileAlignment.auto(candidates.get(0)) : TileAlignment.manual();
    }

    /**
     * @return true if any pixel on the specified edge of the tile has an alpha value of at least the threshold.
     */
    public boolean hasOpaquePixelsOnEdge(final Tile tile,
                                         final Edge edge) {

        final int width = tile.getWidth();
        final int height = tile.getHeight();

        final int[] edgePixels;
        switch (edge) {
            case LEFT:   edgePixels = tile.getImage().getRGB(0, 0, 1, height, null, 0, 1); break;
            case RIGHT:  edgePixels = tile.getImage().getRGB(width - 1, 0, 1, height, null, 0, 1); break;
            case TOP:    edgePixels = tile.getImage().getRGB(0, 0, width, 1, null, 0, width); break;
            case BOTTOM: edgePixels = tile.getImage().getRGB(0, height - 1, width, 1, null, 0, width); break;
            default: throw new IllegalArgumentException("edge " + edge + " is not mapped");
        }

        for (final int pixel : edgePixels) {
            if (ArgbImages.alpha(pixel) >= opacityThreshold) {
                return true;
            }
        }
        return false;
    }

    private static void addIf(final boolean condition,
                              final AlignDirection direction,
                              final List<AlignDirection> candidates) {
        if (condition) {
            candidates.add(direction);
        }
    }

}
