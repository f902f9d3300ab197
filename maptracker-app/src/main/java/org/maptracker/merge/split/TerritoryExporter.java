package org.maptracker.merge.split;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.maptracker.merge.image.ArgbImages;
import org.maptracker.merge.image.CanvasCompositor;
import org.maptracker.merge.mask.BinaryMask;
import org.maptracker.merge.mask.PixelBounds;
import org.maptracker.merge.match.CanvasPosition;
import org.maptracker.merge.match.Layout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cuts each map's territory out of its canvas placement.
 */
public class TerritoryExporter {

    private final CanvasCompositor compositor;

    public TerritoryExporter() {
        this.compositor = new CanvasCompositor();
    }

    /**
     * @param  maps          map images keyed by name.
     * @param  layout        canvas placement of the maps.
     * @param  partition     ownership of the canvas pixels.
     *
     * @return territories in partition order, maps without any owned pixel are omitted.
     */
    public List<Territory> export(final Map<String, BufferedImage> maps,
                                  final Layout layout,
                                  final PartitionResult partition) {

        final List<Territory> territories = new ArrayList<>();
        final List<String> mapNames = partition.getMapNames();

        for (int m = 0; m < mapNames.size(); m++) {

            final String mapName = mapNames.get(m);
            final BinaryMask ownership = partition.getOwnershipMasks().get(m);
            final PixelBounds bounds = ownership.getBounds();

            if (bounds == null) {
                LOG.warn("export: {} has no assigned pixels, skipped", mapName);
                continue;
            }

            final BufferedImage image = maps.get(mapName);
            if (image == null) {
                throw new IllegalArgumentException("no image for map '" + mapName + "'");
            }

            final CanvasPosition position = layout.getPosition(mapName);
            final BufferedImage placed = ArgbImages.newFilledImage(ownership.getWidth(),
                                                                   ownership.getHeight(),
                                                                   ArgbImages.OPAQUE_BLACK);
            compositor.paste(placed, ArgbImages.toOpaque(image), position.getX(), position.getY(), false);

            final BufferedImage cropped = ArgbImages.newImage(bounds.getWidth(), bounds.getHeight());
            final int[] placedPixels = ArgbImages.getPixels(placed);
            final int[] croppedPixels = ArgbImages.getPixels(cropped);
            final int canvasWidth = ownership.getWidth();
            int i = 0;
            for (int y = bounds.getMinY(); y < bounds.getMaxY(); y++) {
                for (int x = bounds.getMinX(); x < bounds.getMaxX(); x++) {
                    final int canvasIndex = (y * canvasWidth) + x;
                    croppedPixels[i++] = ownership.get(canvasIndex) ? placedPixels[canvasIndex] : ArgbImages.OPAQUE_BLACK;
                }
            }

            LOG.info("export: {} owns {}", mapName, bounds);

            territories.add(new Territory(mapName, bounds, cropped));
        }

        return territories;
    }

    private static final Logger LOG = LoggerFactory.getLogger(TerritoryExporter.class);
}
