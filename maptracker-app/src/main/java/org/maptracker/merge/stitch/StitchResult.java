package org.maptracker.merge.stitch;

import java.awt.image.BufferedImage;
import java.util.List;

import org.maptracker.merge.match.Layout;
import org.maptracker.merge.match.OverlapEdge;
import org.maptracker.merge.split.PartitionResult;
import org.maptracker.merge.split.Territory;

/**
 * Everything derived while stitching one group of merged maps.
 */
public class StitchResult {

    private final String groupKey;
    private final List<OverlapEdge> edges;
    private final Layout layout;
    private final BufferedImage stitchedCanvas;
    private final PartitionResult partition;
    private final List<Territory> territories;

    public StitchResult(final String groupKey,
                        final List<OverlapEdge> edges,
                        final Layout layout,
                        final BufferedImage stitchedCanvas,
                        final PartitionResult partition,
                        final List<Territory> territories) {
        this.groupKey = groupKey;
        this.edges = edges;
        this.layout = layout;
        this.stitchedCanvas = stitchedCanvas;
        this.partition = partition;
        this.territories = territories;
    }

    public String getGroupKey() {
        return groupKey;
    }

    public List<OverlapEdge> getEdges() {
        return edges;
    }

    public Layout getLayout() {
        return layout;
    }

    /**
     * @return canvas with every (unfiltered) map composited, before islands were removed.
     */
    public BufferedImage getStitchedCanvas() {
        return stitchedCanvas;
    }

    public PartitionResult getPartition() {
        return partition;
    }

    public List<Territory> getTerritories() {
        return territories;
    }
}
