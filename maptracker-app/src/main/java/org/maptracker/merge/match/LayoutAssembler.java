package org.maptracker.merge.match;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts pairwise overlap edges into a global layout.
 *
 * Maps connected through edges are placed relative to each other by breadth first search.
 * Roots and neighbors are both visited in name order so the same input always produces the
 * same layout. Each connected component is shifted to a zero origin and components are then
 * laid out left to right separated by a fixed gap.
 */
public class LayoutAssembler {

    private final int componentGap;

    public LayoutAssembler(final int componentGap) {
        if (componentGap < 0) {
            throw new IllegalArgumentException("componentGap must not be negative");
        }
        this.componentGap = componentGap;
    }

    /**
     * @param  mapWidths  width of every map that should be placed, keyed by map name.
     * @param  edges      overlap edges between those maps.
     *
     * @return layout for all maps in mapWidths.
     *
     * @throws IllegalArgumentException
     *   if an edge references a map that is not in mapWidths.
     */
    public Layout assemble(final Map<String, Integer> mapWidths,
                           final List<OverlapEdge> edges)
            throws IllegalArgumentException {

        final SortedMap<String, List<OverlapEdge>> adjacency = new TreeMap<>();
        for (final String name : mapWidths.keySet()) {
            adjacency.put(name, new ArrayList<>());
        }

        for (final OverlapEdge edge : edges) {
            addEdge(adjacency, edge);
            addEdge(adjacency, edge.reverse());
        }

        // stable sort keeps insertion order for repeated pairs
        for (final List<OverlapEdge> neighbors : adjacency.values()) {
            neighbors.sort(Comparator.comparing(OverlapEdge::getqName));
        }

        final Map<String, int[]> visitedPositions = new HashMap<>();
        final List<List<String>> components = new ArrayList<>();

        for (final String root : adjacency.keySet()) {

            if (visitedPositions.containsKey(root)) {
                continue;
            }

            final List<String> component = new ArrayList<>();
            final Deque<String> queue = new ArrayDeque<>();
            visitedPositions.put(root, new int[] {0, 0});
            queue.add(root);

            while (! queue.isEmpty()) {
                final String name = queue.poll();
                component.add(name);
                final int[] position = visitedPositions.get(name);
                for (final OverlapEdge edge : adjacency.get(name)) {
                    final String neighbor = edge.getqName();
                    if (! visitedPositions.containsKey(neighbor)) {
                        visitedPositions.put(neighbor,
                                             new int[] {position[0] + edge.getDx(), position[1] + edge.getDy()});
                        queue.add(neighbor);
                    }
                }
            }

            components.add(component);
        }

        final SortedMap<String, CanvasPosition> nameToPosition = new TreeMap<>();
        int xCursor = 0;
        for (final List<String> component : components) {

            int minX = Integer.MAX_VALUE;
            int minY = Integer.MAX_VALUE;
            for (final String name : component) {
                final int[] position = visitedPositions.get(name);
                minX = Math.min(minX, position[0]);
                minY = Math.min(minY, position[1]);
            }

            int maxRight = xCursor;
            for (final String name : component) {
                final int[] position = visitedPositions.get(name);
                final int x = position[0] - minX + xCursor;
                final int y = position[1] - minY;
                nameToPosition.put(name, new CanvasPosition(x, y));
                maxRight = Math.max(maxRight, x + mapWidths.get(name));
            }

            xCursor = maxRight + componentGap;
        }

        LOG.info("assemble: placed {} map(s) in {} component(s)", nameToPosition.size(), components.size());

        return new Layout(nameToPosition, components);
    }

    private static void addEdge(final Map<String, List<OverlapEdge>> adjacency,
                                final OverlapEdge edge) {
        final List<OverlapEdge> neighbors = adjacency.get(edge.getpName());
        if ((neighbors == null) || (! adjacency.containsKey(edge.getqName()))) {
            throw new IllegalArgumentException("edge " + edge + " references an unknown map");
        }
        neighbors.add(edge);
    }

    private static final Logger LOG = LoggerFactory.getLogger(LayoutAssembler.class);
}
