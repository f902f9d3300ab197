package org.maptracker.merge.match;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link LayoutAssembler} class.
 */
public class LayoutAssemblerTest {

    @Test
    public void testAssemble() {

        final Map<String, Integer> mapWidths = buildWidths();
        final List<OverlapEdge> edges = Collections.singletonList(new OverlapEdge("a", "b", 30, -10, 0.9));

        final Layout layout = new LayoutAssembler(20).assemble(mapWidths, edges);

        Assert.assertEquals("invalid position for a", new CanvasPosition(0, 10), layout.getPosition("a"));
        Assert.assertEquals("invalid position for b", new CanvasPosition(30, 0), layout.getPosition("b"));
        Assert.assertEquals("invalid position for c", new CanvasPosition(150, 0), layout.getPosition("c"));
        Assert.assertEquals("invalid position for d", new CanvasPosition(220, 0), layout.getPosition("d"));

        Assert.assertEquals("invalid components",
                            Arrays.asList(Arrays.asList("a", "b"),
                                          Collections.singletonList("c"),
                                          Collections.singletonList("d")),
                            layout.getComponents());
    }

    @Test
    public void testEdgeOrderDoesNotChangeLayout() {

        final Map<String, Integer> mapWidths = buildWidths();
        final List<OverlapEdge> edges = new ArrayList<>(Arrays.asList(
                new OverlapEdge("a", "b", 10, 0, 0.9),
                new OverlapEdge("b", "c", 10, 0, 0.9),
                new OverlapEdge("a", "c", 50, 0, 0.9),
                new OverlapEdge("c", "d", 0, 40, 0.9)));

        final LayoutAssembler assembler = new LayoutAssembler(20);
        final Layout layout = assembler.assemble(mapWidths, edges);

        Collections.reverse(edges);
        final Layout reversedLayout = assembler.assemble(mapWidths, edges);

        Assert.assertEquals("edge order should not change positions",
                            layout.getNameToPosition(), reversedLayout.getNameToPosition());
        Assert.assertEquals("edge order should not change components",
                            layout.getComponents(), reversedLayout.getComponents());
    }

    @Test
    public void testNeighborsAreVisitedInNameOrder() {

        final Map<String, Integer> mapWidths = buildWidths();
        final List<OverlapEdge> edges = Arrays.asList(
                new OverlapEdge("b", "c", 10, 0, 0.9),
                new OverlapEdge("a", "c", 50, 0, 0.9),
                new OverlapEdge("a", "b", 10, 0, 0.9));

        final Layout layout = new LayoutAssembler(20).assemble(mapWidths, edges);

        // c is reached directly from a before b is expanded
        Assert.assertEquals("invalid position for b", new CanvasPosition(10, 0), layout.getPosition("b"));
        Assert.assertEquals("invalid position for c", new CanvasPosition(50, 0), layout.getPosition("c"));
        Assert.assertEquals("invalid visit order",
                            Arrays.asList("a", "b", "c"), layout.getComponents().get(0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownMapInEdge() {
        new LayoutAssembler(20).assemble(buildWidths(),
                                         Collections.singletonList(new OverlapEdge("a", "zz", 1, 1, 0.9)));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeGap() {
        new LayoutAssembler(-1);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownPosition() {
        new LayoutAssembler(0).assemble(buildWidths(), Collections.emptyList()).getPosition("zz");
    }

    private static Map<String, Integer> buildWidths() {
        final Map<String, Integer> mapWidths = new TreeMap<>();
        mapWidths.put("d", 80);
        mapWidths.put("c", 50);
        mapWidths.put("b", 100);
        mapWidths.put("a", 100);
        return mapWidths;
    }

}
