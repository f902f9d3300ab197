package org.maptracker.merge.mask;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ConnectedComponents} class.
 */
public class ConnectedComponentsTest {

    @Test
    public void testDiagonalConnectivity() {

        // X . . .
        // . X . X
        // . . . X
        final BinaryMask mask = new BinaryMask(4, 3);
        mask.set(0, 0, true);
        mask.set(1, 1, true);
        mask.set(3, 1, true);
        mask.set(3, 2, true);

        final ComponentLabels fourConnected = ConnectedComponents.label(mask, ConnectedComponents.Connectivity.FOUR);
        Assert.assertEquals("invalid 4-connected component count", 3, fourConnected.getComponentCount());

        final ComponentLabels eightConnected = ConnectedComponents.label(mask, ConnectedComponents.Connectivity.EIGHT);
        Assert.assertEquals("invalid 8-connected component count", 2, eightConnected.getComponentCount());
        Assert.assertEquals("diagonal pixels should share a label",
                            eightConnected.getLabel(0, 0), eightConnected.getLabel(1, 1));
        Assert.assertEquals("background should have label 0", 0, eightConnected.getLabel(2, 0));
    }

    @Test
    public void testComponentPixels() {

        final BinaryMask mask = new BinaryMask(5, 5);
        mask.fill(0, 0, 2, 2, true);
        mask.fill(3, 1, 5, 5, true);

        final ComponentLabels labels = ConnectedComponents.label(mask, ConnectedComponents.Connectivity.FOUR);

        Assert.assertEquals("invalid component count", 2, labels.getComponentCount());
        Assert.assertEquals("first component should start at the first raster pixel", 1, labels.getLabel(0, 0));
        Assert.assertEquals("invalid size for component 1", 4, labels.getComponentSize(1));
        Assert.assertEquals("invalid size for component 2", 8, labels.getComponentSize(2));

        for (final int index : labels.getComponentPixels(2)) {
            Assert.assertEquals("pixel " + index + " has wrong label", 2, labels.getLabel(index));
        }
    }

    @Test
    public void testEmptyMask() {
        final ComponentLabels labels = ConnectedComponents.label(new BinaryMask(3, 3),
                                                                 ConnectedComponents.Connectivity.EIGHT);
        Assert.assertEquals("empty mask should have no components", 0, labels.getComponentCount());
    }

}
