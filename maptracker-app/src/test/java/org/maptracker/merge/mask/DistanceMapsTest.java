package org.maptracker.merge.mask;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DistanceMaps} class.
 */
public class DistanceMapsTest {

    @Test
    public void testDistanceToMask() {

        final BinaryMask target = new BinaryMask(20, 10);
        target.set(2, 5, true);

        final float[] distances = DistanceMaps.distanceToMask(target);

        Assert.assertEquals("target pixel should have distance 0", 0.0, distances[(5 * 20) + 2], 0.001);
        Assert.assertEquals("invalid horizontal distance", 7.0, distances[(5 * 20) + 9], 0.001);
        Assert.assertEquals("invalid diagonal distance", 5.0, distances[(1 * 20) + 5], 0.001);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testEmptyTarget() {
        DistanceMaps.distanceToMask(new BinaryMask(4, 4));
    }

}
