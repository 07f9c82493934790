package org.spectrummap.map;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link IntensityGrid} class.
 */
public class IntensityGridTest {

    @Test
    public void testPublicConstructorCopiesValues() {
        final double[] values = { 1, 2, 3, 4 };
        final IntensityGrid grid = new IntensityGrid(2, 2, values);
        values[0] = 99;
        Assert.assertEquals("grid should not see later changes to its source array", 1, grid.get(0, 0), 0);
    }

    @Test
    public void testWrapSharesValues() {
        final double[] values = { 1, 2, 3, 4 };
        final IntensityGrid grid = IntensityGrid.wrap(2, 2, values);
        values[3] = 42;
        Assert.assertEquals("wrapped grid should use the source array as is", 42, grid.get(1, 1), 0);
        Assert.assertEquals("invalid max value", 42, grid.getMaxValue(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testWrapValidatesDimensions() {
        IntensityGrid.wrap(3, 2, new double[4]);
    }

    @Test
    public void testRowMajorAccess() {
        final IntensityGrid grid = new IntensityGrid(3, 2, new double[] { 1, 2, 3, 4, 5, 6 });
        Assert.assertEquals("invalid value for row 1, column 0", 4, grid.get(1, 0), 0);
        Assert.assertEquals("invalid value for row 0, column 2", 3, grid.get(0, 2), 0);
    }
}
