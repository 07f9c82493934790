package org.spectrummap.map;

import org.junit.Assert;
import org.junit.Test;
import org.spectrummap.GridGeometryException;

/**
 * Tests the {@link GridResampler} and {@link PixelStepFunction} classes.
 */
public class GridResamplerTest {

    @Test
    public void testThreeByTwoGrid() {

        final RawMap rawMap = assemble(new double[] { 0, 1, 2 },
                                       new double[] { 0, 1 },
                                       new double[] { 1, 2, 3,
                                                      4, 5, 6 });

        final IntensityGrid formatted = new GridResampler().resample(rawMap);

        // (2 - 0) / 1 + 1 = 3 padded to 4, (1 - 0) / 1 + 1 = 2 padded to 4
        Assert.assertEquals("invalid pixel width", 4, formatted.getWidth());
        Assert.assertEquals("invalid pixel height", 4, formatted.getHeight());
        Assert.assertEquals("invalid number of cells", 16, formatted.size());

        // x boundaries are 1 * 4 / 2 = 2 and 4, the only y boundary is 1 * 4 / 1 = 4
        final double[] expected = {
                1, 1, 2, 2,
                1, 1, 2, 2,
                1, 1, 2, 2,
                1, 1, 2, 2
        };
        Assert.assertArrayEquals("invalid formatted values", expected, formatted.getValues(), 0);

        Assert.assertEquals("corner value should be preserved",
                            rawMap.getGrid().get(0, 0), formatted.get(0, 0), 0);
    }

    @Test
    public void testAlignedUniformGridIsUnchanged() {

        final double[] values = new double[16];
        for (int i = 0; i < values.length; i++) {
            values[i] = i / 16.0;
        }

        // steps of 10 with extent 30 give pixel steps of 10 * 4 / 30 = 1
        final RawMap rawMap = assemble(new double[] { 0, 10, 20, 30 },
                                       new double[] { 0, 10, 20, 30 },
                                       values);

        final IntensityGrid formatted = new GridResampler().resample(rawMap);

        Assert.assertEquals("formatted grid should match raw grid", rawMap.getGrid(), formatted);
    }

    @Test
    public void testNonUniformStepsAndSingleRow() {

        final RawMap rawMap = assemble(new double[] { 0, 2, 3 },
                                       new double[] { 0 },
                                       new double[] { 1, 2, 3 });

        final IntensityGrid formatted = new GridResampler().resample(rawMap);

        // 3 / 1 + 1 = 4 columns, single row axis gives 1 row padded to 4
        Assert.assertEquals("invalid pixel width", 4, formatted.getWidth());
        Assert.assertEquals("invalid pixel height", 4, formatted.getHeight());

        // boundaries: 2 * 4 / 3 = 2, then 2 + 1 * 4 / 3 = 3
        final double[] expectedRow = { 1, 1, 2, 3 };
        for (int row = 0; row < formatted.getHeight(); row++) {
            for (int column = 0; column < formatted.getWidth(); column++) {
                Assert.assertEquals("invalid value for row " + row + ", column " + column,
                                    expectedRow[column], formatted.get(row, column), 0);
            }
        }
    }

    @Test
    public void testSingleSite() {

        final RawMap rawMap = assemble(new double[] { 0 }, new double[] { 0 }, new double[] { 0.5 });

        final IntensityGrid formatted = new GridResampler().resample(rawMap);

        Assert.assertEquals("invalid pixel width", 4, formatted.getWidth());
        Assert.assertEquals("invalid pixel height", 4, formatted.getHeight());
        for (final double value : formatted.getValues()) {
            Assert.assertEquals("every pixel should hold the single site value", 0.5, value, 0);
        }
    }

    @Test
    public void testNonZeroOriginIsResampledAnyway() {

        // known limitation: the map is resampled relative to its own minimum with a warning
        final RawMap rawMap = assemble(new double[] { 1, 2, 3 },
                                       new double[] { 5 },
                                       new double[] { 7, 8, 9 });

        final IntensityGrid formatted = new GridResampler().resample(rawMap);

        Assert.assertEquals("invalid pixel width", 4, formatted.getWidth());
        Assert.assertEquals("invalid pixel height", 4, formatted.getHeight());
        Assert.assertEquals("first pixel should hold first raw value", 7, formatted.get(0, 0), 0);
    }

    @Test
    public void testPaddingToMultipleOfFour() {
        Assert.assertEquals("1 should pad to 4", 4, GridResampler.pad(1));
        Assert.assertEquals("4 should stay 4", 4, GridResampler.pad(4));
        Assert.assertEquals("5 should pad to 8", 8, GridResampler.pad(5));
        Assert.assertEquals("11 should pad to 12", 12, GridResampler.pad(11));
    }

    @Test
    public void testPixelCountUsesSmallestStep() {
        final StepSequence steps = new StepSequence(new long[] { 4, 2, 4 });
        Assert.assertEquals("invalid pixel count", 6, GridResampler.getPixelCount("x", steps, 10));
    }

    @Test(expected = GridGeometryException.class)
    public void testZeroStepIsDegenerate() {
        // 0.3 rounds to a step of 0
        final RawMap rawMap = assemble(new double[] { 0, 0.3 }, new double[] { 0 }, new double[] { 1, 2 });
        new GridResampler().resample(rawMap);
    }

    @Test(expected = GridGeometryException.class)
    public void testZeroExtentIsDegenerate() {
        // both values truncate to 0 even though their gap rounds to 1
        final RawMap rawMap = assemble(new double[] { 0.2, 0.9 }, new double[] { 0 }, new double[] { 1, 2 });
        new GridResampler().resample(rawMap);
    }

    @Test
    public void testPixelStepFunction() {

        final PixelStepFunction function =
                new PixelStepFunction(new StepSequence(new long[] { 1, 3, 2 }), 12, 6);

        Assert.assertArrayEquals("invalid boundaries", new long[] { 2, 8, 12 }, function.getBoundaries());

        final int[] expected = { 0, 0, 1, 1, 1, 1, 1, 1, 2, 2, 2, 2 };
        for (int pixel = 0; pixel < expected.length; pixel++) {
            Assert.assertEquals("invalid raw index for pixel " + pixel, expected[pixel], function.getRawIndex(pixel));
        }
    }

    @Test
    public void testPixelStepFunctionNeverExceedsLastRawIndex() {

        // boundaries 0, 1, 1 - a repeated boundary advances more than one raw index at once
        final PixelStepFunction function =
                new PixelStepFunction(new StepSequence(new long[] { 1, 2, 1 }), 4, 5);

        Assert.assertArrayEquals("invalid boundaries", new long[] { 0, 1, 1 }, function.getBoundaries());

        final int[] expected = { 1, 3, 3, 3 };
        for (int pixel = 0; pixel < expected.length; pixel++) {
            Assert.assertEquals("invalid raw index for pixel " + pixel, expected[pixel], function.getRawIndex(pixel));
        }
    }

    private static RawMap assemble(final double[] x,
                                   final double[] y,
                                   final double[] rowMajorValues) {
        final IntensityMap.Builder builder = new IntensityMap.Builder();
        int i = 0;
        for (final double yValue : y) {
            for (final double xValue : x) {
                builder.put(new SiteCoordinate(xValue, yValue), rowMajorValues[i], "site-" + i);
                i++;
            }
        }
        return new GridAssembler().assemble(builder.build());
    }
}
