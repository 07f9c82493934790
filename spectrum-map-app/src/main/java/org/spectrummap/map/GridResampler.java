package org.spectrummap.map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.GridGeometryException;

/**
 * Resamples a raw grid into a uniformly pixeled grid suitable for display.
 *
 * The number of pixels along each axis is the physical extent of the axis divided by its smallest
 * step (so the most closely spaced rows or columns set the resolution), padded up to a multiple of
 * four for raster row alignment.  Raw cells are spread over the pixels with a
 * {@link PixelStepFunction} for each axis.
 *
 * Maps whose minimum x or y is not zero are resampled anyway but may be misaligned.
 */
public class GridResampler {

    public static final int ALIGNMENT = 4;

    /**
     * @param  rawMap  assembled raw map.
     *
     * @return the formatted grid; its width and height are the padded pixel dimensions.
     *
     * @throws GridGeometryException
     *   if an axis has a degenerate step sequence or the formatted grid would be too large.
     */
    public IntensityGrid resample(final RawMap rawMap)
            throws GridGeometryException {

        final AxisSet axisSet = rawMap.getAxisSet();

        if ((axisSet.getMinX() != 0) || (axisSet.getMinY() != 0)) {
            LOG.warn("resample: origin of coordinates is ({}, {}) instead of (0, 0), " +
                     "the formatted grid and bitmap may not be aligned with the acquisition sites",
                     axisSet.getMinX(), axisSet.getMinY());
        }

        final long xExtent = getExtent(axisSet.getMinX(), axisSet.getMaxX());
        final long yExtent = getExtent(axisSet.getMinY(), axisSet.getMaxY());

        final int width = getPaddedPixelCount("x", rawMap.getXSteps(), xExtent);
        final int height = getPaddedPixelCount("y", rawMap.getYSteps(), yExtent);

        if (((long) width * height) > GridAssembler.MAX_CELLS) {
            throw new GridGeometryException("formatted grid of " + width + "x" + height + " pixels is too large");
        }

        final PixelStepFunction columnLookup = new PixelStepFunction(rawMap.getXSteps(), width, xExtent);
        final PixelStepFunction rowLookup = new PixelStepFunction(rawMap.getYSteps(), height, yExtent);

        LOG.debug("resample: columnLookup={}, rowLookup={}", columnLookup, rowLookup);

        final IntensityGrid rawGrid = rawMap.getGrid();
        final double[] values = new double[width * height];
        int i = 0;
        for (int row = 0; row < height; row++) {
            final int rawRow = rowLookup.getRawIndex(row);
            for (int column = 0; column < width; column++) {
                values[i] = rawGrid.get(rawRow, columnLookup.getRawIndex(column));
                i++;
            }
        }

        LOG.debug("resample: exit, formatted grid is {}x{} pixels", width, height);

        return IntensityGrid.wrap(width, height, values);
    }

    /**
     * @return number of pixels needed to show every step of the axis at the resolution of its
     *         smallest step, before padding.
     *
     * @throws GridGeometryException
     *   if the axis has more than one value but its smallest step or its extent is zero.
     */
    static long getPixelCount(final String axisName,
                              final StepSequence steps,
                              final long extent)
            throws GridGeometryException {

        long pixelCount = 1;

        if (! steps.isEmpty()) {

            final long minStep = steps.getMinimum();

            if ((minStep <= 0) || (extent <= 0)) {
                throw new GridGeometryException(
                        "degenerate " + axisName + " step sequence " + steps + " with extent " + extent +
                        ", distinct " + axisName + " positions must be at least one unit apart");
            }

            pixelCount = (extent / minStep) + 1;
        }

        return pixelCount;
    }

    static long pad(final long pixelCount) {
        final long remainder = pixelCount % ALIGNMENT;
        return remainder == 0 ? pixelCount : pixelCount + ALIGNMENT - remainder;
    }

    static long getExtent(final double min,
                          final double max) {
        return (long) max - (long) min;
    }

    private static int getPaddedPixelCount(final String axisName,
                                           final StepSequence steps,
                                           final long extent)
            throws GridGeometryException {

        final long padded = pad(getPixelCount(axisName, steps, extent));
        if (padded > Integer.MAX_VALUE) {
            throw new GridGeometryException("formatted " + axisName + " dimension " + padded + " is too large");
        }
        return (int) padded;
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridResampler.class);
}
