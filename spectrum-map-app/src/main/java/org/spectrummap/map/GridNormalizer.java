package org.spectrummap.map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Scales grid values into [0, 1] by dividing them by the grid's maximum value.
 *
 * Negative intensities (e.g. from background subtracted spectra) have no color in the bitmap,
 * so they are clamped to 0 after scaling.  A grid without any positive value becomes all zeros.
 */
public class GridNormalizer {

    /**
     * @return normalized grid with every value in [0, 1].
     */
    public IntensityGrid normalize(final IntensityGrid grid) {

        final double max = grid.getMaxValue();
        final boolean scale = (max > 0) && Double.isFinite(max);

        if (! scale) {
            LOG.warn("normalize: maximum value is {}, only clamping negative values to 0", max);
        }

        final double[] values = grid.getValues();
        int clampedCount = 0;
        for (int i = 0; i < values.length; i++) {
            final double scaled = scale ? values[i] / max : values[i];
            if (scaled < 0) {
                values[i] = 0;
                clampedCount++;
            } else {
                values[i] = scaled;
            }
        }

        if (clampedCount > 0) {
            LOG.info("normalize: clamped {} negative values to 0", clampedCount);
        }

        LOG.debug("normalize: divided {} values by {}", values.length, max);

        return IntensityGrid.wrap(grid.getWidth(), grid.getHeight(), values);
    }

    private static final Logger LOG = LoggerFactory.getLogger(GridNormalizer.class);
}
