package org.spectrummap.map;

import java.util.Arrays;

/**
 * Monotonic lookup from an output pixel index to the raw grid index whose value that pixel holds.
 *
 * Each raw step contributes {@code step * pixelCount / extent} pixels (integer division) and the
 * running totals of those contributions are the pixel-step boundaries: the pixel at which the next
 * raw index becomes active.  Between two boundaries every pixel repeats the value of the current
 * raw index (nearest-neighbor, hold-last-value).
 */
public class PixelStepFunction {

    private final long[] boundaries;
    private final int[] rawIndexForPixel;

    /**
     * @param  steps        steps between the distinct values of one axis.
     * @param  pixelCount   number of (padded) output pixels along the axis.
     * @param  extent       physical extent of the axis ({@code max - min}, truncated to whole units).
     *                      Only used when the axis has at least one step.
     */
    public PixelStepFunction(final StepSequence steps,
                             final int pixelCount,
                             final long extent)
            throws IllegalArgumentException {

        if ((steps.size() > 0) && (extent <= 0)) {
            throw new IllegalArgumentException("extent must be positive for an axis with " +
                                               (steps.size() + 1) + " values");
        }

        this.boundaries = new long[steps.size()];
        long accumulated = 0;
        for (int i = 0; i < steps.size(); i++) {
            accumulated += (steps.get(i) * pixelCount) / extent;
            this.boundaries[i] = accumulated;
        }

        final int maxRawIndex = steps.size();
        this.rawIndexForPixel = new int[pixelCount];
        int rawIndex = 0;
        for (int pixel = 0; pixel < pixelCount; pixel++) {
            while ((rawIndex < maxRawIndex) && (boundaries[rawIndex] <= pixel)) {
                rawIndex++;
            }
            this.rawIndexForPixel[pixel] = rawIndex;
        }
    }

    public int getPixelCount() {
        return rawIndexForPixel.length;
    }

    public int getRawIndex(final int pixel) {
        return rawIndexForPixel[pixel];
    }

    /**
     * @return pixel-step boundaries, one per raw step.
     */
    public long[] getBoundaries() {
        return boundaries.clone();
    }

    @Override
    public String toString() {
        return "PixelStepFunction{pixelCount=" + rawIndexForPixel.length +
               ", boundaries=" + Arrays.toString(boundaries) + '}';
    }
}
