package org.spectrummap.map;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Dense row-major matrix of intensities.
 * Used for both the raw grid (one cell per distinct x/y pair) and the formatted (resampled) grid.
 */
public class IntensityGrid
        implements Serializable {

    private final int width;
    private final int height;
    private final double[] values;

    public IntensityGrid(final int width,
                         final int height,
                         final double[] values)
            throws IllegalArgumentException {
        this(width, height, values, true);
    }

    private IntensityGrid(final int width,
                          final int height,
                          final double[] values,
                          final boolean copyValues)
            throws IllegalArgumentException {

        if ((width < 0) || (height < 0)) {
            throw new IllegalArgumentException("grid dimensions must not be negative but were " +
                                               width + "x" + height);
        }

        if (((long) width * height) != values.length) {
            throw new IllegalArgumentException("grid dimensions " + width + "x" + height +
                                               " do not match number of values (" + values.length + ")");
        }

        this.width = width;
        this.height = height;
        this.values = copyValues ? values.clone() : values;
    }

    /**
     * @return grid that takes ownership of the specified values without copying them.
     *         Callers must not modify the array afterwards.
     */
    static IntensityGrid wrap(final int width,
                              final int height,
                              final double[] values)
            throws IllegalArgumentException {
        return new IntensityGrid(width, height, values, false);
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public int size() {
        return values.length;
    }

    public double get(final int row,
                      final int column) {
        return values[(row * width) + column];
    }

    /**
     * @return copy of the row-major cell values.
     */
    public double[] getValues() {
        return values.clone();
    }

    public double getMaxValue() {
        double max = Double.NEGATIVE_INFINITY;
        for (final double value : values) {
            max = Math.max(max, value);
        }
        return max;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final IntensityGrid that = (IntensityGrid) o;
        return (width == that.width) && (height == that.height) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return (31 * ((31 * width) + height)) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "IntensityGrid{width=" + width + ", height=" + height + '}';
    }
}
