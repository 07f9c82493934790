package org.spectrummap.map;

import java.io.Serializable;
import java.util.Arrays;
import java.util.Collection;

/**
 * Sorted distinct x and y values observed across all acquisition sites of a map.
 */
public class AxisSet
        implements Serializable {

    private final double[] xValues;
    private final double[] yValues;

    public AxisSet(final double[] xValues,
                   final double[] yValues) {
        this.xValues = xValues.clone();
        this.yValues = yValues.clone();
    }

    /**
     * Projects the sites onto each axis, sorts each projection and then drops adjacent duplicates.
     * Sorting has to happen first so that equal values anywhere in the input collapse together.
     */
    public static AxisSet fromSites(final Collection<SiteCoordinate> sites) {
        final double[] x = new double[sites.size()];
        final double[] y = new double[sites.size()];
        int i = 0;
        for (final SiteCoordinate site : sites) {
            x[i] = site.getX();
            y[i] = site.getY();
            i++;
        }
        return new AxisSet(sortedUnique(x), sortedUnique(y));
    }

    /**
     * @return number of distinct x values (the raw grid width).
     */
    public int getWidth() {
        return xValues.length;
    }

    /**
     * @return number of distinct y values (the raw grid length).
     */
    public int getLength() {
        return yValues.length;
    }

    public double getX(final int index) {
        return xValues[index];
    }

    public double getY(final int index) {
        return yValues[index];
    }

    public double getMinX() {
        return xValues[0];
    }

    public double getMaxX() {
        return xValues[xValues.length - 1];
    }

    public double getMinY() {
        return yValues[0];
    }

    public double getMaxY() {
        return yValues[yValues.length - 1];
    }

    public double[] getXValues() {
        return xValues.clone();
    }

    public double[] getYValues() {
        return yValues.clone();
    }

    public StepSequence getXSteps() {
        return StepSequence.fromAxis(xValues);
    }

    public StepSequence getYSteps() {
        return StepSequence.fromAxis(yValues);
    }

    @Override
    public String toString() {
        return "AxisSet{x=" + Arrays.toString(xValues) + ", y=" + Arrays.toString(yValues) + '}';
    }

    static double[] sortedUnique(final double[] values) {
        final double[] sorted = values.clone();
        Arrays.sort(sorted);
        int count = 0;
        for (int i = 0; i < sorted.length; i++) {
            if ((i == 0) || (Double.compare(sorted[i], sorted[count - 1]) != 0)) {
                sorted[count] = sorted[i];
                count++;
            }
        }
        return Arrays.copyOf(sorted, count);
    }
}
