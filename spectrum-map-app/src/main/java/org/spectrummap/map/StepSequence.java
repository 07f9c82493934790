package org.spectrummap.map;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Rounded gaps between consecutive values of a sorted unique axis.
 * A sequence for an axis with n values has n - 1 steps.
 */
public class StepSequence
        implements Serializable {

    private final long[] steps;

    public StepSequence(final long[] steps) {
        this.steps = steps.clone();
    }

    /**
     * Gaps are rounded half away from zero.
     * Since the axis is sorted every gap is non-negative, so {@link Math#round(double)} does exactly that.
     *
     * @param  sortedUniqueValues  ascending axis values without duplicates.
     *
     * @return steps between the specified values.
     */
    public static StepSequence fromAxis(final double[] sortedUniqueValues) {
        final int numberOfSteps = Math.max(0, sortedUniqueValues.length - 1);
        final long[] steps = new long[numberOfSteps];
        for (int i = 1; i < sortedUniqueValues.length; i++) {
            steps[i - 1] = Math.round(sortedUniqueValues[i] - sortedUniqueValues[i - 1]);
        }
        return new StepSequence(steps);
    }

    public int size() {
        return steps.length;
    }

    public boolean isEmpty() {
        return steps.length == 0;
    }

    public long get(final int index) {
        return steps[index];
    }

    /**
     * @return smallest step, or 1 for an empty sequence (single sample axis).
     */
    public long getMinimum() {
        long min = 1;
        if (steps.length > 0) {
            min = steps[0];
            for (final long step : steps) {
                min = Math.min(min, step);
            }
        }
        return min;
    }

    public boolean isUniform() {
        for (final long step : steps) {
            if (step != steps[0]) {
                return false;
            }
        }
        return true;
    }

    public long[] toArray() {
        return steps.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        return Arrays.equals(steps, ((StepSequence) o).steps);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(steps);
    }

    @Override
    public String toString() {
        return Arrays.toString(steps);
    }
}
