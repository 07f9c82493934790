package org.spectrummap.map;

import java.io.Serializable;

/**
 * Result of assembling a set of acquisition sites: distinct axis values, the steps between them
 * and the raw grid with one cell per (x, y) pair.
 */
public class RawMap
        implements Serializable {

    private final AxisSet axisSet;
    private final StepSequence xSteps;
    private final StepSequence ySteps;
    private final IntensityGrid grid;

    public RawMap(final AxisSet axisSet,
                  final StepSequence xSteps,
                  final StepSequence ySteps,
                  final IntensityGrid grid) {
        this.axisSet = axisSet;
        this.xSteps = xSteps;
        this.ySteps = ySteps;
        this.grid = grid;
    }

    public AxisSet getAxisSet() {
        return axisSet;
    }

    public StepSequence getXSteps() {
        return xSteps;
    }

    public StepSequence getYSteps() {
        return ySteps;
    }

    public IntensityGrid getGrid() {
        return grid;
    }

    /**
     * @return number of distinct x values.
     */
    public int getTrueWidth() {
        return axisSet.getWidth();
    }

    /**
     * @return number of distinct y values.
     */
    public int getTrueLength() {
        return axisSet.getLength();
    }

    @Override
    public String toString() {
        return "RawMap{trueWidth=" + getTrueWidth() +
               ", trueLength=" + getTrueLength() +
               ", xSteps=" + xSteps +
               ", ySteps=" + ySteps +
               '}';
    }
}
