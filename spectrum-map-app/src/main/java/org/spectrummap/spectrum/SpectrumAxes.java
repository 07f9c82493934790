package org.spectrummap.spectrum;

import java.io.Serializable;

/**
 * Parallel energy and intensity axes read from one spectrum file.
 */
public class SpectrumAxes
        implements Serializable {

    private final double[] energy;
    private final double[] intensity;

    public SpectrumAxes(final double[] energy,
                        final double[] intensity)
            throws IllegalArgumentException {

        if (energy.length != intensity.length) {
            throw new IllegalArgumentException("energy axis has " + energy.length +
                                               " values but intensity axis has " + intensity.length);
        }
        if (energy.length == 0) {
            throw new IllegalArgumentException("spectrum axes must contain at least one value");
        }

        this.energy = energy.clone();
        this.intensity = intensity.clone();
    }

    public int size() {
        return energy.length;
    }

    public double getEnergy(final int index) {
        return energy[index];
    }

    public double getIntensity(final int index) {
        return intensity[index];
    }

    public double getMinEnergy() {
        return energy[0];
    }

    public double getMaxEnergy() {
        return energy[energy.length - 1];
    }

    public double[] getEnergyValues() {
        return energy.clone();
    }

    public double[] getIntensityValues() {
        return intensity.clone();
    }
}
