package org.spectrummap;

/**
 * Thrown when a requested energy lies outside the energy axis of a spectrum.
 */
public class EnergyRangeException
        extends SpectrumMapException {

    private final double energy;
    private final double minEnergy;
    private final double maxEnergy;

    public EnergyRangeException(final double energy,
                                final double minEnergy,
                                final double maxEnergy) {
        super("requested energy " + energy + " is outside of the spectrum energy range [" +
              minEnergy + ", " + maxEnergy + "]");
        this.energy = energy;
        this.minEnergy = minEnergy;
        this.maxEnergy = maxEnergy;
    }

    public double getEnergy() {
        return energy;
    }

    public double getMinEnergy() {
        return minEnergy;
    }

    public double getMaxEnergy() {
        return maxEnergy;
    }
}
