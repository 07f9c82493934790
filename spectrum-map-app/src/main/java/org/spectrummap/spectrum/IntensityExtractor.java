package org.spectrummap.spectrum;

import org.spectrummap.EnergyRangeException;

/**
 * Extracts one scalar intensity from each spectrum of a run.
 * The same extractor is applied to every sample so that all sites are comparable.
 */
public abstract class IntensityExtractor {

    private final double energy;

    protected IntensityExtractor(final double energy) {
        this.energy = energy;
    }

    public double getEnergy() {
        return energy;
    }

    /**
     * @throws EnergyRangeException
     *   if the extractor's energy is outside of the sample's energy axis.
     */
    public abstract double extract(final SpectrumSample sample)
            throws EnergyRangeException;

    /**
     * @return short label identifying the mode and its settings.
     */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }

    public static IntensityExtractor interpolated(final double energy) {
        return new IntensityExtractor(energy) {
            @Override
            public double extract(final SpectrumSample sample) {
                return sample.interpolatedIntensity(getEnergy());
            }

            @Override
            public String describe() {
                return "interpolated at " + getEnergy();
            }
        };
    }

    public static IntensityExtractor integrated(final double energy,
                                                final int channels)
            throws IllegalArgumentException {

        if (channels < 0) {
            throw new IllegalArgumentException("number of channels (" + channels + ") must not be negative");
        }

        return new IntensityExtractor(energy) {
            @Override
            public double extract(final SpectrumSample sample) {
                return sample.integratedIntensity(getEnergy(), channels);
            }

            @Override
            public String describe() {
                return "integrated at " + getEnergy() + " over " + channels + " channels per side";
            }
        };
    }

}
