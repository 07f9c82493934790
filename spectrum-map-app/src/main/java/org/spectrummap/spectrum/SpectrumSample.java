package org.spectrummap.spectrum;

import java.nio.file.Path;

import org.spectrummap.EnergyRangeException;
import org.spectrummap.InputFormatException;
import org.spectrummap.map.SiteCoordinate;

/**
 * One spectrum measured at one acquisition site.
 * The energy axis is expected to be in ascending order.
 */
public class SpectrumSample {

    private final SpectrumAxes axes;
    private final SiteCoordinate site;

    public SpectrumSample(final SpectrumAxes axes,
                          final SiteCoordinate site) {
        this.axes = axes;
        this.site = site;
    }

    /**
     * @return sample with axes read from the file's content and site derived from the file's name.
     *
     * @throws InputFormatException
     *   if the file content or name is malformed.
     */
    public static SpectrumSample fromFile(final Path path)
            throws InputFormatException {
        final SiteCoordinate site = new SiteCoordinateParser().parse(path);
        final SpectrumAxes axes = new SpectrumFileReader().read(path);
        return new SpectrumSample(axes, site);
    }

    public SpectrumAxes getAxes() {
        return axes;
    }

    public SiteCoordinate getSite() {
        return site;
    }

    /**
     * Sums intensities over a window of channels on each side of the first energy value
     * that is greater than or equal to the specified energy.
     * The window is clipped at both ends of the axis.
     *
     * @param  energy    energy of interest.
     * @param  channels  number of channels to include on each side.
     *
     * @return summed intensity.
     *
     * @throws EnergyRangeException
     *   if the energy is outside of this spectrum's energy axis.
     */
    public double integratedIntensity(final double energy,
                                      final int channels)
            throws EnergyRangeException, IllegalArgumentException {

        if (channels < 0) {
            throw new IllegalArgumentException("number of channels (" + channels + ") must not be negative");
        }

        validateEnergy(energy);

        final int lastIndex = axes.size() - 1;
        int position = lastIndex;
        for (int i = 0; i < axes.size(); i++) {
            if (axes.getEnergy(i) >= energy) {
                position = i;
                break;
            }
        }

        final int lowerLimit = Math.max(0, position - channels);
        final int upperLimit = (int) Math.min(lastIndex, (long) position + channels);

        double sum = 0;
        for (int i = lowerLimit; i <= upperLimit; i++) {
            sum += axes.getIntensity(i);
        }
        return sum;
    }

    /**
     * Linearly interpolates the intensity at the specified energy from the two bracketing samples.
     *
     * @throws EnergyRangeException
     *   if the energy is outside of this spectrum's energy axis.
     */
    public double interpolatedIntensity(final double energy)
            throws EnergyRangeException {

        validateEnergy(energy);

        final int lastIndex = axes.size() - 1;
        for (int i = 0; i < lastIndex; i++) {
            final double lowerEnergy = axes.getEnergy(i);
            final double upperEnergy = axes.getEnergy(i + 1);
            if (energy == lowerEnergy) {
                return axes.getIntensity(i);
            } else if ((energy > lowerEnergy) && (energy < upperEnergy)) {
                final double lowerIntensity = axes.getIntensity(i);
                final double upperIntensity = axes.getIntensity(i + 1);
                return lowerIntensity +
                       ((energy - lowerEnergy) * (upperIntensity - lowerIntensity) / (upperEnergy - lowerEnergy));
            }
        }

        // only the last sample remains
        return axes.getIntensity(lastIndex);
    }

    private void validateEnergy(final double energy)
            throws EnergyRangeException {
        if (! ((energy >= axes.getMinEnergy()) && (energy <= axes.getMaxEnergy()))) {
            throw new EnergyRangeException(energy, axes.getMinEnergy(), axes.getMaxEnergy());
        }
    }

    @Override
    public String toString() {
        return "SpectrumSample{site=" + site + ", numberOfValues=" + axes.size() + '}';
    }
}
