package org.spectrummap.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

import org.spectrummap.spectrum.IntensityExtractor;

/**
 * Parameters for extracting one intensity from each spectrum.
 */
public class IntensityParameters
        implements Serializable {

    @Parameter(
            names = "--mode",
            description = "Intensity mode: interpolated (intensity at the exact energy) or " +
                          "integrated (sum of intensities over a range of channels)",
            required = true)
    public IntensityMode mode;

    @Parameter(
            names = "--energy",
            description = "Energy of interest",
            required = true)
    public Double energy;

    @Parameter(
            names = "--channels",
            description = "Number of energy channels to add on each side of the energy of interest " +
                          "(required for integrated mode)")
    public Integer channels;

    public IntensityParameters() {
    }

    public IntensityParameters(final IntensityMode mode,
                               final Double energy,
                               final Integer channels) {
        this.mode = mode;
        this.energy = energy;
        this.channels = channels;
    }

    /**
     * @throws IllegalArgumentException
     *   if the parameters are missing or inconsistent.
     */
    public void validate()
            throws IllegalArgumentException {

        if (mode == null) {
            throw new IllegalArgumentException("intensity mode must be specified");
        }

        if ((energy == null) || (! Double.isFinite(energy))) {
            throw new IllegalArgumentException("energy must be a finite number but was " + energy);
        }

        if (mode == IntensityMode.INTEGRATED) {
            if (channels == null) {
                throw new IllegalArgumentException("--channels must be specified for integrated mode");
            } else if (channels < 0) {
                throw new IllegalArgumentException("--channels (" + channels + ") must not be negative");
            }
        }
    }

    public IntensityExtractor buildExtractor()
            throws IllegalArgumentException {

        validate();

        final IntensityExtractor extractor;
        if (mode == IntensityMode.INTEGRATED) {
            extractor = IntensityExtractor.integrated(energy, channels);
        } else {
            extractor = IntensityExtractor.interpolated(energy);
        }
        return extractor;
    }
}
