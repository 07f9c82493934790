package org.spectrummap.client.parameter;

/**
 * How the intensity of each spectrum is extracted at the energy of interest.
 */
public enum IntensityMode {

    /** Linear interpolation between the two samples bracketing the energy. */
    INTERPOLATED,

    /** Sum over a window of channels around the energy. */
    INTEGRATED
}
