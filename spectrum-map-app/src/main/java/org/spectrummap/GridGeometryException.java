package org.spectrummap;

/**
 * Thrown when the acquisition sites of a run cannot be assembled into a grid
 * (no sites, two spectra for the same site, or a degenerate step sequence).
 */
public class GridGeometryException
        extends SpectrumMapException {

    public GridGeometryException(final String message) {
        super(message);
    }

}
