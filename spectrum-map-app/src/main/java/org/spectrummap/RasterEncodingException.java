package org.spectrummap;

/**
 * Thrown when a grid does not satisfy the preconditions for raster encoding.
 */
public class RasterEncodingException
        extends SpectrumMapException {

    public RasterEncodingException(final String message) {
        super(message);
    }

}
