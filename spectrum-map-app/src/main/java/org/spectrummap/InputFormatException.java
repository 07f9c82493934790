package org.spectrummap;

/**
 * Thrown when a spectrum file or file name does not have the expected syntax.
 */
public class InputFormatException
        extends SpectrumMapException {

    public InputFormatException(final String message) {
        super(message);
    }

    public InputFormatException(final String message,
                                final Throwable cause) {
        super(message, cause);
    }

}
