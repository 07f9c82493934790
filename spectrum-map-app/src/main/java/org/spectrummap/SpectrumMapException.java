package org.spectrummap;

/**
 * Base class for failures that abort a map building run.
 * Subclasses identify which stage of the run rejected the data so that callers
 * can report them differently; none of them are retryable.
 */
public abstract class SpectrumMapException
        extends RuntimeException {

    protected SpectrumMapException(final String message) {
        super(message);
    }

    protected SpectrumMapException(final String message,
                                   final Throwable cause) {
        super(message, cause);
    }

}
