package org.spectrummap.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.SpectrumMapException;
import org.spectrummap.util.ProcessTimer;

/**
 * Command line client wrapper that logs failures and overall process completion,
 * then exits with status 0 on success or 1 on failure.
 *
 * Failures raised by the map building stages are logged with their message only since
 * they describe problems with the input data rather than with the program.
 */
public abstract class ClientRunner {

    private final String[] args;

    /**
     * @param  args  command line arguments for client.
     */
    public ClientRunner(final String[] args) {
        this.args = args;
    }

    /**
     * Wraps a run with consistent log statements.
     * Absence of the standard exit log message indicates that the client was terminated abnormally.
     */
    public void run() {
        System.exit(runAndGetExitStatus());
    }

    /**
     * @return exit status for the run (0 for success, 1 for failure).
     */
    public int runAndGetExitStatus() {

        LOG.info("run: entry");

        final ProcessTimer processTimer = new ProcessTimer();

        int exitStatus = 1;
        try {
            runClient(args);
            LOG.info("run: exit, processing completed in {}", processTimer);
            exitStatus = 0;
        } catch (final SpectrumMapException e) {
            LOG.error("run: {} - {}", e.getClass().getSimpleName(), e.getMessage());
            LOG.info("run: exit, processing failed after {}", processTimer);
        } catch (final Throwable t) {
            LOG.error("run: caught exception", t);
            LOG.info("run: exit, processing failed after {}", processTimer);
        }

        return exitStatus;
    }

    /**
     * This method should contain the specific client implementation to be wrapped.
     *
     * @param  args  command line arguments for client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
