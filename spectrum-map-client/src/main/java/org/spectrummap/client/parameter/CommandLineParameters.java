package org.spectrummap.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.fasterxml.jackson.core.JsonProcessingException;

import java.io.Serializable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.json.JsonUtils;

/**
 * Base parameters for the spectrum map command line tools.
 *
 * Parsing happens in two stages: JCommander checks syntax and required options,
 * then {@link #validate()} checks combinations of options that JCommander cannot express
 * (e.g. {@code --channels} being required only for integrated mode).
 * A failure in either stage prints usage.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public void parse(final String[] args) throws IllegalArgumentException {
        parse(args, this.getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                 arguments to parse.
     * @param  programClass         class with the main method (named in usage text).
     * @param  exitOnHelpOrFailure  if true, exit after printing usage for --help or a failure;
     *                              otherwise throw an {@link IllegalArgumentException} for failures.
     *
     * @throws IllegalArgumentException
     *   if the arguments are invalid and exitOnHelpOrFailure is false.
     */
    public void parse(final String[] args,
                      final Class<?> programClass,
                      final boolean exitOnHelpOrFailure) throws IllegalArgumentException {

        final JCommander jCommander = new JCommander(this);
        jCommander.setProgramName("java -cp spectrum-map-client.jar " +
                                  (programClass == null ? "<client class>" : programClass.getName()));

        final String failureMessage = parseAndValidate(jCommander, args);

        if (help || (failureMessage != null)) {
            jCommander.getConsole().println("");
            jCommander.usage();
            if (exitOnHelpOrFailure) {
                System.exit(1);
            } else if (failureMessage != null) {
                throw new IllegalArgumentException(failureMessage);
            }
        }
    }

    /**
     * Checks option combinations after a successful parse.
     * Subclasses with dependent options should override this and validate their delegates.
     *
     * @throws IllegalArgumentException
     *   if the options are inconsistent.
     */
    public void validate() throws IllegalArgumentException {
    }

    /**
     * @return string representation of these parameters.
     */
    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final JsonProcessingException e) {
            throw new IllegalArgumentException(e);
        }
    }

    /**
     * Helper (no pun intended) for testing parameter parsing.
     *
     * @param  parameters  parameters instance to test.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

    /**
     * @return description of the failure, or null if the arguments are valid (or only help was requested).
     */
    private String parseAndValidate(final JCommander jCommander,
                                    final String[] args) {

        String failureMessage = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException pe) {
            failureMessage = "failed to parse command line arguments: " + pe.getMessage();
        } catch (final IllegalArgumentException iae) {
            failureMessage = "invalid command line arguments: " + iae.getMessage();
        }

        if (failureMessage != null) {
            LOG.error("parse: {}", failureMessage);
        }

        return failureMessage;
    }

    private static final Logger LOG = LoggerFactory.getLogger(CommandLineParameters.class);

}
