package org.spectrummap.client.parameter;

import com.beust.jcommander.Parameter;

import java.io.Serializable;

/**
 * Parameters for the files written for a map.
 */
public class MapOutputParameters
        implements Serializable {

    @Parameter(
            names = "--format",
            description = "Outputs to write: raw (raw map and axis handles), grid (formatted grid), " +
                          "bmp (bitmap) or all")
    public OutputFormat format = OutputFormat.ALL;

    @Parameter(
            names = "--title",
            description = "Output file name prefix, 'raw' or 'grid' is appended for text outputs",
            required = true)
    public String title;

    @Parameter(
            names = "--outputDirectory",
            description = "Directory for output files (created if missing)")
    public String outputDirectory = ".";

    @Parameter(
            names = "--normalize",
            description = "Divide the formatted grid by its maximum before building the bitmap",
            arity = 1)
    public boolean normalize = true;

    @Parameter(
            names = "--clampChannels",
            description = "Saturate bitmap color channels at 255 instead of keeping the low 8 bits")
    public boolean clampChannels = false;

    public MapOutputParameters() {
    }

    public MapOutputParameters(final OutputFormat format,
                               final String title,
                               final String outputDirectory) {
        this.format = format;
        this.title = title;
        this.outputDirectory = outputDirectory;
    }

    public void validate()
            throws IllegalArgumentException {

        if (format == null) {
            throw new IllegalArgumentException("output format must be specified");
        }

        if ((title == null) || title.trim().isEmpty()) {
            throw new IllegalArgumentException("output title must be specified");
        }

        if (title.contains("/") || title.contains("\\")) {
            throw new IllegalArgumentException("output title '" + title +
                                               "' must not contain path separators, use --outputDirectory instead");
        }
    }
}
