package org.spectrummap.export;

import java.io.BufferedWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.map.AxisSet;
import org.spectrummap.map.IntensityGrid;

/**
 * Writes grids and axis values as whitespace delimited text so that maps can be plotted with other tools.
 *
 * Values are written with six significant digits, switching to exponent notation for very large
 * or very small magnitudes, without trailing zeros.  Matrix values are right aligned in ten
 * character columns and each one is followed by a space.
 */
public class TextExporter {

    public static final String MATRIX_SUFFIX = ".txt";
    public static final String X_AXIS_SUFFIX = "-x-axis-handles.txt";
    public static final String Y_AXIS_SUFFIX = "-y-axis-handles.txt";

    /**
     * Writes {@code [directory]/[title].txt} with one line per grid row.
     *
     * @return path of the written file.
     */
    public Path writeMatrix(final IntensityGrid grid,
                            final Path directory,
                            final String title)
            throws IOException {

        final Path toPath = directory.resolve(title + MATRIX_SUFFIX);

        try (final BufferedWriter writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            for (int row = 0; row < grid.getHeight(); row++) {
                for (int column = 0; column < grid.getWidth(); column++) {
                    writer.write(String.format("%10s ", formatValue(grid.get(row, column))));
                }
                writer.write('\n');
            }
        }

        LOG.info("writeMatrix: wrote {}x{} matrix to {}", grid.getWidth(), grid.getHeight(), toPath);

        return toPath;
    }

    /**
     * Writes {@code [directory]/[title]-x-axis-handles.txt} and {@code [directory]/[title]-y-axis-handles.txt}
     * with one axis value per line.
     *
     * @return paths of the written x and y files.
     */
    public Path[] writeAxes(final AxisSet axisSet,
                            final Path directory,
                            final String title)
            throws IOException {

        final Path xPath = directory.resolve(title + X_AXIS_SUFFIX);
        final Path yPath = directory.resolve(title + Y_AXIS_SUFFIX);

        writeColumn(axisSet.getXValues(), xPath);
        writeColumn(axisSet.getYValues(), yPath);

        LOG.info("writeAxes: wrote {} x values to {} and {} y values to {}",
                 axisSet.getWidth(), xPath, axisSet.getLength(), yPath);

        return new Path[] { xPath, yPath };
    }

    /**
     * @return the value with six significant digits in the shorter of plain or exponent notation,
     *         like C's {@code %g} without trailing zeros.  Exact ties round to even like {@code %g} does.
     */
    public static String formatValue(final double value) {

        if (Double.isNaN(value)) {
            return "nan";
        } else if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        } else if (value == 0) {
            return (1 / value) < 0 ? "-0" : "0";
        }

        final BigDecimal rounded = new BigDecimal(value).round(SIGNIFICANT_DIGITS);
        final int exponent = rounded.precision() - rounded.scale() - 1;

        final String formatted;
        if ((exponent < -4) || (exponent >= SIGNIFICANT_DIGITS.getPrecision())) {
            final String mantissa = rounded.movePointLeft(exponent).stripTrailingZeros().toPlainString();
            formatted = mantissa + (exponent < 0 ? "e-" : "e+") + String.format("%02d", Math.abs(exponent));
        } else {
            formatted = rounded.stripTrailingZeros().toPlainString();
        }

        return formatted;
    }

    private static void writeColumn(final double[] values,
                                    final Path toPath)
            throws IOException {
        try (final BufferedWriter writer = Files.newBufferedWriter(toPath, StandardCharsets.UTF_8)) {
            for (final double value : values) {
                writer.write(formatValue(value));
                writer.write('\n');
            }
        }
    }

    private static final MathContext SIGNIFICANT_DIGITS = new MathContext(6, RoundingMode.HALF_EVEN);

    private static final Logger LOG = LoggerFactory.getLogger(TextExporter.class);
}
