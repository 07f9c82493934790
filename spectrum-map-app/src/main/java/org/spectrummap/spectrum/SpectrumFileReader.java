package org.spectrummap.spectrum;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.InputFormatException;

/**
 * Reads a spectrum file with one "energy intensity" pair per line.
 *
 * Syntax is checked strictly: the two values must be separated by exactly one space and may only
 * contain digits, a single leading minus sign and at most one decimal point.  A trailing carriage
 * return is ignored.
 */
public class SpectrumFileReader {

    public SpectrumAxes read(final Path path)
            throws InputFormatException {

        final List<Double> energyList = new ArrayList<>();
        final List<Double> intensityList = new ArrayList<>();

        try (final BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                parseLine(path, lineNumber, stripCarriageReturn(line), energyList, intensityList);
            }
        } catch (final IOException e) {
            throw new InputFormatException("failed to read " + path, e);
        }

        if (energyList.isEmpty()) {
            throw new InputFormatException("error reading the file " + path + ": file may be empty");
        }

        LOG.debug("read: exit, read {} values from {}", energyList.size(), path);

        return new SpectrumAxes(toArray(energyList), toArray(intensityList));
    }

    static void parseLine(final Path path,
                          final int lineNumber,
                          final String line,
                          final List<Double> energyList,
                          final List<Double> intensityList)
            throws InputFormatException {

        int spaceCount = 0;
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == ' ') {
                spaceCount++;
            } else if (Character.isLetter(c)) {
                throw formatError(path, lineNumber, "eliminate alphabetic characters from the values");
            } else if (! (isDigit(c) || (c == '-') || (c == '.'))) {
                throw formatError(path, lineNumber,
                                  "only negation '-' at the beginning or a single point '.' for a float are allowed");
            }
        }

        if (spaceCount != 1) {
            throw formatError(path, lineNumber,
                              "each line should have exactly one pair of values separated by a single space");
        }

        final int separatorIndex = line.indexOf(' ');
        final String energy = line.substring(0, separatorIndex);
        final String intensity = line.substring(separatorIndex + 1);

        energyList.add(parseValue(path, lineNumber, "energy", energy));
        intensityList.add(parseValue(path, lineNumber, "intensity", intensity));
    }

    static double parseValue(final Path path,
                             final int lineNumber,
                             final String context,
                             final String token)
            throws InputFormatException {

        if (token.isEmpty()) {
            throw formatError(path, lineNumber, "missing " + context + " value");
        }

        if ((token.lastIndexOf('-') > 0) || (token.indexOf('.') != token.lastIndexOf('.'))) {
            throw formatError(path, lineNumber,
                              "only negation '-' at the beginning or a single point '.' for a float are allowed");
        }

        final double value;
        try {
            value = Double.parseDouble(token);
        } catch (final NumberFormatException e) {
            throw new InputFormatException(describeLine(path, lineNumber) + ": invalid " + context +
                                           " value '" + token + "'", e);
        }

        if (! Double.isFinite(value)) {
            throw formatError(path, lineNumber, context + " value '" + token + "' is not finite");
        }

        return value;
    }

    private static boolean isDigit(final char c) {
        return (c >= '0') && (c <= '9');
    }

    private static String stripCarriageReturn(final String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    private static InputFormatException formatError(final Path path,
                                                    final int lineNumber,
                                                    final String problem) {
        return new InputFormatException(describeLine(path, lineNumber) + ": " + problem);
    }

    private static String describeLine(final Path path,
                                       final int lineNumber) {
        return "error reading line " + lineNumber + " of file " + path;
    }

    private static double[] toArray(final List<Double> list) {
        final double[] array = new double[list.size()];
        for (int i = 0; i < array.length; i++) {
            array[i] = list.get(i);
        }
        return array;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumFileReader.class);
}
