package org.spectrummap.spectrum;

import java.nio.file.Path;

import org.spectrummap.InputFormatException;
import org.spectrummap.map.SiteCoordinate;

/**
 * Derives the acquisition site of a spectrum from its file name.
 *
 * File names look like {@code [id]-[x]-[y].[extension]}.  Within the coordinate segments a
 * literal {@code p} stands for the decimal point and any other letter is ignored,
 * so {@code sample-2p5-10um.txt} is acquired at (2.5, 10).
 */
public class SiteCoordinateParser {

    public SiteCoordinate parse(final Path path)
            throws InputFormatException {

        final Path fileNamePath = path.getFileName();
        if (fileNamePath == null) {
            throw new InputFormatException("no file name in path " + path);
        }

        final String stem = getStem(fileNamePath.toString());

        final int ySeparator = stem.lastIndexOf('-');
        if (ySeparator < 0) {
            throw new InputFormatException("file name " + path + " does not follow the pattern " +
                                           "'[id]-[x]-[y].[extension]'");
        }

        final String ySegment = stem.substring(ySeparator + 1);
        final String beforeY = stem.substring(0, ySeparator);
        final String xSegment = beforeY.substring(beforeY.lastIndexOf('-') + 1);

        return new SiteCoordinate(parseSegment(path, "x", xSegment),
                                  parseSegment(path, "y", ySegment));
    }

    static String getStem(final String fileName) {
        final int extensionIndex = fileName.lastIndexOf('.');
        return extensionIndex > 0 ? fileName.substring(0, extensionIndex) : fileName;
    }

    static double parseSegment(final Path path,
                               final String axisName,
                               final String segment)
            throws InputFormatException {

        final StringBuilder normalized = new StringBuilder(segment.length());
        for (int i = 0; i < segment.length(); i++) {
            final char c = segment.charAt(i);
            if (c == 'p') {
                normalized.append('.');
            } else if ((c >= '0') && (c <= '9')) {
                normalized.append(c);
            } else if (! Character.isLetter(c)) {
                throw new InputFormatException("unrecognized character '" + c + "' for " + axisName +
                                               " position in file " + path);
            }
        }

        if (normalized.length() == 0) {
            throw new InputFormatException("no value specified for position " + axisName + " in file " + path);
        }

        try {
            return Double.parseDouble(normalized.toString());
        } catch (final NumberFormatException e) {
            throw new InputFormatException("invalid " + axisName + " position '" + segment + "' in file " + path, e);
        }
    }

}
