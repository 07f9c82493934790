package org.spectrummap.raster;

import java.io.BufferedOutputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Files;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.RasterEncodingException;
import org.spectrummap.map.IntensityGrid;

/**
 * Encodes a grid of intensities in [0, 1] as a minimal uncompressed 24-bit bitmap
 * (14 byte file header, 40 byte info header, then one BGR triple per cell).
 *
 * Rows are written in grid order rather than in the bottom-up order bitmap viewers expect,
 * so viewers show the grid flipped vertically.  Rows are not padded; grid dimensions must
 * be multiples of four.
 */
public class RasterEncoder {

    public static final int FILE_HEADER_SIZE = 14;
    public static final int INFO_HEADER_SIZE = 40;
    public static final int PIXEL_DATA_OFFSET = FILE_HEADER_SIZE + INFO_HEADER_SIZE;
    public static final int BYTES_PER_PIXEL = 3;

    static final int BASE_RESOLUTION = 1000;

    private final ChannelOverflow channelOverflow;

    public RasterEncoder() {
        this(ChannelOverflow.WRAP);
    }

    public RasterEncoder(final ChannelOverflow channelOverflow) {
        this.channelOverflow = channelOverflow;
    }

    public ChannelOverflow getChannelOverflow() {
        return channelOverflow;
    }

    public void encode(final IntensityGrid grid,
                       final OutputStream outputStream)
            throws RasterEncodingException, IOException {
        validate(grid);
        writeValidated(grid, outputStream);
    }

    /**
     * @param  values        row-major intensities, each no greater than 1.
     * @param  width         number of pixels per row.
     * @param  height        number of rows.
     * @param  outputStream  stream to write the bitmap to (not closed by this method).
     *
     * @throws RasterEncodingException
     *   if the dimensions or values do not meet the bitmap preconditions.
     *
     * @throws IOException
     *   if the stream cannot be written.
     */
    public void encode(final double[] values,
                       final long width,
                       final long height,
                       final OutputStream outputStream)
            throws RasterEncodingException, IOException {

        validate(values, width, height);

        outputStream.write(buildHeaders((int) width, (int) height));

        final byte[] pixel = new byte[BYTES_PER_PIXEL];
        for (final double value : values) {
            writePixel(value, pixel, outputStream);
        }
    }

    public byte[] encodeToBytes(final IntensityGrid grid)
            throws RasterEncodingException {
        final ByteArrayOutputStream outputStream =
                new ByteArrayOutputStream(PIXEL_DATA_OFFSET + (BYTES_PER_PIXEL * grid.size()));
        try {
            encode(grid, outputStream);
        } catch (final IOException e) {
            throw new IllegalStateException("failed to write to in-memory stream", e);
        }
        return outputStream.toByteArray();
    }

    /**
     * Encodes the grid and writes it to the specified file.
     * The grid is validated before the file is created.
     */
    public void write(final IntensityGrid grid,
                      final Path toPath)
            throws RasterEncodingException, IOException {

        validate(grid);

        try (final OutputStream outputStream = new BufferedOutputStream(Files.newOutputStream(toPath))) {
            writeValidated(grid, outputStream);
        }

        LOG.info("write: exit, wrote {}x{} bitmap to {}", grid.getWidth(), grid.getHeight(), toPath);
    }

    static void validate(final IntensityGrid grid)
            throws RasterEncodingException {
        final int width = grid.getWidth();
        validateDimensions(width, grid.getHeight(), grid.size());
        for (int row = 0; row < grid.getHeight(); row++) {
            for (int column = 0; column < width; column++) {
                validateValue(grid.get(row, column), (row * width) + column);
            }
        }
    }

    static void validate(final double[] values,
                         final long width,
                         final long height)
            throws RasterEncodingException {
        validateDimensions(width, height, values.length);
        for (int i = 0; i < values.length; i++) {
            validateValue(values[i], i);
        }
    }

    private static void validateDimensions(final long width,
                                           final long height,
                                           final int numberOfValues)
            throws RasterEncodingException {

        if ((width < 0) || (height < 0)) {
            throw new RasterEncodingException("bitmap dimensions " + width + "x" + height +
                                              " must not be negative");
        }

        if ((width > Integer.MAX_VALUE) || (height > Integer.MAX_VALUE)) {
            throw new RasterEncodingException("bitmap dimensions " + width + "x" + height +
                                              " exceed the maximum of " + Integer.MAX_VALUE +
                                              ", export the formatted grid as text instead");
        }

        if (((width % 4) != 0) || ((height % 4) != 0)) {
            throw new RasterEncodingException("bitmap dimensions " + width + "x" + height +
                                              " must both be multiples of 4");
        }

        if ((width * height) != numberOfValues) {
            throw new RasterEncodingException("bitmap dimensions " + width + "x" + height +
                                              " do not match number of values (" + numberOfValues + ")");
        }
    }

    private static void validateValue(final double value,
                                      final int index)
            throws RasterEncodingException {
        if (value > 1) {
            throw new RasterEncodingException("intensity " + value + " at index " + index +
                                              " is greater than 1, normalize the map before building a bitmap");
        }
    }

    private void writeValidated(final IntensityGrid grid,
                                final OutputStream outputStream)
            throws IOException {

        outputStream.write(buildHeaders(grid.getWidth(), grid.getHeight()));

        final byte[] pixel = new byte[BYTES_PER_PIXEL];
        for (int row = 0; row < grid.getHeight(); row++) {
            for (int column = 0; column < grid.getWidth(); column++) {
                writePixel(grid.get(row, column), pixel, outputStream);
            }
        }
    }

    private void writePixel(final double value,
                            final byte[] pixel,
                            final OutputStream outputStream)
            throws IOException {
        pixel[0] = (byte) channelOverflow.toByte(75 * value / 0.8);
        pixel[1] = (byte) channelOverflow.toByte(145 * value / 0.3);
        pixel[2] = (byte) channelOverflow.toByte(250 * value / 0.2);
        outputStream.write(pixel);
    }

    static byte[] buildHeaders(final int width,
                               final int height) {

        final long fileSize = PIXEL_DATA_OFFSET + (4L * width * height);

        final int gcd = greatestCommonDivisor(width, height);
        int horizontalResolution = BASE_RESOLUTION;
        int verticalResolution = BASE_RESOLUTION;
        if (gcd != 0) {
            horizontalResolution = BASE_RESOLUTION * (width / gcd);
            verticalResolution = BASE_RESOLUTION * (height / gcd);
        }

        final ByteBuffer buffer = ByteBuffer.allocate(PIXEL_DATA_OFFSET).order(ByteOrder.LITTLE_ENDIAN);

        // file header
        buffer.put((byte) 'B').put((byte) 'M');
        buffer.putInt((int) fileSize);
        buffer.putInt(0);                        // reserved
        buffer.putInt(PIXEL_DATA_OFFSET);

        // info header
        buffer.putInt(INFO_HEADER_SIZE);
        buffer.putInt(width);
        buffer.putInt(height);
        buffer.putShort((short) 1);              // color planes
        buffer.putShort((short) 24);             // bits per pixel
        buffer.putInt(0);                        // no compression
        buffer.putInt(0);                        // raw bitmap data size
        buffer.putInt(horizontalResolution);
        buffer.putInt(verticalResolution);
        buffer.putInt(0);                        // color table entries
        buffer.putInt(0);                        // important colors

        return buffer.array();
    }

    static int greatestCommonDivisor(final int a,
                                     final int b) {
        int x = a;
        int y = b;
        while (y != 0) {
            final int r = x % y;
            x = y;
            y = r;
        }
        return x;
    }

    private static final Logger LOG = LoggerFactory.getLogger(RasterEncoder.class);
}
