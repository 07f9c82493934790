package org.spectrummap.client.parameter;

/**
 * Which map outputs are written.
 */
public enum OutputFormat {

    RAW(true, false, false),
    GRID(false, true, false),
    BMP(false, false, true),
    ALL(true, true, true);

    private final boolean rawText;
    private final boolean gridText;
    private final boolean bitmap;

    OutputFormat(final boolean rawText,
                 final boolean gridText,
                 final boolean bitmap) {
        this.rawText = rawText;
        this.gridText = gridText;
        this.bitmap = bitmap;
    }

    /**
     * @return true if the raw matrix and its axis handle files are written.
     */
    public boolean includesRawText() {
        return rawText;
    }

    /**
     * @return true if the formatted grid matrix is written.
     */
    public boolean includesGridText() {
        return gridText;
    }

    public boolean includesBitmap() {
        return bitmap;
    }

    public boolean needsFormattedGrid() {
        return gridText || bitmap;
    }
}
