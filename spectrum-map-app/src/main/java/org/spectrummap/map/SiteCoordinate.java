package org.spectrummap.map;

import java.io.Serializable;

/**
 * Position (x, y) of one acquisition site.
 * Coordinates are ordered lexicographically, x first.
 */
public class SiteCoordinate
        implements Comparable<SiteCoordinate>, Serializable {

    private final double x;
    private final double y;

    public SiteCoordinate(final double x,
                          final double y)
            throws IllegalArgumentException {

        if (! (Double.isFinite(x) && Double.isFinite(y))) {
            throw new IllegalArgumentException("site coordinates must be finite but were (" + x + ", " + y + ")");
        }

        // adding zero folds -0.0 into 0.0 so that equal positions compare equal
        this.x = x + 0.0;
        this.y = y + 0.0;
    }

    public double getX() {
        return x;
    }

    public double getY() {
        return y;
    }

    @Override
    public int compareTo(final SiteCoordinate that) {
        int result = Double.compare(this.x, that.x);
        if (result == 0) {
            result = Double.compare(this.y, that.y);
        }
        return result;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if ((o == null) || (getClass() != o.getClass())) {
            return false;
        }
        final SiteCoordinate that = (SiteCoordinate) o;
        return (Double.compare(x, that.x) == 0) && (Double.compare(y, that.y) == 0);
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(x) + Double.hashCode(y);
    }

    @Override
    public String toString() {
        return "(" + x + ", " + y + ")";
    }
}
