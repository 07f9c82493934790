package org.spectrummap.map;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import org.spectrummap.GridGeometryException;

/**
 * Immutable mapping of acquisition sites to the intensity extracted for each site.
 * Instances are created with a {@link Builder} which rejects a second intensity for the same site.
 */
public class IntensityMap {

    private final SortedMap<SiteCoordinate, Double> siteToIntensity;

    private IntensityMap(final SortedMap<SiteCoordinate, Double> siteToIntensity) {
        this.siteToIntensity = Collections.unmodifiableSortedMap(siteToIntensity);
    }

    public int size() {
        return siteToIntensity.size();
    }

    public boolean isEmpty() {
        return siteToIntensity.isEmpty();
    }

    public SortedSet<SiteCoordinate> getSites() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(siteToIntensity.keySet()));
    }

    public Map<SiteCoordinate, Double> asMap() {
        return siteToIntensity;
    }

    public Double getIntensity(final SiteCoordinate site) {
        return siteToIntensity.get(site);
    }

    @Override
    public String toString() {
        return "IntensityMap{numberOfSites=" + siteToIntensity.size() + '}';
    }

    public static class Builder {

        private final SortedMap<SiteCoordinate, Double> siteToIntensity;
        private final Map<SiteCoordinate, String> siteToSource;

        public Builder() {
            this.siteToIntensity = new TreeMap<>();
            this.siteToSource = new HashMap<>();
        }

        /**
         * @param  site       acquisition site.
         * @param  intensity  intensity extracted for the site.
         * @param  source     description of where the intensity came from (typically a file name).
         *
         * @return this builder.
         *
         * @throws GridGeometryException
         *   if an intensity has already been added for the site.
         */
        public Builder put(final SiteCoordinate site,
                           final double intensity,
                           final String source)
                throws GridGeometryException {

            final String existingSource = siteToSource.get(site);
            if (existingSource != null) {
                throw new GridGeometryException(
                        "two files found for the same position " + site + ": " + existingSource + " and " +
                        source + ", make sure the directory only has one file per position");
            }

            siteToIntensity.put(site, intensity);
            siteToSource.put(site, source);

            return this;
        }

        public int size() {
            return siteToIntensity.size();
        }

        public IntensityMap build() {
            return new IntensityMap(new TreeMap<>(siteToIntensity));
        }
    }

}
