package org.spectrummap.map;

import java.util.Map;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.GridGeometryException;

/**
 * Reduces an irregular set of acquisition sites into a dense rectangular raw grid.
 *
 * The grid is built from the sorted distinct projections of the sites onto each axis rather than
 * from the order in which sites were supplied.  Every distinct x is assumed to pair with every
 * distinct y, so positions that were never acquired are filled with zero.
 */
public class GridAssembler {

    public RawMap assemble(final IntensityMap intensityMap)
            throws GridGeometryException {
        return assemble(intensityMap.getSites(), intensityMap.asMap());
    }

    /**
     * @param  sites              all acquisition sites for the run.
     * @param  siteToIntensity    intensity for each site.
     *
     * @return the assembled raw map.
     *
     * @throws GridGeometryException
     *   if either the site set or the intensity map is empty.
     */
    public RawMap assemble(final Set<SiteCoordinate> sites,
                           final Map<SiteCoordinate, Double> siteToIntensity)
            throws GridGeometryException {

        if ((sites == null) || sites.isEmpty()) {
            throw new GridGeometryException("no acquisition sites were found");
        }
        if ((siteToIntensity == null) || siteToIntensity.isEmpty()) {
            throw new GridGeometryException("no intensities were extracted for the acquisition sites");
        }

        final AxisSet axisSet = AxisSet.fromSites(sites);
        final StepSequence xSteps = axisSet.getXSteps();
        final StepSequence ySteps = axisSet.getYSteps();

        final int width = axisSet.getWidth();
        final int length = axisSet.getLength();
        if (((long) width * length) > MAX_CELLS) {
            throw new GridGeometryException("raw grid with " + width + " distinct x values and " + length +
                                            " distinct y values is too large");
        }

        final double[] values = new double[width * length];
        int missingCount = 0;
        int i = 0;
        for (int row = 0; row < length; row++) {
            for (int column = 0; column < width; column++) {
                final Double intensity =
                        siteToIntensity.get(new SiteCoordinate(axisSet.getX(column), axisSet.getY(row)));
                if (intensity == null) {
                    missingCount++;
                } else {
                    values[i] = intensity;
                }
                i++;
            }
        }

        if (missingCount > 0) {
            LOG.info("assemble: filled {} missing positions with zero", missingCount);
        }

        final RawMap rawMap = new RawMap(axisSet, xSteps, ySteps, IntensityGrid.wrap(width, length, values));

        LOG.debug("assemble: exit, returning {}", rawMap);

        return rawMap;
    }

    static final long MAX_CELLS = Integer.MAX_VALUE - 8;

    private static final Logger LOG = LoggerFactory.getLogger(GridAssembler.class);
}
