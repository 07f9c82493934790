package org.spectrummap.map;

import java.util.ArrayList;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.spectrummap.GridGeometryException;

/**
 * Tests the {@link IntensityMap} and {@link SiteCoordinate} classes.
 */
public class IntensityMapTest {

    @Test
    public void testDuplicateSiteIsRejected() {

        final IntensityMap.Builder builder = new IntensityMap.Builder();
        builder.put(new SiteCoordinate(2.5, 10), 1.0, "a-2p5-10.txt");

        try {
            builder.put(new SiteCoordinate(2.5, 10.0), 2.0, "b-2p5-10.txt");
            Assert.fail("duplicate site should have caused exception");
        } catch (final GridGeometryException e) {
            Assert.assertTrue("message should name first file", e.getMessage().contains("a-2p5-10.txt"));
            Assert.assertTrue("message should name second file", e.getMessage().contains("b-2p5-10.txt"));
        }
    }

    @Test
    public void testSitesAreSorted() {

        final IntensityMap intensityMap = new IntensityMap.Builder()
                .put(new SiteCoordinate(1, 0), 1.0, "a")
                .put(new SiteCoordinate(0, 5), 2.0, "b")
                .put(new SiteCoordinate(0, 1), 3.0, "c")
                .build();

        final List<SiteCoordinate> sites = new ArrayList<>(intensityMap.getSites());

        Assert.assertEquals("invalid number of sites", 3, sites.size());
        Assert.assertEquals("invalid first site", new SiteCoordinate(0, 1), sites.get(0));
        Assert.assertEquals("invalid second site", new SiteCoordinate(0, 5), sites.get(1));
        Assert.assertEquals("invalid third site", new SiteCoordinate(1, 0), sites.get(2));
        Assert.assertEquals("invalid intensity", 2.0, intensityMap.getIntensity(new SiteCoordinate(0, 5)), 0);
    }

    @Test(expected = UnsupportedOperationException.class)
    public void testMapIsImmutable() {
        final IntensityMap intensityMap = new IntensityMap.Builder()
                .put(new SiteCoordinate(0, 0), 1.0, "a")
                .build();
        intensityMap.asMap().put(new SiteCoordinate(1, 1), 2.0);
    }

    @Test
    public void testNegativeZeroEqualsZero() {
        Assert.assertEquals("-0.0 and 0.0 should be the same site",
                            new SiteCoordinate(0.0, 0.0), new SiteCoordinate(-0.0, 0.0));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNonFiniteCoordinate() {
        new SiteCoordinate(Double.NaN, 0);
    }
}
