package org.spectrummap.spectrum;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;
import org.spectrummap.EnergyRangeException;
import org.spectrummap.map.SiteCoordinate;

/**
 * Tests the {@link SpectrumSample} class.
 */
public class SpectrumSampleTest {

    private SpectrumSample sample;

    @Before
    public void setup() {
        sample = new SpectrumSample(new SpectrumAxes(new double[] {  0,  1,  2,  3 },
                                                     new double[] { 10, 20, 30, 40 }),
                                    new SiteCoordinate(0, 0));
    }

    @Test
    public void testInterpolatedIntensity() {
        Assert.assertEquals("invalid midpoint intensity", 25.0, sample.interpolatedIntensity(1.5), 0.0);
        Assert.assertEquals("invalid quarter intensity", 32.5, sample.interpolatedIntensity(2.25), 0.0);
        Assert.assertEquals("invalid exact hit intensity", 20.0, sample.interpolatedIntensity(1.0), 0.0);
        Assert.assertEquals("invalid first intensity", 10.0, sample.interpolatedIntensity(0.0), 0.0);
        Assert.assertEquals("invalid last intensity", 40.0, sample.interpolatedIntensity(3.0), 0.0);
    }

    @Test
    public void testIntegratedIntensity() {
        Assert.assertEquals("invalid sum for one channel", 60.0, sample.integratedIntensity(1.0, 1), 0.0);
        Assert.assertEquals("invalid sum for zero channels", 20.0, sample.integratedIntensity(1.0, 0), 0.0);

        // first energy >= 1.5 is at index 2
        Assert.assertEquals("invalid sum between samples", 90.0, sample.integratedIntensity(1.5, 1), 0.0);
    }

    @Test
    public void testIntegratedWindowIsClipped() {
        Assert.assertEquals("invalid sum clipped at start", 30.0, sample.integratedIntensity(0.0, 1), 0.0);
        Assert.assertEquals("invalid sum clipped at end", 70.0, sample.integratedIntensity(3.0, 1), 0.0);
        Assert.assertEquals("invalid sum clipped at both ends", 100.0, sample.integratedIntensity(1.0, 10), 0.0);
        Assert.assertEquals("invalid sum for huge window", 100.0,
                            sample.integratedIntensity(2.0, Integer.MAX_VALUE), 0.0);
    }

    @Test
    public void testSingleSampleSpectrum() {
        final SpectrumSample single = new SpectrumSample(new SpectrumAxes(new double[] { 5 }, new double[] { 7 }),
                                                         new SiteCoordinate(1, 1));
        Assert.assertEquals("invalid interpolated intensity", 7.0, single.interpolatedIntensity(5), 0.0);
        Assert.assertEquals("invalid integrated intensity", 7.0, single.integratedIntensity(5, 3), 0.0);
    }

    @Test
    public void testEnergyBelowRange() {
        try {
            sample.interpolatedIntensity(-0.5);
            Assert.fail("energy below range should cause exception");
        } catch (final EnergyRangeException e) {
            Assert.assertEquals("invalid energy in exception", -0.5, e.getEnergy(), 0.0);
            Assert.assertEquals("invalid minimum in exception", 0.0, e.getMinEnergy(), 0.0);
            Assert.assertEquals("invalid maximum in exception", 3.0, e.getMaxEnergy(), 0.0);
        }
    }

    @Test(expected = EnergyRangeException.class)
    public void testEnergyAboveRange() {
        sample.integratedIntensity(3.5, 1);
    }

    @Test(expected = EnergyRangeException.class)
    public void testNaNEnergy() {
        sample.interpolatedIntensity(Double.NaN);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testNegativeChannels() {
        sample.integratedIntensity(1.0, -1);
    }

    @Test
    public void testExtractors() {
        Assert.assertEquals("invalid interpolated extraction",
                            25.0, IntensityExtractor.interpolated(1.5).extract(sample), 0.0);
        Assert.assertEquals("invalid integrated extraction",
                            60.0, IntensityExtractor.integrated(1.0, 1).extract(sample), 0.0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testIntegratedExtractorWithNegativeChannels() {
        IntensityExtractor.integrated(1.0, -2);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMismatchedAxes() {
        new SpectrumAxes(new double[] { 1, 2 }, new double[] { 1 });
    }

}
