package org.spectrummap.client;

import org.junit.Assert;
import org.junit.Test;
import org.spectrummap.client.parameter.CommandLineParameters;
import org.spectrummap.client.parameter.IntensityMode;
import org.spectrummap.client.parameter.OutputFormat;

/**
 * Tests the {@link SpectrumMapClient} class.
 */
public class SpectrumMapClientTest {

    @Test
    public void testParameterParsing() throws Exception {
        CommandLineParameters.parseHelp(new SpectrumMapClient.Parameters());
    }

    @Test
    public void testParseArguments() {

        final SpectrumMapClient.Parameters parameters = new SpectrumMapClient.Parameters();
        parameters.parse(new String[] {
                "--inputDirectory", "/data/EELS",
                "--format", "grid",
                "--mode", "integrated",
                "--channels", "2",
                "--energy", "0.035",
                "--title", "EELS_Spectrum_map",
                "--normalize", "false",
                "--clampChannels"
        }, SpectrumMapClient.class, false);

        Assert.assertEquals("invalid input directory", "/data/EELS", parameters.inputDirectory);
        Assert.assertEquals("invalid mode", IntensityMode.INTEGRATED, parameters.intensity.mode);
        Assert.assertEquals("invalid energy", 0.035, parameters.intensity.energy, 0.0);
        Assert.assertEquals("invalid channels", Integer.valueOf(2), parameters.intensity.channels);
        Assert.assertEquals("invalid format", OutputFormat.GRID, parameters.output.format);
        Assert.assertEquals("invalid title", "EELS_Spectrum_map", parameters.output.title);
        Assert.assertEquals("invalid output directory", ".", parameters.output.outputDirectory);
        Assert.assertFalse("normalize should be disabled", parameters.output.normalize);
        Assert.assertTrue("clampChannels should be enabled", parameters.output.clampChannels);

        Assert.assertTrue("parameters should be rendered as json but were: " + parameters,
                          parameters.toString().contains("\"title\" : \"EELS_Spectrum_map\""));
    }

    @Test
    public void testDefaults() {

        final SpectrumMapClient.Parameters parameters = new SpectrumMapClient.Parameters();
        parameters.parse(new String[] {
                "--inputDirectory", "in",
                "--mode", "interpolated",
                "--energy", "12.5",
                "--title", "map"
        }, SpectrumMapClient.class, false);

        Assert.assertEquals("invalid default format", OutputFormat.ALL, parameters.output.format);
        Assert.assertTrue("normalize should be enabled by default", parameters.output.normalize);
        Assert.assertFalse("clampChannels should be disabled by default", parameters.output.clampChannels);
        Assert.assertNull("channels should not be set", parameters.intensity.channels);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testMissingRequiredArgument() {
        new SpectrumMapClient.Parameters().parse(new String[] {
                "--inputDirectory", "in",
                "--mode", "interpolated",
                "--energy", "12.5"
        }, SpectrumMapClient.class, false);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownMode() {
        new SpectrumMapClient.Parameters().parse(new String[] {
                "--inputDirectory", "in",
                "--mode", "summed",
                "--energy", "12.5",
                "--title", "map"
        }, SpectrumMapClient.class, false);
    }

    @Test
    public void testIntegratedModeRequiresChannels() {
        try {
            new SpectrumMapClient.Parameters().parse(new String[] {
                    "--inputDirectory", "in",
                    "--mode", "integrated",
                    "--energy", "12.5",
                    "--title", "map"
            }, SpectrumMapClient.class, false);
            Assert.fail("integrated mode without channels should cause exception");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should name --channels but was: " + e.getMessage(),
                              e.getMessage().contains("--channels"));
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testTitleWithPathSeparator() {
        new SpectrumMapClient.Parameters().parse(new String[] {
                "--inputDirectory", "in",
                "--mode", "interpolated",
                "--energy", "12.5",
                "--title", "maps/map"
        }, SpectrumMapClient.class, false);
    }

}
