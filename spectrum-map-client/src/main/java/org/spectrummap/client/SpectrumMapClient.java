package org.spectrummap.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.nio.file.Paths;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.client.parameter.CommandLineParameters;
import org.spectrummap.client.parameter.IntensityParameters;
import org.spectrummap.client.parameter.MapOutputParameters;

/**
 * Java client for building a spatial intensity map from a directory of spectrum files.
 * See {@link SpectrumMapBuilder} for implementation details.
 *
 * Example:
 * <pre>
 *   java -cp spectrum-map-client.jar org.spectrummap.client.SpectrumMapClient \
 *       --inputDirectory /data/EELS --format all --mode integrated --channels 2 \
 *       --title EELS_Spectrum_map --energy 0.035
 * </pre>
 */
public class SpectrumMapClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--inputDirectory",
                description = "Directory with one spectrum file per acquisition site, " +
                              "named [id]-[x]-[y].[extension]",
                required = true)
        public String inputDirectory;

        @ParametersDelegate
        public IntensityParameters intensity = new IntensityParameters();

        @ParametersDelegate
        public MapOutputParameters output = new MapOutputParameters();

        @Override
        public void validate() throws IllegalArgumentException {
            intensity.validate();
            output.validate();
        }
    }

    /**
     * @param  args  see {@link Parameters} for command line argument details.
     */
    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final SpectrumMapBuilder builder =
                        new SpectrumMapBuilder(Paths.get(parameters.inputDirectory),
                                               parameters.intensity.buildExtractor(),
                                               parameters.output);
                builder.build();
            }
        };
        clientRunner.run();
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumMapClient.class);
}
