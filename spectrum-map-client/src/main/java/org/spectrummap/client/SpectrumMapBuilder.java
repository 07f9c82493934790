package org.spectrummap.client;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.spectrummap.client.parameter.MapOutputParameters;
import org.spectrummap.client.parameter.OutputFormat;
import org.spectrummap.export.TextExporter;
import org.spectrummap.map.GridAssembler;
import org.spectrummap.map.GridNormalizer;
import org.spectrummap.map.GridResampler;
import org.spectrummap.map.IntensityGrid;
import org.spectrummap.map.IntensityMap;
import org.spectrummap.map.RawMap;
import org.spectrummap.raster.ChannelOverflow;
import org.spectrummap.raster.RasterEncoder;
import org.spectrummap.spectrum.IntensityExtractor;
import org.spectrummap.spectrum.SpectrumSample;
import org.spectrummap.util.FileUtil;
import org.spectrummap.util.ProcessTimer;

/**
 * Builds the map for one directory of spectrum files and writes the requested outputs.
 *
 * Every file in the directory is parsed and reduced to one intensity, the intensities are
 * assembled into a raw grid and (when needed) resampled into a formatted grid.  Text outputs
 * are written before the bitmap so that they are kept when the bitmap cannot be encoded.
 * Any malformed file, duplicate position or out of range energy aborts the whole run.
 */
public class SpectrumMapBuilder {

    public static final String RAW_SUFFIX = "raw";
    public static final String GRID_SUFFIX = "grid";
    public static final String BITMAP_SUFFIX = ".bmp";

    private final Path inputDirectory;
    private final IntensityExtractor extractor;
    private final MapOutputParameters outputParameters;
    private final Path outputDirectory;

    public SpectrumMapBuilder(final Path inputDirectory,
                              final IntensityExtractor extractor,
                              final MapOutputParameters outputParameters)
            throws IllegalArgumentException {

        outputParameters.validate();

        this.inputDirectory = inputDirectory;
        this.extractor = extractor;
        this.outputParameters = outputParameters;
        this.outputDirectory = Paths.get(outputParameters.outputDirectory).toAbsolutePath();
    }

    /**
     * @return intensities extracted from every regular file in the input directory.
     */
    public IntensityMap buildIntensityMap()
            throws IOException {

        final List<Path> files = FileUtil.listRegularFiles(inputDirectory);

        LOG.info("buildIntensityMap: entry, extracting intensity {} from {} files in {}",
                 extractor.describe(), files.size(), inputDirectory);

        final ProcessTimer timer = new ProcessTimer();
        final IntensityMap.Builder builder = new IntensityMap.Builder();
        for (final Path file : files) {
            final SpectrumSample sample = SpectrumSample.fromFile(file);
            builder.put(sample.getSite(), extractor.extract(sample), file.getFileName().toString());
            if (timer.hasIntervalPassed()) {
                LOG.info("buildIntensityMap: extracted {} out of {} intensities", builder.size(), files.size());
            }
        }

        final IntensityMap intensityMap = builder.build();

        LOG.info("buildIntensityMap: exit, extracted {} intensities in {}", intensityMap.size(), timer);

        return intensityMap;
    }

    /**
     * Builds the map and writes all outputs for the configured format.
     *
     * @return paths of the written files.
     */
    public List<Path> build()
            throws IOException {

        FileUtil.ensureWritableDirectory(outputDirectory.toFile());

        final IntensityMap intensityMap = buildIntensityMap();
        final RawMap rawMap = new GridAssembler().assemble(intensityMap);

        LOG.info("build: raw width is {}, raw height is {}", rawMap.getTrueWidth(), rawMap.getTrueLength());

        final OutputFormat format = outputParameters.format;
        final String title = outputParameters.title;
        final TextExporter textExporter = new TextExporter();
        final List<Path> writtenFiles = new ArrayList<>();

        if (format.includesRawText()) {
            final String rawTitle = title + RAW_SUFFIX;
            writtenFiles.add(textExporter.writeMatrix(rawMap.getGrid(), outputDirectory, rawTitle));
            writtenFiles.addAll(Arrays.asList(textExporter.writeAxes(rawMap.getAxisSet(), outputDirectory, rawTitle)));
        }

        if (format.needsFormattedGrid()) {

            final IntensityGrid formattedGrid = new GridResampler().resample(rawMap);

            LOG.info("build: formatted width is {}, formatted height is {}",
                     formattedGrid.getWidth(), formattedGrid.getHeight());

            if (format.includesGridText()) {
                writtenFiles.add(textExporter.writeMatrix(formattedGrid, outputDirectory, title + GRID_SUFFIX));
            }

            if (format.includesBitmap()) {
                final IntensityGrid bitmapGrid =
                        outputParameters.normalize ? new GridNormalizer().normalize(formattedGrid) : formattedGrid;
                final ChannelOverflow overflow =
                        outputParameters.clampChannels ? ChannelOverflow.CLAMP : ChannelOverflow.WRAP;
                final Path bitmapPath = outputDirectory.resolve(title + BITMAP_SUFFIX);
                new RasterEncoder(overflow).write(bitmapGrid, bitmapPath);
                writtenFiles.add(bitmapPath);
            }
        }

        LOG.info("build: exit, wrote {} files to {}", writtenFiles.size(), outputDirectory);

        return writtenFiles;
    }

    private static final Logger LOG = LoggerFactory.getLogger(SpectrumMapBuilder.class);
}
