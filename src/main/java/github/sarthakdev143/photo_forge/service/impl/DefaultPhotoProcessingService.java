package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.FitMode;
import github.sarthakdev143.photo_forge.model.Histogram;
import github.sarthakdev143.photo_forge.service.AdjustmentPipeline;
import github.sarthakdev143.photo_forge.service.ImageBackend;
import github.sarthakdev143.photo_forge.service.PhotoProcessingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

@Service
public class DefaultPhotoProcessingService implements PhotoProcessingService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPhotoProcessingService.class);
    private static final int THUMBNAIL_QUALITY = 80;
    private static final int PREVIEW_QUALITY = 85;
    private static final int HISTOGRAM_SAMPLE_SIZE = 512;

    private final ImageBackend backend;
    private final AdjustmentPipeline pipeline;
    private final ExportEncoder exportEncoder;
    private final Counter exportFailureCounter;

    public DefaultPhotoProcessingService(
            ImageBackend backend,
            AdjustmentPipeline pipeline,
            ExportEncoder exportEncoder,
            MeterRegistry meterRegistry) {
        this.backend = backend;
        this.pipeline = pipeline;
        this.exportEncoder = exportEncoder;
        this.exportFailureCounter = meterRegistry.counter("photo_forge.export.failures");
    }

    @Override
    public BufferedImage processPhoto(Path filePath, AdjustmentSet adjustments) throws IOException {
        BufferedImage decoded = backend.decode(filePath);
        return pipeline.apply(decoded, adjustments == null ? AdjustmentSet.identity() : adjustments);
    }

    @Override
    public boolean exportPhoto(Path filePath, Path outputPath, ExportOptions exportOptions, AdjustmentSet adjustments) {
        try {
            BufferedImage image = backend.decode(filePath);
            if (adjustments != null) {
                image = pipeline.apply(image, adjustments);
            }
            exportEncoder.export(image, exportOptions, outputPath);
            logger.info("Exported {} to {} format={}", filePath, outputPath, exportOptions.format().apiValue());
            return true;
        } catch (IOException | RuntimeException e) {
            exportFailureCounter.increment();
            logger.error("Export of {} to {} failed", filePath, outputPath, e);
            return false;
        }
    }

    @Override
    public byte[] generateThumbnail(Path filePath, int size) throws IOException {
        if (size <= 0) {
            throw new IllegalArgumentException("size must be positive.");
        }

        BufferedImage decoded = backend.decode(filePath);
        BufferedImage thumbnail = backend.resize(decoded, size, size, FitMode.COVER);
        return backend.encode(thumbnail, ExportFormat.JPEG, THUMBNAIL_QUALITY);
    }

    @Override
    public byte[] generatePreview(Path filePath, int maxDimension) throws IOException {
        if (maxDimension <= 0) {
            throw new IllegalArgumentException("maxDimension must be positive.");
        }

        BufferedImage decoded = backend.decode(filePath);
        BufferedImage preview = backend.resize(decoded, maxDimension, maxDimension, FitMode.INSIDE);
        return backend.encode(preview, ExportFormat.JPEG, PREVIEW_QUALITY);
    }

    @Override
    public Histogram getHistogram(Path filePath) throws IOException {
        BufferedImage decoded = backend.decode(filePath);
        BufferedImage sample = backend.resize(decoded, HISTOGRAM_SAMPLE_SIZE, HISTOGRAM_SAMPLE_SIZE, FitMode.INSIDE);

        double[] red = new double[Histogram.BINS];
        double[] green = new double[Histogram.BINS];
        double[] blue = new double[Histogram.BINS];
        double[] luminance = new double[Histogram.BINS];

        int width = sample.getWidth();
        int height = sample.getHeight();
        int[] pixels = sample.getRGB(0, 0, width, height, null, 0, width);
        for (int argb : pixels) {
            int r = (argb >> 16) & 0xFF;
            int g = (argb >> 8) & 0xFF;
            int b = argb & 0xFF;
            red[r]++;
            green[g]++;
            blue[b]++;
            luminance[(int) Math.round(0.299 * r + 0.587 * g + 0.114 * b)]++;
        }

        normalize(red);
        normalize(green);
        normalize(blue);
        normalize(luminance);
        return new Histogram(red, green, blue, luminance);
    }

    private static void normalize(double[] bins) {
        double max = 0;
        for (double value : bins) {
            max = Math.max(max, value);
        }
        if (max == 0) {
            return;
        }
        for (int i = 0; i < bins.length; i++) {
            bins[i] /= max;
        }
    }
}
