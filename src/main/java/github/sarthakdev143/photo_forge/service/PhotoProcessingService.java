package github.sarthakdev143.photo_forge.service;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.Histogram;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

public interface PhotoProcessingService {

    BufferedImage processPhoto(Path filePath, AdjustmentSet adjustments) throws IOException;

    boolean exportPhoto(Path filePath, Path outputPath, ExportOptions exportOptions, AdjustmentSet adjustments);

    byte[] generateThumbnail(Path filePath, int size) throws IOException;

    byte[] generatePreview(Path filePath, int maxDimension) throws IOException;

    Histogram getHistogram(Path filePath) throws IOException;
}
