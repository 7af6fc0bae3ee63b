package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ExportOptions;

/**
 * {@code adjustments} is optional; without it the decoded image is exported as is.
 */
public record ExportPhotoRequest(
        String filePath,
        String outputPath,
        ExportOptions exportOptions,
        AdjustmentSet adjustments) {
}
