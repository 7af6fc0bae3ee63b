package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ExportOptions;

import java.util.List;

public record CreateBatchJobRequest(
        String name,
        List<String> inputFiles,
        String outputDirectory,
        AdjustmentSet adjustments,
        ExportOptions exportOptions) {
}
