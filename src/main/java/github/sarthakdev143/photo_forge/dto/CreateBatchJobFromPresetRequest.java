package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.ExportOptions;

import java.util.List;

public record CreateBatchJobFromPresetRequest(
        String name,
        List<String> inputFiles,
        String outputDirectory,
        String presetId,
        ExportOptions exportOptions) {
}
