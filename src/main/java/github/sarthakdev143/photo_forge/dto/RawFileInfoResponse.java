package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.RawProcessingSettings;

public record RawFileInfoResponse(String path, boolean raw, RawProcessingSettings settings) {
}
