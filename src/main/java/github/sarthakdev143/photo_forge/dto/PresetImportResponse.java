package github.sarthakdev143.photo_forge.dto;

public record PresetImportResponse(boolean imported, int totalPresets) {
}
