package github.sarthakdev143.photo_forge.dto;

public record ExportPhotoResponse(boolean success, String outputPath) {
}
