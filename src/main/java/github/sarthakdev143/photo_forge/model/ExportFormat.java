package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import github.sarthakdev143.photo_forge.exception.UnsupportedExportFormatException;

import java.util.Locale;

public enum ExportFormat {
    JPEG("jpeg", ".jpg", "jpeg"),
    PNG("png", ".png", "png"),
    TIFF("tiff", ".tiff", "tiff"),
    WEBP("webp", ".webp", "webp");

    private final String apiValue;
    private final String extension;
    private final String writerFormatName;

    ExportFormat(String apiValue, String extension, String writerFormatName) {
        this.apiValue = apiValue;
        this.extension = extension;
        this.writerFormatName = writerFormatName;
    }

    @JsonCreator
    public static ExportFormat fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new UnsupportedExportFormatException("Export format is required.");
        }

        return switch (input.trim().toLowerCase(Locale.ROOT)) {
            case "jpeg", "jpg" -> JPEG;
            case "png" -> PNG;
            case "tiff", "tif" -> TIFF;
            case "webp" -> WEBP;
            default -> throw new UnsupportedExportFormatException("Unsupported export format: " + input);
        };
    }

    @JsonValue
    public String apiValue() {
        return apiValue;
    }

    public String extension() {
        return extension;
    }

    public String writerFormatName() {
        return writerFormatName;
    }

    public boolean supportsAlpha() {
        return this != JPEG;
    }
}
