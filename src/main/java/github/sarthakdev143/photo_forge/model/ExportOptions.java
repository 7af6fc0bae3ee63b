package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Output format and naming of an export. {@code quality} 0 selects the default of 90.
 */
public record ExportOptions(
        ExportFormat format,
        int quality,
        Integer width,
        Integer height,
        FitMode fit,
        FileNaming fileNaming,
        boolean overwrite) {

    public static final int DEFAULT_QUALITY = 90;

    public ExportOptions {
        if (format == null) {
            throw new IllegalArgumentException("exportOptions.format is required.");
        }
        if (width != null && width <= 0) {
            throw new IllegalArgumentException("exportOptions.width must be positive.");
        }
        if (height != null && height <= 0) {
            throw new IllegalArgumentException("exportOptions.height must be positive.");
        }
        quality = quality == 0 ? DEFAULT_QUALITY : Math.max(1, Math.min(100, quality));
        fit = fit == null ? FitMode.INSIDE : fit;
        fileNaming = fileNaming == null ? FileNaming.NONE : fileNaming;
    }

    public static ExportOptions of(ExportFormat format) {
        return new ExportOptions(format, DEFAULT_QUALITY, null, null, FitMode.INSIDE, FileNaming.NONE, false);
    }

    @JsonIgnore
    public boolean hasResize() {
        return width != null || height != null;
    }

    public ExportOptions withOverwrite(boolean overwrite) {
        return new ExportOptions(format, quality, width, height, fit, fileNaming, overwrite);
    }

    public ExportOptions withFileNaming(FileNaming fileNaming) {
        return new ExportOptions(format, quality, width, height, fit, fileNaming, overwrite);
    }
}
