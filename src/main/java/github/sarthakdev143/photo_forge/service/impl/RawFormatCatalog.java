package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.RawProcessingSettings;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Camera RAW extensions and per-manufacturer decoder defaults.
 */
@Component
public class RawFormatCatalog {

    private static final List<String> RAW_EXTENSIONS = List.of(
            ".cr2", ".cr3", ".crw",
            ".nef", ".nrw",
            ".arw", ".srf", ".sr2",
            ".orf", ".ori",
            ".rw2",
            ".pef", ".ptx",
            ".raf",
            ".3fr", ".fff",
            ".dcr", ".mrw", ".mdg", ".mdc",
            ".erf",
            ".mos",
            ".raw", ".rwl",
            ".dng",
            ".iiq",
            ".k25", ".kdc",
            ".mef",
            ".nksc",
            ".qtk",
            ".rdc",
            ".bay",
            ".cine",
            ".ia",
            ".on1",
            ".x3f");

    private static final Set<String> EXTENSION_LOOKUP = Set.copyOf(RAW_EXTENSIONS);

    public boolean isRawFile(Path file) {
        if (file == null || file.getFileName() == null) {
            return false;
        }
        return EXTENSION_LOOKUP.contains(extensionOf(file.getFileName().toString()));
    }

    public List<String> supportedFormats() {
        return List.copyOf(new TreeSet<>(RAW_EXTENSIONS));
    }

    public RawProcessingSettings defaultSettingsForCamera(String cameraMake) {
        RawProcessingSettings defaults = RawProcessingSettings.defaults();
        if (cameraMake == null || cameraMake.isBlank()) {
            return defaults;
        }

        return switch (cameraMake.trim().toLowerCase(Locale.ROOT)) {
            case "canon" -> defaults.withCameraProfile("DCB", 40);
            case "nikon" -> defaults.withCameraProfile("AHD", 35);
            case "sony" -> defaults.withCameraProfile("VNG", 45);
            case "fujifilm" -> defaults.withCameraProfile("AMaZE", 30);
            default -> defaults;
        };
    }

    static String extensionOf(String fileName) {
        int dot = fileName.lastIndexOf('.');
        if (dot < 0) {
            return "";
        }
        return fileName.substring(dot).toLowerCase(Locale.ROOT);
    }
}
