package github.sarthakdev143.photo_forge.controller;

import github.sarthakdev143.photo_forge.dto.ExportPhotoRequest;
import github.sarthakdev143.photo_forge.dto.ExportPhotoResponse;
import github.sarthakdev143.photo_forge.dto.ProcessPhotoRequest;
import github.sarthakdev143.photo_forge.dto.RawFileInfoResponse;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.model.Histogram;
import github.sarthakdev143.photo_forge.service.PhotoProcessingService;
import github.sarthakdev143.photo_forge.service.impl.ExportEncoder;
import github.sarthakdev143.photo_forge.service.impl.RawFormatCatalog;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

@RestController
@RequestMapping("/api/photos")
public class PhotoController {

    private static final int DEFAULT_THUMBNAIL_SIZE = 300;
    private static final int DEFAULT_PREVIEW_DIMENSION = 1920;
    private static final int MAX_DIMENSION = 10_000;

    private final PhotoProcessingService photoProcessingService;
    private final ExportEncoder exportEncoder;
    private final RawFormatCatalog rawFormatCatalog;

    public PhotoController(
            PhotoProcessingService photoProcessingService,
            ExportEncoder exportEncoder,
            RawFormatCatalog rawFormatCatalog) {
        this.photoProcessingService = photoProcessingService;
        this.exportEncoder = exportEncoder;
        this.rawFormatCatalog = rawFormatCatalog;
    }

    @PostMapping(value = "/process", produces = MediaType.IMAGE_PNG_VALUE)
    public ResponseEntity<byte[]> processPhoto(@RequestBody ProcessPhotoRequest request) throws IOException {
        Path source = requirePath("filePath", request.filePath());
        AdjustmentSet adjustments = request.adjustments() == null
                ? AdjustmentSet.identity()
                : request.adjustments().clamped();

        BufferedImage edited = photoProcessingService.processPhoto(source, adjustments);
        byte[] png = exportEncoder.encode(edited, ExportOptions.of(ExportFormat.PNG));
        return ResponseEntity.ok().contentType(MediaType.IMAGE_PNG).body(png);
    }

    @PostMapping("/export")
    public ExportPhotoResponse exportPhoto(@RequestBody ExportPhotoRequest request) {
        Path source = requirePath("filePath", request.filePath());
        Path target = requirePath("outputPath", request.outputPath());
        if (request.exportOptions() == null) {
            throw new IllegalArgumentException("exportOptions is required.");
        }

        AdjustmentSet adjustments = request.adjustments() == null ? null : request.adjustments().clamped();
        boolean success = photoProcessingService.exportPhoto(source, target, request.exportOptions(), adjustments);
        return new ExportPhotoResponse(success, target.toString());
    }

    @GetMapping("/thumbnail")
    public ResponseEntity<byte[]> thumbnail(
            @RequestParam("path") String path,
            @RequestParam(value = "size", defaultValue = "" + DEFAULT_THUMBNAIL_SIZE) int size) throws IOException {
        validateDimension("size", size);
        byte[] jpeg = photoProcessingService.generateThumbnail(requirePath("path", path), size);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(jpeg);
    }

    @GetMapping("/preview")
    public ResponseEntity<byte[]> preview(
            @RequestParam("path") String path,
            @RequestParam(value = "maxDimension", defaultValue = "" + DEFAULT_PREVIEW_DIMENSION) int maxDimension)
            throws IOException {
        validateDimension("maxDimension", maxDimension);
        byte[] jpeg = photoProcessingService.generatePreview(requirePath("path", path), maxDimension);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(jpeg);
    }

    @GetMapping("/histogram")
    public Histogram histogram(@RequestParam("path") String path) throws IOException {
        return photoProcessingService.getHistogram(requirePath("path", path));
    }

    @GetMapping("/raw")
    public RawFileInfoResponse rawInfo(
            @RequestParam("path") String path,
            @RequestParam(value = "cameraMake", required = false) String cameraMake) {
        Path file = requirePath("path", path);
        boolean raw = rawFormatCatalog.isRawFile(file);
        return new RawFileInfoResponse(
                file.toString(),
                raw,
                raw ? rawFormatCatalog.defaultSettingsForCamera(cameraMake) : null);
    }

    @GetMapping("/raw/formats")
    public List<String> rawFormats() {
        return rawFormatCatalog.supportedFormats();
    }

    private Path requirePath(String fieldName, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " is required.");
        }
        return Path.of(value.trim());
    }

    private void validateDimension(String fieldName, int value) {
        if (value < 1 || value > MAX_DIMENSION) {
            throw new IllegalArgumentException(fieldName + " must be between 1 and " + MAX_DIMENSION + ".");
        }
    }
}
