package github.sarthakdev143.photo_forge.controller;

import github.sarthakdev143.photo_forge.dto.PresetFromAdjustmentsRequest;
import github.sarthakdev143.photo_forge.dto.PresetImportResponse;
import github.sarthakdev143.photo_forge.dto.SavePresetRequest;
import github.sarthakdev143.photo_forge.exception.PresetNotFoundException;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.CategorySummary;
import github.sarthakdev143.photo_forge.model.PhotoPreset;
import github.sarthakdev143.photo_forge.model.PresetCategory;
import github.sarthakdev143.photo_forge.service.PresetService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/presets")
public class PresetController {

    private static final int MAX_NAME_LENGTH = 100;

    private final PresetService presetService;

    public PresetController(PresetService presetService) {
        this.presetService = presetService;
    }

    @GetMapping
    public List<PhotoPreset> listPresets(@RequestParam(value = "category", required = false) String category) {
        if (category == null || category.isBlank()) {
            return presetService.getAllPresets();
        }
        return presetService.getPresetsByCategory(PresetCategory.fromInput(category));
    }

    @GetMapping("/{presetId}")
    public PhotoPreset getPreset(@PathVariable String presetId) {
        return requirePreset(presetId);
    }

    @PostMapping
    public ResponseEntity<PhotoPreset> createPreset(@RequestBody SavePresetRequest request) {
        String name = requireName(request.name());
        PhotoPreset preset = presetService.createCustomPreset(
                name,
                request.description(),
                PresetCategory.fromInput(request.category()),
                request.adjustments());
        return ResponseEntity.status(HttpStatus.CREATED).body(preset);
    }

    @PostMapping("/from-adjustments")
    public ResponseEntity<PhotoPreset> createFromAdjustments(@RequestBody PresetFromAdjustmentsRequest request) {
        String name = requireName(request.name());
        AdjustmentSet adjustments = request.adjustments() == null
                ? AdjustmentSet.identity()
                : request.adjustments().clamped();
        PhotoPreset preset = presetService.createPresetFromAdjustments(
                adjustments,
                name,
                request.description(),
                PresetCategory.fromInput(request.category()));
        return ResponseEntity.status(HttpStatus.CREATED).body(preset);
    }

    @PutMapping("/{presetId}")
    public PhotoPreset updatePreset(@PathVariable String presetId, @RequestBody SavePresetRequest request) {
        String name = request.name() == null ? null : requireName(request.name());
        PresetCategory category = request.category() == null ? null : PresetCategory.fromInput(request.category());
        if (!presetService.updatePreset(presetId, name, request.description(), category, request.adjustments())) {
            throw new PresetNotFoundException(presetId);
        }
        return requirePreset(presetId);
    }

    @DeleteMapping("/{presetId}")
    public ResponseEntity<Void> deletePreset(@PathVariable String presetId) {
        if (!presetService.deletePreset(presetId)) {
            requirePreset(presetId);
            throw new IllegalStateException("Built-in preset " + presetId + " cannot be deleted.");
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{presetId}/apply")
    public AdjustmentSet applyPreset(
            @PathVariable String presetId,
            @RequestBody(required = false) AdjustmentSet currentAdjustments) {
        requirePreset(presetId);
        AdjustmentSet base = currentAdjustments == null ? AdjustmentSet.identity() : currentAdjustments.clamped();
        return presetService.applyPreset(base, presetId);
    }

    @GetMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public String exportPresets() {
        return presetService.exportPresets();
    }

    @PostMapping(value = "/import", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PresetImportResponse> importPresets(@RequestBody String json) {
        boolean imported = presetService.importPresets(json);
        PresetImportResponse response = new PresetImportResponse(imported, presetService.getAllPresets().size());
        if (!imported) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @GetMapping("/categories")
    public List<CategorySummary> categories() {
        return presetService.getCategorySummary();
    }

    private PhotoPreset requirePreset(String presetId) {
        return presetService.getPreset(presetId).orElseThrow(() -> new PresetNotFoundException(presetId));
    }

    private String requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name is required.");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("name must be at most " + MAX_NAME_LENGTH + " characters.");
        }
        return trimmed;
    }
}
