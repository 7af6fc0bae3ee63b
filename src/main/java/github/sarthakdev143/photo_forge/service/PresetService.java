package github.sarthakdev143.photo_forge.service;

import github.sarthakdev143.photo_forge.model.AdjustmentOverrides;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.CategorySummary;
import github.sarthakdev143.photo_forge.model.PhotoPreset;
import github.sarthakdev143.photo_forge.model.PresetCategory;

import java.util.List;
import java.util.Optional;

public interface PresetService {

    List<PhotoPreset> getAllPresets();

    List<PhotoPreset> getPresetsByCategory(PresetCategory category);

    Optional<PhotoPreset> getPreset(String presetId);

    PhotoPreset createCustomPreset(
            String name,
            String description,
            PresetCategory category,
            AdjustmentOverrides adjustments);

    PhotoPreset createPresetFromAdjustments(
            AdjustmentSet adjustments,
            String name,
            String description,
            PresetCategory category);

    boolean updatePreset(
            String presetId,
            String name,
            String description,
            PresetCategory category,
            AdjustmentOverrides adjustments);

    boolean deletePreset(String presetId);

    AdjustmentSet applyPreset(AdjustmentSet currentAdjustments, String presetId);

    String exportPresets();

    boolean importPresets(String json);

    List<CategorySummary> getCategorySummary();
}
