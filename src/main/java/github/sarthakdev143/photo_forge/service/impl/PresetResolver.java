package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.AdjustmentOverrides;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.PhotoPreset;
import github.sarthakdev143.photo_forge.service.PresetService;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a preset reference into a complete {@link AdjustmentSet}.
 */
@Component
public class PresetResolver {

    private final PresetService presetService;

    public PresetResolver(PresetService presetService) {
        this.presetService = presetService;
    }

    /**
     * Resolves {@code presetId} onto {@code base}, or returns empty when the preset is unknown.
     */
    public Optional<AdjustmentSet> resolve(AdjustmentSet base, String presetId) {
        if (presetId == null || presetId.isBlank()) {
            return Optional.empty();
        }
        return presetService.getPreset(presetId)
                .map(PhotoPreset::adjustments)
                .map(overrides -> merge(base, overrides));
    }

    /**
     * Shallow merge: each non-null member of {@code overrides} replaces the base member, sub-records
     * included.
     */
    public static AdjustmentSet merge(AdjustmentSet base, AdjustmentOverrides overrides) {
        AdjustmentSet start = base == null ? AdjustmentSet.identity() : base;
        if (overrides == null) {
            return start;
        }

        AdjustmentSet.Builder builder = start.toBuilder();
        if (overrides.exposure() != null) {
            builder.exposure(overrides.exposure());
        }
        if (overrides.contrast() != null) {
            builder.contrast(overrides.contrast());
        }
        if (overrides.highlights() != null) {
            builder.highlights(overrides.highlights());
        }
        if (overrides.shadows() != null) {
            builder.shadows(overrides.shadows());
        }
        if (overrides.whites() != null) {
            builder.whites(overrides.whites());
        }
        if (overrides.blacks() != null) {
            builder.blacks(overrides.blacks());
        }
        if (overrides.temperature() != null) {
            builder.temperature(overrides.temperature());
        }
        if (overrides.tint() != null) {
            builder.tint(overrides.tint());
        }
        if (overrides.vibrance() != null) {
            builder.vibrance(overrides.vibrance());
        }
        if (overrides.saturation() != null) {
            builder.saturation(overrides.saturation());
        }
        if (overrides.sharpening() != null) {
            builder.sharpening(overrides.sharpening());
        }
        if (overrides.noiseReduction() != null) {
            builder.noiseReduction(overrides.noiseReduction());
        }
        if (overrides.clarity() != null) {
            builder.clarity(overrides.clarity());
        }
        if (overrides.dehaze() != null) {
            builder.dehaze(overrides.dehaze());
        }
        if (overrides.vignette() != null) {
            builder.vignette(overrides.vignette());
        }
        if (overrides.hsl() != null) {
            builder.hsl(overrides.hsl());
        }
        if (overrides.toneCurve() != null) {
            builder.toneCurve(overrides.toneCurve());
        }
        if (overrides.splitToning() != null) {
            builder.splitToning(overrides.splitToning());
        }
        if (overrides.colorGrading() != null) {
            builder.colorGrading(overrides.colorGrading());
        }
        if (overrides.lensCorrections() != null) {
            builder.lensCorrections(overrides.lensCorrections());
        }
        if (overrides.localAdjustments() != null) {
            builder.localAdjustments(overrides.localAdjustments());
        }
        return builder.build();
    }
}
