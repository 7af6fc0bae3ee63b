package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.AdjustmentOverrides;

/**
 * Body of preset create and update calls. On update, {@code null} members keep their current value.
 */
public record SavePresetRequest(
        String name,
        String description,
        String category,
        AdjustmentOverrides adjustments) {
}
