package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;

public record PresetFromAdjustmentsRequest(
        String name,
        String description,
        String category,
        AdjustmentSet adjustments) {
}
