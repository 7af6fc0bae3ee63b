package github.sarthakdev143.photo_forge.model;

public record LocalAdjustment(
        String id,
        LocalAdjustmentType type,
        MaskGeometry geometry,
        AdjustmentOverrides adjustments,
        boolean inverted) {

    public LocalAdjustment {
        adjustments = adjustments == null ? AdjustmentOverrides.empty() : adjustments;
    }
}
