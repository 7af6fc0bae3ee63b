package github.sarthakdev143.photo_forge.model;

public enum LocalAdjustmentType {
    RADIAL,
    LINEAR,
    MASKING
}
