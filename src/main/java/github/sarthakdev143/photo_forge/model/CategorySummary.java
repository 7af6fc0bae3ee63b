package github.sarthakdev143.photo_forge.model;

public record CategorySummary(PresetCategory category, long count) {
}
