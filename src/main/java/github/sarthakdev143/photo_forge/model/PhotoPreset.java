package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.time.Instant;

public record PhotoPreset(
        String id,
        String name,
        String description,
        PresetCategory category,
        AdjustmentOverrides adjustments,
        String author,
        Instant createdAt) {

    public static final String CUSTOM_ID_PREFIX = "custom-";

    public PhotoPreset {
        adjustments = adjustments == null ? AdjustmentOverrides.empty() : adjustments;
    }

    @JsonIgnore
    public boolean isCustom() {
        return id != null && id.startsWith(CUSTOM_ID_PREFIX);
    }

    public PhotoPreset withIdentity(String newId, Instant newCreatedAt) {
        return new PhotoPreset(newId, name, description, category, adjustments, author, newCreatedAt);
    }
}
