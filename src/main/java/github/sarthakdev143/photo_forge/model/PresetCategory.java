package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum PresetCategory {
    PORTRAIT("portrait"),
    LANDSCAPE("landscape"),
    STREET("street"),
    BLACK_WHITE("black-white"),
    VINTAGE("vintage"),
    MODERN("modern"),
    ARTISTIC("artistic");

    private final String apiValue;

    PresetCategory(String apiValue) {
        this.apiValue = apiValue;
    }

    @JsonCreator
    public static PresetCategory fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("category is required.");
        }

        String normalized = input.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (PresetCategory category : values()) {
            if (category.apiValue.equals(normalized)) {
                return category;
            }
        }
        throw new IllegalArgumentException(
                "category must be one of portrait, landscape, street, black-white, vintage, modern, artistic.");
    }

    @JsonValue
    public String apiValue() {
        return apiValue;
    }
}
