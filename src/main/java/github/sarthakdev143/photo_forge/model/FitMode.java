package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How an image is fitted into the requested export dimensions.
 */
public enum FitMode {
    /** Fill both dimensions, cropping the overflow around the centre. */
    COVER,
    /** Fit within both dimensions, keeping the aspect ratio. */
    CONTAIN,
    /** Stretch to exactly the requested dimensions. */
    FILL,
    /** Like {@link #CONTAIN}. */
    INSIDE,
    /** Cover both dimensions, keeping the aspect ratio, without cropping. */
    OUTSIDE;

    @JsonCreator
    public static FitMode fromInput(String input) {
        if (input == null || input.isBlank()) {
            return INSIDE;
        }

        try {
            return FitMode.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("fit must be one of cover, contain, fill, inside, outside.");
        }
    }

    @JsonValue
    public String apiValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
