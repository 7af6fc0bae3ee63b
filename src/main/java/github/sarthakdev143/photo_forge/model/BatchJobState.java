package github.sarthakdev143.photo_forge.model;

import java.util.Locale;

public enum BatchJobState {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static BatchJobState fromInput(String input) {
        if (input == null || input.isBlank()) {
            throw new IllegalArgumentException("status is required.");
        }

        try {
            return BatchJobState.valueOf(input.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new IllegalArgumentException("status must be one of PENDING, PROCESSING, COMPLETED, FAILED.");
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
