package github.sarthakdev143.photo_forge.dto;

import java.time.Instant;

public record ApiError(String message, Instant timestamp) {
}
