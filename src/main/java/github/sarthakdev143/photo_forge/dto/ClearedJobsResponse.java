package github.sarthakdev143.photo_forge.dto;

public record ClearedJobsResponse(int removed) {
}
