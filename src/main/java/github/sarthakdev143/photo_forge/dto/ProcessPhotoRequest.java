package github.sarthakdev143.photo_forge.dto;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;

public record ProcessPhotoRequest(String filePath, AdjustmentSet adjustments) {
}
