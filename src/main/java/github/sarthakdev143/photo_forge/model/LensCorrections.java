package github.sarthakdev143.photo_forge.model;

public record LensCorrections(
        double chromaticAberration,
        double distortion,
        double vignetting,
        double fringing) {
}
