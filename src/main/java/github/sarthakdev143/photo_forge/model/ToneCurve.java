package github.sarthakdev143.photo_forge.model;

public record ToneCurve(
        double highlights,
        double lights,
        double darks,
        double shadows,
        double parametricHighlights,
        double parametricLights,
        double parametricDarks,
        double parametricShadows) {
}
