package github.sarthakdev143.photo_forge.model;

public record ColorGrading(
        ColorGradeZone shadows,
        ColorGradeZone midtones,
        ColorGradeZone highlights,
        double globalSaturation,
        double globalLuminance,
        double balance) {

    public ColorGrading {
        shadows = shadows == null ? ColorGradeZone.NEUTRAL : shadows;
        midtones = midtones == null ? ColorGradeZone.NEUTRAL : midtones;
        highlights = highlights == null ? ColorGradeZone.NEUTRAL : highlights;
    }
}
