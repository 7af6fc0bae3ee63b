package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record ColorGradeZone(double hue, double saturation, double luminance) {

    public static final ColorGradeZone NEUTRAL = new ColorGradeZone(0, 0, 0);

    @JsonIgnore
    public boolean isNeutral() {
        return hue == 0 && saturation == 0 && luminance == 0;
    }
}
