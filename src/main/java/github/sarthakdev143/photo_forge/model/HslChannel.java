package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record HslChannel(double hue, double saturation, double luminance) {

    @JsonIgnore
    public boolean isNeutral() {
        return hue == 0 && saturation == 0 && luminance == 0;
    }
}
