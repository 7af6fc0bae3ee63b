package github.sarthakdev143.photo_forge.model;

/**
 * Brightness and saturation multipliers plus a hue rotation in degrees.
 */
public record Modulation(double brightness, double saturation, double hueDegrees) {

    public static Modulation brightness(double brightness) {
        return new Modulation(brightness, 1.0, 0.0);
    }

    public static Modulation saturation(double saturation) {
        return new Modulation(1.0, saturation, 0.0);
    }

    public static Modulation hue(double hueDegrees) {
        return new Modulation(1.0, 1.0, hueDegrees);
    }

    public boolean isIdentity() {
        return brightness == 1.0 && saturation == 1.0 && hueDegrees % 360.0 == 0.0;
    }
}
