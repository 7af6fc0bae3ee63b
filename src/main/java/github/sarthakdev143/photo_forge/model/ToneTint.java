package github.sarthakdev143.photo_forge.model;

/**
 * Hue in degrees [0, 360] and saturation [0, 100] of one split toning zone.
 */
public record ToneTint(double hue, double saturation) {

    public static final ToneTint NONE = new ToneTint(0, 0);
}
