package github.sarthakdev143.photo_forge.model;

/**
 * Placement of a local adjustment in normalised image coordinates. Optional members depend on the
 * mask type: radius for radial masks, width/height/angle for linear ones.
 */
public record MaskGeometry(
        double x,
        double y,
        Double width,
        Double height,
        Double radius,
        Double angle,
        double feather) {
}
