package github.sarthakdev143.photo_forge.model;

/**
 * 256-bin channel histograms, each normalised so that its fullest bin is 1.0.
 */
public record Histogram(double[] red, double[] green, double[] blue, double[] luminance) {

    public static final int BINS = 256;
}
