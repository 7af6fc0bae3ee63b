package github.sarthakdev143.photo_forge.model;

/**
 * Decoder parameters handed to a RAW-capable backend.
 */
public record RawProcessingSettings(
        String demosaicing,
        String colorSpace,
        String whiteBalance,
        boolean noiseReduction,
        double denoisingStrength,
        double exposureCompensation,
        boolean sharpening,
        int sharpeningAmount,
        double sharpeningRadius,
        int outputBitDepth,
        double outputGamma) {

    public static RawProcessingSettings defaults() {
        return new RawProcessingSettings("AHD", "sRGB", "auto", true, 0.25, 0.0, true, 50, 1.0, 16, 2.2);
    }

    public RawProcessingSettings withCameraProfile(String demosaicing, int sharpeningAmount) {
        return new RawProcessingSettings(
                demosaicing,
                colorSpace,
                whiteBalance,
                noiseReduction,
                denoisingStrength,
                exposureCompensation,
                true,
                sharpeningAmount,
                sharpeningRadius,
                outputBitDepth,
                outputGamma);
    }
}
