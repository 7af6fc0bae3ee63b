package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.List;

/**
 * Complete parameter record of one photo edit.
 * <p>
 * Scalar ranges are a convention only: exposure [-2, 2], temperature [-1000, 1000],
 * sharpening and noiseReduction [0, 100], everything else [-100, 100]. Use {@link #clamped()}
 * to normalise values coming from outside.
 */
public record AdjustmentSet(
        double exposure,
        double contrast,
        double highlights,
        double shadows,
        double whites,
        double blacks,
        double temperature,
        double tint,
        double vibrance,
        double saturation,
        double sharpening,
        double noiseReduction,
        double clarity,
        double dehaze,
        double vignette,
        HslAdjustments hsl,
        ToneCurve toneCurve,
        SplitToning splitToning,
        ColorGrading colorGrading,
        LensCorrections lensCorrections,
        List<LocalAdjustment> localAdjustments) {

    private static final AdjustmentSet IDENTITY = builder().build();

    public AdjustmentSet {
        localAdjustments = localAdjustments == null ? List.of() : List.copyOf(localAdjustments);
    }

    public static AdjustmentSet identity() {
        return IDENTITY;
    }

    @JsonIgnore
    public boolean isIdentity() {
        return exposure == 0
                && contrast == 0
                && highlights == 0
                && shadows == 0
                && whites == 0
                && blacks == 0
                && temperature == 0
                && tint == 0
                && vibrance == 0
                && saturation == 0
                && sharpening == 0
                && noiseReduction == 0
                && clarity == 0
                && dehaze == 0
                && vignette == 0
                && hsl == null
                && toneCurve == null
                && splitToning == null
                && colorGrading == null
                && lensCorrections == null
                && localAdjustments.isEmpty();
    }

    public AdjustmentSet clamped() {
        return toBuilder()
                .exposure(clamp(exposure, -2.0, 2.0))
                .contrast(clamp(contrast, -100, 100))
                .highlights(clamp(highlights, -100, 100))
                .shadows(clamp(shadows, -100, 100))
                .whites(clamp(whites, -100, 100))
                .blacks(clamp(blacks, -100, 100))
                .temperature(clamp(temperature, -1000, 1000))
                .tint(clamp(tint, -100, 100))
                .vibrance(clamp(vibrance, -100, 100))
                .saturation(clamp(saturation, -100, 100))
                .sharpening(clamp(sharpening, 0, 100))
                .noiseReduction(clamp(noiseReduction, 0, 100))
                .clarity(clamp(clarity, -100, 100))
                .dehaze(clamp(dehaze, -100, 100))
                .vignette(clamp(vignette, -100, 100))
                .build();
    }

    public Builder toBuilder() {
        return new Builder()
                .exposure(exposure)
                .contrast(contrast)
                .highlights(highlights)
                .shadows(shadows)
                .whites(whites)
                .blacks(blacks)
                .temperature(temperature)
                .tint(tint)
                .vibrance(vibrance)
                .saturation(saturation)
                .sharpening(sharpening)
                .noiseReduction(noiseReduction)
                .clarity(clarity)
                .dehaze(dehaze)
                .vignette(vignette)
                .hsl(hsl)
                .toneCurve(toneCurve)
                .splitToning(splitToning)
                .colorGrading(colorGrading)
                .lensCorrections(lensCorrections)
                .localAdjustments(localAdjustments);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    public static final class Builder {

        private double exposure;
        private double contrast;
        private double highlights;
        private double shadows;
        private double whites;
        private double blacks;
        private double temperature;
        private double tint;
        private double vibrance;
        private double saturation;
        private double sharpening;
        private double noiseReduction;
        private double clarity;
        private double dehaze;
        private double vignette;
        private HslAdjustments hsl;
        private ToneCurve toneCurve;
        private SplitToning splitToning;
        private ColorGrading colorGrading;
        private LensCorrections lensCorrections;
        private List<LocalAdjustment> localAdjustments = List.of();

        private Builder() {
        }

        public Builder exposure(double exposure) {
            this.exposure = exposure;
            return this;
        }

        public Builder contrast(double contrast) {
            this.contrast = contrast;
            return this;
        }

        public Builder highlights(double highlights) {
            this.highlights = highlights;
            return this;
        }

        public Builder shadows(double shadows) {
            this.shadows = shadows;
            return this;
        }

        public Builder whites(double whites) {
            this.whites = whites;
            return this;
        }

        public Builder blacks(double blacks) {
            this.blacks = blacks;
            return this;
        }

        public Builder temperature(double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder tint(double tint) {
            this.tint = tint;
            return this;
        }

        public Builder vibrance(double vibrance) {
            this.vibrance = vibrance;
            return this;
        }

        public Builder saturation(double saturation) {
            this.saturation = saturation;
            return this;
        }

        public Builder sharpening(double sharpening) {
            this.sharpening = sharpening;
            return this;
        }

        public Builder noiseReduction(double noiseReduction) {
            this.noiseReduction = noiseReduction;
            return this;
        }

        public Builder clarity(double clarity) {
            this.clarity = clarity;
            return this;
        }

        public Builder dehaze(double dehaze) {
            this.dehaze = dehaze;
            return this;
        }

        public Builder vignette(double vignette) {
            this.vignette = vignette;
            return this;
        }

        public Builder hsl(HslAdjustments hsl) {
            this.hsl = hsl;
            return this;
        }

        public Builder toneCurve(ToneCurve toneCurve) {
            this.toneCurve = toneCurve;
            return this;
        }

        public Builder splitToning(SplitToning splitToning) {
            this.splitToning = splitToning;
            return this;
        }

        public Builder colorGrading(ColorGrading colorGrading) {
            this.colorGrading = colorGrading;
            return this;
        }

        public Builder lensCorrections(LensCorrections lensCorrections) {
            this.lensCorrections = lensCorrections;
            return this;
        }

        public Builder localAdjustments(List<LocalAdjustment> localAdjustments) {
            this.localAdjustments = localAdjustments;
            return this;
        }

        public AdjustmentSet build() {
            return new AdjustmentSet(
                    exposure,
                    contrast,
                    highlights,
                    shadows,
                    whites,
                    blacks,
                    temperature,
                    tint,
                    vibrance,
                    saturation,
                    sharpening,
                    noiseReduction,
                    clarity,
                    dehaze,
                    vignette,
                    hsl,
                    toneCurve,
                    splitToning,
                    colorGrading,
                    lensCorrections,
                    localAdjustments);
        }
    }
}
