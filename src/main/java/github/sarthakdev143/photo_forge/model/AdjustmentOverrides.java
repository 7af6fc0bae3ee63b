package github.sarthakdev143.photo_forge.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Partial {@link AdjustmentSet}: a {@code null} member leaves the base value untouched when merged.
 * Presets and local adjustments are stored in this form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdjustmentOverrides(
        Double exposure,
        Double contrast,
        Double highlights,
        Double shadows,
        Double whites,
        Double blacks,
        Double temperature,
        Double tint,
        Double vibrance,
        Double saturation,
        Double sharpening,
        Double noiseReduction,
        Double clarity,
        Double dehaze,
        Double vignette,
        HslAdjustments hsl,
        ToneCurve toneCurve,
        SplitToning splitToning,
        ColorGrading colorGrading,
        LensCorrections lensCorrections,
        List<LocalAdjustment> localAdjustments) {

    private static final AdjustmentOverrides EMPTY = builder().build();

    public AdjustmentOverrides {
        localAdjustments = localAdjustments == null ? null : List.copyOf(localAdjustments);
    }

    public static AdjustmentOverrides empty() {
        return EMPTY;
    }

    /**
     * Keeps only the members of {@code adjustments} that differ from the identity adjustment.
     */
    public static AdjustmentOverrides nonDefault(AdjustmentSet adjustments) {
        return builder()
                .exposure(nonZero(adjustments.exposure()))
                .contrast(nonZero(adjustments.contrast()))
                .highlights(nonZero(adjustments.highlights()))
                .shadows(nonZero(adjustments.shadows()))
                .whites(nonZero(adjustments.whites()))
                .blacks(nonZero(adjustments.blacks()))
                .temperature(nonZero(adjustments.temperature()))
                .tint(nonZero(adjustments.tint()))
                .vibrance(nonZero(adjustments.vibrance()))
                .saturation(nonZero(adjustments.saturation()))
                .sharpening(nonZero(adjustments.sharpening()))
                .noiseReduction(nonZero(adjustments.noiseReduction()))
                .clarity(nonZero(adjustments.clarity()))
                .dehaze(nonZero(adjustments.dehaze()))
                .vignette(nonZero(adjustments.vignette()))
                .hsl(adjustments.hsl())
                .toneCurve(adjustments.toneCurve())
                .splitToning(adjustments.splitToning())
                .colorGrading(adjustments.colorGrading())
                .lensCorrections(adjustments.lensCorrections())
                .localAdjustments(adjustments.localAdjustments().isEmpty() ? null : adjustments.localAdjustments())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static Double nonZero(double value) {
        return value == 0 ? null : value;
    }

    public static final class Builder {

        private Double exposure;
        private Double contrast;
        private Double highlights;
        private Double shadows;
        private Double whites;
        private Double blacks;
        private Double temperature;
        private Double tint;
        private Double vibrance;
        private Double saturation;
        private Double sharpening;
        private Double noiseReduction;
        private Double clarity;
        private Double dehaze;
        private Double vignette;
        private HslAdjustments hsl;
        private ToneCurve toneCurve;
        private SplitToning splitToning;
        private ColorGrading colorGrading;
        private LensCorrections lensCorrections;
        private List<LocalAdjustment> localAdjustments;

        private Builder() {
        }

        public Builder exposure(Double exposure) {
            this.exposure = exposure;
            return this;
        }

        public Builder contrast(Double contrast) {
            this.contrast = contrast;
            return this;
        }

        public Builder highlights(Double highlights) {
            this.highlights = highlights;
            return this;
        }

        public Builder shadows(Double shadows) {
            this.shadows = shadows;
            return this;
        }

        public Builder whites(Double whites) {
            this.whites = whites;
            return this;
        }

        public Builder blacks(Double blacks) {
            this.blacks = blacks;
            return this;
        }

        public Builder temperature(Double temperature) {
            this.temperature = temperature;
            return this;
        }

        public Builder tint(Double tint) {
            this.tint = tint;
            return this;
        }

        public Builder vibrance(Double vibrance) {
            this.vibrance = vibrance;
            return this;
        }

        public Builder saturation(Double saturation) {
            this.saturation = saturation;
            return this;
        }

        public Builder sharpening(Double sharpening) {
            this.sharpening = sharpening;
            return this;
        }

        public Builder noiseReduction(Double noiseReduction) {
            this.noiseReduction = noiseReduction;
            return this;
        }

        public Builder clarity(Double clarity) {
            this.clarity = clarity;
            return this;
        }

        public Builder dehaze(Double dehaze) {
            this.dehaze = dehaze;
            return this;
        }

        public Builder vignette(Double vignette) {
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

        public AdjustmentOverrides build() {
            return new AdjustmentOverrides(
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
