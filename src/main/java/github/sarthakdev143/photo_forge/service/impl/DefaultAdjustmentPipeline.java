package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.ColorGradeZone;
import github.sarthakdev143.photo_forge.model.ColorGrading;
import github.sarthakdev143.photo_forge.model.HslAdjustments;
import github.sarthakdev143.photo_forge.model.HslChannel;
import github.sarthakdev143.photo_forge.model.HueFamily;
import github.sarthakdev143.photo_forge.model.LensCorrections;
import github.sarthakdev143.photo_forge.model.Modulation;
import github.sarthakdev143.photo_forge.model.SplitToning;
import github.sarthakdev143.photo_forge.model.ToneCurve;
import github.sarthakdev143.photo_forge.service.AdjustmentPipeline;
import github.sarthakdev143.photo_forge.service.ImageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * Fixed-order adjustment pipeline. Each stage is a global operation on the backend and is skipped
 * when its parameters are at their identity value.
 * <p>
 * HSL, vignette, split toning and colour grading are global approximations: they modulate the whole
 * frame rather than a hue range, radial falloff or tonal zone.
 */
@Component
public class DefaultAdjustmentPipeline implements AdjustmentPipeline {

    private static final Logger logger = LoggerFactory.getLogger(DefaultAdjustmentPipeline.class);

    private final ImageBackend backend;

    public DefaultAdjustmentPipeline(ImageBackend backend) {
        this.backend = backend;
    }

    @Override
    public BufferedImage apply(BufferedImage source, AdjustmentSet adjustments) {
        if (adjustments == null || adjustments.isIdentity()) {
            return source;
        }

        BufferedImage image = source;
        image = applyExposure(image, adjustments.exposure());
        image = applyContrast(image, adjustments.contrast());
        image = applyHighlightsShadows(image, adjustments.highlights(), adjustments.shadows());
        image = applyWhitesBlacks(image, adjustments.whites(), adjustments.blacks());
        image = applySaturationVibrance(image, adjustments.saturation(), adjustments.vibrance());
        image = applyTemperatureTint(image, adjustments.temperature(), adjustments.tint());
        image = applyToneCurve(image, adjustments.toneCurve());
        image = applyColorGrading(image, adjustments.colorGrading());
        image = applyHsl(image, adjustments.hsl());
        image = applySharpening(image, adjustments.sharpening());
        image = applyNoiseReduction(image, adjustments.noiseReduction());
        image = applyClarity(image, adjustments.clarity());
        image = applyVignette(image, adjustments.vignette());
        image = applyDehaze(image, adjustments.dehaze());
        image = applyLensCorrections(image, adjustments.lensCorrections());
        image = applySplitToning(image, adjustments.splitToning());
        return image;
    }

    private BufferedImage applyExposure(BufferedImage image, double exposure) {
        if (exposure == 0) {
            return image;
        }
        return backend.gamma(image, Math.pow(2.0, exposure));
    }

    private BufferedImage applyContrast(BufferedImage image, double contrast) {
        if (contrast == 0) {
            return image;
        }
        return backend.linear(image, 1.0 + contrast / 100.0, 0.0);
    }

    private BufferedImage applyHighlightsShadows(BufferedImage image, double highlights, double shadows) {
        if (highlights == 0 && shadows == 0) {
            return image;
        }
        return backend.modulate(image, Modulation.brightness(1.0 + (shadows - highlights) / 200.0));
    }

    private BufferedImage applyWhitesBlacks(BufferedImage image, double whites, double blacks) {
        if (whites == 0 && blacks == 0) {
            return image;
        }
        return backend.linear(image, 1.0 + whites / 100.0 * 0.5, blacks / 100.0 * 10.0);
    }

    private BufferedImage applySaturationVibrance(BufferedImage image, double saturation, double vibrance) {
        if (saturation == 0 && vibrance == 0) {
            return image;
        }
        return backend.modulate(image, Modulation.saturation(1.0 + (saturation + vibrance) / 200.0));
    }

    private BufferedImage applyTemperatureTint(BufferedImage image, double temperature, double tint) {
        if (temperature == 0 && tint == 0) {
            return image;
        }
        double shift = (temperature / 1000.0) * 0.5 + (tint / 1000.0) * 0.3;
        return backend.modulate(image, Modulation.hue(shift * 180.0));
    }

    // Only highlights and shadows have a pixel effect; the other curve points are carried as data.
    private BufferedImage applyToneCurve(BufferedImage image, ToneCurve toneCurve) {
        if (toneCurve == null) {
            return image;
        }

        BufferedImage result = image;
        if (toneCurve.highlights() != 0) {
            result = backend.linear(result, 1.0 + toneCurve.highlights() / 200.0, 0.0);
        }
        if (toneCurve.shadows() != 0) {
            result = backend.modulate(result, Modulation.brightness(1.0 + toneCurve.shadows() / 200.0));
        }
        return result;
    }

    private BufferedImage applyColorGrading(BufferedImage image, ColorGrading colorGrading) {
        if (colorGrading == null) {
            return image;
        }

        ColorGradeZone shadows = colorGrading.shadows();
        if (shadows.isNeutral()) {
            return image;
        }
        return backend.modulate(image, zoneModulation(shadows.hue(), shadows.saturation(), shadows.luminance()));
    }

    private BufferedImage applyHsl(BufferedImage image, HslAdjustments hsl) {
        if (hsl == null) {
            return image;
        }

        BufferedImage result = image;
        for (HueFamily family : HueFamily.values()) {
            HslChannel channel = hsl.channel(family);
            if (channel == null || channel.isNeutral()) {
                continue;
            }
            result = backend.modulate(
                    result,
                    zoneModulation(channel.hue(), channel.saturation(), channel.luminance()));
        }
        return result;
    }

    private BufferedImage applySharpening(BufferedImage image, double sharpening) {
        if (sharpening <= 0) {
            return image;
        }
        return backend.sharpen(image, 1.0, sharpening / 100.0);
    }

    private BufferedImage applyNoiseReduction(BufferedImage image, double noiseReduction) {
        if (noiseReduction <= 0) {
            return image;
        }

        double strength = noiseReduction / 100.0;
        if (strength > 0.5) {
            return backend.median(image, (int) Math.max(1, Math.round(strength * 3.0)));
        }
        return backend.blur(image, strength * 2.0);
    }

    private BufferedImage applyClarity(BufferedImage image, double clarity) {
        if (clarity > 0) {
            return backend.sharpen(image, 3.0, clarity / 100.0);
        }
        if (clarity < 0) {
            return backend.blur(image, Math.abs(clarity) / 100.0 * 0.5);
        }
        return image;
    }

    private BufferedImage applyVignette(BufferedImage image, double vignette) {
        if (vignette == 0) {
            return image;
        }

        double strength = Math.abs(vignette) / 100.0;
        double brightness = vignette > 0 ? 1.0 - strength * 0.4 : 1.0 + strength * 0.3;
        return backend.modulate(image, Modulation.brightness(brightness));
    }

    private BufferedImage applyDehaze(BufferedImage image, double dehaze) {
        if (dehaze == 0) {
            return image;
        }

        double strength = dehaze / 100.0;
        if (strength > 0) {
            BufferedImage modulated = backend.modulate(
                    image,
                    new Modulation(1.0 + strength * 0.1, 1.0 + strength * 0.2, 0.0));
            return backend.linear(modulated, 1.0 + strength * 0.3, 0.0);
        }

        double magnitude = Math.abs(strength);
        BufferedImage modulated = backend.modulate(
                image,
                new Modulation(1.0 - magnitude * 0.1, 1.0 - magnitude * 0.3, 0.0));
        return backend.linear(modulated, 1.0 - magnitude * 0.2, magnitude * 20.0);
    }

    private BufferedImage applyLensCorrections(BufferedImage image, LensCorrections lensCorrections) {
        if (lensCorrections == null) {
            return image;
        }

        if (lensCorrections.chromaticAberration() != 0 || lensCorrections.distortion() != 0) {
            logger.debug(
                    "Lens correction chromaticAberration={} distortion={} has no pixel effect",
                    lensCorrections.chromaticAberration(),
                    lensCorrections.distortion());
        }

        if (lensCorrections.vignetting() != 0) {
            return applyVignette(image, -lensCorrections.vignetting());
        }
        return image;
    }

    private BufferedImage applySplitToning(BufferedImage image, SplitToning splitToning) {
        if (splitToning == null) {
            return image;
        }

        double highlightHue = splitToning.highlights().hue();
        double shadowHue = splitToning.shadows().hue();
        if (highlightHue == 0 && shadowHue == 0) {
            return image;
        }
        return backend.modulate(image, Modulation.hue((highlightHue + shadowHue) * 0.05));
    }

    private static Modulation zoneModulation(double hue, double saturation, double luminance) {
        return new Modulation(1.0 + luminance / 100.0, 1.0 + saturation / 100.0, hue * 0.1);
    }
}
