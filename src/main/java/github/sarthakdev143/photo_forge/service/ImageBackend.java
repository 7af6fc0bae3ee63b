package github.sarthakdev143.photo_forge.service;

import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.FitMode;
import github.sarthakdev143.photo_forge.model.Modulation;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Pixel primitives the adjustment pipeline and the exporter are composed from.
 * <p>
 * Implementations must be stateless: every operation returns a new image and never modifies its
 * argument, so concurrent callers need no coordination.
 */
public interface ImageBackend {

    BufferedImage decode(Path source) throws IOException;

    /**
     * Gamma correction, {@code v' = 255 * (v / 255)^(1 / gamma)}. Values above 1 brighten.
     */
    BufferedImage gamma(BufferedImage image, double gamma);

    /**
     * Per-channel {@code v' = multiplier * v + offset}.
     */
    BufferedImage linear(BufferedImage image, double multiplier, double offset);

    BufferedImage modulate(BufferedImage image, Modulation modulation);

    /**
     * Unsharp mask with a Gaussian of {@code sigma} scaled by {@code amount}.
     */
    BufferedImage sharpen(BufferedImage image, double sigma, double amount);

    BufferedImage blur(BufferedImage image, double sigma);

    BufferedImage median(BufferedImage image, int radius);

    /**
     * Fits the image into the requested box without enlarging it. Either dimension may be
     * {@code null}, in which case it follows the aspect ratio.
     */
    BufferedImage resize(BufferedImage image, Integer width, Integer height, FitMode fit) throws IOException;

    byte[] encode(BufferedImage image, ExportFormat format, int quality) throws IOException;

    void write(byte[] encoded, Path target) throws IOException;
}
