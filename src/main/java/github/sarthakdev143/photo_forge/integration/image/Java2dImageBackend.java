package github.sarthakdev143.photo_forge.integration.image;

import github.sarthakdev143.photo_forge.exception.ImageDecodeException;
import github.sarthakdev143.photo_forge.exception.UnsupportedExportFormatException;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.FitMode;
import github.sarthakdev143.photo_forge.model.Modulation;
import github.sarthakdev143.photo_forge.service.ImageBackend;
import github.sarthakdev143.photo_forge.service.impl.RawFormatCatalog;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Iterator;

/**
 * {@link ImageBackend} on top of Java2D and ImageIO. Images are normalised to 8-bit
 * {@code TYPE_INT_RGB} or {@code TYPE_INT_ARGB}; alpha is carried through untouched.
 */
@Component
public class Java2dImageBackend implements ImageBackend {

    private static final Logger logger = LoggerFactory.getLogger(Java2dImageBackend.class);
    private static final double EPSILON = 1e-9;

    private final RawFormatCatalog rawFormatCatalog;

    public Java2dImageBackend(RawFormatCatalog rawFormatCatalog) {
        this.rawFormatCatalog = rawFormatCatalog;
    }

    @Override
    public BufferedImage decode(Path source) throws IOException {
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(source.toFile());
        } catch (IOException e) {
            throw new ImageDecodeException("Unable to decode " + source + ": " + e.getMessage(), e);
        }

        if (decoded == null) {
            if (rawFormatCatalog.isRawFile(source)) {
                throw new ImageDecodeException("No RAW decoder is available for " + source.getFileName());
            }
            throw new ImageDecodeException("Unsupported or corrupt image: " + source.getFileName());
        }

        logger.debug("Decoded {} ({}x{})", source, decoded.getWidth(), decoded.getHeight());
        return normalize(decoded);
    }

    @Override
    public BufferedImage gamma(BufferedImage image, double gamma) {
        if (gamma <= 0) {
            throw new IllegalArgumentException("gamma must be positive.");
        }

        int[] table = new int[256];
        for (int value = 0; value < table.length; value++) {
            table[value] = clampChannel(255.0 * Math.pow(value / 255.0, 1.0 / gamma));
        }
        return applyLookupTable(image, table);
    }

    @Override
    public BufferedImage linear(BufferedImage image, double multiplier, double offset) {
        int[] table = new int[256];
        for (int value = 0; value < table.length; value++) {
            table[value] = clampChannel(multiplier * value + offset);
        }
        return applyLookupTable(image, table);
    }

    @Override
    public BufferedImage modulate(BufferedImage image, Modulation modulation) {
        if (modulation.isIdentity()) {
            return copy(image);
        }

        int[] pixels = pixels(image);
        float hueShift = (float) (modulation.hueDegrees() / 360.0);
        float[] hsb = new float[3];
        for (int index = 0; index < pixels.length; index++) {
            int argb = pixels[index];
            Color.RGBtoHSB((argb >> 16) & 0xFF, (argb >> 8) & 0xFF, argb & 0xFF, hsb);
            float hue = hsb[0] + hueShift;
            hue -= (float) Math.floor(hue);
            float saturation = clampUnit(hsb[1] * modulation.saturation());
            float brightness = clampUnit(hsb[2] * modulation.brightness());
            int rgb = Color.HSBtoRGB(hue, saturation, brightness) & 0x00FFFFFF;
            pixels[index] = (argb & 0xFF000000) | rgb;
        }
        return fromPixels(image, pixels);
    }

    @Override
    public BufferedImage sharpen(BufferedImage image, double sigma, double amount) {
        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = pixels(image);
        int[] blurred = gaussian(pixels, width, height, sigma);

        int[] sharpened = new int[pixels.length];
        for (int index = 0; index < pixels.length; index++) {
            int original = pixels[index];
            int soft = blurred[index];
            int red = unsharp((original >> 16) & 0xFF, (soft >> 16) & 0xFF, amount);
            int green = unsharp((original >> 8) & 0xFF, (soft >> 8) & 0xFF, amount);
            int blue = unsharp(original & 0xFF, soft & 0xFF, amount);
            sharpened[index] = (original & 0xFF000000) | (red << 16) | (green << 8) | blue;
        }
        return fromPixels(image, sharpened);
    }

    @Override
    public BufferedImage blur(BufferedImage image, double sigma) {
        if (sigma <= EPSILON) {
            return copy(image);
        }
        return fromPixels(image, gaussian(pixels(image), image.getWidth(), image.getHeight(), sigma));
    }

    @Override
    public BufferedImage median(BufferedImage image, int radius) {
        if (radius < 1) {
            return copy(image);
        }

        int width = image.getWidth();
        int height = image.getHeight();
        int[] pixels = pixels(image);
        int[] filtered = new int[pixels.length];
        int windowSize = (2 * radius + 1) * (2 * radius + 1);
        int[] reds = new int[windowSize];
        int[] greens = new int[windowSize];
        int[] blues = new int[windowSize];

        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int count = 0;
                for (int dy = -radius; dy <= radius; dy++) {
                    int sampleY = clampIndex(y + dy, height);
                    for (int dx = -radius; dx <= radius; dx++) {
                        int sample = pixels[sampleY * width + clampIndex(x + dx, width)];
                        reds[count] = (sample >> 16) & 0xFF;
                        greens[count] = (sample >> 8) & 0xFF;
                        blues[count] = sample & 0xFF;
                        count++;
                    }
                }
                Arrays.sort(reds);
                Arrays.sort(greens);
                Arrays.sort(blues);
                int middle = windowSize / 2;
                int alpha = pixels[y * width + x] & 0xFF000000;
                filtered[y * width + x] = alpha | (reds[middle] << 16) | (greens[middle] << 8) | blues[middle];
            }
        }
        return fromPixels(image, filtered);
    }

    @Override
    public BufferedImage resize(BufferedImage image, Integer width, Integer height, FitMode fit) throws IOException {
        if (width == null && height == null) {
            return copy(image);
        }

        int sourceWidth = image.getWidth();
        int sourceHeight = image.getHeight();
        double scaleX = width == null ? Double.NaN : width / (double) sourceWidth;
        double scaleY = height == null ? Double.NaN : height / (double) sourceHeight;
        FitMode mode = fit == null ? FitMode.INSIDE : fit;

        if (width == null || height == null) {
            double scale = width == null ? scaleY : scaleX;
            if (scale >= 1.0) {
                return copy(image);
            }
            return Thumbnails.of(image).scale(scale).imageType(image.getType()).asBufferedImage();
        }

        switch (mode) {
            case FILL -> {
                if (scaleX >= 1.0 && scaleY >= 1.0) {
                    return copy(image);
                }
                return Thumbnails.of(image)
                        .forceSize(Math.min(width, sourceWidth), Math.min(height, sourceHeight))
                        .imageType(image.getType())
                        .asBufferedImage();
            }
            case COVER -> {
                if (Math.max(scaleX, scaleY) >= 1.0) {
                    return copy(image);
                }
                return Thumbnails.of(image)
                        .size(width, height)
                        .crop(Positions.CENTER)
                        .imageType(image.getType())
                        .asBufferedImage();
            }
            case OUTSIDE -> {
                double scale = Math.max(scaleX, scaleY);
                if (scale >= 1.0) {
                    return copy(image);
                }
                return Thumbnails.of(image).scale(scale).imageType(image.getType()).asBufferedImage();
            }
            default -> {
                if (Math.min(scaleX, scaleY) >= 1.0) {
                    return copy(image);
                }
                return Thumbnails.of(image)
                        .size(width, height)
                        .keepAspectRatio(true)
                        .imageType(image.getType())
                        .asBufferedImage();
            }
        }
    }

    @Override
    public byte[] encode(BufferedImage image, ExportFormat format, int quality) throws IOException {
        Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName(format.writerFormatName());
        if (!writers.hasNext()) {
            throw new UnsupportedExportFormatException("No image writer available for format " + format.apiValue());
        }

        ImageWriter writer = writers.next();
        BufferedImage output = format.supportsAlpha() ? image : withoutAlpha(image);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (ImageOutputStream stream = ImageIO.createImageOutputStream(bytes)) {
            writer.setOutput(stream);
            writer.write(null, new IIOImage(output, null, null), writeParam(writer, format, quality));
        } finally {
            writer.dispose();
        }
        return bytes.toByteArray();
    }

    @Override
    public void write(byte[] encoded, Path target) throws IOException {
        Files.write(target, encoded);
        logger.debug("Wrote {} bytes to {}", encoded.length, target);
    }

    private ImageWriteParam writeParam(ImageWriter writer, ExportFormat format, int quality) {
        ImageWriteParam param = writer.getDefaultWriteParam();
        switch (format) {
            case JPEG -> {
                param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                param.setCompressionQuality(quality / 100f);
                if (param.canWriteProgressive()) {
                    param.setProgressiveMode(ImageWriteParam.MODE_DEFAULT);
                }
            }
            case TIFF -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionType("LZW");
                }
            }
            case WEBP -> {
                if (param.canWriteCompressed()) {
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionQuality(quality / 100f);
                }
            }
            case PNG -> {
                // lossless, writer defaults
            }
        }
        return param;
    }

    private BufferedImage normalize(BufferedImage decoded) {
        int type = decoded.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        if (decoded.getType() == type) {
            return decoded;
        }

        BufferedImage converted = new BufferedImage(decoded.getWidth(), decoded.getHeight(), type);
        Graphics2D graphics = converted.createGraphics();
        try {
            graphics.drawImage(decoded, 0, 0, null);
        } finally {
            graphics.dispose();
        }
        return converted;
    }

    private BufferedImage withoutAlpha(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }

        int[] pixels = pixels(image);
        for (int index = 0; index < pixels.length; index++) {
            pixels[index] = pixels[index] | 0xFF000000;
        }
        BufferedImage opaque = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_RGB);
        opaque.setRGB(0, 0, image.getWidth(), image.getHeight(), pixels, 0, image.getWidth());
        return opaque;
    }

    private BufferedImage applyLookupTable(BufferedImage image, int[] table) {
        int[] pixels = pixels(image);
        for (int index = 0; index < pixels.length; index++) {
            int argb = pixels[index];
            pixels[index] = (argb & 0xFF000000)
                    | (table[(argb >> 16) & 0xFF] << 16)
                    | (table[(argb >> 8) & 0xFF] << 8)
                    | table[argb & 0xFF];
        }
        return fromPixels(image, pixels);
    }

    /**
     * Separable Gaussian over the colour channels with clamped edges; alpha is copied from the source.
     */
    private int[] gaussian(int[] pixels, int width, int height, double sigma) {
        double[] kernel = gaussianKernel(sigma);
        int radius = kernel.length / 2;
        double[][] planes = new double[3][pixels.length];
        double[][] pass = new double[3][pixels.length];

        for (int index = 0; index < pixels.length; index++) {
            planes[0][index] = (pixels[index] >> 16) & 0xFF;
            planes[1][index] = (pixels[index] >> 8) & 0xFF;
            planes[2][index] = pixels[index] & 0xFF;
        }

        for (int channel = 0; channel < 3; channel++) {
            double[] source = planes[channel];
            double[] horizontal = pass[channel];
            for (int y = 0; y < height; y++) {
                int row = y * width;
                for (int x = 0; x < width; x++) {
                    double sum = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        sum += kernel[k + radius] * source[row + clampIndex(x + k, width)];
                    }
                    horizontal[row + x] = sum;
                }
            }
            for (int y = 0; y < height; y++) {
                for (int x = 0; x < width; x++) {
                    double sum = 0.0;
                    for (int k = -radius; k <= radius; k++) {
                        sum += kernel[k + radius] * horizontal[clampIndex(y + k, height) * width + x];
                    }
                    source[y * width + x] = sum;
                }
            }
        }

        int[] result = new int[pixels.length];
        for (int index = 0; index < pixels.length; index++) {
            result[index] = (pixels[index] & 0xFF000000)
                    | (clampChannel(planes[0][index]) << 16)
                    | (clampChannel(planes[1][index]) << 8)
                    | clampChannel(planes[2][index]);
        }
        return result;
    }

    private double[] gaussianKernel(double sigma) {
        int radius = Math.max(1, (int) Math.ceil(3.0 * sigma));
        double[] kernel = new double[2 * radius + 1];
        double sum = 0.0;
        for (int offset = -radius; offset <= radius; offset++) {
            double weight = Math.exp(-(offset * offset) / (2.0 * sigma * sigma));
            kernel[offset + radius] = weight;
            sum += weight;
        }
        for (int index = 0; index < kernel.length; index++) {
            kernel[index] /= sum;
        }
        return kernel;
    }

    private int unsharp(int original, int blurred, double amount) {
        return clampChannel(original + amount * (original - blurred));
    }

    private int[] pixels(BufferedImage image) {
        return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
    }

    private BufferedImage fromPixels(BufferedImage template, int[] pixels) {
        BufferedImage result = new BufferedImage(template.getWidth(), template.getHeight(), imageType(template));
        result.setRGB(0, 0, template.getWidth(), template.getHeight(), pixels, 0, template.getWidth());
        return result;
    }

    private BufferedImage copy(BufferedImage image) {
        return fromPixels(image, pixels(image));
    }

    private int imageType(BufferedImage image) {
        return image.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private static int clampIndex(int index, int length) {
        return Math.max(0, Math.min(length - 1, index));
    }

    private static int clampChannel(double value) {
        return (int) Math.max(0, Math.min(255, Math.round(value)));
    }

    private static float clampUnit(double value) {
        return (float) Math.max(0.0, Math.min(1.0, value));
    }
}
