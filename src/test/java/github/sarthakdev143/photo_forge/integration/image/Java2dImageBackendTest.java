package github.sarthakdev143.photo_forge.integration.image;

import github.sarthakdev143.photo_forge.exception.ImageDecodeException;
import github.sarthakdev143.photo_forge.exception.UnsupportedExportFormatException;
import github.sarthakdev143.photo_forge.model.ExportFormat;
import github.sarthakdev143.photo_forge.model.FitMode;
import github.sarthakdev143.photo_forge.model.Modulation;
import github.sarthakdev143.photo_forge.service.impl.RawFormatCatalog;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assumptions.assumeFalse;

class Java2dImageBackendTest {

    private final Java2dImageBackend backend = new Java2dImageBackend(new RawFormatCatalog());

    @TempDir
    Path tempDir;

    @Test
    void gammaOfOneLeavesPixelsUnchanged() {
        BufferedImage source = gradient(16, 8);

        BufferedImage result = backend.gamma(source, 1.0);

        assertThat(pixels(result)).isEqualTo(pixels(source));
        assertThat(result).isNotSameAs(source);
    }

    @Test
    void gammaAboveOneBrightensMidtones() {
        BufferedImage source = solid(4, 4, 0xFF808080);

        BufferedImage result = backend.gamma(source, 2.0);

        // 255 * (128 / 255)^(1 / 2) = 180.6
        assertThat(red(result.getRGB(0, 0))).isEqualTo(181);
    }

    @Test
    void linearAppliesMultiplierAndOffsetWithClamping() {
        BufferedImage source = solid(2, 2, 0xFF64C832);

        BufferedImage result = backend.linear(source, 1.5, 10.0);

        int pixel = result.getRGB(1, 1);
        assertThat(red(pixel)).isEqualTo(160);
        assertThat(green(pixel)).isEqualTo(255);
        assertThat(blue(pixel)).isEqualTo(85);
    }

    @Test
    void operationsNeverTouchAlphaOrTheSourceImage() {
        BufferedImage source = new BufferedImage(3, 3, BufferedImage.TYPE_INT_ARGB);
        source.setRGB(1, 1, 0x40FF8000);
        int[] before = pixels(source);

        BufferedImage result = backend.linear(source, 0.5, 0.0);

        assertThat(result.getRGB(1, 1) >>> 24).isEqualTo(0x40);
        assertThat(pixels(source)).isEqualTo(before);
    }

    @Test
    void modulateBrightnessScalesValue() {
        BufferedImage source = solid(2, 2, 0xFF808080);

        BufferedImage result = backend.modulate(source, Modulation.brightness(0.5));

        assertThat(red(result.getRGB(0, 0))).isBetween(63, 65);
    }

    @Test
    void modulateZeroSaturationProducesGrey() {
        BufferedImage source = solid(2, 2, 0xFFFF0000);

        int pixel = backend.modulate(source, Modulation.saturation(0.0)).getRGB(0, 0);

        assertThat(red(pixel)).isEqualTo(green(pixel)).isEqualTo(blue(pixel));
    }

    @Test
    void blurOfUniformImageIsUnchanged() {
        BufferedImage source = solid(9, 9, 0xFF336699);

        assertThat(pixels(backend.blur(source, 2.0))).isEqualTo(pixels(source));
    }

    @Test
    void sharpenOfUniformImageIsUnchanged() {
        BufferedImage source = solid(9, 9, 0xFF336699);

        assertThat(pixels(backend.sharpen(source, 1.0, 0.8))).isEqualTo(pixels(source));
    }

    @Test
    void medianRemovesIsolatedImpulse() {
        BufferedImage source = solid(5, 5, 0xFF000000);
        source.setRGB(2, 2, 0xFFFFFFFF);

        BufferedImage result = backend.median(source, 1);

        assertThat(result.getRGB(2, 2)).isEqualTo(0xFF000000);
    }

    @Test
    void resizeInsideKeepsAspectRatioAndNeverEnlarges() throws Exception {
        BufferedImage source = gradient(400, 200);

        BufferedImage shrunk = backend.resize(source, 100, 100, FitMode.INSIDE);
        BufferedImage untouched = backend.resize(source, 1000, 1000, FitMode.INSIDE);

        assertThat(shrunk.getWidth()).isEqualTo(100);
        assertThat(shrunk.getHeight()).isEqualTo(50);
        assertThat(untouched.getWidth()).isEqualTo(400);
        assertThat(untouched.getHeight()).isEqualTo(200);
    }

    @Test
    void resizeCoverProducesExactBox() throws Exception {
        BufferedImage result = backend.resize(gradient(400, 200), 100, 100, FitMode.COVER);

        assertThat(result.getWidth()).isEqualTo(100);
        assertThat(result.getHeight()).isEqualTo(100);
    }

    @Test
    void resizeWithOnlyWidthFollowsAspectRatio() throws Exception {
        BufferedImage result = backend.resize(gradient(400, 200), 200, null, FitMode.INSIDE);

        assertThat(result.getWidth()).isEqualTo(200);
        assertThat(result.getHeight()).isEqualTo(100);
    }

    @Test
    void encodePngIsLossless() throws Exception {
        BufferedImage source = gradient(32, 16);

        byte[] encoded = backend.encode(source, ExportFormat.PNG, 90);
        BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(encoded));

        assertThat(decoded.getWidth()).isEqualTo(32);
        for (int x = 0; x < 32; x++) {
            assertThat(decoded.getRGB(x, 3) & 0xFFFFFF).isEqualTo(source.getRGB(x, 3) & 0xFFFFFF);
        }
    }

    @Test
    void encodeJpegDropsAlphaAndHonoursQuality() throws Exception {
        BufferedImage source = new BufferedImage(64, 64, BufferedImage.TYPE_INT_ARGB);
        for (int y = 0; y < 64; y++) {
            for (int x = 0; x < 64; x++) {
                source.setRGB(x, y, 0x80000000 | (x * 4 << 16) | (y * 4 << 8) | ((x ^ y) & 0xFF));
            }
        }

        byte[] low = backend.encode(source, ExportFormat.JPEG, 10);
        byte[] high = backend.encode(source, ExportFormat.JPEG, 100);

        assertThat(ImageIO.read(new ByteArrayInputStream(high))).isNotNull();
        assertThat(low.length).isLessThan(high.length);
    }

    @Test
    void encodeTiffWritesReadableImage() throws Exception {
        byte[] encoded = backend.encode(gradient(8, 8), ExportFormat.TIFF, 90);

        assertThat(ImageIO.read(new ByteArrayInputStream(encoded)).getWidth()).isEqualTo(8);
    }

    @Test
    void encodeWebpWithoutWriterIsRejected() {
        assumeFalse(ImageIO.getImageWritersByFormatName("webp").hasNext());

        assertThatThrownBy(() -> backend.encode(gradient(4, 4), ExportFormat.WEBP, 80))
                .isInstanceOf(UnsupportedExportFormatException.class)
                .hasMessageContaining("webp");
    }

    @Test
    void decodeNormalisesAndWriteRoundTrips() throws Exception {
        Path target = tempDir.resolve("out.png");

        backend.write(backend.encode(gradient(10, 5), ExportFormat.PNG, 90), target);
        BufferedImage decoded = backend.decode(target);

        assertThat(decoded.getType()).isIn(BufferedImage.TYPE_INT_RGB, BufferedImage.TYPE_INT_ARGB);
        assertThat(decoded.getWidth()).isEqualTo(10);
        assertThat(decoded.getHeight()).isEqualTo(5);
    }

    @Test
    void decodeRejectsNonImageFiles() throws Exception {
        Path notAnImage = Files.writeString(tempDir.resolve("notes.jpg"), "not an image");

        assertThatThrownBy(() -> backend.decode(notAnImage))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageContaining("notes.jpg");
    }

    @Test
    void decodeReportsMissingRawDecoder() throws Exception {
        Path raw = Files.write(tempDir.resolve("IMG_0001.CR2"), new byte[]{1, 2, 3, 4});

        assertThatThrownBy(() -> backend.decode(raw))
                .isInstanceOf(ImageDecodeException.class)
                .hasMessageContaining("RAW");
    }

    @Test
    void decodeOfMissingFileFails() {
        assertThatThrownBy(() -> backend.decode(tempDir.resolve("missing.png")))
                .isInstanceOf(ImageDecodeException.class);
    }

    static BufferedImage gradient(int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int r = (x * 255) / Math.max(1, width - 1);
                int g = (y * 255) / Math.max(1, height - 1);
                int b = (x * 7 + y * 13) & 0xFF;
                image.setRGB(x, y, 0xFF000000 | (r << 16) | (g << 8) | b);
            }
        }
        return image;
    }

    static BufferedImage solid(int width, int height, int argb) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, argb);
            }
        }
        return image;
    }

    private static int[] pixels(BufferedImage image) {
        return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
    }

    private static int red(int argb) {
        return (argb >> 16) & 0xFF;
    }

    private static int green(int argb) {
        return (argb >> 8) & 0xFF;
    }

    private static int blue(int argb) {
        return argb & 0xFF;
    }
}
