package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.ExportOptions;
import github.sarthakdev143.photo_forge.service.ImageBackend;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Resizes (never enlarging) and encodes an edited image according to {@link ExportOptions}.
 */
@Component
public class ExportEncoder {

    private final ImageBackend backend;

    public ExportEncoder(ImageBackend backend) {
        this.backend = backend;
    }

    public byte[] encode(BufferedImage image, ExportOptions options) throws IOException {
        BufferedImage output = image;
        if (options.hasResize()) {
            output = backend.resize(image, options.width(), options.height(), options.fit());
        }
        return backend.encode(output, options.format(), options.quality());
    }

    public void export(BufferedImage image, ExportOptions options, Path target) throws IOException {
        backend.write(encode(image, options), target);
    }
}
