package github.sarthakdev143.photo_forge.config;

import github.sarthakdev143.photo_forge.model.ExportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Set;

@Component
@ConditionalOnProperty(name = "photo-forge.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final Set<ExportFormat> REQUIRED_WRITERS = EnumSet.of(ExportFormat.JPEG, ExportFormat.PNG, ExportFormat.TIFF);

    private final PhotoForgeProperties properties;

    public StartupPreflightChecks(PhotoForgeProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkImageWriters();
        checkDefaultOutputDirectory();
    }

    private void checkImageWriters() {
        for (ExportFormat format : REQUIRED_WRITERS) {
            if (!ImageIO.getImageWritersByFormatName(format.writerFormatName()).hasNext()) {
                throw new IllegalStateException(
                        "No ImageIO writer installed for " + format.apiValue() + ". Exports in this format cannot run.");
            }
        }

        if (!ImageIO.getImageWritersByFormatName(ExportFormat.WEBP.writerFormatName()).hasNext()) {
            logger.warn("No ImageIO writer installed for webp; webp exports will fail.");
        }
    }

    private void checkDefaultOutputDirectory() {
        String configured = properties.getDefaultOutputDirectory();
        if (configured == null || configured.isBlank()) {
            return;
        }

        Path outputDirectory = Path.of(configured);
        try {
            Files.createDirectories(outputDirectory);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Default output directory cannot be created at " + outputDirectory.toAbsolutePath()
                            + ". Set photo-forge.default-output-directory to a writable path.",
                    e);
        }

        if (!Files.isWritable(outputDirectory)) {
            throw new IllegalStateException(
                    "Default output directory is not writable at " + outputDirectory.toAbsolutePath() + ".");
        }
    }
}
