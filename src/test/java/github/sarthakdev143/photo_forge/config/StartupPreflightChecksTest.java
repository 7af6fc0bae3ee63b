package github.sarthakdev143.photo_forge.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StartupPreflightChecksTest {

    @TempDir
    Path tempDir;

    @Test
    void createsMissingDefaultOutputDirectory() {
        Path outputDirectory = tempDir.resolve("exports/default");
        PhotoForgeProperties properties = new PhotoForgeProperties();
        properties.setDefaultOutputDirectory(outputDirectory.toString());

        new StartupPreflightChecks(properties).run(new DefaultApplicationArguments());

        assertThat(outputDirectory).isDirectory();
    }

    @Test
    void failsWhenDefaultOutputDirectoryCannotBeCreated() throws Exception {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "file");
        PhotoForgeProperties properties = new PhotoForgeProperties();
        properties.setDefaultOutputDirectory(blocker.resolve("exports").toString());

        assertThatThrownBy(() -> new StartupPreflightChecks(properties).run(new DefaultApplicationArguments()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("photo-forge.default-output-directory");
    }

    @Test
    void passesWithoutConfiguredDirectory() {
        new StartupPreflightChecks(new PhotoForgeProperties()).run(new DefaultApplicationArguments());
    }
}
