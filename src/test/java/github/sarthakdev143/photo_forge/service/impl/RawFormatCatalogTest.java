package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.RawProcessingSettings;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class RawFormatCatalogTest {

    private final RawFormatCatalog catalog = new RawFormatCatalog();

    @Test
    void recognisesRawExtensionsCaseInsensitively() {
        assertThat(catalog.isRawFile(Path.of("/shots/IMG_0001.CR2"))).isTrue();
        assertThat(catalog.isRawFile(Path.of("DSC_1234.nef"))).isTrue();
        assertThat(catalog.isRawFile(Path.of("scan.dng"))).isTrue();
        assertThat(catalog.isRawFile(Path.of("photo.jpg"))).isFalse();
        assertThat(catalog.isRawFile(Path.of("no-extension"))).isFalse();
    }

    @Test
    void supportedFormatsAreSortedAndDistinct() {
        assertThat(catalog.supportedFormats())
                .isSorted()
                .doesNotHaveDuplicates()
                .contains(".cr3", ".arw", ".raf", ".x3f");
    }

    @Test
    void cameraMakeSelectsDemosaicingProfile() {
        RawProcessingSettings canon = catalog.defaultSettingsForCamera("Canon");
        RawProcessingSettings sony = catalog.defaultSettingsForCamera(" sony ");

        assertThat(canon.demosaicing()).isEqualTo("DCB");
        assertThat(canon.sharpeningAmount()).isEqualTo(40);
        assertThat(sony.demosaicing()).isEqualTo("VNG");
        assertThat(sony.sharpeningAmount()).isEqualTo(45);
        assertThat(catalog.defaultSettingsForCamera("fujifilm").demosaicing()).isEqualTo("AMaZE");
        assertThat(catalog.defaultSettingsForCamera("nikon").sharpeningAmount()).isEqualTo(35);
    }

    @Test
    void unknownCameraGetsDefaults() {
        assertThat(catalog.defaultSettingsForCamera("Leica")).isEqualTo(RawProcessingSettings.defaults());
        assertThat(catalog.defaultSettingsForCamera(null)).isEqualTo(RawProcessingSettings.defaults());
    }
}
