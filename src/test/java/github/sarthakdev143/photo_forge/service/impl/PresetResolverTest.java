package github.sarthakdev143.photo_forge.service.impl;

import github.sarthakdev143.photo_forge.model.AdjustmentOverrides;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.PhotoPreset;
import github.sarthakdev143.photo_forge.model.PresetCategory;
import github.sarthakdev143.photo_forge.model.SplitToning;
import github.sarthakdev143.photo_forge.model.ToneTint;
import github.sarthakdev143.photo_forge.service.PresetService;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PresetResolverTest {

    @Mock
    private PresetService presetService;

    @Test
    void mergeReplacesOnlyNonNullMembers() {
        AdjustmentSet base = AdjustmentSet.builder()
                .exposure(1.0)
                .contrast(10)
                .splitToning(new SplitToning(new ToneTint(10, 10), null, 5))
                .build();
        SplitToning presetToning = new SplitToning(new ToneTint(45, 15), new ToneTint(220, 10), 0);
        AdjustmentOverrides overrides = AdjustmentOverrides.builder()
                .contrast(30.0)
                .splitToning(presetToning)
                .build();

        AdjustmentSet merged = PresetResolver.merge(base, overrides);

        assertThat(merged.exposure()).isEqualTo(1.0);
        assertThat(merged.contrast()).isEqualTo(30.0);
        assertThat(merged.splitToning()).isEqualTo(presetToning);
    }

    @Test
    void mergeWithoutOverridesReturnsBase() {
        AdjustmentSet base = AdjustmentSet.builder().vignette(-20).build();

        assertThat(PresetResolver.merge(base, null)).isEqualTo(base);
        assertThat(PresetResolver.merge(null, AdjustmentOverrides.empty())).isEqualTo(AdjustmentSet.identity());
    }

    @Test
    void resolveLooksUpPreset() {
        when(presetService.getPreset("vintage-film")).thenReturn(Optional.of(new PhotoPreset(
                "vintage-film",
                "Vintage Film",
                null,
                PresetCategory.VINTAGE,
                AdjustmentOverrides.builder().exposure(-0.2).build(),
                "PhotoEdit Pro",
                Instant.EPOCH)));

        Optional<AdjustmentSet> resolved = new PresetResolver(presetService)
                .resolve(AdjustmentSet.identity(), "vintage-film");

        assertThat(resolved).map(AdjustmentSet::exposure).contains(-0.2);
    }

    @Test
    void resolveBlankIdSkipsLookup() {
        assertThat(new PresetResolver(presetService).resolve(AdjustmentSet.identity(), " ")).isEmpty();

        verifyNoInteractions(presetService);
    }
}
