package github.sarthakdev143.photo_forge.service.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.photo_forge.model.AdjustmentOverrides;
import github.sarthakdev143.photo_forge.model.AdjustmentSet;
import github.sarthakdev143.photo_forge.model.CategorySummary;
import github.sarthakdev143.photo_forge.model.ColorGradeZone;
import github.sarthakdev143.photo_forge.model.ColorGrading;
import github.sarthakdev143.photo_forge.model.PhotoPreset;
import github.sarthakdev143.photo_forge.model.PresetCategory;
import github.sarthakdev143.photo_forge.model.SplitToning;
import github.sarthakdev143.photo_forge.model.ToneTint;
import github.sarthakdev143.photo_forge.service.PresetService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
public class DefaultPresetService implements PresetService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultPresetService.class);
    static final String BUILT_IN_AUTHOR = "PhotoEdit Pro";
    static final String CUSTOM_AUTHOR = "User";

    private final ObjectMapper objectMapper;
    private final Map<String, PhotoPreset> presets = new LinkedHashMap<>();

    public DefaultPresetService(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        Instant now = Instant.now();
        for (PhotoPreset preset : builtInPresets(now)) {
            presets.put(preset.id(), preset);
        }
    }

    @Override
    public synchronized List<PhotoPreset> getAllPresets() {
        return List.copyOf(presets.values());
    }

    @Override
    public synchronized List<PhotoPreset> getPresetsByCategory(PresetCategory category) {
        return presets.values().stream()
                .filter(preset -> preset.category() == category)
                .toList();
    }

    @Override
    public synchronized Optional<PhotoPreset> getPreset(String presetId) {
        if (presetId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(presets.get(presetId));
    }

    @Override
    public synchronized PhotoPreset createCustomPreset(
            String name,
            String description,
            PresetCategory category,
            AdjustmentOverrides adjustments) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Preset name is required.");
        }
        if (category == null) {
            throw new IllegalArgumentException("category is required.");
        }

        Instant now = Instant.now();
        PhotoPreset preset = new PhotoPreset(
                newCustomId(now),
                name,
                description,
                category,
                adjustments,
                CUSTOM_AUTHOR,
                now);
        presets.put(preset.id(), preset);
        logger.info("Created custom preset {} name={} category={}", preset.id(), name, category.apiValue());
        return preset;
    }

    @Override
    public PhotoPreset createPresetFromAdjustments(
            AdjustmentSet adjustments,
            String name,
            String description,
            PresetCategory category) {
        AdjustmentSet source = adjustments == null ? AdjustmentSet.identity() : adjustments;
        return createCustomPreset(name, description, category, AdjustmentOverrides.nonDefault(source));
    }

    @Override
    public synchronized boolean updatePreset(
            String presetId,
            String name,
            String description,
            PresetCategory category,
            AdjustmentOverrides adjustments) {
        PhotoPreset current = presetId == null ? null : presets.get(presetId);
        if (current == null) {
            logger.warn("Preset update ignored, unknown preset {}", presetId);
            return false;
        }

        PhotoPreset updated = new PhotoPreset(
                current.id(),
                name != null ? name : current.name(),
                description != null ? description : current.description(),
                category != null ? category : current.category(),
                adjustments != null ? adjustments : current.adjustments(),
                current.author(),
                current.createdAt());
        presets.put(presetId, updated);
        return true;
    }

    @Override
    public synchronized boolean deletePreset(String presetId) {
        PhotoPreset current = presetId == null ? null : presets.get(presetId);
        if (current == null || !current.isCustom()) {
            return false;
        }

        presets.remove(presetId);
        logger.info("Deleted custom preset {}", presetId);
        return true;
    }

    @Override
    public AdjustmentSet applyPreset(AdjustmentSet currentAdjustments, String presetId) {
        AdjustmentSet base = currentAdjustments == null ? AdjustmentSet.identity() : currentAdjustments;
        return getPreset(presetId)
                .map(preset -> PresetResolver.merge(base, preset.adjustments()))
                .orElse(base);
    }

    @Override
    public String exportPresets() {
        List<PhotoPreset> customPresets;
        synchronized (this) {
            customPresets = presets.values().stream().filter(PhotoPreset::isCustom).toList();
        }

        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(customPresets);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise custom presets", e);
        }
    }

    @Override
    public boolean importPresets(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json == null ? "" : json);
        } catch (JsonProcessingException e) {
            logger.warn("Preset import rejected, malformed JSON: {}", e.getOriginalMessage());
            return false;
        }
        if (root == null || !root.isArray()) {
            logger.warn("Preset import rejected, expected a JSON array");
            return false;
        }

        List<PhotoPreset> accepted = new ArrayList<>();
        for (JsonNode entry : root) {
            if (!hasValue(entry, "name") || !hasValue(entry, "adjustments") || !hasValue(entry, "category")) {
                continue;
            }

            try {
                accepted.add(objectMapper.treeToValue(entry, PhotoPreset.class));
            } catch (JsonProcessingException | IllegalArgumentException e) {
                logger.warn("Skipping preset entry that cannot be read: {}", e.getMessage());
            }
        }

        synchronized (this) {
            for (PhotoPreset preset : accepted) {
                Instant now = Instant.now();
                PhotoPreset imported = new PhotoPreset(
                        newCustomId(now),
                        preset.name(),
                        preset.description(),
                        preset.category(),
                        preset.adjustments(),
                        preset.author() == null ? CUSTOM_AUTHOR : preset.author(),
                        now);
                presets.put(imported.id(), imported);
            }
        }

        logger.info("Imported {} preset(s), skipped {}", accepted.size(), root.size() - accepted.size());
        return true;
    }

    @Override
    public synchronized List<CategorySummary> getCategorySummary() {
        return Arrays.stream(PresetCategory.values())
                .map(category -> new CategorySummary(
                        category,
                        presets.values().stream().filter(preset -> preset.category() == category).count()))
                .toList();
    }

    private String newCustomId(Instant now) {
        String id;
        do {
            id = Identifiers.timestamped(PhotoPreset.CUSTOM_ID_PREFIX, now.toEpochMilli());
        } while (presets.containsKey(id));
        return id;
    }

    private static boolean hasValue(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        return value != null && !value.isNull() && !(value.isTextual() && value.asText().isEmpty());
    }

    private static List<PhotoPreset> builtInPresets(Instant now) {
        return List.of(
                builtIn("portrait-warm", "Warm Portrait",
                        "Warm, flattering tones for portrait photography",
                        PresetCategory.PORTRAIT,
                        AdjustmentOverrides.builder()
                                .exposure(0.3)
                                .contrast(15.0)
                                .highlights(-20.0)
                                .shadows(25.0)
                                .temperature(200.0)
                                .tint(5.0)
                                .vibrance(20.0)
                                .saturation(10.0)
                                .clarity(15.0)
                                .vignette(-15.0)
                                .build(),
                        now),
                builtIn("landscape-vivid", "Vivid Landscape",
                        "Enhanced colors and contrast for landscape photos",
                        PresetCategory.LANDSCAPE,
                        AdjustmentOverrides.builder()
                                .exposure(0.2)
                                .contrast(25.0)
                                .highlights(-30.0)
                                .shadows(20.0)
                                .whites(10.0)
                                .blacks(-15.0)
                                .vibrance(40.0)
                                .saturation(15.0)
                                .clarity(25.0)
                                .dehaze(20.0)
                                .build(),
                        now),
                builtIn("black-white-classic", "Classic B&W",
                        "Timeless black and white conversion",
                        PresetCategory.BLACK_WHITE,
                        AdjustmentOverrides.builder()
                                .exposure(0.1)
                                .contrast(30.0)
                                .highlights(-25.0)
                                .shadows(15.0)
                                .whites(20.0)
                                .blacks(-20.0)
                                .saturation(-100.0)
                                .clarity(20.0)
                                .vignette(-10.0)
                                .build(),
                        now),
                builtIn("vintage-film", "Vintage Film",
                        "Nostalgic film-like appearance",
                        PresetCategory.VINTAGE,
                        AdjustmentOverrides.builder()
                                .exposure(-0.2)
                                .contrast(-10.0)
                                .highlights(-40.0)
                                .shadows(30.0)
                                .temperature(100.0)
                                .tint(10.0)
                                .saturation(-20.0)
                                .vibrance(-15.0)
                                .clarity(-20.0)
                                .vignette(-25.0)
                                .splitToning(new SplitToning(new ToneTint(45, 15), new ToneTint(220, 10), 0))
                                .build(),
                        now),
                builtIn("street-moody", "Moody Street",
                        "Dark, moody atmosphere for urban photography",
                        PresetCategory.STREET,
                        AdjustmentOverrides.builder()
                                .exposure(-0.5)
                                .contrast(35.0)
                                .highlights(-50.0)
                                .shadows(-20.0)
                                .whites(-10.0)
                                .blacks(-30.0)
                                .temperature(-100.0)
                                .saturation(-30.0)
                                .vibrance(20.0)
                                .clarity(30.0)
                                .dehaze(15.0)
                                .vignette(-20.0)
                                .build(),
                        now),
                builtIn("modern-bright", "Modern Bright",
                        "Clean, bright modern look",
                        PresetCategory.MODERN,
                        AdjustmentOverrides.builder()
                                .exposure(0.4)
                                .contrast(20.0)
                                .highlights(-15.0)
                                .shadows(35.0)
                                .whites(15.0)
                                .blacks(10.0)
                                .temperature(50.0)
                                .vibrance(25.0)
                                .saturation(5.0)
                                .clarity(10.0)
                                .dehaze(10.0)
                                .build(),
                        now),
                builtIn("artistic-dramatic", "Dramatic Art",
                        "High contrast artistic processing",
                        PresetCategory.ARTISTIC,
                        AdjustmentOverrides.builder()
                                .exposure(0.2)
                                .contrast(50.0)
                                .highlights(-60.0)
                                .shadows(40.0)
                                .whites(25.0)
                                .blacks(-40.0)
                                .vibrance(30.0)
                                .saturation(20.0)
                                .clarity(40.0)
                                .dehaze(25.0)
                                .vignette(-30.0)
                                .colorGrading(new ColorGrading(
                                        new ColorGradeZone(240, 20, -10),
                                        new ColorGradeZone(30, 10, 0),
                                        new ColorGradeZone(60, 15, 10),
                                        0,
                                        0,
                                        0))
                                .build(),
                        now));
    }

    private static PhotoPreset builtIn(
            String id,
            String name,
            String description,
            PresetCategory category,
            AdjustmentOverrides adjustments,
            Instant createdAt) {
        return new PhotoPreset(id, name, description, category, adjustments, BUILT_IN_AUTHOR, createdAt);
    }
}
