package github.sarthakdev143.photo_forge.model;

import java.util.EnumMap;
import java.util.Map;

/**
 * Per hue family hue/saturation/luminance offsets. Families without an entry are untouched.
 */
public record HslAdjustments(Map<HueFamily, HslChannel> channels) {

    public HslAdjustments {
        EnumMap<HueFamily, HslChannel> copy = new EnumMap<>(HueFamily.class);
        if (channels != null) {
            channels.forEach((family, channel) -> {
                if (family != null && channel != null) {
                    copy.put(family, channel);
                }
            });
        }
        channels = Map.copyOf(copy);
    }

    public HslChannel channel(HueFamily family) {
        return channels.get(family);
    }
}
