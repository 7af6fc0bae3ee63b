package github.sarthakdev143.photo_forge.exception;

public class PresetNotFoundException extends RuntimeException {

    public PresetNotFoundException(String presetId) {
        super("Preset not found for id: " + presetId);
    }
}
