package github.sarthakdev143.photo_forge.model;

public record FileNaming(String prefix, String suffix, boolean includeIndex) {

    public static final FileNaming NONE = new FileNaming(null, null, false);

    public FileNaming {
        prefix = prefix == null || prefix.isEmpty() ? null : prefix;
        suffix = suffix == null || suffix.isEmpty() ? null : suffix;
    }
}
