package github.sarthakdev143.photo_forge.model;

public record SplitToning(ToneTint highlights, ToneTint shadows, double balance) {

    public SplitToning {
        highlights = highlights == null ? ToneTint.NONE : highlights;
        shadows = shadows == null ? ToneTint.NONE : shadows;
    }
}
