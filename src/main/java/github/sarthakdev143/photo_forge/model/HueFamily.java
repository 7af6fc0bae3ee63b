package github.sarthakdev143.photo_forge.model;

public enum HueFamily {
    RED,
    ORANGE,
    YELLOW,
    GREEN,
    AQUA,
    BLUE,
    PURPLE,
    MAGENTA
}
