package github.sarthakdev143.photo_forge.service.impl;

import java.util.concurrent.ThreadLocalRandom;

final class Identifiers {

    private static final String BASE36 = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int RANDOM_LENGTH = 9;

    private Identifiers() {
    }

    /**
     * {@code <prefix><epochMillis>-<9 random base36 chars>}.
     */
    static String timestamped(String prefix, long epochMillis) {
        StringBuilder id = new StringBuilder(prefix).append(epochMillis).append('-');
        ThreadLocalRandom random = ThreadLocalRandom.current();
        for (int i = 0; i < RANDOM_LENGTH; i++) {
            id.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return id.toString();
    }
}
