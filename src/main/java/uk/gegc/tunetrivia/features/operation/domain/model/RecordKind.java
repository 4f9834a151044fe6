package uk.gegc.tunetrivia.features.operation.domain.model;

import java.time.Clock;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Record types the clip pipeline persists, with the table each one lives in.
 */
public enum RecordKind {
    SONG("songs", "song"),
    GAME("games", "game"),
    QUESTION("questions", "question"),
    YOUTUBE_URL("youtube_urls", "url");

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 9;

    private final String tableName;
    private final String idPrefix;

    RecordKind(String tableName, String idPrefix) {
        this.tableName = tableName;
        this.idPrefix = idPrefix;
    }

    public String tableName() {
        return tableName;
    }

    public String idPrefix() {
        return idPrefix;
    }

    /**
     * {@code <prefix>_<epochMillis>_<9 random base36 chars>}, e.g. {@code song_1718000000000_k3j9x0a1b}.
     */
    public String newId(Clock clock) {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(ID_SUFFIX_LENGTH);
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return idPrefix + "_" + clock.millis() + "_" + suffix;
    }
}
