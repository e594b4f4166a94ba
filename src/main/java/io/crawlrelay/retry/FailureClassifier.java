package io.crawlrelay.retry;

import io.crawlrelay.model.ErrorGenre;

import java.util.Map;
import java.util.Optional;

/**
 * Maps crawler exit statuses to error genres. Statuses outside the table have
 * no genre.
 */
public final class FailureClassifier {
    public static final int EXIT_PROXY_BLOCK = 41;
    public static final int EXIT_CHROME_VERSION = 42;
    public static final int EXIT_OTHER_PROCESS_EXIST = 43;
    public static final int EXIT_UNKNOWN = 44;

    private static final Map<Integer, ErrorGenre> GENRE_BY_EXIT_STATUS = Map.of(
            EXIT_PROXY_BLOCK, ErrorGenre.PROXY_BLOCK,
            EXIT_CHROME_VERSION, ErrorGenre.CHROME_VERSION,
            EXIT_OTHER_PROCESS_EXIST, ErrorGenre.OTHER_PROCESS_EXIST,
            EXIT_UNKNOWN, ErrorGenre.UNKNOWN
    );

    private FailureClassifier() {
    }

    public static Optional<ErrorGenre> classify(int exitStatus) {
        return Optional.ofNullable(GENRE_BY_EXIT_STATUS.get(exitStatus));
    }

    public static Optional<ErrorGenre> classify(Integer exitStatus) {
        return exitStatus == null ? Optional.empty() : classify(exitStatus.intValue());
    }
}
