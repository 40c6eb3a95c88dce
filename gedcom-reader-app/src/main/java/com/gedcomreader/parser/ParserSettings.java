package com.gedcomreader.parser;

import java.util.Set;

/**
 * Tunables for {@link GedcomParser}.
 *
 * @param maxLevel                   largest accepted level number
 * @param obsoleteTags               tags accepted with a warning and flagged on the record
 * @param parallelTokenizeThreshold  line count at which tokenization runs in parallel; 0 disables
 */
public record ParserSettings(
    int maxLevel,
    Set<String> obsoleteTags,
    int parallelTokenizeThreshold
) {
    public static final int DEFAULT_MAX_LEVEL = 99;

    public ParserSettings {
        obsoleteTags = obsoleteTags == null ? Set.of() : Set.copyOf(obsoleteTags);
    }

    public static ParserSettings defaults() {
        return new ParserSettings(DEFAULT_MAX_LEVEL, Set.of("SSN", "FSID"), 50_000);
    }

    public boolean tokenizeInParallel(int lineCount) {
        return parallelTokenizeThreshold > 0 && lineCount >= parallelTokenizeThreshold;
    }
}
