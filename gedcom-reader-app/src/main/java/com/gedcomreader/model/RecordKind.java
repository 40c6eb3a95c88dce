package com.gedcomreader.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Top-level GEDCOM 5.5.x record kinds, keyed by their level-0 tag.
 * Each kind knows the section name it is exported under.
 */
public enum RecordKind {
    HEAD("header"),
    SUBM("submitters"),
    SUBN("submission"),
    INDI("individuals"),
    FAM("families"),
    NOTE("notes"),
    SOUR("sources"),
    REPO("repositories"),
    OBJE("multimedia"),
    TRLR("trailer");

    private final String sectionName;

    RecordKind(String sectionName) {
        this.sectionName = sectionName;
    }

    public String sectionName() {
        return sectionName;
    }

    public String tag() {
        return name();
    }

    public static Optional<RecordKind> fromTag(String tag) {
        if (tag == null) return Optional.empty();
        return Arrays.stream(values())
                .filter(kind -> kind.name().equals(tag))
                .findFirst();
    }

    /**
     * Lenient lookup used for request parameters: accepts the tag ("INDI"),
     * the section name ("individuals") or the short forms "IND"/"FAMILY",
     * case-insensitively.
     */
    public static Optional<RecordKind> parse(String text) {
        if (text == null || text.isBlank()) return Optional.empty();
        String key = text.trim();
        for (RecordKind kind : values()) {
            if (kind.name().equalsIgnoreCase(key) || kind.sectionName.equalsIgnoreCase(key)) {
                return Optional.of(kind);
            }
        }
        if ("IND".equalsIgnoreCase(key) || "INDIVIDUAL".equalsIgnoreCase(key)) return Optional.of(INDI);
        if ("FAMILY".equalsIgnoreCase(key)) return Optional.of(FAM);
        return Optional.empty();
    }
}
