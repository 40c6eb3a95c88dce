package com.gedcomreader.export;

import com.gedcomreader.model.RecordKind;

import java.util.EnumSet;
import java.util.Set;

/**
 * Caller choices for one projection.
 *
 * @param kinds       top-level record kinds to include; empty means all kinds
 * @param pointers    rendering of resolved pointers
 * @param pruneEmpty  drop keys whose value is blank, an empty list or an empty map
 */
public record ProjectionOptions(
    Set<RecordKind> kinds,
    PointerRendering pointers,
    boolean pruneEmpty
) {
    public ProjectionOptions {
        kinds = kinds == null || kinds.isEmpty() ? EnumSet.allOf(RecordKind.class) : EnumSet.copyOf(kinds);
        pointers = pointers == null ? PointerRendering.REFERENCE : pointers;
    }

    public static ProjectionOptions of(Set<RecordKind> kinds) {
        return new ProjectionOptions(kinds, PointerRendering.REFERENCE, true);
    }

    public ProjectionOptions withPointers(PointerRendering rendering) {
        return new ProjectionOptions(kinds, rendering, pruneEmpty);
    }
}
