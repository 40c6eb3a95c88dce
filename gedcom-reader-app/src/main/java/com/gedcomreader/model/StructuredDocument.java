package com.gedcomreader.model;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Output of a projection: section name to the ordered list of projected
 * records, plus the tags the projector passed through without a handler.
 * The section map is what gets serialized; {@code unsupportedTags} is
 * reporting metadata for the caller.
 */
public record StructuredDocument(
    Map<String, List<Map<String, Object>>> sections,
    Set<String> unsupportedTags
) {
    public List<Map<String, Object>> section(RecordKind kind) {
        return sections.getOrDefault(kind.sectionName(), List.of());
    }

    public boolean isEmpty() {
        return sections.isEmpty();
    }
}
