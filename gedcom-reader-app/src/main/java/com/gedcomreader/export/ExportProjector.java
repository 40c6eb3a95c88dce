package com.gedcomreader.export;

import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.PointerStatus;
import com.gedcomreader.model.Record;
import com.gedcomreader.model.RecordKind;
import com.gedcomreader.model.StructuredDocument;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Projects the selected top-level records of a document into plain maps and
 * lists, ready for a JSON (or any other) serializer.
 * <p>
 * Node layout:
 * <pre>
 * { "tag": "FAMS", "xref": ..., "value": ..., "ref" | "target" | "unresolved": ..., (handler keys), "children": [...] }
 * </pre>
 * The walk follows owned children only, so it terminates on any document.
 * Nested pointer targets are projected with their own pointers as references,
 * which keeps cyclic pointer graphs finite. Read-only on the document.
 */
public class ExportProjector {

    private final TagRegistry tagRegistry;

    public ExportProjector(TagRegistry tagRegistry) {
        this.tagRegistry = tagRegistry;
    }

    public StructuredDocument project(GedcomDocument document, ProjectionOptions options) {
        Map<String, List<Map<String, Object>>> sections = new LinkedHashMap<>();
        Set<String> unsupported = new TreeSet<>();

        for (RecordKind kind : RecordKind.values()) {
            if (!options.kinds().contains(kind)) {
                continue;
            }
            List<Map<String, Object>> projected = new ArrayList<>();
            for (Record record : document.recordsOfKind(kind)) {
                if (record.isObsolete()) continue;
                projected.add(projectRecord(record, document, options, true, unsupported));
            }
            if (!projected.isEmpty() || !options.pruneEmpty()) {
                sections.put(kind.sectionName(), Collections.unmodifiableList(projected));
            }
        }

        return new StructuredDocument(Collections.unmodifiableMap(sections), Collections.unmodifiableSet(unsupported));
    }

    private Map<String, Object> projectRecord(Record record, GedcomDocument document, ProjectionOptions options,
                                              boolean allowNesting, Set<String> unsupported) {
        Map<String, Object> node = new LinkedHashMap<>();
        node.put("tag", record.getTag());
        record.getXrefId().ifPresent(id -> node.put("xref", id));

        if (record.getPointerStatus() == PointerStatus.RESOLVED) {
            Record target = document.target(record).orElseThrow();
            if (options.pointers() == PointerRendering.NESTED && allowNesting) {
                node.put("target", projectRecord(target, document, options, false, unsupported));
            } else {
                node.put("ref", target.getXrefId().orElseThrow());
            }
        } else if (record.getPointerStatus() == PointerStatus.UNRESOLVED) {
            record.getValue().ifPresent(v -> node.put("value", v));
            node.put("unresolved", true);
        } else {
            record.getValue().ifPresent(v -> node.put("value", v));
        }

        if (!tagRegistry.isSupported(record.getTag())) {
            unsupported.add(record.getTag());
        }
        tagRegistry.handlerFor(record.getTag()).decorate(record, node);

        List<Map<String, Object>> children = new ArrayList<>();
        for (Record child : record.getChildren()) {
            if (child.isObsolete()) continue;
            children.add(projectRecord(child, document, options, allowNesting, unsupported));
        }
        node.put("children", children);

        if (options.pruneEmpty()) {
            prune(node);
        }
        return node;
    }

    private static void prune(Map<String, Object> node) {
        node.entrySet().removeIf(entry -> isEmpty(entry.getValue()));
    }

    private static boolean isEmpty(Object value) {
        if (value == null) return true;
        if (value instanceof String) return ((String) value).isBlank();
        if (value instanceof Collection) return ((Collection<?>) value).isEmpty();
        if (value instanceof Map) return ((Map<?, ?>) value).isEmpty();
        return false;
    }
}
