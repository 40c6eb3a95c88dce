package com.gedcomreader.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * A loaded GEDCOM file: the forest of level-0 records plus the index of
 * every record that declares a cross-reference id.
 * <p>
 * The index is the only place a record is found by id. Pointer fields keep
 * the id and are resolved through {@link #target(Record)}; the reverse
 * overlay ({@link #referrers(String)}) lists who points at an id.
 * <p>
 * Once sealed the document is read-only and safe to share between threads.
 */
public class GedcomDocument {

    private final List<Record> roots = new ArrayList<>();
    private final Map<String, Record> xrefIndex = new LinkedHashMap<>();
    private final Map<String, List<Record>> referrers = new LinkedHashMap<>();
    private final List<ParseWarning> warnings = new ArrayList<>();
    private volatile boolean sealed;

    // ========== BUILDING ==========

    public void addRoot(Record root) {
        checkMutable();
        if (root.getLevel() != 0 || !root.isRoot()) {
            throw new IllegalArgumentException("not a root record: " + root.toGedcomLine());
        }
        roots.add(root);
    }

    /**
     * Registers the record under its xref id.
     *
     * @return the record already registered under that id, if any (in which case
     *         nothing is changed)
     */
    public Optional<Record> register(Record record) {
        checkMutable();
        String id = record.getXrefId()
                .orElseThrow(() -> new IllegalArgumentException("record has no xref id: " + record.toGedcomLine()));
        Record existing = xrefIndex.putIfAbsent(id, record);
        return Optional.ofNullable(existing);
    }

    public void addReferrer(String xrefId, Record referrer) {
        checkMutable();
        referrers.computeIfAbsent(xrefId, k -> new ArrayList<>()).add(referrer);
    }

    public void addWarning(ParseWarning warning) {
        checkMutable();
        warnings.add(warning);
    }

    public void seal() {
        for (Record root : roots) {
            root.seal();
        }
        sealed = true;
    }

    public boolean isSealed() {
        return sealed;
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("document is sealed");
        }
    }

    // ========== QUERIES ==========

    public List<Record> getRoots() {
        return Collections.unmodifiableList(roots);
    }

    public Map<String, Record> getXrefIndex() {
        return Collections.unmodifiableMap(xrefIndex);
    }

    public Optional<Record> lookup(String xrefId) {
        return Optional.ofNullable(xrefIndex.get(xrefId));
    }

    /**
     * The record a pointer field refers to. Empty when the record is not a
     * pointer or its target does not exist.
     */
    public Optional<Record> target(Record pointer) {
        return pointer.getPointerId().flatMap(this::lookup);
    }

    public List<Record> referrers(String xrefId) {
        return Collections.unmodifiableList(referrers.getOrDefault(xrefId, List.of()));
    }

    public List<Record> recordsOfKind(RecordKind kind) {
        return roots.stream()
                .filter(r -> r.getTag().equals(kind.tag()))
                .toList();
    }

    public List<ParseWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public List<Record> unresolvedPointers() {
        List<Record> result = new ArrayList<>();
        for (Record root : roots) {
            collectUnresolved(root, result);
        }
        return result;
    }

    private void collectUnresolved(Record record, List<Record> result) {
        if (record.getPointerStatus() == PointerStatus.UNRESOLVED) {
            result.add(record);
        }
        for (Record child : record.getChildren()) {
            collectUnresolved(child, result);
        }
    }

    // ========== PRINTING ==========

    /**
     * Renders the document back to GEDCOM lines. Newlines inside values are
     * written as CONT lines one level down. With {@code showHierarchy} each
     * line is indented by its level.
     */
    public String print(boolean showHierarchy) {
        StringBuilder sb = new StringBuilder();
        for (Record root : roots) {
            printRecord(root, showHierarchy, sb);
        }
        return sb.toString();
    }

    private void printRecord(Record record, boolean showHierarchy, StringBuilder sb) {
        String[] valueLines = record.getValue().map(v -> v.split("\n", -1)).orElse(new String[0]);
        indent(record.getLevel(), showHierarchy, sb);
        sb.append(record.getLevel()).append(' ');
        record.getXrefId().ifPresent(id -> sb.append(id).append(' '));
        sb.append(record.getTag());
        if (valueLines.length > 0) {
            sb.append(' ').append(valueLines[0]);
        }
        sb.append('\n');
        for (int i = 1; i < valueLines.length; i++) {
            indent(record.getLevel() + 1, showHierarchy, sb);
            sb.append(record.getLevel() + 1).append(" CONT");
            if (!valueLines[i].isEmpty()) {
                sb.append(' ').append(valueLines[i]);
            }
            sb.append('\n');
        }
        for (Record child : record.getChildren()) {
            printRecord(child, showHierarchy, sb);
        }
    }

    private static void indent(int level, boolean showHierarchy, StringBuilder sb) {
        if (showHierarchy) {
            sb.append(" ".repeat(level));
        }
    }
}
