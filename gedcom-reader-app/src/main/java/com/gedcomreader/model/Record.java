package com.gedcomreader.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * One node of the GEDCOM record tree.
 * <p>
 * A record owns its children (document order). The parent link is for
 * navigation only. Pointer values are not linked to their target here;
 * the target is looked up by id in the owning {@link GedcomDocument}, so the
 * ownership graph stays a tree even when pointers form cycles.
 * <p>
 * Records are mutable while a document is being built and become read-only
 * once the document is sealed.
 */
public class Record {

    private final int level;
    private final String xrefId;
    private final String tag;
    private final String value;
    private final int lineNumber;
    private final List<Record> children = new ArrayList<>();

    private Record parent;
    private PointerStatus pointerStatus = PointerStatus.NONE;
    private boolean obsolete;
    private boolean sealed;

    public Record(int level, String xrefId, String tag, String value, int lineNumber) {
        if (level < 0) {
            throw new IllegalArgumentException("level must be non-negative: " + level);
        }
        if (tag == null || tag.isEmpty()) {
            throw new IllegalArgumentException("tag is required");
        }
        this.level = level;
        this.xrefId = xrefId;
        this.tag = tag;
        this.value = value;
        this.lineNumber = lineNumber;
    }

    public int getLevel() { return level; }
    public String getTag() { return tag; }
    public int getLineNumber() { return lineNumber; }
    public Record getParent() { return parent; }
    public PointerStatus getPointerStatus() { return pointerStatus; }
    public boolean isObsolete() { return obsolete; }
    public boolean isRoot() { return parent == null; }

    public Optional<String> getXrefId() {
        return Optional.ofNullable(xrefId);
    }

    /**
     * The line value. Empty means the line had no value at all, which is
     * different from a present empty string.
     */
    public Optional<String> getValue() {
        return Optional.ofNullable(value);
    }

    public List<Record> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public boolean isPointer() {
        return Xrefs.isXref(value);
    }

    /**
     * The referenced id when the value has pointer syntax.
     */
    public Optional<String> getPointerId() {
        return isPointer() ? Optional.of(value) : Optional.empty();
    }

    public Optional<Record> firstChild(String childTag) {
        return children.stream().filter(c -> c.tag.equals(childTag)).findFirst();
    }

    public void addChild(Record child) {
        checkMutable();
        if (child.parent != null) {
            throw new IllegalArgumentException("record already has a parent: " + child.toGedcomLine());
        }
        if (child.level != level + 1) {
            throw new IllegalArgumentException(
                    "child level " + child.level + " does not follow parent level " + level);
        }
        child.parent = this;
        children.add(child);
    }

    public void markObsolete() {
        checkMutable();
        this.obsolete = true;
    }

    public void setPointerStatus(PointerStatus pointerStatus) {
        checkMutable();
        this.pointerStatus = pointerStatus;
    }

    void seal() {
        sealed = true;
        for (Record child : children) {
            child.seal();
        }
    }

    private void checkMutable() {
        if (sealed) {
            throw new IllegalStateException("record belongs to a sealed document: " + toGedcomLine());
        }
    }

    /**
     * Renders this record as a single GEDCOM line. Multi-line values are
     * emitted with their embedded newlines, see {@link GedcomDocument#print}.
     */
    public String toGedcomLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(level).append(' ');
        if (xrefId != null) {
            sb.append(xrefId).append(' ');
        }
        sb.append(tag);
        if (value != null) {
            sb.append(' ').append(value);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return toGedcomLine();
    }
}
