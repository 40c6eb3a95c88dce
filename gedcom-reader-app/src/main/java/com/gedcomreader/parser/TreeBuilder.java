package com.gedcomreader.parser;

import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.ParseWarning;
import com.gedcomreader.model.Record;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Assembles logical lines into a {@link GedcomDocument}.
 * <p>
 * Keeps the path from the current root to the last inserted record on a
 * stack. Each new line pops the stack until the top is its parent (level
 * one less) or the stack is empty, in which case the line must be level 0.
 */
public class TreeBuilder {

    private final Set<String> obsoleteTags;

    public TreeBuilder(Set<String> obsoleteTags) {
        this.obsoleteTags = obsoleteTags;
    }

    public GedcomDocument build(List<LogicalLine> lines) throws StructuralException, DuplicateXrefException {
        GedcomDocument document = new GedcomDocument();
        Deque<Record> path = new ArrayDeque<>();

        for (LogicalLine line : lines) {
            if (ContinuationFolder.CONT.equals(line.tag()) || ContinuationFolder.CONC.equals(line.tag())) {
                throw new IllegalArgumentException("continuation line reached the tree builder: " + line);
            }

            while (!path.isEmpty() && path.peek().getLevel() >= line.level()) {
                path.pop();
            }

            Record parent = path.peek();
            if (parent == null && line.level() != 0) {
                throw new StructuralException("Level " + line.level() + " line has no parent record",
                        line.lineNumber(), line.text());
            }
            if (parent != null && line.level() > parent.getLevel() + 1) {
                throw new StructuralException("Level skip from " + parent.getLevel() + " to " + line.level()
                        + " (parent at line " + parent.getLineNumber() + ")", line.lineNumber(), line.text());
            }

            Record record = new Record(line.level(), line.xrefId(), line.tag(), line.value(), line.lineNumber());

            if (line.xrefId() != null) {
                Optional<Record> existing = document.register(record);
                if (existing.isPresent()) {
                    throw new DuplicateXrefException(line.xrefId(), existing.get().getLineNumber(),
                            line.lineNumber(), line.text());
                }
            }

            if (obsoleteTags.contains(line.tag())) {
                record.markObsolete();
                document.addWarning(new ParseWarning(ParseWarning.Type.OBSOLETE_TAG, line.lineNumber(),
                        "Record with obsolete tag " + line.tag() + " will be ignored on export"));
            }

            if (parent == null) {
                document.addRoot(record);
            } else {
                parent.addChild(record);
            }
            path.push(record);
        }

        return document;
    }
}
