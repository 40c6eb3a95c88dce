package com.gedcomreader.parser;

import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.ParseWarning;
import com.gedcomreader.model.PointerStatus;
import com.gedcomreader.model.Record;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Marks every pointer-valued record as resolved or unresolved against the
 * document's xref index and fills the reverse (referrer) overlay.
 * <p>
 * Dangling pointers are common in real exports; they become warnings, never
 * failures. The xref index itself is only read.
 */
public class CrossReferenceResolver {

    private static final Logger log = LoggerFactory.getLogger(CrossReferenceResolver.class);

    /**
     * @return the number of unresolved pointers
     */
    public int resolve(GedcomDocument document) {
        int unresolved = 0;
        for (Record root : document.getRoots()) {
            unresolved += resolveRecord(root, document);
        }
        return unresolved;
    }

    private int resolveRecord(Record record, GedcomDocument document) {
        int unresolved = 0;
        if (record.isPointer()) {
            String id = record.getPointerId().orElseThrow();
            if (document.lookup(id).isPresent()) {
                record.setPointerStatus(PointerStatus.RESOLVED);
                document.addReferrer(id, record);
            } else {
                record.setPointerStatus(PointerStatus.UNRESOLVED);
                document.addWarning(new ParseWarning(ParseWarning.Type.UNRESOLVED_POINTER, record.getLineNumber(),
                        record.getTag() + " points to " + id + " which no record declares"));
                log.warn("Unresolved pointer {} in line {}", id, record.getLineNumber());
                unresolved++;
            }
        }
        for (Record child : record.getChildren()) {
            unresolved += resolveRecord(child, document);
        }
        return unresolved;
    }
}
