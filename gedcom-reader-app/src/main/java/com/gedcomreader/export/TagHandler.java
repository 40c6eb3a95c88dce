package com.gedcomreader.export;

import com.gedcomreader.model.Record;

import java.util.Map;

/**
 * Adds tag-specific keys to a projected record node. The generic keys
 * (tag, xref, value, pointer, children) are already written when a handler runs.
 */
@FunctionalInterface
public interface TagHandler {

    /** Known tag with nothing extra to add. */
    TagHandler PLAIN = (record, node) -> { };

    void decorate(Record record, Map<String, Object> node);
}
