package com.gedcomreader.export;

import com.gedcomreader.model.Record;

import java.util.Map;

/**
 * Writes a fixed human-readable label under a key, e.g. {@code "event": "Birth"}.
 * A generic EVEN/FACT record takes its label from its TYPE child instead.
 */
public class LabelTagHandler implements TagHandler {

    private final String key;
    private final String label;

    public LabelTagHandler(String key, String label) {
        this.key = key;
        this.label = label;
    }

    @Override
    public void decorate(Record record, Map<String, Object> node) {
        if (label.isEmpty()) {
            record.firstChild("TYPE")
                    .flatMap(Record::getValue)
                    .ifPresent(type -> node.put(key, type));
        } else {
            node.put(key, label);
        }
    }
}
