package com.gedcomreader.export;

import com.gedcomreader.model.Record;

import java.util.Locale;
import java.util.Map;

public class SexTagHandler implements TagHandler {

    private static final Map<String, String> LABELS = Map.of(
            "M", "Male",
            "F", "Female",
            "U", "Unknown",
            "X", "Intersex",
            "N", "Not Recorded"
    );

    @Override
    public void decorate(Record record, Map<String, Object> node) {
        String code = record.getValue().map(String::trim).orElse("");
        node.put("label", LABELS.getOrDefault(code.toUpperCase(Locale.ROOT), "Unknown"));
    }
}
