package com.gedcomreader.export;

import com.gedcomreader.model.Record;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Splits a personal name value into pieces around the slashed surname:
 * {@code "John Quincy /Van Buren/ Jr."} gives given "John Quincy",
 * surname "Van Buren", suffix "Jr.". A surname opened but never closed
 * leaves the name unsplit. GIVN, SURN, NPFX, SPFX, NSFX, NICK and TYPE
 * children override or add to the split pieces.
 */
public class NameTagHandler implements TagHandler {

    // Structured piece tags and the node keys they fill
    private static final Map<String, String> PIECE_KEYS = pieceKeys();

    @Override
    public void decorate(Record record, Map<String, Object> node) {
        record.getValue().flatMap(NameTagHandler::split).ifPresent(pieces -> {
            node.put("given", pieces.given());
            node.put("surname", pieces.surname());
            node.put("suffix", pieces.suffix());
        });
        // Explicit pieces win over whatever the slashed value implied
        PIECE_KEYS.forEach((tag, key) -> record.firstChild(tag)
                .flatMap(Record::getValue)
                .ifPresent(piece -> node.put(key, piece)));
    }

    private static Map<String, String> pieceKeys() {
        Map<String, String> keys = new LinkedHashMap<>();
        keys.put("NPFX", "prefix");
        keys.put("GIVN", "given");
        keys.put("NICK", "nickname");
        keys.put("SPFX", "surnamePrefix");
        keys.put("SURN", "surname");
        keys.put("NSFX", "suffix");
        keys.put("TYPE", "type");
        return Collections.unmodifiableMap(keys);
    }

    static Optional<NamePieces> split(String value) {
        String[] tokens = value.trim().split("\\s+");
        List<String> given = new ArrayList<>();
        List<String> surname = new ArrayList<>();
        List<String> suffix = new ArrayList<>();

        // 0 = before surname, 1 = inside, 2 = after
        int state = 0;
        for (String token : tokens) {
            if (token.isEmpty()) continue;
            if (state == 0 && token.startsWith("/")) {
                String inner = token.substring(1);
                if (inner.endsWith("/")) {
                    surname.add(inner.substring(0, inner.length() - 1));
                    state = 2;
                } else {
                    surname.add(inner);
                    state = 1;
                }
            } else if (state == 1) {
                if (token.endsWith("/")) {
                    surname.add(token.substring(0, token.length() - 1));
                    state = 2;
                } else {
                    surname.add(token);
                }
            } else if (state == 0) {
                given.add(token);
            } else {
                suffix.add(token);
            }
        }

        if (state == 1) {
            return Optional.empty();
        }
        return Optional.of(new NamePieces(
                String.join(" ", given),
                String.join(" ", surname).trim(),
                String.join(" ", suffix)));
    }

    record NamePieces(String given, String surname, String suffix) {}
}
