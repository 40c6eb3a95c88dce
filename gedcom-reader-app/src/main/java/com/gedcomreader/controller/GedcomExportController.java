package com.gedcomreader.controller;

import com.gedcomreader.export.PointerRendering;
import com.gedcomreader.export.ProjectionOptions;
import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.RecordKind;
import com.gedcomreader.parser.GedcomParseException;
import com.gedcomreader.service.GedcomService;
import com.gedcomreader.service.GedcomService.Summary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.util.*;

@RestController
@RequestMapping("/api/gedcom")
public class GedcomExportController {

    private static final Logger log = LoggerFactory.getLogger(GedcomExportController.class);

    private final GedcomService gedcomService;

    public GedcomExportController(GedcomService gedcomService) {
        this.gedcomService = gedcomService;
    }

    // ========== EXPORT ==========

    /**
     * Export an uploaded GEDCOM file as JSON.
     *
     * @param kinds    comma separated record kinds (INDI, FAM, individuals, ...); defaults from configuration
     * @param pointers "reference" or "nested"
     */
    @PostMapping(value = "/export", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Map<String, List<Map<String, Object>>>> exportFile(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) String kinds,
            @RequestParam(required = false) String pointers) throws IOException, GedcomParseException {

        try (InputStream in = file.getInputStream()) {
            GedcomDocument document = gedcomService.parse(in);
            return ResponseEntity.ok(export(document, kinds, pointers));
        }
    }

    /**
     * Export GEDCOM text sent as the request body.
     */
    @PostMapping(value = "/export", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Map<String, List<Map<String, Object>>>> exportText(
            @RequestBody String body,
            @RequestParam(required = false) String kinds,
            @RequestParam(required = false) String pointers) throws GedcomParseException {

        GedcomDocument document = gedcomService.parse(body);
        return ResponseEntity.ok(export(document, kinds, pointers));
    }

    // ========== SUMMARY ==========

    @PostMapping(value = "/summary", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<Summary> summarizeFile(@RequestParam("file") MultipartFile file)
            throws IOException, GedcomParseException {
        try (InputStream in = file.getInputStream()) {
            return ResponseEntity.ok(gedcomService.summarize(gedcomService.parse(in)));
        }
    }

    @PostMapping(value = "/summary", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<Summary> summarizeText(@RequestBody String body) throws GedcomParseException {
        return ResponseEntity.ok(gedcomService.summarize(gedcomService.parse(body)));
    }

    // ========== ERRORS ==========

    @ExceptionHandler(GedcomParseException.class)
    public ResponseEntity<Map<String, Object>> handleParseError(GedcomParseException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", e.getMessage());
        body.put("type", e.getClass().getSimpleName());
        body.put("lineNumber", e.getLineNumber());
        body.put("line", e.getLine());
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY).body(body);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(IOException e) {
        log.error("Failed to read uploaded GEDCOM", e);
        return ResponseEntity.badRequest().body(Map.of("error", "Could not read upload: " + e.getMessage()));
    }

    // ========== HELPERS ==========

    private Map<String, List<Map<String, Object>>> export(GedcomDocument document, String kinds, String pointers) {
        ProjectionOptions defaults = gedcomService.defaultOptions();
        Set<RecordKind> selected = kinds == null || kinds.isBlank() ? defaults.kinds() : parseKinds(kinds);
        PointerRendering rendering = pointers == null || pointers.isBlank()
                ? defaults.pointers() : PointerRendering.parse(pointers);

        ProjectionOptions options = new ProjectionOptions(selected, rendering, defaults.pruneEmpty());
        return gedcomService.project(document, options).sections();
    }

    private Set<RecordKind> parseKinds(String kinds) {
        Set<RecordKind> selected = EnumSet.noneOf(RecordKind.class);
        for (String token : kinds.split(",")) {
            if (token.isBlank()) continue;
            selected.add(RecordKind.parse(token)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown record kind: " + token.trim())));
        }
        return selected;
    }
}
