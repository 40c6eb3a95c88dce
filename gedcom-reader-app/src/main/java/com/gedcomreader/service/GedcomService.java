package com.gedcomreader.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gedcomreader.config.GedcomProperties;
import com.gedcomreader.export.ExportProjector;
import com.gedcomreader.export.ProjectionOptions;
import com.gedcomreader.model.GedcomDocument;
import com.gedcomreader.model.ParseWarning;
import com.gedcomreader.model.RecordKind;
import com.gedcomreader.model.StructuredDocument;
import com.gedcomreader.parser.GedcomParseException;
import com.gedcomreader.parser.GedcomParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads GEDCOM text into a {@link GedcomDocument} and exports it.
 *
 * Decoding happens here: the parser itself only sees decoded lines.
 * A leading byte order mark is dropped before parsing.
 */
@Service
public class GedcomService {

    private static final Logger log = LoggerFactory.getLogger(GedcomService.class);
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final GedcomParser parser;
    private final ExportProjector projector;
    private final GedcomProperties properties;
    private final ObjectMapper objectMapper;

    public GedcomService(GedcomParser parser,
                         ExportProjector projector,
                         GedcomProperties properties,
                         ObjectMapper objectMapper) {
        this.parser = parser;
        this.projector = projector;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    // ========== PARSING ==========

    public GedcomDocument parse(List<String> lines) throws GedcomParseException {
        List<String> input = lines;
        if (!lines.isEmpty() && lines.get(0) != null && !lines.get(0).isEmpty()
                && lines.get(0).charAt(0) == BYTE_ORDER_MARK) {
            input = new ArrayList<>(lines);
            input.set(0, lines.get(0).substring(1));
        }
        GedcomDocument document = parser.parse(input);
        for (ParseWarning warning : document.getWarnings()) {
            log.debug("GEDCOM warning: {}", warning);
        }
        return document;
    }

    public GedcomDocument parse(String text) throws GedcomParseException {
        return parse(text.lines().toList());
    }

    /**
     * Decodes the stream with the configured charset and parses it.
     * The stream is not closed.
     */
    public GedcomDocument parse(InputStream in) throws IOException, GedcomParseException {
        return parse(readLines(in));
    }

    List<String> readLines(InputStream in) throws IOException {
        Charset charset = Charset.forName(properties.getCharset());
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, charset));
        List<String> lines = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            lines.add(line);
        }
        log.debug("Read {} lines as {}", lines.size(), charset);
        return lines;
    }

    // ========== EXPORT ==========

    public ProjectionOptions defaultOptions() {
        return properties.getExport().toOptions();
    }

    public StructuredDocument project(GedcomDocument document, ProjectionOptions options) {
        StructuredDocument result = projector.project(document, options);
        if (!result.unsupportedTags().isEmpty()) {
            log.info("Passed through unsupported tags: {}", result.unsupportedTags());
        }
        return result;
    }

    public String toJson(StructuredDocument document) throws JsonProcessingException {
        return objectMapper.writeValueAsString(document.sections());
    }

    public Summary summarize(GedcomDocument document) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        for (RecordKind kind : RecordKind.values()) {
            int count = document.recordsOfKind(kind).size();
            if (count > 0) {
                counts.put(kind.sectionName(), count);
            }
        }
        return new Summary(
            document.getRoots().size(),
            document.getXrefIndex().size(),
            document.unresolvedPointers().size(),
            counts,
            document.getWarnings().stream().map(ParseWarning::toString).toList()
        );
    }

    public record Summary(
        int roots,
        int xrefIds,
        int unresolvedPointers,
        Map<String, Integer> recordCounts,
        List<String> warnings
    ) {}
}
