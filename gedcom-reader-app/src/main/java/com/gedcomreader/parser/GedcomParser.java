package com.gedcomreader.parser;

import com.gedcomreader.model.GedcomDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Entry point of the parsing pipeline:
 * tokenize, fold continuations, build the tree, resolve pointers, seal.
 * <p>
 * Each stage consumes the complete output of the previous one. Any stage
 * failure aborts the parse and no partial document is returned.
 * Instances hold no per-parse state and may be shared.
 */
public class GedcomParser {

    private static final Logger log = LoggerFactory.getLogger(GedcomParser.class);

    private final ParserSettings settings;
    private final LineTokenizer tokenizer;
    private final ContinuationFolder folder;
    private final TreeBuilder treeBuilder;
    private final CrossReferenceResolver resolver;

    public GedcomParser() {
        this(ParserSettings.defaults());
    }

    public GedcomParser(ParserSettings settings) {
        this.settings = settings;
        this.tokenizer = new LineTokenizer(settings.maxLevel());
        this.folder = new ContinuationFolder();
        this.treeBuilder = new TreeBuilder(settings.obsoleteTags());
        this.resolver = new CrossReferenceResolver();
    }

    public GedcomDocument parse(List<String> lines) throws GedcomParseException {
        boolean parallel = settings.tokenizeInParallel(lines.size());
        List<RawLine> rawLines = tokenizer.tokenizeAll(lines, parallel);
        log.debug("Tokenized {} physical lines into {} raw lines (parallel={})", lines.size(), rawLines.size(), parallel);

        List<LogicalLine> logicalLines = folder.fold(rawLines);
        log.debug("Folded into {} logical lines", logicalLines.size());

        GedcomDocument document = treeBuilder.build(logicalLines);
        log.debug("Built {} root records, {} cross reference ids", document.getRoots().size(), document.getXrefIndex().size());

        int unresolved = resolver.resolve(document);
        document.seal();

        log.info("Parsed GEDCOM: {} roots, {} xref ids, {} unresolved pointers, {} warnings",
                document.getRoots().size(), document.getXrefIndex().size(), unresolved, document.getWarnings().size());
        return document;
    }
}
