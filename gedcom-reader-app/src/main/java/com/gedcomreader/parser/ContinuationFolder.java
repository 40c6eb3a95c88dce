package com.gedcomreader.parser;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds CONC and CONT lines into the value of the line they continue.
 * <p>
 * CONT appends a newline and its value, CONC appends its value with no
 * separator. Any other tag closes the line under construction. Continuation
 * lines never appear in the output.
 * <p>
 * Levels are only used to check that a continuation sits below the line it
 * continues. Nesting of the folded lines is validated by {@link TreeBuilder}.
 */
public class ContinuationFolder {

    public static final String CONT = "CONT";
    public static final String CONC = "CONC";

    public List<LogicalLine> fold(List<RawLine> lines) throws StructuralException {
        List<LogicalLine> result = new ArrayList<>(lines.size());
        Pending pending = null;

        for (RawLine line : lines) {
            if (!line.isContinuation()) {
                if (pending != null) {
                    result.add(pending.toLogicalLine());
                }
                pending = new Pending(line);
                continue;
            }

            if (pending == null) {
                throw new StructuralException(line.tag() + " line has no preceding line to continue",
                        line.lineNumber(), line.text());
            }
            if (line.level() <= pending.base.level()) {
                throw new StructuralException(line.tag() + " at level " + line.level()
                        + " cannot continue the line at level " + pending.base.level()
                        + " (line " + pending.base.lineNumber() + ")", line.lineNumber(), line.text());
            }
            if (line.xrefId() != null) {
                throw new StructuralException(line.tag() + " line cannot declare cross reference id "
                        + line.xrefId(), line.lineNumber(), line.text());
            }
            pending.append(line);
        }

        if (pending != null) {
            result.add(pending.toLogicalLine());
        }
        return result;
    }

    /**
     * The line under construction. Local to one {@link #fold} call.
     */
    private static final class Pending {
        private final RawLine base;
        private StringBuilder value;

        Pending(RawLine base) {
            this.base = base;
        }

        void append(RawLine continuation) {
            if (value == null) {
                value = new StringBuilder(base.value() == null ? "" : base.value());
            }
            if (CONT.equals(continuation.tag())) {
                value.append('\n');
            }
            if (continuation.value() != null) {
                value.append(continuation.value());
            }
        }

        LogicalLine toLogicalLine() {
            if (value == null) {
                return LogicalLine.of(base);
            }
            return new LogicalLine(base.lineNumber(), base.level(), base.xrefId(), base.tag(),
                    value.toString(), base.text());
        }
    }
}
