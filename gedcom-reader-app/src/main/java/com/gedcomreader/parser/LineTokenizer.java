package com.gedcomreader.parser;

import com.gedcomreader.model.Xrefs;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.IntStream;

/**
 * Splits physical lines into {@link RawLine}s.
 * <p>
 * Grammar: {@code level SP [xref SP] tag [SP value]}. The value is everything
 * after the single delimiter space following the tag, kept verbatim.
 * Lines are independent of each other, so large inputs can be tokenized
 * in parallel.
 */
public class LineTokenizer {

    private static final Pattern TAG = Pattern.compile("[A-Za-z0-9_]+");

    private final int maxLevel;

    public LineTokenizer(int maxLevel) {
        this.maxLevel = maxLevel;
    }

    /**
     * Tokenizes all lines, skipping blank ones. Line numbers are 1-based
     * positions in {@code lines}.
     *
     * @throws MalformedLineException for the first (lowest numbered) bad line
     */
    public List<RawLine> tokenizeAll(List<String> lines, boolean parallel) throws MalformedLineException {
        if (!parallel) {
            List<RawLine> result = new ArrayList<>(lines.size());
            for (int i = 0; i < lines.size(); i++) {
                tokenize(lines.get(i), i + 1).ifPresent(result::add);
            }
            return result;
        }

        List<Attempt> attempts = IntStream.range(0, lines.size())
                .parallel()
                .mapToObj(i -> attempt(lines.get(i), i + 1))
                .toList();

        List<RawLine> result = new ArrayList<>(attempts.size());
        for (Attempt attempt : attempts) {
            if (attempt.error() != null) {
                throw attempt.error();
            }
            if (attempt.line() != null) {
                result.add(attempt.line());
            }
        }
        return result;
    }

    /**
     * Tokenizes one physical line.
     *
     * @return empty for a blank line
     */
    public Optional<RawLine> tokenize(String text, int lineNumber) throws MalformedLineException {
        if (text == null) {
            return Optional.empty();
        }
        String line = stripLineEnding(text);
        if (line.isBlank()) {
            return Optional.empty();
        }

        int pos = skipSpaces(line, 0);

        // Level
        int levelStart = pos;
        while (pos < line.length() && line.charAt(pos) != ' ') {
            pos++;
        }
        String levelToken = line.substring(levelStart, pos);
        int level = parseLevel(levelToken, lineNumber, text);

        pos = skipSpaces(line, pos);
        if (pos >= line.length()) {
            throw new MalformedLineException("Missing tag", lineNumber, text);
        }

        // Optional xref id
        String xrefId = null;
        if (line.charAt(pos) == '@') {
            int end = line.indexOf(' ', pos);
            String token = end < 0 ? line.substring(pos) : line.substring(pos, end);
            if (!Xrefs.isXref(token)) {
                throw new MalformedLineException("Invalid cross reference id " + token, lineNumber, text);
            }
            if (end < 0) {
                throw new MalformedLineException("Missing tag after cross reference id " + token, lineNumber, text);
            }
            xrefId = token;
            pos = skipSpaces(line, end);
            if (pos >= line.length()) {
                throw new MalformedLineException("Missing tag after cross reference id " + token, lineNumber, text);
            }
        }

        // Tag
        int tagEnd = line.indexOf(' ', pos);
        String tag = tagEnd < 0 ? line.substring(pos) : line.substring(pos, tagEnd);
        if (!TAG.matcher(tag).matches()) {
            throw new MalformedLineException("Invalid tag " + tag, lineNumber, text);
        }

        // Value: absent without a delimiter, verbatim after exactly one space otherwise
        String value = tagEnd < 0 ? null : line.substring(tagEnd + 1);

        return Optional.of(new RawLine(lineNumber, level, xrefId, tag, value, text));
    }

    private int parseLevel(String token, int lineNumber, String text) throws MalformedLineException {
        if (token.isEmpty() || !token.chars().allMatch(c -> c >= '0' && c <= '9')) {
            throw new MalformedLineException("Invalid level " + token, lineNumber, text);
        }
        // Digit-only, so the only failure left is overflow. Leading zeros don't count.
        int firstSignificant = 0;
        while (firstSignificant < token.length() - 1 && token.charAt(firstSignificant) == '0') {
            firstSignificant++;
        }
        if (token.length() - firstSignificant > 9) {
            throw new MalformedLineException("Level " + token + " exceeds maximum " + maxLevel, lineNumber, text);
        }
        int level = Integer.parseInt(token);
        if (level > maxLevel) {
            throw new MalformedLineException("Level " + level + " exceeds maximum " + maxLevel, lineNumber, text);
        }
        return level;
    }

    private Attempt attempt(String text, int lineNumber) {
        try {
            return new Attempt(tokenize(text, lineNumber).orElse(null), null);
        } catch (MalformedLineException e) {
            return new Attempt(null, e);
        }
    }

    private static String stripLineEnding(String text) {
        int end = text.length();
        while (end > 0 && (text.charAt(end - 1) == '\n' || text.charAt(end - 1) == '\r')) {
            end--;
        }
        return text.substring(0, end);
    }

    private static int skipSpaces(String line, int pos) {
        while (pos < line.length() && (line.charAt(pos) == ' ' || line.charAt(pos) == '\t')) {
            pos++;
        }
        return pos;
    }

    private record Attempt(RawLine line, MalformedLineException error) {}
}
