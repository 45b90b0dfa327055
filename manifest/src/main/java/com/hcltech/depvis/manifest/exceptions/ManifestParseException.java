package com.hcltech.depvis.manifest.exceptions;

import java.util.List;

/**
 * Input does not have the shape its declared format requires.
 * {@link #line()} is 1-based, or 0 when the problem is not tied to one line.
 */
public final class ManifestParseException extends ManifestException {
    private final int line;
    private final String record;
    private final List<String> problems;

    public ManifestParseException(String source, int line, String record, String problem) {
        this(source, line, record, List.of(problem), null);
    }

    public ManifestParseException(String source, List<String> problems) {
        this(source, 0, null, problems, null);
    }

    public ManifestParseException(String source, int line, String problem, Throwable cause) {
        this(source, line, null, List.of(problem), cause);
    }

    private ManifestParseException(String source, int line, String record, List<String> problems, Throwable cause) {
        super(source, describe(source, line, record, problems), cause);
        this.line = line;
        this.record = record;
        this.problems = List.copyOf(problems);
    }

    public int line() {
        return line;
    }

    /** The offending input text, when there is a single one. */
    public String record() {
        return record;
    }

    public List<String> problems() {
        return problems;
    }

    private static String describe(String source, int line, String record, List<String> problems) {
        StringBuilder sb = new StringBuilder(String.valueOf(source));
        if (line > 0) sb.append(':').append(line);
        sb.append(": ").append(String.join("; ", problems));
        if (record != null) sb.append(" [").append(record).append(']');
        return sb.toString();
    }
}
