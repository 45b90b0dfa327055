package com.hcltech.depvis.manifest;

import java.util.Locale;

/** The closed set of inputs a {@link ManifestParser} understands. */
public enum ManifestFormat {
    /** {@code name: dep1, dep2} */
    LINE_CSV,
    /** {@code name: dep1 dep2} */
    LINE_WS,
    /** JSON object of name to null, string or array of strings. */
    STRUCTURED,
    /** gzip-compressed tar holding an {@code APKINDEX} control file. */
    BINARY_INDEX;

    /**
     * Format implied by a file name: {@code .json} is structured, {@code .tar.gz}/{@code .tgz} a package
     * index, anything else the comma-separated line format.
     */
    public static ManifestFormat detect(String fileName) {
        String lower = fileName.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".json")) return STRUCTURED;
        if (lower.endsWith(".tar.gz") || lower.endsWith(".tgz")) return BINARY_INDEX;
        return LINE_CSV;
    }

    /** Accepts the constant names plus the short forms {@code csv}, {@code ws}, {@code json} and {@code index}. */
    public static ManifestFormat fromName(String name) {
        String n = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return switch (n) {
            case "CSV" -> LINE_CSV;
            case "WS", "WHITESPACE" -> LINE_WS;
            case "JSON" -> STRUCTURED;
            case "INDEX", "APKINDEX" -> BINARY_INDEX;
            default -> valueOf(n);
        };
    }
}
