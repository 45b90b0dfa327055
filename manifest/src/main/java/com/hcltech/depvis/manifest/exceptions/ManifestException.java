package com.hcltech.depvis.manifest.exceptions;

/** A manifest could not be turned into a graph. {@link #source()} names the file or stream. */
public abstract class ManifestException extends RuntimeException {
    private final String source;

    protected ManifestException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String source() {
        return source;
    }
}
