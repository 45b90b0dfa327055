package com.hcltech.depvis.analysis.exceptions;

/** The result could not be written, committed or handed to the image renderer. */
public class SaveException extends RuntimeException {
    public SaveException(String message, Throwable cause) {
        super(message, cause);
    }
}
