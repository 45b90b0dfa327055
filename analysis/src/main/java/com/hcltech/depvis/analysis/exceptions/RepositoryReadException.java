package com.hcltech.depvis.analysis.exceptions;

public class RepositoryReadException extends RuntimeException {
    public RepositoryReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
