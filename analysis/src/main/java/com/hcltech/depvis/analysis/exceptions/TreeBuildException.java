package com.hcltech.depvis.analysis.exceptions;

public class TreeBuildException extends RuntimeException {
    public TreeBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
