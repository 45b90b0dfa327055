package com.hcltech.depvis.analysis.exceptions;

import java.util.List;

/** A required configuration field is missing or blank. */
public class EmptyFieldException extends ConfigurationException {
    public EmptyFieldException(List<String> problems) {
        super(problems);
    }
}
