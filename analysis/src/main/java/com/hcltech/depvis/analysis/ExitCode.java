package com.hcltech.depvis.analysis;

import com.hcltech.depvis.analysis.exceptions.ConfigurationException;
import com.hcltech.depvis.analysis.exceptions.EmptyFieldException;
import com.hcltech.depvis.analysis.exceptions.RepositoryReadException;
import com.hcltech.depvis.analysis.exceptions.SaveException;
import com.hcltech.depvis.manifest.exceptions.ManifestException;

import java.io.IOException;
import java.io.UncheckedIOException;

/** Process exit status of a run. Every failure maps to exactly one non-zero code. */
public enum ExitCode {
    OK(0),
    CONFIGURATION_ERROR(2),
    EMPTY_FIELD(3),
    REPOSITORY_READ_ERROR(4),
    TREE_BUILD_ERROR(5),
    SAVE_ERROR(6);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Anything not recognised is a failure to build the tree, the step that has no typed errors of its own. */
    public static ExitCode forFailure(Throwable t) {
        if (t instanceof EmptyFieldException) return EMPTY_FIELD;
        if (t instanceof ConfigurationException) return CONFIGURATION_ERROR;
        if (t instanceof ManifestException || t instanceof RepositoryReadException) return REPOSITORY_READ_ERROR;
        if (t instanceof IOException || t instanceof UncheckedIOException) return REPOSITORY_READ_ERROR;
        if (t instanceof SaveException) return SAVE_ERROR;
        return TREE_BUILD_ERROR;
    }
}
