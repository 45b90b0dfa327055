package com.hcltech.depvis.analysis.collaborators;

import java.io.IOException;

/** Stores the text produced for a package, and optionally records it in version control. */
@FunctionalInterface
public interface ReportSink {
    /** @return a short description of where the payload went */
    String save(String packageName, String payload) throws IOException;
}
