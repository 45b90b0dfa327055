package com.hcltech.depvis.analysis.collaborators;

import java.io.IOException;

/** Retrieves the raw bytes of a remote package index. Retries, if any, belong to the implementation. */
@FunctionalInterface
public interface IndexFetcher {
    byte[] fetch(String location) throws IOException;
}
