package com.hcltech.depvis.analysis;

import java.util.Locale;
import java.util.Optional;

/** Where the repository named by a run comes from. */
public enum RepositoryMode {
    /** A manifest file on disk. */
    FILE,
    /** A package index fetched through an {@link com.hcltech.depvis.analysis.collaborators.IndexFetcher}. */
    REMOTE;

    public static Optional<RepositoryMode> fromName(String name) {
        if (name == null || name.isBlank()) return Optional.of(FILE);
        String n = name.trim().toUpperCase(Locale.ROOT);
        for (RepositoryMode m : values()) {
            if (m.name().equals(n)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
