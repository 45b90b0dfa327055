package com.hcltech.depvis.manifest.exceptions;

import java.nio.file.Path;

public final class ManifestNotFoundException extends ManifestException {
    private final Path path;

    public ManifestNotFoundException(Path path) {
        super(String.valueOf(path), "Manifest not found: " + path, null);
        this.path = path;
    }

    public Path path() {
        return path;
    }
}
