package com.hcltech.depvis.manifest.index;

import java.util.List;

/** One package block of an index. {@code version} is empty when the block has no version line. */
public record PackageRecord(String name, String version, List<String> dependencies) {
    public PackageRecord {
        version = version == null ? "" : version;
        dependencies = List.copyOf(dependencies);
    }
}
