package com.hcltech.depvis.manifest.index;

import com.hcltech.depvis.graph.DependencyGraph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Graph of a package index plus the version metadata that is not part of the graph. */
public record PackageIndex(DependencyGraph graph, Map<String, PackageRecord> records) {
    public PackageIndex {
        records = Collections.unmodifiableMap(new LinkedHashMap<>(records));
    }

    /** Looks {@code name} up after applying the graph's normalization. */
    public Optional<PackageRecord> find(String name) {
        return Optional.ofNullable(records.get(graph.canonical(name)));
    }
}
