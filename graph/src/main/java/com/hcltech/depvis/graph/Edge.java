package com.hcltech.depvis.graph;

import java.util.Objects;

/** A directed pair as drawn: {@code from -> to}. */
public record Edge(String from, String to) {
    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    public Edge swapped() {
        return new Edge(to, from);
    }

    @Override
    public String toString() {
        return from + " -> " + to;
    }
}
