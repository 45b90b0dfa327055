package com.hcltech.depvis.analysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

public enum OutputMode {
    ASCII_TREE,
    TRAVERSAL,
    EDGES,
    DOT;

    private static final Logger log = LoggerFactory.getLogger(OutputMode.class);

    public static final OutputMode DEFAULT = ASCII_TREE;

    /** Case-insensitive; blank gives the default, anything unrecognized falls back to it with a warning. */
    public static OutputMode parse(String name) {
        if (name == null || name.isBlank()) return DEFAULT;
        String n = name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (OutputMode m : values()) {
            if (m.name().equals(n)) return m;
        }
        log.warn("Output mode '{}' not recognized; defaulting to {}", name, DEFAULT.modeName());
        return DEFAULT;
    }

    public String modeName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Modes whose payload is a graph a renderer can draw. */
    public boolean isGraph() {
        return this == EDGES || this == DOT;
    }
}
