package com.hcltech.depvis.graph;

import java.util.Locale;

/** How package names are canonicalised before they become node identities. One policy per graph. */
public enum NodeNormalization {
    IDENTITY {
        @Override public String apply(String id) { return id; }
    },
    UPPER_CASE {
        @Override public String apply(String id) { return id.toUpperCase(Locale.ROOT); }
    };

    public abstract String apply(String id);
}
