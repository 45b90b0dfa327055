package com.hcltech.depvis.graph.render;

/** Branch-drawing convention for {@link AsciiTreeFormatter}. */
public enum TreeStyle {
    UNICODE("├─ ", "└─ ", "│  ", "   "),
    ASCII("+- ", "\\- ", "|  ", "   "),
    INDENT("   ", "   ", "   ", "   ");

    final String branch;
    final String lastBranch;
    final String continuation;
    final String gap;

    TreeStyle(String branch, String lastBranch, String continuation, String gap) {
        this.branch = branch;
        this.lastBranch = lastBranch;
        this.continuation = continuation;
        this.gap = gap;
    }
}
