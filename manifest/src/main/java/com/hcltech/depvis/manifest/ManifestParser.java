package com.hcltech.depvis.manifest;

import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.NodeNormalization;
import com.hcltech.depvis.manifest.exceptions.ManifestNotFoundException;
import com.hcltech.depvis.manifest.index.PackageIndexParser;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads one manifest format into a {@link DependencyGraph}. Parsers have no side effects beyond
 * reading their input.
 */
public interface ManifestParser {

    ManifestFormat format();

    /**
     * @param source names the input in error messages
     * @throws com.hcltech.depvis.manifest.exceptions.ManifestParseException if the input has the wrong shape
     */
    DependencyGraph parse(InputStream in, String source) throws IOException;

    default DependencyGraph parse(byte[] bytes, String source) throws IOException {
        return parse(new ByteArrayInputStream(bytes), source);
    }

    default DependencyGraph parse(Path path) throws IOException {
        if (!Files.isRegularFile(path)) throw new ManifestNotFoundException(path);
        try (InputStream in = Files.newInputStream(path)) {
            return parse(in, path.toString());
        }
    }

    static ManifestParser forFormat(ManifestFormat format, NodeNormalization normalization) {
        return switch (format) {
            case LINE_CSV -> new LineManifestParser(LineManifestParser.Delimiter.COMMA, normalization);
            case LINE_WS -> new LineManifestParser(LineManifestParser.Delimiter.WHITESPACE, normalization);
            case STRUCTURED -> new StructuredManifestParser(normalization);
            case BINARY_INDEX -> new PackageIndexParser(normalization);
        };
    }

    /** Parser chosen by {@link ManifestFormat#detect(String)} on the file name. */
    static ManifestParser forPath(Path path, NodeNormalization normalization) {
        Path name = path.getFileName();
        return forFormat(ManifestFormat.detect(name == null ? "" : name.toString()), normalization);
    }
}
