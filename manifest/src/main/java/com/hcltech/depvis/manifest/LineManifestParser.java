package com.hcltech.depvis.manifest;

import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.NodeNormalization;
import com.hcltech.depvis.manifest.exceptions.ManifestParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Line-oriented adjacency list, {@code name: dep1, dep2} or {@code name: dep1 dep2}.
 * <ul>
 *   <li>blank lines and lines starting with {@code #} are skipped</li>
 *   <li>a line without {@code :} declares a package with no dependencies</li>
 *   <li>a package named on several lines gets the dependencies of all of them, in order</li>
 *   <li>a dependency token holding the other delimiter is rejected, never split or merged</li>
 * </ul>
 */
public final class LineManifestParser implements ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(LineManifestParser.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public enum Delimiter {
        COMMA(ManifestFormat.LINE_CSV),
        WHITESPACE(ManifestFormat.LINE_WS);

        final ManifestFormat format;

        Delimiter(ManifestFormat format) {
            this.format = format;
        }
    }

    private final Delimiter delimiter;
    private final NodeNormalization normalization;

    public LineManifestParser(Delimiter delimiter, NodeNormalization normalization) {
        this.delimiter = Objects.requireNonNull(delimiter, "delimiter");
        this.normalization = Objects.requireNonNull(normalization, "normalization");
    }

    @Override
    public ManifestFormat format() {
        return delimiter.format;
    }

    @Override
    public DependencyGraph parse(InputStream in, String source) throws IOException {
        DependencyGraph.Builder builder = DependencyGraph.builder(normalization);
        try (BufferedReader br = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                String trimmed = (lineNo == 1 ? stripBom(line) : line).strip();
                if (trimmed.isEmpty() || trimmed.startsWith("#")) continue;

                int colon = trimmed.indexOf(':');
                if (colon < 0) {
                    builder.addNode(trimmed);
                    continue;
                }
                String name = trimmed.substring(0, colon).strip();
                if (name.isEmpty()) {
                    throw new ManifestParseException(source, lineNo, line, "missing package name before ':'");
                }
                builder.addEdges(name, dependencies(trimmed.substring(colon + 1), source, lineNo, line));
            }
        }
        DependencyGraph graph = builder.build();
        log.debug("Parsed {} as {}: {} nodes, {} edges", source, format(), graph.nodes().size(), graph.edgeCount());
        return graph;
    }

    List<String> dependencies(String rest, String source, int lineNo, String line) {
        List<String> out = new ArrayList<>();
        String body = rest.strip();
        if (body.isEmpty()) return out;
        if (delimiter == Delimiter.COMMA) {
            for (String token : body.split(",")) {
                String dep = token.strip();
                if (dep.isEmpty()) continue;
                if (WHITESPACE.matcher(dep).find()) {
                    throw new ManifestParseException(source, lineNo, line,
                            "dependency '" + dep + "' contains whitespace in a comma-separated line");
                }
                out.add(dep);
            }
        } else {
            for (String dep : WHITESPACE.split(body)) {
                if (dep.indexOf(',') >= 0) {
                    throw new ManifestParseException(source, lineNo, line,
                            "dependency '" + dep + "' contains ',' in a whitespace-separated line");
                }
                out.add(dep);
            }
        }
        return out;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
