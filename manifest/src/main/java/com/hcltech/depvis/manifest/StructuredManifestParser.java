package com.hcltech.depvis.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hcltech.depvis.common.errorsor.ErrorsOr;
import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.NodeNormalization;
import com.hcltech.depvis.manifest.exceptions.ManifestParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON object mapping package name to its dependencies, given as {@code null}, {@code ""}, an array of
 * names, or one comma-separated string. All shapes give the same ordered list; blank entries are dropped.
 * Every malformed entry is reported, not only the first.
 */
public final class StructuredManifestParser implements ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(StructuredManifestParser.class);

    // Comments and trailing commas are common in hand-written manifests
    static final ObjectMapper JSON = new ObjectMapper()
            .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS.mappedFeature())
            .enable(JsonReadFeature.ALLOW_TRAILING_COMMA.mappedFeature());

    private final NodeNormalization normalization;

    public StructuredManifestParser(NodeNormalization normalization) {
        this.normalization = Objects.requireNonNull(normalization, "normalization");
    }

    @Override
    public ManifestFormat format() {
        return ManifestFormat.STRUCTURED;
    }

    @Override
    public DependencyGraph parse(InputStream in, String source) throws IOException {
        JsonNode root;
        try {
            root = JSON.readTree(in);
        } catch (JsonProcessingException e) {
            int line = e.getLocation() == null ? 0 : e.getLocation().getLineNr();
            throw new ManifestParseException(source, line, "invalid JSON: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            String kind = root == null || root.isMissingNode() ? "empty document" : root.getNodeType().toString();
            throw new ManifestParseException(source, List.of("top level must be a JSON object, got " + kind));
        }

        DependencyGraph.Builder builder = DependencyGraph.builder(normalization);
        List<String> problems = new ArrayList<>();
        var fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String name = field.getKey().strip();
            if (name.isEmpty()) {
                problems.add("empty package name");
                continue;
            }
            ErrorsOr<List<String>> deps = dependencies(name, field.getValue());
            if (deps.isError()) problems.addAll(deps.getErrors());
            else builder.addEdges(name, deps.valueOrThrow());
        }
        if (!problems.isEmpty()) throw new ManifestParseException(source, problems);

        DependencyGraph graph = builder.build();
        log.debug("Parsed {} as {}: {} nodes, {} edges", source, format(), graph.nodes().size(), graph.edgeCount());
        return graph;
    }

    static ErrorsOr<List<String>> dependencies(String name, JsonNode value) {
        if (value == null || value.isNull()) return ErrorsOr.lift(List.of());
        if (value.isTextual()) return ErrorsOr.lift(splitCommas(value.asText()));
        if (!value.isArray()) {
            return ErrorsOr.error("'" + name + "' must be null, a string or an array of strings, got " + value.getNodeType());
        }
        List<String> deps = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < value.size(); i++) {
            JsonNode item = value.get(i);
            if (!item.isTextual()) {
                errors.add("'" + name + "'[" + i + "] must be a string, got " + item.getNodeType());
            } else if (!item.asText().isBlank()) {
                deps.add(item.asText().strip());
            }
        }
        return ErrorsOr.valueUnless(errors, deps);
    }

    private static List<String> splitCommas(String text) {
        List<String> out = new ArrayList<>();
        for (String token : text.split(",")) {
            if (!token.isBlank()) out.add(token.strip());
        }
        return out;
    }
}
