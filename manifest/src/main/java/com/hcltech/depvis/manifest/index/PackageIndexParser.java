package com.hcltech.depvis.manifest.index;

import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.NodeNormalization;
import com.hcltech.depvis.manifest.ManifestFormat;
import com.hcltech.depvis.manifest.ManifestParser;
import com.hcltech.depvis.manifest.exceptions.ManifestNotFoundException;
import com.hcltech.depvis.manifest.exceptions.ManifestParseException;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads a gzip-compressed tar holding an {@value #CONTROL_MEMBER} member. The member is a list of
 * blank-line separated records of {@code K:value} lines; {@code P} names the package,
 * {@code V} is its version and {@code D} its whitespace-separated dependency tokens.
 * <p>
 * Dependency tokens keep their constraint suffixes. Names and tokens both get the parser's normalization.
 */
public final class PackageIndexParser implements ManifestParser {

    private static final Logger log = LoggerFactory.getLogger(PackageIndexParser.class);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public static final String CONTROL_MEMBER = "APKINDEX";
    static final String NAME_KEY = "P";
    static final String VERSION_KEY = "V";
    static final String DEPENDS_KEY = "D";

    private final NodeNormalization normalization;

    public PackageIndexParser(NodeNormalization normalization) {
        this.normalization = Objects.requireNonNull(normalization, "normalization");
    }

    @Override
    public ManifestFormat format() {
        return ManifestFormat.BINARY_INDEX;
    }

    @Override
    public DependencyGraph parse(InputStream in, String source) throws IOException {
        return parseIndex(in, source).graph();
    }

    public PackageIndex parseIndex(byte[] bytes, String source) throws IOException {
        return parseIndex(new ByteArrayInputStream(bytes), source);
    }

    public PackageIndex parseIndex(Path path) throws IOException {
        if (!Files.isRegularFile(path)) throw new ManifestNotFoundException(path);
        try (InputStream in = Files.newInputStream(path)) {
            return parseIndex(in, path.toString());
        }
    }

    public PackageIndex parseIndex(InputStream in, String source) throws IOException {
        return parseControl(readControlMember(in, source), source);
    }

    String readControlMember(InputStream in, String source) {
        // Signed indexes are several gzip streams back to back
        try (TarArchiveInputStream tar = new TarArchiveInputStream(new GzipCompressorInputStream(in, true))) {
            TarArchiveEntry entry;
            while ((entry = tar.getNextEntry()) != null) {
                if (!entry.isDirectory() && CONTROL_MEMBER.equals(memberName(entry.getName()))) {
                    return new String(tar.readAllBytes(), StandardCharsets.UTF_8);
                }
            }
        } catch (IOException e) {
            throw new ManifestParseException(source, 0, "cannot read index archive: " + e.getMessage(), e);
        }
        throw new ManifestParseException(source, List.of("archive has no '" + CONTROL_MEMBER + "' member"));
    }

    PackageIndex parseControl(String text, String source) throws IOException {
        Map<String, PackageRecord> records = new LinkedHashMap<>();
        Map<String, String> fields = new LinkedHashMap<>();
        int skipped = 0;

        try (BufferedReader br = new BufferedReader(new StringReader(text))) {
            String line;
            int lineNo = 0;
            while ((line = br.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    addRecord(fields, records);
                    fields.clear();
                    continue;
                }
                int colon = line.indexOf(':');
                if (colon < 0) {
                    log.warn("{}:{}: skipping index line without ':' [{}]", source, lineNo, line);
                    skipped++;
                    continue;
                }
                fields.put(line.substring(0, colon).strip(), line.substring(colon + 1).strip());
            }
        }
        addRecord(fields, records);

        DependencyGraph.Builder builder = DependencyGraph.builder(normalization);
        for (PackageRecord record : records.values()) builder.addEdges(record.name(), record.dependencies());
        DependencyGraph graph = builder.build();
        log.debug("Parsed {} as {}: {} packages, {} edges, {} lines skipped",
                source, format(), records.size(), graph.edgeCount(), skipped);
        return new PackageIndex(graph, records);
    }

    private void addRecord(Map<String, String> fields, Map<String, PackageRecord> records) {
        String name = fields.get(NAME_KEY);
        if (name == null || name.isBlank()) return;
        String deps = fields.getOrDefault(DEPENDS_KEY, "").strip();
        List<String> dependencies = new ArrayList<>();
        if (!deps.isEmpty()) {
            for (String token : WHITESPACE.split(deps)) dependencies.add(normalization.apply(token));
        }

        String id = normalization.apply(name.strip());
        // A later block for the same package replaces the earlier one
        PackageRecord previous = records.put(id, new PackageRecord(id, fields.get(VERSION_KEY), dependencies));
        if (previous != null) log.debug("Package {} listed more than once, keeping the last record", id);
    }

    static String memberName(String name) {
        return name.startsWith("./") ? name.substring(2) : name;
    }
}
