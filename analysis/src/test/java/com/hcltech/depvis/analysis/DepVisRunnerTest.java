package com.hcltech.depvis.analysis;

import com.hcltech.depvis.analysis.collaborators.GraphImageRenderer;
import com.hcltech.depvis.analysis.collaborators.IndexFetcher;
import com.hcltech.depvis.analysis.collaborators.ReportSink;
import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.graph.Edge;
import com.hcltech.depvis.manifest.exceptions.ManifestNotFoundException;
import com.hcltech.depvis.manifest.index.PackageIndexParser;
import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.apache.commons.compress.compressors.gzip.GzipCompressorOutputStream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DepVisRunnerTest {

    @Mock IndexFetcher fetcher;
    @Mock ReportSink sink;
    @Mock GraphImageRenderer renderer;

    private DepVisRunner runner;
    private String manifest;

    @BeforeEach
    void setUp() throws URISyntaxException {
        runner = new DepVisRunner(new DependencyAnalyzer(AnalyzerSettings.DEFAULTS), fetcher, sink, renderer);
        manifest = Path.of(DepVisRunnerTest.class.getResource("/DepVisRunnerTest/deps.txt").toURI()).toString();
    }

    private RunConfig local() {
        return RunConfig.of("app", manifest).withFormat("ws");
    }

    @Nested
    class Success {

        @Test
        void ascii_tree_is_saved_and_not_drawn() throws Exception {
            when(sink.save(anyString(), anyString())).thenReturn("saved");

            assertEquals(ExitCode.OK, runner.run(local()));

            verify(sink).save("app", "app\n├─ web\n│  └─ http\n└─ db");
            verifyNoInteractions(renderer, fetcher);
        }

        @Test
        void dot_output_is_saved_and_drawn_in_reverse() throws Exception {
            when(sink.save(anyString(), anyString())).thenReturn("saved");

            assertEquals(ExitCode.OK, runner.run(local().withOutputMode("dot").withReverse(true)));

            verify(sink).save(eq("app"), startsWith("digraph dependencies {"));
            verify(renderer).render("app", List.of(new Edge("web", "app"), new Edge("db", "app"), new Edge("http", "web")), true);
        }

        @Test
        void remote_index_goes_through_fetcher() throws Exception {
            when(fetcher.fetch("https://mirror/APKINDEX.tar.gz")).thenReturn(index("P:curl\nV:8.5.0-r0\nD:libcurl zlib\n"));
            when(sink.save(anyString(), anyString())).thenReturn("saved");

            AnalysisReport report = runner.execute(RunConfig.of("curl", "https://mirror/APKINDEX.tar.gz")
                    .withRepositoryMode("remote").withOutputMode("traversal"));

            assertEquals(List.of("curl", "libcurl", "zlib"), report.traversal());
            assertEquals("8.5.0-r0", report.record().orElseThrow().version());
            verify(sink).save("curl", "curl → libcurl → zlib");
        }

        @Test
        void undeclared_package_is_still_a_success() throws Exception {
            when(sink.save(anyString(), anyString())).thenReturn("saved");
            assertEquals(ExitCode.OK, runner.run(RunConfig.of("ghost", manifest).withFormat("ws")));
            verify(sink).save("ghost", "ghost");
        }
    }

    @Nested
    class Failures {

        @Test
        void empty_field() {
            assertEquals(ExitCode.EMPTY_FIELD, runner.run(RunConfig.of("", manifest)));
            verifyNoInteractions(sink, renderer, fetcher);
        }

        @Test
        void bad_configuration_value() {
            assertEquals(ExitCode.CONFIGURATION_ERROR, runner.run(local().withRepositoryMode("ftp")));
        }

        @Test
        void missing_manifest(@TempDir Path dir) {
            assertEquals(ExitCode.REPOSITORY_READ_ERROR, runner.run(RunConfig.of("app", dir.resolve("none.csv").toString())));
            verifyNoInteractions(sink);
        }

        @Test
        void missing_index_file_is_not_found(@TempDir Path dir) {
            Path missing = dir.resolve("APKINDEX.tar.gz");
            ManifestNotFoundException e = assertThrows(ManifestNotFoundException.class,
                    () -> runner.execute(RunConfig.of("a", missing.toString())));
            assertEquals(missing, e.path());
            assertEquals(ExitCode.REPOSITORY_READ_ERROR, runner.run(RunConfig.of("a", missing.toString())));
            verifyNoInteractions(sink, fetcher);
        }

        @Test
        void malformed_manifest(@TempDir Path dir) throws IOException {
            Path file = Files.writeString(dir.resolve("deps.json"), "[1, 2]");
            assertEquals(ExitCode.REPOSITORY_READ_ERROR, runner.run(RunConfig.of("app", file.toString())));
        }

        @Test
        void fetch_failure() throws Exception {
            when(fetcher.fetch(anyString())).thenThrow(new IOException("timeout"));
            assertEquals(ExitCode.REPOSITORY_READ_ERROR,
                    runner.run(RunConfig.of("curl", "https://mirror/x.tar.gz").withRepositoryMode("remote")));
        }

        @Test
        void sink_failure() throws Exception {
            when(sink.save(anyString(), anyString())).thenThrow(new IOException("disk full"));
            assertEquals(ExitCode.SAVE_ERROR, runner.run(local()));
        }

        @Test
        void renderer_failure() throws Exception {
            when(sink.save(anyString(), anyString())).thenReturn("saved");
            doThrow(new IOException("no dot binary")).when(renderer).render(anyString(), anyList(), anyBoolean());
            assertEquals(ExitCode.SAVE_ERROR, runner.run(local().withOutputMode("edges")));
        }

        @Test
        void analysis_failure_is_tree_build_error() throws Exception {
            DependencyAnalyzer broken = spy(new DependencyAnalyzer(AnalyzerSettings.DEFAULTS));
            doThrow(new IllegalStateException("boom")).when(broken).analyze(any(DependencyGraph.class), anyString(), anyBoolean());
            var r = new DepVisRunner(broken, fetcher, sink, renderer);
            assertEquals(ExitCode.TREE_BUILD_ERROR, r.run(local()));
            verifyNoInteractions(sink);
        }
    }

    private static byte[] index(String control) throws IOException {
        byte[] content = control.getBytes(StandardCharsets.UTF_8);
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        try (TarArchiveOutputStream tar = new TarArchiveOutputStream(new GzipCompressorOutputStream(bytes))) {
            TarArchiveEntry entry = new TarArchiveEntry(PackageIndexParser.CONTROL_MEMBER);
            entry.setSize(content.length);
            tar.putArchiveEntry(entry);
            tar.write(content);
            tar.closeArchiveEntry();
        }
        return bytes.toByteArray();
    }
}
