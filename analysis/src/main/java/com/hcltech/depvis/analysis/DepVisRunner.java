package com.hcltech.depvis.analysis;

import com.hcltech.depvis.analysis.collaborators.GraphImageRenderer;
import com.hcltech.depvis.analysis.collaborators.IndexFetcher;
import com.hcltech.depvis.analysis.collaborators.ReportSink;
import com.hcltech.depvis.analysis.exceptions.ConfigurationException;
import com.hcltech.depvis.analysis.exceptions.EmptyFieldException;
import com.hcltech.depvis.analysis.exceptions.RepositoryReadException;
import com.hcltech.depvis.analysis.exceptions.SaveException;
import com.hcltech.depvis.analysis.exceptions.TreeBuildException;
import com.hcltech.depvis.common.errorsor.ErrorsOr;
import com.hcltech.depvis.graph.DependencyGraph;
import com.hcltech.depvis.manifest.ManifestFormat;
import com.hcltech.depvis.manifest.index.PackageIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * One run end to end: validate, read the repository, analyse, hand the payload on. Each step fails with
 * its own exception type so the caller gets a distinct {@link ExitCode}.
 */
public class DepVisRunner {

    private static final Logger log = LoggerFactory.getLogger(DepVisRunner.class);

    private final DependencyAnalyzer analyzer;
    private final IndexFetcher fetcher;
    private final ReportSink sink;
    private final GraphImageRenderer renderer;

    public DepVisRunner(DependencyAnalyzer analyzer, IndexFetcher fetcher, ReportSink sink, GraphImageRenderer renderer) {
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.renderer = Objects.requireNonNull(renderer, "renderer");
    }

    public ExitCode run(RunConfig config) {
        try {
            execute(config);
            return ExitCode.OK;
        } catch (RuntimeException e) {
            ExitCode code = ExitCode.forFailure(e);
            log.error("Run for '{}' failed with {} ({}): {}", config.packageName(), code, code.code(), e.getMessage(), e);
            return code;
        }
    }

    /** Like {@link #run} but lets the failure through. */
    public AnalysisReport execute(RunConfig config) {
        RunRequest request = validate(config);
        log.info("Package '{}' from {} repository {} as {}, output {}{}", request.packageName(),
                request.repositoryMode(), request.repository(), request.format(),
                request.outputMode().modeName(), request.reverse() ? ", reverse" : "");

        AnalysisReport report = analyze(request);
        report.packageSummary().ifPresent(log::info);
        publish(request, report);
        return report;
    }

    RunRequest validate(RunConfig config) {
        ErrorsOr<RunConfig> required = RunConfigValidator.requiredFields(config);
        if (required.isError()) throw new EmptyFieldException(required.getErrors());
        ErrorsOr<RunRequest> request = RunConfigValidator.validate(config, analyzer.settings());
        if (request.isError()) throw new ConfigurationException(request.getErrors());
        return request.valueOrThrow();
    }

    AnalysisReport analyze(RunRequest request) {
        if (request.format() == ManifestFormat.BINARY_INDEX) {
            PackageIndex index = readIndex(request);
            return build(() -> analyzer.analyze(index, request.packageName(), request.reverse()));
        }
        try {
            DependencyGraph graph = analyzer.load(Path.of(request.repository()), request.format());
            return build(() -> analyzer.analyze(graph, request.packageName(), request.reverse()));
        } catch (IOException e) {
            throw new RepositoryReadException("Cannot read repository " + request.repository(), e);
        }
    }

    private PackageIndex readIndex(RunRequest request) {
        try {
            if (request.repositoryMode() == RepositoryMode.REMOTE) {
                byte[] bytes = fetcher.fetch(request.repository());
                return analyzer.loadIndex(new ByteArrayInputStream(bytes), request.repository());
            }
            return analyzer.loadIndex(Path.of(request.repository()));
        } catch (IOException e) {
            throw new RepositoryReadException("Cannot read package index " + request.repository(), e);
        }
    }

    private static AnalysisReport build(Supplier<AnalysisReport> analysis) {
        try {
            return analysis.get();
        } catch (RuntimeException e) {
            throw new TreeBuildException("Cannot build dependency tree: " + e.getMessage(), e);
        }
    }

    void publish(RunRequest request, AnalysisReport report) {
        try {
            String where = sink.save(report.start(), report.payload(request.outputMode()));
            log.info(where);
            if (request.outputMode().isGraph()) {
                renderer.render(report.start(), report.edges(), report.reverse());
            }
        } catch (IOException | RuntimeException e) {
            throw new SaveException("Cannot save result for " + report.start() + ": " + e.getMessage(), e);
        }
    }
}
