package com.hcltech.depvis.analysis.collaborators;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** Writes each payload to {@code <directory>/<package>_deps.txt}, replacing any earlier result. */
public final class FileReportSink implements ReportSink {

    private static final Logger log = LoggerFactory.getLogger(FileReportSink.class);

    private final Path directory;

    public FileReportSink(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    @Override
    public String save(String packageName, String payload) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(fileName(packageName));
        Files.writeString(file, payload.endsWith("\n") ? payload : payload + "\n", StandardCharsets.UTF_8);
        log.info("Saved result for {} to {}", packageName, file);
        return "Saved to " + file;
    }

    static String fileName(String packageName) {
        return packageName.replaceAll("[^A-Za-z0-9._+-]", "_") + "_deps.txt";
    }
}
