package com.hcltech.depvis.analysis;

import com.hcltech.depvis.common.errorsor.ErrorsOr;
import com.hcltech.depvis.manifest.ManifestFormat;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Checks a {@link RunConfig} in two steps so callers can tell an empty required field from a bad value.
 * Each step reports every problem it finds.
 */
public final class RunConfigValidator {
    private RunConfigValidator() {}

    public static ErrorsOr<RunConfig> requiredFields(RunConfig config) {
        List<String> errors = new ArrayList<>();
        if (isBlank(config.packageName())) errors.add("package name is empty");
        if (isBlank(config.repository())) errors.add("repository path/url is empty");
        return ErrorsOr.valueUnless(errors, config);
    }

    /** Resolves modes and format. An unknown output mode is not an error, it falls back to the default. */
    public static ErrorsOr<RunRequest> validate(RunConfig config, AnalyzerSettings settings) {
        return requiredFields(config).flatMap(c -> resolve(c, settings));
    }

    static ErrorsOr<RunRequest> resolve(RunConfig config, AnalyzerSettings settings) {
        List<String> errors = new ArrayList<>();

        Optional<RepositoryMode> mode = RepositoryMode.fromName(config.repositoryMode());
        if (mode.isEmpty()) {
            errors.add("repository mode '" + config.repositoryMode() + "' is not one of file, remote");
        }

        ManifestFormat format = null;
        if (!isBlank(config.format())) {
            try {
                format = ManifestFormat.fromName(config.format());
            } catch (IllegalArgumentException e) {
                errors.add("format '" + config.format() + "' is not one of csv, ws, json, index");
            }
        }
        if (mode.isPresent() && mode.get() == RepositoryMode.REMOTE && format != null && format != ManifestFormat.BINARY_INDEX) {
            errors.add("remote repositories must be package indexes, got format '" + config.format() + "'");
        }
        if (!errors.isEmpty()) return ErrorsOr.errors(errors);

        String repository = config.repository().trim();
        if (format == null) format = defaultFormat(repository, mode.get(), settings);
        return ErrorsOr.lift(new RunRequest(config.packageName().trim(), repository, mode.get(), format,
                OutputMode.parse(config.outputMode()), config.reverse()));
    }

    static ManifestFormat defaultFormat(String repository, RepositoryMode mode, AnalyzerSettings settings) {
        if (mode == RepositoryMode.REMOTE) return ManifestFormat.BINARY_INDEX;
        Path name = Path.of(repository).getFileName();
        ManifestFormat detected = ManifestFormat.detect(name == null ? repository : name.toString());
        return detected == ManifestFormat.LINE_CSV ? settings.defaultFormat() : detected;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
