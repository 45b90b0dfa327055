package com.hcltech.depvis.analysis;

import com.hcltech.depvis.manifest.ManifestFormat;

/** A {@link RunConfig} that passed validation, with every choice resolved. */
public record RunRequest(String packageName,
                         String repository,
                         RepositoryMode repositoryMode,
                         ManifestFormat format,
                         OutputMode outputMode,
                         boolean reverse) {
}
