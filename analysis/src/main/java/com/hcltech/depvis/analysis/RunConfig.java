package com.hcltech.depvis.analysis;

/**
 * What a caller asks for in one run, as supplied by whatever reads the configuration file.
 * Values are raw; {@link RunConfigValidator} checks them.
 *
 * @param repository     manifest path, or index location when {@code repositoryMode} is {@code remote}
 * @param repositoryMode {@code file} (default) or {@code remote}
 * @param format         manifest format name, or blank to pick by file name
 * @param outputMode     {@code ascii_tree} (default), {@code traversal}, {@code edges} or {@code dot}
 * @param reverse        analyse packages that depend on {@code packageName} instead of its dependencies
 */
public record RunConfig(String packageName,
                        String repository,
                        String repositoryMode,
                        String format,
                        String outputMode,
                        boolean reverse) {

    public static RunConfig of(String packageName, String repository) {
        return new RunConfig(packageName, repository, null, null, null, false);
    }

    public RunConfig withRepositoryMode(String mode) {
        return new RunConfig(packageName, repository, mode, format, outputMode, reverse);
    }

    public RunConfig withFormat(String f) {
        return new RunConfig(packageName, repository, repositoryMode, f, outputMode, reverse);
    }

    public RunConfig withOutputMode(String mode) {
        return new RunConfig(packageName, repository, repositoryMode, format, mode, reverse);
    }

    public RunConfig withReverse(boolean r) {
        return new RunConfig(packageName, repository, repositoryMode, format, outputMode, r);
    }
}
