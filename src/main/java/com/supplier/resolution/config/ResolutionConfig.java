package com.supplier.resolution.config;

import com.supplier.resolution.api.ResolutionOptions;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A loaded configuration file: where to read and write, and how to resolve.
 *
 * @param inputPath     input records
 * @param referencePath reference records, or null when the input is a candidate-pairs export
 * @param outputPath    output directory
 * @param options       validated resolution options
 */
public record ResolutionConfig(
        Path inputPath,
        Path referencePath,
        Path outputPath,
        ResolutionOptions options
) {
    public ResolutionConfig {
        Objects.requireNonNull(inputPath, "inputPath is required");
        Objects.requireNonNull(outputPath, "outputPath is required");
        Objects.requireNonNull(options, "options is required");
    }

    public boolean hasReferencePath() {
        return referencePath != null;
    }

    public ResolutionConfig withPaths(Path input, Path reference, Path output) {
        return new ResolutionConfig(
                input != null ? input : inputPath,
                reference != null ? reference : referencePath,
                output != null ? output : outputPath,
                options);
    }

    public ResolutionConfig withOptions(ResolutionOptions newOptions) {
        return new ResolutionConfig(inputPath, referencePath, outputPath, newOptions);
    }
}
