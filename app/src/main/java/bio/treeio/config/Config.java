package bio.treeio.config;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Optional<Path> input,
        Optional<Path> output,
        LogFormat logFormat,
        NewickOptions newickOptions
) {

    public Config {
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        newickOptions = Objects.requireNonNull(newickOptions, "newickOptions");
        if (input.isPresent() && output.isPresent()
                && input.get().toAbsolutePath().normalize().equals(output.get().toAbsolutePath().normalize())) {
            throw new IllegalArgumentException("--output must not overwrite the input file");
        }
    }
}
