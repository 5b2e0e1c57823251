package bio.treeio.cli;

import bio.treeio.config.BootstrapStyle;
import picocli.CommandLine;

/**
 * Parses bootstrap style CLI options.
 */
public class BootstrapStyleConverter implements CommandLine.ITypeConverter<BootstrapStyle> {
    @Override
    public BootstrapStyle convert(String value) {
        return BootstrapStyle.from(value);
    }
}
