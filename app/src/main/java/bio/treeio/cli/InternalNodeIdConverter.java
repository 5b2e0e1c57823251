package bio.treeio.cli;

import bio.treeio.config.InternalNodeId;
import picocli.CommandLine;

/**
 * Parses internal node id CLI options.
 */
public class InternalNodeIdConverter implements CommandLine.ITypeConverter<InternalNodeId> {
    @Override
    public InternalNodeId convert(String value) {
        return InternalNodeId.from(value);
    }
}
