package bio.treeio.cli;

import bio.treeio.config.BootstrapStyle;
import bio.treeio.config.InternalNodeId;
import bio.treeio.config.LogFormat;
import bio.treeio.config.OrderBy;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "newick-treeio", mixinStandardHelpOptions = true,
        description = "Reads Newick/NHX trees and writes them back in the requested style")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", paramLabel = "FILE",
            description = "File holding one or more trees; standard input when omitted")
    private Path input;

    @CommandLine.Option(names = {"-o", "--output"}, paramLabel = "FILE", description = "Write trees to FILE instead of standard output")
    private Path output;

    @CommandLine.Option(names = "--internal-node-id", converter = InternalNodeIdConverter.class,
            description = "Read and write internal labels as: id or bootstrap")
    private InternalNodeId internalNodeId;

    @CommandLine.Option(names = "--bootstrap-style", converter = BootstrapStyleConverter.class,
            description = "Bootstrap placement: traditional, molphy or nobranchlength")
    private BootstrapStyle bootstrapStyle;

    @CommandLine.Option(names = "--order-by", converter = OrderByConverter.class, description = "Sibling order: none or name")
    private OrderBy orderBy;

    @CommandLine.Option(names = "--no-branch-lengths", description = "Omit branch lengths")
    private boolean noBranchLengths;

    @CommandLine.Option(names = "--no-bootstrap-values", description = "Omit bootstrap values")
    private boolean noBootstrapValues;

    @CommandLine.Option(names = "--no-internal-node-labels", description = "Omit node labels; bootstraps written as labels are kept")
    private boolean noInternalNodeLabels;

    @CommandLine.Option(names = "--newline-each-node", description = "Start a new line after every node")
    private boolean newlineEachNode;

    @CommandLine.Option(names = "--print-tree-count", description = "Write the number of trees before the trees")
    private boolean printTreeCount;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path output() {
        return output;
    }

    public InternalNodeId internalNodeId() {
        return internalNodeId;
    }

    public BootstrapStyle bootstrapStyle() {
        return bootstrapStyle;
    }

    public OrderBy orderBy() {
        return orderBy;
    }

    public boolean noBranchLengths() {
        return noBranchLengths;
    }

    public boolean noBootstrapValues() {
        return noBootstrapValues;
    }

    public boolean noInternalNodeLabels() {
        return noInternalNodeLabels;
    }

    public boolean newlineEachNode() {
        return newlineEachNode;
    }

    public boolean printTreeCount() {
        return printTreeCount;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
