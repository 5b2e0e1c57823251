package bio.treeio.config;

import bio.treeio.cli.CliArguments;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INTERNAL_NODE_ID = "NEWICK_INTERNAL_NODE_ID";
    static final String ENV_BOOTSTRAP_STYLE = "NEWICK_BOOTSTRAP_STYLE";
    static final String ENV_ORDER_BY = "NEWICK_ORDER_BY";
    static final String ENV_NO_BRANCH_LENGTHS = "NEWICK_NO_BRANCH_LENGTHS";
    static final String ENV_NO_BOOTSTRAP_VALUES = "NEWICK_NO_BOOTSTRAP_VALUES";
    static final String ENV_NO_INTERNAL_NODE_LABELS = "NEWICK_NO_INTERNAL_NODE_LABELS";
    static final String ENV_NEWLINE_EACH_NODE = "NEWICK_NEWLINE_EACH_NODE";
    static final String ENV_PRINT_TREE_COUNT = "NEWICK_PRINT_TREE_COUNT";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");

        InternalNodeId internalNodeId = resolve(arguments.internalNodeId(), ENV_INTERNAL_NODE_ID,
                InternalNodeId::from, InternalNodeId.ID);
        BootstrapStyle bootstrapStyle = resolve(arguments.bootstrapStyle(), ENV_BOOTSTRAP_STYLE,
                BootstrapStyle::from, BootstrapStyle.TRADITIONAL);
        OrderBy orderBy = resolve(arguments.orderBy(), ENV_ORDER_BY, OrderBy::from, OrderBy.NONE);
        LogFormat logFormat = resolve(arguments.logFormat(), ENV_LOG_FORMAT, LogFormat::from, LogFormat.TEXT);

        NewickOptions newickOptions = new NewickOptions(
                internalNodeId,
                bootstrapStyle,
                resolveFlag(arguments.noBranchLengths(), ENV_NO_BRANCH_LENGTHS),
                resolveFlag(arguments.noBootstrapValues(), ENV_NO_BOOTSTRAP_VALUES),
                resolveFlag(arguments.noInternalNodeLabels(), ENV_NO_INTERNAL_NODE_LABELS),
                resolveFlag(arguments.newlineEachNode(), ENV_NEWLINE_EACH_NODE),
                orderBy,
                resolveFlag(arguments.printTreeCount(), ENV_PRINT_TREE_COUNT));

        return new Config(Optional.ofNullable(arguments.input()), Optional.ofNullable(arguments.output()),
                logFormat, newickOptions);
    }

    private <T> T resolve(T cliValue, String envKey, Function<String, T> parser, T defaultValue) {
        if (cliValue != null) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(parser)
                .orElse(defaultValue);
    }

    private boolean resolveFlag(boolean cliValue, String envKey) {
        if (cliValue) {
            return true;
        }
        return environmentReader.get(envKey)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
