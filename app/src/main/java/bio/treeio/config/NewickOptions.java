package bio.treeio.config;

import java.util.Objects;

/**
 * Immutable parsing and writing options for the Newick format.
 */
public record NewickOptions(
        InternalNodeId internalNodeId,
        BootstrapStyle bootstrapStyle,
        boolean noBranchLengths,
        boolean noBootstrapValues,
        boolean noInternalNodeLabels,
        boolean newlineEachNode,
        OrderBy orderBy,
        boolean printTreeCount
) {

    public NewickOptions {
        internalNodeId = Objects.requireNonNullElse(internalNodeId, InternalNodeId.ID);
        bootstrapStyle = Objects.requireNonNullElse(bootstrapStyle, BootstrapStyle.TRADITIONAL);
        orderBy = Objects.requireNonNullElse(orderBy, OrderBy.NONE);
    }

    public static NewickOptions defaults() {
        return new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                false, false, false, false, OrderBy.NONE, false);
    }

    public NewickOptions withInternalNodeId(InternalNodeId value) {
        return new NewickOptions(value, bootstrapStyle, noBranchLengths, noBootstrapValues,
                noInternalNodeLabels, newlineEachNode, orderBy, printTreeCount);
    }

    public NewickOptions withBootstrapStyle(BootstrapStyle value) {
        return new NewickOptions(internalNodeId, value, noBranchLengths, noBootstrapValues,
                noInternalNodeLabels, newlineEachNode, orderBy, printTreeCount);
    }

    public NewickOptions withOrderBy(OrderBy value) {
        return new NewickOptions(internalNodeId, bootstrapStyle, noBranchLengths, noBootstrapValues,
                noInternalNodeLabels, newlineEachNode, value, printTreeCount);
    }

    public boolean writesBranchLengths() {
        return !noBranchLengths && bootstrapStyle != BootstrapStyle.NOBRANCHLENGTH;
    }

    public boolean writesBootstraps() {
        return !noBootstrapValues;
    }
}
