package bio.treeio.writer;

import bio.treeio.config.BootstrapStyle;
import bio.treeio.config.InternalNodeId;
import bio.treeio.config.NewickOptions;
import bio.treeio.config.OrderBy;
import bio.treeio.tree.Node;
import bio.treeio.tree.Tree;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Renders trees as Newick text according to {@link NewickOptions}.
 */
public class NewickWriter {

    private static final Comparator<Node> BY_NAME = Comparator.comparing(
            (Node node) -> node.id().orElse(null), Comparator.nullsLast(Comparator.naturalOrder()));

    private final NewickOptions options;

    public NewickWriter(NewickOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    public String write(Tree tree) {
        Objects.requireNonNull(tree, "tree");
        StringBuilder builder = new StringBuilder();
        appendNode(builder, tree, tree.root());
        return builder.append(';').toString();
    }

    /**
     * Renders several trees, one per line, preceded by the tree count when {@code printTreeCount} is set.
     */
    public String writeAll(List<Tree> trees) {
        Objects.requireNonNull(trees, "trees");
        StringBuilder builder = new StringBuilder();
        if (options.printTreeCount()) {
            builder.append(' ').append(trees.size()).append('\n');
        }
        for (Tree tree : trees) {
            builder.append(write(tree)).append('\n');
        }
        return builder.toString();
    }

    private void appendNode(StringBuilder builder, Tree tree, Node node) {
        List<Node> children = orderedChildren(tree, node);
        if (!children.isEmpty()) {
            builder.append('(');
            for (int i = 0; i < children.size(); i++) {
                if (i > 0) {
                    builder.append(',');
                }
                appendNode(builder, tree, children.get(i));
            }
            builder.append(')');
        }
        builder.append(label(node));
    }

    private List<Node> orderedChildren(Tree tree, Node node) {
        List<Node> children = tree.children(node);
        if (options.orderBy() == OrderBy.NAME && children.size() > 1) {
            return children.stream().sorted(BY_NAME).collect(Collectors.toList());
        }
        return children;
    }

    /**
     * Label of a single node, without its descendants.
     */
    String label(Node node) {
        StringBuilder label = new StringBuilder();
        Optional<Double> bootstrap = options.writesBootstraps() ? node.bootstrap() : Optional.empty();

        if (!node.isLeaf()
                && bootstrap.isPresent()
                && options.bootstrapStyle() == BootstrapStyle.TRADITIONAL
                && options.internalNodeId() == InternalNodeId.BOOTSTRAP) {
            label.append(formatNumber(bootstrap.get()));
        } else if (!options.noInternalNodeLabels()) {
            node.id().map(NewickWriter::quoteIfNeeded).ifPresent(label::append);
        }

        if (options.writesBranchLengths()) {
            node.branchLength().ifPresent(length -> label.append(':').append(formatNumber(length)));
        }

        if (options.bootstrapStyle() == BootstrapStyle.MOLPHY) {
            bootstrap.ifPresent(value -> label.append('[').append(formatNumber(value)).append(']'));
        }

        if (options.newlineEachNode()) {
            label.append('\n');
        }
        return label.toString();
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    private static String quoteIfNeeded(String id) {
        for (int i = 0; i < id.length(); i++) {
            if (Character.isWhitespace(id.charAt(i))) {
                return '"' + id + '"';
            }
        }
        return id;
    }
}
