package bio.treeio.io;

import bio.treeio.parse.NewickParseException;
import bio.treeio.tree.Tree;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of reading one tree out of a multi-tree text: either the tree or the error that stopped it.
 */
public record TreeParseResult(int index, Optional<Tree> tree, Optional<NewickParseException> error) {

    public TreeParseResult {
        tree = tree == null ? Optional.empty() : tree;
        error = error == null ? Optional.empty() : error;
        if (tree.isPresent() == error.isPresent()) {
            throw new IllegalArgumentException("exactly one of tree and error must be present");
        }
    }

    public static TreeParseResult success(int index, Tree tree) {
        return new TreeParseResult(index, Optional.of(Objects.requireNonNull(tree, "tree")), Optional.empty());
    }

    public static TreeParseResult failure(int index, NewickParseException error) {
        return new TreeParseResult(index, Optional.empty(), Optional.of(Objects.requireNonNull(error, "error")));
    }

    public boolean isSuccess() {
        return tree.isPresent();
    }
}
