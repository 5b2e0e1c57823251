package bio.treeio.tree;

import java.util.Objects;

/**
 * One NHX attribute attached to a node.
 */
public record NodeTag(String name, String value) {

    public NodeTag {
        Objects.requireNonNull(name, "name");
        value = Objects.requireNonNullElse(value, "");
    }
}
