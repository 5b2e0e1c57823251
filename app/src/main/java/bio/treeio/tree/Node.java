package bio.treeio.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * A node of a {@link Tree}. Parent and children are indices into the owning tree, resolved through
 * {@link Tree#parent(Node)} and {@link Tree#children(Node)}.
 *
 * <p>Fields are filled in by {@link TreeBuilder} while the node is open and are not changed afterwards.
 */
public final class Node {

    static final int NO_PARENT = -1;

    private final int index;
    private final int parentIndex;
    private final List<Integer> childIndices = new ArrayList<>();
    private final List<NodeTag> tags = new ArrayList<>();
    private String id;
    private Double branchLength;
    private Double bootstrap;

    Node(int index, int parentIndex) {
        this.index = index;
        this.parentIndex = parentIndex;
    }

    public int index() {
        return index;
    }

    public Optional<String> id() {
        return Optional.ofNullable(id);
    }

    public Optional<Double> branchLength() {
        return Optional.ofNullable(branchLength);
    }

    public Optional<Double> bootstrap() {
        return Optional.ofNullable(bootstrap);
    }

    /**
     * NHX tags in the order they were read. Names may repeat.
     */
    public List<NodeTag> tags() {
        return Collections.unmodifiableList(tags);
    }

    public List<String> tagValues(String name) {
        List<String> values = new ArrayList<>();
        for (NodeTag tag : tags) {
            if (tag.name().equals(name)) {
                values.add(tag.value());
            }
        }
        return values;
    }

    /**
     * First value recorded for {@code name}.
     */
    public Optional<String> tagValue(String name) {
        return tags.stream()
                .filter(tag -> tag.name().equals(name))
                .map(NodeTag::value)
                .findFirst();
    }

    public boolean isLeaf() {
        return childIndices.isEmpty();
    }

    public boolean isRoot() {
        return parentIndex == NO_PARENT;
    }

    int parentIndex() {
        return parentIndex;
    }

    List<Integer> childIndices() {
        return Collections.unmodifiableList(childIndices);
    }

    void addChild(int childIndex) {
        childIndices.add(childIndex);
    }

    void setId(String id) {
        this.id = id;
    }

    void setBranchLength(double branchLength) {
        this.branchLength = branchLength;
    }

    void setBootstrap(double bootstrap) {
        this.bootstrap = bootstrap;
    }

    void addTag(NodeTag tag) {
        tags.add(tag);
    }

    @Override
    public String toString() {
        return "Node[" + index + (id == null ? "" : " " + id) + "]";
    }
}
