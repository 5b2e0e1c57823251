package bio.treeio.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A parsed tree. The tree owns every node in an index-addressed arena; links between nodes are arena
 * indices, so nothing outside the tree keeps nodes reachable.
 */
public final class Tree {

    private final List<Node> arena;
    private final int rootIndex;
    private final Optional<Double> score;
    private final Optional<String> id;
    private final boolean rooted;

    Tree(List<Node> arena, int rootIndex) {
        this(List.copyOf(arena), rootIndex, Optional.empty(), Optional.empty(), true);
    }

    private Tree(List<Node> arena, int rootIndex, Optional<Double> score, Optional<String> id, boolean rooted) {
        if (rootIndex < 0 || rootIndex >= arena.size()) {
            throw new IllegalArgumentException("root index " + rootIndex + " outside arena of " + arena.size());
        }
        this.arena = arena;
        this.rootIndex = rootIndex;
        this.score = Objects.requireNonNull(score, "score");
        this.id = Objects.requireNonNull(id, "id");
        this.rooted = rooted;
    }

    public Node root() {
        return arena.get(rootIndex);
    }

    public Node node(int index) {
        return arena.get(index);
    }

    public int size() {
        return arena.size();
    }

    /**
     * All nodes in pre-order, starting at the root.
     */
    public List<Node> nodes() {
        List<Node> ordered = new ArrayList<>(arena.size());
        Deque<Node> pending = new ArrayDeque<>();
        pending.push(root());
        while (!pending.isEmpty()) {
            Node current = pending.pop();
            ordered.add(current);
            List<Integer> children = current.childIndices();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(arena.get(children.get(i)));
            }
        }
        return ordered;
    }

    public List<Node> leaves() {
        return nodes().stream().filter(Node::isLeaf).toList();
    }

    public List<Node> children(Node node) {
        return owned(node).childIndices().stream().map(arena::get).toList();
    }

    public Optional<Node> parent(Node node) {
        Node owned = owned(node);
        return owned.isRoot() ? Optional.empty() : Optional.of(arena.get(owned.parentIndex()));
    }

    public Optional<Node> findById(String nodeId) {
        return nodes().stream()
                .filter(node -> node.id().filter(nodeId::equals).isPresent())
                .findFirst();
    }

    public Optional<Double> score() {
        return score;
    }

    public Optional<String> id() {
        return id;
    }

    public boolean isRooted() {
        return rooted;
    }

    public Tree withScore(Optional<Double> value) {
        return new Tree(arena, rootIndex, value, id, rooted);
    }

    public Tree withId(Optional<String> value) {
        return new Tree(arena, rootIndex, score, value, rooted);
    }

    public Tree withRooted(boolean value) {
        return new Tree(arena, rootIndex, score, id, value);
    }

    private Node owned(Node node) {
        Objects.requireNonNull(node, "node");
        if (node.index() >= arena.size() || arena.get(node.index()) != node) {
            throw new IllegalArgumentException(node + " does not belong to this tree");
        }
        return node;
    }
}
