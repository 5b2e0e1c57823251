package bio.treeio.tree;

import bio.treeio.parse.Element;
import bio.treeio.parse.StructuralException;
import bio.treeio.parse.TreeEventSink;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Builds a {@link Tree} from parser events.
 *
 * <p>A builder assembles exactly one tree and must be thrown away afterwards, also when parsing failed
 * half way.
 */
public class TreeBuilder implements TreeEventSink<Tree> {

    private final List<Node> arena = new ArrayList<>();
    private final Deque<Integer> openNodes = new ArrayDeque<>();
    private final List<Integer> topLevelNodes = new ArrayList<>();
    private final Set<Element> openElements = EnumSet.noneOf(Element.class);
    private Element currentField;
    private String pendingTagName;
    private boolean completed;

    @Override
    public void start(Element element) {
        ensureNotCompleted();
        switch (element) {
            case NODE -> startNode();
            case TREE, NHX_TAG -> openElements.add(element);
            case ID, BRANCH_LENGTH, BOOTSTRAP, TAG_NAME, TAG_VALUE -> {
                requireOpenNode(element);
                openElements.add(element);
                currentField = element;
            }
        }
    }

    @Override
    public void end(Element element) {
        ensureNotCompleted();
        switch (element) {
            case NODE -> endNode();
            case NHX_TAG -> {
                pendingTagName = null;
                openElements.remove(element);
            }
            case TREE -> openElements.remove(element);
            case ID, BRANCH_LENGTH, BOOTSTRAP, TAG_NAME, TAG_VALUE -> {
                openElements.remove(element);
                if (currentField == element) {
                    currentField = null;
                }
            }
        }
    }

    @Override
    public void characters(String text) {
        ensureNotCompleted();
        if (currentField == null) {
            return;
        }
        Node node = arena.get(openNodes.peek());
        switch (currentField) {
            case ID -> node.setId(text);
            case BRANCH_LENGTH -> node.setBranchLength(parseNumber(text, "branch length"));
            case BOOTSTRAP -> node.setBootstrap(parseNumber(text, "bootstrap"));
            case TAG_NAME -> pendingTagName = text;
            case TAG_VALUE -> {
                if (pendingTagName != null) {
                    node.addTag(new NodeTag(pendingTagName, text));
                    pendingTagName = null;
                }
            }
            default -> throw new IllegalStateException("No character data expected for " + currentField);
        }
    }

    @Override
    public Tree endDocument() {
        ensureNotCompleted();
        completed = true;
        if (!openNodes.isEmpty()) {
            throw new StructuralException(openNodes.size() + " node(s) were never closed", -1);
        }
        if (topLevelNodes.size() != 1) {
            throw new StructuralException("Expected exactly one root node but found " + topLevelNodes.size(), -1);
        }
        return new Tree(arena, topLevelNodes.get(0));
    }

    @Override
    public boolean isOpen(Element element) {
        if (element == Element.NODE) {
            return !openNodes.isEmpty();
        }
        return openElements.contains(element);
    }

    private void startNode() {
        int index = arena.size();
        Integer parent = openNodes.peek();
        Node node = new Node(index, parent == null ? Node.NO_PARENT : parent);
        arena.add(node);
        if (parent == null) {
            topLevelNodes.add(index);
        } else {
            arena.get(parent).addChild(index);
        }
        openNodes.push(index);
    }

    private void endNode() {
        if (openNodes.isEmpty()) {
            throw new StructuralException("Node closed without being opened", -1);
        }
        openNodes.pop();
    }

    private void requireOpenNode(Element element) {
        if (openNodes.isEmpty()) {
            throw new StructuralException(element + " outside of a node", -1);
        }
    }

    private void ensureNotCompleted() {
        if (completed) {
            throw new IllegalStateException("TreeBuilder has already produced its tree");
        }
    }

    private static double parseNumber(String text, String what) {
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException ex) {
            throw new StructuralException("Invalid " + what + " '" + text + "'", -1, ex);
        }
    }
}
