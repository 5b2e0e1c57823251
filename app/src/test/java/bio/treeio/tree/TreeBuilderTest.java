package bio.treeio.tree;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import bio.treeio.parse.Element;
import bio.treeio.parse.StructuralException;
import org.junit.jupiter.api.Test;

class TreeBuilderTest {

    @Test
    void linksChildrenToTheEnclosingNode() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.TREE);
        builder.start(Element.NODE);
        leaf(builder, "A", "0.5");
        leaf(builder, "B", "1");
        field(builder, Element.ID, "root");
        builder.end(Element.NODE);
        builder.end(Element.TREE);

        Tree tree = builder.endDocument();

        Node root = tree.root();
        assertThat(root.id()).contains("root");
        assertThat(root.isRoot()).isTrue();
        assertThat(root.isLeaf()).isFalse();
        assertThat(tree.children(root)).extracting(node -> node.id().orElse(null)).containsExactly("A", "B");
        Node a = tree.children(root).get(0);
        assertThat(a.branchLength()).contains(0.5);
        assertThat(a.isLeaf()).isTrue();
        assertThat(tree.parent(a)).contains(root);
        assertThat(tree.parent(root)).isEmpty();
    }

    @Test
    void storesTagNameAndValueAsOnePair() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.TREE);
        builder.start(Element.NODE);
        builder.start(Element.NHX_TAG);
        field(builder, Element.TAG_NAME, "S");
        field(builder, Element.TAG_VALUE, "human");
        field(builder, Element.TAG_NAME, "S");
        field(builder, Element.TAG_VALUE, "mouse");
        builder.end(Element.NHX_TAG);
        builder.end(Element.NODE);
        builder.end(Element.TREE);

        Node root = builder.endDocument().root();

        assertThat(root.tags()).containsExactly(new NodeTag("S", "human"), new NodeTag("S", "mouse"));
        assertThat(root.tagValues("S")).containsExactly("human", "mouse");
        assertThat(root.tagValue("S")).contains("human");
        assertThat(root.tagValue("T")).isEmpty();
    }

    @Test
    void tracksOpenElements() {
        TreeBuilder builder = new TreeBuilder();

        builder.start(Element.TREE);
        builder.start(Element.NODE);

        assertThat(builder.isOpen(Element.TREE)).isTrue();
        assertThat(builder.isOpen(Element.NODE)).isTrue();
        assertThat(builder.isOpen(Element.NHX_TAG)).isFalse();

        builder.end(Element.NODE);
        builder.end(Element.TREE);

        assertThat(builder.isOpen(Element.TREE)).isFalse();
        assertThat(builder.isOpen(Element.NODE)).isFalse();
    }

    @Test
    void refusesToFinishWithOpenNode() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.TREE);
        builder.start(Element.NODE);

        Throwable thrown = catchThrowable(builder::endDocument);

        assertThat(thrown).isInstanceOf(StructuralException.class).hasMessageContaining("never closed");
    }

    @Test
    void refusesToFinishWithSeveralRoots() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.NODE);
        builder.end(Element.NODE);
        builder.start(Element.NODE);
        builder.end(Element.NODE);

        Throwable thrown = catchThrowable(builder::endDocument);

        assertThat(thrown).isInstanceOf(StructuralException.class).hasMessageContaining("exactly one root");
    }

    @Test
    void refusesToFinishWithoutNodes() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.TREE);
        builder.end(Element.TREE);

        assertThat(catchThrowable(builder::endDocument)).isInstanceOf(StructuralException.class);
    }

    @Test
    void cannotBeReusedAfterProducingTree() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.NODE);
        builder.end(Element.NODE);
        builder.endDocument();

        assertThat(catchThrowable(() -> builder.start(Element.NODE))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void rejectsFieldOutsideNode() {
        TreeBuilder builder = new TreeBuilder();
        builder.start(Element.TREE);

        assertThat(catchThrowable(() -> builder.start(Element.ID))).isInstanceOf(StructuralException.class);
    }

    private static void leaf(TreeBuilder builder, String id, String branchLength) {
        builder.start(Element.NODE);
        field(builder, Element.ID, id);
        field(builder, Element.BRANCH_LENGTH, branchLength);
        builder.end(Element.NODE);
    }

    private static void field(TreeBuilder builder, Element element, String text) {
        builder.start(element);
        builder.characters(text);
        builder.end(element);
    }
}
