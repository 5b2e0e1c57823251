package bio.treeio.writer;

import static org.assertj.core.api.Assertions.assertThat;

import bio.treeio.config.BootstrapStyle;
import bio.treeio.config.InternalNodeId;
import bio.treeio.config.NewickOptions;
import bio.treeio.config.OrderBy;
import bio.treeio.io.NewickTreeReader;
import bio.treeio.tree.Node;
import bio.treeio.tree.Tree;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class NewickWriterTest {

    private static final NewickOptions DEFAULTS = NewickOptions.defaults();
    private static final NewickOptions BOOTSTRAP_LABELS = DEFAULTS.withInternalNodeId(InternalNodeId.BOOTSTRAP);

    @Test
    void writesLabelsAndBranchLengths() {
        assertThat(rewrite("(A:1,B:2)C:3;", DEFAULTS, DEFAULTS)).isEqualTo("(A:1,B:2)C:3;");
    }

    @Test
    void writesBootstrapInPlaceOfLabelInTraditionalStyle() {
        String written = rewrite("(A:0.11,B:0.22)100:0.33;", BOOTSTRAP_LABELS, BOOTSTRAP_LABELS);

        assertThat(written).isEqualTo("(A:0.11,B:0.22)100:0.33;");
    }

    @Test
    void writesBootstrapInBracketsInMolphyStyle() {
        NewickOptions molphy = BOOTSTRAP_LABELS.withBootstrapStyle(BootstrapStyle.MOLPHY);

        String written = rewrite("(A:0.11,B:0.22)100:0.33;", BOOTSTRAP_LABELS, molphy);

        assertThat(written).isEqualTo("(A:0.11,B:0.22):0.33[100];");
    }

    @Test
    void readsMolphyOutputBack() {
        NewickOptions molphy = BOOTSTRAP_LABELS.withBootstrapStyle(BootstrapStyle.MOLPHY);
        Tree tree = new NewickTreeReader(molphy).read("(A:0.11,B:0.22):0.33[100];");

        assertThat(new NewickWriter(BOOTSTRAP_LABELS).write(tree)).isEqualTo("(A:0.11,B:0.22)100:0.33;");
    }

    @Test
    void omitsBranchLengthsInNoBranchLengthStyle() {
        NewickOptions style = DEFAULTS.withBootstrapStyle(BootstrapStyle.NOBRANCHLENGTH);

        assertThat(rewrite("(A:1,B:2)C:3;", DEFAULTS, style)).isEqualTo("(A,B)C;");
    }

    @Test
    void honoursSuppressionFlags() {
        NewickOptions noLengths = new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                true, false, false, false, OrderBy.NONE, false);
        NewickOptions noInternalLabels = new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                false, false, true, false, OrderBy.NONE, false);
        NewickOptions noBootstraps = new NewickOptions(InternalNodeId.BOOTSTRAP, BootstrapStyle.TRADITIONAL,
                false, true, false, false, OrderBy.NONE, false);

        assertThat(rewrite("(A:1,B:2)C:3;", DEFAULTS, noLengths)).isEqualTo("(A,B)C;");
        assertThat(rewrite("((A:1,B:2)X:3)C;", DEFAULTS, noInternalLabels)).isEqualTo("((:1,:2):3);");
        assertThat(rewrite("(A:1,B:2)95:3;", BOOTSTRAP_LABELS, noBootstraps)).isEqualTo("(A:1,B:2):3;");
    }

    @Test
    void suppressesLeafLabelsTogetherWithInternalLabels() {
        NewickOptions noLabels = new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                false, false, true, false, OrderBy.NONE, false);
        NewickOptions noLabelsWithBootstraps = new NewickOptions(InternalNodeId.BOOTSTRAP, BootstrapStyle.TRADITIONAL,
                false, false, true, false, OrderBy.NONE, false);

        assertThat(rewrite("(A:1,B:2)C:3;", DEFAULTS, noLabels)).isEqualTo("(:1,:2):3;");
        assertThat(rewrite("((A,B)95,C);", BOOTSTRAP_LABELS, noLabelsWithBootstraps)).isEqualTo("((,)95,);");
    }

    @Test
    void endsEveryNodeWithNewlineWhenRequested() {
        NewickOptions newlines = new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                false, false, false, true, OrderBy.NONE, false);

        assertThat(rewrite("(A,B)C;", DEFAULTS, newlines)).isEqualTo("(A\n,B\n)C\n;");
    }

    @Test
    void sortsSiblingsByNameWhenRequested() {
        NewickOptions byName = DEFAULTS.withOrderBy(OrderBy.NAME);

        assertThat(rewrite("(C,(B,A)X,,D);", DEFAULTS, byName)).isEqualTo("(C,D,(A,B)X,);");
        assertThat(rewrite("(C,(B,A)X,,D);", DEFAULTS, DEFAULTS)).isEqualTo("(C,(B,A)X,,D);");
    }

    @Test
    void quotesLabelsContainingWhitespace() {
        assertThat(rewrite("(\"Homo sapiens\":1,B:2);", DEFAULTS, DEFAULTS)).isEqualTo("(\"Homo sapiens\":1,B:2);");
    }

    @Test
    void prefixesBatchWithTreeCount() {
        NewickOptions counted = new NewickOptions(InternalNodeId.ID, BootstrapStyle.TRADITIONAL,
                false, false, false, false, OrderBy.NONE, true);
        NewickTreeReader reader = new NewickTreeReader(DEFAULTS);
        List<Tree> trees = List.of(reader.read("(A,B);"), reader.read("(C,D);"));

        assertThat(new NewickWriter(counted).writeAll(trees)).isEqualTo(" 2\n(A,B);\n(C,D);\n");
        assertThat(new NewickWriter(DEFAULTS).writeAll(trees)).isEqualTo("(A,B);\n(C,D);\n");
    }

    @Test
    void formatsNumbersWithoutTrailingZeros() {
        assertThat(NewickWriter.formatNumber(1.0)).isEqualTo("1");
        assertThat(NewickWriter.formatNumber(0.25)).isEqualTo("0.25");
        assertThat(NewickWriter.formatNumber(0.0)).isEqualTo("0");
        assertThat(NewickWriter.formatNumber(1e-10)).isEqualTo("0.0000000001");
        assertThat(NewickWriter.formatNumber(-2.50)).isEqualTo("-2.5");
    }

    @Test
    void preservesTopologyLabelsAndLengthsThroughRoundTrip() {
        NewickTreeReader reader = new NewickTreeReader(DEFAULTS);
        NewickWriter writer = new NewickWriter(DEFAULTS);
        List<String> inputs = List.of(
                "(A:1,B:2)C:3;",
                "((a:0.007249365808272394,b:0.02):0.1,(c,d)e,f:12.5);",
                "(,(,),);",
                "((((A))));",
                "(\"Homo sapiens\":0.2,(B:1e-3,C)D:0)E;");

        for (String input : inputs) {
            Tree original = reader.read(input);
            Tree reparsed = reader.read(writer.write(original));

            assertThat(describe(reparsed, reparsed.root())).as(input).isEqualTo(describe(original, original.root()));
        }
    }

    private static String rewrite(String input, NewickOptions readOptions, NewickOptions writeOptions) {
        Tree tree = new NewickTreeReader(readOptions).read(input);
        return new NewickWriter(writeOptions).write(tree);
    }

    private static String describe(Tree tree, Node node) {
        String children = tree.children(node).stream()
                .map(child -> describe(tree, child))
                .collect(Collectors.joining(" ", "{", "}"));
        return node.id().orElse("-") + "/" + node.branchLength().map(String::valueOf).orElse("-") + children;
    }
}
