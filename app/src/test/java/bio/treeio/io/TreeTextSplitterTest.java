package bio.treeio.io;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TreeTextSplitterTest {

    private final TreeTextSplitter splitter = new TreeTextSplitter();

    @Test
    void cutsAfterEachTerminator() {
        assertThat(splitter.split("(A,B);\n(C,D);\n"))
                .containsExactly("(A,B);", "\n(C,D);");
    }

    @Test
    void ignoresTerminatorsInsideQuotesAndBrackets() {
        assertThat(splitter.split("(\"A;x\",B)[note;1];(C,D);"))
                .containsExactly("(\"A;x\",B)[note;1];", "(C,D);");
    }

    @Test
    void keepsUnterminatedLastTree() {
        assertThat(splitter.split("(A,B);(C,D)")).containsExactly("(A,B);", "(C,D)");
    }

    @Test
    void returnsNothingForBlankText() {
        assertThat(splitter.split("  \n")).isEmpty();
        assertThat(splitter.split("(A,B);\n\n")).containsExactly("(A,B);");
    }
}
