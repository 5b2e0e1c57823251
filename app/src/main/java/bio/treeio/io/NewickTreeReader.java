package bio.treeio.io;

import bio.treeio.config.NewickOptions;
import bio.treeio.parse.InputNormalizer;
import bio.treeio.parse.NewickParseException;
import bio.treeio.parse.NewickParser;
import bio.treeio.parse.NormalizedInput;
import bio.treeio.tree.Tree;
import bio.treeio.tree.TreeBuilder;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Reads Newick and NHX trees from text.
 */
public class NewickTreeReader {

    static final String MDC_TREE_INDEX = "treeIndex";

    private static final Logger LOGGER = LoggerFactory.getLogger(NewickTreeReader.class);

    private final InputNormalizer normalizer;
    private final NewickParser parser;
    private final TreeTextSplitter splitter;

    public NewickTreeReader(NewickOptions options) {
        this(new InputNormalizer(), new NewickParser(options), new TreeTextSplitter());
    }

    NewickTreeReader(InputNormalizer normalizer, NewickParser parser, TreeTextSplitter splitter) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.splitter = Objects.requireNonNull(splitter, "splitter");
    }

    /**
     * Reads a single tree.
     *
     * @throws NewickParseException if the text is not a well-formed tree
     */
    public Tree read(String text) {
        NormalizedInput input = normalizer.normalize(text);
        Tree tree = parser.parse(input.text(), new TreeBuilder()).withScore(input.score());
        if (input.rooted().isPresent()) {
            tree = tree.withRooted(input.rooted().get());
        }
        return tree;
    }

    /**
     * Reads every tree in {@code text}. A malformed tree is reported in the summary and does not prevent
     * the trees after it from being read.
     */
    public TreeReadSummary readAll(String text) {
        List<String> pieces = splitter.split(text);
        List<TreeParseResult> results = new ArrayList<>(pieces.size());
        for (int index = 0; index < pieces.size(); index++) {
            MDC.put(MDC_TREE_INDEX, Integer.toString(index));
            try {
                results.add(TreeParseResult.success(index, read(pieces.get(index))));
            } catch (NewickParseException ex) {
                LOGGER.warn("Skipping tree {}: {}", index, ex.getMessage());
                results.add(TreeParseResult.failure(index, ex));
            } finally {
                MDC.remove(MDC_TREE_INDEX);
            }
        }
        LOGGER.debug("Read {} tree(s) from {} piece(s)", results.size() - countFailures(results), pieces.size());
        return new TreeReadSummary(results);
    }

    private static long countFailures(List<TreeParseResult> results) {
        return results.stream().filter(result -> !result.isSuccess()).count();
    }
}
