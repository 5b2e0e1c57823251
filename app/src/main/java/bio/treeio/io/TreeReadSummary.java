package bio.treeio.io;

import bio.treeio.tree.Tree;
import java.util.List;
import java.util.Objects;

/**
 * Results of reading every tree in a text, in input order.
 */
public record TreeReadSummary(List<TreeParseResult> results) {

    public TreeReadSummary {
        results = List.copyOf(Objects.requireNonNull(results, "results"));
    }

    public List<Tree> trees() {
        return results.stream()
                .filter(TreeParseResult::isSuccess)
                .map(result -> result.tree().orElseThrow())
                .toList();
    }

    public List<TreeParseResult> failures() {
        return results.stream().filter(result -> !result.isSuccess()).toList();
    }

    public boolean hasFailures() {
        return results.stream().anyMatch(result -> !result.isSuccess());
    }
}
