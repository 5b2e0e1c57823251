package bio.treeio.parse;

import java.util.Objects;
import java.util.Optional;

/**
 * Newick text ready for the parser, plus the tree-level values found in a leading bracket comment.
 */
public record NormalizedInput(String text, Optional<Double> score, Optional<Boolean> rooted) {

    public NormalizedInput {
        Objects.requireNonNull(text, "text");
        score = score == null ? Optional.empty() : score;
        rooted = rooted == null ? Optional.empty() : rooted;
    }
}
