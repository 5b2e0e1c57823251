package bio.treeio.parse;

import java.util.Optional;

/**
 * Pulls the next token from a {@link TextCursor}. Which characters end a token depends on the
 * parser state, so every call names its own delimiter set.
 */
public final class NewickTokenizer {

    public static final String AFTER_OPEN = "[(:,)";
    public static final String AFTER_LABEL = "[:,);";
    public static final String BRANCH_LENGTH = "[,);";
    public static final String AFTER_ANNOTATION = ",);";
    public static final String FIRST = "(;";
    public static final String AFTER_TERMINATOR = "(";

    /**
     * Returns the next token, or an empty optional at end of input.
     *
     * <p>The token runs up to the earliest delimiter anywhere ahead, whatever its position in
     * {@code delimiters}. A delimiter at the cursor is returned as a one-character token.
     *
     * @throws TokenizationException if no delimiter occurs in the remaining input
     */
    public Optional<String> nextToken(TextCursor cursor, String delimiters) {
        cursor.skipWhitespace();
        if (cursor.isExhausted()) {
            return Optional.empty();
        }
        int distance = cursor.distanceToAny(delimiters);
        if (distance < 0) {
            throw new TokenizationException("Could not find any of the delimiters \"" + delimiters
                    + "\" in \"" + abbreviate(cursor.remaining()) + "\"", cursor.offset());
        }
        return Optional.of(cursor.take(distance == 0 ? 1 : distance));
    }

    private static String abbreviate(String value) {
        return value.length() <= 40 ? value : value.substring(0, 37) + "...";
    }
}
