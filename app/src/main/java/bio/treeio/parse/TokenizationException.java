package bio.treeio.parse;

/**
 * Raised when none of the requested delimiters occurs in the remaining input.
 */
public class TokenizationException extends NewickParseException {

    public TokenizationException(String message, int position) {
        super(message, position);
    }
}
