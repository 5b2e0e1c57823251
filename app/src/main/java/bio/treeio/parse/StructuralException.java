package bio.treeio.parse;

/**
 * Raised for unbalanced parentheses, misplaced tokens and trailing content after the terminator.
 */
public class StructuralException extends NewickParseException {

    public StructuralException(String message, int position) {
        super(message, position);
    }

    public StructuralException(String message, int position, Throwable cause) {
        super(message, position, cause);
    }
}
