package bio.treeio.parse;

/**
 * Runtime exception raised when Newick text cannot be turned into a tree.
 */
public class NewickParseException extends RuntimeException {

    private final int position;

    public NewickParseException(String message, int position) {
        super(message);
        this.position = position;
    }

    public NewickParseException(String message, int position, Throwable cause) {
        super(message, cause);
        this.position = position;
    }

    /**
     * Offset into the normalized text where the failure was detected, or -1 when unknown.
     */
    public int position() {
        return position;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return position < 0 ? message : message + " (at offset " + position + ")";
    }
}
