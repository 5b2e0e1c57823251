package bio.treeio.parse;

/**
 * States of the Newick parser. {@link #TERMINAL} is entered after the closing {@code ;} and accepts no
 * further tokens.
 */
public enum ParserState {
    NEW_NODE,
    NAMING_NODE,
    BRANCH_LENGTH_OR_TAG,
    NHX_TAG,
    END_NODE,
    TERMINAL
}
