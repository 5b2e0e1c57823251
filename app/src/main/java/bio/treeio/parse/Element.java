package bio.treeio.parse;

/**
 * Names of the elements the parser opens and closes on a {@link TreeEventSink}.
 */
public enum Element {
    TREE,
    NODE,
    ID,
    BRANCH_LENGTH,
    BOOTSTRAP,
    NHX_TAG,
    TAG_NAME,
    TAG_VALUE
}
