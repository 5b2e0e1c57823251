package bio.treeio.config;

/**
 * How an unannotated label on an internal node is interpreted and written.
 */
public enum InternalNodeId {
    ID,
    BOOTSTRAP;

    public static InternalNodeId from(String raw) {
        if (raw == null || raw.isBlank()) {
            return ID;
        }
        for (InternalNodeId value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unsupported internal node id: " + raw);
    }
}
