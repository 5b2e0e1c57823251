package bio.treeio.config;

/**
 * Sibling ordering applied when writing trees.
 */
public enum OrderBy {
    NONE,
    NAME;

    public static OrderBy from(String raw) {
        if (raw == null || raw.isBlank()) {
            return NONE;
        }
        for (OrderBy order : values()) {
            if (order.name().equalsIgnoreCase(raw.trim())) {
                return order;
            }
        }
        throw new IllegalArgumentException("Unsupported sibling order: " + raw);
    }
}
