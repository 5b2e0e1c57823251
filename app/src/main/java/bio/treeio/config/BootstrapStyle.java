package bio.treeio.config;

/**
 * Placement of bootstrap values in written trees.
 * <ul>
 *   <li>{@code TRADITIONAL}: {@code (A:0.11,B:0.22)100:0.33}</li>
 *   <li>{@code MOLPHY}: {@code (A:0.11,B:0.22):0.33[100]}</li>
 *   <li>{@code NOBRANCHLENGTH}: no branch lengths at all</li>
 * </ul>
 */
public enum BootstrapStyle {
    TRADITIONAL,
    MOLPHY,
    NOBRANCHLENGTH;

    public static BootstrapStyle from(String raw) {
        if (raw == null || raw.isBlank()) {
            return TRADITIONAL;
        }
        for (BootstrapStyle style : values()) {
            if (style.name().equalsIgnoreCase(raw.trim())) {
                return style;
            }
        }
        throw new IllegalArgumentException("Unsupported bootstrap style: " + raw);
    }
}
