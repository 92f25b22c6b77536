package marouter.placement.model;

/**
 * Kind of resource provider behind a node.
 */
public enum NodeCategory {
    /** Fixed installation in a data center */
    DATACENTER("datacenter"),
    /** Small edge cluster */
    EDGE_CLUSTER("edge_cluster"),
    /** Transient volunteer machine */
    MIST_NODE("mist_node");

    private final String wireName;

    NodeCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean isVolunteer() {
        return this == MIST_NODE;
    }

    /**
     * Parse either the wire name ("mist_node") or the enum name ("MIST_NODE").
     */
    public static NodeCategory fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("node category is required");
        }
        for (NodeCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("unknown node category: " + value);
    }
}
