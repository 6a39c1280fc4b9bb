package com.plcmodel.core.locator;

/**
 * Strategy tiers of the structure locator, in precedence order.
 */
public enum LocatorTier {
    /** Vendor auxiliary-data block identified by a namespace-like name. */
    NAMESPACED_BLOCK("namespaced-block"),
    /** Resource-like containers anywhere in the document. */
    RESOURCE_SCAN("resource-scan"),
    /** The whole document. */
    FLAT_SCAN("flat-scan");

    private final String id;

    LocatorTier(String id) {
        this.id = id;
    }

    /**
     * Returns the tier id used in diagnostics and variable origins.
     *
     * @return tier id
     */
    public String id() {
        return id;
    }
}
