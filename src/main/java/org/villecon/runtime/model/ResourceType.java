package org.villecon.runtime.model;

/**
 * Harvestable resources tracked by tiles and villages.
 */
public enum ResourceType {
    FOOD("food"),
    WOOD("wood"),
    ORE("ore");

    private final String key;

    ResourceType(String key) {
        this.key = key;
    }

    /**
     * @return the lower-case key used in configuration files and log output.
     */
    public String key() {
        return key;
    }

    /**
     * Resolves a resource from its configuration key.
     *
     * @param key the lower-case key, e.g. {@code "wood"}.
     * @return the matching resource type.
     * @throws IllegalArgumentException if the key is unknown.
     */
    public static ResourceType fromKey(String key) {
        for (ResourceType type : values()) {
            if (type.key.equals(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown resource type: " + key);
    }
}
