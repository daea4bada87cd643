package org.villecon.runtime.model;

/**
 * Terrain of a single map cell. Determines how fast its resources recover.
 */
public enum TerrainType {
    WATER("water"),
    LAND("land"),
    FOREST("forest"),
    MOUNTAIN("mountain"),
    ROAD("road");

    private final String key;

    TerrainType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
