package com.hexwar.model;

import com.fasterxml.jackson.annotation.JsonCreator;

/**
 * Terrain types a hex can carry, with the movement points needed to enter them.
 */
public enum Terrain {
    CLEAR(1),
    TOWN(1),
    MOUNTAIN(2),
    FOREST(2),
    DESERT(3),
    SWAMP(3),
    WATER(0);      // impassable, cost unused

    private final int baseCost;

    Terrain(int baseCost) {
        this.baseCost = baseCost;
    }

    public int getBaseCost() {
        return baseCost;
    }

    public boolean isPassable() {
        return this != WATER;
    }

    /**
     * Case-insensitive lookup used when reading scenario files.
     * Unrecognized names map to {@code null}, which the cost model treats as clear ground.
     */
    @JsonCreator
    public static Terrain fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (Terrain terrain : values()) {
            if (terrain.name().equalsIgnoreCase(value.trim())) {
                return terrain;
            }
        }
        return null;
    }
}
