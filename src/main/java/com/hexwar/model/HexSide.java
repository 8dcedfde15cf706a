package com.hexwar.model;

/**
 * The six sides of a flat-top hex, numbered clockwise from north.
 * The ordinal is the bit index used by the river and road masks.
 */
public enum HexSide {
    TOP,
    TOP_RIGHT,
    BOTTOM_RIGHT,
    BOTTOM,
    BOTTOM_LEFT,
    TOP_LEFT;

    private static final HexSide[] SIDES = values();

    public int mask() {
        return 1 << ordinal();
    }

    public HexSide opposite() {
        return SIDES[(ordinal() + 3) % 6];
    }
}
