package com.hexwar.model;

import java.util.Comparator;

/**
 * Column/row position of a hex on the offset grid.
 *
 * @param column zero-based column
 * @param row    zero-based row
 */
public record HexCoordinate(int column, int row) implements Comparable<HexCoordinate> {

    private static final Comparator<HexCoordinate> ORDER =
            Comparator.comparingInt(HexCoordinate::column).thenComparingInt(HexCoordinate::row);

    public static HexCoordinate of(int column, int row) {
        return new HexCoordinate(column, row);
    }

    public String key() {
        return column + "," + row;
    }

    public boolean isEvenColumn() {
        return column % 2 == 0;
    }

    @Override
    public int compareTo(HexCoordinate other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return "(" + column + ", " + row + ")";
    }
}
