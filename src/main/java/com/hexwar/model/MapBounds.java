package com.hexwar.model;

/**
 * Size of a scenario map in hexes.
 *
 * @param columns number of columns
 * @param rows    number of rows
 */
public record MapBounds(int columns, int rows) {

    public boolean contains(HexCoordinate coordinate) {
        return coordinate.column() >= 0 && coordinate.column() < columns
                && coordinate.row() >= 0 && coordinate.row() < rows;
    }
}
