package com.hexwar.movement;

import com.hexwar.model.HexCoordinate;
import com.hexwar.model.HexSide;

import java.util.ArrayList;
import java.util.List;

/**
 * Adjacency on a flat-top hex grid with even-q offset columns.
 * <p>
 * Odd columns sit half a hex lower than even ones, so the diagonal
 * neighbors of a hex depend on the parity of its column.
 */
public final class HexTopology {

    private HexTopology() {
    }

    /**
     * A neighboring hex together with the side of the origin hex that faces it.
     */
    public record Neighbor(HexSide side, HexCoordinate coordinate) {}

    public static HexCoordinate neighbor(int column, int row, HexSide side) {
        return neighbor(HexCoordinate.of(column, row), side);
    }

    public static HexCoordinate neighbor(HexCoordinate coordinate, HexSide side) {
        int column = coordinate.column();
        int row = coordinate.row();
        boolean even = coordinate.isEvenColumn();
        return switch (side) {
            case TOP -> HexCoordinate.of(column, row - 1);
            case TOP_RIGHT -> even ? HexCoordinate.of(column + 1, row - 1) : HexCoordinate.of(column + 1, row);
            case BOTTOM_RIGHT -> even ? HexCoordinate.of(column + 1, row) : HexCoordinate.of(column + 1, row + 1);
            case BOTTOM -> HexCoordinate.of(column, row + 1);
            case BOTTOM_LEFT -> even ? HexCoordinate.of(column - 1, row) : HexCoordinate.of(column - 1, row + 1);
            case TOP_LEFT -> even ? HexCoordinate.of(column - 1, row - 1) : HexCoordinate.of(column - 1, row);
        };
    }

    /**
     * All six neighbors in side order, TOP first. Callers rely on this order.
     */
    public static List<Neighbor> neighbors(HexCoordinate coordinate) {
        List<Neighbor> neighbors = new ArrayList<>(6);
        for (HexSide side : HexSide.values()) {
            neighbors.add(new Neighbor(side, neighbor(coordinate, side)));
        }
        return neighbors;
    }

    /**
     * The side of the neighboring hex that faces back across the shared edge.
     */
    public static HexSide opposite(HexSide side) {
        return side.opposite();
    }
}
