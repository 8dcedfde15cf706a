package com.hexwar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single hex of a scenario map.
 * <p>
 * Rivers and roads run along hex edges. Each edge feature is stored on both
 * hexes that share the edge, so either copy may be consulted on its own.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapHex {

    private int column;
    private int row;

    /** {@code null} when the terrain is missing or unrecognized. */
    private Terrain terrain;

    /** Bit {@code i} set means side {@code i} carries a river. */
    private int rivers;

    /** Bit {@code i} set means side {@code i} carries a road. */
    private int roads;

    public HexCoordinate getCoordinate() {
        return HexCoordinate.of(column, row);
    }

    public boolean hasRiver(HexSide side) {
        return (rivers & side.mask()) != 0;
    }

    public boolean hasRoad(HexSide side) {
        return (roads & side.mask()) != 0;
    }

    /**
     * Stand-in for coordinates the map has no record of: unknown terrain, no edge features.
     */
    public static MapHex blank(HexCoordinate coordinate) {
        return MapHex.builder()
                .column(coordinate.column())
                .row(coordinate.row())
                .build();
    }
}
