package com.hexwar.config;

import com.hexwar.model.MapHex;
import com.hexwar.model.Terrain;

/**
 * A single hex in a scenario file.
 *
 * @param column zero-based column
 * @param row    zero-based row
 * @param terrain terrain name, e.g. "forest"; unknown names are read as {@code null}
 * @param rivers river bitmask, bit {@code i} for side {@code i}; absent means none
 * @param roads  road bitmask with the same encoding; absent means none
 */
public record HexDefinition(
        int column,
        int row,
        Terrain terrain,
        Integer rivers,
        Integer roads
) {

    public MapHex toMapHex() {
        return MapHex.builder()
                .column(column)
                .row(row)
                .terrain(terrain)
                .rivers(rivers != null ? rivers : 0)
                .roads(roads != null ? roads : 0)
                .build();
    }
}
