package com.hexwar.config;

import com.hexwar.model.MapBounds;
import com.hexwar.model.MapHex;
import com.hexwar.model.MapUnit;

import java.util.List;
import java.util.Optional;

/**
 * Root definition of a playable scenario, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "river-crossing"
 * @param title       human-readable title shown in the UI
 * @param description short description of the situation
 * @param columns     map width in hexes
 * @param rows        map height in hexes
 * @param turns       number of game turns
 * @param hexes       hexes that differ from blank ground
 * @param units       starting units of both sides
 */
public record ScenarioDefinition(
        String id,
        String title,
        String description,
        int columns,
        int rows,
        int turns,
        List<HexDefinition> hexes,
        List<UnitDefinition> units
) {

    public ScenarioDefinition {
        hexes = hexes != null ? List.copyOf(hexes) : List.of();
        units = units != null ? List.copyOf(units) : List.of();
    }

    public MapBounds bounds() {
        return new MapBounds(columns, rows);
    }

    public List<MapHex> toMapHexes() {
        return hexes.stream().map(HexDefinition::toMapHex).toList();
    }

    public List<MapUnit> toMapUnits() {
        return units.stream().map(UnitDefinition::toMapUnit).toList();
    }

    public Optional<UnitDefinition> findUnit(String unitId) {
        return units.stream().filter(u -> u.id().equals(unitId)).findFirst();
    }
}
