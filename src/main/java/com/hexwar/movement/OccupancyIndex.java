package com.hexwar.movement;

import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapHex;
import com.hexwar.model.MapUnit;
import com.hexwar.model.PlayerSide;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Units grouped by the hex they stand on, seen from the moving side.
 * Friendly units never block; any unit of the other side does.
 */
public final class OccupancyIndex {

    private final Map<HexCoordinate, List<MapUnit>> unitsByHex = new HashMap<>();
    private final PlayerSide mover;

    public OccupancyIndex(Collection<MapUnit> units, PlayerSide mover) {
        this.mover = mover;
        if (units != null) {
            for (MapUnit unit : units) {
                unitsByHex.computeIfAbsent(unit.getCoordinate(), c -> new ArrayList<>()).add(unit);
            }
        }
    }

    public List<MapUnit> unitsAt(HexCoordinate coordinate) {
        return unitsByHex.getOrDefault(coordinate, List.of());
    }

    public boolean isEnemyOccupied(HexCoordinate coordinate) {
        return unitsAt(coordinate).stream().anyMatch(unit -> unit.isEnemyOf(mover));
    }

    /**
     * True when some neighbor holds an enemy and the shared edge has no river.
     * Only the river mask of {@code hex} itself is consulted.
     */
    public boolean isExposedToEnemy(MapHex hex) {
        for (HexTopology.Neighbor neighbor : HexTopology.neighbors(hex.getCoordinate())) {
            if (isEnemyOccupied(neighbor.coordinate()) && !hex.hasRiver(neighbor.side())) {
                return true;
            }
        }
        return false;
    }
}
