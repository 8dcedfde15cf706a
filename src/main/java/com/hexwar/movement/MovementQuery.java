package com.hexwar.movement;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import com.hexwar.model.MapHex;
import com.hexwar.model.MapUnit;
import com.hexwar.model.PlayerSide;
import lombok.Builder;

import java.util.Collection;

/**
 * Everything needed to compute one unit's movement range.
 *
 * @param start             hex the unit stands on
 * @param movementAllowance movement points available this turn
 * @param hexes             hex records of the map; missing coordinates count as blank hexes
 * @param bounds            map size
 * @param units             every unit on the map, the mover included
 * @param side              side of the moving unit
 * @param branch            branch of the moving unit
 */
@Builder
public record MovementQuery(
        HexCoordinate start,
        int movementAllowance,
        Collection<MapHex> hexes,
        MapBounds bounds,
        Collection<MapUnit> units,
        PlayerSide side,
        ArmyBranch branch
) {}
