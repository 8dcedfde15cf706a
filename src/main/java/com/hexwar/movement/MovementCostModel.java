package com.hexwar.movement;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.HexSide;
import com.hexwar.model.MapHex;
import com.hexwar.model.Terrain;

import java.util.OptionalInt;

/**
 * Movement points needed to cross one hex edge.
 * <p>
 * Rules, in order:
 * <ol>
 *   <li>Water cannot be entered.</li>
 *   <li>Moving along a road costs exactly 1, whatever the terrain or rivers.</li>
 *   <li>Otherwise the destination terrain sets the base cost (1, 2 or 3; unknown terrain costs 1).</li>
 *   <li>Crossing a river adds the branch surcharge: 2 for artillery, 1 for everybody else.</li>
 * </ol>
 * Road and river flags are read from both hexes of the edge; either one is enough.
 */
public final class MovementCostModel {

    static final int ROAD_COST = 1;
    static final int UNKNOWN_TERRAIN_COST = 1;
    static final int DEFAULT_RIVER_SURCHARGE = 1;

    private MovementCostModel() {
    }

    /**
     * @param destination hex being entered
     * @param entrySide   side of {@code destination} the unit crosses
     * @param source      hex being left, may be {@code null}
     * @param exitSide    side of {@code source} the unit crosses, may be {@code null}
     * @param branch      branch of the moving unit, may be {@code null}
     * @return the cost, or empty when the edge is impassable
     */
    public static OptionalInt entryCost(MapHex destination, HexSide entrySide,
                                        MapHex source, HexSide exitSide, ArmyBranch branch) {
        Terrain terrain = destination.getTerrain();
        if (terrain != null && !terrain.isPassable()) {
            return OptionalInt.empty();
        }

        if (edgeHasRoad(destination, entrySide, source, exitSide)) {
            return OptionalInt.of(ROAD_COST);
        }

        int cost = terrain != null ? terrain.getBaseCost() : UNKNOWN_TERRAIN_COST;

        if (edgeHasRiver(destination, entrySide, source, exitSide)) {
            cost += branch != null ? branch.getRiverSurcharge() : DEFAULT_RIVER_SURCHARGE;
        }
        return OptionalInt.of(cost);
    }

    private static boolean edgeHasRoad(MapHex destination, HexSide entrySide, MapHex source, HexSide exitSide) {
        if (entrySide != null && destination.hasRoad(entrySide)) {
            return true;
        }
        return source != null && exitSide != null && source.hasRoad(exitSide);
    }

    private static boolean edgeHasRiver(MapHex destination, HexSide entrySide, MapHex source, HexSide exitSide) {
        if (entrySide != null && destination.hasRiver(entrySide)) {
            return true;
        }
        return source != null && exitSide != null && source.hasRiver(exitSide);
    }
}
