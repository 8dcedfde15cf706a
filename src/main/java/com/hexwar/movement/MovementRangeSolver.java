package com.hexwar.movement;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import com.hexwar.model.MapHex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Dijkstra search over the hex grid computing where a unit may move this turn.
 * <p>
 * Besides terrain costs the search applies two rules:
 * <ul>
 *   <li>A hex next to an enemy that is not across a river ends movement: it can be
 *       entered but nothing is expanded from it.</li>
 *   <li>A unit with at least one movement point that cannot afford any neighbor
 *       still gets the first enterable neighbor in side order, whatever it costs.</li>
 * </ul>
 * Stateless; one instance can serve concurrent callers.
 */
@Component
@Slf4j
public class MovementRangeSolver {

    private static final Comparator<Frontier> FRONTIER_ORDER =
            Comparator.comparingInt(Frontier::cost).thenComparingLong(Frontier::sequence);

    /** Queue entry; {@code sequence} keeps equal-cost pops in insertion order. */
    private record Frontier(HexCoordinate coordinate, int cost, long sequence) {}

    public MovementRange solve(MovementQuery query) {
        Objects.requireNonNull(query, "query");
        HexCoordinate start = Objects.requireNonNull(query.start(), "start");
        MapBounds bounds = Objects.requireNonNull(query.bounds(), "bounds");
        int allowance = query.movementAllowance();
        ArmyBranch branch = query.branch();

        Map<HexCoordinate, MapHex> hexes = indexHexes(query.hexes());
        OccupancyIndex occupancy = new OccupancyIndex(query.units(), query.side());

        Map<HexCoordinate, Integer> bestCost = new HashMap<>();
        Set<HexCoordinate> settled = new HashSet<>();
        PriorityQueue<Frontier> queue = new PriorityQueue<>(FRONTIER_ORDER);
        long sequence = 0;

        SortedMap<HexCoordinate, Integer> range = new TreeMap<>();
        SortedSet<HexCoordinate> stopHexes = new TreeSet<>();

        bestCost.put(start, 0);
        queue.add(new Frontier(start, 0, sequence++));

        while (!queue.isEmpty()) {
            Frontier current = queue.poll();
            HexCoordinate coordinate = current.coordinate();
            if (!settled.add(coordinate)) {
                continue;
            }

            int cost = current.cost();
            if (cost <= allowance) {
                range.put(coordinate, cost);
            }

            MapHex currentHex = hexAt(hexes, coordinate);
            if (occupancy.isExposedToEnemy(currentHex)) {
                if (cost <= allowance) {
                    stopHexes.add(coordinate);
                }
                continue;
            }

            for (HexTopology.Neighbor neighbor : HexTopology.neighbors(coordinate)) {
                HexCoordinate next = neighbor.coordinate();
                if (!bounds.contains(next) || settled.contains(next) || occupancy.isEnemyOccupied(next)) {
                    continue;
                }

                OptionalInt step = MovementCostModel.entryCost(hexAt(hexes, next),
                        HexTopology.opposite(neighbor.side()), currentHex, neighbor.side(), branch);
                if (step.isEmpty()) {
                    continue;
                }

                int candidate = cost + step.getAsInt();
                // every edge costs at least 1, so a hex past the allowance never leads back inside it
                if (candidate > allowance) {
                    continue;
                }

                Integer known = bestCost.get(next);
                if (known == null || candidate < known) {
                    bestCost.put(next, candidate);
                    queue.add(new Frontier(next, candidate, sequence++));
                }
            }
        }

        HexCoordinate fallbackHex = null;
        if (allowance >= 1 && onlyStart(range, start)) {
            fallbackHex = grantFallbackHex(start, hexes, bounds, occupancy, branch, range);
        }

        log.debug("Movement range from {} with allowance {}: {} hexes ({} stop hexes, fallback {})",
                start, allowance, range.size(), stopHexes.size(), fallbackHex);

        return new MovementRange(start, allowance, range, stopHexes, fallbackHex);
    }

    private HexCoordinate grantFallbackHex(HexCoordinate start, Map<HexCoordinate, MapHex> hexes,
                                           MapBounds bounds, OccupancyIndex occupancy, ArmyBranch branch,
                                           SortedMap<HexCoordinate, Integer> range) {
        MapHex startHex = hexAt(hexes, start);
        for (HexTopology.Neighbor neighbor : HexTopology.neighbors(start)) {
            HexCoordinate next = neighbor.coordinate();
            if (!bounds.contains(next) || occupancy.isEnemyOccupied(next)) {
                continue;
            }
            OptionalInt step = MovementCostModel.entryCost(hexAt(hexes, next),
                    HexTopology.opposite(neighbor.side()), startHex, neighbor.side(), branch);
            if (step.isPresent()) {
                range.put(next, step.getAsInt());
                return next;
            }
        }
        return null;
    }

    private static boolean onlyStart(SortedMap<HexCoordinate, Integer> range, HexCoordinate start) {
        return range.keySet().stream().allMatch(start::equals);
    }

    private static Map<HexCoordinate, MapHex> indexHexes(Collection<MapHex> hexes) {
        Map<HexCoordinate, MapHex> index = new HashMap<>();
        if (hexes != null) {
            for (MapHex hex : hexes) {
                index.put(hex.getCoordinate(), hex);
            }
        }
        return index;
    }

    private static MapHex hexAt(Map<HexCoordinate, MapHex> hexes, HexCoordinate coordinate) {
        MapHex hex = hexes.get(coordinate);
        return hex != null ? hex : MapHex.blank(coordinate);
    }
}
