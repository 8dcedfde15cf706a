package com.hexwar.movement;

import com.hexwar.model.HexCoordinate;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Hexes a unit can reach this turn, each with the cheapest cost to enter it.
 * <p>
 * The start hex is a member at cost 0. Iteration is in ascending coordinate order.
 */
public final class MovementRange {

    private final HexCoordinate start;
    private final int movementAllowance;
    private final SortedMap<HexCoordinate, Integer> costs;
    private final SortedSet<HexCoordinate> stopHexes;
    private final HexCoordinate fallbackHex;

    MovementRange(HexCoordinate start, int movementAllowance,
                  SortedMap<HexCoordinate, Integer> costs,
                  SortedSet<HexCoordinate> stopHexes,
                  HexCoordinate fallbackHex) {
        this.start = start;
        this.movementAllowance = movementAllowance;
        this.costs = Collections.unmodifiableSortedMap(new TreeMap<>(costs));
        this.stopHexes = Collections.unmodifiableSortedSet(new TreeSet<>(stopHexes));
        this.fallbackHex = fallbackHex;
    }

    public HexCoordinate getStart() {
        return start;
    }

    public int getMovementAllowance() {
        return movementAllowance;
    }

    public boolean contains(HexCoordinate coordinate) {
        return costs.containsKey(coordinate);
    }

    public OptionalInt costTo(HexCoordinate coordinate) {
        Integer cost = costs.get(coordinate);
        return cost != null ? OptionalInt.of(cost) : OptionalInt.empty();
    }

    public SortedMap<HexCoordinate, Integer> asMap() {
        return costs;
    }

    public int size() {
        return costs.size();
    }

    /**
     * Number of hexes the unit could actually move to, i.e. without the start hex.
     */
    public int destinationCount() {
        return contains(start) ? costs.size() - 1 : costs.size();
    }

    /**
     * Reachable hexes next to an enemy without a river in between. Movement ends there.
     */
    public SortedSet<HexCoordinate> getStopHexes() {
        return stopHexes;
    }

    /**
     * The single neighbor granted to a unit that could not afford any move, if one was granted.
     * Its cost may exceed the allowance.
     */
    public Optional<HexCoordinate> getFallbackHex() {
        return Optional.ofNullable(fallbackHex);
    }

    /**
     * Costs keyed by {@code "column,row"}, the format the client highlights from.
     */
    public Map<String, Integer> toKeyedMap() {
        Map<String, Integer> keyed = new LinkedHashMap<>();
        costs.forEach((coordinate, cost) -> keyed.put(coordinate.key(), cost));
        return keyed;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MovementRange other)) return false;
        return movementAllowance == other.movementAllowance
                && start.equals(other.start)
                && costs.equals(other.costs)
                && stopHexes.equals(other.stopHexes)
                && Objects.equals(fallbackHex, other.fallbackHex);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, movementAllowance, costs, stopHexes, fallbackHex);
    }

    @Override
    public String toString() {
        return "MovementRange{start=" + start + ", allowance=" + movementAllowance + ", costs=" + toKeyedMap() + "}";
    }
}
