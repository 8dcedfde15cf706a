package com.hexwar.service;

import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import com.hexwar.model.MapHex;
import com.hexwar.model.MapUnit;
import com.hexwar.movement.MovementQuery;
import com.hexwar.movement.MovementRange;
import com.hexwar.movement.MovementRangeSolver;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.OptionalInt;

/**
 * Entry point for movement-range queries.
 * <p>
 * Rejects malformed input up front instead of returning an empty range, then
 * hands the query to {@link MovementRangeSolver}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MovementRangeService {

    private final MovementRangeSolver solver;

    /**
     * Compute every hex the unit may move to this turn.
     *
     * @throws IllegalArgumentException on a negative allowance, an empty map,
     *                                  or a start hex outside the map
     */
    public MovementRange calculateRange(MovementQuery query) {
        validate(query);
        MovementRange range = solver.solve(query);
        log.debug("Unit at {} ({} {}) can reach {} hex(es)", query.start(), query.side(),
                query.branch(), range.destinationCount());
        return range;
    }

    /**
     * Compute the range of a unit from its own position, allowance, side and branch.
     */
    public MovementRange calculateRange(MapUnit unit, Collection<MapHex> hexes,
                                        MapBounds bounds, Collection<MapUnit> units) {
        if (unit == null) {
            throw new IllegalArgumentException("Unit is required");
        }
        return calculateRange(MovementQuery.builder()
                .start(unit.getCoordinate())
                .movementAllowance(unit.getMovementAllowance())
                .hexes(hexes)
                .bounds(bounds)
                .units(units)
                .side(unit.getSide())
                .branch(unit.getBranch())
                .build());
    }

    /**
     * Cost of moving to {@code destination}.
     *
     * @throws IllegalArgumentException if the destination is the start hex or outside the range
     */
    public int requireReachable(MovementRange range, HexCoordinate destination) {
        if (destination.equals(range.getStart())) {
            throw new IllegalArgumentException("Unit is already at " + destination);
        }
        OptionalInt cost = range.costTo(destination);
        if (cost.isEmpty()) {
            throw new IllegalArgumentException("Destination hex " + destination
                    + " is not within movement range. Movement allowance: " + range.getMovementAllowance());
        }
        return cost.getAsInt();
    }

    private void validate(MovementQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("Movement query is required");
        }
        if (query.start() == null) {
            throw new IllegalArgumentException("Start hex is required");
        }
        if (query.side() == null) {
            throw new IllegalArgumentException("Side of the moving unit is required");
        }
        if (query.movementAllowance() < 0) {
            throw new IllegalArgumentException("Movement allowance cannot be negative: " + query.movementAllowance());
        }
        MapBounds bounds = query.bounds();
        if (bounds == null || bounds.columns() < 1 || bounds.rows() < 1) {
            throw new IllegalArgumentException("Map must be at least 1x1");
        }
        if (!bounds.contains(query.start())) {
            throw new IllegalArgumentException("Start hex " + query.start() + " is outside the "
                    + bounds.columns() + "x" + bounds.rows() + " map");
        }
    }
}
