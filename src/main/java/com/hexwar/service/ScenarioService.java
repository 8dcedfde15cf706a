package com.hexwar.service;

import com.hexwar.config.HexDefinition;
import com.hexwar.config.ScenarioDefinition;
import com.hexwar.config.ScenarioLoader;
import com.hexwar.config.UnitDefinition;
import com.hexwar.dto.MoveCheckDTO;
import com.hexwar.dto.MovementRangeDTO;
import com.hexwar.dto.MovementRangeRequest;
import com.hexwar.dto.ScenarioInfoDTO;
import com.hexwar.model.HexCoordinate;
import com.hexwar.model.MapBounds;
import com.hexwar.model.MapHex;
import com.hexwar.model.MapUnit;
import com.hexwar.movement.MovementQuery;
import com.hexwar.movement.MovementRange;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Objects;

/**
 * Movement queries against scenario maps: built-in scenarios and editor previews.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ScenarioService {

    private final ScenarioLoader scenarioLoader;
    private final MovementRangeService movementRangeService;

    /**
     * Summaries of every loaded scenario.
     */
    public List<ScenarioInfoDTO> listScenarios() {
        return scenarioLoader.getAvailableScenarios().stream()
                .map(ScenarioInfoDTO::fromDefinition)
                .toList();
    }

    /**
     * Get scenario by ID.
     */
    public ScenarioDefinition getScenario(String scenarioId) {
        return scenarioLoader.getScenario(scenarioId);
    }

    /**
     * Movement range of a unit from its starting position in a scenario.
     *
     * @param allowanceOverride replaces the unit's own allowance when not {@code null}
     */
    public MovementRangeDTO getMovementRange(String scenarioId, String unitId, Integer allowanceOverride) {
        ScenarioDefinition scenario = getScenario(scenarioId);
        MapUnit unit = findUnit(scenario, unitId);
        if (allowanceOverride != null) {
            unit.setMovementAllowance(allowanceOverride);
        }

        MovementRange range = movementRangeService.calculateRange(unit, scenario.toMapHexes(),
                scenario.bounds(), scenario.toMapUnits());
        return MovementRangeDTO.fromRange(range, unit.getId(), unit.getSide(), unit.getBranch());
    }

    /**
     * Check whether a unit may move to the given hex this turn.
     * An unreachable hex is reported, not thrown, so the UI can show the reason.
     */
    public MoveCheckDTO checkMove(String scenarioId, String unitId, int column, int row) {
        ScenarioDefinition scenario = getScenario(scenarioId);
        MapUnit unit = findUnit(scenario, unitId);
        HexCoordinate destination = HexCoordinate.of(column, row);

        MovementRange range = movementRangeService.calculateRange(unit, scenario.toMapHexes(),
                scenario.bounds(), scenario.toMapUnits());
        try {
            int cost = movementRangeService.requireReachable(range, destination);
            return MoveCheckDTO.builder()
                    .unitId(unitId)
                    .destination(destination.key())
                    .reachable(true)
                    .cost(cost)
                    .message("Move to " + destination + " costs " + cost)
                    .build();
        } catch (IllegalArgumentException e) {
            log.debug("Rejected move of {} in scenario {}: {}", unitId, scenarioId, e.getMessage());
            return MoveCheckDTO.builder()
                    .unitId(unitId)
                    .destination(destination.key())
                    .reachable(false)
                    .message(e.getMessage())
                    .build();
        }
    }

    /**
     * Range for a map sent by the scenario editor, not necessarily saved anywhere.
     */
    public MovementRangeDTO previewRange(MovementRangeRequest request) {
        List<HexDefinition> hexDefinitions = request.getHexes() == null ? List.of() : request.getHexes();
        List<UnitDefinition> unitDefinitions = request.getUnits() == null ? List.of() : request.getUnits();
        requireCompleteMap(hexDefinitions, unitDefinitions);

        List<MapHex> hexes = hexDefinitions.stream().map(HexDefinition::toMapHex).toList();
        List<MapUnit> units = unitDefinitions.stream().map(UnitDefinition::toMapUnit).toList();

        MovementRange range = movementRangeService.calculateRange(MovementQuery.builder()
                .start(HexCoordinate.of(request.getStartColumn(), request.getStartRow()))
                .movementAllowance(request.getMovementAllowance())
                .hexes(hexes)
                .bounds(new MapBounds(request.getColumns(), request.getRows()))
                .units(units)
                .side(request.getSide())
                .branch(request.getBranch())
                .build());
        return MovementRangeDTO.fromRange(range, null, request.getSide(), request.getBranch());
    }

    /**
     * Editor maps bypass the scenario loader, so entries are checked here.
     * A unit without a side would otherwise count as an enemy of both sides.
     */
    private static void requireCompleteMap(List<HexDefinition> hexes, List<UnitDefinition> units) {
        if (hexes.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("Hex entries cannot be null");
        }
        for (UnitDefinition unit : units) {
            if (unit == null) {
                throw new IllegalArgumentException("Unit entries cannot be null");
            }
            if (unit.side() == null) {
                throw new IllegalArgumentException("Unit " + unit.id() + " at ("
                        + unit.column() + ", " + unit.row() + ") has no side");
            }
        }
    }

    private MapUnit findUnit(ScenarioDefinition scenario, String unitId) {
        return scenario.findUnit(unitId)
                .map(UnitDefinition::toMapUnit)
                .orElseThrow(() -> new IllegalArgumentException("Unit not found: " + unitId
                        + " in scenario " + scenario.id()));
    }
}
