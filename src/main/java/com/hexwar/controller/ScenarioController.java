package com.hexwar.controller;

import com.hexwar.config.ScenarioDefinition;
import com.hexwar.dto.MoveCheckDTO;
import com.hexwar.dto.MovementRangeDTO;
import com.hexwar.dto.ScenarioInfoDTO;
import com.hexwar.service.ScenarioService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST API controller for scenarios and the movement of their units.
 */
@RestController
@RequestMapping("/api/scenarios")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class ScenarioController {

    private final ScenarioService scenarioService;

    /**
     * List available scenarios.
     */
    @GetMapping
    public ResponseEntity<List<ScenarioInfoDTO>> getScenarios() {
        return ResponseEntity.ok(scenarioService.listScenarios());
    }

    /**
     * Get scenario details, including hexes and starting units.
     */
    @GetMapping("/{scenarioId}")
    public ResponseEntity<ScenarioDefinition> getScenario(@PathVariable String scenarioId) {
        return ResponseEntity.ok(scenarioService.getScenario(scenarioId));
    }

    /**
     * Hexes a unit can reach from its starting position.
     */
    @GetMapping("/{scenarioId}/units/{unitId}/movement-range")
    public ResponseEntity<MovementRangeDTO> getMovementRange(@PathVariable String scenarioId,
                                                             @PathVariable String unitId,
                                                             @RequestParam(required = false) Integer allowance) {
        log.info("Movement range for unit {} in scenario {}", unitId, scenarioId);
        return ResponseEntity.ok(scenarioService.getMovementRange(scenarioId, unitId, allowance));
    }

    /**
     * Check whether a unit may move to a hex.
     */
    @GetMapping("/{scenarioId}/units/{unitId}/moves/check")
    public ResponseEntity<MoveCheckDTO> checkMove(@PathVariable String scenarioId,
                                                  @PathVariable String unitId,
                                                  @RequestParam int column,
                                                  @RequestParam int row) {
        return ResponseEntity.ok(scenarioService.checkMove(scenarioId, unitId, column, row));
    }
}
