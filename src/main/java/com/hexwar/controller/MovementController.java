package com.hexwar.controller;

import com.hexwar.dto.MovementRangeDTO;
import com.hexwar.dto.MovementRangeRequest;
import com.hexwar.service.ScenarioService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * REST API controller for ad-hoc movement queries from the scenario editor.
 */
@RestController
@RequestMapping("/api/movement")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class MovementController {

    private final ScenarioService scenarioService;

    /**
     * Compute a movement range over a map supplied in the request.
     */
    @PostMapping("/range")
    public ResponseEntity<MovementRangeDTO> calculateRange(@Valid @RequestBody MovementRangeRequest request) {
        log.info("Previewing movement range from ({}, {}) on a {}x{} map",
                request.getStartColumn(), request.getStartRow(), request.getColumns(), request.getRows());
        return ResponseEntity.ok(scenarioService.previewRange(request));
    }
}
