package com.hexwar.dto;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.HexCoordinate;
import com.hexwar.model.PlayerSide;
import com.hexwar.movement.MovementRange;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * DTO for a computed movement range. Hex keys use the {@code "column,row"} format.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MovementRangeDTO {

    private String unitId;
    private String start;
    private int movementAllowance;
    private PlayerSide side;
    private ArmyBranch branch;
    private Map<String, Integer> costs;
    private List<String> stopHexes;
    private String fallbackHex;
    private int destinationCount;

    public static MovementRangeDTO fromRange(MovementRange range, String unitId,
                                             PlayerSide side, ArmyBranch branch) {
        return MovementRangeDTO.builder()
                .unitId(unitId)
                .start(range.getStart().key())
                .movementAllowance(range.getMovementAllowance())
                .side(side)
                .branch(branch)
                .costs(range.toKeyedMap())
                .stopHexes(range.getStopHexes().stream()
                    .map(HexCoordinate::key)
                    .toList())
                .fallbackHex(range.getFallbackHex()
                    .map(HexCoordinate::key)
                    .orElse(null))
                .destinationCount(range.destinationCount())
                .build();
    }
}
