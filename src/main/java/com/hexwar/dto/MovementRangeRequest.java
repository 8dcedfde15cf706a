package com.hexwar.dto;

import com.hexwar.config.HexDefinition;
import com.hexwar.config.UnitDefinition;
import com.hexwar.model.ArmyBranch;
import com.hexwar.model.PlayerSide;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Ad-hoc movement query sent by the scenario editor, carrying the whole map.
 * Uses Integer wrappers so Jackson 3 leaves absent fields as null and validation reports them.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MovementRangeRequest {

    @NotNull(message = "Start column is required")
    @Min(value = 0, message = "Start column cannot be negative")
    private Integer startColumn;

    @NotNull(message = "Start row is required")
    @Min(value = 0, message = "Start row cannot be negative")
    private Integer startRow;

    @NotNull(message = "Movement allowance is required")
    @Min(value = 0, message = "Movement allowance cannot be negative")
    private Integer movementAllowance;

    @NotNull(message = "Side is required")
    private PlayerSide side;

    private ArmyBranch branch;

    @NotNull(message = "Map columns are required")
    @Min(value = 1, message = "Map must have at least one column")
    private Integer columns;

    @NotNull(message = "Map rows are required")
    @Min(value = 1, message = "Map must have at least one row")
    private Integer rows;

    @Builder.Default
    private List<@NotNull(message = "Hex entries cannot be null") HexDefinition> hexes = new ArrayList<>();

    @Valid
    @Builder.Default
    private List<@NotNull(message = "Unit entries cannot be null") UnitDefinition> units = new ArrayList<>();

    public ArmyBranch getBranch() {
        return branch != null ? branch : ArmyBranch.INFANTRY;
    }
}
