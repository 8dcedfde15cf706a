package com.hexwar.config;

import com.hexwar.model.ArmyBranch;
import com.hexwar.model.MapUnit;
import com.hexwar.model.PlayerSide;
import jakarta.validation.constraints.NotNull;

/**
 * A unit placed on the map at the start of a scenario.
 *
 * @param id                unique within the scenario
 * @param name              display name, e.g. "3rd Hussars"
 * @param side              owning side
 * @param column            starting column
 * @param row               starting row
 * @param movementAllowance movement points per turn
 * @param branch            arm of service
 */
public record UnitDefinition(
        String id,
        String name,
        @NotNull(message = "Unit side is required") PlayerSide side,
        int column,
        int row,
        int movementAllowance,
        ArmyBranch branch
) {

    public MapUnit toMapUnit() {
        return MapUnit.builder()
                .id(id)
                .name(name)
                .side(side)
                .column(column)
                .row(row)
                .movementAllowance(movementAllowance)
                .branch(branch)
                .build();
    }
}
