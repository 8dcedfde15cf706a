package com.hexwar.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A unit standing on the map.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MapUnit {

    private String id;
    private String name;
    private PlayerSide side;
    private int column;
    private int row;
    private int movementAllowance;
    private ArmyBranch branch;

    @Builder.Default
    private UnitStatus status = UnitStatus.AVAILABLE;

    public HexCoordinate getCoordinate() {
        return HexCoordinate.of(column, row);
    }

    public boolean isEnemyOf(PlayerSide mover) {
        return side != mover;
    }
}
