package com.hexwar.dto;

import com.hexwar.config.ScenarioDefinition;
import com.hexwar.model.PlayerSide;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for exposing available scenario information to the UI.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScenarioInfoDTO {

    private String id;
    private String title;
    private String description;
    private int columns;
    private int rows;
    private int turns;
    private int playerOneUnits;
    private int playerTwoUnits;

    public static ScenarioInfoDTO fromDefinition(ScenarioDefinition def) {
        int playerOne = (int) def.units().stream()
                .filter(u -> u.side() == PlayerSide.PLAYER_ONE)
                .count();
        return ScenarioInfoDTO.builder()
                .id(def.id())
                .title(def.title())
                .description(def.description())
                .columns(def.columns())
                .rows(def.rows())
                .turns(def.turns())
                .playerOneUnits(playerOne)
                .playerTwoUnits(def.units().size() - playerOne)
                .build();
    }
}
