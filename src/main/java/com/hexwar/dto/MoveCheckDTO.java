package com.hexwar.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of checking whether a unit may move to a given hex.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MoveCheckDTO {

    private String unitId;
    private String destination;
    private boolean reachable;
    private Integer cost;
    private String message;
}
