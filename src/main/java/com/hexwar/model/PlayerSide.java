package com.hexwar.model;

/**
 * The two sides of a game.
 */
public enum PlayerSide {
    PLAYER_ONE,
    PLAYER_TWO
}
