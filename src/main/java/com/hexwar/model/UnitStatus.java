package com.hexwar.model;

/**
 * Selection state of a unit during the movement phase.
 */
public enum UnitStatus {
    AVAILABLE,      // May be selected this phase
    SELECTED,       // Chosen, waiting for a destination
    MOVED,          // Already moved this phase
    UNAVAILABLE     // Belongs to the inactive player
}
