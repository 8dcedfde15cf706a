package com.hexwar.model;

/**
 * Arm of service of a unit. Only river crossings depend on it.
 */
public enum ArmyBranch {
    INFANTRY(1),
    CAVALRY(1),
    ARTILLERY(2);

    /** Extra movement points paid when crossing a river. */
    private final int riverSurcharge;

    ArmyBranch(int riverSurcharge) {
        this.riverSurcharge = riverSurcharge;
    }

    public int getRiverSurcharge() {
        return riverSurcharge;
    }
}
