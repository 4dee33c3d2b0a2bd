package com.omniguard.core.domain;

/**
 * Crisis severity. Each level maps onto the 0-10 crisis scale used by crisis responders.
 */
public enum Severity {
    NONE(0),
    LOW(3),
    MEDIUM(5),
    HIGH(8),
    CRITICAL(10);

    private final int crisisLevel;

    Severity(int crisisLevel) {
        this.crisisLevel = crisisLevel;
    }

    public int crisisLevel() {
        return crisisLevel;
    }

    public boolean isCrisis() {
        return this != NONE;
    }

    public Severity max(Severity other) {
        return other.compareTo(this) > 0 ? other : this;
    }
}
