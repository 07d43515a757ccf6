package com.example.waystone.model;

/**
 * Character stance determines their current physical position.
 * This affects regeneration rates and available actions.
 */
public enum Stance {
    STANDING(1, "standing"),
    RESTING(2, "resting"),
    SLEEPING(4, "sleeping");

    private final int regenMultiplier;
    private final String displayName;

    Stance(int regenMultiplier, String displayName) {
        this.regenMultiplier = regenMultiplier;
        this.displayName = displayName;
    }

    /**
     * Multiplier applied to the base regeneration rate each tick.
     */
    public int getRegenMultiplier() {
        return regenMultiplier;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Check if this stance allows normal movement commands.
     */
    public boolean canMove() {
        return this == STANDING;
    }

    public boolean isAsleep() {
        return this == SLEEPING;
    }

    /**
     * Parse a stance from a string (case-insensitive).
     * Returns STANDING as default if not found.
     */
    public static Stance fromString(String s) {
        if (s == null || s.isEmpty()) return STANDING;
        for (Stance stance : values()) {
            if (stance.name().equalsIgnoreCase(s.trim()) || stance.displayName.equalsIgnoreCase(s.trim())) {
                return stance;
            }
        }
        return STANDING;
    }
}
