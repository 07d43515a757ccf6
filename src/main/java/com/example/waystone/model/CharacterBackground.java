package com.example.waystone.model;

import java.util.Collections;
import java.util.Map;

/**
 * A character's upbringing. Each background grants small attribute bonuses
 * on top of the points spent during creation.
 */
public enum CharacterBackground {
    SCHOLAR("Scholar", Map.of("intelligence", 2)),
    MERCHANT("Merchant", Map.of("charisma", 1, "wisdom", 1)),
    PERFORMER("Performer", Map.of("charisma", 2)),
    WAYFARER("Wayfarer", Map.of("dexterity", 1, "constitution", 1)),
    NOBLE("Noble", Map.of("intelligence", 1, "charisma", 1)),
    COMMONER("Commoner", Map.of("constitution", 1, "strength", 1));

    private final String displayName;
    private final Map<String, Integer> bonuses;

    CharacterBackground(String displayName, Map<String, Integer> bonuses) {
        this.displayName = displayName;
        this.bonuses = Collections.unmodifiableMap(bonuses);
    }

    public String getDisplayName() {
        return displayName;
    }

    /** Attribute name to bonus. */
    public Map<String, Integer> getBonuses() {
        return bonuses;
    }

    public static CharacterBackground fromString(String s) {
        if (s == null) return null;
        for (CharacterBackground bg : values()) {
            if (bg.name().equalsIgnoreCase(s.trim()) || bg.displayName.equalsIgnoreCase(s.trim())) {
                return bg;
            }
        }
        return null;
    }
}
