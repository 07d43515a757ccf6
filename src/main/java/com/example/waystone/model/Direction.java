package com.example.waystone.model;

import java.util.List;

/**
 * Exit directions and their short forms.
 */
public enum Direction {
    NORTH("north", "n"),
    SOUTH("south", "s"),
    EAST("east", "e"),
    WEST("west", "w"),
    UP("up", "u"),
    DOWN("down", "d"),
    NORTHEAST("northeast", "ne"),
    NORTHWEST("northwest", "nw"),
    SOUTHEAST("southeast", "se"),
    SOUTHWEST("southwest", "sw"),
    IN("in", "enter"),
    OUT("out", "o", "leave");

    private final String key;
    private final List<String> aliases;

    Direction(String key, String... aliases) {
        this.key = key;
        this.aliases = List.of(aliases);
    }

    /** Name used in room exit tables. */
    public String getKey() {
        return key;
    }

    public List<String> getAliases() {
        return aliases;
    }

    public Direction opposite() {
        switch (this) {
            case NORTH: return SOUTH;
            case SOUTH: return NORTH;
            case EAST: return WEST;
            case WEST: return EAST;
            case UP: return DOWN;
            case DOWN: return UP;
            case NORTHEAST: return SOUTHWEST;
            case SOUTHWEST: return NORTHEAST;
            case NORTHWEST: return SOUTHEAST;
            case SOUTHEAST: return NORTHWEST;
            case IN: return OUT;
            case OUT: return IN;
            default: throw new IllegalStateException("Unhandled direction " + this);
        }
    }

    /**
     * Phrase used when someone arrives from the opposite side,
     * e.g. "from the south", "from above".
     */
    public String arrivalPhrase() {
        switch (this) {
            case UP: return "from below";
            case DOWN: return "from above";
            case IN: return "from outside";
            case OUT: return "from inside";
            default: return "from the " + opposite().key;
        }
    }

    /**
     * Parse a direction from its name or alias (case-insensitive).
     * @return the direction or null if not recognised
     */
    public static Direction fromString(String s) {
        if (s == null) return null;
        String lower = s.toLowerCase().trim();
        for (Direction d : values()) {
            if (d.key.equals(lower) || d.aliases.contains(lower)) return d;
        }
        return null;
    }
}
