package com.example.waystone.model;

/**
 * Flags that can be applied to rooms to modify their behavior.
 * Multiple flags can be applied to a single room.
 */
public enum RoomFlag {
    /**
     * Room is open to the sky.
     */
    OUTDOOR("outdoor", "Room is outdoors"),

    /**
     * Room has no light. Rooms are lit unless flagged dark.
     */
    DARK("dark", "Room is dark"),

    /**
     * No combat is permitted in this room.
     */
    SAFE("safe_zone", "No combat is permitted in this room");

    private final String key;
    private final String description;

    RoomFlag(String key, String description) {
        this.key = key;
        this.description = description;
    }

    /**
     * Get the content-file key for this flag.
     */
    public String getKey() {
        return key;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Find a RoomFlag by its key or enum name (case-insensitive).
     * @return the RoomFlag or null if not found
     */
    public static RoomFlag fromKey(String key) {
        if (key == null) return null;
        String lowerKey = key.toLowerCase().trim();
        for (RoomFlag flag : values()) {
            if (flag.key.equals(lowerKey) || flag.name().equalsIgnoreCase(lowerKey)) {
                return flag;
            }
        }
        return null;
    }
}
