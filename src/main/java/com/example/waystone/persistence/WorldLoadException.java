package com.example.waystone.persistence;

/**
 * Room content is missing or invalid. The server cannot start without a world.
 */
public class WorldLoadException extends Exception {

    public WorldLoadException(String message) {
        super(message);
    }

    public WorldLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
