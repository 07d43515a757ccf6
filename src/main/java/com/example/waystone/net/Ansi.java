package com.example.waystone.net;

import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * ANSI color escapes used in player-facing text.
 */
public final class Ansi {

    public static final String RESET = "\u001B[0m";

    private static final Map<String, String> COLORS = Map.ofEntries(
            Map.entry("RED", "\u001B[31m"),
            Map.entry("GREEN", "\u001B[32m"),
            Map.entry("YELLOW", "\u001B[33m"),
            Map.entry("BLUE", "\u001B[34m"),
            Map.entry("MAGENTA", "\u001B[35m"),
            Map.entry("CYAN", "\u001B[36m"),
            Map.entry("WHITE", "\u001B[37m"),
            Map.entry("RESET", RESET),
            Map.entry("BOLD", "\u001B[1m"),
            Map.entry("DIM", "\u001B[2m"),
            Map.entry("UNDERLINE", "\u001B[4m")
    );

    /** Matches every SGR escape this server emits. */
    public static final Pattern ESCAPE_PATTERN = Pattern.compile("\u001B\\[[0-9;]*m");

    public static final String WELCOME_BANNER =
            COLORS.get("CYAN") + COLORS.get("BOLD") + "\n"
            + " W A Y S T O N E\n"
            + RESET + "\n"
            + COLORS.get("GREEN") + "A Multi-User Dungeon" + RESET + "\n"
            + COLORS.get("DIM") + "------------------------------------------------------------" + RESET + "\n";

    private Ansi() {
    }

    /**
     * Wrap text in the named color. Unknown color names return the text unchanged.
     */
    public static String colorize(String text, String color) {
        if (color == null) return text;
        String code = COLORS.get(color.toUpperCase(Locale.ROOT));
        if (code == null) return text;
        return code + text + RESET;
    }

    public static String strip(String text) {
        if (text == null) return null;
        return ESCAPE_PATTERN.matcher(text).replaceAll("");
    }
}
