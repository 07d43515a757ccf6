package com.example.waystone.net;

import java.util.Collections;
import java.util.List;

/**
 * Defines metadata for a single command in the game.
 */
public class CommandDefinition {

    public enum Category {
        AUTHENTICATION("Account"),
        CHARACTER("Characters"),
        MOVEMENT("Movement"),
        COMMUNICATION("Communication"),
        INFORMATION("Information"),
        POSITION("Position");

        private final String displayName;

        Category(String displayName) {
            this.displayName = displayName;
        }

        public String getDisplayName() {
            return displayName;
        }
    }

    private final String name;
    private final String usage;
    private final String description;
    private final Category category;
    private final List<String> aliases;
    private final int minArgs;
    private final boolean requiresCharacter;

    public CommandDefinition(String name, String usage, String description, Category category,
                             List<String> aliases, int minArgs, boolean requiresCharacter) {
        this.name = name.toLowerCase();
        this.usage = usage == null ? name : usage;
        this.description = description;
        this.category = category;
        this.aliases = aliases == null ? Collections.emptyList() : List.copyOf(aliases);
        this.minArgs = minArgs;
        this.requiresCharacter = requiresCharacter;
    }

    /**
     * A command usable before a character is in play, taking no arguments.
     */
    public CommandDefinition(String name, String description, Category category) {
        this(name, name, description, category, Collections.emptyList(), 0, false);
    }

    public String getName() { return name; }
    public String getUsage() { return usage; }
    public String getDescription() { return description; }
    public Category getCategory() { return category; }
    public List<String> getAliases() { return aliases; }
    public int getMinArgs() { return minArgs; }
    public boolean requiresCharacter() { return requiresCharacter; }

    /**
     * Returns the display name for help listings (e.g., "north (n)" if has alias "n").
     */
    public String getDisplayName() {
        if (aliases.isEmpty()) {
            return name;
        }
        return name + " (" + String.join(", ", aliases) + ")";
    }

    public static Builder builder(String name, Category category) {
        return new Builder(name, category);
    }

    public static class Builder {
        private final String name;
        private final Category category;
        private String usage;
        private String description = "";
        private List<String> aliases = Collections.emptyList();
        private int minArgs;
        private boolean requiresCharacter;

        private Builder(String name, Category category) {
            this.name = name;
            this.category = category;
        }

        public Builder usage(String usage) { this.usage = usage; return this; }
        public Builder description(String description) { this.description = description; return this; }
        public Builder aliases(String... aliases) { this.aliases = List.of(aliases); return this; }
        public Builder minArgs(int minArgs) { this.minArgs = minArgs; return this; }
        public Builder requiresCharacter() { this.requiresCharacter = true; return this; }

        public CommandDefinition build() {
            return new CommandDefinition(name, usage, description, category, aliases, minArgs, requiresCharacter);
        }
    }

    @Override
    public String toString() {
        return "CommandDefinition(" + getDisplayName() + ")";
    }
}
