package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;
import com.example.waystone.net.CommandRegistry;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Handles information commands (help, who, score, time, save).
 */
public class InformationCommandHandler implements CommandHandler {

    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'").withZone(ZoneOffset.UTC);

    private static final List<CommandDefinition> COMMANDS = List.of(
            CommandDefinition.builder("help", Category.INFORMATION)
                    .aliases("?")
                    .usage("help [command]")
                    .description("Display available commands or help on a specific command")
                    .build(),
            CommandDefinition.builder("who", Category.INFORMATION)
                    .description("List all players currently online")
                    .build(),
            CommandDefinition.builder("score", Category.INFORMATION)
                    .aliases("stats", "sc")
                    .description("Display your character sheet")
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("time", Category.INFORMATION)
                    .description("Show the server time and uptime")
                    .build(),
            CommandDefinition.builder("save", Category.INFORMATION)
                    .description("Save your character")
                    .requiresCharacter()
                    .build());

    @Override
    public List<CommandDefinition> getCommands() {
        return COMMANDS;
    }

    @Override
    public void handle(CommandContext ctx) {
        switch (ctx.getCommandName()) {
            case "help": handleHelp(ctx); break;
            case "who": handleWho(ctx); break;
            case "score": handleScore(ctx); break;
            case "time": handleTime(ctx); break;
            case "save": handleSave(ctx); break;
            default: throw new IllegalArgumentException("Unsupported command " + ctx.getCommandName());
        }
    }

    private void handleHelp(CommandContext ctx) {
        CommandRegistry registry = ctx.getEngine().getCommandRegistry();
        String topic = ctx.getArg(0);
        if (topic != null) {
            Optional<Command> cmd = registry.get(topic);
            if (cmd.isEmpty()) {
                ctx.send(Ansi.colorize("No help available for '" + topic + "'.", "YELLOW"));
                return;
            }
            CommandDefinition def = cmd.get().getDefinition();
            ctx.send(Ansi.colorize(def.getUsage(), "YELLOW") + " - " + def.getDescription());
            if (!def.getAliases().isEmpty()) {
                ctx.send("Aliases: " + String.join(", ", def.getAliases()));
            }
            return;
        }

        ctx.send(Ansi.colorize("\n=== Available Commands ===", "CYAN"));
        for (Category category : Category.values()) {
            List<Command> commands = registry.getCommandsByCategory(category);
            if (commands.isEmpty()) continue;
            ctx.send(Ansi.colorize("\n" + category.getDisplayName() + ":", "YELLOW"));
            for (Command cmd : commands) {
                CommandDefinition def = cmd.getDefinition();
                ctx.send(String.format("  %-28s %s", def.getDisplayName(), def.getDescription()));
            }
        }
        ctx.send("\nType " + Ansi.colorize("help <command>", "YELLOW") + " for details on a command.");
    }

    private void handleWho(CommandContext ctx) {
        GameEngine engine = ctx.getEngine();
        List<String> lines = new ArrayList<>();
        for (Map.Entry<String, Set<String>> room : engine.getWorld().occupancySnapshot().entrySet()) {
            String roomName = engine.getWorld().getRoom(room.getKey()).map(r -> r.getName()).orElse(room.getKey());
            for (String characterId : room.getValue()) {
                engine.getOnlineCharacter(characterId).ifPresent(ch ->
                        lines.add("  " + Ansi.colorize(ch.getName(), "BOLD") + " - " + roomName));
            }
        }
        ctx.send(Ansi.colorize("\n=== Players Online ===", "CYAN"));
        lines.sort(String.CASE_INSENSITIVE_ORDER);
        for (String line : lines) {
            ctx.send(line);
        }
        ctx.send(lines.size() + (lines.size() == 1 ? " player" : " players") + " online.");
    }

    private void handleScore(CommandContext ctx) {
        PlayerCharacter ch = ctx.getCharacter();
        if (ch == null) {
            ctx.send(Ansi.colorize("Character not found.", "RED"));
            return;
        }
        Map<String, Integer> bonuses = ch.getBackground().getBonuses();
        ctx.send(Ansi.colorize("\n=== " + ch.getName() + " ===", "CYAN"));
        ctx.send("Background: " + Ansi.colorize(ch.getBackground().getDisplayName(), "YELLOW")
                + "   Level: " + ch.getLevel() + "   Experience: " + ch.getExperience());
        ctx.send("HP: " + ch.getCurrentHp() + "/" + ch.getMaxHp() + "   Position: " + ch.getStance().getDisplayName());
        ctx.send("\nAttributes:");
        for (Map.Entry<String, Integer> attr : ch.getAttributes().entrySet()) {
            int bonus = bonuses.getOrDefault(attr.getKey(), 0);
            int total = attr.getValue() + bonus;
            int mod = PlayerCharacter.modifier(total);
            String line = String.format("  %-13s %2d (%s%d)", capitalize(attr.getKey()) + ":", total, mod >= 0 ? "+" : "", mod);
            if (bonus > 0) line += Ansi.colorize("  [+" + bonus + " background]", "DIM");
            ctx.send(line);
        }
    }

    private void handleTime(CommandContext ctx) {
        GameEngine engine = ctx.getEngine();
        Instant now = engine.getClock().instant();
        ctx.send("Server time: " + TIME_FORMAT.format(now));
        Instant started = engine.getStartedAt();
        if (started != null) {
            ctx.send("Uptime: " + formatDuration(Duration.between(started, now)));
        }
    }

    private void handleSave(CommandContext ctx) {
        PlayerCharacter ch = ctx.getCharacter();
        if (ch == null) {
            ctx.send(Ansi.colorize("Character not found.", "RED"));
            return;
        }
        ctx.getEngine().saveCharacter(ch);
        ctx.send(Ansi.colorize("Your character has been saved.", "GREEN"));
    }

    static String formatDuration(Duration d) {
        long days = d.toDays();
        long hours = d.toHoursPart();
        long minutes = d.toMinutesPart();
        if (days > 0) return days + "d " + hours + "h " + minutes + "m";
        if (hours > 0) return hours + "h " + minutes + "m";
        return minutes + "m " + d.toSecondsPart() + "s";
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
