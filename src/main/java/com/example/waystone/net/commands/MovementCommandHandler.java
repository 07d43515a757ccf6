package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.engine.World;
import com.example.waystone.model.Direction;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Room;
import com.example.waystone.model.Stance;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles movement and looking around (the directions, go, look, exits).
 */
public class MovementCommandHandler implements CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(MovementCommandHandler.class);

    private static final List<CommandDefinition> COMMANDS = buildCommands();

    private static List<CommandDefinition> buildCommands() {
        List<CommandDefinition> defs = new ArrayList<>();
        for (Direction dir : Direction.values()) {
            defs.add(CommandDefinition.builder(dir.getKey(), Category.MOVEMENT)
                    .aliases(dir.getAliases().toArray(new String[0]))
                    .description("Move " + dir.getKey())
                    .requiresCharacter()
                    .build());
        }
        defs.add(CommandDefinition.builder("go", Category.MOVEMENT)
                .usage("go <direction>")
                .description("Move in a direction")
                .minArgs(1)
                .requiresCharacter()
                .build());
        defs.add(CommandDefinition.builder("look", Category.MOVEMENT)
                .aliases("l")
                .description("Look at your surroundings")
                .requiresCharacter()
                .build());
        defs.add(CommandDefinition.builder("exits", Category.MOVEMENT)
                .description("List the obvious exits")
                .requiresCharacter()
                .build());
        return List.copyOf(defs);
    }

    @Override
    public List<CommandDefinition> getCommands() {
        return COMMANDS;
    }

    @Override
    public void handle(CommandContext ctx) {
        String cmdName = ctx.getCommandName();
        switch (cmdName) {
            case "look":
                handleLook(ctx);
                return;
            case "exits":
                handleExits(ctx);
                return;
            case "go": {
                Direction dir = Direction.fromString(ctx.getArg(0));
                if (dir == null) {
                    ctx.send(Ansi.colorize("Unknown direction: " + ctx.getArg(0), "RED"));
                    return;
                }
                move(ctx, dir);
                return;
            }
            default: {
                Direction dir = Direction.fromString(cmdName);
                if (dir == null) throw new IllegalArgumentException("Unsupported command " + cmdName);
                move(ctx, dir);
            }
        }
    }

    private void move(CommandContext ctx, Direction dir) {
        PlayerCharacter ch = ctx.getCharacter();
        if (ch == null) {
            ctx.send(Ansi.colorize("Character not found.", "RED"));
            return;
        }
        if (!ch.getStance().canMove()) {
            String fix = ch.getStance() == Stance.SLEEPING ? "wake" : "stand";
            ctx.send(Ansi.colorize("You can't move while " + ch.getStance().getDisplayName()
                    + ". Type '" + fix + "' first.", "YELLOW"));
            return;
        }

        GameEngine engine = ctx.getEngine();
        World world = engine.getWorld();
        String fromId = ch.getCurrentRoomId();
        Optional<Room> from = world.getRoom(fromId);
        if (from.isEmpty()) {
            ctx.send(Ansi.colorize("Your current location doesn't exist!", "RED"));
            return;
        }
        String toId = from.get().getExit(dir.getKey());
        if (toId == null) {
            ctx.send(Ansi.colorize("You can't go " + dir.getKey() + " from here.", "YELLOW"));
            return;
        }
        Optional<Room> to = world.getRoom(toId);
        if (to.isEmpty()) {
            logger.warn("Exit {} from {} leads to unknown room {}", dir.getKey(), fromId, toId);
            ctx.send(Ansi.colorize("That exit leads nowhere!", "RED"));
            return;
        }
        if (!world.moveCharacter(ch.getId(), fromId, toId)) {
            logger.warn("Character {} was not in {} when moving {}", ch.getName(), fromId, dir.getKey());
            world.placeCharacter(ch.getId(), toId);
        }
        ch.setCurrentRoomId(toId);

        engine.broadcastToRoom(fromId, Ansi.colorize(ch.getName() + " leaves " + dir.getKey() + ".", "CYAN"),
                ctx.getSession().getId());
        engine.broadcastToRoom(toId, Ansi.colorize(ch.getName() + " arrives " + dir.arrivalPhrase() + ".", "CYAN"),
                ctx.getSession().getId());

        ctx.send(Ansi.colorize("\nYou travel " + dir.getKey() + ".", "GREEN"));
        showRoom(ctx, to.get());
    }

    private void handleLook(CommandContext ctx) {
        PlayerCharacter ch = ctx.getCharacter();
        Optional<Room> room = ch == null ? Optional.empty() : ctx.getEngine().getWorld().getRoom(ch.getCurrentRoomId());
        if (room.isEmpty()) {
            ctx.send(Ansi.colorize("Your current location doesn't exist!", "RED"));
            return;
        }
        showRoom(ctx, room.get());
    }

    private void handleExits(CommandContext ctx) {
        PlayerCharacter ch = ctx.getCharacter();
        World world = ctx.getEngine().getWorld();
        Optional<Room> room = ch == null ? Optional.empty() : world.getRoom(ch.getCurrentRoomId());
        if (room.isEmpty()) {
            ctx.send(Ansi.colorize("Your current location doesn't exist!", "RED"));
            return;
        }
        List<String> dirs = room.get().getAvailableExits();
        if (dirs.isEmpty()) {
            ctx.send(Ansi.colorize("There are no obvious exits.", "YELLOW"));
            return;
        }
        ctx.send(Ansi.colorize("\nObvious exits:", "CYAN"));
        for (String dir : dirs) {
            String dest = world.getRoom(room.get().getExit(dir)).map(Room::getName).orElse("Unknown");
            ctx.send("  " + Ansi.colorize(capitalize(dir), "GREEN") + " - " + dest);
        }
    }

    /**
     * Describe a room to the player, including who else is there.
     */
    static void showRoom(CommandContext ctx, Room room) {
        if (!room.isLit()) {
            ctx.send("\n" + room.getName());
            ctx.send(Ansi.colorize("It is too dark to make out much here.", "DIM"));
            ctx.send("[Exits: " + (room.getExits().isEmpty() ? "none" : String.join(", ", room.getAvailableExits())) + "]");
            return;
        }
        ctx.send(room.formatDescription());
        String self = ctx.getSession().getCharacterId();
        List<String> others = new ArrayList<>();
        for (String occupant : room.getOccupants()) {
            if (occupant.equals(self)) continue;
            ctx.getEngine().getOnlineCharacter(occupant).ifPresent(other -> others.add(describe(other)));
        }
        if (!others.isEmpty()) {
            ctx.send("");
            for (String line : others) {
                ctx.send(Ansi.colorize(line, "CYAN"));
            }
        }
    }

    private static String describe(PlayerCharacter other) {
        switch (other.getStance()) {
            case RESTING: return other.getName() + " is resting here.";
            case SLEEPING: return other.getName() + " is sleeping here.";
            default: return other.getName() + " is here.";
        }
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
