package com.example.waystone.net.commands;

import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Stance;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;

import java.util.List;

/**
 * Handles stance changes (rest, sleep, stand). Resting and sleeping speed
 * up regeneration but prevent movement.
 */
public class PositionCommandHandler implements CommandHandler {

    private static final List<CommandDefinition> COMMANDS = List.of(
            CommandDefinition.builder("rest", Category.POSITION)
                    .aliases("sit")
                    .description("Sit down and rest (2x regeneration)")
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("sleep", Category.POSITION)
                    .description("Go to sleep (4x regeneration)")
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("stand", Category.POSITION)
                    .aliases("wake")
                    .description("Stand up from resting or sleeping")
                    .requiresCharacter()
                    .build());

    @Override
    public List<CommandDefinition> getCommands() {
        return COMMANDS;
    }

    @Override
    public void handle(CommandContext ctx) {
        PlayerCharacter ch = ctx.getCharacter();
        if (ch == null) {
            ctx.send(Ansi.colorize("Character not found.", "RED"));
            return;
        }
        Stance current = ch.getStance();
        switch (ctx.getCommandName()) {
            case "rest":
                if (current == Stance.RESTING) {
                    ctx.send("You are already resting.");
                    return;
                }
                change(ctx, ch, Stance.RESTING,
                        current == Stance.SLEEPING ? "You wake and sit up." : "You sit down and rest.",
                        ch.getName() + " sits down and rests.");
                return;
            case "sleep":
                if (current == Stance.SLEEPING) {
                    ctx.send("You are already asleep.");
                    return;
                }
                change(ctx, ch, Stance.SLEEPING, "You lie down and go to sleep.",
                        ch.getName() + " lies down and goes to sleep.");
                return;
            case "stand":
                if (current == Stance.STANDING) {
                    ctx.send("You are already standing.");
                    return;
                }
                change(ctx, ch, Stance.STANDING,
                        current == Stance.SLEEPING ? "You wake and stand up." : "You stand up.",
                        ch.getName() + " stands up.");
                return;
            default:
                throw new IllegalArgumentException("Unsupported command " + ctx.getCommandName());
        }
    }

    private void change(CommandContext ctx, PlayerCharacter ch, Stance stance, String selfMessage, String roomMessage) {
        ch.setStance(stance);
        ctx.send(Ansi.colorize(selfMessage, "GREEN"));
        ctx.getEngine().broadcastToRoom(ch.getCurrentRoomId(), Ansi.colorize(roomMessage, "CYAN"), ctx.getSession().getId());
    }
}
