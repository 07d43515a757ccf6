package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;

import java.util.List;
import java.util.Optional;

/**
 * Handles communication commands (say, emote, chat, tell).
 */
public class CommunicationCommandHandler implements CommandHandler {

    private static final List<CommandDefinition> COMMANDS = List.of(
            CommandDefinition.builder("say", Category.COMMUNICATION)
                    .usage("say <message>")
                    .description("Say something to others in the room (shortcut: ')")
                    .minArgs(1)
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("emote", Category.COMMUNICATION)
                    .usage("emote <action>")
                    .description("Perform an action visible to the room (shortcut: :)")
                    .minArgs(1)
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("chat", Category.COMMUNICATION)
                    .aliases("ooc")
                    .usage("chat <message>")
                    .description("Send a message to everyone online")
                    .minArgs(1)
                    .requiresCharacter()
                    .build(),
            CommandDefinition.builder("tell", Category.COMMUNICATION)
                    .aliases("whisper", "t")
                    .usage("tell <player> <message>")
                    .description("Send a private message to another player")
                    .minArgs(2)
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
        switch (ctx.getCommandName()) {
            case "say": handleSay(ctx, ch); break;
            case "emote": handleEmote(ctx, ch); break;
            case "chat": handleChat(ctx, ch); break;
            case "tell": handleTell(ctx, ch); break;
            default: throw new IllegalArgumentException("Unsupported command " + ctx.getCommandName());
        }
    }

    private void handleSay(CommandContext ctx, PlayerCharacter ch) {
        if (ch.getStance().isAsleep()) {
            ctx.send(Ansi.colorize("You mumble in your sleep.", "YELLOW"));
            return;
        }
        String message = ctx.getArgString();
        ctx.send(Ansi.colorize("You say, \"" + message + "\"", "YELLOW"));
        ctx.getEngine().broadcastToRoom(ch.getCurrentRoomId(),
                Ansi.colorize(ch.getName() + " says, \"" + message + "\"", "YELLOW"), ctx.getSession().getId());
    }

    private void handleEmote(CommandContext ctx, PlayerCharacter ch) {
        String line = Ansi.colorize(ch.getName() + " " + ctx.getArgString(), "MAGENTA");
        ctx.send(line);
        ctx.getEngine().broadcastToRoom(ch.getCurrentRoomId(), line, ctx.getSession().getId());
    }

    private void handleChat(CommandContext ctx, PlayerCharacter ch) {
        String line = Ansi.colorize("[CHAT] ", "CYAN") + Ansi.colorize(ch.getName(), "BOLD")
                + Ansi.colorize(": ", "CYAN") + ctx.getArgString();
        ctx.send(line);
        ctx.getEngine().broadcastAll(line, ctx.getSession().getId());
    }

    private void handleTell(CommandContext ctx, PlayerCharacter ch) {
        String targetName = ctx.getArg(0);
        String message = ctx.getArgString(1);
        GameEngine engine = ctx.getEngine();
        Optional<PlayerCharacter> target = engine.findOnlineCharacterByName(targetName);
        if (target.isEmpty()) {
            ctx.send(Ansi.colorize(targetName + " is not currently online.", "YELLOW"));
            return;
        }
        if (target.get().getId().equals(ch.getId())) {
            ctx.send(Ansi.colorize("You mutter to yourself.", "YELLOW"));
            return;
        }
        engine.sendToCharacter(target.get().getId(), Ansi.colorize(ch.getName() + " tells you, ", "MAGENTA")
                + Ansi.colorize("\"" + message + "\"", "WHITE"));
        ctx.send(Ansi.colorize("You tell " + target.get().getName() + ", ", "MAGENTA")
                + Ansi.colorize("\"" + message + "\"", "WHITE"));
    }
}
