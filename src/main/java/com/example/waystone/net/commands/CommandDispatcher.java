package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandParser;
import com.example.waystone.net.CommandParser.ParsedCommand;
import com.example.waystone.net.CommandRegistry;
import com.example.waystone.net.ConnectionException;
import com.example.waystone.net.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns one input line into at most one command execution.
 *
 * Every path that reaches a command ends with the player hearing something:
 * the command's own output, a usage line, or a single generic failure line.
 */
public class CommandDispatcher {
    private static final Logger logger = LoggerFactory.getLogger(CommandDispatcher.class);

    public static final String GENERIC_FAILURE = "An error occurred while executing the command.";
    public static final String CHARACTER_REQUIRED = "You must be playing a character to use this command.";

    private final CommandRegistry registry;
    private final GameEngine engine;

    public CommandDispatcher(CommandRegistry registry, GameEngine engine) {
        this.registry = registry;
        this.engine = engine;
    }

    /**
     * Parse and execute a line for the session.
     *
     * @throws ConnectionException if the connection failed while an
     *         interactive command was reading from it
     */
    public void dispatch(Session session, String rawLine) throws ConnectionException {
        ParsedCommand parsed = CommandParser.parse(rawLine);
        if (parsed == null) return;
        session.updateActivity();

        Optional<Command> found = registry.get(parsed.getVerb());
        if (found.isEmpty()) {
            session.getConnection().sendLine(Ansi.colorize(
                    "Unknown command: " + parsed.getVerb() + ". Type 'help' for a list of commands.", "YELLOW"));
            return;
        }

        Command command = found.get();
        CommandDefinition def = command.getDefinition();
        if (def.requiresCharacter() && !session.hasCharacter()) {
            session.getConnection().sendLine(CHARACTER_REQUIRED);
            return;
        }
        if (parsed.getArgs().size() < def.getMinArgs()) {
            session.getConnection().sendLine("Usage: " + def.getUsage());
            return;
        }

        CommandContext ctx = new CommandContext(session, engine, def, parsed.getArgs(), parsed.getRawInput());
        try {
            command.execute(ctx);
            logger.debug("Session {} executed {}", session.getId(), def.getName());
        } catch (ConnectionException e) {
            throw e;
        } catch (Exception e) {
            logger.error("Command '{}' failed for session {} (character {}): {}",
                    def.getName(), session.getId(), session.getCharacterId(), e.getMessage(), e);
            session.getConnection().sendLine(Ansi.colorize(GENERIC_FAILURE, "RED"));
        }
    }
}
