package com.example.waystone.net;

import com.example.waystone.net.CommandDefinition.Category;
import com.example.waystone.net.commands.Command;
import com.example.waystone.net.commands.CommandContext;
import com.example.waystone.net.commands.CommandHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of all game commands, keyed by name and alias.
 *
 * Filled once while the engine starts and only read afterwards.
 */
public class CommandRegistry {
    private static final Logger logger = LoggerFactory.getLogger(CommandRegistry.class);

    private final List<Command> commands = new ArrayList<>();
    private final Map<String, Command> byName = new ConcurrentHashMap<>();

    /**
     * Register every command a category handler declares.
     */
    public synchronized void register(CommandHandler handler) {
        for (CommandDefinition def : handler.getCommands()) {
            register(new HandlerCommand(def, handler));
        }
    }

    /**
     * Register a command under its name and all of its aliases.
     *
     * @throws IllegalStateException if any of those verbs is already claimed
     */
    public synchronized void register(Command command) {
        List<String> names = command.getNames();
        for (String name : names) {
            Command existing = byName.get(name.toLowerCase());
            if (existing != null) {
                throw new IllegalStateException("Command verb '" + name + "' already registered by "
                        + existing.getDefinition().getName());
            }
        }
        for (String name : names) {
            byName.put(name.toLowerCase(), command);
        }
        commands.add(command);
        logger.debug("Registered command {}", command.getDefinition().getDisplayName());
    }

    /**
     * Look up a command by name or alias, ignoring case.
     */
    public Optional<Command> get(String verb) {
        if (verb == null) return Optional.empty();
        return Optional.ofNullable(byName.get(verb.toLowerCase()));
    }

    public synchronized List<Command> getAllCommands() {
        return Collections.unmodifiableList(new ArrayList<>(commands));
    }

    public synchronized List<Command> getCommandsByCategory(Category category) {
        List<Command> result = new ArrayList<>();
        for (Command cmd : commands) {
            if (cmd.getDefinition().getCategory() == category) {
                result.add(cmd);
            }
        }
        return result;
    }

    private static final class HandlerCommand implements Command {
        private final CommandDefinition definition;
        private final CommandHandler handler;

        HandlerCommand(CommandDefinition definition, CommandHandler handler) {
            this.definition = definition;
            this.handler = handler;
        }

        @Override
        public CommandDefinition getDefinition() {
            return definition;
        }

        @Override
        public void execute(CommandContext ctx) throws Exception {
            handler.handle(ctx);
        }

        @Override
        public String toString() {
            return "Command(" + definition.getName() + ")";
        }
    }
}
