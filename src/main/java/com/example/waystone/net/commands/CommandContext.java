package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.ConnectionException;
import com.example.waystone.net.Session;
import com.example.waystone.net.TelnetConnection;

import java.util.List;

/**
 * Context object passed to command handlers containing all the state needed
 * to execute a command. This decouples command handlers from the connection loop.
 */
public class CommandContext {
    private final Session session;
    private final TelnetConnection connection;
    private final GameEngine engine;
    private final CommandDefinition definition;
    private final List<String> args;
    private final String rawInput;

    public CommandContext(Session session, GameEngine engine, CommandDefinition definition,
                          List<String> args, String rawInput) {
        this.session = session;
        this.connection = session.getConnection();
        this.engine = engine;
        this.definition = definition;
        this.args = List.copyOf(args);
        this.rawInput = rawInput;
    }

    public Session getSession() { return session; }
    public TelnetConnection getConnection() { return connection; }
    public GameEngine getEngine() { return engine; }
    public CommandDefinition getDefinition() { return definition; }
    public List<String> getArgs() { return args; }
    public String getRawInput() { return rawInput; }

    /**
     * Get the canonical command name, whichever alias was typed.
     */
    public String getCommandName() {
        return definition.getName();
    }

    /**
     * @return the argument at index, or null if there are fewer arguments
     */
    public String getArg(int index) {
        return index < args.size() ? args.get(index) : null;
    }

    /**
     * Arguments from index onwards joined by single spaces.
     */
    public String getArgString(int fromIndex) {
        if (fromIndex >= args.size()) return "";
        return String.join(" ", args.subList(fromIndex, args.size()));
    }

    public String getArgString() {
        return getArgString(0);
    }

    /**
     * The character this session is playing, or null before {@code play}.
     */
    public PlayerCharacter getCharacter() {
        String characterId = session.getCharacterId();
        if (characterId == null) return null;
        return engine.getOnlineCharacter(characterId).orElse(null);
    }

    /**
     * Send a message to the player.
     */
    public void send(String message) {
        connection.sendLine(message);
    }

    /**
     * Show a prompt and wait for the player's answer.
     */
    public String prompt(String question) throws ConnectionException {
        connection.send(question);
        return connection.readLine();
    }
}
