package com.example.waystone.net.commands;

import com.example.waystone.net.CommandDefinition;

import java.util.List;

/**
 * Interface for command handlers. Each handler processes one category of
 * related commands and switches on {@link CommandContext#getCommandName()}.
 */
public interface CommandHandler {

    /**
     * The commands this handler executes.
     */
    List<CommandDefinition> getCommands();

    /**
     * Execute the command.
     *
     * @param ctx the command context containing all necessary state
     * @throws Exception any failure; the dispatcher reports it to the player
     */
    void handle(CommandContext ctx) throws Exception;
}
