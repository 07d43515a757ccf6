package com.example.waystone.net.commands;

import com.example.waystone.net.CommandDefinition;

import java.util.ArrayList;
import java.util.List;

/**
 * A single executable command. The registry stores one instance under its
 * name and under every alias.
 */
public interface Command {

    CommandDefinition getDefinition();

    void execute(CommandContext ctx) throws Exception;

    /** Canonical name first, then aliases. */
    default List<String> getNames() {
        CommandDefinition def = getDefinition();
        List<String> names = new ArrayList<>();
        names.add(def.getName());
        names.addAll(def.getAliases());
        return names;
    }
}
