package com.example.waystone.net.commands;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Room;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandDefinition;
import com.example.waystone.net.CommandDefinition.Category;
import com.example.waystone.net.ConnectionException;
import com.example.waystone.net.Session;
import com.example.waystone.persistence.CharacterDAO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Handles character management (characters, create, play, delete).
 * All of these need a logged-in account.
 */
public class CharacterCommandHandler implements CommandHandler {
    private static final Logger logger = LoggerFactory.getLogger(CharacterCommandHandler.class);

    static final Pattern CHARACTER_NAME_PATTERN = Pattern.compile("^[A-Z][a-zA-Z]{1,29}$");
    static final int CREATION_POINTS = 5;

    private static final Map<String, String> ATTRIBUTE_SHORTCUTS = new LinkedHashMap<>();
    static {
        ATTRIBUTE_SHORTCUTS.put("str", "strength");
        ATTRIBUTE_SHORTCUTS.put("s", "strength");
        ATTRIBUTE_SHORTCUTS.put("dex", "dexterity");
        ATTRIBUTE_SHORTCUTS.put("d", "dexterity");
        ATTRIBUTE_SHORTCUTS.put("con", "constitution");
        ATTRIBUTE_SHORTCUTS.put("c", "constitution");
        ATTRIBUTE_SHORTCUTS.put("int", "intelligence");
        ATTRIBUTE_SHORTCUTS.put("i", "intelligence");
        ATTRIBUTE_SHORTCUTS.put("wis", "wisdom");
        ATTRIBUTE_SHORTCUTS.put("w", "wisdom");
        ATTRIBUTE_SHORTCUTS.put("cha", "charisma");
        ATTRIBUTE_SHORTCUTS.put("ch", "charisma");
    }

    private static final List<CommandDefinition> COMMANDS = List.of(
            CommandDefinition.builder("characters", Category.CHARACTER)
                    .aliases("chars")
                    .description("List your characters")
                    .build(),
            CommandDefinition.builder("create", Category.CHARACTER)
                    .usage("create <name>")
                    .description("Create a new character")
                    .minArgs(1)
                    .build(),
            CommandDefinition.builder("play", Category.CHARACTER)
                    .usage("play <name>")
                    .description("Enter the game with a character")
                    .minArgs(1)
                    .build(),
            CommandDefinition.builder("delete", Category.CHARACTER)
                    .usage("delete <name>")
                    .description("Delete a character (permanent!)")
                    .minArgs(1)
                    .build());

    @Override
    public List<CommandDefinition> getCommands() {
        return COMMANDS;
    }

    @Override
    public void handle(CommandContext ctx) throws Exception {
        if (ctx.getSession().getUserId() == null) {
            ctx.send(Ansi.colorize("You must be logged in to do that.", "RED"));
            return;
        }
        switch (ctx.getCommandName()) {
            case "characters": handleList(ctx); break;
            case "create": handleCreate(ctx); break;
            case "play": handlePlay(ctx); break;
            case "delete": handleDelete(ctx); break;
            default: throw new IllegalArgumentException("Unsupported command " + ctx.getCommandName());
        }
    }

    private void handleList(CommandContext ctx) {
        List<PlayerCharacter> characters = ctx.getEngine().getCharacterDao().listByUser(ctx.getSession().getUserId());
        if (characters.isEmpty()) {
            ctx.send(Ansi.colorize("You have no characters yet.", "YELLOW"));
            ctx.send("Type " + Ansi.colorize("create <name>", "YELLOW") + " to create one.");
            return;
        }
        ctx.send(Ansi.colorize("\n=== Your Characters ===", "CYAN"));
        for (PlayerCharacter ch : characters) {
            ctx.send("  " + Ansi.colorize(ch.getName(), "BOLD") + " - Level " + ch.getLevel() + " "
                    + Ansi.colorize(ch.getBackground().getDisplayName(), "YELLOW"));
        }
        ctx.send("\nType " + Ansi.colorize("play <name>", "YELLOW") + " to enter the world.");
    }

    private void handleCreate(CommandContext ctx) throws ConnectionException {
        String name = ctx.getArg(0);
        if (!CHARACTER_NAME_PATTERN.matcher(name).matches()) {
            ctx.send(Ansi.colorize("Invalid character name. Must be 2-30 letters, starting with a capital letter.", "RED"));
            return;
        }
        CharacterDAO dao = ctx.getEngine().getCharacterDao();
        if (dao.isNameTaken(name)) {
            ctx.send(Ansi.colorize("The name '" + name + "' is already taken.", "RED"));
            return;
        }

        ctx.send(Ansi.colorize("\n=== Creating Character: " + name + " ===", "CYAN"));
        ctx.send(Ansi.colorize("\nChoose a background:", "YELLOW"));
        CharacterBackground[] backgrounds = CharacterBackground.values();
        for (int i = 0; i < backgrounds.length; i++) {
            ctx.send("  " + (i + 1) + ". " + Ansi.colorize(backgrounds[i].getDisplayName(), "CYAN"));
        }
        CharacterBackground background = parseBackground(ctx.prompt("\nEnter the number of your choice: "), backgrounds);
        if (background == null) {
            ctx.send(Ansi.colorize("Invalid choice. Character creation cancelled.", "RED"));
            return;
        }

        ctx.send(Ansi.colorize("\n" + name + " the " + background.getDisplayName()
                + " begins with base attributes of " + PlayerCharacter.BASE_ATTRIBUTE + ".", "CYAN"));
        ctx.send(Ansi.colorize("You have " + CREATION_POINTS + " bonus points to allocate.", "YELLOW"));
        Map<String, Integer> attributes = allocatePoints(ctx);

        ctx.send(Ansi.colorize("\n=== Character Summary ===", "CYAN"));
        ctx.send("Name: " + Ansi.colorize(name, "BOLD"));
        ctx.send("Background: " + Ansi.colorize(background.getDisplayName(), "YELLOW"));
        ctx.send("\nAttributes:");
        for (Map.Entry<String, Integer> e : attributes.entrySet()) {
            ctx.send("  " + capitalize(e.getKey()) + ": " + e.getValue());
        }
        String confirm = ctx.prompt(Ansi.colorize("\nConfirm creation? (y/n): ", "GREEN")).toLowerCase();
        if (!confirm.equals("y") && !confirm.equals("yes")) {
            ctx.send(Ansi.colorize("Character creation cancelled.", "YELLOW"));
            return;
        }

        Optional<PlayerCharacter> created = dao.createCharacter(ctx.getSession().getUserId(), name, background,
                attributes, ctx.getEngine().getConfig().getStartingRoomId());
        if (created.isEmpty()) {
            // someone else took the name while we were asking questions
            ctx.send(Ansi.colorize("The name '" + name + "' is already taken.", "RED"));
            return;
        }
        logger.info("Character {} ({}) created for user {}", name, created.get().getId(), ctx.getSession().getUserId());
        ctx.send(Ansi.colorize("\n" + name + " has been created!", "GREEN"));
        ctx.send("Type " + Ansi.colorize("play " + name, "YELLOW") + " to enter the world.");
    }

    private static CharacterBackground parseBackground(String choice, CharacterBackground[] backgrounds) {
        try {
            int index = Integer.parseInt(choice.trim()) - 1;
            return index >= 0 && index < backgrounds.length ? backgrounds[index] : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private Map<String, Integer> allocatePoints(CommandContext ctx) throws ConnectionException {
        Map<String, Integer> attributes = new LinkedHashMap<>();
        for (String attr : List.of("strength", "dexterity", "constitution", "intelligence", "wisdom", "charisma")) {
            attributes.put(attr, PlayerCharacter.BASE_ATTRIBUTE);
        }
        int remaining = CREATION_POINTS;
        while (remaining > 0) {
            ctx.send(Ansi.colorize("\nPoints remaining: " + remaining, "GREEN"));
            ctx.send("Attributes (shortcuts in parentheses):");
            ctx.send("  Strength (str/s): " + attributes.get("strength"));
            ctx.send("  Dexterity (dex/d): " + attributes.get("dexterity"));
            ctx.send("  Constitution (con/c): " + attributes.get("constitution"));
            ctx.send("  Intelligence (int/i): " + attributes.get("intelligence"));
            ctx.send("  Wisdom (wis/w): " + attributes.get("wisdom"));
            ctx.send("  Charisma (cha/ch): " + attributes.get("charisma"));

            String choice = ctx.prompt(Ansi.colorize("\nEnter attribute to increase (or 'done' to finish): ", "YELLOW"))
                    .toLowerCase();
            if (choice.equals("done") || choice.equals("dn")) break;
            String attr = ATTRIBUTE_SHORTCUTS.getOrDefault(choice, choice);
            if (!attributes.containsKey(attr)) {
                ctx.send(Ansi.colorize("Invalid attribute. Use: str, dex, con, int, wis, cha", "RED"));
                continue;
            }
            attributes.merge(attr, 1, Integer::sum);
            remaining--;
            ctx.send(Ansi.colorize("  +1 " + capitalize(attr) + " (now " + attributes.get(attr) + ")", "GREEN"));
        }
        return attributes;
    }

    private void handlePlay(CommandContext ctx) {
        Session session = ctx.getSession();
        if (session.hasCharacter()) {
            ctx.send(Ansi.colorize("You are already playing a character. Use 'logout' or 'quit' first.", "YELLOW"));
            return;
        }
        String name = ctx.getArg(0);
        GameEngine engine = ctx.getEngine();
        Optional<PlayerCharacter> found = engine.getCharacterDao().findByUserAndName(session.getUserId(), name);
        if (found.isEmpty()) {
            ctx.send(Ansi.colorize("You don't have a character named '" + name + "'.", "RED"));
            return;
        }
        PlayerCharacter character = found.get();
        if (!engine.enterWorld(session, character)) {
            ctx.send(Ansi.colorize(character.getName() + " is already being played in another session.", "RED"));
            return;
        }

        ctx.send(Ansi.colorize("\nWelcome to the world, " + character.getName() + "!\n", "GREEN"));
        Optional<Room> room = engine.getWorld().getRoom(character.getCurrentRoomId());
        room.ifPresent(r -> MovementCommandHandler.showRoom(ctx, r));
    }

    private void handleDelete(CommandContext ctx) throws ConnectionException {
        String name = ctx.getArg(0);
        GameEngine engine = ctx.getEngine();
        Optional<PlayerCharacter> found = engine.getCharacterDao().findByUserAndName(ctx.getSession().getUserId(), name);
        if (found.isEmpty()) {
            ctx.send(Ansi.colorize("You don't have a character named '" + name + "'.", "RED"));
            return;
        }
        PlayerCharacter character = found.get();
        if (engine.getSessionForCharacter(character.getId()).isPresent()) {
            ctx.send(Ansi.colorize(character.getName() + " is in the world and cannot be deleted now.", "RED"));
            return;
        }

        ctx.send(Ansi.colorize("\nWARNING: This will permanently delete " + character.getName() + "!", "RED"));
        String confirm = ctx.prompt(Ansi.colorize("Type '" + character.getName() + "' exactly to confirm deletion: ", "YELLOW"));
        if (!confirm.equals(character.getName())) {
            ctx.send(Ansi.colorize("Deletion cancelled.", "GREEN"));
            return;
        }
        engine.getCharacterDao().delete(character.getId());
        logger.info("Character {} ({}) deleted by user {}", character.getName(), character.getId(),
                ctx.getSession().getUserId());
        ctx.send(Ansi.colorize("\n" + character.getName() + " has been deleted.", "YELLOW"));
    }

    private static String capitalize(String s) {
        return s.isEmpty() ? s : Character.toUpperCase(s.charAt(0)) + s.substring(1);
    }
}
