package com.example.waystone.net.commands;

import com.example.waystone.EngineFixtures;
import com.example.waystone.ScriptedClient;
import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.net.ConnectionException;
import com.example.waystone.net.SessionState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CharacterCommandHandler Tests")
public class CharacterCommandHandlerTest {

    private GameEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        engine = EngineFixtures.startedEngine();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("character commands need a login")
    void requiresLogin() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        client.command("characters");
        assertTrue(client.takeOutput().contains("You must be logged in to do that."));
    }

    @Test
    @DisplayName("create walks through background, points and confirmation")
    void createInteractive() throws Exception {
        String script = "1\r\n" + "str\r\n" + "s\r\n" + "con\r\n" + "bogus\r\n" + "i\r\n" + "ch\r\n" + "y\r\n";
        ScriptedClient client = new ScriptedClient(engine, script);
        EngineFixtures.loggedIn(engine, client, "alice");

        client.command("create Kvothe");
        String output = client.takeOutput();
        assertTrue(output.contains("Choose a background:"));
        assertTrue(output.contains("Invalid attribute"));
        assertTrue(output.contains("Kvothe has been created!"));

        PlayerCharacter ch = engine.getCharacterDao().findByName("Kvothe").orElseThrow();
        assertEquals(CharacterBackground.SCHOLAR, ch.getBackground());
        assertEquals(12, ch.getStrength());
        assertEquals(11, ch.getConstitution());
        assertEquals(11, ch.getIntelligence());
        assertEquals(11, ch.getCharisma());
        assertEquals(10, ch.getDexterity());
        assertEquals(EngineFixtures.START_ROOM, ch.getCurrentRoomId());
        assertEquals(ch.getMaxHp(), ch.getCurrentHp());
    }

    @Test
    @DisplayName("done ends allocation early")
    void createDoneEarly() throws Exception {
        ScriptedClient client = new ScriptedClient(engine, "4\r\ndex\r\ndone\r\nyes\r\n");
        EngineFixtures.loggedIn(engine, client, "alice");
        client.command("create Denna");
        PlayerCharacter ch = engine.getCharacterDao().findByName("Denna").orElseThrow();
        assertEquals(CharacterBackground.WAYFARER, ch.getBackground());
        assertEquals(11, ch.getDexterity());
        assertEquals(10, ch.getStrength());
    }

    @Test
    @DisplayName("invalid background cancels creation")
    void createBadBackground() throws Exception {
        ScriptedClient client = new ScriptedClient(engine, "9\r\n");
        EngineFixtures.loggedIn(engine, client, "alice");
        client.command("create Kvothe");
        assertTrue(client.takeOutput().contains("Invalid choice. Character creation cancelled."));
        assertTrue(engine.getCharacterDao().findByName("Kvothe").isEmpty());
    }

    @Test
    @DisplayName("declining the summary creates nothing")
    void createDeclined() throws Exception {
        ScriptedClient client = new ScriptedClient(engine, "2\r\ndone\r\nn\r\n");
        EngineFixtures.loggedIn(engine, client, "alice");
        client.command("create Kvothe");
        assertTrue(client.takeOutput().contains("Character creation cancelled."));
        assertTrue(engine.getCharacterDao().findByName("Kvothe").isEmpty());
    }

    @Test
    @DisplayName("create rejects bad and taken names")
    void createNameChecks() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        EngineFixtures.loggedIn(engine, client, "alice");
        client.command("create kvothe");
        assertTrue(client.takeOutput().contains("Invalid character name"));

        engine.getCharacterDao().createCharacter(client.getSession().getUserId(), "Kvothe",
                CharacterBackground.PERFORMER, Map.of(), EngineFixtures.START_ROOM);
        client.command("create KVOTHE");
        assertTrue(client.takeOutput().contains("The name 'KVOTHE' is already taken."));
        client.command("create Kvothe");
        assertTrue(client.takeOutput().contains("The name 'Kvothe' is already taken."));
    }

    @Test
    @DisplayName("a dropped connection during create propagates")
    void createConnectionLost() throws Exception {
        ScriptedClient client = new ScriptedClient(engine, "1\r\n");
        EngineFixtures.loggedIn(engine, client, "alice");
        assertThrows(ConnectionException.class, () -> client.command("create Kvothe"));
        assertTrue(engine.getCharacterDao().findByName("Kvothe").isEmpty());
    }

    @Test
    @DisplayName("characters lists the account's characters")
    void listCharacters() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        EngineFixtures.loggedIn(engine, client, "alice");
        client.command("chars");
        assertTrue(client.takeOutput().contains("You have no characters yet."));

        engine.getCharacterDao().createCharacter(client.getSession().getUserId(), "Kvothe",
                CharacterBackground.PERFORMER, Map.of(), EngineFixtures.START_ROOM);
        client.command("characters");
        String output = client.takeOutput();
        assertTrue(output.contains("Kvothe - Level 1 Performer"));
    }

    @Test
    @DisplayName("play puts the character in the starting room")
    void play() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        EngineFixtures.loggedIn(engine, client, "alice");
        engine.getCharacterDao().createCharacter(client.getSession().getUserId(), "Kvothe",
                CharacterBackground.PERFORMER, Map.of(), EngineFixtures.START_ROOM);

        client.command("play kvothe");
        String output = client.takeOutput();
        assertTrue(output.contains("Welcome to the world, Kvothe!"));
        assertTrue(output.contains("Test Start"));
        assertEquals(SessionState.PLAYING, client.getSession().getState());
        assertTrue(engine.getWorld().getOccupants(EngineFixtures.START_ROOM)
                .contains(client.getSession().getCharacterId()));
    }

    @Test
    @DisplayName("play refuses other accounts' characters and a second character")
    void playRefusals() throws Exception {
        ScriptedClient owner = new ScriptedClient(engine);
        ScriptedClient other = new ScriptedClient(engine);
        EngineFixtures.playing(engine, owner, "alice", "Kvothe");
        EngineFixtures.loggedIn(engine, other, "bob");

        other.command("play Kvothe");
        assertTrue(other.takeOutput().contains("You don't have a character named 'Kvothe'."));

        engine.getCharacterDao().createCharacter(owner.getSession().getUserId(), "Simmon",
                CharacterBackground.NOBLE, Map.of(), EngineFixtures.START_ROOM);
        owner.command("play Simmon");
        assertTrue(owner.takeOutput().contains("You are already playing a character."));
    }

    @Test
    @DisplayName("play of a character in use elsewhere is refused")
    void playInUse() throws Exception {
        ScriptedClient first = new ScriptedClient(engine);
        PlayerCharacter ch = EngineFixtures.playing(engine, first, "alice", "Kvothe");
        first.command("logout");

        ScriptedClient second = new ScriptedClient(engine);
        second.command("login alice secret123");
        second.takeOutput();
        // a stale binding from a session that never released the character
        ScriptedClient ghost = new ScriptedClient(engine);
        ghost.getSession().setUser(second.getSession().getUserId());
        assertTrue(engine.enterWorld(ghost.getSession(), engine.getCharacterDao().findById(ch.getId()).orElseThrow()));

        second.command("play Kvothe");
        assertTrue(second.takeOutput().contains("Kvothe is already being played in another session."));
        assertNotEquals(SessionState.PLAYING, second.getSession().getState());
    }

    @Test
    @DisplayName("delete needs the exact name typed back")
    void deleteCharacter() throws Exception {
        ScriptedClient client = new ScriptedClient(engine, "kvothe\r\nKvothe\r\n");
        EngineFixtures.loggedIn(engine, client, "alice");
        engine.getCharacterDao().createCharacter(client.getSession().getUserId(), "Kvothe",
                CharacterBackground.PERFORMER, Map.of(), EngineFixtures.START_ROOM);

        client.command("delete Kvothe");
        assertTrue(client.takeOutput().contains("Deletion cancelled."));
        assertTrue(engine.getCharacterDao().findByName("Kvothe").isPresent());

        client.command("delete Kvothe");
        assertTrue(client.takeOutput().contains("Kvothe has been deleted."));
        assertTrue(engine.getCharacterDao().findByName("Kvothe").isEmpty());
    }

    @Test
    @DisplayName("a character in play cannot be deleted")
    void deleteOnline() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        EngineFixtures.playing(engine, client, "alice", "Kvothe");
        client.command("delete Kvothe");
        assertTrue(client.takeOutput().contains("is in the world and cannot be deleted now."));
    }
}
