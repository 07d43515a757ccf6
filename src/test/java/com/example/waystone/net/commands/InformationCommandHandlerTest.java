package com.example.waystone.net.commands;

import com.example.waystone.EngineFixtures;
import com.example.waystone.MutableClock;
import com.example.waystone.ScriptedClient;
import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.PlayerCharacter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InformationCommandHandler Tests")
public class InformationCommandHandlerTest {

    private MutableClock clock;
    private GameEngine engine;

    @BeforeEach
    void setUp() throws Exception {
        clock = new MutableClock(Instant.parse("2024-03-01T12:00:00Z"));
        engine = EngineFixtures.startedEngine(EngineFixtures.testConfig().build(), clock);
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("help lists commands by category")
    void helpIndex() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        client.command("help");
        String output = client.takeOutput();
        assertTrue(output.contains("Account:"));
        assertTrue(output.contains("Movement:"));
        assertTrue(output.contains("north (n)"));
        assertTrue(output.contains("tell (whisper, t)"));
    }

    @Test
    @DisplayName("help on one command shows usage and aliases")
    void helpTopic() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        client.command("help whisper");
        String output = client.takeOutput();
        assertTrue(output.contains("tell <player> <message> - Send a private message to another player"));
        assertTrue(output.contains("Aliases: whisper, t"));
        client.command("help juggle");
        assertTrue(client.takeOutput().contains("No help available for 'juggle'."));
    }

    @Test
    @DisplayName("who lists playing characters")
    void who() throws Exception {
        ScriptedClient alice = new ScriptedClient(engine);
        ScriptedClient bob = new ScriptedClient(engine);
        EngineFixtures.playing(engine, alice, "alice", "Alyx");
        EngineFixtures.playing(engine, bob, "bob", "Bast");
        ScriptedClient watcher = new ScriptedClient(engine);

        watcher.command("who");
        String output = watcher.takeOutput();
        assertTrue(output.contains("Alyx - Test Start"));
        assertTrue(output.contains("Bast - Test Start"));
        assertTrue(output.contains("2 players online."));
        assertTrue(output.indexOf("Alyx") < output.indexOf("Bast"));
    }

    @Test
    @DisplayName("score shows attributes with background bonuses")
    void score() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        PlayerCharacter ch = EngineFixtures.playing(engine, client, "alice", "Alyx");
        client.command("sc");
        String output = client.takeOutput();
        assertTrue(output.contains("=== Alyx ==="));
        assertTrue(output.contains("Background: Commoner"));
        assertTrue(output.contains("HP: " + ch.getCurrentHp() + "/" + ch.getMaxHp()));
        assertTrue(output.contains("Strength:     11 (+0)  [+1 background]"));
        assertTrue(output.contains("Dexterity:    10 (+0)"));
    }

    @Test
    @DisplayName("time reports server time and uptime")
    void time() throws Exception {
        clock.advance(Duration.ofMinutes(90));
        ScriptedClient client = new ScriptedClient(engine);
        client.command("time");
        String output = client.takeOutput();
        assertTrue(output.contains("Server time: 2024-03-01 13:30:00 UTC"));
        assertTrue(output.contains("Uptime: 1h 30m"));
    }

    @Test
    @DisplayName("save writes the character's state")
    void save() throws Exception {
        ScriptedClient client = new ScriptedClient(engine);
        PlayerCharacter ch = EngineFixtures.playing(engine, client, "alice", "Alyx");
        client.command("north");
        client.command("save");
        assertTrue(client.takeOutput().contains("Your character has been saved."));
        assertEquals("test_north", engine.getCharacterDao().findById(ch.getId()).orElseThrow().getCurrentRoomId());
    }

    @Test
    @DisplayName("formatDuration picks the largest units")
    void formatDuration() {
        assertEquals("0m 42s", InformationCommandHandler.formatDuration(Duration.ofSeconds(42)));
        assertEquals("2h 5m", InformationCommandHandler.formatDuration(Duration.ofMinutes(125)));
        assertEquals("3d 1h 0m", InformationCommandHandler.formatDuration(Duration.ofHours(73)));
    }
}
