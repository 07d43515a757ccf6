package com.example.waystone.net.commands;

import com.example.waystone.EngineFixtures;
import com.example.waystone.ScriptedClient;
import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Stance;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PositionCommandHandler Tests")
public class PositionCommandHandlerTest {

    private GameEngine engine;
    private ScriptedClient alice;
    private ScriptedClient bob;
    private PlayerCharacter alyx;

    @BeforeEach
    void setUp() throws Exception {
        engine = EngineFixtures.startedEngine();
        alice = new ScriptedClient(engine);
        bob = new ScriptedClient(engine);
        alyx = EngineFixtures.playing(engine, alice, "alice", "Alyx");
        EngineFixtures.playing(engine, bob, "bob", "Bast");
        alice.takeOutput();
    }

    @AfterEach
    void tearDown() {
        engine.stop();
    }

    @Test
    @DisplayName("rest, sleep and stand change stance and tell the room")
    void stanceCycle() throws Exception {
        alice.command("rest");
        assertEquals(Stance.RESTING, alyx.getStance());
        assertTrue(alice.takeOutput().contains("You sit down and rest."));
        assertTrue(bob.takeOutput().contains("Alyx sits down and rests."));

        alice.command("sleep");
        assertEquals(Stance.SLEEPING, alyx.getStance());
        assertTrue(bob.takeOutput().contains("Alyx lies down and goes to sleep."));

        alice.command("wake");
        assertEquals(Stance.STANDING, alyx.getStance());
        assertTrue(alice.takeOutput().contains("You wake and stand up."));
    }

    @Test
    @DisplayName("repeating the current stance says so")
    void alreadyInStance() throws Exception {
        alice.command("stand");
        assertTrue(alice.takeOutput().contains("You are already standing."));
        alice.command("sit");
        alice.takeOutput();
        alice.command("rest");
        assertTrue(alice.takeOutput().contains("You are already resting."));
    }
}
