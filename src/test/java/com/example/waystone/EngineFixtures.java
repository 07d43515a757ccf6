package com.example.waystone;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.util.ServerConfig;

import java.time.Clock;
import java.util.Map;
import java.util.UUID;

/**
 * Engines wired for tests: the small test world, a private in-memory
 * database, synchronous message delivery and a tick that never fires on
 * its own.
 */
public final class EngineFixtures {
    public static final String START_ROOM = "test_start";

    private EngineFixtures() {
    }

    public static ServerConfig.Builder testConfig() {
        return ServerConfig.builder()
                .host("127.0.0.1")
                .port(0)
                .dbUrl("jdbc:h2:mem:test-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1")
                .worldResource("/data/test-rooms.yaml")
                .startingRoomId(START_ROOM)
                .tickIntervalSeconds(3600);
    }

    public static GameEngine startedEngine() throws Exception {
        return startedEngine(testConfig().build(), Clock.systemUTC());
    }

    public static GameEngine startedEngine(ServerConfig config, Clock clock) throws Exception {
        GameEngine engine = new GameEngine(config, clock, Runnable::run);
        engine.start();
        return engine;
    }

    /**
     * Register and log in an account, then create a character and put it
     * in the world.
     */
    public static PlayerCharacter playing(GameEngine engine, ScriptedClient client, String username,
                                          String characterName) throws Exception {
        loggedIn(engine, client, username);
        engine.getCharacterDao().createCharacter(client.getSession().getUserId(), characterName,
                CharacterBackground.COMMONER, Map.of(), START_ROOM).orElseThrow();
        client.command("play " + characterName);
        client.takeOutput();
        return engine.getOnlineCharacter(client.getSession().getCharacterId()).orElseThrow();
    }

    public static void loggedIn(GameEngine engine, ScriptedClient client, String username) throws Exception {
        client.command("register " + username + " secret123 " + username + "@example.com");
        client.command("login " + username + " secret123");
        client.takeOutput();
    }
}
