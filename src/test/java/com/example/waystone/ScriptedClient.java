package com.example.waystone;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.Session;
import com.example.waystone.net.TelnetConnection;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * An in-memory player: answers prompts from a fixed script and records
 * everything the server sends, with colors removed.
 */
public class ScriptedClient {
    private final ByteArrayOutputStream out;
    private final TelnetConnection connection;
    private final Session session;
    private final GameEngine engine;

    public ScriptedClient(GameEngine engine) {
        this(engine, "");
    }

    public ScriptedClient(GameEngine engine, String scriptedInput) {
        this(engine, scriptedInput, new ByteArrayOutputStream());
    }

    /** Record output into the given sink, which may block writes on purpose. */
    public ScriptedClient(GameEngine engine, String scriptedInput, ByteArrayOutputStream sink) {
        this.engine = engine;
        this.out = sink;
        this.connection = new TelnetConnection(
                new ByteArrayInputStream(scriptedInput.getBytes(StandardCharsets.UTF_8)), out, "127.0.0.1", 1024);
        this.session = engine.openSession(connection);
    }

    public void command(String line) throws Exception {
        engine.processCommand(session, line);
    }

    public Session getSession() {
        return session;
    }

    public TelnetConnection getConnection() {
        return connection;
    }

    public String output() {
        String raw = new String(out.toByteArray(), StandardCharsets.UTF_8);
        return Ansi.strip(raw).replace("\r\n", "\n");
    }

    /** Output since the last call, then forget it. */
    public String takeOutput() {
        String s = output();
        out.reset();
        return s;
    }

    /** Non-blank output lines since the last call. */
    public List<String> takeLines() {
        List<String> lines = new ArrayList<>();
        for (String line : Arrays.asList(takeOutput().split("\n"))) {
            if (!line.isBlank()) lines.add(line);
        }
        return lines;
    }
}
