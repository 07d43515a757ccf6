package com.example.waystone.net;

import com.example.waystone.engine.GameEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-client loop: greets the player, then reads lines and hands each one
 * to the engine until the connection ends.
 */
public class ClientHandler implements Runnable {
    private static final Logger logger = LoggerFactory.getLogger(ClientHandler.class);

    private final TelnetConnection connection;
    private final GameEngine engine;
    private final Runnable onFinish;

    /**
     * @param onFinish run once after the session has been torn down
     */
    public ClientHandler(TelnetConnection connection, GameEngine engine, Runnable onFinish) {
        this.connection = connection;
        this.engine = engine;
        this.onFinish = onFinish;
    }

    @Override
    public void run() {
        Session session = engine.openSession(connection);
        logger.info("Client handler started for {} (session {})", connection.getRemoteAddress(), session.getId());
        try {
            connection.negotiateServerEcho();
            sendWelcome();
            while (!connection.isClosed()) {
                connection.send(prompt(session));
                String line = connection.readLine();
                if (line.isEmpty()) continue;
                engine.processCommand(session, line);
            }
        } catch (ConnectionException e) {
            logger.info("Connection {} ended: {}", connection.getId(), e.getMessage());
        } catch (RuntimeException e) {
            logger.error("Client handler for {} failed: {}", connection.getRemoteAddress(), e.getMessage(), e);
        } finally {
            engine.disconnect(session);
            onFinish.run();
            logger.info("Client handler ended for {} (session {})", connection.getRemoteAddress(), session.getId());
        }
    }

    private void sendWelcome() {
        connection.sendLine(Ansi.WELCOME_BANNER);
        connection.sendLine(Ansi.colorize("Type 'help' for a list of commands.\n", "DIM"));
        connection.sendLine("To get started:\n"
                + "  " + Ansi.colorize("register <username> <password> <email>", "YELLOW") + " - Create a new account\n"
                + "  " + Ansi.colorize("login <username> <password>", "YELLOW") + " - Log into existing account\n");
    }

    static String prompt(Session session) {
        switch (session.getState()) {
            case PLAYING:
                return Ansi.colorize("> ", "GREEN");
            case AUTHENTICATING:
                if (session.getUserId() != null) {
                    return Ansi.colorize("(Character Select) > ", "CYAN");
                }
                return Ansi.colorize("(Login) > ", "YELLOW");
            default:
                return Ansi.colorize("(Login) > ", "YELLOW");
        }
    }
}
