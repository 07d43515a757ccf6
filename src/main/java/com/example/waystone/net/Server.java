package com.example.waystone.net;

import com.example.waystone.engine.GameEngine;
import com.example.waystone.persistence.WorldLoadException;
import com.example.waystone.util.LogFileCleaner;
import com.example.waystone.util.ServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telnet MUD server.
 * Listens on the configured port and runs a ClientHandler per connection.
 */
public class Server {
    private static final Logger logger = LoggerFactory.getLogger(Server.class);

    public static final String TOO_MANY_CONNECTIONS = "Too many connections from your IP address.";

    private final ServerConfig config;
    private final GameEngine engine;
    private final ConnectionLimiter limiter;
    private final AtomicInteger threadCounter = new AtomicInteger();
    private final ExecutorService pool = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, "waystone-client-" + threadCounter.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private final AtomicBoolean stopped = new AtomicBoolean(false);
    private volatile ServerSocket serverSocket;

    public Server(ServerConfig config) {
        this(config, new GameEngine(config));
    }

    public Server(ServerConfig config, GameEngine engine) {
        this.config = config;
        this.engine = engine;
        this.limiter = new ConnectionLimiter(config.getMaxConnectionsPerIp());
    }

    /**
     * Start the engine and bind the listening socket.
     *
     * @throws WorldLoadException if the world cannot be loaded
     * @throws IOException if the port cannot be bound
     */
    public void start() throws WorldLoadException, IOException {
        engine.start();
        ServerSocket socket = new ServerSocket();
        socket.setReuseAddress(true);
        socket.bind(new InetSocketAddress(InetAddress.getByName(config.getHost()), config.getPort()));
        serverSocket = socket;
        logger.info("Waystone server listening on {}:{}", config.getHost(), socket.getLocalPort());
    }

    /**
     * Accept clients until {@link #stop()} is called.
     */
    public void serve() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("Server not started");
        }
        while (!stopped.get()) {
            Socket client;
            try {
                client = socket.accept();
            } catch (IOException e) {
                if (stopped.get()) break;
                logger.warn("Accept failed: {}", e.getMessage());
                continue;
            }
            accept(client);
        }
        logger.info("Accept loop ended");
    }

    private void accept(Socket client) {
        String address = client.getInetAddress() != null ? client.getInetAddress().getHostAddress() : "unknown";
        if (!limiter.tryAcquire(address)) {
            logger.warn("Rejected connection from {}: limit of {} reached", address, limiter.getMaxPerAddress());
            reject(client);
            return;
        }
        logger.info("Accepted connection from {}", client.getRemoteSocketAddress());
        pool.submit(() -> {
            TelnetConnection connection;
            try {
                connection = new TelnetConnection(client, config.getReadTimeoutSeconds() * 1000, config.getMaxLineLength());
            } catch (IOException e) {
                logger.warn("Could not set up connection from {}: {}", address, e.getMessage());
                closeQuietly(client);
                limiter.release(address);
                return;
            }
            new ClientHandler(connection, engine, () -> limiter.release(address)).run();
        });
    }

    private static void reject(Socket client) {
        try (Socket s = client) {
            OutputStream out = s.getOutputStream();
            out.write((TOO_MANY_CONNECTIONS + "\r\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        } catch (IOException e) {
            logger.debug("Error rejecting connection: {}", e.getMessage());
        }
    }

    private static void closeQuietly(Socket s) {
        try {
            s.close();
        } catch (IOException e) {
            logger.debug("Error closing socket: {}", e.getMessage());
        }
    }

    /**
     * Stop accepting, end every session and release threads. Safe to call twice.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        logger.info("Server stopping");
        ServerSocket socket = serverSocket;
        if (socket != null) {
            try {
                socket.close();
            } catch (IOException e) {
                logger.debug("Error closing server socket: {}", e.getMessage());
            }
        }
        engine.stop();
        pool.shutdownNow();
    }

    public int getLocalPort() {
        ServerSocket socket = serverSocket;
        return socket == null ? -1 : socket.getLocalPort();
    }

    public GameEngine getEngine() {
        return engine;
    }

    public static void main(String[] args) {
        LogFileCleaner.cleanLogs();
        ServerConfig config = ServerConfig.load();
        Server server = new Server(config);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "waystone-shutdown"));
        try {
            server.start();
        } catch (WorldLoadException | IOException e) {
            logger.error("Failed to start server: {}", e.getMessage(), e);
            server.stop();
            System.exit(1);
        }
        server.serve();
    }
}
