package com.example.waystone.engine;

import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Room;
import com.example.waystone.net.Ansi;
import com.example.waystone.net.CommandRegistry;
import com.example.waystone.net.ConnectionException;
import com.example.waystone.net.Session;
import com.example.waystone.net.SessionManager;
import com.example.waystone.net.SessionState;
import com.example.waystone.net.TelnetConnection;
import com.example.waystone.net.commands.AuthCommandHandler;
import com.example.waystone.net.commands.CharacterCommandHandler;
import com.example.waystone.net.commands.CommandDispatcher;
import com.example.waystone.net.commands.CommunicationCommandHandler;
import com.example.waystone.net.commands.InformationCommandHandler;
import com.example.waystone.net.commands.MovementCommandHandler;
import com.example.waystone.net.commands.PositionCommandHandler;
import com.example.waystone.persistence.CharacterDAO;
import com.example.waystone.persistence.DataAccessException;
import com.example.waystone.persistence.Database;
import com.example.waystone.persistence.UserDAO;
import com.example.waystone.persistence.WorldLoadException;
import com.example.waystone.persistence.WorldLoader;
import com.example.waystone.util.RegenerationService;
import com.example.waystone.util.ServerConfig;
import com.example.waystone.util.TickService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Owns the shared game state: world, sessions, commands, online characters
 * and the tick loop.
 *
 * Each connection thread drives its own session through
 * {@link #processCommand}. Messages to other players go through a
 * per-recipient {@link OutboundQueue} drained on the delivery executor, so a
 * slow recipient never holds up the sender or anyone else. A recipient that
 * falls {@link #MAX_PENDING_DELIVERIES} lines behind is disconnected.
 */
public class GameEngine {
    private static final Logger logger = LoggerFactory.getLogger(GameEngine.class);

    public static final String TICK_SESSION_CLEANUP = "session-cleanup";
    public static final String TICK_AUTOSAVE = "autosave";

    static final int MAX_PENDING_DELIVERIES = 256;
    static final long SHUTDOWN_FLUSH_MILLIS = 2000;

    private final ServerConfig config;
    private final Clock clock;
    private final SessionManager sessionManager;
    private final CommandRegistry commandRegistry = new CommandRegistry();
    private final CommandDispatcher dispatcher;
    private final TickService tickService = new TickService();
    private final Executor deliveryExecutor;
    private final ExecutorService ownedExecutor;

    // character id -> session playing it; putIfAbsent keeps one session per character
    private final Map<String, Session> characterSessions = new ConcurrentHashMap<>();
    private final Map<String, PlayerCharacter> onlineCharacters = new ConcurrentHashMap<>();
    private final Map<UUID, OutboundQueue> outbound = new ConcurrentHashMap<>();

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    private volatile World world;
    private volatile Database database;
    private volatile UserDAO userDao;
    private volatile CharacterDAO characterDao;
    private volatile Instant startedAt;

    public GameEngine(ServerConfig config) {
        this(config, Clock.systemUTC(), null);
    }

    /**
     * @param deliveryExecutor runs message deliveries to other players; when
     *        null the engine creates and owns a pool of daemon delivery threads
     */
    public GameEngine(ServerConfig config, Clock clock, Executor deliveryExecutor) {
        this.config = config;
        this.clock = clock;
        this.sessionManager = new SessionManager(clock);
        this.dispatcher = new CommandDispatcher(commandRegistry, this);
        if (deliveryExecutor == null) {
            AtomicInteger threadCount = new AtomicInteger();
            this.ownedExecutor = Executors.newCachedThreadPool(r -> {
                Thread t = new Thread(r, "waystone-delivery-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
            this.deliveryExecutor = ownedExecutor;
        } else {
            this.ownedExecutor = null;
            this.deliveryExecutor = deliveryExecutor;
        }
        sessionManager.addDestroyListener(this::releaseSession);
    }

    /**
     * Load the world, prepare the database, register commands and start ticking.
     *
     * @throws WorldLoadException if room content is missing or invalid
     */
    public void start() throws WorldLoadException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Engine already started");
        }
        logger.info("Starting game engine with {}", config);

        world = new World(WorldLoader.loadFromResource(config.getWorldResource()));
        if (world.getRoom(config.getStartingRoomId()).isEmpty()) {
            throw new WorldLoadException("Starting room '" + config.getStartingRoomId() + "' does not exist");
        }

        database = new Database(config.getDbUrl(), config.getDbUser(), config.getDbPassword());
        database.ensureSchema();
        userDao = new UserDAO(database);
        characterDao = new CharacterDAO(database);

        registerCommands();

        tickService.register(TICK_SESSION_CLEANUP, this::cleanupSessions);
        new RegenerationService(this::getOnlineCharacters).initialize(tickService);
        tickService.register(TICK_AUTOSAVE, this::autosave);
        tickService.start(config.getTickIntervalSeconds() * 1000L);

        startedAt = clock.instant();
        logger.info("Game engine started: {} rooms, {} commands", world.size(), commandRegistry.getAllCommands().size());
    }

    private void registerCommands() {
        commandRegistry.register(new AuthCommandHandler());
        commandRegistry.register(new CharacterCommandHandler());
        commandRegistry.register(new MovementCommandHandler());
        commandRegistry.register(new CommunicationCommandHandler());
        commandRegistry.register(new InformationCommandHandler());
        commandRegistry.register(new PositionCommandHandler());
    }

    /**
     * Tell everyone, end every session and stop background work. Safe to
     * call twice and after a failed start.
     */
    public void stop() {
        if (!stopped.compareAndSet(false, true)) return;
        logger.info("Stopping game engine, {} session(s) live", sessionManager.getSessionCount());
        List<Session> sessions = sessionManager.getAllSessions();
        String notice = Ansi.colorize("Server shutting down...", "YELLOW");
        for (Session session : sessions) {
            deliver(session, notice);
        }
        long deadline = System.currentTimeMillis() + SHUTDOWN_FLUSH_MILLIS;
        for (Session session : sessions) {
            OutboundQueue queue = outbound.get(session.getId());
            if (queue != null && !queue.awaitIdle(Math.max(0, deadline - System.currentTimeMillis()))) {
                logger.warn("Shutdown notice to session {} not flushed in time", session.getId());
            }
        }
        for (Session session : sessions) {
            sessionManager.destroySession(session.getId());
        }
        tickService.shutdown();
        if (ownedExecutor != null) {
            ownedExecutor.shutdown();
        }
        logger.info("Game engine stopped");
    }

    // ---- connections ----

    public Session openSession(TelnetConnection connection) {
        return sessionManager.createSession(connection);
    }

    /**
     * End a session after its connection loop finished, whatever the reason.
     */
    public void disconnect(Session session) {
        if (!sessionManager.destroySession(session.getId())) {
            session.getConnection().close();
        }
    }

    // runs for every destroyed session, including idle-sweep victims
    private void releaseSession(Session session) {
        leaveWorld(session);
        outbound.remove(session.getId());
        session.getConnection().close();
    }

    /**
     * Parse and execute one line of input for the session.
     *
     * @throws ConnectionException if the connection failed during an interactive command
     */
    public void processCommand(Session session, String rawLine) throws ConnectionException {
        dispatcher.dispatch(session, rawLine);
    }

    // ---- characters in play ----

    /**
     * Put a character into the world for this session.
     *
     * @return false if another session is already playing the character, or
     *         this session was disconnected meanwhile
     */
    public boolean enterWorld(Session session, PlayerCharacter character) {
        Session existing = characterSessions.putIfAbsent(character.getId(), session);
        if (existing != null && existing != session) {
            return false;
        }
        try {
            session.setState(SessionState.PLAYING);
        } catch (IllegalStateException e) {
            characterSessions.remove(character.getId(), session);
            logger.info("Session {} ended before {} could enter the world", session.getId(), character.getName());
            return false;
        }
        onlineCharacters.put(character.getId(), character);

        Room room = world.getRoom(character.getCurrentRoomId()).orElse(null);
        if (room == null) {
            logger.warn("Character {} was in unknown room '{}', moving to {}", character.getName(),
                    character.getCurrentRoomId(), config.getStartingRoomId());
            room = world.getRoom(config.getStartingRoomId()).orElseThrow();
            character.setCurrentRoomId(room.getId());
        }
        world.placeCharacter(character.getId(), room.getId());
        session.setCharacter(character.getId());
        if (session.getState() == SessionState.DISCONNECTED) {
            // destroyed while entering; its release ran before the character was bound
            leaveWorld(session);
            return false;
        }
        broadcastToRoom(room.getId(), Ansi.colorize(character.getName() + " has entered the world.", "CYAN"),
                session.getId());
        logger.info("Character {} ({}) entered the world in {}", character.getName(), character.getId(), room.getId());
        return true;
    }

    /**
     * Take the session's character out of the world and save it. Does
     * nothing if the session has no character.
     */
    public void leaveWorld(Session session) {
        String characterId = session.getCharacterId();
        if (characterId == null) return;
        session.setCharacter(null);
        characterSessions.remove(characterId, session);
        PlayerCharacter character = onlineCharacters.remove(characterId);
        Optional<Room> room = world == null ? Optional.empty() : world.removeCharacter(characterId);
        if (character == null) return;

        room.ifPresent(r -> broadcastToRoom(r.getId(),
                Ansi.colorize(character.getName() + " has left the world.", "CYAN"), session.getId()));
        try {
            saveCharacter(character);
        } catch (DataAccessException e) {
            logger.error("Could not save {} on leaving: {}", character.getName(), e.getMessage(), e);
        }
        logger.info("Character {} ({}) left the world", character.getName(), characterId);
    }

    public Optional<PlayerCharacter> getOnlineCharacter(String characterId) {
        if (characterId == null) return Optional.empty();
        return Optional.ofNullable(onlineCharacters.get(characterId));
    }

    /** Case-insensitive lookup among characters in play. */
    public Optional<PlayerCharacter> findOnlineCharacterByName(String name) {
        for (PlayerCharacter ch : onlineCharacters.values()) {
            if (ch.getName().equalsIgnoreCase(name)) return Optional.of(ch);
        }
        return Optional.empty();
    }

    public Collection<PlayerCharacter> getOnlineCharacters() {
        return new ArrayList<>(onlineCharacters.values());
    }

    public Optional<Session> getSessionForCharacter(String characterId) {
        if (characterId == null) return Optional.empty();
        return Optional.ofNullable(characterSessions.get(characterId));
    }

    public void saveCharacter(PlayerCharacter character) {
        if (characterDao == null) return;
        characterDao.saveState(character);
    }

    // ---- messaging ----

    /**
     * Send a message to everyone in a room except one session.
     */
    public void broadcastToRoom(String roomId, String message, UUID excludeSessionId) {
        if (world == null) return;
        for (String characterId : world.getOccupants(roomId)) {
            Session target = characterSessions.get(characterId);
            if (target == null || target.getId().equals(excludeSessionId)) continue;
            deliver(target, message);
        }
    }

    /**
     * @return false if the character is not in play
     */
    public boolean sendToCharacter(String characterId, String message) {
        Session target = characterSessions.get(characterId);
        if (target == null) return false;
        deliver(target, message);
        return true;
    }

    /**
     * Send a message to every playing character except one session.
     */
    public void broadcastAll(String message, UUID excludeSessionId) {
        for (Session target : characterSessions.values()) {
            if (target.getId().equals(excludeSessionId)) continue;
            deliver(target, message);
        }
    }

    private void deliver(Session target, String message) {
        TelnetConnection conn = target.getConnection();
        if (conn.isClosed()) return;
        OutboundQueue queue = outbound.computeIfAbsent(target.getId(),
                id -> new OutboundQueue(conn, deliveryExecutor, MAX_PENDING_DELIVERIES));
        try {
            if (!queue.offer(message)) {
                logger.warn("Session {} from {} is {} lines behind, disconnecting", target.getId(),
                        conn.getRemoteAddress(), MAX_PENDING_DELIVERIES);
                conn.close();
            }
        } catch (RejectedExecutionException e) {
            logger.debug("Delivery to session {} dropped, executor stopped", target.getId());
        }
    }

    // ---- tick ----

    /** Run one tick immediately. */
    public void runTick() {
        tickService.runTick();
    }

    public TickService getTickService() {
        return tickService;
    }

    void cleanupSessions() {
        sessionManager.cleanupExpired(config.getSessionTimeoutMinutes());
    }

    void autosave() {
        int saved = 0;
        for (PlayerCharacter ch : getOnlineCharacters()) {
            try {
                saveCharacter(ch);
                saved++;
            } catch (DataAccessException e) {
                logger.error("Autosave failed for {}: {}", ch.getName(), e.getMessage(), e);
            }
        }
        logger.debug("Autosaved {} character(s)", saved);
    }

    // ---- accessors ----

    public ServerConfig getConfig() { return config; }
    public Clock getClock() { return clock; }
    public World getWorld() { return world; }
    public SessionManager getSessionManager() { return sessionManager; }
    public CommandRegistry getCommandRegistry() { return commandRegistry; }
    public UserDAO getUserDao() { return userDao; }
    public CharacterDAO getCharacterDao() { return characterDao; }
    public Instant getStartedAt() { return startedAt; }

    /** True between a successful {@link #start()} and {@link #stop()}. */
    public boolean isRunning() {
        return startedAt != null && !stopped.get();
    }

    public List<Session> getPlayingSessions() {
        return new ArrayList<>(characterSessions.values());
    }
}
