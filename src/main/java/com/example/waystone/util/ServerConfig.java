package com.example.waystone.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;
import java.util.Map;
import java.util.Properties;

/**
 * Server settings.
 *
 * Each key is resolved from the environment ({@code WAYSTONE_PORT}), then a
 * system property ({@code waystone.port}), then the classpath file
 * {@code /waystone.properties}, then the built-in default.
 */
public class ServerConfig {
    private static final Logger logger = LoggerFactory.getLogger(ServerConfig.class);

    public static final String DEFAULT_HOST = "0.0.0.0";
    public static final int DEFAULT_PORT = 4000;
    public static final String DEFAULT_DB_URL = "jdbc:h2:file:./data/waystone;DB_CLOSE_DELAY=-1";
    public static final String DEFAULT_WORLD_RESOURCE = "/data/rooms.yaml";
    public static final String DEFAULT_STARTING_ROOM = "university_main_gates";
    public static final int DEFAULT_SESSION_TIMEOUT_MINUTES = 60;
    public static final int DEFAULT_MAX_CONNECTIONS_PER_IP = 5;
    public static final int DEFAULT_READ_TIMEOUT_SECONDS = 300;
    public static final int DEFAULT_TICK_INTERVAL_SECONDS = 30;
    public static final int DEFAULT_MAX_LINE_LENGTH = 1024;

    private final String host;
    private final int port;
    private final String dbUrl;
    private final String dbUser;
    private final String dbPassword;
    private final String worldResource;
    private final String startingRoomId;
    private final int sessionTimeoutMinutes;
    private final int maxConnectionsPerIp;
    private final int readTimeoutSeconds;
    private final int tickIntervalSeconds;
    private final int maxLineLength;

    private ServerConfig(Builder b) {
        this.host = b.host;
        this.port = b.port;
        this.dbUrl = b.dbUrl;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword;
        this.worldResource = b.worldResource;
        this.startingRoomId = b.startingRoomId;
        this.sessionTimeoutMinutes = b.sessionTimeoutMinutes;
        this.maxConnectionsPerIp = b.maxConnectionsPerIp;
        this.readTimeoutSeconds = b.readTimeoutSeconds;
        this.tickIntervalSeconds = b.tickIntervalSeconds;
        this.maxLineLength = b.maxLineLength;
    }

    /**
     * Load settings from the process environment, system properties and
     * {@code /waystone.properties}.
     */
    public static ServerConfig load() {
        Properties file = new Properties();
        try (InputStream in = ServerConfig.class.getResourceAsStream("/waystone.properties")) {
            if (in != null) file.load(in);
        } catch (IOException e) {
            logger.warn("Could not read waystone.properties: {}", e.getMessage());
        }
        return fromSources(System.getenv(), System.getProperties(), file);
    }

    static ServerConfig fromSources(Map<String, String> env, Properties sysProps, Properties file) {
        Resolver r = new Resolver(env, sysProps, file);
        return builder()
                .host(r.string("host", DEFAULT_HOST))
                .port(r.integer("port", DEFAULT_PORT))
                .dbUrl(r.string("db.url", DEFAULT_DB_URL))
                .dbUser(r.string("db.user", "sa"))
                .dbPassword(r.string("db.password", ""))
                .worldResource(r.string("world.resource", DEFAULT_WORLD_RESOURCE))
                .startingRoomId(r.string("starting.room", DEFAULT_STARTING_ROOM))
                .sessionTimeoutMinutes(r.integer("session.timeout.minutes", DEFAULT_SESSION_TIMEOUT_MINUTES))
                .maxConnectionsPerIp(r.integer("max.connections.per.ip", DEFAULT_MAX_CONNECTIONS_PER_IP))
                .readTimeoutSeconds(r.integer("read.timeout.seconds", DEFAULT_READ_TIMEOUT_SECONDS))
                .tickIntervalSeconds(r.integer("tick.interval.seconds", DEFAULT_TICK_INTERVAL_SECONDS))
                .maxLineLength(r.integer("max.line.length", DEFAULT_MAX_LINE_LENGTH))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDbUrl() { return dbUrl; }
    public String getDbUser() { return dbUser; }
    public String getDbPassword() { return dbPassword; }
    public String getWorldResource() { return worldResource; }
    public String getStartingRoomId() { return startingRoomId; }
    public int getSessionTimeoutMinutes() { return sessionTimeoutMinutes; }
    public int getMaxConnectionsPerIp() { return maxConnectionsPerIp; }
    public int getReadTimeoutSeconds() { return readTimeoutSeconds; }
    public int getTickIntervalSeconds() { return tickIntervalSeconds; }
    public int getMaxLineLength() { return maxLineLength; }

    @Override
    public String toString() {
        return "ServerConfig{host=" + host + ", port=" + port + ", db=" + dbUrl
                + ", world=" + worldResource + ", sessionTimeout=" + sessionTimeoutMinutes + "m"
                + ", maxPerIp=" + maxConnectionsPerIp + ", readTimeout=" + readTimeoutSeconds + "s"
                + ", tick=" + tickIntervalSeconds + "s}";
    }

    private static class Resolver {
        private final Map<String, String> env;
        private final Properties sysProps;
        private final Properties file;

        Resolver(Map<String, String> env, Properties sysProps, Properties file) {
            this.env = env;
            this.sysProps = sysProps;
            this.file = file;
        }

        String string(String key, String def) {
            String envKey = "WAYSTONE_" + key.toUpperCase(Locale.ROOT).replace('.', '_');
            String v = env.get(envKey);
            if (v != null && !v.isEmpty()) return v;
            v = sysProps.getProperty("waystone." + key);
            if (v != null && !v.isEmpty()) return v;
            v = file.getProperty(key);
            if (v != null && !v.isEmpty()) return v.trim();
            return def;
        }

        int integer(String key, int def) {
            String v = string(key, null);
            if (v == null) return def;
            try {
                return Integer.parseInt(v.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid value '{}' for {}, using default {}", v, key, def);
                return def;
            }
        }
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private String dbUrl = DEFAULT_DB_URL;
        private String dbUser = "sa";
        private String dbPassword = "";
        private String worldResource = DEFAULT_WORLD_RESOURCE;
        private String startingRoomId = DEFAULT_STARTING_ROOM;
        private int sessionTimeoutMinutes = DEFAULT_SESSION_TIMEOUT_MINUTES;
        private int maxConnectionsPerIp = DEFAULT_MAX_CONNECTIONS_PER_IP;
        private int readTimeoutSeconds = DEFAULT_READ_TIMEOUT_SECONDS;
        private int tickIntervalSeconds = DEFAULT_TICK_INTERVAL_SECONDS;
        private int maxLineLength = DEFAULT_MAX_LINE_LENGTH;

        public Builder host(String host) { this.host = host; return this; }
        public Builder port(int port) { this.port = port; return this; }
        public Builder dbUrl(String dbUrl) { this.dbUrl = dbUrl; return this; }
        public Builder dbUser(String dbUser) { this.dbUser = dbUser; return this; }
        public Builder dbPassword(String dbPassword) { this.dbPassword = dbPassword; return this; }
        public Builder worldResource(String worldResource) { this.worldResource = worldResource; return this; }
        public Builder startingRoomId(String startingRoomId) { this.startingRoomId = startingRoomId; return this; }
        public Builder sessionTimeoutMinutes(int v) { this.sessionTimeoutMinutes = v; return this; }
        public Builder maxConnectionsPerIp(int v) { this.maxConnectionsPerIp = v; return this; }
        public Builder readTimeoutSeconds(int v) { this.readTimeoutSeconds = v; return this; }
        public Builder tickIntervalSeconds(int v) { this.tickIntervalSeconds = v; return this; }
        public Builder maxLineLength(int v) { this.maxLineLength = v; return this; }

        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
