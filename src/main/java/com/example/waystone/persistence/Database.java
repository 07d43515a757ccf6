package com.example.waystone.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * JDBC access to the H2 store. Each unit of work gets its own connection and
 * transaction.
 */
public class Database {
    private static final Logger logger = LoggerFactory.getLogger(Database.class);

    /**
     * Work done inside one transaction.
     */
    @FunctionalInterface
    public interface SqlWork<T> {
        T apply(Connection c) throws SQLException;
    }

    private final String url;
    private final String user;
    private final String password;

    public Database(String url, String user, String password) {
        this.url = url;
        this.user = user;
        this.password = password;
    }

    public String getUrl() {
        return url;
    }

    /** SQLSTATE 23505: a unique index or primary key already holds the value. */
    static boolean isUniqueViolation(SQLException e) {
        return "23505".equals(e.getSQLState());
    }

    /**
     * Run work in a transaction: commit when it returns, roll back when it throws.
     *
     * @throws DataAccessException wrapping any {@link SQLException}
     */
    public <T> T inTransaction(SqlWork<T> work) {
        try (Connection c = DriverManager.getConnection(url, user, password)) {
            c.setAutoCommit(false);
            try {
                T result = work.apply(c);
                c.commit();
                return result;
            } catch (SQLException | RuntimeException e) {
                rollback(c, e);
                throw e;
            }
        } catch (SQLException e) {
            throw new DataAccessException("Database operation failed: " + e.getMessage(), e);
        }
    }

    /**
     * Create the tables the server needs if they do not exist yet.
     */
    public void ensureSchema() {
        inTransaction(c -> {
            try (Statement s = c.createStatement()) {
                s.execute("CREATE TABLE IF NOT EXISTS users (" +
                        "id VARCHAR(36) PRIMARY KEY, " +
                        "username VARCHAR(20) NOT NULL, " +
                        "username_key VARCHAR(20) UNIQUE NOT NULL, " +
                        "email VARCHAR(255) UNIQUE NOT NULL, " +
                        "password_hash VARCHAR(512) NOT NULL, " +
                        "password_salt VARCHAR(512) NOT NULL, " +
                        "is_admin BOOLEAN DEFAULT FALSE, " +
                        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");
                s.execute("CREATE TABLE IF NOT EXISTS characters (" +
                        "id VARCHAR(36) PRIMARY KEY, " +
                        "user_id VARCHAR(36) NOT NULL, " +
                        "name VARCHAR(30) NOT NULL, " +
                        "name_key VARCHAR(30) UNIQUE NOT NULL, " +
                        "background VARCHAR(20) NOT NULL, " +
                        "str INT DEFAULT 10, " +
                        "dex INT DEFAULT 10, " +
                        "con INT DEFAULT 10, " +
                        "intel INT DEFAULT 10, " +
                        "wis INT DEFAULT 10, " +
                        "cha INT DEFAULT 10, " +
                        "current_room VARCHAR(100), " +
                        "level INT DEFAULT 1, " +
                        "experience INT DEFAULT 0, " +
                        "hp_cur INT DEFAULT 11, " +
                        "hp_max INT DEFAULT 11, " +
                        "stance VARCHAR(16) DEFAULT 'STANDING', " +
                        "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP, " +
                        "FOREIGN KEY (user_id) REFERENCES users(id) ON DELETE CASCADE)");
            }
            return null;
        });
        logger.info("Database schema ready at {}", url);
    }

    private static void rollback(Connection c, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
            logger.warn("Rollback failed: {}", e.getMessage());
        }
    }
}
