package com.example.waystone.persistence;

import com.example.waystone.model.UserAccount;
import com.example.waystone.util.PasswordUtil;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Account storage and password checks.
 */
public class UserDAO {

    public enum RegistrationResult {
        CREATED,
        USERNAME_TAKEN,
        EMAIL_TAKEN
    }

    private static final String COLUMNS = "id, username, email, password_hash, password_salt, is_admin, created_at";

    private final Database db;

    public UserDAO(Database db) {
        this.db = db;
    }

    /**
     * Create an account. Username (ignoring case) and email must both be unused.
     */
    public RegistrationResult register(String username, String email, char[] password) {
        PasswordUtil.Credentials creds = PasswordUtil.createCredentials(password);
        return db.inTransaction(c -> {
            if (exists(c, "username_key", usernameKey(username))) return RegistrationResult.USERNAME_TAKEN;
            if (exists(c, "email", email)) return RegistrationResult.EMAIL_TAKEN;
            String sql = "INSERT INTO users (id, username, username_key, email, password_hash, password_salt, "
                    + "is_admin, created_at) VALUES (?, ?, ?, ?, ?, ?, FALSE, ?)";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, username);
                ps.setString(3, usernameKey(username));
                ps.setString(4, email);
                ps.setString(5, creds.getHash());
                ps.setString(6, creds.getSalt());
                ps.setTimestamp(7, Timestamp.from(Instant.now()));
                ps.executeUpdate();
            } catch (SQLException e) {
                // lost a race with a concurrent registration; report which value it claimed
                if (!Database.isUniqueViolation(e)) throw e;
                return exists(c, "username_key", usernameKey(username))
                        ? RegistrationResult.USERNAME_TAKEN : RegistrationResult.EMAIL_TAKEN;
            }
            return RegistrationResult.CREATED;
        });
    }

    /**
     * @return the account if the username exists and the password matches
     */
    public Optional<UserAccount> authenticate(String username, char[] password) {
        Optional<UserAccount> user = findByUsername(username);
        if (user.isEmpty()) return Optional.empty();
        UserAccount u = user.get();
        return PasswordUtil.verify(password, u.getPasswordSalt(), u.getPasswordHash()) ? user : Optional.empty();
    }

    /** Case-insensitive. */
    public Optional<UserAccount> findByUsername(String username) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE username_key = ?", usernameKey(username));
    }

    public Optional<UserAccount> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM users WHERE id = ?", id);
    }

    private Optional<UserAccount> findOne(String sql, String param) {
        return db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, param);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<UserAccount>empty();
                }
            }
        });
    }

    private static boolean exists(Connection c, String column, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM users WHERE " + column + " = ?")) {
            ps.setString(1, value);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String usernameKey(String username) {
        return username.toLowerCase(Locale.ROOT);
    }

    private static UserAccount map(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        return new UserAccount(
                rs.getString("id"),
                rs.getString("username"),
                rs.getString("email"),
                rs.getString("password_hash"),
                rs.getString("password_salt"),
                rs.getBoolean("is_admin"),
                created == null ? null : created.toInstant());
    }
}
