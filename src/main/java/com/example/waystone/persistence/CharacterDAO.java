package com.example.waystone.persistence;

import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Stance;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Character storage.
 */
public class CharacterDAO {

    private static final String COLUMNS = "id, user_id, name, background, str, dex, con, intel, wis, cha, "
            + "current_room, level, experience, hp_cur, hp_max, stance, created_at";

    private final Database db;

    public CharacterDAO(Database db) {
        this.db = db;
    }

    /**
     * Create a level 1 character at full health. Names are unique ignoring
     * case; the lowercased {@code name_key} column carries the constraint.
     *
     * @param attributes attribute name (strength, dexterity, ...) to score;
     *                   missing attributes default to 10
     * @return the new character, or empty if the name is already taken
     */
    public Optional<PlayerCharacter> createCharacter(String userId, String name, CharacterBackground background,
                                                     Map<String, Integer> attributes, String startingRoomId) {
        int str = attributes.getOrDefault("strength", PlayerCharacter.BASE_ATTRIBUTE);
        int dex = attributes.getOrDefault("dexterity", PlayerCharacter.BASE_ATTRIBUTE);
        int con = attributes.getOrDefault("constitution", PlayerCharacter.BASE_ATTRIBUTE);
        int intel = attributes.getOrDefault("intelligence", PlayerCharacter.BASE_ATTRIBUTE);
        int wis = attributes.getOrDefault("wisdom", PlayerCharacter.BASE_ATTRIBUTE);
        int cha = attributes.getOrDefault("charisma", PlayerCharacter.BASE_ATTRIBUTE);
        int maxHp = PlayerCharacter.calculateMaxHp(con, 1);
        String id = UUID.randomUUID().toString();
        Instant now = Instant.now();

        return db.inTransaction(c -> {
            if (nameTaken(c, name)) return Optional.<PlayerCharacter>empty();
            String sql = "INSERT INTO characters (" + COLUMNS + ", name_key) "
                    + "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, 1, 0, ?, ?, ?, ?, ?)";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, id);
                ps.setString(2, userId);
                ps.setString(3, name);
                ps.setString(4, background.name());
                ps.setInt(5, str);
                ps.setInt(6, dex);
                ps.setInt(7, con);
                ps.setInt(8, intel);
                ps.setInt(9, wis);
                ps.setInt(10, cha);
                ps.setString(11, startingRoomId);
                ps.setInt(12, maxHp);
                ps.setInt(13, maxHp);
                ps.setString(14, Stance.STANDING.name());
                ps.setTimestamp(15, Timestamp.from(now));
                ps.setString(16, nameKey(name));
                ps.executeUpdate();
            } catch (SQLException e) {
                // a concurrent create claimed the name after our check
                if (Database.isUniqueViolation(e)) return Optional.<PlayerCharacter>empty();
                throw e;
            }
            return Optional.of(new PlayerCharacter(id, userId, name, background, str, dex, con, intel, wis, cha,
                    startingRoomId, 1, 0, maxHp, maxHp, Stance.STANDING, now));
        });
    }

    public boolean isNameTaken(String name) {
        return db.inTransaction(c -> nameTaken(c, name));
    }

    public Optional<PlayerCharacter> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM characters WHERE id = ?", id);
    }

    /** Case-insensitive lookup across all accounts. */
    public Optional<PlayerCharacter> findByName(String name) {
        return findOne("SELECT " + COLUMNS + " FROM characters WHERE name_key = ?", nameKey(name));
    }

    /** Case-insensitive lookup within one account. */
    public Optional<PlayerCharacter> findByUserAndName(String userId, String name) {
        return db.inTransaction(c -> {
            String sql = "SELECT " + COLUMNS + " FROM characters WHERE user_id = ? AND name_key = ?";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, userId);
                ps.setString(2, nameKey(name));
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<PlayerCharacter>empty();
                }
            }
        });
    }

    public List<PlayerCharacter> listByUser(String userId) {
        return db.inTransaction(c -> {
            List<PlayerCharacter> result = new ArrayList<>();
            String sql = "SELECT " + COLUMNS + " FROM characters WHERE user_id = ? ORDER BY created_at, name";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, userId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) result.add(map(rs));
                }
            }
            return result;
        });
    }

    public boolean delete(String id) {
        return db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM characters WHERE id = ?")) {
                ps.setString(1, id);
                return ps.executeUpdate() > 0;
            }
        });
    }

    /**
     * Write back the fields that change during play.
     */
    public boolean saveState(PlayerCharacter ch) {
        return db.inTransaction(c -> {
            String sql = "UPDATE characters SET current_room = ?, hp_cur = ?, stance = ? WHERE id = ?";
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, ch.getCurrentRoomId());
                ps.setInt(2, ch.getCurrentHp());
                ps.setString(3, ch.getStance().name());
                ps.setString(4, ch.getId());
                return ps.executeUpdate() > 0;
            }
        });
    }

    private Optional<PlayerCharacter> findOne(String sql, String param) {
        return db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement(sql)) {
                ps.setString(1, param);
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(map(rs)) : Optional.<PlayerCharacter>empty();
                }
            }
        });
    }

    private static boolean nameTaken(Connection c, String name) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM characters WHERE name_key = ?")) {
            ps.setString(1, nameKey(name));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private static String nameKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static PlayerCharacter map(ResultSet rs) throws SQLException {
        Timestamp created = rs.getTimestamp("created_at");
        CharacterBackground bg = CharacterBackground.fromString(rs.getString("background"));
        return new PlayerCharacter(
                rs.getString("id"),
                rs.getString("user_id"),
                rs.getString("name"),
                bg == null ? CharacterBackground.COMMONER : bg,
                rs.getInt("str"),
                rs.getInt("dex"),
                rs.getInt("con"),
                rs.getInt("intel"),
                rs.getInt("wis"),
                rs.getInt("cha"),
                rs.getString("current_room"),
                rs.getInt("level"),
                rs.getInt("experience"),
                rs.getInt("hp_cur"),
                rs.getInt("hp_max"),
                Stance.fromString(rs.getString("stance")),
                created == null ? null : created.toInstant());
    }
}
