package com.example.waystone.persistence;

import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Stance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CharacterDAO Tests")
public class CharacterDAOTest {

    private Database db;
    private CharacterDAO dao;
    private String userId;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:chars-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        db.ensureSchema();
        UserDAO users = new UserDAO(db);
        users.register("alice", "alice@example.com", "secret123".toCharArray());
        userId = users.findByUsername("alice").orElseThrow().getId();
        dao = new CharacterDAO(db);
    }

    @Test
    @DisplayName("createCharacter stores attributes and derives hit points")
    void create() {
        PlayerCharacter ch = dao.createCharacter(userId, "Kvothe", CharacterBackground.PERFORMER,
                Map.of("constitution", 14, "dexterity", 12), "start").orElseThrow();
        assertEquals(14, ch.getConstitution());
        assertEquals(12, ch.getDexterity());
        assertEquals(10, ch.getStrength());
        assertEquals(1, ch.getLevel());
        assertEquals(PlayerCharacter.calculateMaxHp(14, 1), ch.getMaxHp());
        assertEquals(13, ch.getMaxHp());
        assertEquals(ch.getMaxHp(), ch.getCurrentHp());

        PlayerCharacter loaded = dao.findById(ch.getId()).orElseThrow();
        assertEquals("Kvothe", loaded.getName());
        assertEquals(CharacterBackground.PERFORMER, loaded.getBackground());
        assertEquals("start", loaded.getCurrentRoomId());
        assertEquals(Stance.STANDING, loaded.getStance());
        assertEquals(userId, loaded.getUserId());
    }

    @Test
    @DisplayName("names are unique ignoring case")
    void uniqueNames() {
        assertTrue(dao.createCharacter(userId, "Kvothe", CharacterBackground.SCHOLAR, Map.of(), "start").isPresent());
        assertTrue(dao.createCharacter(userId, "KVOTHE", CharacterBackground.SCHOLAR, Map.of(), "start").isEmpty());
        assertTrue(dao.isNameTaken("kvothe"));
        assertFalse(dao.isNameTaken("Denna"));
        assertTrue(dao.findByName("kVoThE").isPresent());
    }

    @Test
    @DisplayName("findByUserAndName only finds the owner's characters")
    void findByUserAndName() {
        dao.createCharacter(userId, "Kvothe", CharacterBackground.SCHOLAR, Map.of(), "start");
        assertTrue(dao.findByUserAndName(userId, "kvothe").isPresent());
        assertTrue(dao.findByUserAndName("someone-else", "Kvothe").isEmpty());
    }

    @Test
    @DisplayName("listByUser and delete")
    void listAndDelete() {
        PlayerCharacter a = dao.createCharacter(userId, "Kvothe", CharacterBackground.SCHOLAR, Map.of(), "start").orElseThrow();
        dao.createCharacter(userId, "Denna", CharacterBackground.PERFORMER, Map.of(), "start");
        assertEquals(2, dao.listByUser(userId).size());
        assertTrue(dao.delete(a.getId()));
        assertFalse(dao.delete(a.getId()));
        assertEquals(1, dao.listByUser(userId).size());
    }

    @Test
    @DisplayName("saveState writes room, hit points and stance")
    void saveState() {
        PlayerCharacter ch = dao.createCharacter(userId, "Kvothe", CharacterBackground.SCHOLAR, Map.of(), "start").orElseThrow();
        ch.setCurrentRoomId("elsewhere");
        ch.setCurrentHp(3);
        ch.setStance(Stance.RESTING);
        assertTrue(dao.saveState(ch));

        PlayerCharacter loaded = dao.findById(ch.getId()).orElseThrow();
        assertEquals("elsewhere", loaded.getCurrentRoomId());
        assertEquals(3, loaded.getCurrentHp());
        assertEquals(Stance.RESTING, loaded.getStance());
    }

    @Test
    @DisplayName("a failed transaction rolls back and raises DataAccessException")
    void rollback() {
        dao.createCharacter(userId, "Kvothe", CharacterBackground.SCHOLAR, Map.of(), "start");
        assertThrows(DataAccessException.class, () -> db.inTransaction(c -> {
            try (PreparedStatement ps = c.prepareStatement("DELETE FROM characters")) {
                ps.executeUpdate();
            }
            try (PreparedStatement ps = c.prepareStatement("SELECT * FROM no_such_table")) {
                ps.executeQuery();
            }
            return null;
        }));
        assertTrue(dao.findByName("Kvothe").isPresent());
    }

    @Test
    @DisplayName("concurrent creates of one name in different cases yield exactly one character")
    void concurrentCreates() throws Exception {
        List<String> spellings = List.of("Kvothe", "KVothe", "KvOthe", "KVOTHE", "Kvothe", "KvothE");
        ExecutorService pool = Executors.newFixedThreadPool(spellings.size());
        CountDownLatch go = new CountDownLatch(1);
        try {
            List<Future<Optional<PlayerCharacter>>> results = new ArrayList<>();
            for (String name : spellings) {
                results.add(pool.submit(() -> {
                    go.await();
                    return dao.createCharacter(userId, name, CharacterBackground.SCHOLAR, Map.of(), "start");
                }));
            }
            go.countDown();
            int created = 0;
            for (Future<Optional<PlayerCharacter>> f : results) {
                if (f.get(10, TimeUnit.SECONDS).isPresent()) created++;
            }
            assertEquals(1, created);
            assertEquals(1, dao.listByUser(userId).size());
        } finally {
            pool.shutdownNow();
        }
    }
}
