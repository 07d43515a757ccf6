package com.example.waystone.util;

import com.example.waystone.model.CharacterBackground;
import com.example.waystone.model.PlayerCharacter;
import com.example.waystone.model.Stance;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RegenerationService Tests")
public class RegenerationServiceTest {

    private static PlayerCharacter character(int con, int maxHp, int hp, Stance stance) {
        return new PlayerCharacter("id", "user", "Kvothe", CharacterBackground.SCHOLAR,
                10, 10, con, 10, 10, 10, "room", 1, 0, hp, maxHp, stance, Instant.now());
    }

    @ParameterizedTest(name = "con {0}, max {1}, {2} -> {3}")
    @CsvSource({
        "10, 100, STANDING, 5",
        "10, 100, RESTING, 10",
        "10, 100, SLEEPING, 20",
        "14, 100, STANDING, 7",
        "6, 100, STANDING, 5",
        "10, 11, STANDING, 1",
        "10, 11, SLEEPING, 1"
    })
    @DisplayName("regen amount follows max HP, constitution and stance")
    void regenAmount(int con, int maxHp, Stance stance, int expected) {
        assertEquals(expected, RegenerationService.calculateRegenAmount(character(con, maxHp, 1, stance)));
    }

    @Test
    @DisplayName("tick heals damaged characters without exceeding max")
    void tickHeals() {
        PlayerCharacter hurt = character(10, 100, 50, Stance.STANDING);
        PlayerCharacter almost = character(10, 100, 98, Stance.SLEEPING);
        PlayerCharacter healthy = character(10, 100, 100, Stance.STANDING);
        RegenerationService regen = new RegenerationService(() -> List.of(hurt, almost, healthy));

        assertEquals(2, regen.tick());
        assertEquals(55, hurt.getCurrentHp());
        assertEquals(100, almost.getCurrentHp());
        assertEquals(100, healthy.getCurrentHp());
    }

    @Test
    @DisplayName("initialize registers with the tick service")
    void initialize() {
        PlayerCharacter hurt = character(10, 100, 50, Stance.STANDING);
        TickService ticks = new TickService();
        try {
            new RegenerationService(() -> List.of(hurt)).initialize(ticks);
            ticks.runTick();
            assertEquals(55, hurt.getCurrentHp());
        } finally {
            ticks.shutdown();
        }
    }
}
