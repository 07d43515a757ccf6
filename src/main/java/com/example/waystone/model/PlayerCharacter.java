package com.example.waystone.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A playable character.
 *
 * Identity and attributes are fixed once loaded. Room, hit points and stance
 * change during play and are written back by the autosave tick.
 */
public class PlayerCharacter {
    public static final int BASE_ATTRIBUTE = 10;

    private final String id;
    private final String userId;
    private final String name;
    private final CharacterBackground background;
    private final int strength;
    private final int dexterity;
    private final int constitution;
    private final int intelligence;
    private final int wisdom;
    private final int charisma;
    private final int level;
    private final int experience;
    private final int maxHp;
    private final Instant createdAt;

    private volatile String currentRoomId;
    private volatile int currentHp;
    private volatile Stance stance;

    public PlayerCharacter(String id, String userId, String name, CharacterBackground background,
                           int strength, int dexterity, int constitution,
                           int intelligence, int wisdom, int charisma,
                           String currentRoomId, int level, int experience,
                           int currentHp, int maxHp, Stance stance, Instant createdAt) {
        this.id = id;
        this.userId = userId;
        this.name = name;
        this.background = background;
        this.strength = strength;
        this.dexterity = dexterity;
        this.constitution = constitution;
        this.intelligence = intelligence;
        this.wisdom = wisdom;
        this.charisma = charisma;
        this.currentRoomId = currentRoomId;
        this.level = level;
        this.experience = experience;
        this.currentHp = currentHp;
        this.maxHp = maxHp;
        this.stance = stance == null ? Stance.STANDING : stance;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getUserId() { return userId; }
    public String getName() { return name; }
    public CharacterBackground getBackground() { return background; }
    public int getStrength() { return strength; }
    public int getDexterity() { return dexterity; }
    public int getConstitution() { return constitution; }
    public int getIntelligence() { return intelligence; }
    public int getWisdom() { return wisdom; }
    public int getCharisma() { return charisma; }
    public int getLevel() { return level; }
    public int getExperience() { return experience; }
    public int getMaxHp() { return maxHp; }
    public Instant getCreatedAt() { return createdAt; }

    public String getCurrentRoomId() { return currentRoomId; }
    public void setCurrentRoomId(String currentRoomId) { this.currentRoomId = currentRoomId; }

    public int getCurrentHp() { return currentHp; }
    public void setCurrentHp(int hp) { this.currentHp = Math.max(0, Math.min(hp, maxHp)); }

    public Stance getStance() { return stance; }
    public void setStance(Stance stance) { this.stance = stance; }

    /** Attributes in display order. */
    public Map<String, Integer> getAttributes() {
        Map<String, Integer> attrs = new LinkedHashMap<>();
        attrs.put("strength", strength);
        attrs.put("dexterity", dexterity);
        attrs.put("constitution", constitution);
        attrs.put("intelligence", intelligence);
        attrs.put("wisdom", wisdom);
        attrs.put("charisma", charisma);
        return attrs;
    }

    /**
     * D20-style modifier: (score - 10) / 2, rounded down.
     */
    public static int modifier(int score) {
        return Math.floorDiv(score - BASE_ATTRIBUTE, 2);
    }

    /**
     * Base 10, plus the constitution modifier and one point per level.
     */
    public static int calculateMaxHp(int constitution, int level) {
        return Math.max(1, 10 + modifier(constitution) * level + level);
    }

    @Override
    public String toString() {
        return "PlayerCharacter(" + name + ", " + id + ")";
    }
}
