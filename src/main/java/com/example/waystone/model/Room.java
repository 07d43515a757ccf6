package com.example.waystone.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * A location in the world.
 *
 * Static data (name, description, exits, flags) never changes after loading.
 * The occupant set is shared between connection threads and every access
 * goes through the room's lock.
 */
public class Room {
    private final String id;
    private final String name;
    private final String area;
    private final String description;
    private final Map<String, String> exits;
    private final Set<RoomFlag> flags;

    private final Set<String> occupants = new LinkedHashSet<>();
    private final ReentrantLock lock = new ReentrantLock();

    public Room(String id, String name, String area, String description,
                Map<String, String> exits, Set<RoomFlag> flags) {
        this.id = id;
        this.name = name;
        this.area = area;
        this.description = description;
        Map<String, String> ex = new LinkedHashMap<>();
        if (exits != null) {
            for (Map.Entry<String, String> e : exits.entrySet()) {
                ex.put(e.getKey().toLowerCase(), e.getValue());
            }
        }
        this.exits = Collections.unmodifiableMap(ex);
        this.flags = flags == null || flags.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(RoomFlag.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(flags));
    }

    public String getId() { return id; }
    public String getName() { return name; }
    public String getArea() { return area; }
    public String getDescription() { return description; }
    public Map<String, String> getExits() { return exits; }
    public Set<RoomFlag> getFlags() { return flags; }

    /**
     * @return the destination room id, or null if there is no exit that way
     */
    public String getExit(String direction) {
        if (direction == null) return null;
        return exits.get(direction.toLowerCase());
    }

    /** Exit directions, sorted. */
    public List<String> getAvailableExits() {
        List<String> dirs = new ArrayList<>(exits.keySet());
        Collections.sort(dirs);
        return dirs;
    }

    public boolean isOutdoor() { return flags.contains(RoomFlag.OUTDOOR); }
    public boolean isLit() { return !flags.contains(RoomFlag.DARK); }
    public boolean isSafeZone() { return flags.contains(RoomFlag.SAFE); }

    /**
     * The lock guarding this room's occupants. Callers that need several
     * rooms at once must take the locks in ascending room-id order.
     */
    public ReentrantLock getLock() {
        return lock;
    }

    public boolean addOccupant(String characterId) {
        lock.lock();
        try {
            return occupants.add(characterId);
        } finally {
            lock.unlock();
        }
    }

    public boolean removeOccupant(String characterId) {
        lock.lock();
        try {
            return occupants.remove(characterId);
        } finally {
            lock.unlock();
        }
    }

    public boolean hasOccupant(String characterId) {
        lock.lock();
        try {
            return occupants.contains(characterId);
        } finally {
            lock.unlock();
        }
    }

    /** A copy of the current occupants. */
    public Set<String> getOccupants() {
        lock.lock();
        try {
            return new LinkedHashSet<>(occupants);
        } finally {
            lock.unlock();
        }
    }

    public int getOccupantCount() {
        lock.lock();
        try {
            return occupants.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Name, underline, description and exit list, ready to send.
     */
    public String formatDescription() {
        StringBuilder sb = new StringBuilder();
        sb.append('\n').append(name).append('\n');
        sb.append("-".repeat(name.length())).append('\n');
        sb.append(description.strip()).append('\n');
        sb.append('\n');
        if (exits.isEmpty()) {
            sb.append("[Exits: none]");
        } else {
            sb.append("[Exits: ").append(String.join(", ", getAvailableExits())).append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "Room(" + id + ")";
    }
}
