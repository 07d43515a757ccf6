package com.example.waystone.engine;

import com.example.waystone.model.Room;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * The loaded room table and the occupancy of each room.
 *
 * The set of rooms is fixed at construction. A character is in at most one
 * room at any moment: every operation that touches two rooms holds both
 * room locks, always taken in ascending room-id order.
 */
public class World {
    private static final Logger logger = LoggerFactory.getLogger(World.class);

    // sorted by id so that iteration order is also lock order
    private final Map<String, Room> rooms;

    public World(Map<String, Room> rooms) {
        this.rooms = Collections.unmodifiableMap(new TreeMap<>(rooms));
    }

    public Optional<Room> getRoom(String roomId) {
        if (roomId == null) return Optional.empty();
        return Optional.ofNullable(rooms.get(roomId));
    }

    public Map<String, Room> getRooms() {
        return rooms;
    }

    public int size() {
        return rooms.size();
    }

    /**
     * Put a character into a room, taking it out of whichever room held it.
     * Calls for one character come from that character's connection thread.
     *
     * @return false if the room does not exist
     */
    public boolean placeCharacter(String characterId, String roomId) {
        Room target = rooms.get(roomId);
        if (target == null) return false;
        Optional<Room> current = locate(characterId);
        if (current.isEmpty()) {
            target.addOccupant(characterId);
            return true;
        }
        return current.get() == target || moveCharacter(characterId, current.get().getId(), roomId);
    }

    /**
     * Move a character between two rooms as one step.
     *
     * @return false if either room is missing or the character is not in
     *         the source room; nothing changes in that case
     */
    public boolean moveCharacter(String characterId, String fromRoomId, String toRoomId) {
        Room from = rooms.get(fromRoomId);
        Room to = rooms.get(toRoomId);
        if (from == null || to == null) return false;
        if (from == to) return from.hasOccupant(characterId);

        Room first = fromRoomId.compareTo(toRoomId) < 0 ? from : to;
        Room second = first == from ? to : from;
        first.getLock().lock();
        try {
            second.getLock().lock();
            try {
                if (!from.removeOccupant(characterId)) return false;
                to.addOccupant(characterId);
                logger.debug("Character {} moved {} -> {}", characterId, fromRoomId, toRoomId);
                return true;
            } finally {
                second.getLock().unlock();
            }
        } finally {
            first.getLock().unlock();
        }
    }

    /**
     * Take a character out of the world.
     *
     * @return the room it was removed from, if any
     */
    public Optional<Room> removeCharacter(String characterId) {
        Optional<Room> removedFrom = Optional.empty();
        for (Room room : rooms.values()) {
            if (room.removeOccupant(characterId)) {
                removedFrom = Optional.of(room);
            }
        }
        return removedFrom;
    }

    /**
     * The room currently holding the character.
     */
    public Optional<Room> locate(String characterId) {
        for (Room room : rooms.values()) {
            if (room.hasOccupant(characterId)) return Optional.of(room);
        }
        return Optional.empty();
    }

    public Set<String> getOccupants(String roomId) {
        Room room = rooms.get(roomId);
        return room == null ? Collections.emptySet() : room.getOccupants();
    }

    /**
     * A consistent view of every room's occupants, taken while holding all
     * room locks.
     */
    public Map<String, Set<String>> occupancySnapshot() {
        List<Room> locked = new ArrayList<>(rooms.size());
        try {
            for (Room room : rooms.values()) {
                room.getLock().lock();
                locked.add(room);
            }
            Map<String, Set<String>> snapshot = new LinkedHashMap<>();
            for (Room room : rooms.values()) {
                snapshot.put(room.getId(), room.getOccupants());
            }
            return snapshot;
        } finally {
            for (int i = locked.size() - 1; i >= 0; i--) {
                locked.get(i).getLock().unlock();
            }
        }
    }
}
