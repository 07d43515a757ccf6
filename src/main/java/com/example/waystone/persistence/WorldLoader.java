package com.example.waystone.persistence;

import com.example.waystone.model.Direction;
import com.example.waystone.model.Room;
import com.example.waystone.model.RoomFlag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads room definitions from a YAML classpath resource.
 *
 * <pre>
 * rooms:
 *   - id: university_main_gates
 *     name: The University Main Gates
 *     area: university
 *     description: ...
 *     exits: { north: university_courtyard }
 *     properties: { outdoor: true, lit: true, safe_zone: true }
 * </pre>
 *
 * Missing fields, duplicate ids and exits to unknown rooms are fatal.
 * One-way exits are only logged.
 */
public class WorldLoader {
    private static final Logger logger = LoggerFactory.getLogger(WorldLoader.class);

    private static final String[] REQUIRED_FIELDS = {"id", "name", "area", "description"};

    private WorldLoader() {
    }

    public static Map<String, Room> loadFromResource(String resource) throws WorldLoadException {
        try (InputStream in = WorldLoader.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new WorldLoadException("World resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new WorldLoadException("Error reading " + resource + ": " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Room> load(InputStream in, String source) throws WorldLoadException {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new WorldLoadException("YAML parsing error in " + source + ": " + e.getMessage(), e);
        }
        if (!(root instanceof Map)) {
            throw new WorldLoadException("Empty or malformed world file: " + source);
        }
        Object roomList = ((Map<String, Object>) root).get("rooms");
        if (roomList == null) {
            throw new WorldLoadException("Missing 'rooms' key in " + source);
        }
        if (!(roomList instanceof List)) {
            throw new WorldLoadException("'rooms' must be a list in " + source);
        }

        Map<String, Room> rooms = new LinkedHashMap<>();
        for (Object entry : (List<Object>) roomList) {
            if (!(entry instanceof Map)) {
                throw new WorldLoadException("Room entry in " + source + " is not a mapping");
            }
            Room room = toRoom((Map<String, Object>) entry, source);
            if (rooms.containsKey(room.getId())) {
                throw new WorldLoadException("Duplicate room ID '" + room.getId() + "' found in " + source);
            }
            rooms.put(room.getId(), room);
        }
        if (rooms.isEmpty()) {
            throw new WorldLoadException("No rooms defined in " + source);
        }

        for (String warning : validateExits(rooms)) {
            logger.warn(warning);
        }
        logger.info("Loaded {} rooms from {}", rooms.size(), source);
        return rooms;
    }

    /**
     * Check every exit against the room table.
     *
     * @return warnings for exits without a matching way back
     * @throws WorldLoadException if an exit leads to a room that does not exist
     */
    public static List<String> validateExits(Map<String, Room> rooms) throws WorldLoadException {
        List<String> warnings = new ArrayList<>();
        for (Room room : rooms.values()) {
            for (Map.Entry<String, String> exit : room.getExits().entrySet()) {
                String direction = exit.getKey();
                String targetId = exit.getValue();
                Room target = rooms.get(targetId);
                if (target == null) {
                    throw new WorldLoadException("Room '" + room.getId() + "' has exit '" + direction
                            + "' to non-existent room '" + targetId + "'");
                }
                Direction dir = Direction.fromString(direction);
                if (dir == null) continue;
                String reverse = dir.opposite().getKey();
                String back = target.getExit(reverse);
                if (back == null) {
                    warnings.add("Non-bidirectional exit: '" + room.getId() + "' -> '" + direction + "' -> '"
                            + targetId + "', but '" + targetId + "' has no '" + reverse + "' exit back");
                } else if (!back.equals(room.getId())) {
                    warnings.add("Mismatched exit: '" + room.getId() + "' -> '" + direction + "' -> '"
                            + targetId + "', but '" + targetId + "' '" + reverse + "' points to '" + back + "'");
                }
            }
        }
        return warnings;
    }

    @SuppressWarnings("unchecked")
    private static Room toRoom(Map<String, Object> data, String source) throws WorldLoadException {
        for (String field : REQUIRED_FIELDS) {
            if (data.get(field) == null) {
                Object id = data.getOrDefault("id", "unknown");
                throw new WorldLoadException("Room '" + id + "' in " + source + " missing required field: " + field);
            }
        }
        String id = String.valueOf(data.get("id"));

        Map<String, String> exits = new LinkedHashMap<>();
        Object rawExits = data.get("exits");
        if (rawExits != null) {
            if (!(rawExits instanceof Map)) {
                throw new WorldLoadException("Room '" + id + "' in " + source + " has invalid exits (must be a mapping)");
            }
            for (Map.Entry<Object, Object> e : ((Map<Object, Object>) rawExits).entrySet()) {
                exits.put(String.valueOf(e.getKey()).toLowerCase(), String.valueOf(e.getValue()));
            }
        }

        Set<RoomFlag> flags = EnumSet.noneOf(RoomFlag.class);
        Object rawProps = data.get("properties");
        if (rawProps != null) {
            if (!(rawProps instanceof Map)) {
                throw new WorldLoadException("Room '" + id + "' in " + source + " has invalid properties (must be a mapping)");
            }
            Map<Object, Object> props = (Map<Object, Object>) rawProps;
            if (isTrue(props.get("outdoor"))) flags.add(RoomFlag.OUTDOOR);
            if (props.containsKey("lit") && !isTrue(props.get("lit"))) flags.add(RoomFlag.DARK);
            if (isTrue(props.get("dark"))) flags.add(RoomFlag.DARK);
            if (isTrue(props.get("safe_zone"))) flags.add(RoomFlag.SAFE);
        }

        return new Room(id,
                String.valueOf(data.get("name")),
                String.valueOf(data.get("area")),
                String.valueOf(data.get("description")),
                exits,
                flags);
    }

    private static boolean isTrue(Object value) {
        if (value instanceof Boolean) return (Boolean) value;
        return value != null && Boolean.parseBoolean(String.valueOf(value));
    }
}
