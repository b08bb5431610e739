package com.questrail.dtchat.config;

import com.questrail.dtchat.api.Endpoint;
import com.questrail.dtchat.api.EndpointFormatException;
import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;
import com.questrail.dtchat.api.RoomParticipant;

import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads a {@link ChatConfig} from a YAML document.
 *
 * <pre>
 * db_type: YamlVec
 * cp_path: ./contacts.cp          # optional
 * file_reception_dir: ./received  # optional
 * peer_list:
 *   - uuid: "1"
 *     name: Alice
 *     color: red
 *     endpoints: ["tcp 127.0.0.1:7001", "bp ipn:1.0"]
 * room_list:                      # optional
 *   - uuid: r1
 *     name: general
 *     participants:
 *       - { peer: "1", endpoint: "tcp 127.0.0.1:7001" }
 * </pre>
 *
 * <p>Without {@code room_list} a room {@value #DEFAULT_ROOM_UUID} is created
 * containing every peer on its first endpoint.</p>
 */
public final class YamlChatConfigLoader
{
    public static final String DEFAULT_ROOM_UUID = "default";

    private static final String SUPPORTED_DB_TYPE = "YamlVec";

    private YamlChatConfigLoader() {
    }

    /**
     * @throws ConfigException if the file cannot be read or is not a valid configuration
     */
    public static ChatConfig load(Path path, String localPeerUuid) {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(localPeerUuid, "localPeerUuid");

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return load(reader, localPeerUuid);
        }
        catch (IOException e) {
            throw new ConfigException("Failed to read configuration at " + path, e);
        }
    }

    public static ChatConfig load(Reader reader, String localPeerUuid) {
        Objects.requireNonNull(reader, "reader");
        Objects.requireNonNull(localPeerUuid, "localPeerUuid");

        Object document;
        try {
            document = new Yaml().load(reader);
        }
        catch (YAMLException e) {
            throw new ConfigException("Failed to parse YAML configuration", e);
        }
        if (document == null) {
            throw new ConfigException("Configuration is empty");
        }
        Map<String, Object> root = asMap(document, "root");

        String dbType = optionalString(root, "db_type", SUPPORTED_DB_TYPE, "root");
        if (!SUPPORTED_DB_TYPE.equalsIgnoreCase(dbType)) {
            throw new ConfigException("Unsupported db_type '" + dbType + "', expected " + SUPPORTED_DB_TYPE);
        }

        ChatConfig.Builder builder = ChatConfig.builder().withLocalPeerUuid(localPeerUuid);

        String cpPath = optionalString(root, "cp_path", null, "root");
        if (cpPath != null && !cpPath.isBlank()) {
            builder.withContactPlan(Path.of(cpPath));
        }
        builder.withFileReceptionDir(Path.of(optionalString(root, "file_reception_dir", "./", "root")));

        List<Peer> peers = new ArrayList<>();
        for (Object node : asList(root.get("peer_list"), "peer_list")) {
            Peer peer = peer(asMap(node, "peer_list entry"));
            peers.add(peer);
            builder.withPeer(peer);
        }
        if (peers.isEmpty()) {
            throw new ConfigException("peer_list must not be empty");
        }

        if (root.containsKey("room_list")) {
            for (Object node : asList(root.get("room_list"), "room_list")) {
                builder.withRoom(room(asMap(node, "room_list entry")));
            }
        } else {
            builder.withRoom(defaultRoom(peers));
        }

        return builder.build();
    }

    private static Peer peer(Map<String, Object> node) {
        String uuid = requiredString(node, "uuid", "peer");
        String name = optionalString(node, "name", uuid, "peer " + uuid);
        String color = optionalString(node, "color", "white", "peer " + uuid);

        List<Endpoint> endpoints = new ArrayList<>();
        for (Object e : asList(node.get("endpoints"), "endpoints of peer " + uuid)) {
            endpoints.add(endpoint(e, "peer " + uuid));
        }
        return new Peer(uuid, name, color, endpoints);
    }

    private static Room room(Map<String, Object> node) {
        String uuid = requiredString(node, "uuid", "room");
        String name = optionalString(node, "name", uuid, "room " + uuid);

        List<RoomParticipant> participants = new ArrayList<>();
        for (Object p : asList(node.get("participants"), "participants of room " + uuid)) {
            Map<String, Object> participant = asMap(p, "participant of room " + uuid);
            participants.add(new RoomParticipant(
                    requiredString(participant, "peer", "participant of room " + uuid),
                    endpoint(participant.get("endpoint"), "room " + uuid)));
        }
        return new Room(uuid, name, participants);
    }

    private static Room defaultRoom(List<Peer> peers) {
        List<RoomParticipant> participants = peers.stream()
                .filter(p -> !p.endpoints().isEmpty())
                .map(p -> new RoomParticipant(p.uuid(), p.endpoints().get(0)))
                .toList();
        return new Room(DEFAULT_ROOM_UUID, DEFAULT_ROOM_UUID, participants);
    }

    private static Endpoint endpoint(Object value, String context) {
        if (!(value instanceof String text)) {
            throw new ConfigException(context + ": endpoint must be a string like 'tcp 127.0.0.1:8000'");
        }
        try {
            return Endpoint.parse(text);
        }
        catch (EndpointFormatException e) {
            throw new ConfigException(context + ": " + e.getMessage(), e);
        }
    }

    private static Map<String, Object> asMap(Object node, String context) {
        if (!(node instanceof Map<?, ?> raw)) {
            throw new ConfigException(context + " must be a mapping");
        }
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new ConfigException(context + " contains non-string key");
            }
            map.put(key, entry.getValue());
        }
        return map;
    }

    private static List<?> asList(Object node, String context) {
        if (node == null) {
            return List.of();
        }
        if (!(node instanceof List<?> list)) {
            throw new ConfigException(context + " must be a list");
        }
        return list;
    }

    private static String requiredString(Map<String, Object> node, String key, String context) {
        String value = optionalString(node, key, null, context);
        if (value == null || value.isBlank()) {
            throw new ConfigException(context + ": missing '" + key + "'");
        }
        return value;
    }

    private static String optionalString(Map<String, Object> node, String key, String fallback, String context) {
        Object value = node.get(key);
        if (value == null) {
            return fallback;
        }
        if (value instanceof Map<?, ?> || value instanceof List<?>) {
            throw new ConfigException(context + ": '" + key + "' must be a scalar");
        }
        // unquoted uuids such as 1 arrive as Integer
        return value.toString();
    }
}
