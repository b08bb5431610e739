package com.questrail.dtchat.config;

import com.questrail.dtchat.api.Peer;
import com.questrail.dtchat.api.Room;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Aggregated configuration for one chat node.
 *
 * @param localPeerUuid    which entry of {@code peers} this node is
 * @param contactPlan      ION contact plan enabling delivery-time prediction
 * @param fileReceptionDir where received files are written
 * @param peers            every peer, the local one included
 * @param rooms            configured rooms
 */
public record ChatConfig(
    String localPeerUuid,
    Optional<Path> contactPlan,
    Path fileReceptionDir,
    List<Peer> peers,
    List<Room> rooms
) {
    public ChatConfig {
        Objects.requireNonNull(localPeerUuid, "localPeerUuid");
        Objects.requireNonNull(contactPlan, "contactPlan");
        Objects.requireNonNull(fileReceptionDir, "fileReceptionDir");
        peers = List.copyOf(Objects.requireNonNull(peers, "peers"));
        rooms = List.copyOf(Objects.requireNonNull(rooms, "rooms"));

        if (peers.stream().noneMatch(p -> p.uuid().equals(localPeerUuid))) {
            throw new ConfigException("Local peer '" + localPeerUuid + "' is not in the peer list");
        }
    }

    public Peer localPeer() {
        return peers.stream()
                .filter(p -> p.uuid().equals(localPeerUuid))
                .findFirst()
                .orElseThrow();
    }

    public List<Peer> otherPeers() {
        return peers.stream()
                .filter(p -> !p.uuid().equals(localPeerUuid))
                .toList();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String localPeerUuid;
        private Path contactPlan;
        private Path fileReceptionDir = Path.of("./");
        private final List<Peer> peers = new ArrayList<>();
        private final List<Room> rooms = new ArrayList<>();

        public Builder withLocalPeerUuid(String localPeerUuid) {
            this.localPeerUuid = localPeerUuid;
            return this;
        }

        public Builder withContactPlan(Path contactPlan) {
            this.contactPlan = contactPlan;
            return this;
        }

        public Builder withFileReceptionDir(Path fileReceptionDir) {
            this.fileReceptionDir = fileReceptionDir;
            return this;
        }

        public Builder withPeer(Peer peer) {
            this.peers.add(Objects.requireNonNull(peer, "peer"));
            return this;
        }

        public Builder withRoom(Room room) {
            this.rooms.add(Objects.requireNonNull(room, "room"));
            return this;
        }

        public ChatConfig build() {
            return new ChatConfig(localPeerUuid, Optional.ofNullable(contactPlan), fileReceptionDir, peers, rooms);
        }
    }
}
