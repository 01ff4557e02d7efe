package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.domain.GameServerInfo;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RoomSpawner} handing out ports of game servers running on one host.
 *
 * <p>Configuration properties:
 * <ul>
 *   <li>{@code lobbies.spawner.host}: address reported to clients (default: 127.0.0.1)</li>
 *   <li>{@code lobbies.spawner.base-port}: first port of the range (default: 7777)</li>
 *   <li>{@code lobbies.spawner.max-rooms}: number of ports in the range (default: 100)</li>
 * </ul>
 *
 * <p>Provisioning fails when every port of the range is taken.
 */
@Service
@Slf4j
public class LocalRoomSpawner implements RoomSpawner {

    private final String host;
    private final int basePort;
    private final int maxRooms;
    private final Set<Integer> usedPorts = ConcurrentHashMap.newKeySet();

    public LocalRoomSpawner(@Value("${lobbies.spawner.host:127.0.0.1}") String host,
                            @Value("${lobbies.spawner.base-port:7777}") int basePort,
                            @Value("${lobbies.spawner.max-rooms:100}") int maxRooms) {
        this.host = host;
        this.basePort = basePort;
        this.maxRooms = maxRooms;
    }

    @Override
    public CompletableFuture<GameServerInfo> provision(Lobby lobby) {
        for (int port = basePort; port < basePort + maxRooms; port++) {
            if (usedPorts.add(port)) {
                GameServerInfo server = new GameServerInfo(UUID.randomUUID().toString(), host, port);
                log.info("Provisioned room {} on {}:{} for lobby {}", server.roomId(), host, port, lobby.getId());
                return CompletableFuture.completedFuture(server);
            }
        }
        log.warn("No free game server port for lobby {} ({} rooms in use)", lobby.getId(), usedPorts.size());
        return CompletableFuture.failedFuture(new IllegalStateException("No free game server available"));
    }

    @Override
    public RoomAccessDto requestAccess(GameServerInfo server, String username) {
        return new RoomAccessDto(
                server.roomId(),
                server.ip(),
                server.port(),
                UUID.randomUUID().toString(),
                username
        );
    }

    @Override
    public void release(GameServerInfo server) {
        if (usedPorts.remove(server.port())) {
            log.debug("Released room {} on port {}", server.roomId(), server.port());
        }
    }

    public int getRoomsInUse() {
        return usedPorts.size();
    }
}
