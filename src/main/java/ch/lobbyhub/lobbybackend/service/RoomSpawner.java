package ch.lobbyhub.lobbybackend.service;

import ch.lobbyhub.lobbybackend.domain.GameServerInfo;
import ch.lobbyhub.lobbybackend.lobby.Lobby;
import ch.lobbyhub.lobbybackend.web.api.dto.RoomAccessDto;

import java.util.concurrent.CompletableFuture;

/**
 * Boundary to the subsystem that runs the actual game servers.
 *
 * <p>Lobbies call {@link #provision(Lobby)} when a game starts and wait for the
 * future with a bounded timeout; a timed-out future is cancelled.
 */
public interface RoomSpawner {

    /**
     * Starts a game server for the given lobby.
     *
     * @param lobby lobby that is starting
     * @return future completed with the server's connection details, or failed
     */
    CompletableFuture<GameServerInfo> provision(Lobby lobby);

    /**
     * Issues room credentials for a lobby member.
     *
     * @param server   server provisioned for the lobby
     * @param username member requesting access
     * @return access credentials
     */
    RoomAccessDto requestAccess(GameServerInfo server, String username);

    /**
     * Gives the server's slot back once the lobby that owned it is destroyed.
     */
    void release(GameServerInfo server);
}
