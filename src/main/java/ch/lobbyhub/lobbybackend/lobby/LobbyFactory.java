package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyPeer;

import java.util.Map;

/**
 * Builds lobbies of one type. Registered with the coordination service under {@link #getId()}.
 */
public interface LobbyFactory {

    String getId();

    /**
     * Builds a new lobby. The lobby is not registered and has no members yet.
     *
     * @param lobbyId id allocated by the coordination service
     * @param options creation options sent by the client
     * @param creator connection requesting the lobby
     * @throws ch.lobbyhub.lobbybackend.domain.LobbyException with
     *         {@link ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType#INVALID_REQUEST}
     *         if the options are invalid
     */
    Lobby createLobby(int lobbyId, Map<String, String> options, LobbyPeer creator);
}
