package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.List;

/**
 * @param totalLobbies      live lobbies in the registry
 * @param emptyLobbies      lobbies without members
 * @param inProgressLobbies lobbies whose game server is running
 * @param connectedPeers    connections known to the backend
 * @param factoryIds        registered lobby factories
 */
public record LobbyRegistryStatusDto(
        int totalLobbies,
        long emptyLobbies,
        long inProgressLobbies,
        int connectedPeers,
        List<String> factoryIds
) {}
