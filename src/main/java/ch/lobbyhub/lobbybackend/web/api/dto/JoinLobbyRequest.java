package ch.lobbyhub.lobbybackend.web.api.dto;

/**
 * Request DTO used to join or leave a lobby and to query lobby info.
 *
 * @param lobbyId id of the target lobby
 */
public record JoinLobbyRequest(
        int lobbyId
) {}
