package ch.lobbyhub.lobbybackend.web.api.dto;

/**
 * @param lobbyId id of the lobby
 * @param peerId  connection id of the member
 */
public record LobbyMemberDataRequest(
        int lobbyId,
        int peerId
) {}
