package ch.lobbyhub.lobbybackend.web.api.dto;

import ch.lobbyhub.lobbybackend.domain.enums.LobbyMessageType;
import ch.lobbyhub.lobbybackend.domain.enums.ResponseStatus;

/**
 * Reply sent to {@code /user/queue/lobbies} for every lobby request.
 */
public record LobbyResponseDto(
        LobbyMessageType type,
        ResponseStatus status,
        String message,
        Object data
) {
    public static LobbyResponseDto of(LobbyMessageType type, LobbyResponse<?> response) {
        return new LobbyResponseDto(type, response.status(), response.message(), response.data());
    }
}
