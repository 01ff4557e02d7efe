package ch.lobbyhub.lobbybackend.web.api.dto;

import ch.lobbyhub.lobbybackend.domain.LobbyException;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.domain.enums.ResponseStatus;

/**
 * Outcome of one lobby request, independent of the transport that carries it.
 *
 * @param status    response status sent to the client
 * @param errorType failure classification, {@code null} on success
 * @param message   human-readable reason, {@code null} on success
 * @param data      payload, may be {@code null}
 * @param <T>       payload type
 */
public record LobbyResponse<T>(
        ResponseStatus status,
        LobbyErrorType errorType,
        String message,
        T data
) {
    public static <T> LobbyResponse<T> success() {
        return new LobbyResponse<>(ResponseStatus.SUCCESS, null, null, null);
    }

    public static <T> LobbyResponse<T> success(T data) {
        return new LobbyResponse<>(ResponseStatus.SUCCESS, null, null, data);
    }

    public static <T> LobbyResponse<T> failure(LobbyErrorType errorType, String message) {
        return new LobbyResponse<>(errorType.getResponseStatus(), errorType, message, null);
    }

    public static <T> LobbyResponse<T> failure(LobbyException e) {
        return failure(e.getType(), e.getMessage());
    }

    public boolean isSuccess() {
        return status == ResponseStatus.SUCCESS;
    }
}
