package ch.lobbyhub.lobbybackend.domain.enums;

/**
 * Status attached to every response sent for a lobby request.
 */
public enum ResponseStatus {
    SUCCESS,
    FAILED,
    UNAUTHORIZED,
    ERROR
}
