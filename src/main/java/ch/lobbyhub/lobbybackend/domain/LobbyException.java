package ch.lobbyhub.lobbybackend.domain;

import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import lombok.Getter;

/**
 * Signals that a lobby operation was rejected.
 *
 * <p>Carries a {@link LobbyErrorType} so callers can turn the failure into a
 * response status without inspecting the message.
 */
@Getter
public class LobbyException extends RuntimeException {

    private final LobbyErrorType type;

    public LobbyException(LobbyErrorType type, String message) {
        super(message);
        this.type = type;
    }

    public LobbyException(LobbyErrorType type, String message, Throwable cause) {
        super(message, cause);
        this.type = type;
    }
}
