package ch.lobbyhub.lobbybackend.domain.enums;

import org.springframework.http.HttpStatus;

/**
 * Classifies why a lobby request failed.
 *
 * <p>Every type maps to exactly one {@link ResponseStatus} for STOMP replies and
 * one {@link HttpStatus} for the REST endpoints.
 */
public enum LobbyErrorType {

    /**
     * Caller lacks the permission level or role for the operation.
     */
    UNAUTHORIZED(ResponseStatus.UNAUTHORIZED, HttpStatus.FORBIDDEN),

    /**
     * Malformed payload, missing field or unknown factory id.
     */
    INVALID_REQUEST(ResponseStatus.FAILED, HttpStatus.BAD_REQUEST),

    /**
     * Request clashes with current state (already in a lobby, lobby full, id collision).
     */
    CONFLICT(ResponseStatus.FAILED, HttpStatus.CONFLICT),

    /**
     * Lobby, member or team does not exist.
     */
    NOT_FOUND(ResponseStatus.FAILED, HttpStatus.NOT_FOUND),

    /**
     * Registration failure or downstream provisioning failure.
     */
    INTERNAL_ERROR(ResponseStatus.ERROR, HttpStatus.INTERNAL_SERVER_ERROR);

    private final ResponseStatus responseStatus;
    private final HttpStatus httpStatus;

    LobbyErrorType(ResponseStatus responseStatus, HttpStatus httpStatus) {
        this.responseStatus = responseStatus;
        this.httpStatus = httpStatus;
    }

    public ResponseStatus getResponseStatus() {
        return responseStatus;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }
}
