package ch.lobbyhub.lobbybackend.web.api.dto;

/**
 * DTO representing the result of a manual empty-lobby sweep.
 *
 * @param message          human-readable status message
 * @param destroyedCount   number of lobbies destroyed by the sweep
 * @param lobbiesBefore    live lobbies before the sweep
 * @param lobbiesAfter     live lobbies after the sweep
 * @param emptyTtlSeconds  how long a lobby may stay empty before it is destroyed
 */
public record LobbyCleanupResultDto(
        String message,
        int destroyedCount,
        int lobbiesBefore,
        int lobbiesAfter,
        long emptyTtlSeconds
) {}
