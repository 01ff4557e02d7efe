package ch.lobbyhub.lobbybackend.web.api.dto;

/**
 * Credentials a lobby member needs to connect to the provisioned game server.
 *
 * @param roomId   id of the room on the game server
 * @param roomIp   address of the game server
 * @param roomPort port of the game server
 * @param token    one-time access token bound to the member
 * @param username member the token was issued for
 */
public record RoomAccessDto(
        String roomId,
        String roomIp,
        int roomPort,
        String token,
        String username
) {}
