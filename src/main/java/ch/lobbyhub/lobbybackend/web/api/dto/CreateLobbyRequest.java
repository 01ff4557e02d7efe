package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.Map;

/**
 * Request DTO used to create a lobby.
 *
 * <p>The factory id may also be passed inside {@code options} under
 * {@code lobbyFactoryId}; the explicit field wins.
 *
 * @param factoryId id of the lobby factory (e.g. {@code deathmatch})
 * @param options   creation options such as {@code lobbyName} or {@code maxPlayers}
 */
public record CreateLobbyRequest(
        String factoryId,
        Map<String, String> options
) {}
