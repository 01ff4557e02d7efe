package ch.lobbyhub.lobbybackend.web.api.dto;

import ch.lobbyhub.lobbybackend.domain.enums.GameInfoType;

import java.util.Map;

/**
 * One entry of the public game listing.
 *
 * <p>Only rendered values are exposed; member objects never leave the lobby.
 *
 * @param address       {@code ip:port} of the game server, {@code null} before the game was provisioned
 * @param id            lobby id
 * @param maxPlayers    capacity of the lobby
 * @param name          lobby name
 * @param onlinePlayers current member count
 * @param customOptions public lobby properties
 * @param type          always {@link GameInfoType#LOBBY}
 */
public record GameInfoDto(
        String address,
        int id,
        int maxPlayers,
        String name,
        int onlinePlayers,
        Map<String, String> customOptions,
        GameInfoType type
) {}
