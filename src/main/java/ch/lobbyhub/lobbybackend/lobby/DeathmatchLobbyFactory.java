package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;

import java.time.Duration;
import java.util.Map;
import java.util.Set;

/**
 * Builds {@link DeathmatchLobby} instances. Accepts {@code maxPlayers} between 2 and 32.
 */
public class DeathmatchLobbyFactory extends BaseLobbyFactory {

    public static final String ID = "deathmatch";

    static final int DEFAULT_MAX_PLAYERS = 10;
    static final int MAX_PLAYERS_LIMIT = 32;

    private final Set<String> numericPropertyKeys;

    public DeathmatchLobbyFactory(LobbyEventPublisher eventPublisher,
                                  RoomSpawner roomSpawner,
                                  Duration startTimeout,
                                  Set<String> numericPropertyKeys) {
        super(ID, "Deathmatch", eventPublisher, roomSpawner, startTimeout);
        this.numericPropertyKeys = Set.copyOf(numericPropertyKeys);
    }

    @Override
    protected BaseLobby build(int lobbyId, String name, Map<String, String> options) {
        int maxPlayers = parseInt(options, LobbyOptionKeys.MAX_PLAYERS, DEFAULT_MAX_PLAYERS, 2, MAX_PLAYERS_LIMIT);

        LobbyConfig config = LobbyConfig.builder()
                .minPlayers(2)
                .maxPlayers(maxPlayers)
                .numericPropertyKeys(numericPropertyKeys)
                .privatePropertyKeys(Set.of("password"))
                .startTimeout(startTimeout)
                .build();

        return new DeathmatchLobby(lobbyId, getId(), name, config, eventPublisher, roomSpawner);
    }
}
