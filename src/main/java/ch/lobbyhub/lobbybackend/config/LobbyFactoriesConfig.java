package ch.lobbyhub.lobbybackend.config;

import ch.lobbyhub.lobbybackend.lobby.DeathmatchLobby;
import ch.lobbyhub.lobbybackend.lobby.DeathmatchLobbyFactory;
import ch.lobbyhub.lobbybackend.lobby.LobbyFactory;
import ch.lobbyhub.lobbybackend.lobby.TeamLobbyFactory;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Set;

/**
 * Built-in lobby types. Every {@link LobbyFactory} bean is registered with the
 * coordination service under its id.
 *
 * <p>{@code lobbies.start-timeout-ms} bounds how long a start waits for the
 * room spawner (default: 10 seconds).
 */
@Configuration
public class LobbyFactoriesConfig {

    private final Duration startTimeout;

    public LobbyFactoriesConfig(@Value("${lobbies.start-timeout-ms:10000}") long startTimeoutMs) {
        this.startTimeout = Duration.ofMillis(startTimeoutMs);
    }

    @Bean
    public LobbyFactory deathmatchLobbyFactory(LobbyEventPublisher eventPublisher, RoomSpawner roomSpawner) {
        return new DeathmatchLobbyFactory(
                eventPublisher,
                roomSpawner,
                startTimeout,
                Set.of(DeathmatchLobby.ROUNDS_KEY, DeathmatchLobby.TIME_LIMIT_KEY)
        );
    }

    @Bean
    public LobbyFactory twoVersusTwoLobbyFactory(LobbyEventPublisher eventPublisher, RoomSpawner roomSpawner) {
        return TeamLobbyFactory.versus(2, eventPublisher, roomSpawner, startTimeout);
    }

    @Bean
    public LobbyFactory threeVersusThreeLobbyFactory(LobbyEventPublisher eventPublisher, RoomSpawner roomSpawner) {
        return TeamLobbyFactory.versus(3, eventPublisher, roomSpawner, startTimeout);
    }
}
