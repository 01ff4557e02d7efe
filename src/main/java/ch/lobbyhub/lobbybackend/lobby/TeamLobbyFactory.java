package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.domain.LobbyTeam;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Builds {@link TeamLobby} instances with fixed teams of equal size, e.g. {@code 2v2}.
 *
 * <p>The capacity is derived from the team layout, a {@code maxPlayers} option is ignored.
 * Each team needs at least one member before the game can start.
 */
public class TeamLobbyFactory extends BaseLobbyFactory {

    private final List<String> teamNames;
    private final int teamSize;

    public TeamLobbyFactory(String id,
                            String displayName,
                            List<String> teamNames,
                            int teamSize,
                            LobbyEventPublisher eventPublisher,
                            RoomSpawner roomSpawner,
                            Duration startTimeout) {
        super(id, displayName, eventPublisher, roomSpawner, startTimeout);
        this.teamNames = List.copyOf(teamNames);
        this.teamSize = teamSize;
    }

    public static TeamLobbyFactory versus(int teamSize,
                                          LobbyEventPublisher eventPublisher,
                                          RoomSpawner roomSpawner,
                                          Duration startTimeout) {
        String id = teamSize + "v" + teamSize;
        return new TeamLobbyFactory(id, id, List.of("red", "blue"), teamSize, eventPublisher, roomSpawner, startTimeout);
    }

    @Override
    protected BaseLobby build(int lobbyId, String name, Map<String, String> options) {
        LobbyConfig config = LobbyConfig.builder()
                .minPlayers(teamNames.size())
                .maxPlayers(teamNames.size() * teamSize)
                .startTimeout(startTimeout)
                .build();

        List<LobbyTeam> teams = teamNames.stream()
                .map(teamName -> new LobbyTeam(teamName, 1, teamSize))
                .toList();

        return new TeamLobby(lobbyId, getId(), name, config, teams, eventPublisher, roomSpawner);
    }
}
