package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.LobbyTeam;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Lobby whose members are always assigned to a team.
 *
 * <p>New members go to the non-full team with the fewest members; ties go to
 * the team declared first.
 */
public class TeamLobby extends BaseLobby {

    public TeamLobby(int id,
                     String type,
                     String name,
                     LobbyConfig config,
                     List<LobbyTeam> teams,
                     LobbyEventPublisher eventPublisher,
                     RoomSpawner roomSpawner) {
        super(id, type, name, config, eventPublisher, roomSpawner);
        teams.forEach(this::addTeam);
    }

    @Override
    protected Optional<LobbyTeam> pickTeamForPlayer(LobbyMember member) {
        return teams().stream()
                .filter(team -> !team.isFull())
                .min(Comparator.comparingInt(LobbyTeam::getPlayerCount));
    }
}
