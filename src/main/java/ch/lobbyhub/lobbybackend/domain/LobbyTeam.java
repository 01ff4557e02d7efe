package ch.lobbyhub.lobbybackend.domain;

import ch.lobbyhub.lobbybackend.web.api.dto.LobbyTeamDto;
import lombok.Getter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * A team inside a lobby. Guarded by the owning lobby's lock.
 */
@Getter
public class LobbyTeam {

    private final String name;

    private final int minPlayers;

    private final int maxPlayers;

    private final Map<String, String> properties;

    private final Set<LobbyMember> members = new LinkedHashSet<>();

    public LobbyTeam(String name, int minPlayers, int maxPlayers) {
        this(name, minPlayers, maxPlayers, Map.of());
    }

    public LobbyTeam(String name, int minPlayers, int maxPlayers, Map<String, String> properties) {
        this.name = name;
        this.minPlayers = minPlayers;
        this.maxPlayers = maxPlayers;
        this.properties = new LinkedHashMap<>(properties);
    }

    public int getPlayerCount() {
        return members.size();
    }

    public boolean isFull() {
        return members.size() >= maxPlayers;
    }

    public boolean hasMember(LobbyMember member) {
        return members.contains(member);
    }

    public void addMember(LobbyMember member) {
        members.add(member);
    }

    public void removeMember(LobbyMember member) {
        members.remove(member);
    }

    public LobbyTeamDto toDto() {
        return new LobbyTeamDto(
                name,
                minPlayers,
                maxPlayers,
                Map.copyOf(properties),
                new ArrayList<>(members.stream().map(LobbyMember::getUsername).toList())
        );
    }
}
