package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.List;
import java.util.Map;

public record LobbyTeamDto(
        String name,
        int minPlayers,
        int maxPlayers,
        Map<String, String> properties,
        List<String> members
) {}
