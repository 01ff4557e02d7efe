package ch.lobbyhub.lobbybackend.web.api.dto;

import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;

import java.util.List;
import java.util.Map;

/**
 * Snapshot of a lobby as sent to joining members and info requests.
 *
 * <p>{@code currentUsername} is only set when the snapshot was generated for a
 * specific member (join response); generic snapshots leave it {@code null}.
 */
public record LobbyDataDto(
        int lobbyId,
        String lobbyType,
        String name,
        LobbyState state,
        String gameMaster,
        int minPlayers,
        int maxPlayers,
        int playerCount,
        Map<String, String> properties,
        List<LobbyMemberDataDto> members,
        List<LobbyTeamDto> teams,
        boolean readySystemEnabled,
        boolean manualStartEnabled,
        String currentUsername
) {}
