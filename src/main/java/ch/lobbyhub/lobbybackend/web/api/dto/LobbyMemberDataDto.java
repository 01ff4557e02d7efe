package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.Map;

/**
 * Public view of one lobby member.
 *
 * @param peerId     connection id of the member
 * @param username   display name
 * @param properties member-level properties (e.g. selected character)
 * @param ready      ready flag
 * @param team       team name, {@code null} in lobbies without teams
 */
public record LobbyMemberDataDto(
        int peerId,
        String username,
        Map<String, String> properties,
        boolean ready,
        String team
) {}
