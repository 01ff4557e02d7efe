package ch.lobbyhub.lobbybackend.web.api.dto;

public record JoinTeamRequest(
        String teamName
) {}
