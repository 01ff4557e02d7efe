package ch.lobbyhub.lobbybackend.web.api.dto;

public record ChatMessageRequest(
        String message
) {}
