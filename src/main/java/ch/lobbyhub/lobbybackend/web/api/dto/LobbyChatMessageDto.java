package ch.lobbyhub.lobbybackend.web.api.dto;

import java.time.Instant;

public record LobbyChatMessageDto(
        int lobbyId,
        String senderName,
        String message,
        Instant timestamp
) {}
