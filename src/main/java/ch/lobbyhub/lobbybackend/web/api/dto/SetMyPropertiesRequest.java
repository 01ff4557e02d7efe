package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.Map;

public record SetMyPropertiesRequest(
        Map<String, String> properties
) {}
