package ch.lobbyhub.lobbybackend.web.api.dto;

import java.util.Map;

/**
 * Batch of lobby-level property writes, applied in the order given.
 *
 * @param lobbyId    id of the target lobby
 * @param properties key/value pairs to set
 */
public record SetLobbyPropertiesRequest(
        int lobbyId,
        Map<String, String> properties
) {}
