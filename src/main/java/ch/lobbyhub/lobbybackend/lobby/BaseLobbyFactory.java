package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyException;
import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Option parsing shared by the built-in factories.
 *
 * <p>{@code lobbyName} and {@code maxPlayers} are read by the factory, all other
 * non-reserved options are applied as initial lobby properties through the
 * lobby's own validation.
 */
public abstract class BaseLobbyFactory implements LobbyFactory {

    private final String id;
    private final String displayName;
    protected final LobbyEventPublisher eventPublisher;
    protected final RoomSpawner roomSpawner;
    protected final Duration startTimeout;

    protected BaseLobbyFactory(String id,
                               String displayName,
                               LobbyEventPublisher eventPublisher,
                               RoomSpawner roomSpawner,
                               Duration startTimeout) {
        this.id = id;
        this.displayName = displayName;
        this.eventPublisher = eventPublisher;
        this.roomSpawner = roomSpawner;
        this.startTimeout = startTimeout;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public final Lobby createLobby(int lobbyId, Map<String, String> options, LobbyPeer creator) {
        Map<String, String> safeOptions = options != null ? options : Map.of();
        BaseLobby lobby = build(lobbyId, resolveName(lobbyId, safeOptions), safeOptions);
        lobby.initProperties(customProperties(safeOptions));
        return lobby;
    }

    protected abstract BaseLobby build(int lobbyId, String name, Map<String, String> options);

    private String resolveName(int lobbyId, Map<String, String> options) {
        String name = options.get(LobbyOptionKeys.LOBBY_NAME);
        if (name == null || name.isBlank()) {
            return displayName + " #" + lobbyId;
        }
        return name.strip();
    }

    protected int parseInt(Map<String, String> options, String key, int defaultValue, int min, int max) {
        String raw = options.get(key);
        if (raw == null || raw.isBlank()) {
            return defaultValue;
        }

        int value;
        try {
            value = Integer.parseInt(raw.strip());
        } catch (NumberFormatException e) {
            throw new LobbyException(LobbyErrorType.INVALID_REQUEST, "Invalid value for " + key + ": " + raw, e);
        }

        if (value < min || value > max) {
            throw new LobbyException(LobbyErrorType.INVALID_REQUEST,
                    key + " must be between " + min + " and " + max);
        }
        return value;
    }

    private static Map<String, String> customProperties(Map<String, String> options) {
        Map<String, String> custom = new LinkedHashMap<>(options);
        custom.keySet().removeAll(LobbyOptionKeys.RESERVED);
        return custom;
    }
}
