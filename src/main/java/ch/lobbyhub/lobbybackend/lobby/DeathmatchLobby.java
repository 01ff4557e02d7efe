package ch.lobbyhub.lobbybackend.lobby;

import ch.lobbyhub.lobbybackend.domain.LobbyConfig;
import ch.lobbyhub.lobbybackend.service.LobbyEventPublisher;
import ch.lobbyhub.lobbybackend.service.RoomSpawner;

/**
 * Free-for-all lobby without teams.
 *
 * <p>Besides the generic rules, the {@code rounds} and {@code timeLimit}
 * properties are range checked.
 */
public class DeathmatchLobby extends BaseLobby {

    public static final String ROUNDS_KEY = "rounds";
    public static final String TIME_LIMIT_KEY = "timeLimit";

    static final int MAX_ROUNDS = 50;
    static final int MAX_TIME_LIMIT_MINUTES = 60;

    public DeathmatchLobby(int id,
                           String type,
                           String name,
                           LobbyConfig config,
                           LobbyEventPublisher eventPublisher,
                           RoomSpawner roomSpawner) {
        super(id, type, name, config, eventPublisher, roomSpawner);
    }

    @Override
    protected boolean isLobbyPropertyValid(String key, String value) {
        if (!super.isLobbyPropertyValid(key, value)) {
            return false;
        }
        if (ROUNDS_KEY.equals(key)) {
            return isInRange(value, MAX_ROUNDS);
        }
        if (TIME_LIMIT_KEY.equals(key)) {
            return isInRange(value, MAX_TIME_LIMIT_MINUTES);
        }
        return true;
    }

    private static boolean isInRange(String value, int max) {
        if (!isInteger(value)) {
            return false;
        }
        int parsed = Integer.parseInt(value.strip());
        return parsed >= 1 && parsed <= max;
    }
}
