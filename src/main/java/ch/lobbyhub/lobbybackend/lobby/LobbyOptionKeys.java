package ch.lobbyhub.lobbybackend.lobby;

import java.util.Set;

/**
 * Option keys with a fixed meaning in create-lobby requests.
 */
public final class LobbyOptionKeys {

    public static final String FACTORY_ID = "lobbyFactoryId";
    public static final String LOBBY_NAME = "lobbyName";
    public static final String MAX_PLAYERS = "maxPlayers";

    /**
     * Keys consumed by the factories themselves; every other option becomes a lobby property.
     */
    public static final Set<String> RESERVED = Set.of(FACTORY_ID, LOBBY_NAME, MAX_PLAYERS);

    private LobbyOptionKeys() {
    }
}
