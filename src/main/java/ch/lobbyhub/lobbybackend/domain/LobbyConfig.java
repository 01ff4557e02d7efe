package ch.lobbyhub.lobbybackend.domain;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.util.Set;

/**
 * Rules a lobby applies to its own members.
 *
 * <p>Built by the lobby factories; the defaults describe a free-for-all lobby
 * with a ready system and a manual start by the game master.
 */
@Getter
@Builder(toBuilder = true)
public class LobbyConfig {

    @Builder.Default
    private final int minPlayers = 1;

    @Builder.Default
    private final int maxPlayers = 10;

    /**
     * Manual start requires every member to be ready.
     */
    @Builder.Default
    private final boolean enableReadySystem = true;

    /**
     * Start automatically once every member is ready and the minimum is reached.
     */
    @Builder.Default
    private final boolean startGameWhenAllReady = false;

    @Builder.Default
    private final boolean enableManualStart = true;

    @Builder.Default
    private final boolean enableTeamSwitching = true;

    @Builder.Default
    private final boolean allowJoiningWhenGameIsLive = false;

    /**
     * When {@code false}, only the game master may change lobby properties.
     */
    @Builder.Default
    private final boolean allowPlayersChangeLobbyProperties = false;

    /**
     * Lobby property keys whose values must be integers.
     */
    @Builder.Default
    private final Set<String> numericPropertyKeys = Set.of();

    /**
     * Lobby property keys hidden from the public game listing.
     */
    @Builder.Default
    private final Set<String> privatePropertyKeys = Set.of();

    @Builder.Default
    private final int maxPropertyValueLength = 256;

    @Builder.Default
    private final int maxChatMessageLength = 500;

    /**
     * Upper bound for waiting on the room spawner during a start.
     */
    @Builder.Default
    private final Duration startTimeout = Duration.ofSeconds(10);
}
