package ch.lobbyhub.lobbybackend.domain.enums;

/**
 * Lifecycle state of a lobby.
 *
 * <p>Allowed transitions:
 * <ul>
 *   <li>FORMING → STARTING (a start was requested)</li>
 *   <li>STARTING → IN_PROGRESS (game server provisioned)</li>
 *   <li>STARTING → FORMING (provisioning failed or timed out)</li>
 *   <li>any → DESTROYED (terminal)</li>
 * </ul>
 */
public enum LobbyState {

    /**
     * Lobby accepts joins, property changes and team switches.
     */
    FORMING,

    /**
     * A start was accepted and the game server is being provisioned.
     */
    STARTING,

    /**
     * Game server address is known; members are expected to move to the room.
     */
    IN_PROGRESS,

    /**
     * Lobby was removed from the registry and accepts no further operations.
     */
    DESTROYED
}
