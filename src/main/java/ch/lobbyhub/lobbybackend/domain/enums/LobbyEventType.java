package ch.lobbyhub.lobbybackend.domain.enums;

/**
 * Defines event types related to lobby state changes.
 *
 * <p>Published to {@code /topic/lobbies/{lobbyId}/events} so that every member
 * can keep a local copy of the lobby in sync.
 */
public enum LobbyEventType {

    MEMBER_JOINED,

    MEMBER_LEFT,

    /**
     * A lobby-level property was changed.
     */
    PROPERTY_CHANGED,

    /**
     * A member-level property was changed.
     */
    MEMBER_PROPERTY_CHANGED,

    MEMBER_READY_CHANGED,

    MEMBER_TEAM_CHANGED,

    /**
     * The member allowed to start the game changed.
     */
    MASTER_CHANGED,

    STATE_CHANGED,

    LOBBY_DESTROYED
}
