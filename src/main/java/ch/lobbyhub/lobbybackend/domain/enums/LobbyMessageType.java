package ch.lobbyhub.lobbybackend.domain.enums;

/**
 * Request types of the lobby protocol.
 *
 * <p>Echoed back in every {@code LobbyResponseDto} so clients can match
 * replies on the shared {@code /user/queue/lobbies} destination.
 */
public enum LobbyMessageType {
    CREATE_LOBBY,
    JOIN_LOBBY,
    LEAVE_LOBBY,
    SET_LOBBY_PROPERTIES,
    SET_MY_LOBBY_PROPERTIES,
    JOIN_LOBBY_TEAM,
    LOBBY_SEND_CHAT_MESSAGE,
    LOBBY_SET_READY,
    LOBBY_START_GAME,
    GET_LOBBY_ROOM_ACCESS,
    GET_LOBBY_MEMBER_DATA,
    GET_LOBBY_INFO
}
