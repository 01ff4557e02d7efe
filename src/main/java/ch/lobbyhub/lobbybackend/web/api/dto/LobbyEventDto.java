package ch.lobbyhub.lobbybackend.web.api.dto;

import ch.lobbyhub.lobbybackend.domain.LobbyMember;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyEventType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyState;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

public record LobbyEventDto(
        LobbyEventType type,
        int lobbyId,
        LobbyState lobbyState,
        Instant timeStamp,
        Map<String, Object> payload
) {
    public static LobbyEventDto memberJoined(int lobbyId, LobbyState state, LobbyMember member) {
        return new LobbyEventDto(
                LobbyEventType.MEMBER_JOINED,
                lobbyId,
                state,
                Instant.now(),
                Map.of("member", member.generateDataPacket())
        );
    }

    public static LobbyEventDto memberLeft(int lobbyId, LobbyState state, LobbyMember member) {
        return new LobbyEventDto(
                LobbyEventType.MEMBER_LEFT,
                lobbyId,
                state,
                Instant.now(),
                Map.of("username", member.getUsername())
        );
    }

    public static LobbyEventDto propertyChanged(int lobbyId, LobbyState state, String key, String value) {
        return new LobbyEventDto(
                LobbyEventType.PROPERTY_CHANGED,
                lobbyId,
                state,
                Instant.now(),
                Map.of(
                        "key", key,
                        "value", value
                )
        );
    }

    public static LobbyEventDto memberPropertyChanged(int lobbyId, LobbyState state,
                                                      LobbyMember member, String key, String value) {
        return new LobbyEventDto(
                LobbyEventType.MEMBER_PROPERTY_CHANGED,
                lobbyId,
                state,
                Instant.now(),
                Map.of(
                        "username", member.getUsername(),
                        "key", key,
                        "value", value
                )
        );
    }

    public static LobbyEventDto memberReadyChanged(int lobbyId, LobbyState state, LobbyMember member) {
        return new LobbyEventDto(
                LobbyEventType.MEMBER_READY_CHANGED,
                lobbyId,
                state,
                Instant.now(),
                Map.of(
                        "username", member.getUsername(),
                        "ready", member.isReady()
                )
        );
    }

    public static LobbyEventDto memberTeamChanged(int lobbyId, LobbyState state, LobbyMember member) {
        return new LobbyEventDto(
                LobbyEventType.MEMBER_TEAM_CHANGED,
                lobbyId,
                state,
                Instant.now(),
                Map.of(
                        "username", member.getUsername(),
                        "team", member.getTeam()
                )
        );
    }

    public static LobbyEventDto masterChanged(int lobbyId, LobbyState state, LobbyMember newMaster) {
        // new master may be null once the lobby is empty
        Map<String, Object> payload = new HashMap<>();
        payload.put("gameMaster", newMaster != null ? newMaster.getUsername() : null);
        return new LobbyEventDto(
                LobbyEventType.MASTER_CHANGED,
                lobbyId,
                state,
                Instant.now(),
                payload
        );
    }

    public static LobbyEventDto stateChanged(int lobbyId, LobbyState previous, LobbyState current) {
        return new LobbyEventDto(
                LobbyEventType.STATE_CHANGED,
                lobbyId,
                current,
                Instant.now(),
                Map.of("previousState", previous)
        );
    }

    public static LobbyEventDto lobbyDestroyed(int lobbyId) {
        return new LobbyEventDto(
                LobbyEventType.LOBBY_DESTROYED,
                lobbyId,
                LobbyState.DESTROYED,
                Instant.now(),
                Map.of()
        );
    }
}
