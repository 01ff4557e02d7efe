package ch.lobbyhub.lobbybackend.web.api.controller;

import ch.lobbyhub.lobbybackend.domain.LobbyPeer;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyErrorType;
import ch.lobbyhub.lobbybackend.domain.enums.LobbyMessageType;
import ch.lobbyhub.lobbybackend.repository.PeerRegistry;
import ch.lobbyhub.lobbybackend.service.LobbyCoordinationService;
import ch.lobbyhub.lobbybackend.web.api.dto.ChatMessageRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.CreateLobbyRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.JoinLobbyRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.JoinTeamRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyMemberDataRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyResponse;
import ch.lobbyhub.lobbybackend.web.api.dto.LobbyResponseDto;
import ch.lobbyhub.lobbybackend.web.api.dto.SetLobbyPropertiesRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.SetMyPropertiesRequest;
import ch.lobbyhub.lobbybackend.web.api.dto.SetReadyRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.MessageExceptionHandler;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.messaging.simp.annotation.SendToUser;
import org.springframework.stereotype.Controller;

import java.util.Optional;
import java.util.function.Function;

/**
 * STOMP entry points of the lobby protocol.
 *
 * <p>Clients send to {@code /app/lobbies/...} and receive exactly one
 * {@link LobbyResponseDto} per request on {@code /user/queue/lobbies}, except for
 * chat messages which are never answered. Requests from sessions that did not
 * register as a peer are rejected with {@code UNAUTHORIZED}.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class LobbyWebSocketController {

    static final String REPLY_DESTINATION = "/queue/lobbies";

    private final LobbyCoordinationService coordinationService;
    private final PeerRegistry peerRegistry;

    @MessageMapping("/lobbies/create")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto createLobby(@Payload CreateLobbyRequest request,
                                        @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.CREATE_LOBBY, sessionId,
                peer -> coordinationService.createLobby(peer, request.factoryId(), request.options()));
    }

    @MessageMapping("/lobbies/join")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto joinLobby(@Payload JoinLobbyRequest request,
                                      @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.JOIN_LOBBY, sessionId,
                peer -> coordinationService.joinLobby(peer, request.lobbyId()));
    }

    @MessageMapping("/lobbies/leave")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto leaveLobby(@Payload JoinLobbyRequest request,
                                       @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.LEAVE_LOBBY, sessionId,
                peer -> coordinationService.leaveLobby(peer, request.lobbyId()));
    }

    @MessageMapping("/lobbies/properties")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto setLobbyProperties(@Payload SetLobbyPropertiesRequest request,
                                               @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.SET_LOBBY_PROPERTIES, sessionId,
                peer -> coordinationService.setLobbyProperties(peer, request.lobbyId(), request.properties()));
    }

    @MessageMapping("/lobbies/my-properties")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto setMyProperties(@Payload SetMyPropertiesRequest request,
                                            @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.SET_MY_LOBBY_PROPERTIES, sessionId,
                peer -> coordinationService.setMyProperties(peer, request.properties()));
    }

    @MessageMapping("/lobbies/team")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto joinTeam(@Payload JoinTeamRequest request,
                                     @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.JOIN_LOBBY_TEAM, sessionId,
                peer -> coordinationService.joinTeam(peer, request.teamName()));
    }

    @MessageMapping("/lobbies/chat")
    public void sendChatMessage(@Payload ChatMessageRequest request,
                                @Header("simpSessionId") String sessionId) {
        peerRegistry.find(sessionId)
                .ifPresent(peer -> coordinationService.sendChatMessage(peer, request.message()));
    }

    @MessageMapping("/lobbies/ready")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto setReady(@Payload SetReadyRequest request,
                                     @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.LOBBY_SET_READY, sessionId,
                peer -> coordinationService.setReadyStatus(peer, request.isReady()));
    }

    @MessageMapping("/lobbies/start")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto startGame(@Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.LOBBY_START_GAME, sessionId, coordinationService::startGame);
    }

    @MessageMapping("/lobbies/room-access")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto getRoomAccess(@Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.GET_LOBBY_ROOM_ACCESS, sessionId, coordinationService::getLobbyRoomAccess);
    }

    @MessageMapping("/lobbies/member-data")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto getMemberData(@Payload LobbyMemberDataRequest request,
                                          @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.GET_LOBBY_MEMBER_DATA, sessionId,
                peer -> coordinationService.getLobbyMemberData(request.lobbyId(), request.peerId()));
    }

    @MessageMapping("/lobbies/info")
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto getLobbyInfo(@Payload JoinLobbyRequest request,
                                         @Header("simpSessionId") String sessionId) {
        return handle(LobbyMessageType.GET_LOBBY_INFO, sessionId,
                peer -> coordinationService.getLobbyInfo(peer, request.lobbyId()));
    }

    /**
     * Replies to requests whose payload could not be converted.
     */
    @MessageExceptionHandler
    @SendToUser(destinations = REPLY_DESTINATION, broadcast = false)
    public LobbyResponseDto handleException(Exception e) {
        log.warn("Lobby request failed: {}", e.getMessage());
        return LobbyResponseDto.of(null, LobbyResponse.failure(LobbyErrorType.INVALID_REQUEST, "Invalid request"));
    }

    private LobbyResponseDto handle(LobbyMessageType type,
                                    String sessionId,
                                    Function<LobbyPeer, LobbyResponse<?>> action) {
        Optional<LobbyPeer> peer = peerRegistry.find(sessionId);
        if (peer.isEmpty()) {
            return LobbyResponseDto.of(type, LobbyResponse.failure(LobbyErrorType.UNAUTHORIZED, "Unknown connection"));
        }

        try {
            return LobbyResponseDto.of(type, action.apply(peer.get()));
        } catch (RuntimeException e) {
            log.error("{} request from {} failed", type, peer.get(), e);
            return LobbyResponseDto.of(type, LobbyResponse.failure(LobbyErrorType.INTERNAL_ERROR, "Internal error"));
        }
    }
}
